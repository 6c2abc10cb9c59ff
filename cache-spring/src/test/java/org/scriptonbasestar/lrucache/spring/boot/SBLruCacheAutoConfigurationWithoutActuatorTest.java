package org.scriptonbasestar.lrucache.spring.boot;

import org.junit.Test;
import org.scriptonbasestar.lrucache.spring.SBLruCacheRegistry;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.test.context.FilteredClassLoader;
import org.springframework.context.annotation.AnnotationConfigApplicationContext;

import static org.junit.Assert.*;

/**
 * actuator가 클래스패스에 없을 때의 자동 설정 테스트
 *
 * @author archmagece
 * @since 2025-01
 */
public class SBLruCacheAutoConfigurationWithoutActuatorTest {

	@Test
	public void testRegistryWithoutHealthIndicator() {
		try (AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext()) {
			context.setClassLoader(new FilteredClassLoader("org.springframework.boot.actuate"));
			context.register(SBLruCacheAutoConfiguration.class);
			context.refresh();

			assertNotNull(context.getBean(SBLruCacheRegistry.class));
			assertFalse(context.containsBean("sbLruCacheHealthIndicator"));
		}
	}

	@Test
	public void testHealthIndicatorWithActuator() {
		try (AnnotationConfigApplicationContext context = new AnnotationConfigApplicationContext()) {
			context.register(SBLruCacheAutoConfiguration.class);
			context.refresh();

			assertTrue(context.getBean("sbLruCacheHealthIndicator") instanceof HealthIndicator);
		}
	}
}
