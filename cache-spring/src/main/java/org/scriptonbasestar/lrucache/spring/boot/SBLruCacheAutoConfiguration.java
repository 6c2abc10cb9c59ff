package org.scriptonbasestar.lrucache.spring.boot;

import org.scriptonbasestar.lrucache.collection.map.SBLruCache;
import org.scriptonbasestar.lrucache.spring.SBLruCacheRegistry;
import org.scriptonbasestar.lrucache.spring.actuator.LruCacheHealthIndicator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

/**
 * Spring Boot Auto-Configuration for SB LRU Cache.
 * <p>
 * This auto-configuration will be triggered when:
 * <ul>
 *   <li>SBLruCache class is on the classpath</li>
 *   <li>No SBLruCacheRegistry bean is already defined</li>
 * </ul>
 * Every entry of {@code sb-lru-cache.caches} becomes a registered cache; the global
 * {@code sb-lru-cache.*} values fill the per-cache gaps.
 * </p>
 *
 * @author archmagece
 * @since 2025-01
 */
@Configuration(proxyBeanMethods = false)
@ConditionalOnClass(SBLruCache.class)
@EnableConfigurationProperties(SBLruCacheProperties.class)
public class SBLruCacheAutoConfiguration {

	private static final Logger log = LoggerFactory.getLogger(SBLruCacheAutoConfiguration.class);

	/**
	 * Creates the cache registry from configuration.
	 *
	 * @param properties bound {@code sb-lru-cache.*} properties
	 * @return registry holding the configured caches
	 */
	@Bean
	@ConditionalOnMissingBean
	public SBLruCacheRegistry sbLruCacheRegistry(SBLruCacheProperties properties) {
		SBLruCacheRegistry registry = new SBLruCacheRegistry(properties::defaultBuilder);

		for (Map.Entry<String, SBLruCacheProperties.CacheConfig> entry : properties.getCaches().entrySet()) {
			String cacheName = entry.getKey();
			SBLruCacheProperties.CacheConfig config = entry.getValue();

			// Apply defaults
			config.applyDefaults(properties);
			registry.addCache(cacheName, config.createCache(cacheName));
		}

		log.info("SB LRU cache registry initialized with caches: {}", registry.getCacheNames());
		return registry;
	}

	/**
	 * Actuator 클래스는 이 중첩 설정 안에서만 참조하므로 actuator가 없으면 통째로 건너뜁니다.
	 */
	@Configuration(proxyBeanMethods = false)
	@ConditionalOnClass(name = "org.springframework.boot.actuate.health.HealthIndicator")
	static class HealthIndicatorConfiguration {

		/**
		 * Creates a health indicator for all registered caches.
		 *
		 * @param registry the registry to monitor
		 * @return health indicator
		 */
		@Bean
		@ConditionalOnMissingBean(name = "sbLruCacheHealthIndicator")
		public HealthIndicator sbLruCacheHealthIndicator(SBLruCacheRegistry registry) {
			return new LruCacheHealthIndicator(registry);
		}
	}
}
