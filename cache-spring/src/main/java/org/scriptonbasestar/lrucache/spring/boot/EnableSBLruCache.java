package org.scriptonbasestar.lrucache.spring.boot;

import org.springframework.context.annotation.Import;

import java.lang.annotation.*;

/**
 * Enables SB LRU Cache without relying on Spring Boot auto-configuration discovery.
 *
 * <h3>Basic Usage:</h3>
 * <pre>{@code
 * @Configuration
 * @EnableSBLruCache
 * public class CacheConfig {
 * }
 *
 * @Service
 * public class UserService {
 *     private final SBSynchronizedLruCache users;
 *
 *     public UserService(SBLruCacheRegistry registry) {
 *         this.users = registry.getOrCreate("users");
 *     }
 * }
 * }</pre>
 *
 * @author archmagece
 * @since 2025-01
 * @see SBLruCacheAutoConfiguration
 * @see SBLruCacheProperties
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
@Documented
@Import(SBLruCacheAutoConfiguration.class)
public @interface EnableSBLruCache {
}
