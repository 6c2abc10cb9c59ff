/**
 * Spring Boot Actuator integration for SB LRU Cache health monitoring.
 * <p>
 * {@link org.scriptonbasestar.lrucache.spring.actuator.LruCacheHealthIndicator} is registered by the
 * auto-configuration as {@code sbLruCacheHealthIndicator} and is visible under
 * {@code /actuator/health/sbLruCache}.
 * </p>
 *
 * <h2>Configuration:</h2>
 * <pre>
 * # application.yml
 * management:
 *   endpoint:
 *     health:
 *       show-details: always
 * </pre>
 *
 * @author archmagece
 * @since 2025-01
 */
package org.scriptonbasestar.lrucache.spring.actuator;
