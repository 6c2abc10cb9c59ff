package org.scriptonbasestar.lrucache.spring.actuator;

import org.scriptonbasestar.lrucache.collection.map.SBSynchronizedLruCache;
import org.scriptonbasestar.lrucache.collection.metrics.CacheHealthCheck;
import org.scriptonbasestar.lrucache.collection.metrics.CacheMetrics;
import org.scriptonbasestar.lrucache.core.exception.SBLruCacheCorruptedException;
import org.scriptonbasestar.lrucache.spring.SBLruCacheRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Spring Boot Actuator HealthIndicator for every cache of a {@link SBLruCacheRegistry}.
 * <p>
 * 캐시마다 구조 무결성을 검사하고, 메트릭이 켜진 캐시는 {@link CacheHealthCheck} 경고를 함께 보고합니다.
 * 경고는 상태에 영향을 주지 않으며, 하나라도 무결성 검사에 실패하면 DOWN 입니다.
 * </p>
 *
 * <h3>Response Format:</h3>
 * <pre>{@code
 * {
 *   "status": "UP",
 *   "details": {
 *     "totalCaches": 1,
 *     "unhealthyCaches": 0,
 *     "caches": {
 *       "users": {
 *         "status": "UP",
 *         "size": 120,
 *         "capacity": 500,
 *         "requestCount": 1000,
 *         "hitRate": "85.00%"
 *       }
 *     }
 *   }
 * }
 * }</pre>
 *
 * @author archmagece
 * @since 2025-01
 */
public class LruCacheHealthIndicator implements HealthIndicator {

	private static final Logger log = LoggerFactory.getLogger(LruCacheHealthIndicator.class);

	private final SBLruCacheRegistry registry;
	private final CacheHealthCheck.HealthThresholds thresholds;

	public LruCacheHealthIndicator(SBLruCacheRegistry registry) {
		this(registry, CacheHealthCheck.HealthThresholds.DEFAULT);
	}

	/**
	 * @param registry   monitored caches
	 * @param thresholds warning thresholds applied to caches with metrics enabled
	 */
	public LruCacheHealthIndicator(SBLruCacheRegistry registry, CacheHealthCheck.HealthThresholds thresholds) {
		if (registry == null) {
			throw new IllegalArgumentException("registry must not be null");
		}
		if (thresholds == null) {
			throw new IllegalArgumentException("thresholds must not be null");
		}
		this.registry = registry;
		this.thresholds = thresholds;
	}

	@Override
	public Health health() {
		Map<String, SBSynchronizedLruCache> caches = new TreeMap<>(registry.getAllCaches());
		if (caches.isEmpty()) {
			return Health.up()
				.withDetail("totalCaches", 0)
				.withDetail("message", "No caches configured")
				.build();
		}

		Map<String, Map<String, Object>> cacheDetails = new LinkedHashMap<>();
		int unhealthyCount = 0;
		for (Map.Entry<String, SBSynchronizedLruCache> entry : caches.entrySet()) {
			Map<String, Object> details = new LinkedHashMap<>();
			if (!inspect(entry.getKey(), entry.getValue(), details)) {
				unhealthyCount++;
			}
			cacheDetails.put(entry.getKey(), details);
		}

		// 하나라도 unhealthy면 DOWN
		Health.Builder builder = (unhealthyCount == 0) ? Health.up() : Health.down();
		builder.withDetail("totalCaches", caches.size());
		builder.withDetail("unhealthyCaches", unhealthyCount);
		builder.withDetail("caches", cacheDetails);
		return builder.build();
	}

	private boolean inspect(String cacheName, SBSynchronizedLruCache cache, Map<String, Object> details) {
		boolean healthy = true;
		details.put("size", cache.size());
		details.put("capacity", cache.capacity());

		try {
			cache.checkIntegrity();
		} catch (SBLruCacheCorruptedException e) {
			log.warn("LRU cache '{}' failed integrity check: {}", cacheName, e.getMessage());
			details.put("integrity", e.getMessage());
			healthy = false;
		}

		CacheMetrics metrics = cache.metrics();
		if (metrics != null) {
			details.put("requestCount", metrics.requestCount());
			details.put("hitCount", metrics.hitCount());
			details.put("missCount", metrics.missCount());
			details.put("staleCount", metrics.staleCount());
			details.put("evictionCount", metrics.evictionCount());
			details.put("hitRate", String.format(Locale.ROOT, "%.2f%%", metrics.hitRate() * 100));

			CacheHealthCheck.HealthStatus status = new CacheHealthCheck(metrics, thresholds).check();
			if (status.hasWarnings()) {
				details.put("warnings", status.warnings());
			}
		}

		details.put("status", healthy ? "UP" : "DOWN");
		return healthy;
	}
}
