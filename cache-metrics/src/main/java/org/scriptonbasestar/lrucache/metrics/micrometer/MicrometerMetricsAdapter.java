package org.scriptonbasestar.lrucache.metrics.micrometer;

import io.micrometer.core.instrument.FunctionCounter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.scriptonbasestar.lrucache.collection.map.SBLruCache;
import org.scriptonbasestar.lrucache.collection.map.SBSynchronizedLruCache;
import org.scriptonbasestar.lrucache.collection.metrics.CacheMetrics;

import java.util.function.ToDoubleFunction;

/**
 * Micrometer MeterRegistry와 캐시 메트릭을 연동하는 어댑터
 *
 * CacheMetrics 카운터를 FunctionCounter로, 캐시 크기와 용량을 Gauge로 노출합니다.
 * 값은 스크랩 시점에 캐시에서 직접 읽으므로 별도 동기화가 필요 없습니다.
 *
 * <p>사용 예시:</p>
 * <pre>{@code
 * MeterRegistry registry = new SimpleMeterRegistry();
 * SBLruCache cache = SBLruCache.builder()
 *     .capacity(1000)
 *     .enableMetrics(true)
 *     .build();
 *
 * MicrometerMetricsAdapter adapter = new MicrometerMetricsAdapter(cache, registry, "user-cache");
 * }</pre>
 *
 * @author archmagece
 * @since 2025-01
 */
public class MicrometerMetricsAdapter {

	private final CacheMetrics cacheMetrics;
	private final String cacheName;

	/**
	 * 단일 스레드 캐시용 어댑터.
	 * 크기 gauge는 잠금 없이 읽으므로 스크랩 값은 근사치일 수 있습니다.
	 *
	 * @param cache 메트릭이 활성화된 캐시
	 * @param meterRegistry Micrometer 레지스트리
	 * @param cacheName 캐시 이름 (태그로 사용)
	 */
	public MicrometerMetricsAdapter(SBLruCache cache, MeterRegistry meterRegistry, String cacheName) {
		this(requireCache(cache), cache.metrics(), SBLruCache::size, cache.capacity(), meterRegistry, cacheName);
	}

	/**
	 * 동기화된 캐시용 어댑터
	 *
	 * @param cache 메트릭이 활성화된 캐시
	 * @param meterRegistry Micrometer 레지스트리
	 * @param cacheName 캐시 이름 (태그로 사용)
	 */
	public MicrometerMetricsAdapter(SBSynchronizedLruCache cache, MeterRegistry meterRegistry, String cacheName) {
		this(requireCache(cache), cache.metrics(), SBSynchronizedLruCache::size, cache.capacity(), meterRegistry, cacheName);
	}

	/**
	 * Gauge는 상태 객체를 약한 참조로 잡으므로 크기 gauge는 캐시 객체 자체에 연결합니다.
	 */
	private <C> MicrometerMetricsAdapter(
		C cache,
		CacheMetrics cacheMetrics,
		ToDoubleFunction<C> size,
		int capacity,
		MeterRegistry meterRegistry,
		String cacheName
	) {
		if (cacheMetrics == null) {
			throw new IllegalArgumentException("Cache metrics must be enabled (Builder.enableMetrics(true))");
		}
		if (meterRegistry == null) {
			throw new IllegalArgumentException("MeterRegistry must not be null");
		}
		if (cacheName == null || cacheName.trim().isEmpty()) {
			throw new IllegalArgumentException("Cache name must not be null or empty");
		}

		this.cacheMetrics = cacheMetrics;
		this.cacheName = cacheName;
		Tags tags = Tags.of("cache", cacheName);

		// Counter
		counter(meterRegistry, "cache.hits", "Cache hit count", tags, CacheMetrics::hitCount);
		counter(meterRegistry, "cache.misses", "Cache miss count (stale included)", tags, CacheMetrics::missCount);
		counter(meterRegistry, "cache.stale", "Stale entries discarded on access", tags, CacheMetrics::staleCount);
		counter(meterRegistry, "cache.puts", "Cache put count", tags, CacheMetrics::putCount);
		counter(meterRegistry, "cache.evictions", "Capacity eviction count", tags, CacheMetrics::evictionCount);
		counter(meterRegistry, "cache.removals", "Explicit removal count", tags, CacheMetrics::removalCount);

		// Gauge (실시간 값)
		Gauge.builder("cache.size", cache, size)
			.tags(tags)
			.description("Current number of entries")
			.register(meterRegistry);
		Gauge.builder("cache.capacity", () -> capacity)
			.tags(tags)
			.description("Maximum number of entries")
			.register(meterRegistry);
		Gauge.builder("cache.hit.rate", cacheMetrics, CacheMetrics::hitRate)
			.tags(tags)
			.description("Cache hit ratio")
			.register(meterRegistry);
	}

	private void counter(MeterRegistry registry, String name, String description, Tags tags,
						 ToDoubleFunction<CacheMetrics> count) {
		FunctionCounter.builder(name, cacheMetrics, count)
			.tags(tags)
			.description(description)
			.register(registry);
	}

	private static <T> T requireCache(T cache) {
		if (cache == null) {
			throw new IllegalArgumentException("Cache must not be null");
		}
		return cache;
	}

	/**
	 * 캐시 이름을 반환합니다.
	 *
	 * @return 캐시 이름
	 */
	public String getCacheName() {
		return cacheName;
	}

	/**
	 * CacheMetrics를 반환합니다.
	 *
	 * @return 캐시 메트릭
	 */
	public CacheMetrics getCacheMetrics() {
		return cacheMetrics;
	}
}
