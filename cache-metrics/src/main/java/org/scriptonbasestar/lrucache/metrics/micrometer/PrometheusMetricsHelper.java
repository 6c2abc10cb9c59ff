package org.scriptonbasestar.lrucache.metrics.micrometer;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.scriptonbasestar.lrucache.collection.map.SBSynchronizedLruCache;

import java.util.Map;

/**
 * Prometheus 메트릭 간편 설정 헬퍼
 *
 * <p>사용 예시:</p>
 * <pre>{@code
 * PrometheusMeterRegistry registry = PrometheusMetricsHelper.createPrometheusRegistry();
 * PrometheusMetricsHelper.bindCache(cache, registry, "users");
 *
 * String prometheusFormat = PrometheusMetricsHelper.scrapeMetrics(registry);
 * }</pre>
 *
 * @author archmagece
 * @since 2025-01
 */
public class PrometheusMetricsHelper {

	/**
	 * 기본 설정으로 Prometheus 레지스트리를 생성합니다.
	 *
	 * @return PrometheusMeterRegistry
	 */
	public static PrometheusMeterRegistry createPrometheusRegistry() {
		return new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);
	}

	/**
	 * 캐시를 MeterRegistry에 바인딩합니다.
	 *
	 * @param cache 메트릭이 활성화된 캐시
	 * @param meterRegistry 메터 레지스트리
	 * @param cacheName 캐시 이름
	 * @return MicrometerMetricsAdapter
	 */
	public static MicrometerMetricsAdapter bindCache(
		SBSynchronizedLruCache cache,
		MeterRegistry meterRegistry,
		String cacheName
	) {
		return new MicrometerMetricsAdapter(cache, meterRegistry, cacheName);
	}

	/**
	 * 여러 캐시를 한번에 바인딩합니다. 메트릭이 비활성화된 캐시는 건너뜁니다.
	 *
	 * @param caches 캐시 이름과 캐시의 맵
	 * @param meterRegistry 메터 레지스트리
	 * @return 어댑터 배열
	 */
	public static MicrometerMetricsAdapter[] bindCaches(
		Map<String, SBSynchronizedLruCache> caches,
		MeterRegistry meterRegistry
	) {
		return caches.entrySet().stream()
			.filter(entry -> entry.getValue().metrics() != null)
			.map(entry -> new MicrometerMetricsAdapter(entry.getValue(), meterRegistry, entry.getKey()))
			.toArray(MicrometerMetricsAdapter[]::new);
	}

	/**
	 * Prometheus 스크래핑 포맷으로 메트릭을 출력합니다.
	 *
	 * @param registry Prometheus 레지스트리
	 * @return Prometheus 포맷 문자열
	 */
	public static String scrapeMetrics(PrometheusMeterRegistry registry) {
		return registry.scrape();
	}

	private PrometheusMetricsHelper() {
		// 유틸리티 클래스
	}
}
