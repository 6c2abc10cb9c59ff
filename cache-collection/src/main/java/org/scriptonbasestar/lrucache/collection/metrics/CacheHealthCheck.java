package org.scriptonbasestar.lrucache.collection.metrics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * 캐시 메트릭 기반 헬스체크
 *
 * <p>낮은 히트율, 높은 stale 비율, 잦은 축출은 튜닝이 필요하다는 신호일 뿐 장애가 아니므로
 * 모두 경고로만 보고합니다. 구조 손상은 {@code SBLruCache.checkIntegrity()}가 담당합니다.</p>
 *
 * @author archmagece
 * @since 2025-01
 */
public class CacheHealthCheck {

	private final CacheMetrics metrics;
	private final HealthThresholds thresholds;

	public CacheHealthCheck(CacheMetrics metrics) {
		this(metrics, HealthThresholds.DEFAULT);
	}

	/**
	 * @param metrics 캐시 메트릭
	 * @param thresholds 경고 임계값
	 */
	public CacheHealthCheck(CacheMetrics metrics, HealthThresholds thresholds) {
		if (metrics == null) {
			throw new IllegalArgumentException("Metrics must not be null");
		}
		if (thresholds == null) {
			throw new IllegalArgumentException("Thresholds must not be null");
		}
		this.metrics = metrics;
		this.thresholds = thresholds;
	}

	/**
	 * 현재 메트릭을 임계값과 비교합니다.
	 * 요청 수가 {@link HealthThresholds#minRequests()} 미만이면 비율 검사는 건너뜁니다.
	 *
	 * @return 검사 결과
	 */
	public HealthStatus check() {
		List<String> warnings = new ArrayList<>();
		List<String> info = new ArrayList<>();

		long requests = metrics.requestCount();
		if (requests < thresholds.minRequests()) {
			info.add(String.format("Low request count: %d (threshold: %d)", requests, thresholds.minRequests()));
			return new HealthStatus(warnings, info);
		}

		double hitRate = metrics.hitRate();
		if (hitRate < thresholds.minHitRate()) {
			warnings.add(percent("Low hit rate", hitRate, thresholds.minHitRate()));
		}

		// TTL이 짧은 캐시는 stale 비율이 높은 것이 정상
		double staleRate = metrics.staleRate();
		if (staleRate > thresholds.maxStaleRate()) {
			warnings.add(percent("High stale rate", staleRate, thresholds.maxStaleRate()));
		}

		// 용량이 작업량에 비해 작음
		double evictionRate = metrics.evictionRate();
		if (evictionRate > thresholds.maxEvictionRate()) {
			warnings.add(percent("High eviction rate (of puts)", evictionRate, thresholds.maxEvictionRate()));
		}

		return new HealthStatus(warnings, info);
	}

	private static String percent(String label, double actual, double threshold) {
		return String.format("%s: %.2f%% (threshold: %.2f%%)", label, actual * 100, threshold * 100);
	}

	/**
	 * 경고 임계값. 비율은 0.0 ~ 1.0 범위입니다.
	 */
	public static final class HealthThresholds {

		public static final HealthThresholds DEFAULT = new HealthThresholds(0.5, 0.3, 0.9, 10);
		public static final HealthThresholds STRICT = new HealthThresholds(0.8, 0.1, 0.5, 100);
		public static final HealthThresholds RELAXED = new HealthThresholds(0.3, 0.5, 1.0, 5);

		private final double minHitRate;
		private final double maxStaleRate;
		private final double maxEvictionRate;
		private final long minRequests;

		public HealthThresholds(double minHitRate, double maxStaleRate, double maxEvictionRate, long minRequests) {
			this.minHitRate = requireRatio("minHitRate", minHitRate);
			this.maxStaleRate = requireRatio("maxStaleRate", maxStaleRate);
			this.maxEvictionRate = requireRatio("maxEvictionRate", maxEvictionRate);
			if (minRequests < 0) {
				throw new IllegalArgumentException("minRequests must not be negative: " + minRequests);
			}
			this.minRequests = minRequests;
		}

		public double minHitRate() {
			return minHitRate;
		}

		public double maxStaleRate() {
			return maxStaleRate;
		}

		public double maxEvictionRate() {
			return maxEvictionRate;
		}

		public long minRequests() {
			return minRequests;
		}

		private static double requireRatio(String name, double value) {
			if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
				throw new IllegalArgumentException(name + " must be within [0.0, 1.0]: " + value);
			}
			return value;
		}
	}

	/**
	 * 검사 결과. 목록은 수정할 수 없습니다.
	 */
	public static final class HealthStatus {

		private final List<String> warnings;
		private final List<String> info;

		HealthStatus(List<String> warnings, List<String> info) {
			this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
			this.info = Collections.unmodifiableList(new ArrayList<>(info));
		}

		public boolean hasWarnings() {
			return !warnings.isEmpty();
		}

		public List<String> warnings() {
			return warnings;
		}

		public List<String> info() {
			return info;
		}

		@Override
		public String toString() {
			return "HealthStatus{warnings=" + warnings + ", info=" + info + "}";
		}
	}
}
