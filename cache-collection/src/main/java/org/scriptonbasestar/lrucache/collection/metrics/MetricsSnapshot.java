package org.scriptonbasestar.lrucache.collection.metrics;

import java.time.Instant;

/**
 * 캐시 메트릭의 불변 스냅샷
 *
 * 특정 시점의 메트릭 정보를 저장합니다.
 *
 * @author archmagece
 * @since 2025-01
 */
public class MetricsSnapshot {

	private final long timestamp;
	private final long hitCount;
	private final long missCount;
	private final long staleCount;
	private final long putCount;
	private final long evictionCount;
	private final long removalCount;

	/**
	 * CacheMetrics로부터 스냅샷을 생성합니다.
	 *
	 * @param metrics 캐시 메트릭
	 * @param timestamp 스냅샷 시각 (epoch milliseconds)
	 */
	public MetricsSnapshot(CacheMetrics metrics, long timestamp) {
		this.timestamp = timestamp;
		this.hitCount = metrics.hitCount();
		this.missCount = metrics.missCount();
		this.staleCount = metrics.staleCount();
		this.putCount = metrics.putCount();
		this.evictionCount = metrics.evictionCount();
		this.removalCount = metrics.removalCount();
	}

	public MetricsSnapshot(CacheMetrics metrics) {
		this(metrics, System.currentTimeMillis());
	}

	public long timestamp() {
		return timestamp;
	}

	public Instant instant() {
		return Instant.ofEpochMilli(timestamp);
	}

	public long hitCount() {
		return hitCount;
	}

	public long missCount() {
		return missCount;
	}

	public long staleCount() {
		return staleCount;
	}

	public long putCount() {
		return putCount;
	}

	public long evictionCount() {
		return evictionCount;
	}

	public long removalCount() {
		return removalCount;
	}

	public long requestCount() {
		return hitCount + missCount;
	}

	public double hitRate() {
		long requests = requestCount();
		return requests == 0 ? 0.0 : (double) hitCount / requests;
	}

	/**
	 * 이전 스냅샷과의 차이를 계산합니다.
	 *
	 * @param previous 이전 스냅샷
	 * @return 구간 동안의 변화량
	 */
	public MetricsDelta diff(MetricsSnapshot previous) {
		return new MetricsDelta(
			timestamp - previous.timestamp,
			hitCount - previous.hitCount,
			missCount - previous.missCount,
			staleCount - previous.staleCount,
			putCount - previous.putCount,
			evictionCount - previous.evictionCount,
			removalCount - previous.removalCount
		);
	}

	@Override
	public String toString() {
		return String.format(
			"MetricsSnapshot{time=%s, requests=%d, hitRate=%.2f%%, stale=%d, puts=%d, evictions=%d, removals=%d}",
			instant(), requestCount(), hitRate() * 100, staleCount, putCount, evictionCount, removalCount
		);
	}

	/**
	 * 두 스냅샷 사이의 변화량. 사이에 {@link CacheMetrics#reset()}이 있었다면 음수가 될 수 있습니다.
	 */
	public static class MetricsDelta {
		private final long durationMillis;
		private final long hits;
		private final long misses;
		private final long stale;
		private final long puts;
		private final long evictions;
		private final long removals;

		MetricsDelta(long durationMillis, long hits, long misses, long stale,
					 long puts, long evictions, long removals) {
			this.durationMillis = durationMillis;
			this.hits = hits;
			this.misses = misses;
			this.stale = stale;
			this.puts = puts;
			this.evictions = evictions;
			this.removals = removals;
		}

		public long durationMillis() {
			return durationMillis;
		}

		public long hits() {
			return hits;
		}

		public long misses() {
			return misses;
		}

		public long stale() {
			return stale;
		}

		public long puts() {
			return puts;
		}

		public long evictions() {
			return evictions;
		}

		public long removals() {
			return removals;
		}

		public double hitRate() {
			long requests = hits + misses;
			return requests == 0 ? 0.0 : (double) hits / requests;
		}

		@Override
		public String toString() {
			return String.format(
				"MetricsDelta{duration=%dms, hits=%d, misses=%d, stale=%d, puts=%d, evictions=%d, removals=%d}",
				durationMillis, hits, misses, stale, puts, evictions, removals
			);
		}
	}
}
