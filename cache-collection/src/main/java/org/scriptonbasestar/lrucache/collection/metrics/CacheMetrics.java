package org.scriptonbasestar.lrucache.collection.metrics;

import java.util.concurrent.atomic.AtomicLong;

/**
 * 캐시 통계 및 메트릭 정보를 제공합니다.
 *
 * 스레드 안전하며 오버헤드가 거의 없도록 AtomicLong을 사용합니다.
 * stale 항목 조회는 미스로도 집계됩니다.
 *
 * @author archmagece
 * @since 2025-01
 */
public class CacheMetrics {

	private final AtomicLong hitCount = new AtomicLong(0);
	private final AtomicLong missCount = new AtomicLong(0);
	private final AtomicLong staleCount = new AtomicLong(0);
	private final AtomicLong putCount = new AtomicLong(0);
	private final AtomicLong evictionCount = new AtomicLong(0);
	private final AtomicLong removalCount = new AtomicLong(0);

	/**
	 * 캐시 히트 횟수를 증가시킵니다.
	 */
	public void recordHit() {
		hitCount.incrementAndGet();
	}

	/**
	 * 캐시 미스 횟수를 증가시킵니다.
	 */
	public void recordMiss() {
		missCount.incrementAndGet();
	}

	/**
	 * stale 항목 조회를 기록합니다. 미스 횟수도 함께 증가합니다.
	 */
	public void recordStale() {
		staleCount.incrementAndGet();
		missCount.incrementAndGet();
	}

	/**
	 * 항목 저장을 기록합니다.
	 */
	public void recordPut() {
		putCount.incrementAndGet();
	}

	/**
	 * 용량 초과로 인한 축출을 기록합니다.
	 *
	 * @param count 축출된 항목 수
	 */
	public void recordEviction(int count) {
		evictionCount.addAndGet(count);
	}

	/**
	 * 명시적 제거(remove, pop)를 기록합니다.
	 */
	public void recordRemoval() {
		removalCount.incrementAndGet();
	}

	public long hitCount() {
		return hitCount.get();
	}

	public long missCount() {
		return missCount.get();
	}

	public long staleCount() {
		return staleCount.get();
	}

	public long putCount() {
		return putCount.get();
	}

	public long evictionCount() {
		return evictionCount.get();
	}

	public long removalCount() {
		return removalCount.get();
	}

	/**
	 * 총 요청 횟수를 반환합니다 (히트 + 미스).
	 *
	 * @return 총 요청 횟수
	 */
	public long requestCount() {
		return hitCount.get() + missCount.get();
	}

	/**
	 * 캐시 히트율을 계산합니다.
	 *
	 * @return 히트율 (0.0 ~ 1.0), 요청이 없으면 0.0
	 */
	public double hitRate() {
		long requests = requestCount();
		return requests == 0 ? 0.0 : (double) hitCount.get() / requests;
	}

	/**
	 * 캐시 미스율을 계산합니다.
	 *
	 * @return 미스율 (0.0 ~ 1.0), 요청이 없으면 0.0
	 */
	public double missRate() {
		long requests = requestCount();
		return requests == 0 ? 0.0 : (double) missCount.get() / requests;
	}

	/**
	 * 요청 중 stale 항목이었던 비율
	 *
	 * @return stale 비율 (0.0 ~ 1.0), 요청이 없으면 0.0
	 */
	public double staleRate() {
		long requests = requestCount();
		return requests == 0 ? 0.0 : (double) staleCount.get() / requests;
	}

	/**
	 * 저장 대비 축출 비율
	 *
	 * @return 축출 비율, 저장이 없으면 0.0
	 */
	public double evictionRate() {
		long puts = putCount.get();
		return puts == 0 ? 0.0 : (double) evictionCount.get() / puts;
	}

	/**
	 * 모든 통계를 초기화합니다.
	 */
	public void reset() {
		hitCount.set(0);
		missCount.set(0);
		staleCount.set(0);
		putCount.set(0);
		evictionCount.set(0);
		removalCount.set(0);
	}

	@Override
	public String toString() {
		return String.format(
			"CacheMetrics{requests=%d, hits=%d, misses=%d, hitRate=%.2f%%, " +
			"stale=%d, puts=%d, evictions=%d, removals=%d}",
			requestCount(),
			hitCount(),
			missCount(),
			hitRate() * 100,
			staleCount(),
			putCount(),
			evictionCount(),
			removalCount()
		);
	}
}
