package org.scriptonbasestar.lrucache.core.util;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 수동으로 진행시키는 시간 공급자. TTL 동작을 sleep 없이 검증할 때 사용합니다.
 *
 * @author archmagece
 * @since 2025-01
 */
public class ManualTimeSource implements TimeSource {

	private final AtomicLong nowMillis;

	public ManualTimeSource() {
		this(0L);
	}

	public ManualTimeSource(long startMillis) {
		this.nowMillis = new AtomicLong(startMillis);
	}

	@Override
	public long now() {
		return nowMillis.get();
	}

	public void advance(Duration duration) {
		nowMillis.addAndGet(duration.toMillis());
	}

	public void advanceMillis(long millis) {
		nowMillis.addAndGet(millis);
	}

	public void set(long millis) {
		nowMillis.set(millis);
	}
}
