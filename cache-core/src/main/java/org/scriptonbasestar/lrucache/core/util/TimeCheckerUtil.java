package org.scriptonbasestar.lrucache.core.util;

import lombok.experimental.UtilityClass;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;

/**
 * @athor archmagece
 * @since 2017-01-17 16
 */
@Slf4j
@UtilityClass
public class TimeCheckerUtil {

	/**
	 * 생성 시각과 TTL로 항목이 stale 상태인지 확인합니다.
	 * 경과 시간이 TTL과 정확히 같으면 아직 stale이 아닙니다.
	 *
	 * @param createdAtMillis 항목 생성 시각 (milliseconds)
	 * @param ttl TTL, null이면 만료되지 않음
	 * @param nowMillis 비교 기준 시각 (milliseconds)
	 * @return stale이면 true
	 */
	public static boolean isStale(long createdAtMillis, Duration ttl, long nowMillis) {
		if (ttl == null) {
			return false;
		}
		long elapsed = nowMillis - createdAtMillis;

		if (log.isTraceEnabled()) {
			log.trace("isStale param - createdAt : {}, ttl : {}, now : {}",
				Instant.ofEpochMilli(createdAtMillis), ttl, Instant.ofEpochMilli(nowMillis));
		}

		return elapsed > ttl.toMillis();
	}

	/**
	 * 항목이 stale 상태가 되기까지 남은 시간을 계산합니다.
	 *
	 * @param createdAtMillis 항목 생성 시각 (milliseconds)
	 * @param ttl TTL, null이면 만료되지 않음
	 * @param nowMillis 비교 기준 시각 (milliseconds)
	 * @return 남은 시간, ttl이 null이면 null, 이미 stale이면 {@link Duration#ZERO}
	 */
	public static Duration remaining(long createdAtMillis, Duration ttl, long nowMillis) {
		if (ttl == null) {
			return null;
		}
		long left = ttl.toMillis() - (nowMillis - createdAtMillis);
		return left > 0 ? Duration.ofMillis(left) : Duration.ZERO;
	}

	/**
	 * TTL 설정값을 검증합니다.
	 *
	 * @param ttl 검증할 TTL (null 허용)
	 * @return 입력 그대로
	 * @throws IllegalArgumentException 음수 TTL
	 */
	public static Duration requireValidTtl(Duration ttl) {
		if (ttl != null && ttl.isNegative()) {
			throw new IllegalArgumentException("ttl must not be negative: " + ttl);
		}
		return ttl;
	}
}
