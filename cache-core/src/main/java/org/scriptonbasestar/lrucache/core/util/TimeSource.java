package org.scriptonbasestar.lrucache.core.util;

/**
 * 캐시가 사용하는 시간 공급자
 *
 * <p>엔트리 생성 시각과 staleness 판정에 같은 단위(epoch milliseconds)를 사용해야 합니다.</p>
 *
 * @author archmagece
 * @since 2025-01
 */
@FunctionalInterface
public interface TimeSource {

	/**
	 * System wall clock.
	 */
	TimeSource SYSTEM = System::currentTimeMillis;

	/**
	 * @return current time in epoch milliseconds
	 */
	long now();
}
