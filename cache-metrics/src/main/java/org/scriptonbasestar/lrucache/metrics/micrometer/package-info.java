/**
 * Micrometer 기반 캐시 메트릭 통합
 *
 * <h3>지원 메트릭</h3>
 * <ul>
 *   <li>cache.hits - 캐시 히트 횟수 (FunctionCounter)</li>
 *   <li>cache.misses - 캐시 미스 횟수, stale 포함 (FunctionCounter)</li>
 *   <li>cache.stale - 조회 시 폐기된 stale 항목 수 (FunctionCounter)</li>
 *   <li>cache.puts - 저장 횟수 (FunctionCounter)</li>
 *   <li>cache.evictions - 용량 초과 축출 횟수 (FunctionCounter)</li>
 *   <li>cache.removals - remove/pop 횟수 (FunctionCounter)</li>
 *   <li>cache.size / cache.capacity - 현재 크기와 용량 (Gauge)</li>
 *   <li>cache.hit.rate - 히트율 (Gauge)</li>
 * </ul>
 *
 * 모든 메트릭은 {@code cache=<이름>} 태그를 가집니다.
 *
 * @author archmagece
 * @since 2025-01
 */
package org.scriptonbasestar.lrucache.metrics.micrometer;
