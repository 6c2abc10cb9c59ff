/**
 * Spring Framework 통합 모듈
 *
 * <h2>주요 클래스</h2>
 * <ul>
 *     <li>{@link org.scriptonbasestar.lrucache.spring.SBLruCacheRegistry} - 이름 기반 캐시 레지스트리</li>
 *     <li>{@link org.scriptonbasestar.lrucache.spring.boot.SBLruCacheAutoConfiguration} - Spring Boot 자동 설정</li>
 *     <li>{@link org.scriptonbasestar.lrucache.spring.actuator.LruCacheHealthIndicator} - Actuator 헬스 체크</li>
 * </ul>
 *
 * @author archmagece
 * @since 2025-01
 */
package org.scriptonbasestar.lrucache.spring;
