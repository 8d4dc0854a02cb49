/**
 * SingleFlight Application Layer - 호출 중복 제거 API.
 *
 * <p>이 패키지는 SingleFlight SDK의 포트 계층으로,
 * 키 단위 중복 제거 계약과 호출자에게 돌려주는 결과 타입을 정의합니다.</p>
 *
 * <h2>핵심 인터페이스</h2>
 * <ul>
 *   <li>{@link com.ryuqq.singleflight.application.group.FlightGroup} - 키 단위 중복 제거 그룹</li>
 *   <li>{@link com.ryuqq.singleflight.application.group.FlightResult} - 호출자별 실행 결과</li>
 *   <li>{@link com.ryuqq.singleflight.application.group.FlightHandle} - 비동기 호출자 전용 핸들</li>
 * </ul>
 *
 * <h2>설계 원칙</h2>
 * <ul>
 *   <li><strong>헥사고날 아키텍처:</strong> 포트(인터페이스)와 어댑터 분리</li>
 *   <li><strong>의존성 역전:</strong> 구현체는 adapter-inmemory 모듈에 위치</li>
 *   <li><strong>명시적 그룹:</strong> 전역 상태 없이 애플리케이션이 그룹 인스턴스를 생성하여 주입</li>
 * </ul>
 *
 * @author SingleFlight Team
 * @since 1.0.0
 */
package com.ryuqq.singleflight.application.group;
