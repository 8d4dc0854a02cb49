/**
 * 중복 제거 대상 작업 정의.
 *
 * <p>{@link com.ryuqq.singleflight.core.work.Work}는 호출자가 제공하는 불투명한 작업 단위입니다.
 * 캐시 적재, 원격 조회, 고비용 재계산 등 어떤 로직이든 될 수 있으며,
 * SDK는 그 내용을 해석하지 않습니다.</p>
 *
 * @author SingleFlight Team
 * @since 1.0.0
 */
package com.ryuqq.singleflight.core.work;
