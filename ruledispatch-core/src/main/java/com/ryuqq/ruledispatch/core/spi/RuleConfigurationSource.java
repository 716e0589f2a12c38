package com.ryuqq.ruledispatch.core.spi;

import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;

/**
 * Rule Configuration Source SPI.
 *
 * <p>룰별 적용 여부(예: "이 지점에서 주간 최대 근무 시간 룰을 적용하는가")를 제공합니다.
 * Dispatcher나 Batch Executor는 이 SPI를 호출하지 않으며, 핸들러 또는
 * {@link com.ryuqq.ruledispatch.core.handler.EnforcementGuard}만 사용합니다.</p>
 *
 * <p><strong>구현 가이드:</strong></p>
 * <ul>
 *   <li>thread-safe하게 구현 (여러 요청이 동시에 조회)</li>
 *   <li>scope별 설정이 없으면 태그 전역 설정으로 대체</li>
 * </ul>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public interface RuleConfigurationSource {

    /**
     * 룰 적용 여부 조회.
     *
     * @param tag 룰 태그
     * @param scope 적용 범위 (예: 지점 ID), null이면 전역
     * @return 적용 대상이면 true
     * @throws IllegalArgumentException tag가 null인 경우
     */
    boolean isEnforced(ParameterTypeTag tag, String scope);
}
