package com.ryuqq.ruledispatch.application.dispatcher;

import com.ryuqq.ruledispatch.core.exception.RegistryNotSealedException;
import com.ryuqq.ruledispatch.core.model.RuleParameters;
import com.ryuqq.ruledispatch.core.outcome.Outcome;

/**
 * 룰 파라미터를 Outcome으로 변환하는 디스패처.
 *
 * <p>파라미터의 태그로 핸들러를 찾아 호출하고, 핸들러의 Outcome을 그대로 반환합니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>params.tag()로 Handler Registry 조회</li>
 *   <li>핸들러 없음 → {@code Failed(HANDLER_NOT_FOUND)} (기본값으로 대체하지 않음)</li>
 *   <li>핸들러 호출 → Outcome 그대로 반환</li>
 *   <li>핸들러 예외/null/타입 불일치/타임아웃 → 해당 {@code Failed}</li>
 * </ol>
 *
 * <p><strong>재시도 없음:</strong> 재시도 정책은 핸들러 자신의 책임입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * Outcome outcome = dispatcher.dispatch(new ShiftOverlapParameters("C-1", from, to));
 * if (outcome instanceof Produced produced &amp;&amp; produced.result().isBusinessRuleRejection()) {
 *     // 사용자에게 거부 사유 안내
 * }
 * </pre>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public interface Dispatcher {

    /**
     * 파라미터 한 건 디스패치.
     *
     * @param params 룰 파라미터
     * @return 실행 결과 (Produced, Empty, Failed)
     * @throws IllegalArgumentException params가 null이거나 태그가 null인 경우
     * @throws RegistryNotSealedException 레지스트리가 봉인되기 전에 호출된 경우
     */
    Outcome dispatch(RuleParameters params);
}
