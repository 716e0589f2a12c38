package com.ryuqq.ruledispatch.core.protection.noop;

import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;
import com.ryuqq.ruledispatch.core.protection.HandlerTimeoutPolicy;

/**
 * Handler Timeout Policy NoOp 구현.
 *
 * <p>타임아웃을 적용하지 않습니다 (0 반환). 모든 핸들러는 호출 스레드에서 동기 실행됩니다.</p>
 *
 * <p><strong>동작 방식:</strong></p>
 * <ul>
 *   <li>getTimeoutMs(): 항상 0 반환 (타임아웃 없음)</li>
 *   <li>recordTimeout(): 아무 동작 안 함</li>
 * </ul>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public final class NoOpHandlerTimeoutPolicy implements HandlerTimeoutPolicy {

    @Override
    public long getTimeoutMs(ParameterTypeTag tag) {
        return 0;
    }

    @Override
    public void recordTimeout(ParameterTypeTag tag, long elapsedMs) {
        // NoOp
    }
}
