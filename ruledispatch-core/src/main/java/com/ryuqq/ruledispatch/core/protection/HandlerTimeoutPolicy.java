package com.ryuqq.ruledispatch.core.protection;

import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;

/**
 * Handler Timeout Policy SPI.
 *
 * <p>핸들러 한 번의 호출에 허용되는 최대 시간을 태그별로 지정하여 무한 대기를 방지합니다.</p>
 *
 * <p><strong>적용 방식:</strong></p>
 * <ul>
 *   <li>0: 타임아웃 없음, 호출 스레드에서 동기 실행</li>
 *   <li>양수: 별도 스레드에서 실행하고 시간 초과 시 취소 후 HANDLER_TIMEOUT 반환</li>
 * </ul>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>{@code
 * long timeout = policy.getTimeoutMs(tag);
 * if (timeout > 0) {
 *     Future<Outcome> future = handlerExecutor.submit(() -> registration.invoke(params));
 *     try {
 *         return future.get(timeout, TimeUnit.MILLISECONDS);
 *     } catch (TimeoutException e) {
 *         future.cancel(true);
 *         policy.recordTimeout(tag, timeout);
 *         return Failed.of(FailureKind.HANDLER_TIMEOUT, tag, "...");
 *     }
 * }
 * }</pre>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public interface HandlerTimeoutPolicy {

    /**
     * 태그별 핸들러 타임아웃 조회.
     *
     * @param tag 파라미터 태그
     * @return 타임아웃 시간 (밀리초), 0은 타임아웃 없음을 의미
     */
    long getTimeoutMs(ParameterTypeTag tag);

    /**
     * 타임아웃 발생 기록.
     *
     * @param tag 파라미터 태그
     * @param elapsedMs 실제 경과 시간 (밀리초)
     */
    void recordTimeout(ParameterTypeTag tag, long elapsedMs);
}
