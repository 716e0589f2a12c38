package com.ryuqq.ruledispatch.core.spi;

import com.ryuqq.ruledispatch.core.exception.RuleDispatchException;
import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;
import com.ryuqq.ruledispatch.core.outcome.Failed;
import com.ryuqq.ruledispatch.core.outcome.Outcome;

/**
 * Logging/Telemetry Sink SPI.
 *
 * <p>Dispatcher는 핸들러 미등록, 레지스트리 오류, 기타 디스패치 실패를 이 Sink로 보고합니다.
 * 구현체는 로깅, 메트릭, 알림 등 어떤 방식이든 선택할 수 있습니다.</p>
 *
 * <p><strong>구현 가이드:</strong></p>
 * <ul>
 *   <li>예외를 던지지 않음 (디스패치 결과에 영향을 주면 안 됨)</li>
 *   <li>thread-safe하게 구현</li>
 * </ul>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public interface DispatchTelemetry {

    /**
     * 핸들러 미등록 보고.
     *
     * @param tag 핸들러가 없는 태그
     */
    void onHandlerNotFound(ParameterTypeTag tag);

    /**
     * 핸들러 조회 중 발생한 레지스트리 오류 보고 (예: 봉인 전 조회).
     *
     * <p>보고 후 예외는 호출자에게 그대로 전파됩니다.</p>
     *
     * @param error 레지스트리 예외
     */
    void onRegistryError(RuleDispatchException error);

    /**
     * 핸들러 미등록 이외의 디스패치 실패 보고 (타입 불일치, 핸들러 오류, 타임아웃).
     *
     * @param failure 실패 Outcome
     */
    void onHandlerFailure(Failed failure);

    /**
     * 디스패치 완료 보고.
     *
     * @param tag 파라미터 태그
     * @param outcome 디스패치 결과
     * @param elapsedNanos 핸들러 실행 소요 시간 (나노초)
     */
    void onDispatched(ParameterTypeTag tag, Outcome outcome, long elapsedNanos);
}
