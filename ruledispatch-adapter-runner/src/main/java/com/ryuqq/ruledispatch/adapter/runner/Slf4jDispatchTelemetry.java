package com.ryuqq.ruledispatch.adapter.runner;

import com.ryuqq.ruledispatch.core.exception.RuleDispatchException;
import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;
import com.ryuqq.ruledispatch.core.outcome.Failed;
import com.ryuqq.ruledispatch.core.outcome.Outcome;
import com.ryuqq.ruledispatch.core.spi.DispatchTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.TimeUnit;

/**
 * SLF4J 기반 Dispatch Telemetry.
 *
 * <p>디스패치 실패 로그는 이 Sink에서만 남깁니다.</p>
 *
 * <ul>
 *   <li>핸들러 미등록: WARN (배포 구성 결함)</li>
 *   <li>레지스트리 오류: ERROR (프로그래밍 오류)</li>
 *   <li>기타 디스패치 실패: WARN</li>
 *   <li>디스패치 완료: DEBUG</li>
 * </ul>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public final class Slf4jDispatchTelemetry implements DispatchTelemetry {

    private final Logger log;

    /**
     * 기본 생성자 (클래스 이름의 Logger 사용).
     */
    public Slf4jDispatchTelemetry() {
        this(LoggerFactory.getLogger(Slf4jDispatchTelemetry.class));
    }

    /**
     * 생성자 (Logger 지정).
     *
     * @param log 출력 대상 Logger
     * @throws IllegalArgumentException log가 null인 경우
     */
    Slf4jDispatchTelemetry(Logger log) {
        if (log == null) {
            throw new IllegalArgumentException("log cannot be null");
        }
        this.log = log;
    }

    @Override
    public void onHandlerNotFound(ParameterTypeTag tag) {
        log.warn("No handler registered for {}; check handler registrations for this deployment", tag.getValue());
    }

    @Override
    public void onRegistryError(RuleDispatchException error) {
        String tag = error.getTag() != null ? error.getTag().getValue() : "-";
        log.error("Registry error while resolving {}: {}", tag, error.getMessage());
    }

    @Override
    public void onHandlerFailure(Failed failure) {
        log.warn("Rule dispatch failed for {}: {} - {} (cause: {})",
            failure.tag().getValue(), failure.kind(), failure.message(), failure.cause());
    }

    @Override
    public void onDispatched(ParameterTypeTag tag, Outcome outcome, long elapsedNanos) {
        if (log.isDebugEnabled()) {
            log.debug("Dispatched {} → {} in {}µs",
                tag.getValue(), outcome.getClass().getSimpleName(), TimeUnit.NANOSECONDS.toMicros(elapsedNanos));
        }
    }
}
