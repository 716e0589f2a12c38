package com.ryuqq.ruledispatch.adapter.runner;

import com.ryuqq.ruledispatch.application.dispatcher.Dispatcher;
import com.ryuqq.ruledispatch.core.exception.HandlerNotFoundException;
import com.ryuqq.ruledispatch.core.exception.RuleDispatchException;
import com.ryuqq.ruledispatch.core.handler.HandlerRegistration;
import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;
import com.ryuqq.ruledispatch.core.model.RuleParameters;
import com.ryuqq.ruledispatch.core.outcome.Failed;
import com.ryuqq.ruledispatch.core.outcome.FailureKind;
import com.ryuqq.ruledispatch.core.outcome.Outcome;
import com.ryuqq.ruledispatch.core.protection.HandlerTimeoutPolicy;
import com.ryuqq.ruledispatch.core.protection.noop.NoOpHandlerTimeoutPolicy;
import com.ryuqq.ruledispatch.core.registry.HandlerRegistry;
import com.ryuqq.ruledispatch.core.spi.DispatchTelemetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Dispatcher 기본 구현체.
 *
 * <p><strong>동작 방식:</strong></p>
 * <ol>
 *   <li>params.tag()로 레지스트리 조회 (O(1))</li>
 *   <li>미등록 → Telemetry 보고 후 {@code Failed(HANDLER_NOT_FOUND)}</li>
 *   <li>파라미터 타입이 등록 타입과 다르면 {@code Failed(PARAMETER_TYPE_MISMATCH)}</li>
 *   <li>타임아웃 0 → 호출 스레드에서 직접 실행</li>
 *   <li>타임아웃 양수 → handlerExecutor에서 실행, 초과 시 취소 후 {@code Failed(HANDLER_TIMEOUT)}</li>
 *   <li>핸들러 예외 또는 null 반환 → {@code Failed(HANDLER_ERROR)}</li>
 * </ol>
 *
 * <p><strong>전파되는 예외:</strong></p>
 * <ul>
 *   <li>RegistryNotSealedException: 설정 단계 완료 전 호출 (프로그래밍 오류, Telemetry 보고 후 전파)</li>
 *   <li>IllegalStateException: 대기 중 호출 스레드 인터럽트</li>
 *   <li>Error: 핸들러에서 발생한 JVM 오류</li>
 * </ul>
 *
 * <p>Stateless 설계로 여러 스레드에서 동시에 호출할 수 있습니다.</p>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public final class DefaultDispatcher implements Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(DefaultDispatcher.class);

    private final HandlerRegistry registry;
    private final HandlerTimeoutPolicy timeoutPolicy;
    private final DispatchTelemetry telemetry;
    private final ExecutorService handlerExecutor;

    /**
     * 생성자 (타임아웃 없음, SLF4J Telemetry).
     *
     * @param registry 봉인된 Handler Registry
     * @throws IllegalArgumentException registry가 null인 경우
     */
    public DefaultDispatcher(HandlerRegistry registry) {
        this(registry, new Slf4jDispatchTelemetry());
    }

    /**
     * 생성자 (타임아웃 없음, Telemetry 지정).
     *
     * @param registry 봉인된 Handler Registry
     * @param telemetry 디스패치 Telemetry Sink
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public DefaultDispatcher(HandlerRegistry registry, DispatchTelemetry telemetry) {
        this(registry, new NoOpHandlerTimeoutPolicy(), telemetry, null, false);
    }

    /**
     * 생성자 (핸들러별 타임아웃 적용).
     *
     * <p>handlerExecutor의 생명주기(shutdown)는 호출자가 관리합니다.</p>
     *
     * @param registry 봉인된 Handler Registry
     * @param timeoutPolicy 핸들러 타임아웃 정책
     * @param telemetry 디스패치 Telemetry Sink
     * @param handlerExecutor 타임아웃이 있는 핸들러를 실행할 스레드 풀
     * @throws IllegalArgumentException 인자가 null인 경우
     */
    public DefaultDispatcher(
            HandlerRegistry registry,
            HandlerTimeoutPolicy timeoutPolicy,
            DispatchTelemetry telemetry,
            ExecutorService handlerExecutor) {
        this(registry, timeoutPolicy, telemetry, handlerExecutor, true);
    }

    private DefaultDispatcher(
            HandlerRegistry registry,
            HandlerTimeoutPolicy timeoutPolicy,
            DispatchTelemetry telemetry,
            ExecutorService handlerExecutor,
            boolean executorRequired) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        if (timeoutPolicy == null) {
            throw new IllegalArgumentException("timeoutPolicy cannot be null");
        }
        if (telemetry == null) {
            throw new IllegalArgumentException("telemetry cannot be null");
        }
        if (executorRequired && handlerExecutor == null) {
            throw new IllegalArgumentException("handlerExecutor cannot be null");
        }
        this.registry = registry;
        this.timeoutPolicy = timeoutPolicy;
        this.telemetry = telemetry;
        this.handlerExecutor = handlerExecutor;
    }

    @Override
    public Outcome dispatch(RuleParameters params) {
        if (params == null) {
            throw new IllegalArgumentException("params cannot be null");
        }
        ParameterTypeTag tag = params.tag();
        if (tag == null) {
            throw new IllegalArgumentException("params.tag() cannot be null (type: " + params.getClass().getName() + ")");
        }

        // 1. 핸들러 조회
        HandlerRegistration<?> registration;
        try {
            registration = registry.resolve(tag);
        } catch (HandlerNotFoundException e) {
            telemetry.onHandlerNotFound(tag);
            return Failed.handlerNotFound(tag);
        } catch (RuleDispatchException e) {
            telemetry.onRegistryError(e);
            throw e;
        }

        // 2. 태그와 실제 타입 일치 여부 확인
        if (!registration.parameterType().isInstance(params)) {
            Failed mismatch = Failed.of(
                FailureKind.PARAMETER_TYPE_MISMATCH,
                tag,
                "Parameter type mismatch for " + tag.getValue(),
                "expected " + registration.parameterType().getName() + " but was " + params.getClass().getName()
            );
            telemetry.onHandlerFailure(mismatch);
            return mismatch;
        }

        // 3. 핸들러 실행
        long startNanos = System.nanoTime();
        Outcome outcome = invoke(registration, params, tag);
        long elapsedNanos = System.nanoTime() - startNanos;

        if (outcome instanceof Failed failed) {
            telemetry.onHandlerFailure(failed);
        }
        telemetry.onDispatched(tag, outcome, elapsedNanos);
        return outcome;
    }

    private Outcome invoke(HandlerRegistration<?> registration, RuleParameters params, ParameterTypeTag tag) {
        long timeoutMs = timeoutPolicy.getTimeoutMs(tag);
        if (timeoutMs <= 0 || handlerExecutor == null) {
            return invokeDirect(registration, params, tag);
        }
        return invokeWithDeadline(registration, params, tag, timeoutMs);
    }

    /**
     * 호출 스레드에서 핸들러 실행.
     */
    private Outcome invokeDirect(HandlerRegistration<?> registration, RuleParameters params, ParameterTypeTag tag) {
        try {
            return nonNull(registration.invoke(params), tag);
        } catch (RuntimeException e) {
            return handlerError(tag, e);
        }
    }

    /**
     * handlerExecutor에서 핸들러를 실행하고 timeoutMs까지 대기.
     *
     * <p>시간 초과 시 작업을 인터럽트로 취소합니다. 인터럽트에 반응하지 않는 핸들러는
     * 백그라운드에서 계속 실행될 수 있으나 그 결과는 버려집니다.</p>
     */
    private Outcome invokeWithDeadline(
            HandlerRegistration<?> registration, RuleParameters params, ParameterTypeTag tag, long timeoutMs) {
        Future<Outcome> future;
        try {
            future = handlerExecutor.submit(() -> registration.invoke(params));
        } catch (RejectedExecutionException e) {
            log.debug("Handler executor rejected invocation for {}", tag.getValue(), e);
            return Failed.of(FailureKind.HANDLER_ERROR, tag, "Handler executor rejected invocation", e.getMessage());
        }

        long startNanos = System.nanoTime();
        try {
            return nonNull(future.get(timeoutMs, TimeUnit.MILLISECONDS), tag);
        } catch (TimeoutException e) {
            future.cancel(true);
            long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
            timeoutPolicy.recordTimeout(tag, elapsedMs);
            return Failed.of(
                FailureKind.HANDLER_TIMEOUT,
                tag,
                "Handler did not complete within " + timeoutMs + "ms"
            );
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof Error error) {
                throw error;
            }
            return handlerError(tag, cause);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Handler invocation interrupted for " + tag.getValue(), e);
        }
    }

    private Outcome nonNull(Outcome outcome, ParameterTypeTag tag) {
        if (outcome == null) {
            return Failed.of(FailureKind.HANDLER_ERROR, tag, "Handler returned null outcome");
        }
        return outcome;
    }

    private Failed handlerError(ParameterTypeTag tag, Throwable cause) {
        // 실패 로그는 Telemetry가 남김, 여기서는 스택 트레이스만
        log.debug("Handler for {} threw {}", tag.getValue(), cause.getClass().getSimpleName(), cause);
        return Failed.of(
            FailureKind.HANDLER_ERROR,
            tag,
            "Handler threw " + cause.getClass().getSimpleName(),
            cause.getMessage()
        );
    }
}
