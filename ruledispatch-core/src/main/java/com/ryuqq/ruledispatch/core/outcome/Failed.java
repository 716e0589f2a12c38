package com.ryuqq.ruledispatch.core.outcome;

import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;

/**
 * 인프라/레지스트리 실패.
 *
 * <p>핸들러 미등록, 타입 불일치, 핸들러 예외, 타임아웃처럼 배포나 운영 측에서 조치해야 하는
 * 실패를 나타냅니다. 비즈니스 룰 거부는 이 타입이 아니라 {@link Produced}로 표현됩니다.</p>
 *
 * @param kind 실패 종류
 * @param tag 실패한 파라미터의 태그
 * @param message 실패 메시지
 * @param cause 원인 (선택, null 가능)
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public record Failed(
    FailureKind kind,
    ParameterTypeTag tag,
    String message,
    String cause
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException kind, tag가 null이거나 message가 null 또는 빈 문자열인 경우
     */
    public Failed {
        if (kind == null) {
            throw new IllegalArgumentException("kind cannot be null");
        }
        if (tag == null) {
            throw new IllegalArgumentException("tag cannot be null");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    /**
     * cause 없이 Failed 생성.
     *
     * @param kind 실패 종류
     * @param tag 파라미터 태그
     * @param message 실패 메시지
     * @return Failed 인스턴스
     */
    public static Failed of(FailureKind kind, ParameterTypeTag tag, String message) {
        return new Failed(kind, tag, message, null);
    }

    /**
     * Failed 생성 (cause 포함).
     *
     * @param kind 실패 종류
     * @param tag 파라미터 태그
     * @param message 실패 메시지
     * @param cause 원인
     * @return Failed 인스턴스
     */
    public static Failed of(FailureKind kind, ParameterTypeTag tag, String message, String cause) {
        return new Failed(kind, tag, message, cause);
    }

    /**
     * 핸들러 미등록 실패 생성.
     *
     * @param tag 핸들러가 없는 태그
     * @return HANDLER_NOT_FOUND Failed
     */
    public static Failed handlerNotFound(ParameterTypeTag tag) {
        return new Failed(FailureKind.HANDLER_NOT_FOUND, tag, "No handler registered for " + tag.getValue(), null);
    }

    /**
     * 핸들러 미등록 실패인지 확인.
     *
     * @return kind가 HANDLER_NOT_FOUND인 경우 true
     */
    public boolean isHandlerNotFound() {
        return kind == FailureKind.HANDLER_NOT_FOUND;
    }
}
