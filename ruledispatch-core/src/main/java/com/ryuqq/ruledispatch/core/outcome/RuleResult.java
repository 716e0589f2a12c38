package com.ryuqq.ruledispatch.core.outcome;

/**
 * 하나의 룰 실행 결과.
 *
 * <p>핸들러가 생성하고, Batch Executor 또는 호출자가 소비합니다. 생성 후 변경되지 않습니다.</p>
 *
 * <p><strong>불변식:</strong></p>
 * <ul>
 *   <li>성공 결과: errorCode == 0, failureReason == null</li>
 *   <li>실패 결과: failureReason != null, message는 null 또는 빈 문자열 불가</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * RuleResult ok = RuleResult.passed();
 * RuleResult veto = RuleResult.rejected(4001, "Candidate exceeds weekly hour limit");
 * RuleResult invalid = RuleResult.failed(4220, "Shift end precedes start", FailureReason.VALIDATION);
 * </pre>
 *
 * @param success 성공 여부
 * @param message 사용자에게 보여줄 메시지 (성공 시 null 가능)
 * @param errorCode 숫자 오류 코드 (성공 시 0)
 * @param failureReason 실패 사유 (성공 시 null)
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public record RuleResult(
    boolean success,
    String message,
    int errorCode,
    FailureReason failureReason
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 성공/실패 불변식을 위반한 경우
     */
    public RuleResult {
        if (success) {
            if (errorCode != 0) {
                throw new IllegalArgumentException("errorCode must be 0 for a successful result (current: " + errorCode + ")");
            }
            if (failureReason != null) {
                throw new IllegalArgumentException("failureReason must be null for a successful result (current: " + failureReason + ")");
            }
        } else {
            if (failureReason == null) {
                throw new IllegalArgumentException("failureReason cannot be null for a failed result");
            }
            if (message == null || message.isBlank()) {
                throw new IllegalArgumentException("message cannot be null or blank for a failed result");
            }
        }
    }

    /**
     * 메시지 없는 성공 결과 생성.
     *
     * @return 성공 RuleResult
     */
    public static RuleResult passed() {
        return new RuleResult(true, null, 0, null);
    }

    /**
     * 메시지 포함 성공 결과 생성.
     *
     * @param message 성공 메시지
     * @return 성공 RuleResult
     */
    public static RuleResult passed(String message) {
        return new RuleResult(true, message, 0, null);
    }

    /**
     * 비즈니스 룰 거부 결과 생성.
     *
     * @param errorCode 오류 코드
     * @param message 거부 사유
     * @return failureReason이 {@link FailureReason#BUSINESS_RULE}인 실패 RuleResult
     * @throws IllegalArgumentException message가 null이거나 빈 문자열인 경우
     */
    public static RuleResult rejected(int errorCode, String message) {
        return new RuleResult(false, message, errorCode, FailureReason.BUSINESS_RULE);
    }

    /**
     * 사유를 지정한 실패 결과 생성.
     *
     * @param errorCode 오류 코드
     * @param message 실패 메시지
     * @param failureReason 실패 사유
     * @return 실패 RuleResult
     * @throws IllegalArgumentException message 또는 failureReason이 유효하지 않은 경우
     */
    public static RuleResult failed(int errorCode, String message, FailureReason failureReason) {
        return new RuleResult(false, message, errorCode, failureReason);
    }

    /**
     * 의도된 비즈니스 룰 거부인지 확인.
     *
     * @return 실패이면서 사유가 BUSINESS_RULE인 경우 true
     */
    public boolean isBusinessRuleRejection() {
        return !success && failureReason == FailureReason.BUSINESS_RULE;
    }
}
