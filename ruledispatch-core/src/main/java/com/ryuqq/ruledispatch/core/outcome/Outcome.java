package com.ryuqq.ruledispatch.core.outcome;

/**
 * 룰 한 건의 디스패치 결과.
 *
 * <p>Outcome은 세 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Produced}: 룰이 실행되어 {@link RuleResult}를 생성함 (성공 또는 거부)</li>
 *   <li>{@link Empty}: 룰이 실행되었으나 보고할 내용 없음 (통과로 간주)</li>
 *   <li>{@link Failed}: 인프라/레지스트리 실패 (비즈니스 거부와 구분)</li>
 * </ul>
 *
 * <p>Sealed interface로 정의되어 모든 케이스를 컴파일 타임에 검증합니다.
 * Empty를 성공 Produced로 합치지 않습니다. "룰이 적용되지 않음" 신호가 사라지기 때문입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * if (outcome instanceof Produced produced) {
 *     RuleResult result = produced.result();
 * } else if (outcome instanceof Failed failed) {
 *     log.warn("Rule dispatch failed: {}", failed.kind());
 * }
 * </pre>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Produced, Empty, Failed {

    /**
     * Produced Outcome 생성.
     *
     * @param result 룰 결과
     * @return Produced 인스턴스
     * @throws IllegalArgumentException result가 null인 경우
     */
    static Outcome produced(RuleResult result) {
        return new Produced(result);
    }

    /**
     * Empty Outcome 조회.
     *
     * @return Empty 인스턴스
     */
    static Outcome empty() {
        return Empty.INSTANCE;
    }

    /**
     * 결과가 Produced인지 확인.
     *
     * @return Produced 여부
     */
    default boolean isProduced() {
        return this instanceof Produced;
    }

    /**
     * 결과가 Empty인지 확인.
     *
     * @return Empty 여부
     */
    default boolean isEmpty() {
        return this instanceof Empty;
    }

    /**
     * 결과가 인프라 실패인지 확인.
     *
     * @return Failed 여부
     */
    default boolean isFailed() {
        return this instanceof Failed;
    }
}
