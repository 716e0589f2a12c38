package com.ryuqq.ruledispatch.core.model;

/**
 * 룰 실행 파라미터.
 *
 * <p>각 구체 구현체는 하나의 룰이 필요로 하는 값(후보자 ID, 기간, 적용 여부 등)을 담고,
 * {@link #tag()}로 자신의 종류를 밝힙니다. 하나의 태그에는 정확히 하나의 핸들러가 등록됩니다.</p>
 *
 * <p><strong>구현 가이드:</strong></p>
 * <ul>
 *   <li>불변 객체(record 권장)로 구현</li>
 *   <li>생성자 또는 정적 팩토리에서 모든 필드를 검증 (리플렉션 기반 생성 금지)</li>
 *   <li>{@link #tag()}는 항상 같은 값을 반환 (보통 상수)</li>
 * </ul>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * public record ShiftOverlapParameters(String candidateId, LocalDate from, LocalDate to)
 *         implements RuleParameters {
 *
 *     public static final ParameterTypeTag TAG = ParameterTypeTag.of("SHIFT_OVERLAP");
 *
 *     {@literal @}Override
 *     public ParameterTypeTag tag() {
 *         return TAG;
 *     }
 * }
 * </pre>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public interface RuleParameters {

    /**
     * 파라미터 종류 태그 조회.
     *
     * @return 이 파라미터의 태그 (null 불가)
     */
    ParameterTypeTag tag();
}
