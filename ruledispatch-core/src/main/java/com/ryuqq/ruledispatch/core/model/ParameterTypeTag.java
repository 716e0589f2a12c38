package com.ryuqq.ruledispatch.core.model;

import java.util.regex.Pattern;

/**
 * 룰 파라미터 종류 구분자.
 *
 * <p>ParameterTypeTag는 {@link RuleParameters}의 구체 타입을 식별하며,
 * Handler Registry에서 핸들러를 찾는 키로 사용됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>ParameterTypeTag.of("SHIFT_OVERLAP") - 근무 시간 중복 검사</li>
 *   <li>ParameterTypeTag.of("CANDIDATE_ELIGIBILITY") - 후보자 자격 검사</li>
 *   <li>ParameterTypeTag.of("MAX_WEEKLY_HOURS") - 주간 최대 근무 시간 검사</li>
 * </ul>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~64자</li>
 *   <li>패턴: 대문자로 시작, 대문자/숫자/언더스코어만 허용 (예: SHIFT_OVERLAP, RULE_42)</li>
 * </ul>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public final class ParameterTypeTag {

    private static final Pattern VALID_PATTERN = Pattern.compile("^[A-Z][A-Z0-9_]*$");
    private static final int MAX_LENGTH = 64;

    private final String value;

    private ParameterTypeTag(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("ParameterTypeTag cannot be null or blank");
        }
        if (value.length() > MAX_LENGTH) {
            throw new IllegalArgumentException("ParameterTypeTag length cannot exceed " + MAX_LENGTH + " characters");
        }
        if (!VALID_PATTERN.matcher(value).matches()) {
            throw new IllegalArgumentException(
                "ParameterTypeTag must start with an uppercase letter and contain only uppercase letters, digits and underscores (current: " + value + ")"
            );
        }
        this.value = value;
    }

    /**
     * ParameterTypeTag 생성.
     *
     * @param value 태그 값 (예: SHIFT_OVERLAP)
     * @return ParameterTypeTag 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static ParameterTypeTag of(String value) {
        return new ParameterTypeTag(value);
    }

    /**
     * 태그 값 조회.
     *
     * @return 태그 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        ParameterTypeTag that = (ParameterTypeTag) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "ParameterTypeTag{" + value + '}';
    }
}
