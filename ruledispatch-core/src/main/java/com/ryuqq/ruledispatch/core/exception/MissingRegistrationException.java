package com.ryuqq.ruledispatch.core.exception;

import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;

import java.util.List;
import java.util.stream.Collectors;

/**
 * 봉인 시점 사전 검증에서 필수 태그의 핸들러가 누락된 경우 발생.
 *
 * <p>첫 요청 시점이 아니라 기동 시점에 누락을 드러냅니다.</p>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public class MissingRegistrationException extends RuleDispatchException {

    private final List<ParameterTypeTag> missingTags;

    /**
     * 생성자.
     *
     * @param missingTags 핸들러가 없는 필수 태그 목록 (비어 있으면 안 됨)
     */
    public MissingRegistrationException(List<ParameterTypeTag> missingTags) {
        super("Missing handler registrations: " + missingTags.stream()
            .map(ParameterTypeTag::getValue)
            .collect(Collectors.joining(", ")), missingTags.get(0));
        this.missingTags = List.copyOf(missingTags);
    }

    /**
     * 누락된 태그 목록 조회.
     *
     * @return 불변 태그 목록
     */
    public List<ParameterTypeTag> getMissingTags() {
        return missingTags;
    }
}
