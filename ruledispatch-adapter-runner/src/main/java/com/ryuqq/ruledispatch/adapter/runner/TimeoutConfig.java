package com.ryuqq.ruledispatch.adapter.runner;

import com.ryuqq.ruledispatch.core.model.ParameterTypeTag;

import java.util.HashMap;
import java.util.Map;

/**
 * 핸들러 타임아웃 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>defaultTimeoutMs: 기본 타임아웃 (기본 0 = 타임아웃 없음)</li>
 *   <li>overrides: 태그별 타임아웃 (기본값보다 우선)</li>
 * </ul>
 *
 * <p><strong>튜닝 가이드:</strong></p>
 * <ul>
 *   <li>외부 서비스를 호출하는 룰: 명시적 override (예: 500ms)</li>
 *   <li>순수 계산 룰: 0 유지 (호출 스레드에서 동기 실행, 스레드 전환 비용 없음)</li>
 * </ul>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 * @param defaultTimeoutMs 기본 타임아웃 (밀리초, 0 이상)
 * @param overrides 태그별 타임아웃 (밀리초, 0 이상)
 */
public record TimeoutConfig(
    long defaultTimeoutMs,
    Map<ParameterTypeTag, Long> overrides
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: defaultTimeoutMs=0 (타임아웃 없음), overrides 없음</p>
     */
    public TimeoutConfig() {
        this(0, Map.of());
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public TimeoutConfig {
        if (defaultTimeoutMs < 0) {
            throw new IllegalArgumentException(
                "defaultTimeoutMs must be non-negative (current: " + defaultTimeoutMs + ")"
            );
        }
        if (overrides == null) {
            throw new IllegalArgumentException("overrides cannot be null");
        }
        for (Map.Entry<ParameterTypeTag, Long> entry : overrides.entrySet()) {
            if (entry.getKey() == null) {
                throw new IllegalArgumentException("override tag cannot be null");
            }
            if (entry.getValue() == null || entry.getValue() < 0) {
                throw new IllegalArgumentException(
                    "override for " + entry.getKey() + " must be non-negative (current: " + entry.getValue() + ")"
                );
            }
        }
        overrides = Map.copyOf(overrides);
    }

    /**
     * defaultTimeoutMs만 변경한 새 인스턴스 생성.
     */
    public TimeoutConfig withDefaultTimeoutMs(long defaultTimeoutMs) {
        return new TimeoutConfig(defaultTimeoutMs, overrides);
    }

    /**
     * 태그 하나의 타임아웃을 추가(또는 교체)한 새 인스턴스 생성.
     */
    public TimeoutConfig withOverride(ParameterTypeTag tag, long timeoutMs) {
        if (tag == null) {
            throw new IllegalArgumentException("tag cannot be null");
        }
        Map<ParameterTypeTag, Long> copy = new HashMap<>(overrides);
        copy.put(tag, timeoutMs);
        return new TimeoutConfig(defaultTimeoutMs, copy);
    }

    /**
     * 태그에 적용될 타임아웃 조회.
     *
     * @param tag 파라미터 태그
     * @return override가 있으면 override, 없으면 defaultTimeoutMs
     */
    public long timeoutFor(ParameterTypeTag tag) {
        Long override = overrides.get(tag);
        return override != null ? override : defaultTimeoutMs;
    }
}
