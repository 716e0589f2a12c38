package com.ryuqq.ruledispatch.core.registry;

/**
 * Handler Registry의 생명주기 상태.
 *
 * <p><strong>상태 전이 규칙:</strong></p>
 * <ul>
 *   <li>BUILDING → SEALED (봉인, 한 번만)</li>
 *   <li><strong>역방향 전이 불가 (불변식)</strong></li>
 * </ul>
 *
 * <pre>
 * BUILDING  (register 허용, resolve 불가)
 *    │
 *    ▼ seal()
 * SEALED    (resolve만 허용, 읽기 전용)
 * </pre>
 *
 * @author RuleDispatch Team
 * @since 1.0.0
 */
public enum RegistryState {

    /**
     * 등록 단계 (쓰기 가능).
     */
    BUILDING,

    /**
     * 봉인됨 (읽기 전용).
     */
    SEALED;

    /**
     * 핸들러 등록이 허용되는 상태인지 확인.
     *
     * @return BUILDING인 경우 true
     */
    public boolean acceptsRegistration() {
        return this == BUILDING;
    }
}
