package com.ryuqq.registry.core.outcome;

/**
 * Command 실행 결과.
 *
 * <p>Outcome은 두 가지 가능한 결과를 나타냅니다:</p>
 * <ul>
 *   <li>{@link Ok}: 커밋 완료</li>
 *   <li>{@link Fail}: 가드 위반 또는 시스템 오류로 거부됨 (상태 변경 없음)</li>
 * </ul>
 *
 * <p>레지스트리는 자동 재시도를 하지 않으므로 재시도 결과 타입은 두지 않습니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public sealed interface Outcome permits Ok, Fail {

    /**
     * 결과가 성공인지 확인.
     *
     * @return 성공 여부
     */
    default boolean isOk() {
        return this instanceof Ok;
    }

    /**
     * 결과가 실패인지 확인.
     *
     * @return 실패 여부
     */
    default boolean isFail() {
        return this instanceof Fail;
    }
}
