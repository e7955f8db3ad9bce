package com.ryuqq.registry.core.outcome;

import com.ryuqq.registry.core.contract.CommandId;

/**
 * 성공 결과.
 *
 * <p>Command가 검증을 통과하고 커밋되었음을 나타냅니다.</p>
 *
 * @param commandId Command ID
 * @param message 성공 메시지 (선택, null 가능)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record Ok(
    CommandId commandId,
    String message
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException commandId가 null인 경우
     */
    public Ok {
        if (commandId == null) {
            throw new IllegalArgumentException("commandId cannot be null");
        }
        // message는 null 허용
    }

    /**
     * 메시지 없이 성공 결과 생성.
     *
     * @param commandId Command ID
     * @return Ok 인스턴스
     */
    public static Ok of(CommandId commandId) {
        return new Ok(commandId, null);
    }
}
