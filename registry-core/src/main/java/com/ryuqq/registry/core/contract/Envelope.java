package com.ryuqq.registry.core.contract;

import com.ryuqq.registry.core.model.Address;

/**
 * Command 실행을 위한 봉투 (Envelope).
 *
 * <p>Envelope은 Command에 CommandId, 호출자 주소, 수락 시각을 더한
 * 완전한 실행 컨텍스트입니다. 호출자는 트랜잭션 발신자에 해당하며
 * 모든 권한 검사의 기준이 됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <pre>
 * Envelope envelope = Envelope.now(
 *     CommandId.random(),
 *     Address.of("0xA11CE"),
 *     new Command.TransferOwnership(Vin.of("VIN123"), Address.of("0xB0B"))
 * );
 * </pre>
 *
 * @param commandId Command 고유 식별자
 * @param caller 호출자 주소
 * @param command 실행할 명령
 * @param acceptedAt 요청 수락 시각 (epoch millis)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record Envelope(
    CommandId commandId,
    Address caller,
    Command command,
    long acceptedAt
) {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException 필수 필드가 null이거나 acceptedAt이 음수인 경우
     */
    public Envelope {
        if (commandId == null) {
            throw new IllegalArgumentException("commandId cannot be null");
        }
        if (caller == null) {
            throw new IllegalArgumentException("caller cannot be null");
        }
        if (command == null) {
            throw new IllegalArgumentException("command cannot be null");
        }
        if (acceptedAt < 0) {
            throw new IllegalArgumentException("acceptedAt must be non-negative (current: " + acceptedAt + ")");
        }
    }

    public static Envelope of(CommandId commandId, Address caller, Command command, long acceptedAt) {
        return new Envelope(commandId, caller, command, acceptedAt);
    }

    /**
     * 현재 시각으로 Envelope 생성.
     *
     * @param commandId Command ID
     * @param caller 호출자 주소
     * @param command Command
     * @return 생성된 Envelope
     */
    public static Envelope now(CommandId commandId, Address caller, Command command) {
        return new Envelope(commandId, caller, command, System.currentTimeMillis());
    }
}
