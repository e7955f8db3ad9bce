package com.ryuqq.registry.core.error;

/**
 * 이미 등록된 주소, VIN, 자격증명 ID 또는 DID를 다시 등록하려는 경우.
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class ConflictException extends RegistryException {

    /**
     * 생성자.
     *
     * @param reason 사유 코드 (분류가 {@link ErrorKind#CONFLICT}여야 함)
     * @param message 오류 메시지
     * @throws IllegalArgumentException reason의 분류가 일치하지 않는 경우
     */
    public ConflictException(ReasonCode reason, String message) {
        super(ErrorKind.CONFLICT, reason, message);
    }
}
