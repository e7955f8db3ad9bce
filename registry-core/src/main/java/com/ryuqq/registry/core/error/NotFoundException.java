package com.ryuqq.registry.core.error;

/**
 * 참조한 주소, DID, VIN, 자격증명이 존재하지 않는 경우.
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class NotFoundException extends RegistryException {

    /**
     * 생성자.
     *
     * @param reason 사유 코드 (분류가 {@link ErrorKind#NOT_FOUND}여야 함)
     * @param message 오류 메시지
     * @throws IllegalArgumentException reason의 분류가 일치하지 않는 경우
     */
    public NotFoundException(ReasonCode reason, String message) {
        super(ErrorKind.NOT_FOUND, reason, message);
    }
}
