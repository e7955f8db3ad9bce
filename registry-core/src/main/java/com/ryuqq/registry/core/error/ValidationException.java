package com.ryuqq.registry.core.error;

/**
 * 입력이 비어있거나 형식이 잘못되었거나, 대상의 역할이 연산에 맞지 않는 경우.
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class ValidationException extends RegistryException {

    /**
     * 생성자.
     *
     * @param reason 사유 코드 (분류가 {@link ErrorKind#VALIDATION}여야 함)
     * @param message 오류 메시지
     * @throws IllegalArgumentException reason의 분류가 일치하지 않는 경우
     */
    public ValidationException(ReasonCode reason, String message) {
        super(ErrorKind.VALIDATION, reason, message);
    }
}
