package com.ryuqq.registry.core.error;

/**
 * 호출자에게 필요한 역할이나 관계(차량 소유자, 인가된 정비사, DID 컨트롤러)가 없는 경우.
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class AuthorizationException extends RegistryException {

    /**
     * 생성자.
     *
     * @param reason 사유 코드 (분류가 {@link ErrorKind#AUTHORIZATION}여야 함)
     * @param message 오류 메시지
     * @throws IllegalArgumentException reason의 분류가 일치하지 않는 경우
     */
    public AuthorizationException(ReasonCode reason, String message) {
        super(ErrorKind.AUTHORIZATION, reason, message);
    }
}
