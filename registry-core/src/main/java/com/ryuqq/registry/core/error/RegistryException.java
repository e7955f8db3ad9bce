package com.ryuqq.registry.core.error;

/**
 * 레지스트리 연산 실패의 공통 상위 타입.
 *
 * <p>모든 변경 연산은 원자적입니다. 이 예외가 발생하면 해당 연산의 어떤 쓰기도
 * 커밋되지 않았고, 어떤 알림도 발행되지 않았음을 보장합니다.</p>
 *
 * <p>구체 타입: {@link ValidationException}, {@link AuthorizationException},
 * {@link NotFoundException}, {@link ConflictException}.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public abstract class RegistryException extends RuntimeException {

    private final ReasonCode reason;

    /**
     * 생성자.
     *
     * @param expectedKind 하위 타입이 허용하는 오류 분류
     * @param reason 사유 코드
     * @param message 오류 메시지
     * @throws IllegalArgumentException reason이 null이거나 분류가 일치하지 않는 경우
     */
    protected RegistryException(ErrorKind expectedKind, ReasonCode reason, String message) {
        super(message);
        if (reason == null) {
            throw new IllegalArgumentException("reason cannot be null");
        }
        if (reason.kind() != expectedKind) {
            throw new IllegalArgumentException(
                String.format("Reason %s belongs to %s, not %s", reason, reason.kind(), expectedKind));
        }
        this.reason = reason;
    }

    public ReasonCode getReason() {
        return reason;
    }

    public ErrorKind getKind() {
        return reason.kind();
    }

    /**
     * 외부 공개용 오류 코드.
     *
     * @return 코드 문자열 (예: AUTH-003)
     */
    public String getCode() {
        return reason.code();
    }
}
