package com.ryuqq.registry.core.model;

import com.ryuqq.registry.core.error.ReasonCode;
import com.ryuqq.registry.core.error.ValidationException;

/**
 * Verifiable Credential 식별자.
 *
 * <p>CredentialId는 한 번만 기록(write-once)되는 자격증명의 키입니다.
 * 보통 {@code urn:uuid:...} 형태를 사용합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class CredentialId {

    private final String value;

    private CredentialId(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(ReasonCode.EMPTY_FIELD, "CredentialId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new ValidationException(ReasonCode.MALFORMED_IDENTIFIER, "CredentialId length cannot exceed 255 characters");
        }
        this.value = value;
    }

    /**
     * CredentialId 생성.
     *
     * @param value 식별자 값
     * @return CredentialId 인스턴스
     * @throws ValidationException 유효하지 않은 값인 경우
     */
    public static CredentialId of(String value) {
        return new CredentialId(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CredentialId that = (CredentialId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "CredentialId{" + value + '}';
    }
}
