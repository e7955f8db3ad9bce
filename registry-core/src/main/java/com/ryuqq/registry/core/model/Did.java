package com.ryuqq.registry.core.model;

import com.ryuqq.registry.core.error.ReasonCode;
import com.ryuqq.registry.core.error.ValidationException;

/**
 * 탈중앙 식별자 (Decentralized Identifier).
 *
 * <p>DID는 {@code did:<method>:<method-specific-id>} 형식의 자기 기술적 식별자이며,
 * 등록 시 하나의 주소(또는 차량 VIN)에 영구적으로 바인딩됩니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>did:ethr:0x5B38Da6a701c568545dCfcB03FcB875f56beddC4</li>
 *   <li>did:alice:e</li>
 * </ul>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>{@code did:} 접두사 필수, method 부분 비어있으면 안 됨</li>
 *   <li>길이: 최대 512자, 공백 불가</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class Did implements Comparable<Did> {

    private static final String PREFIX = "did:";

    private final String value;

    private Did(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(ReasonCode.EMPTY_FIELD, "DID cannot be null or blank");
        }
        if (value.length() > 512) {
            throw new ValidationException(ReasonCode.MALFORMED_IDENTIFIER, "DID length cannot exceed 512 characters");
        }
        if (!value.startsWith(PREFIX) || value.indexOf(':', PREFIX.length()) <= PREFIX.length()) {
            throw new ValidationException(ReasonCode.MALFORMED_IDENTIFIER, "Invalid DID format, expected did:<method>:<id>: " + value);
        }
        if (value.chars().anyMatch(Character::isWhitespace)) {
            throw new ValidationException(ReasonCode.MALFORMED_IDENTIFIER, "DID cannot contain whitespace: " + value);
        }
        this.value = value;
    }

    /**
     * DID 생성.
     *
     * @param value DID 문자열
     * @return Did 인스턴스
     * @throws ValidationException 형식이 올바르지 않은 경우
     */
    public static Did of(String value) {
        return new Did(value);
    }

    /**
     * 문자열이 DID 형식인지 확인 (예외 없이).
     *
     * <p>상호작용 로그의 식별자처럼 DID 또는 VIN이 올 수 있는 필드를 분기할 때 사용합니다.</p>
     *
     * @param value 검사할 문자열
     * @return DID 형식이면 true
     */
    public static boolean isDid(String value) {
        return value != null && value.startsWith(PREFIX);
    }

    /**
     * DID method 조회 (예: "ethr", "key").
     *
     * @return method 문자열
     */
    public String getMethod() {
        return value.substring(PREFIX.length(), value.indexOf(':', PREFIX.length()));
    }

    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(Did other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Did did = (Did) o;
        return value.equals(did.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Did{" + value + '}';
    }
}
