package com.ryuqq.registry.core.model;

import com.ryuqq.registry.core.error.ReasonCode;
import com.ryuqq.registry.core.error.ValidationException;

/**
 * 참여자(Principal, Roadside Unit)의 계정 주소.
 *
 * <p>Address는 트랜잭션 발신자와 소유권 참조에 사용되는 불투명(opaque) 키입니다.
 * 대소문자를 포함한 원본 값 그대로 비교합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 후 값 변경 불가</p>
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>공백 문자 포함 불가</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class Address implements Comparable<Address> {

    private final String value;

    private Address(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(ReasonCode.EMPTY_FIELD, "Address cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new ValidationException(ReasonCode.MALFORMED_IDENTIFIER, "Address length cannot exceed 255 characters");
        }
        if (value.chars().anyMatch(Character::isWhitespace)) {
            throw new ValidationException(ReasonCode.MALFORMED_IDENTIFIER, "Address cannot contain whitespace: " + value);
        }
        this.value = value;
    }

    /**
     * Address 생성.
     *
     * @param value 주소 값 (예: 0x5B38Da6a701c568545dCfcB03FcB875f56beddC4)
     * @return Address 인스턴스
     * @throws ValidationException 유효하지 않은 값인 경우
     */
    public static Address of(String value) {
        return new Address(value);
    }

    /**
     * Address 값 조회.
     *
     * @return 주소 값
     */
    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(Address other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Address address = (Address) o;
        return value.equals(address.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Address{" + value + '}';
    }
}
