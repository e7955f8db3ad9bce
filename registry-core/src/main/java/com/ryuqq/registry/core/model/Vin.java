package com.ryuqq.registry.core.model;

import com.ryuqq.registry.core.error.ReasonCode;
import com.ryuqq.registry.core.error.ValidationException;

/**
 * 차량 식별 번호 (Vehicle Identification Number).
 *
 * <p>VIN은 차량 레코드의 전역 고유 키이며, 등록 후 변경되지 않습니다.
 * 실제 VIN은 17자이지만 레지스트리는 형식을 강제하지 않고 불투명 키로 취급합니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~64자, 공백 불가</li>
 *   <li>{@code did:} 접두사 불가 (상호작용 식별자에서 DID와 구분)</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class Vin implements Comparable<Vin> {

    private final String value;

    private Vin(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(ReasonCode.EMPTY_FIELD, "VIN cannot be null or blank");
        }
        if (value.length() > 64) {
            throw new ValidationException(ReasonCode.MALFORMED_IDENTIFIER, "VIN length cannot exceed 64 characters");
        }
        if (value.chars().anyMatch(Character::isWhitespace) || Did.isDid(value)) {
            throw new ValidationException(ReasonCode.MALFORMED_IDENTIFIER, "Invalid VIN: " + value);
        }
        this.value = value;
    }

    /**
     * VIN 생성.
     *
     * @param value VIN 문자열 (예: 1HGCM82633A004352)
     * @return Vin 인스턴스
     * @throws ValidationException 유효하지 않은 값인 경우
     */
    public static Vin of(String value) {
        return new Vin(value);
    }

    public String getValue() {
        return value;
    }

    @Override
    public int compareTo(Vin other) {
        return value.compareTo(other.value);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Vin vin = (Vin) o;
        return value.equals(vin.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "Vin{" + value + '}';
    }
}
