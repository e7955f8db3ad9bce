package com.ryuqq.registry.core.model;

import com.ryuqq.registry.core.error.ReasonCode;
import com.ryuqq.registry.core.error.ValidationException;

import java.util.Locale;

/**
 * Principal의 역할.
 *
 * <p>주소 하나는 정확히 하나의 역할만 가집니다. 권한 검사는 이 enum 값에 대한
 * 가드 함수로 표현되며, 상속 계층을 사용하지 않습니다.</p>
 *
 * <p>{@link #ordinal()} 순서는 원장의 uint8 enum 값과 일치합니다
 * (INDIVIDUAL=0 ... CAR=5).</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public enum Role {

    INDIVIDUAL("Individual"),

    MECHANIC("Mechanic"),

    INSURANCE_COMPANY("Insurance Provider"),

    ROADSIDE_UNIT("Roadside Unit"),

    VEHICLE_MANUFACTURER("Vehicle Manufacturer"),

    /**
     * 독립 엔티티로 등록된 차량 (차량 자체 지갑 보유).
     */
    CAR("Car");

    private final String displayName;

    Role(String displayName) {
        this.displayName = displayName;
    }

    /**
     * 화면 표시용 이름.
     *
     * @return 표시 이름 (예: "Insurance Provider")
     */
    public String displayName() {
        return displayName;
    }

    /**
     * 이름으로 Role 조회.
     *
     * <p>enum 상수명, 표시 이름 모두 허용하며 대소문자와 공백/밑줄 차이를 무시합니다.
     * 예: "insurance provider", "INSURANCE_COMPANY", "Roadside Unit".</p>
     *
     * @param name 역할 이름
     * @return Role
     * @throws ValidationException 일치하는 역할이 없는 경우
     */
    public static Role fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new ValidationException(ReasonCode.EMPTY_FIELD, "Role name cannot be null or blank");
        }
        String normalized = normalize(name);
        for (Role role : values()) {
            if (normalize(role.name()).equals(normalized) || normalize(role.displayName).equals(normalized)) {
                return role;
            }
        }
        throw new ValidationException(ReasonCode.INVALID_ROLE, "Unknown role: " + name);
    }

    private static String normalize(String value) {
        return value.trim().replace(' ', '_').toUpperCase(Locale.ROOT);
    }
}
