package com.ryuqq.registry.core.error;

/**
 * 안정적인 오류 사유 코드.
 *
 * <p>코드 문자열은 외부 호출자(HTTP 파사드, 지갑 시뮬레이터)가 분기에 사용하므로
 * 한 번 공개한 값은 변경하지 않습니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public enum ReasonCode {

    // Validation
    EMPTY_FIELD("VAL-001", ErrorKind.VALIDATION),
    MALFORMED_IDENTIFIER("VAL-002", ErrorKind.VALIDATION),
    DUPLICATE_DID_PAIR("VAL-003", ErrorKind.VALIDATION),
    INVALID_ROLE("VAL-004", ErrorKind.VALIDATION),
    TARGET_NOT_REGISTERED("VAL-005", ErrorKind.VALIDATION),
    INVALID_DID("VAL-006", ErrorKind.VALIDATION),
    UNRESOLVABLE_IDENTIFIER("VAL-007", ErrorKind.VALIDATION),
    INVALID_PERIOD("VAL-008", ErrorKind.VALIDATION),
    SIZE_LIMIT_EXCEEDED("VAL-009", ErrorKind.VALIDATION),
    INVALID_YEAR("VAL-010", ErrorKind.VALIDATION),
    VEHICLE_WITHOUT_OWNER("VAL-011", ErrorKind.VALIDATION),
    VEHICLE_NOT_REGISTERED("VAL-012", ErrorKind.VALIDATION),

    // Authorization
    NOT_REGISTERED("AUTH-001", ErrorKind.AUTHORIZATION),
    ROLE_REQUIRED("AUTH-002", ErrorKind.AUTHORIZATION),
    NOT_VEHICLE_OWNER("AUTH-003", ErrorKind.AUTHORIZATION),
    MECHANIC_NOT_AUTHORIZED("AUTH-004", ErrorKind.AUTHORIZATION),
    NOT_DID_CONTROLLER("AUTH-005", ErrorKind.AUTHORIZATION),

    // Not found
    DID_NOT_FOUND("NF-001", ErrorKind.NOT_FOUND),
    PRINCIPAL_NOT_FOUND("NF-002", ErrorKind.NOT_FOUND),
    VEHICLE_NOT_FOUND("NF-003", ErrorKind.NOT_FOUND),
    CREDENTIAL_NOT_FOUND("NF-004", ErrorKind.NOT_FOUND),
    POLICY_NOT_FOUND("NF-005", ErrorKind.NOT_FOUND),
    DOCUMENT_NOT_FOUND("NF-006", ErrorKind.NOT_FOUND),
    ROADSIDE_UNIT_NOT_FOUND("NF-007", ErrorKind.NOT_FOUND),

    // Conflict
    ADDRESS_ALREADY_REGISTERED("CON-001", ErrorKind.CONFLICT),
    VIN_ALREADY_REGISTERED("CON-002", ErrorKind.CONFLICT),
    CREDENTIAL_ALREADY_EXISTS("CON-003", ErrorKind.CONFLICT),
    DID_ALREADY_REGISTERED("CON-004", ErrorKind.CONFLICT);

    private final String code;
    private final ErrorKind kind;

    ReasonCode(String code, ErrorKind kind) {
        this.code = code;
        this.kind = kind;
    }

    /**
     * 외부 공개용 코드 (예: VAL-001).
     *
     * @return 코드 문자열
     */
    public String code() {
        return code;
    }

    /**
     * 이 사유가 속한 오류 분류.
     *
     * @return ErrorKind
     */
    public ErrorKind kind() {
        return kind;
    }
}
