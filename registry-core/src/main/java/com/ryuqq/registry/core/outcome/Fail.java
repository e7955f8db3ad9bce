package com.ryuqq.registry.core.outcome;

/**
 * 실패 결과.
 *
 * <p>가드 위반이나 예기치 않은 오류로 Command가 거부되었음을 나타냅니다.
 * 실패한 Command는 어떤 상태 변경도 남기지 않습니다.</p>
 *
 * <p><strong>예시:</strong></p>
 * <ul>
 *   <li>VAL-001: 필수 필드 누락</li>
 *   <li>AUTH-003: 차량 소유자가 아님</li>
 *   <li>NF-003: 존재하지 않는 VIN</li>
 *   <li>CON-003: 이미 존재하는 자격증명 ID</li>
 *   <li>SYS-001: 예기치 않은 시스템 오류</li>
 * </ul>
 *
 * @param errorCode 오류 코드 (예: VAL-001, CON-002)
 * @param message 오류 메시지
 * @param cause 원인 분류 (예: VALIDATION, null 가능)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record Fail(
    String errorCode,
    String message,
    String cause
) implements Outcome {

    /**
     * Compact Constructor.
     *
     * @throws IllegalArgumentException errorCode 또는 message가 null이거나 빈 문자열인 경우
     */
    public Fail {
        if (errorCode == null || errorCode.isBlank()) {
            throw new IllegalArgumentException("errorCode cannot be null or blank");
        }
        if (message == null || message.isBlank()) {
            throw new IllegalArgumentException("message cannot be null or blank");
        }
        // cause는 null 허용
    }

    public static Fail of(String errorCode, String message, String cause) {
        return new Fail(errorCode, message, cause);
    }

    public static Fail of(String errorCode, String message) {
        return new Fail(errorCode, message, null);
    }
}
