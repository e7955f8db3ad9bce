package com.ryuqq.registry.core.contract;

import java.util.UUID;

/**
 * 제출된 Command의 고유 식별자.
 *
 * <p>러너가 반환하는 Outcome과 제출 요청을 연결하는 데 사용됩니다.</p>
 *
 * <p><strong>유효성 검증:</strong></p>
 * <ul>
 *   <li>null 또는 빈 문자열 불가</li>
 *   <li>길이: 1~255자</li>
 *   <li>패턴: 영숫자, 하이픈(-), 언더스코어(_)만 허용</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class CommandId {

    private final String value;

    private CommandId(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("CommandId cannot be null or blank");
        }
        if (value.length() > 255) {
            throw new IllegalArgumentException("CommandId length cannot exceed 255 characters");
        }
        if (!value.matches("^[a-zA-Z0-9\\-_]+$")) {
            throw new IllegalArgumentException("CommandId contains invalid characters. Only alphanumeric, hyphen, and underscore are allowed");
        }
        this.value = value;
    }

    /**
     * CommandId 생성.
     *
     * @param value CommandId 값
     * @return CommandId 인스턴스
     * @throws IllegalArgumentException 유효하지 않은 값인 경우
     */
    public static CommandId of(String value) {
        return new CommandId(value);
    }

    /**
     * 무작위 UUID 기반 CommandId 생성.
     *
     * @return 새 CommandId
     */
    public static CommandId random() {
        return new CommandId(UUID.randomUUID().toString());
    }

    public String getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CommandId that = (CommandId) o;
        return value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return value.hashCode();
    }

    @Override
    public String toString() {
        return "CommandId{" + value + '}';
    }
}
