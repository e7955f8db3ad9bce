package com.ryuqq.registry.core.model;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * 상호작용에 첨부되는 불투명 바이트 데이터.
 *
 * <p>레지스트리는 Payload의 내용을 해석하지 않습니다. 직렬화 형식(JSON, CBOR,
 * 암호화된 DIDComm 메시지 등)은 호출자가 선택합니다.</p>
 *
 * <p><strong>불변성:</strong> 생성 및 조회 시 방어적 복사를 수행합니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class Payload {

    private static final Payload EMPTY = new Payload(new byte[0]);

    private final byte[] value;

    private Payload(byte[] value) {
        this.value = value;
    }

    /**
     * Payload 생성.
     *
     * @param value 바이트 배열 (null이면 빈 Payload)
     * @return Payload 인스턴스
     */
    public static Payload of(byte[] value) {
        if (value == null || value.length == 0) {
            return EMPTY;
        }
        return new Payload(value.clone());
    }

    /**
     * UTF-8 문자열로부터 Payload 생성.
     *
     * @param value 문자열 (null이면 빈 Payload)
     * @return Payload 인스턴스
     */
    public static Payload ofUtf8(String value) {
        return value == null ? EMPTY : of(value.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * 빈 Payload.
     *
     * @return 빈 Payload 인스턴스
     */
    public static Payload empty() {
        return EMPTY;
    }

    /**
     * 바이트 배열 복사본 조회.
     *
     * @return Payload 바이트 (복사본)
     */
    public byte[] getValue() {
        return value.clone();
    }

    /**
     * UTF-8 문자열로 해석.
     *
     * @return 디코딩된 문자열
     */
    public String asUtf8() {
        return new String(value, StandardCharsets.UTF_8);
    }

    public int size() {
        return value.length;
    }

    public boolean isEmpty() {
        return value.length == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Payload payload = (Payload) o;
        return Arrays.equals(value, payload.value);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(value);
    }

    @Override
    public String toString() {
        return "Payload{" + value.length + " bytes}";
    }
}
