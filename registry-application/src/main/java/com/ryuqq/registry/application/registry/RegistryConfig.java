package com.ryuqq.registry.application.registry;

/**
 * LedgerRegistry 설정 (불변 record).
 *
 * <p><strong>설정 항목:</strong></p>
 * <ul>
 *   <li>maxNameLength: 이름, 위치, 제조사, 모델, 상호작용 유형의 최대 길이 (기본 256)</li>
 *   <li>maxDocumentLength: DID 문서, 차량 설정, 정비 설명의 최대 길이 (기본 65536)</li>
 *   <li>maxCredentialLength: 자격증명 데이터의 최대 길이 (기본 65536)</li>
 *   <li>maxPayloadBytes: 상호작용 페이로드의 최대 바이트 수 (기본 65536)</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 * @param maxNameLength 짧은 문자열 필드 최대 길이 (양수여야 함)
 * @param maxDocumentLength 문서형 필드 최대 길이 (양수여야 함)
 * @param maxCredentialLength 자격증명 데이터 최대 길이 (양수여야 함)
 * @param maxPayloadBytes 페이로드 최대 바이트 수 (0 이상이어야 함)
 */
public record RegistryConfig(
    int maxNameLength,
    int maxDocumentLength,
    int maxCredentialLength,
    int maxPayloadBytes
) {

    /**
     * 기본 설정 생성자.
     *
     * <p>기본값: maxNameLength=256, maxDocumentLength=65536,
     * maxCredentialLength=65536, maxPayloadBytes=65536</p>
     */
    public RegistryConfig() {
        this(256, 65536, 65536, 65536);
    }

    /**
     * Compact constructor (유효성 검증).
     *
     * @throws IllegalArgumentException 파라미터 검증 실패 시
     */
    public RegistryConfig {
        if (maxNameLength <= 0) {
            throw new IllegalArgumentException(
                "maxNameLength must be positive (current: " + maxNameLength + ")"
            );
        }
        if (maxDocumentLength <= 0) {
            throw new IllegalArgumentException(
                "maxDocumentLength must be positive (current: " + maxDocumentLength + ")"
            );
        }
        if (maxCredentialLength <= 0) {
            throw new IllegalArgumentException(
                "maxCredentialLength must be positive (current: " + maxCredentialLength + ")"
            );
        }
        if (maxPayloadBytes < 0) {
            throw new IllegalArgumentException(
                "maxPayloadBytes must be non-negative (current: " + maxPayloadBytes + ")"
            );
        }
    }

    public RegistryConfig withMaxNameLength(int maxNameLength) {
        return new RegistryConfig(maxNameLength, maxDocumentLength, maxCredentialLength, maxPayloadBytes);
    }

    public RegistryConfig withMaxDocumentLength(int maxDocumentLength) {
        return new RegistryConfig(maxNameLength, maxDocumentLength, maxCredentialLength, maxPayloadBytes);
    }

    public RegistryConfig withMaxCredentialLength(int maxCredentialLength) {
        return new RegistryConfig(maxNameLength, maxDocumentLength, maxCredentialLength, maxPayloadBytes);
    }

    public RegistryConfig withMaxPayloadBytes(int maxPayloadBytes) {
        return new RegistryConfig(maxNameLength, maxDocumentLength, maxCredentialLength, maxPayloadBytes);
    }
}
