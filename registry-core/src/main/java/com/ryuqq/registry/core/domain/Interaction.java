package com.ryuqq.registry.core.domain;

import com.ryuqq.registry.core.model.Address;
import com.ryuqq.registry.core.model.Payload;

/**
 * 엔티티 간 상호작용 로그 항목.
 *
 * <p>sourceIdentifier와 destinationIdentifier는 DID 또는 VIN 문자열입니다.
 * sequence는 로그 내 위치(0부터)이며 제출 순서와 동일합니다.</p>
 *
 * @param sequence 로그 위치
 * @param source 발신 주소
 * @param destination 수신 주소
 * @param sourceIdentifier 발신 식별자 (DID 또는 VIN)
 * @param destinationIdentifier 수신 식별자 (DID 또는 VIN)
 * @param interactionType 유형 태그 (예: DATA_REQUEST, V2I_ALERT)
 * @param payload 불투명 페이로드
 * @param timestamp 기록 시각 (epoch seconds)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record Interaction(
    long sequence,
    Address source,
    Address destination,
    String sourceIdentifier,
    String destinationIdentifier,
    String interactionType,
    Payload payload,
    long timestamp
) {

    public Interaction {
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be non-negative (current: " + sequence + ")");
        }
        if (source == null || destination == null) {
            throw new IllegalArgumentException("source and destination cannot be null");
        }
        if (sourceIdentifier == null || destinationIdentifier == null || interactionType == null) {
            throw new IllegalArgumentException("identifiers and interactionType cannot be null");
        }
        payload = payload == null ? Payload.empty() : payload;
    }

    /**
     * 식별자가 발신 또는 수신 측에 해당하는지 확인.
     */
    public boolean involves(String identifier) {
        return sourceIdentifier.equals(identifier) || destinationIdentifier.equals(identifier);
    }

    /**
     * 순서 없는 쌍 {a, b}가 이 상호작용의 발신/수신과 일치하는지 확인.
     */
    public boolean connects(String a, String b) {
        return (sourceIdentifier.equals(a) && destinationIdentifier.equals(b))
            || (sourceIdentifier.equals(b) && destinationIdentifier.equals(a));
    }
}
