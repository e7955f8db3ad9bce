package com.ryuqq.registry.core.domain;

import com.ryuqq.registry.core.model.Address;
import com.ryuqq.registry.core.model.CredentialId;
import com.ryuqq.registry.core.model.Did;

/**
 * Verifiable Credential. 한 번 기록되면 수정, 삭제할 수 없습니다.
 *
 * <p>issuer는 인자로 받은 issuerDid가 아니라 실제 트랜잭션 발신자 주소입니다.</p>
 *
 * @param credentialId 자격증명 ID (write-once 키)
 * @param issuer 발급 트랜잭션 발신자 주소
 * @param subjectDid 주체 DID
 * @param data 직렬화된 자격증명 데이터
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record Credential(
    CredentialId credentialId,
    Address issuer,
    Did subjectDid,
    String data
) {

    public Credential {
        if (credentialId == null || issuer == null || subjectDid == null) {
            throw new IllegalArgumentException("credentialId, issuer and subjectDid cannot be null");
        }
        if (data == null) {
            throw new IllegalArgumentException("data cannot be null");
        }
    }
}
