package com.ryuqq.registry.core.domain;

import com.ryuqq.registry.core.model.Address;
import com.ryuqq.registry.core.model.Did;

/**
 * DID 문서.
 *
 * <p>document는 직렬화된 불투명 페이로드(보통 W3C DID Document JSON)입니다.
 * controller가 설정된 이후에는 해당 controller만 문서를 갱신하거나 폐기할 수 있습니다.</p>
 *
 * @param did 대상 DID (고유 키)
 * @param document 직렬화된 문서 (저장된 문서가 없으면 빈 문자열)
 * @param timestamp 마지막 갱신 시각 (epoch seconds, 저장된 적 없으면 0)
 * @param active 활성 여부 (폐기 시 false)
 * @param controller 컨트롤러 주소 (null 가능)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record DidDocument(
    Did did,
    String document,
    long timestamp,
    boolean active,
    Address controller
) {

    public DidDocument {
        if (did == null) {
            throw new IllegalArgumentException("did cannot be null");
        }
        if (document == null) {
            throw new IllegalArgumentException("document cannot be null");
        }
    }

    /**
     * 등록은 되었으나 문서가 저장된 적 없는 DID의 빈 문서.
     *
     * @param did 대상 DID
     * @return 빈 문서 (비활성, 컨트롤러 없음)
     */
    public static DidDocument unset(Did did) {
        return new DidDocument(did, "", 0L, false, null);
    }

    public DidDocument revoke() {
        return new DidDocument(did, document, timestamp, false, controller);
    }

    public boolean hasController() {
        return controller != null;
    }

    /**
     * 폐기되었는지 확인 (저장 후 active=false가 된 문서).
     *
     * @return 폐기 여부
     */
    public boolean isRevoked() {
        return hasController() && !active;
    }
}
