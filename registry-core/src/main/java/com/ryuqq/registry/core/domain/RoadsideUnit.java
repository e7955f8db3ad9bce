package com.ryuqq.registry.core.domain;

import com.ryuqq.registry.core.model.Address;
import com.ryuqq.registry.core.model.Did;

/**
 * 노변 기지국 (Roadside Unit).
 *
 * <p>Principal과 같은 고유성 규칙을 따르지만 별도의 네임스페이스에 저장되며,
 * 상호작용의 목적지로만 사용될 수 있습니다. 비활성화된 RSU는 목적지로 인정되지 않습니다.</p>
 *
 * @param address 계정 주소
 * @param name 이름
 * @param location 설치 위치 (자유 형식)
 * @param entityDid 엔티티 DID
 * @param walletDid 지갑 DID
 * @param active 활성 여부
 * @param registeredAt 등록 시각 (epoch seconds)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record RoadsideUnit(
    Address address,
    String name,
    String location,
    Did entityDid,
    Did walletDid,
    boolean active,
    long registeredAt
) {

    public RoadsideUnit {
        if (address == null) {
            throw new IllegalArgumentException("address cannot be null");
        }
        if (name == null || location == null) {
            throw new IllegalArgumentException("name and location cannot be null");
        }
        if (entityDid == null || walletDid == null) {
            throw new IllegalArgumentException("entityDid and walletDid cannot be null");
        }
    }

    /**
     * 비활성화된 사본 생성.
     *
     * @return active=false인 RoadsideUnit
     */
    public RoadsideUnit deactivate() {
        return new RoadsideUnit(address, name, location, entityDid, walletDid, false, registeredAt);
    }
}
