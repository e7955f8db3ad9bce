package com.ryuqq.registry.core.domain;

import com.ryuqq.registry.core.model.Address;
import com.ryuqq.registry.core.model.Did;
import com.ryuqq.registry.core.model.Role;

/**
 * 등록된 참여자 (개인, 정비사, 보험사, 제조사, 엔티티로서의 차량).
 *
 * <p>주소당 최대 하나의 Principal만 존재하며, entityDid와 walletDid는 등록 시점에
 * 이 주소로 영구 바인딩됩니다.</p>
 *
 * @param address 계정 주소 (고유 키)
 * @param name 이름
 * @param role 역할
 * @param entityDid 엔티티 DID
 * @param walletDid 지갑 DID
 * @param registered 등록 여부
 * @param registeredAt 등록 시각 (epoch seconds)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record Principal(
    Address address,
    String name,
    Role role,
    Did entityDid,
    Did walletDid,
    boolean registered,
    long registeredAt
) {

    public Principal {
        if (address == null) {
            throw new IllegalArgumentException("address cannot be null");
        }
        if (name == null) {
            throw new IllegalArgumentException("name cannot be null");
        }
        if (role == null) {
            throw new IllegalArgumentException("role cannot be null");
        }
        if (entityDid == null || walletDid == null) {
            throw new IllegalArgumentException("entityDid and walletDid cannot be null");
        }
    }

    public boolean hasRole(Role expected) {
        return role == expected;
    }
}
