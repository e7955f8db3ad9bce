package com.ryuqq.registry.core.domain;

import com.ryuqq.registry.core.model.Address;
import com.ryuqq.registry.core.model.Did;
import com.ryuqq.registry.core.model.Vin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * 차량 레코드.
 *
 * <p>소유자, 보험사, 정비 제공자는 객체 참조가 아니라 {@link Address} 키로 보관합니다.
 * 변경 메서드는 모두 새 인스턴스를 반환하며, previousOwners는 추가만 가능합니다.</p>
 *
 * <p><strong>previousOwners 주의:</strong> 소유권 이전 시 떠나는 소유자가 아니라
 * <em>새 소유자</em>가 추가됩니다. 원장과 동일한 동작을 유지합니다.</p>
 *
 * @param vin 차량 식별 번호 (고유 키, 불변)
 * @param make 제조사
 * @param model 모델명
 * @param year 연식
 * @param currentOwner 현재 소유자 주소
 * @param previousOwners 소유권 이전 기록 (추가 전용)
 * @param entityDid 차량 엔티티 DID
 * @param walletDid 차량 지갑 DID
 * @param credentialDid 차량 자격증명 DID (null 가능)
 * @param registered 등록 여부
 * @param currentInsurer 현재 보험사 주소 (null 가능)
 * @param maintenanceProviders 정비 기록을 남긴 정비사 집합 (삽입 순서 유지)
 * @param configuration 차량 설정 (불투명 문자열, null 가능)
 * @param registeredAt 등록 시각 (epoch seconds)
 *
 * @author Registry Team
 * @since 1.0.0
 */
public record Vehicle(
    Vin vin,
    String make,
    String model,
    int year,
    Address currentOwner,
    List<Address> previousOwners,
    Did entityDid,
    Did walletDid,
    Did credentialDid,
    boolean registered,
    Address currentInsurer,
    Set<Address> maintenanceProviders,
    String configuration,
    long registeredAt
) {

    public Vehicle {
        if (vin == null) {
            throw new IllegalArgumentException("vin cannot be null");
        }
        if (entityDid == null || walletDid == null) {
            throw new IllegalArgumentException("entityDid and walletDid cannot be null");
        }
        previousOwners = previousOwners == null ? List.of() : List.copyOf(previousOwners);
        maintenanceProviders = maintenanceProviders == null
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(maintenanceProviders));
    }

    /**
     * 신규 등록 차량 생성 (이전 소유자, 보험사, 정비 제공자 없음).
     */
    public static Vehicle register(
        Vin vin,
        String make,
        String model,
        int year,
        Address owner,
        Did entityDid,
        Did walletDid,
        Did credentialDid,
        long registeredAt
    ) {
        return new Vehicle(vin, make, model, year, owner, List.of(), entityDid, walletDid,
            credentialDid, true, null, Set.of(), null, registeredAt);
    }

    /**
     * 소유권 이전.
     *
     * @param newOwner 새 소유자
     * @return currentOwner가 변경되고 previousOwners에 newOwner가 추가된 사본
     */
    public Vehicle transferTo(Address newOwner) {
        List<Address> owners = new ArrayList<>(previousOwners);
        owners.add(newOwner);
        return new Vehicle(vin, make, model, year, newOwner, owners, entityDid, walletDid,
            credentialDid, registered, currentInsurer, maintenanceProviders, configuration, registeredAt);
    }

    public Vehicle withInsurer(Address insurer) {
        return new Vehicle(vin, make, model, year, currentOwner, previousOwners, entityDid, walletDid,
            credentialDid, registered, insurer, maintenanceProviders, configuration, registeredAt);
    }

    /**
     * 정비 제공자 추가 (집합 의미론: 이미 있으면 그대로).
     */
    public Vehicle withMaintenanceProvider(Address mechanic) {
        if (maintenanceProviders.contains(mechanic)) {
            return this;
        }
        Set<Address> providers = new LinkedHashSet<>(maintenanceProviders);
        providers.add(mechanic);
        return new Vehicle(vin, make, model, year, currentOwner, previousOwners, entityDid, walletDid,
            credentialDid, registered, currentInsurer, providers, configuration, registeredAt);
    }

    public Vehicle withConfiguration(String newConfiguration) {
        return new Vehicle(vin, make, model, year, currentOwner, previousOwners, entityDid, walletDid,
            credentialDid, registered, currentInsurer, maintenanceProviders, newConfiguration, registeredAt);
    }

    public boolean isOwnedBy(Address address) {
        return currentOwner != null && currentOwner.equals(address);
    }

    public boolean hasInsurer() {
        return currentInsurer != null;
    }
}
