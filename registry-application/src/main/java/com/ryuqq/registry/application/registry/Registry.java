package com.ryuqq.registry.application.registry;

import com.ryuqq.registry.core.domain.Credential;
import com.ryuqq.registry.core.domain.DidDocument;
import com.ryuqq.registry.core.domain.InsurancePolicy;
import com.ryuqq.registry.core.domain.Interaction;
import com.ryuqq.registry.core.domain.MaintenanceRecord;
import com.ryuqq.registry.core.domain.Principal;
import com.ryuqq.registry.core.domain.RoadsideUnit;
import com.ryuqq.registry.core.domain.Vehicle;
import com.ryuqq.registry.core.model.Address;
import com.ryuqq.registry.core.model.CredentialId;
import com.ryuqq.registry.core.model.Did;
import com.ryuqq.registry.core.model.Payload;
import com.ryuqq.registry.core.model.Role;
import com.ryuqq.registry.core.model.Vin;

import java.util.List;

/**
 * 신원 및 차량 레지스트리 (동기 인터페이스).
 *
 * <p>상태 변경 연산은 모두 원자적입니다. 가드가 하나라도 실패하면 타입 예외
 * ({@code RegistryException} 하위 타입)를 던지고 아무 상태도 바뀌지 않으며 이벤트도 발행되지 않습니다.
 * 호출자 주소({@code caller})는 트랜잭션 발신자이며 모든 권한 검사의 기준입니다.</p>
 *
 * <p><strong>사용 예시:</strong></p>
 * <pre>
 * registry.registerPrincipal(alice, "Alice", Role.INDIVIDUAL, aliceEntity, aliceWallet);
 * registry.registerVehicle(vin, aliceEntity, carEntity, 2022, "Tesla", "Model 3", carWallet);
 * registry.transferOwnership(alice, vin, bob);
 * </pre>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public interface Registry {

    // ===== Principal =====

    /**
     * 호출자를 Principal로 등록하고 두 DID를 호출자 주소에 영구 바인딩합니다.
     *
     * @throws com.ryuqq.registry.core.error.ValidationException 이름이 비었거나 entityDid == walletDid
     * @throws com.ryuqq.registry.core.error.ConflictException 호출자 또는 DID가 이미 등록된 경우
     */
    void registerPrincipal(Address caller, String name, Role role, Did entityDid, Did walletDid);

    boolean isRegistered(Did did);

    /**
     * @throws com.ryuqq.registry.core.error.NotFoundException 바인딩되지 않은 DID
     */
    Address resolveAddress(Did did);

    /**
     * @throws com.ryuqq.registry.core.error.NotFoundException 등록되지 않은 주소
     */
    Principal getPrincipal(Address address);

    List<Address> getRegisteredAddresses();

    List<Principal> getPrincipalsByRole(Role role);

    // ===== Roadside Unit =====

    void registerRoadsideUnit(Address caller, String name, String location, Did entityDid, Did walletDid);

    void deactivateRoadsideUnit(Address caller);

    RoadsideUnit getRoadsideUnit(Address address);

    // ===== Vehicle =====

    /**
     * 차량 등록 (credentialDid 없음).
     */
    default void registerVehicle(Vin vin, Did ownerDid, Did entityDid, int year, String make, String model, Did walletDid) {
        registerVehicle(vin, ownerDid, entityDid, year, make, model, walletDid, null);
    }

    /**
     * 차량 등록. 차량 DID는 주소가 아니라 VIN에 바인딩됩니다.
     *
     * @throws com.ryuqq.registry.core.error.NotFoundException ownerDid가 등록된 Principal로 해석되지 않는 경우
     * @throws com.ryuqq.registry.core.error.ConflictException VIN 또는 차량 DID가 이미 등록된 경우
     * @throws com.ryuqq.registry.core.error.ValidationException make/model이 비었거나 year가 양수가 아니거나 entityDid == walletDid
     */
    void registerVehicle(Vin vin, Did ownerDid, Did entityDid, int year, String make, String model,
                         Did walletDid, Did credentialDid);

    void transferOwnership(Address caller, Vin vin, Address newOwner);

    /**
     * 소유자 DID로 현재 소유 차량 조회 (VIN 등록 순서). 바인딩되지 않은 DID면 빈 리스트.
     */
    List<Vehicle> getVehiclesByOwnerDid(Did ownerDid);

    Vehicle getVehicle(Vin vin);

    Vehicle getVehicleByDid(Did did);

    void updateVehicleConfiguration(Address caller, Vin vin, String configuration);

    // ===== Maintenance & Insurance =====

    void authorizeMechanic(Address caller, Vin vin, Address mechanic);

    void addMaintenanceRecord(Address caller, Vin vin, String description, boolean critical);

    void createInsurancePolicy(Address caller, Vin vin, long startDate, long endDate);

    List<MaintenanceRecord> getMaintenanceHistory(Vin vin, Address mechanic);

    InsurancePolicy getInsurancePolicy(Vin vin);

    boolean isMechanicAuthorized(Vin vin, Address mechanic);

    // ===== DID Document =====

    void storeDidDocument(Address caller, Did did, String document);

    DidDocument getDidDocument(Did did);

    void revokeDidDocument(Address caller, Did did);

    boolean isValidDid(Did did);

    // ===== Credential =====

    void storeCredential(Address caller, CredentialId credentialId, Did issuerDid, Did subjectDid, String data);

    Credential getCredential(CredentialId credentialId);

    // ===== Interaction =====

    /**
     * 상호작용 기록.
     *
     * @return 로그 내 위치 (sequence)
     * @throws com.ryuqq.registry.core.error.ValidationException 식별자가 해석되지 않거나 유형이 비었거나 페이로드가 한도를 초과한 경우
     */
    long recordInteraction(Address source, Address destination, String sourceIdentifier,
                           String destinationIdentifier, String interactionType, Payload payload);

    List<Interaction> queryByIdentifier(String identifier);

    List<Interaction> queryBetween(String first, String second);

    long interactionCount();
}
