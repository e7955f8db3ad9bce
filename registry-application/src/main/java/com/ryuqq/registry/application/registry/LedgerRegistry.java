package com.ryuqq.registry.application.registry;

import com.ryuqq.registry.core.domain.Credential;
import com.ryuqq.registry.core.domain.DidDocument;
import com.ryuqq.registry.core.domain.InsurancePolicy;
import com.ryuqq.registry.core.domain.Interaction;
import com.ryuqq.registry.core.domain.MaintenanceRecord;
import com.ryuqq.registry.core.domain.Principal;
import com.ryuqq.registry.core.domain.RoadsideUnit;
import com.ryuqq.registry.core.domain.Vehicle;
import com.ryuqq.registry.core.error.AuthorizationException;
import com.ryuqq.registry.core.error.ConflictException;
import com.ryuqq.registry.core.error.NotFoundException;
import com.ryuqq.registry.core.error.ReasonCode;
import com.ryuqq.registry.core.error.RegistryException;
import com.ryuqq.registry.core.error.ValidationException;
import com.ryuqq.registry.core.event.RegistryEvent;
import com.ryuqq.registry.core.model.Address;
import com.ryuqq.registry.core.model.CredentialId;
import com.ryuqq.registry.core.model.Did;
import com.ryuqq.registry.core.model.Payload;
import com.ryuqq.registry.core.model.Role;
import com.ryuqq.registry.core.model.Vin;
import com.ryuqq.registry.core.policy.AuthorizationPolicy;
import com.ryuqq.registry.core.spi.EventPublisher;
import com.ryuqq.registry.core.spi.RegistryStore;
import com.ryuqq.registry.core.spi.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;

import static com.ryuqq.registry.core.policy.AuthorizationPolicy.requireMaxLength;
import static com.ryuqq.registry.core.policy.AuthorizationPolicy.requireNotBlank;

/**
 * 원장 상주 레지스트리 상태 머신.
 *
 * <p>모든 상태 변경 연산은 하나의 {@link ReentrantLock}을 통해 직렬화됩니다 (단일 writer 경로).</p>
 *
 * <p><strong>쓰기 흐름:</strong></p>
 * <pre>
 * lock
 *   ↓
 * 1. 커밋된 상태에 대해 모든 가드 검증 (첫 위반에서 중단)
 *   ↓
 * 2. Transaction에 쓰기와 이벤트 적재
 *   ↓
 * 3. store.commit(tx) → 전부 반영 또는 전무
 *   ↓
 * 4. 이벤트 발행 (커밋 이후에만)
 *   ↓
 * unlock
 * </pre>
 *
 * <p>가드가 실패하면 commit도 이벤트 발행도 일어나지 않습니다. 조회 연산은 락을 잡지 않으며
 * 커밋 단위의 일관성은 {@link RegistryStore}가 보장합니다.</p>
 *
 * <p>시각은 주입된 {@link Clock}의 epoch seconds입니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class LedgerRegistry implements Registry {

    private static final Logger log = LoggerFactory.getLogger(LedgerRegistry.class);

    private final RegistryStore store;
    private final EventPublisher publisher;
    private final RegistryConfig config;
    private final Clock clock;
    private final AuthorizationPolicy policy;
    private final ReentrantLock writeLock = new ReentrantLock();

    /**
     * 생성자 (기본 설정, 시스템 UTC 시계).
     *
     * @param store 상태 저장소
     * @param publisher 이벤트 발행자
     */
    public LedgerRegistry(RegistryStore store, EventPublisher publisher) {
        this(store, publisher, new RegistryConfig(), Clock.systemUTC());
    }

    /**
     * 생성자.
     *
     * @param store 상태 저장소
     * @param publisher 이벤트 발행자
     * @param config 설정
     * @param clock 시계
     * @throws IllegalArgumentException 의존성이 null인 경우
     */
    public LedgerRegistry(RegistryStore store, EventPublisher publisher, RegistryConfig config, Clock clock) {
        if (store == null) {
            throw new IllegalArgumentException("store cannot be null");
        }
        if (publisher == null) {
            throw new IllegalArgumentException("publisher cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.store = store;
        this.publisher = publisher;
        this.config = config;
        this.clock = clock;
        this.policy = new AuthorizationPolicy(store);
    }

    // ===== Principal =====

    @Override
    public void registerPrincipal(Address caller, String name, Role role, Did entityDid, Did walletDid) {
        requireArguments(caller, role, entityDid, walletDid);
        write("registerPrincipal", tx -> {
            requireShortText(name, "name");
            requireDistinct(entityDid, walletDid);
            policy.requireUnregistered(caller);
            policy.requireDidUnregistered(entityDid);
            policy.requireDidUnregistered(walletDid);

            long now = now();
            tx.putPrincipal(new Principal(caller, name, role, entityDid, walletDid, true, now))
                .bindDid(entityDid, caller)
                .bindDid(walletDid, caller)
                .emit(new RegistryEvent.PrincipalRegistered(caller, role, entityDid, walletDid, now));
        });
    }

    @Override
    public boolean isRegistered(Did did) {
        requireArguments(did);
        return store.isDidRegistered(did);
    }

    @Override
    public Address resolveAddress(Did did) {
        requireArguments(did);
        return store.findAddressByDid(did)
            .orElseThrow(() -> new NotFoundException(ReasonCode.DID_NOT_FOUND,
                "DID is not bound to an address: " + did.getValue()));
    }

    @Override
    public Principal getPrincipal(Address address) {
        requireArguments(address);
        return store.findPrincipal(address)
            .orElseThrow(() -> new NotFoundException(ReasonCode.PRINCIPAL_NOT_FOUND,
                "Principal not found: " + address.getValue()));
    }

    @Override
    public List<Address> getRegisteredAddresses() {
        return store.registeredAddresses();
    }

    @Override
    public List<Principal> getPrincipalsByRole(Role role) {
        requireArguments(role);
        return store.findPrincipalsByRole(role);
    }

    // ===== Roadside Unit =====

    @Override
    public void registerRoadsideUnit(Address caller, String name, String location, Did entityDid, Did walletDid) {
        requireArguments(caller, entityDid, walletDid);
        write("registerRoadsideUnit", tx -> {
            requireShortText(name, "name");
            requireShortText(location, "location");
            requireDistinct(entityDid, walletDid);
            policy.requireUnregistered(caller);
            policy.requireDidUnregistered(entityDid);
            policy.requireDidUnregistered(walletDid);

            long now = now();
            tx.putRoadsideUnit(new RoadsideUnit(caller, name, location, entityDid, walletDid, true, now))
                .bindDid(entityDid, caller)
                .bindDid(walletDid, caller)
                .emit(new RegistryEvent.RoadsideUnitRegistered(caller, location, entityDid, walletDid, now));
        });
    }

    @Override
    public void deactivateRoadsideUnit(Address caller) {
        requireArguments(caller);
        write("deactivateRoadsideUnit", tx -> {
            RoadsideUnit unit = policy.requireRoadsideUnit(caller);
            tx.putRoadsideUnit(unit.deactivate())
                .emit(new RegistryEvent.RoadsideUnitDeactivated(caller, now()));
        });
    }

    @Override
    public RoadsideUnit getRoadsideUnit(Address address) {
        requireArguments(address);
        return store.findRoadsideUnit(address)
            .orElseThrow(() -> new NotFoundException(ReasonCode.ROADSIDE_UNIT_NOT_FOUND,
                "Roadside unit not found: " + address.getValue()));
    }

    // ===== Vehicle =====

    @Override
    public void registerVehicle(Vin vin, Did ownerDid, Did entityDid, int year, String make, String model,
                                Did walletDid, Did credentialDid) {
        requireArguments(vin, ownerDid, entityDid, walletDid);
        write("registerVehicle", tx -> {
            requireShortText(make, "make");
            requireShortText(model, "model");
            if (year <= 0) {
                throw new ValidationException(ReasonCode.INVALID_YEAR, "year must be positive (current: " + year + ")");
            }
            requireDistinct(entityDid, walletDid);
            Principal owner = policy.requirePrincipalByDid(ownerDid);
            if (store.findVehicle(vin).isPresent()) {
                throw new ConflictException(ReasonCode.VIN_ALREADY_REGISTERED,
                    "VIN already registered: " + vin.getValue());
            }
            policy.requireDidUnregistered(entityDid);
            policy.requireDidUnregistered(walletDid);

            long now = now();
            tx.putVehicle(Vehicle.register(vin, make, model, year, owner.address(), entityDid, walletDid,
                    credentialDid, now))
                .bindVehicleDid(entityDid, vin)
                .bindVehicleDid(walletDid, vin)
                .emit(new RegistryEvent.VehicleRegistered(vin, owner.address(), entityDid, walletDid, now))
                .emit(new RegistryEvent.DidRegistered(entityDid, vin.getValue(), now))
                .emit(new RegistryEvent.DidRegistered(walletDid, vin.getValue(), now));
        });
    }

    @Override
    public void transferOwnership(Address caller, Vin vin, Address newOwner) {
        requireArguments(caller, vin, newOwner);
        write("transferOwnership", tx -> {
            Vehicle vehicle = policy.requireVehicleOwner(caller, vin);
            policy.requireRegisteredTarget(newOwner);

            tx.putVehicle(vehicle.transferTo(newOwner));
            store.findPolicy(vin)
                .filter(InsurancePolicy::active)
                .ifPresent(active -> tx.putPolicy(active.deactivate()));
            tx.emit(new RegistryEvent.OwnershipTransferred(vin, vehicle.currentOwner(), newOwner, now()));
        });
    }

    @Override
    public List<Vehicle> getVehiclesByOwnerDid(Did ownerDid) {
        requireArguments(ownerDid);
        return store.findAddressByDid(ownerDid)
            .map(store::findVehiclesByOwner)
            .orElse(List.of());
    }

    @Override
    public Vehicle getVehicle(Vin vin) {
        requireArguments(vin);
        return policy.requireVehicle(vin);
    }

    @Override
    public Vehicle getVehicleByDid(Did did) {
        requireArguments(did);
        return store.findVinByDid(did)
            .flatMap(store::findVehicle)
            .orElseThrow(() -> new NotFoundException(ReasonCode.VEHICLE_NOT_FOUND,
                "No vehicle bound to DID: " + did.getValue()));
    }

    @Override
    public void updateVehicleConfiguration(Address caller, Vin vin, String configuration) {
        requireArguments(caller, vin);
        write("updateVehicleConfiguration", tx -> {
            Vehicle vehicle = policy.requireVehicleOwner(caller, vin);
            requireNotBlank(configuration, "configuration");
            requireMaxLength(configuration.length(), config.maxDocumentLength(), "configuration");

            tx.putVehicle(vehicle.withConfiguration(configuration))
                .emit(new RegistryEvent.VehicleConfigurationUpdated(vin, caller, now()));
        });
    }

    // ===== Maintenance & Insurance =====

    @Override
    public void authorizeMechanic(Address caller, Vin vin, Address mechanic) {
        requireArguments(caller, vin, mechanic);
        write("authorizeMechanic", tx -> {
            policy.requireVehicleOwner(caller, vin);
            policy.requireTargetRole(mechanic, Role.MECHANIC);

            tx.grantMechanic(vin, mechanic)
                .emit(new RegistryEvent.MechanicAuthorized(vin, caller, mechanic, now()));
        });
    }

    @Override
    public void addMaintenanceRecord(Address caller, Vin vin, String description, boolean critical) {
        requireArguments(caller, vin);
        write("addMaintenanceRecord", tx -> {
            Vehicle vehicle = policy.requireMechanicAuthorized(caller, vin);
            requireNotBlank(description, "description");
            requireMaxLength(description.length(), config.maxDocumentLength(), "description");

            long now = now();
            tx.appendMaintenance(vin, new MaintenanceRecord(caller, description, now, critical))
                .putVehicle(vehicle.withMaintenanceProvider(caller))
                .emit(new RegistryEvent.MaintenanceAdded(vin, caller, critical, now));
        });
    }

    @Override
    public void createInsurancePolicy(Address caller, Vin vin, long startDate, long endDate) {
        requireArguments(caller, vin);
        write("createInsurancePolicy", tx -> {
            Vehicle vehicle = policy.requireInsurableVehicle(caller, vin);
            if (endDate <= startDate) {
                throw new ValidationException(ReasonCode.INVALID_PERIOD,
                    "endDate must be after startDate (start: " + startDate + ", end: " + endDate + ")");
            }

            tx.putPolicy(new InsurancePolicy(vin, caller, vehicle.currentOwner(), startDate, endDate, true))
                .putVehicle(vehicle.withInsurer(caller))
                .emit(new RegistryEvent.PolicyCreated(vin, caller, vehicle.currentOwner(), startDate, endDate, now()));
        });
    }

    @Override
    public List<MaintenanceRecord> getMaintenanceHistory(Vin vin, Address mechanic) {
        requireArguments(vin, mechanic);
        policy.requireVehicle(vin);
        return store.maintenanceHistory(vin, mechanic);
    }

    @Override
    public InsurancePolicy getInsurancePolicy(Vin vin) {
        requireArguments(vin);
        return store.findPolicy(vin)
            .orElseThrow(() -> new NotFoundException(ReasonCode.POLICY_NOT_FOUND,
                "No insurance policy for vehicle: " + vin.getValue()));
    }

    @Override
    public boolean isMechanicAuthorized(Vin vin, Address mechanic) {
        requireArguments(vin, mechanic);
        return store.isMechanicAuthorized(vin, mechanic);
    }

    // ===== DID Document =====

    @Override
    public void storeDidDocument(Address caller, Did did, String document) {
        requireArguments(caller, did);
        write("storeDidDocument", tx -> {
            requireNotBlank(document, "document");
            requireMaxLength(document.length(), config.maxDocumentLength(), "document");
            policy.requireDidController(caller, did);

            long now = now();
            if (!store.isDidRegistered(did)) {
                tx.registerDid(did)
                    .emit(new RegistryEvent.DidRegistered(did, caller.getValue(), now));
            }
            tx.putDidDocument(new DidDocument(did, document, now, true, caller))
                .emit(new RegistryEvent.DidDocumentUpdated(did, caller, now));
        });
    }

    @Override
    public DidDocument getDidDocument(Did did) {
        requireArguments(did);
        Optional<DidDocument> stored = store.findDidDocument(did);
        if (stored.isPresent()) {
            return stored.get();
        }
        if (!store.isDidRegistered(did)) {
            throw new NotFoundException(ReasonCode.DID_NOT_FOUND, "DID not registered: " + did.getValue());
        }
        return DidDocument.unset(did);
    }

    @Override
    public void revokeDidDocument(Address caller, Did did) {
        requireArguments(caller, did);
        write("revokeDidDocument", tx -> {
            DidDocument document = store.findDidDocument(did)
                .orElseThrow(() -> new NotFoundException(ReasonCode.DOCUMENT_NOT_FOUND,
                    "No DID document stored for: " + did.getValue()));
            if (!caller.equals(document.controller())) {
                throw new AuthorizationException(ReasonCode.NOT_DID_CONTROLLER,
                    "Caller is not the controller of " + did.getValue());
            }

            tx.putDidDocument(document.revoke())
                .emit(new RegistryEvent.DidDocumentRevoked(did, caller, now()));
        });
    }

    @Override
    public boolean isValidDid(Did did) {
        requireArguments(did);
        return policy.isValidDid(did);
    }

    // ===== Credential =====

    @Override
    public void storeCredential(Address caller, CredentialId credentialId, Did issuerDid, Did subjectDid, String data) {
        requireArguments(caller, credentialId, issuerDid, subjectDid);
        write("storeCredential", tx -> {
            requireNotBlank(data, "data");
            requireMaxLength(data.length(), config.maxCredentialLength(), "data");
            policy.requireValidDid(issuerDid, "issuerDid");
            policy.requireValidDid(subjectDid, "subjectDid");
            if (store.findCredential(credentialId).isPresent()) {
                throw new ConflictException(ReasonCode.CREDENTIAL_ALREADY_EXISTS,
                    "Credential already exists: " + credentialId.getValue());
            }

            tx.putCredential(new Credential(credentialId, caller, subjectDid, data))
                .emit(new RegistryEvent.CredentialStored(credentialId, caller, subjectDid, now()));
        });
    }

    @Override
    public Credential getCredential(CredentialId credentialId) {
        requireArguments(credentialId);
        return store.findCredential(credentialId)
            .orElseThrow(() -> new NotFoundException(ReasonCode.CREDENTIAL_NOT_FOUND,
                "Credential not found: " + credentialId.getValue()));
    }

    // ===== Interaction =====

    @Override
    public long recordInteraction(Address source, Address destination, String sourceIdentifier,
                                  String destinationIdentifier, String interactionType, Payload payload) {
        requireArguments(source, destination);
        Payload body = payload == null ? Payload.empty() : payload;
        return writeReturning("recordInteraction", tx -> {
            requireShortText(interactionType, "interactionType");
            requireNotBlank(sourceIdentifier, "sourceIdentifier");
            requireNotBlank(destinationIdentifier, "destinationIdentifier");
            requireMaxLength(body.size(), config.maxPayloadBytes(), "payload");
            if (!resolves(source, sourceIdentifier, false)) {
                throw new ValidationException(ReasonCode.UNRESOLVABLE_IDENTIFIER,
                    "Source identifier does not resolve to a registered principal or vehicle: " + sourceIdentifier);
            }
            if (!resolves(destination, destinationIdentifier, true)) {
                throw new ValidationException(ReasonCode.UNRESOLVABLE_IDENTIFIER,
                    "Destination identifier does not resolve to a registered principal, vehicle or active roadside unit: "
                        + destinationIdentifier);
            }

            long sequence = store.interactionCount();
            long now = now();
            tx.appendInteraction(new Interaction(sequence, source, destination, sourceIdentifier,
                    destinationIdentifier, interactionType, body, now))
                .emit(new RegistryEvent.InteractionRecorded(sequence, source, destination, sourceIdentifier,
                    destinationIdentifier, interactionType, now));
            return sequence;
        });
    }

    @Override
    public List<Interaction> queryByIdentifier(String identifier) {
        requireNotBlank(identifier, "identifier");
        return store.interactionsFor(identifier);
    }

    @Override
    public List<Interaction> queryBetween(String first, String second) {
        requireNotBlank(first, "first");
        requireNotBlank(second, "second");
        return store.interactionsBetween(first, second);
    }

    @Override
    public long interactionCount() {
        return store.interactionCount();
    }

    // ===== 내부 =====

    /**
     * 식별자가 주소에 묶인 참여자 또는 등록된 차량으로 해석되는지 확인.
     *
     * <p>DID는 해당 주소에 바인딩되어 있어야 하고, VIN과 차량 DID는 주소와 무관하게 차량으로 해석됩니다.
     * 노변 기지국은 목적지 측에서만, 활성 상태일 때만 인정됩니다.</p>
     */
    private boolean resolves(Address address, String identifier, boolean acceptRoadsideUnit) {
        if (!Did.isDid(identifier)) {
            return store.findVehicle(Vin.of(identifier)).filter(Vehicle::registered).isPresent();
        }
        Did did = Did.of(identifier);
        Optional<Address> bound = store.findAddressByDid(did);
        if (bound.isEmpty()) {
            return store.findVinByDid(did).flatMap(store::findVehicle).isPresent();
        }
        if (!bound.get().equals(address)) {
            return false;
        }
        if (store.findPrincipal(address).filter(Principal::registered).isPresent()) {
            return true;
        }
        return acceptRoadsideUnit && store.findRoadsideUnit(address).filter(RoadsideUnit::active).isPresent();
    }

    private void write(String operation, Consumer<Transaction> staging) {
        writeReturning(operation, tx -> {
            staging.accept(tx);
            return null;
        });
    }

    /**
     * 락 안에서 가드 검증과 적재를 수행하고 커밋 후 이벤트를 발행합니다.
     */
    private <T> T writeReturning(String operation, Function<Transaction, T> staging) {
        writeLock.lock();
        try {
            Transaction tx = new Transaction();
            T result = staging.apply(tx);
            store.commit(tx);
            log.debug("{} committed ({} events)", operation, tx.events().size());
            publishAll(tx.events());
            return result;
        } catch (RegistryException e) {
            log.debug("{} rejected [{}]: {}", operation, e.getCode(), e.getMessage());
            throw e;
        } finally {
            writeLock.unlock();
        }
    }

    private void publishAll(List<RegistryEvent> events) {
        for (RegistryEvent event : events) {
            try {
                publisher.publish(event);
            } catch (RuntimeException e) {
                // 커밋은 이미 확정됨. 발행 실패는 기록만 하고 나머지 이벤트 계속 발행
                log.warn("Event publication failed for {}: {}", event.getClass().getSimpleName(), e.getMessage(), e);
            }
        }
    }

    private void requireShortText(String value, String field) {
        requireNotBlank(value, field);
        requireMaxLength(value.length(), config.maxNameLength(), field);
    }

    private static void requireDistinct(Did entityDid, Did walletDid) {
        if (entityDid.equals(walletDid)) {
            throw new ValidationException(ReasonCode.DUPLICATE_DID_PAIR,
                "entityDid and walletDid must differ: " + entityDid.getValue());
        }
    }

    private static void requireArguments(Object... arguments) {
        for (Object argument : arguments) {
            if (argument == null) {
                throw new IllegalArgumentException("required argument cannot be null");
            }
        }
    }

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
