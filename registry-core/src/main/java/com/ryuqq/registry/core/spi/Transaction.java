package com.ryuqq.registry.core.spi;

import com.ryuqq.registry.core.domain.Credential;
import com.ryuqq.registry.core.domain.DidDocument;
import com.ryuqq.registry.core.domain.InsurancePolicy;
import com.ryuqq.registry.core.domain.Interaction;
import com.ryuqq.registry.core.domain.MaintenanceRecord;
import com.ryuqq.registry.core.domain.Principal;
import com.ryuqq.registry.core.domain.RoadsideUnit;
import com.ryuqq.registry.core.domain.Vehicle;
import com.ryuqq.registry.core.event.RegistryEvent;
import com.ryuqq.registry.core.model.Address;
import com.ryuqq.registry.core.model.CredentialId;
import com.ryuqq.registry.core.model.Did;
import com.ryuqq.registry.core.model.Vin;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Staging buffer for the writes of one registry operation.
 *
 * <p>An operation validates every guard against committed state first, then stages its writes
 * here and hands the whole transaction to {@link RegistryStore#commit(Transaction)}. Events are
 * staged alongside the writes and published only after the commit succeeds.</p>
 *
 * <p>Not thread-safe. A transaction is owned by the single writer that builds it.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class Transaction {

    /**
     * Standing mechanic grant for a vehicle.
     */
    public record MechanicGrant(Vin vin, Address mechanic) {
    }

    /**
     * Maintenance record appended to the (vin, mechanic) history.
     */
    public record MaintenanceEntry(Vin vin, MaintenanceRecord record) {
    }

    private final Map<Address, Principal> principals = new LinkedHashMap<>();
    private final Map<Address, RoadsideUnit> roadsideUnits = new LinkedHashMap<>();
    private final Map<Did, Address> addressBindings = new LinkedHashMap<>();
    private final Map<Did, Vin> vehicleBindings = new LinkedHashMap<>();
    private final Set<Did> registeredDids = new LinkedHashSet<>();
    private final Map<Vin, Vehicle> vehicles = new LinkedHashMap<>();
    private final Map<Vin, InsurancePolicy> policies = new LinkedHashMap<>();
    private final List<MechanicGrant> mechanicGrants = new ArrayList<>();
    private final List<MaintenanceEntry> maintenanceEntries = new ArrayList<>();
    private final Map<Did, DidDocument> didDocuments = new LinkedHashMap<>();
    private final Map<CredentialId, Credential> credentials = new LinkedHashMap<>();
    private final List<Interaction> interactions = new ArrayList<>();
    private final List<RegistryEvent> events = new ArrayList<>();

    public Transaction putPrincipal(Principal principal) {
        principals.put(requireNonNull(principal, "principal").address(), principal);
        return this;
    }

    public Transaction putRoadsideUnit(RoadsideUnit roadsideUnit) {
        roadsideUnits.put(requireNonNull(roadsideUnit, "roadsideUnit").address(), roadsideUnit);
        return this;
    }

    /**
     * Registers a DID and binds it to a principal or roadside unit address.
     */
    public Transaction bindDid(Did did, Address address) {
        addressBindings.put(requireNonNull(did, "did"), requireNonNull(address, "address"));
        registeredDids.add(did);
        return this;
    }

    /**
     * Registers a DID and binds it to a vehicle.
     */
    public Transaction bindVehicleDid(Did did, Vin vin) {
        vehicleBindings.put(requireNonNull(did, "did"), requireNonNull(vin, "vin"));
        registeredDids.add(did);
        return this;
    }

    /**
     * Registers a DID without binding it to an address or vehicle.
     */
    public Transaction registerDid(Did did) {
        registeredDids.add(requireNonNull(did, "did"));
        return this;
    }

    public Transaction putVehicle(Vehicle vehicle) {
        vehicles.put(requireNonNull(vehicle, "vehicle").vin(), vehicle);
        return this;
    }

    public Transaction putPolicy(InsurancePolicy policy) {
        policies.put(requireNonNull(policy, "policy").vin(), policy);
        return this;
    }

    public Transaction grantMechanic(Vin vin, Address mechanic) {
        mechanicGrants.add(new MechanicGrant(requireNonNull(vin, "vin"), requireNonNull(mechanic, "mechanic")));
        return this;
    }

    public Transaction appendMaintenance(Vin vin, MaintenanceRecord record) {
        maintenanceEntries.add(new MaintenanceEntry(requireNonNull(vin, "vin"), requireNonNull(record, "record")));
        return this;
    }

    public Transaction putDidDocument(DidDocument document) {
        didDocuments.put(requireNonNull(document, "document").did(), document);
        return this;
    }

    public Transaction putCredential(Credential credential) {
        credentials.put(requireNonNull(credential, "credential").credentialId(), credential);
        return this;
    }

    /**
     * Stages an interaction. Its sequence must equal the committed log size plus the number of
     * interactions staged before it.
     */
    public Transaction appendInteraction(Interaction interaction) {
        interactions.add(requireNonNull(interaction, "interaction"));
        return this;
    }

    public Transaction emit(RegistryEvent event) {
        events.add(requireNonNull(event, "event"));
        return this;
    }

    public Map<Address, Principal> principals() {
        return Collections.unmodifiableMap(principals);
    }

    public Map<Address, RoadsideUnit> roadsideUnits() {
        return Collections.unmodifiableMap(roadsideUnits);
    }

    public Map<Did, Address> addressBindings() {
        return Collections.unmodifiableMap(addressBindings);
    }

    public Map<Did, Vin> vehicleBindings() {
        return Collections.unmodifiableMap(vehicleBindings);
    }

    public Set<Did> registeredDids() {
        return Collections.unmodifiableSet(registeredDids);
    }

    public Map<Vin, Vehicle> vehicles() {
        return Collections.unmodifiableMap(vehicles);
    }

    public Map<Vin, InsurancePolicy> policies() {
        return Collections.unmodifiableMap(policies);
    }

    public List<MechanicGrant> mechanicGrants() {
        return Collections.unmodifiableList(mechanicGrants);
    }

    public List<MaintenanceEntry> maintenanceEntries() {
        return Collections.unmodifiableList(maintenanceEntries);
    }

    public Map<Did, DidDocument> didDocuments() {
        return Collections.unmodifiableMap(didDocuments);
    }

    public Map<CredentialId, Credential> credentials() {
        return Collections.unmodifiableMap(credentials);
    }

    public List<Interaction> interactions() {
        return Collections.unmodifiableList(interactions);
    }

    public List<RegistryEvent> events() {
        return Collections.unmodifiableList(events);
    }

    /**
     * Checks whether any write is staged. Events alone do not count as writes.
     *
     * @return true if nothing would change on commit
     */
    public boolean isEmpty() {
        return principals.isEmpty()
            && roadsideUnits.isEmpty()
            && registeredDids.isEmpty()
            && vehicles.isEmpty()
            && policies.isEmpty()
            && mechanicGrants.isEmpty()
            && maintenanceEntries.isEmpty()
            && didDocuments.isEmpty()
            && credentials.isEmpty()
            && interactions.isEmpty();
    }

    private static <T> T requireNonNull(T value, String field) {
        if (value == null) {
            throw new IllegalArgumentException(field + " cannot be null");
        }
        return value;
    }
}
