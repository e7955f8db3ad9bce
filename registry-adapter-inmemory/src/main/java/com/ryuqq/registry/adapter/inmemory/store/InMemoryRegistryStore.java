package com.ryuqq.registry.adapter.inmemory.store;

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
import com.ryuqq.registry.core.model.Role;
import com.ryuqq.registry.core.model.Vin;
import com.ryuqq.registry.core.spi.RegistryStore;
import com.ryuqq.registry.core.spi.Transaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * In-memory implementation of {@link RegistryStore} SPI for testing and reference purposes.
 *
 * <p>Primary maps hold the records; secondary indices are derived from them and updated in the
 * same commit. A single {@link ReentrantReadWriteLock} guards everything: {@link #commit(Transaction)}
 * applies a whole transaction under the write lock, and every read takes the read lock, so
 * readers only ever see whole committed transactions.</p>
 *
 * <p><strong>Data Structures:</strong></p>
 * <ul>
 *   <li><strong>principals / roadsideUnits:</strong> HashMap keyed by Address</li>
 *   <li><strong>registeredAddresses:</strong> ArrayList - principal registration order</li>
 *   <li><strong>didToAddress / didToVin / registeredDids:</strong> DID registry and bindings</li>
 *   <li><strong>vehicles + vehicleOrder:</strong> HashMap keyed by VIN plus registration position</li>
 *   <li><strong>ownerIndex:</strong> Address → TreeMap&lt;position, VIN&gt; - owned vehicles in VIN registration order</li>
 *   <li><strong>interactions + identifierIndex:</strong> append-only log plus identifier → log positions</li>
 * </ul>
 *
 * <p><strong>Performance Characteristics:</strong></p>
 * <ul>
 *   <li><strong>Key lookups:</strong> O(1)</li>
 *   <li><strong>findVehiclesByOwner:</strong> O(K) for K owned vehicles</li>
 *   <li><strong>interactionsFor / interactionsBetween:</strong> O(K) for K interactions touching the identifier</li>
 *   <li><strong>commit:</strong> O(W log N) for W staged writes</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public class InMemoryRegistryStore implements RegistryStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryRegistryStore.class);

    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    private final Map<Address, Principal> principals = new HashMap<>();
    private final List<Address> registeredAddresses = new ArrayList<>();
    private final Map<Address, RoadsideUnit> roadsideUnits = new HashMap<>();

    private final Map<Did, Address> didToAddress = new HashMap<>();
    private final Map<Did, Vin> didToVin = new HashMap<>();
    private final Set<Did> registeredDids = new HashSet<>();

    private final Map<Vin, Vehicle> vehicles = new HashMap<>();
    private final Map<Vin, Long> vehicleOrder = new HashMap<>();
    private final Map<Address, TreeMap<Long, Vin>> ownerIndex = new HashMap<>();

    private final Map<Vin, InsurancePolicy> policies = new HashMap<>();
    private final Map<Vin, Set<Address>> mechanicGrants = new HashMap<>();
    private final Map<Vin, Map<Address, List<MaintenanceRecord>>> maintenance = new HashMap<>();

    private final Map<Did, DidDocument> didDocuments = new HashMap<>();
    private final Map<CredentialId, Credential> credentials = new HashMap<>();

    private final List<Interaction> interactions = new ArrayList<>();
    private final Map<String, List<Integer>> identifierIndex = new HashMap<>();

    /**
     * Creates a new InMemoryRegistryStore with empty storage.
     */
    public InMemoryRegistryStore() {
    }

    // ===== Commit =====

    /**
     * {@inheritDoc}
     *
     * <p><strong>Implementation Notes:</strong></p>
     * <ul>
     *   <li>Append-only checks run before any map is touched</li>
     *   <li>Principals are appended to the registration order only on first insert</li>
     *   <li>A vehicle write moves the VIN between owner index entries when the owner changes</li>
     * </ul>
     */
    @Override
    public void commit(Transaction transaction) {
        if (transaction == null) {
            throw new IllegalArgumentException("transaction cannot be null");
        }
        lock.writeLock().lock();
        try {
            verifyAppendOnly(transaction);
            apply(transaction);
            log.trace("Committed transaction: {} vehicles, {} interactions, {} events",
                transaction.vehicles().size(), transaction.interactions().size(), transaction.events().size());
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void verifyAppendOnly(Transaction transaction) {
        for (CredentialId credentialId : transaction.credentials().keySet()) {
            if (credentials.containsKey(credentialId)) {
                throw new IllegalStateException("Credential is write-once: " + credentialId.getValue());
            }
        }
        long expected = interactions.size();
        for (Interaction interaction : transaction.interactions()) {
            if (interaction.sequence() != expected) {
                throw new IllegalStateException("Interaction sequence out of order (expected: "
                    + expected + ", actual: " + interaction.sequence() + ")");
            }
            expected++;
        }
    }

    private void apply(Transaction transaction) {
        for (Principal principal : transaction.principals().values()) {
            if (principals.put(principal.address(), principal) == null) {
                registeredAddresses.add(principal.address());
            }
        }
        roadsideUnits.putAll(transaction.roadsideUnits());

        didToAddress.putAll(transaction.addressBindings());
        didToVin.putAll(transaction.vehicleBindings());
        registeredDids.addAll(transaction.registeredDids());

        for (Vehicle vehicle : transaction.vehicles().values()) {
            putVehicle(vehicle);
        }
        policies.putAll(transaction.policies());

        for (Transaction.MechanicGrant grant : transaction.mechanicGrants()) {
            mechanicGrants.computeIfAbsent(grant.vin(), vin -> new LinkedHashSet<>()).add(grant.mechanic());
        }
        for (Transaction.MaintenanceEntry entry : transaction.maintenanceEntries()) {
            maintenance.computeIfAbsent(entry.vin(), vin -> new HashMap<>())
                .computeIfAbsent(entry.record().mechanic(), mechanic -> new ArrayList<>())
                .add(entry.record());
        }

        didDocuments.putAll(transaction.didDocuments());
        credentials.putAll(transaction.credentials());

        for (Interaction interaction : transaction.interactions()) {
            int position = interactions.size();
            interactions.add(interaction);
            index(interaction.sourceIdentifier(), position);
            if (!interaction.destinationIdentifier().equals(interaction.sourceIdentifier())) {
                index(interaction.destinationIdentifier(), position);
            }
        }
    }

    private void putVehicle(Vehicle vehicle) {
        Vin vin = vehicle.vin();
        Vehicle previous = vehicles.put(vin, vehicle);
        Long position = vehicleOrder.computeIfAbsent(vin, key -> (long) vehicleOrder.size());

        Address previousOwner = previous == null ? null : previous.currentOwner();
        Address owner = vehicle.currentOwner();
        if (previousOwner != null && !previousOwner.equals(owner)) {
            TreeMap<Long, Vin> owned = ownerIndex.get(previousOwner);
            if (owned != null) {
                owned.remove(position);
            }
        }
        if (owner != null) {
            ownerIndex.computeIfAbsent(owner, key -> new TreeMap<>()).put(position, vin);
        }
    }

    private void index(String identifier, int position) {
        identifierIndex.computeIfAbsent(identifier, key -> new ArrayList<>()).add(position);
    }

    // ===== Reads =====

    @Override
    public Optional<Principal> findPrincipal(Address address) {
        return read(() -> Optional.ofNullable(principals.get(address)));
    }

    @Override
    public Optional<RoadsideUnit> findRoadsideUnit(Address address) {
        return read(() -> Optional.ofNullable(roadsideUnits.get(address)));
    }

    @Override
    public Optional<Address> findAddressByDid(Did did) {
        return read(() -> Optional.ofNullable(didToAddress.get(did)));
    }

    @Override
    public Optional<Vin> findVinByDid(Did did) {
        return read(() -> Optional.ofNullable(didToVin.get(did)));
    }

    @Override
    public boolean isDidRegistered(Did did) {
        return read(() -> registeredDids.contains(did));
    }

    @Override
    public Optional<Vehicle> findVehicle(Vin vin) {
        return read(() -> Optional.ofNullable(vehicles.get(vin)));
    }

    @Override
    public List<Vehicle> findVehiclesByOwner(Address owner) {
        return read(() -> {
            TreeMap<Long, Vin> owned = ownerIndex.get(owner);
            if (owned == null) {
                return List.of();
            }
            return owned.values().stream()
                .map(vehicles::get)
                .collect(Collectors.toUnmodifiableList());
        });
    }

    @Override
    public List<Address> registeredAddresses() {
        return read(() -> List.copyOf(registeredAddresses));
    }

    @Override
    public List<Principal> findPrincipalsByRole(Role role) {
        return read(() -> registeredAddresses.stream()
            .map(principals::get)
            .filter(principal -> principal.registered() && principal.hasRole(role))
            .collect(Collectors.toUnmodifiableList()));
    }

    @Override
    public Optional<InsurancePolicy> findPolicy(Vin vin) {
        return read(() -> Optional.ofNullable(policies.get(vin)));
    }

    @Override
    public boolean isMechanicAuthorized(Vin vin, Address mechanic) {
        return read(() -> mechanicGrants.getOrDefault(vin, Set.of()).contains(mechanic));
    }

    @Override
    public List<MaintenanceRecord> maintenanceHistory(Vin vin, Address mechanic) {
        return read(() -> List.copyOf(maintenance.getOrDefault(vin, Map.of()).getOrDefault(mechanic, List.of())));
    }

    @Override
    public Optional<DidDocument> findDidDocument(Did did) {
        return read(() -> Optional.ofNullable(didDocuments.get(did)));
    }

    @Override
    public Optional<Credential> findCredential(CredentialId credentialId) {
        return read(() -> Optional.ofNullable(credentials.get(credentialId)));
    }

    @Override
    public List<Interaction> interactionsFor(String identifier) {
        return read(() -> identifierIndex.getOrDefault(identifier, List.of()).stream()
            .map(interactions::get)
            .collect(Collectors.toUnmodifiableList()));
    }

    @Override
    public List<Interaction> interactionsBetween(String first, String second) {
        return read(() -> identifierIndex.getOrDefault(first, List.of()).stream()
            .map(interactions::get)
            .filter(interaction -> interaction.connects(first, second))
            .collect(Collectors.toUnmodifiableList()));
    }

    @Override
    public long interactionCount() {
        return read(() -> (long) interactions.size());
    }

    private <T> T read(Supplier<T> query) {
        lock.readLock().lock();
        try {
            return query.get();
        } finally {
            lock.readLock().unlock();
        }
    }
}
