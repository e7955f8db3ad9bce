package com.ryuqq.registry.core.spi;

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

import java.util.List;
import java.util.Optional;

/**
 * Read side of the registry durability contract.
 *
 * <p>Every method observes committed state only. A reader never sees a partially applied
 * {@link Transaction}.</p>
 *
 * <p><strong>Implementation Requirements:</strong></p>
 * <ul>
 *   <li>Thread-safe: reads may run concurrently with a commit</li>
 *   <li>List results are immutable snapshots, empty when nothing matches</li>
 *   <li>Ordered results follow insertion order (registration order, log order)</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public interface RegistryReader {

    Optional<Principal> findPrincipal(Address address);

    Optional<RoadsideUnit> findRoadsideUnit(Address address);

    /**
     * Resolves a principal or roadside unit DID to the address it is bound to.
     *
     * @param did entity or wallet DID
     * @return bound address, empty if the DID is unbound or bound to a vehicle
     */
    Optional<Address> findAddressByDid(Did did);

    /**
     * Resolves a vehicle entity or wallet DID to its VIN.
     *
     * @param did vehicle DID
     * @return VIN, empty if the DID is not a vehicle DID
     */
    Optional<Vin> findVinByDid(Did did);

    /**
     * Checks the DID registry. This covers principal, roadside unit and vehicle DIDs as well as
     * DIDs first registered by storing a document.
     *
     * @param did DID to check
     * @return true once registered (registration is permanent)
     */
    boolean isDidRegistered(Did did);

    Optional<Vehicle> findVehicle(Vin vin);

    /**
     * Vehicles currently owned by the address, in VIN registration order.
     *
     * @param owner owner address
     * @return owned vehicles
     */
    List<Vehicle> findVehiclesByOwner(Address owner);

    /**
     * Addresses of registered principals, in registration order.
     *
     * @return registered addresses
     */
    List<Address> registeredAddresses();

    /**
     * Registered principals holding the role, in registration order, read as one snapshot.
     *
     * @param role role to match
     * @return matching principals
     */
    List<Principal> findPrincipalsByRole(Role role);

    Optional<InsurancePolicy> findPolicy(Vin vin);

    boolean isMechanicAuthorized(Vin vin, Address mechanic);

    List<MaintenanceRecord> maintenanceHistory(Vin vin, Address mechanic);

    Optional<DidDocument> findDidDocument(Did did);

    Optional<Credential> findCredential(CredentialId credentialId);

    /**
     * Interactions whose source or destination identifier equals the given identifier, in log order.
     *
     * @param identifier DID or VIN string
     * @return matching interactions
     */
    List<Interaction> interactionsFor(String identifier);

    /**
     * Interactions between the unordered pair of identifiers, in log order.
     *
     * @param first DID or VIN string
     * @param second DID or VIN string
     * @return matching interactions
     */
    List<Interaction> interactionsBetween(String first, String second);

    long interactionCount();
}
