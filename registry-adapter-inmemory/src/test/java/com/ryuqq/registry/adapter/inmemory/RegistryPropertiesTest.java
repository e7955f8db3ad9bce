package com.ryuqq.registry.adapter.inmemory;

import com.ryuqq.registry.adapter.inmemory.bus.InMemoryEventBus;
import com.ryuqq.registry.adapter.inmemory.store.InMemoryRegistryStore;
import com.ryuqq.registry.application.registry.LedgerRegistry;
import com.ryuqq.registry.application.registry.Registry;
import com.ryuqq.registry.core.domain.Interaction;
import com.ryuqq.registry.core.error.ConflictException;
import com.ryuqq.registry.core.model.Address;
import com.ryuqq.registry.core.model.CredentialId;
import com.ryuqq.registry.core.model.Did;
import com.ryuqq.registry.core.model.Payload;
import com.ryuqq.registry.core.model.Role;
import com.ryuqq.registry.core.model.Vin;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import net.jqwik.api.constraints.AlphaChars;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.constraints.Size;
import net.jqwik.api.constraints.StringLength;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Property-based tests for registry invariants over the in-memory store.
 *
 * <p>Each try builds a fresh registry, so properties never share state.</p>
 */
class RegistryPropertiesTest {

    private static final int PARTICIPANTS = 4;

    /**
     * Every registered DID resolves to the address that registered it.
     */
    @Property(tries = 50)
    void registeredDidsResolveToTheirAddress(@ForAll @IntRange(min = 1, max = 30) int count) {
        Registry registry = newRegistry();

        for (int i = 0; i < count; i++) {
            register(registry, i);
        }

        for (int i = 0; i < count; i++) {
            assertThat(registry.resolveAddress(entityDid(i))).isEqualTo(address(i));
            assertThat(registry.resolveAddress(walletDid(i))).isEqualTo(address(i));
        }
        assertThat(registry.getRegisteredAddresses()).hasSize(count);
    }

    /**
     * previousOwners grows by exactly one entry per transfer, in transfer order.
     */
    @Property(tries = 100)
    void previousOwnersRecordEveryTransferInOrder(
            @ForAll @Size(max = 25) List<@IntRange(min = 0, max = PARTICIPANTS - 1) Integer> recipients) {
        Registry registry = newRegistry();
        for (int i = 0; i < PARTICIPANTS; i++) {
            register(registry, i);
        }
        Vin vin = Vin.of("VIN001");
        registry.registerVehicle(vin, entityDid(0), Did.of("did:vehicle:VIN001-e"), 2022, "Tesla", "Model Y",
            Did.of("did:vehicle:VIN001-w"));

        List<Address> expected = new ArrayList<>();
        Address owner = address(0);
        for (int recipient : recipients) {
            registry.transferOwnership(owner, vin, address(recipient));
            owner = address(recipient);
            expected.add(owner);
        }

        assertThat(registry.getVehicle(vin).previousOwners()).containsExactlyElementsOf(expected);
        assertThat(registry.getVehicle(vin).currentOwner()).isEqualTo(owner);
    }

    /**
     * queryBetween(a, b) and queryBetween(b, a) always return the same interactions.
     */
    @Property(tries = 100)
    void queryBetweenIsSymmetric(
            @ForAll @Size(max = 20) List<@IntRange(min = 0, max = PARTICIPANTS * PARTICIPANTS - 1) Integer> edges,
            @ForAll @IntRange(min = 0, max = PARTICIPANTS - 1) int a,
            @ForAll @IntRange(min = 0, max = PARTICIPANTS - 1) int b) {
        Registry registry = newRegistry();
        for (int i = 0; i < PARTICIPANTS; i++) {
            register(registry, i);
        }
        for (int edge : edges) {
            int from = edge / PARTICIPANTS;
            int to = edge % PARTICIPANTS;
            registry.recordInteraction(address(from), address(to), entityDid(from).getValue(),
                entityDid(to).getValue(), "V2V", Payload.empty());
        }

        List<Interaction> forward = registry.queryBetween(entityDid(a).getValue(), entityDid(b).getValue());
        List<Interaction> backward = registry.queryBetween(entityDid(b).getValue(), entityDid(a).getValue());

        assertThat(forward).isEqualTo(backward);
        assertThat(forward).extracting(Interaction::sequence).isSorted();
        assertThat(registry.interactionCount()).isEqualTo(edges.size());
    }

    /**
     * A stored credential never changes, whatever the second writer sends.
     */
    @Property(tries = 50)
    void credentialsAreWriteOnce(
            @ForAll @AlphaChars @StringLength(min = 1, max = 64) String original,
            @ForAll @AlphaChars @StringLength(min = 1, max = 64) String replacement) {
        Registry registry = newRegistry();
        register(registry, 0);
        register(registry, 1);
        CredentialId id = CredentialId.of("urn:uuid:property");

        registry.storeCredential(address(0), id, entityDid(0), entityDid(1), original);

        assertThatThrownBy(() -> registry.storeCredential(address(1), id, entityDid(1), entityDid(0), replacement))
            .isInstanceOf(ConflictException.class);
        assertThat(registry.getCredential(id).data()).isEqualTo(original);
        assertThat(registry.getCredential(id).issuer()).isEqualTo(address(0));
    }

    private static Registry newRegistry() {
        return new LedgerRegistry(new InMemoryRegistryStore(), new InMemoryEventBus());
    }

    private static void register(Registry registry, int index) {
        registry.registerPrincipal(address(index), "p" + index, Role.INDIVIDUAL, entityDid(index), walletDid(index));
    }

    private static Address address(int index) {
        return Address.of("0xp" + index);
    }

    private static Did entityDid(int index) {
        return Did.of("did:p" + index + ":e");
    }

    private static Did walletDid(int index) {
        return Did.of("did:p" + index + ":w");
    }
}
