package com.ryuqq.registry.testkit.contract;

import com.ryuqq.registry.application.registry.LedgerRegistry;
import com.ryuqq.registry.application.registry.Registry;
import com.ryuqq.registry.application.registry.RegistryConfig;
import com.ryuqq.registry.core.domain.Credential;
import com.ryuqq.registry.core.domain.Interaction;
import com.ryuqq.registry.core.domain.Principal;
import com.ryuqq.registry.core.error.ConflictException;
import com.ryuqq.registry.core.error.ReasonCode;
import com.ryuqq.registry.core.error.ValidationException;
import com.ryuqq.registry.core.model.Address;
import com.ryuqq.registry.core.model.CredentialId;
import com.ryuqq.registry.core.model.Payload;
import com.ryuqq.registry.core.model.Role;
import com.ryuqq.registry.core.model.Vin;
import com.ryuqq.registry.core.spi.Transaction;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract Test for all-or-nothing writes.
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>A rejected operation leaves no partial state and publishes nothing</li>
 *   <li>A store commit that breaks an append-only rule applies none of its writes</li>
 *   <li>A failing event publisher does not undo a committed write</li>
 *   <li>Concurrent writers are serialized</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public abstract class AtomicityContractTest extends AbstractContractTest {

    // ===== Rejected operations =====

    @Test
    public void rejected_vehicle_registration_binds_no_DID() {
        // Given
        registerIndividual("alice");
        registerVehicle("VIN001", "alice");

        // When: entity DID is new, wallet DID collides
        assertRejectedWithoutEvents(
            () -> registry.registerVehicle(Vin.of("VIN002"), entityDid("alice"), vehicleDid("VIN002", "e"), 2021,
                "Kia", "EV6", vehicleDid("VIN001", "w")),
            ConflictException.class, ReasonCode.DID_ALREADY_REGISTERED);

        // Then
        assertThat(registry.isRegistered(vehicleDid("VIN002", "e"))).isFalse();
        assertThat(store.findVehicle(Vin.of("VIN002"))).isEmpty();
        assertThat(registry.getVehiclesByOwnerDid(entityDid("alice"))).hasSize(1);
    }

    @Test
    public void oversized_name_is_rejected_without_side_effects() {
        String longName = "x".repeat(new RegistryConfig().maxNameLength() + 1);

        assertRejectedWithoutEvents(
            () -> registry.registerPrincipal(address("alice"), longName, Role.INDIVIDUAL,
                entityDid("alice"), walletDid("alice")),
            ValidationException.class, ReasonCode.SIZE_LIMIT_EXCEEDED);
        assertThat(registry.isRegistered(entityDid("alice"))).isFalse();
        assertThat(registry.getRegisteredAddresses()).isEmpty();
    }

    @Test
    public void rejected_interaction_does_not_consume_a_sequence() {
        // Given
        Address alice = registerIndividual("alice");
        Address bob = registerIndividual("bob");

        // When
        assertRejectedWithoutEvents(
            () -> registry.recordInteraction(alice, bob, entityDid("alice").getValue(), "did:ghost:e", "V2V",
                Payload.empty()),
            ValidationException.class, ReasonCode.UNRESOLVABLE_IDENTIFIER);
        long sequence = registry.recordInteraction(alice, bob, entityDid("alice").getValue(),
            entityDid("bob").getValue(), "V2V", Payload.empty());

        // Then
        assertThat(sequence).isZero();
        assertThat(registry.interactionCount()).isEqualTo(1);
    }

    // ===== Store commit =====

    @Test
    public void commit_with_duplicate_credential_applies_nothing() {
        // Given
        registerIndividual("alice");
        registerIndividual("bob");
        CredentialId id = CredentialId.of("urn:uuid:1");
        registry.storeCredential(address("alice"), id, entityDid("alice"), entityDid("bob"), "{\"v\":1}");
        Address carol = address("carol");

        Transaction tx = new Transaction()
            .putPrincipal(new Principal(carol, "Carol", Role.INDIVIDUAL, entityDid("carol"), walletDid("carol"),
                true, START_SECOND))
            .bindDid(entityDid("carol"), carol)
            .putCredential(new Credential(id, carol, entityDid("bob"), "{\"v\":2}"));

        // When & Then
        assertThatThrownBy(() -> store.commit(tx)).isInstanceOf(IllegalStateException.class);
        assertThat(store.findPrincipal(carol)).isEmpty();
        assertThat(store.isDidRegistered(entityDid("carol"))).isFalse();
        assertThat(store.findCredential(id)).get().extracting(Credential::data).isEqualTo("{\"v\":1}");
    }

    @Test
    public void commit_with_out_of_order_sequence_applies_nothing() {
        // Given
        Address alice = registerIndividual("alice");
        Address bob = address("bob");

        Transaction tx = new Transaction()
            .putPrincipal(new Principal(bob, "Bob", Role.INDIVIDUAL, entityDid("bob"), walletDid("bob"),
                true, START_SECOND))
            .appendInteraction(new Interaction(5, alice, alice, entityDid("alice").getValue(),
                entityDid("alice").getValue(), "PING", Payload.empty(), START_SECOND));

        // When & Then
        assertThatThrownBy(() -> store.commit(tx)).isInstanceOf(IllegalStateException.class);
        assertThat(store.interactionCount()).isZero();
        assertThat(store.findPrincipal(bob)).isEmpty();
    }

    // ===== Publication =====

    @Test
    public void publisher_failure_does_not_undo_commit() {
        // Given
        Registry failing = new LedgerRegistry(store, event -> {
            throw new IllegalStateException("subscriber down");
        }, config(), clock);

        // When
        failing.registerPrincipal(address("alice"), "alice", Role.INDIVIDUAL, entityDid("alice"), walletDid("alice"));

        // Then
        assertThat(registry.isRegistered(entityDid("alice"))).isTrue();
        assertThat(registry.getPrincipal(address("alice")).name()).isEqualTo("alice");
    }

    // ===== Serialization =====

    @Test
    public void concurrent_registrations_all_commit() throws Exception {
        int writers = 16;
        ExecutorService pool = Executors.newFixedThreadPool(4);
        try {
            List<Callable<Void>> tasks = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                String name = "p" + i;
                tasks.add(() -> {
                    registerIndividual(name);
                    return null;
                });
            }
            for (Future<Void> future : pool.invokeAll(tasks)) {
                future.get();
            }
        } finally {
            pool.shutdown();
            pool.awaitTermination(5, TimeUnit.SECONDS);
        }

        assertThat(registry.getRegisteredAddresses()).hasSize(writers).doesNotHaveDuplicates();
        assertThat(events.count()).isEqualTo(writers);
    }

    @Test
    public void concurrent_interactions_receive_distinct_dense_sequences() throws Exception {
        // Given
        Address alice = registerIndividual("alice");
        Address bob = registerIndividual("bob");
        int writers = 32;

        // When
        ExecutorService pool = Executors.newFixedThreadPool(4);
        List<Long> sequences = new ArrayList<>();
        try {
            List<Callable<Long>> tasks = new ArrayList<>();
            for (int i = 0; i < writers; i++) {
                tasks.add(() -> registry.recordInteraction(alice, bob, entityDid("alice").getValue(),
                    entityDid("bob").getValue(), "V2V", Payload.empty()));
            }
            for (Future<Long> future : pool.invokeAll(tasks)) {
                sequences.add(future.get());
            }
        } finally {
            pool.shutdown();
            pool.awaitTermination(5, TimeUnit.SECONDS);
        }

        // Then
        assertThat(sequences).doesNotHaveDuplicates().hasSize(writers);
        assertThat(sequences).allSatisfy(sequence -> assertThat(sequence).isBetween(0L, (long) writers - 1));
        assertThat(registry.queryByIdentifier(entityDid("alice").getValue()))
            .extracting(Interaction::sequence)
            .isSorted();
    }
}
