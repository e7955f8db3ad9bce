package com.ryuqq.registry.adapter.inmemory.store;

import com.ryuqq.registry.core.domain.Interaction;
import com.ryuqq.registry.core.domain.MaintenanceRecord;
import com.ryuqq.registry.core.domain.Principal;
import com.ryuqq.registry.core.domain.Vehicle;
import com.ryuqq.registry.core.model.Address;
import com.ryuqq.registry.core.model.Did;
import com.ryuqq.registry.core.model.Payload;
import com.ryuqq.registry.core.model.Role;
import com.ryuqq.registry.core.model.Vin;
import com.ryuqq.registry.core.spi.Transaction;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryRegistryStore 단위 테스트.
 *
 * <p>레지스트리를 거치지 않고 Transaction을 직접 커밋하여 인덱스 유지 동작을 검증합니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
class InMemoryRegistryStoreTest {

    private static final Address ALICE = Address.of("0xalice");
    private static final Address BOB = Address.of("0xbob");

    private InMemoryRegistryStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryRegistryStore();
    }

    // ===== Principals =====

    @Test
    void commit_PrincipalUpdate_KeepsRegistrationOrderOnce() {
        // Given
        Principal alice = principal(ALICE, "alice");
        store.commit(new Transaction().putPrincipal(alice));
        store.commit(new Transaction().putPrincipal(principal(BOB, "bob")));

        // When: the same address is written again
        store.commit(new Transaction().putPrincipal(alice));

        // Then
        assertThat(store.registeredAddresses()).containsExactly(ALICE, BOB);
    }

    @Test
    void findPrincipalsByRole_ReturnsMatchingPrincipalsInRegistrationOrder() {
        // Given
        Address acme = Address.of("0xacme");
        store.commit(new Transaction()
            .putPrincipal(principal(ALICE, "alice"))
            .putPrincipal(new Principal(acme, "acme", Role.INSURANCE_COMPANY, Did.of("did:acme:e"),
                Did.of("did:acme:w"), true, 0))
            .putPrincipal(principal(BOB, "bob")));

        // When
        List<Principal> individuals = store.findPrincipalsByRole(Role.INDIVIDUAL);

        // Then
        assertThat(individuals).extracting(Principal::address).containsExactly(ALICE, BOB);
        assertThat(store.findPrincipalsByRole(Role.INSURANCE_COMPANY)).extracting(Principal::address)
            .containsExactly(acme);
        assertThat(store.findPrincipalsByRole(Role.MECHANIC)).isEmpty();
        assertThatThrownBy(() -> individuals.add(principal(ALICE, "alice")))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void bindDid_RegistersAndResolves() {
        // When
        store.commit(new Transaction().bindDid(Did.of("did:alice:e"), ALICE));

        // Then
        assertThat(store.isDidRegistered(Did.of("did:alice:e"))).isTrue();
        assertThat(store.findAddressByDid(Did.of("did:alice:e"))).contains(ALICE);
        assertThat(store.findVinByDid(Did.of("did:alice:e"))).isEmpty();
    }

    // ===== Owner index =====

    @Test
    void findVehiclesByOwner_AfterTransfer_MovesVinAndKeepsOrder() {
        // Given
        Vehicle first = vehicle("VIN001", ALICE);
        Vehicle second = vehicle("VIN002", BOB);
        Vehicle third = vehicle("VIN003", ALICE);
        store.commit(new Transaction().putVehicle(first).putVehicle(second));
        store.commit(new Transaction().putVehicle(third));

        // When
        store.commit(new Transaction().putVehicle(first.transferTo(BOB)));

        // Then
        assertThat(store.findVehiclesByOwner(BOB))
            .extracting(Vehicle::vin)
            .containsExactly(Vin.of("VIN001"), Vin.of("VIN002"));
        assertThat(store.findVehiclesByOwner(ALICE))
            .extracting(Vehicle::vin)
            .containsExactly(Vin.of("VIN003"));
    }

    @Test
    void findVehiclesByOwner_UnknownOwner_ReturnsEmpty() {
        assertThat(store.findVehiclesByOwner(Address.of("0xnobody"))).isEmpty();
    }

    // ===== Maintenance =====

    @Test
    void maintenanceHistory_IsPerMechanicAndAppendOnly() {
        // Given
        Vin vin = Vin.of("VIN001");
        MaintenanceRecord oil = new MaintenanceRecord(BOB, "oil change", 10, false);
        MaintenanceRecord brakes = new MaintenanceRecord(BOB, "brakes", 20, true);
        MaintenanceRecord other = new MaintenanceRecord(ALICE, "wash", 30, false);

        // When
        store.commit(new Transaction().grantMechanic(vin, BOB).appendMaintenance(vin, oil));
        store.commit(new Transaction().appendMaintenance(vin, brakes).appendMaintenance(vin, other));

        // Then
        assertThat(store.maintenanceHistory(vin, BOB)).containsExactly(oil, brakes);
        assertThat(store.maintenanceHistory(vin, ALICE)).containsExactly(other);
        assertThat(store.isMechanicAuthorized(vin, BOB)).isTrue();
        assertThat(store.isMechanicAuthorized(vin, ALICE)).isFalse();
    }

    // ===== Interactions =====

    @Test
    void interactions_IndexedByBothIdentifiers() {
        // When
        store.commit(new Transaction()
            .appendInteraction(interaction(0, "did:a:e", "did:b:e"))
            .appendInteraction(interaction(1, "did:b:e", "VIN001")));

        // Then
        assertThat(store.interactionCount()).isEqualTo(2);
        assertThat(store.interactionsFor("did:b:e")).extracting(Interaction::sequence).containsExactly(0L, 1L);
        assertThat(store.interactionsFor("VIN001")).extracting(Interaction::sequence).containsExactly(1L);
        assertThat(store.interactionsBetween("VIN001", "did:b:e")).extracting(Interaction::sequence).containsExactly(1L);
        assertThat(store.interactionsBetween("did:a:e", "VIN001")).isEmpty();
    }

    @Test
    void commit_SequenceGap_ThrowsAndAppliesNothing() {
        // Given
        store.commit(new Transaction().appendInteraction(interaction(0, "did:a:e", "did:b:e")));
        Transaction gap = new Transaction()
            .putPrincipal(principal(ALICE, "alice"))
            .appendInteraction(interaction(2, "did:a:e", "did:b:e"));

        // When & Then
        assertThatThrownBy(() -> store.commit(gap))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("expected: 1");
        assertThat(store.interactionCount()).isEqualTo(1);
        assertThat(store.findPrincipal(ALICE)).isEmpty();
    }

    @Test
    void commit_NullTransaction_ThrowsException() {
        assertThatThrownBy(() -> store.commit(null)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void reads_ReturnUnmodifiableSnapshots() {
        // Given
        store.commit(new Transaction().putPrincipal(principal(ALICE, "alice")));

        // When
        List<Address> snapshot = store.registeredAddresses();
        store.commit(new Transaction().putPrincipal(principal(BOB, "bob")));

        // Then
        assertThat(snapshot).containsExactly(ALICE);
        assertThatThrownBy(() -> snapshot.add(BOB)).isInstanceOf(UnsupportedOperationException.class);
    }

    // ===== Fixtures =====

    private static Principal principal(Address address, String name) {
        return new Principal(address, name, Role.INDIVIDUAL, Did.of("did:" + name + ":e"),
            Did.of("did:" + name + ":w"), true, 0);
    }

    private static Vehicle vehicle(String vin, Address owner) {
        return Vehicle.register(Vin.of(vin), "Hyundai", "Ioniq 5", 2023, owner,
            Did.of("did:vehicle:" + vin + "-e"), Did.of("did:vehicle:" + vin + "-w"), null, 0);
    }

    private static Interaction interaction(long sequence, String from, String to) {
        return new Interaction(sequence, ALICE, BOB, from, to, "V2V", Payload.empty(), 0);
    }
}
