package com.ryuqq.registry.core.policy;

import com.ryuqq.registry.core.domain.DidDocument;
import com.ryuqq.registry.core.domain.Principal;
import com.ryuqq.registry.core.domain.RoadsideUnit;
import com.ryuqq.registry.core.domain.Vehicle;
import com.ryuqq.registry.core.error.AuthorizationException;
import com.ryuqq.registry.core.error.ConflictException;
import com.ryuqq.registry.core.error.NotFoundException;
import com.ryuqq.registry.core.error.ReasonCode;
import com.ryuqq.registry.core.error.ValidationException;
import com.ryuqq.registry.core.model.Address;
import com.ryuqq.registry.core.model.Did;
import com.ryuqq.registry.core.model.Role;
import com.ryuqq.registry.core.model.Vin;
import com.ryuqq.registry.core.spi.RegistryReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.when;

/**
 * AuthorizationPolicy 테스트.
 *
 * <p>RegistryReader를 Mock으로 대체하여 각 가드의 ReasonCode를 검증합니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
@ExtendWith(MockitoExtension.class)
class AuthorizationPolicyTest {

    private static final Address ALICE = Address.of("0xalice");
    private static final Address BOB = Address.of("0xbob");
    private static final Vin VIN = Vin.of("VIN001");
    private static final Did ALICE_E = Did.of("did:alice:e");

    @Mock
    private RegistryReader reader;

    private AuthorizationPolicy policy;

    @BeforeEach
    void setUp() {
        policy = new AuthorizationPolicy(reader);
    }

    // ===== 입력 검증 =====

    @Test
    void requireNotBlank_BlankValue_ThrowsEmptyField() {
        ValidationException exception = assertThrows(ValidationException.class,
            () -> AuthorizationPolicy.requireNotBlank("  ", "name"));
        assertEquals(ReasonCode.EMPTY_FIELD, exception.getReason());
        assertTrue(exception.getMessage().contains("name"));
        assertEquals("ok", AuthorizationPolicy.requireNotBlank("ok", "name"));
    }

    @Test
    void requireMaxLength_OverLimit_ThrowsSizeLimitExceeded() {
        assertDoesNotThrow(() -> AuthorizationPolicy.requireMaxLength(10, 10, "document"));
        assertEquals(ReasonCode.SIZE_LIMIT_EXCEEDED, assertThrows(ValidationException.class,
            () -> AuthorizationPolicy.requireMaxLength(11, 10, "document")).getReason());
    }

    // ===== 호출자 가드 =====

    @Test
    void requireRole_UnregisteredCaller_ThrowsNotRegistered() {
        when(reader.findPrincipal(ALICE)).thenReturn(Optional.empty());

        AuthorizationException exception = assertThrows(AuthorizationException.class,
            () -> policy.requireRole(ALICE, Role.MECHANIC));
        assertEquals(ReasonCode.NOT_REGISTERED, exception.getReason());
    }

    @Test
    void requireRole_WrongRole_ThrowsRoleRequired() {
        when(reader.findPrincipal(ALICE)).thenReturn(Optional.of(principal(ALICE, Role.INDIVIDUAL)));

        AuthorizationException exception = assertThrows(AuthorizationException.class,
            () -> policy.requireRole(ALICE, Role.INSURANCE_COMPANY));
        assertEquals(ReasonCode.ROLE_REQUIRED, exception.getReason());
        assertTrue(exception.getMessage().contains("Insurance Provider"));
    }

    @Test
    void requireUnregistered_RoadsideUnitAtAddress_ThrowsConflict() {
        when(reader.findPrincipal(ALICE)).thenReturn(Optional.empty());
        when(reader.findRoadsideUnit(ALICE)).thenReturn(Optional.of(
            new RoadsideUnit(ALICE, "rsu", "Main St", ALICE_E, Did.of("did:alice:w"), true, 0)));

        assertEquals(ReasonCode.ADDRESS_ALREADY_REGISTERED,
            assertThrows(ConflictException.class, () -> policy.requireUnregistered(ALICE)).getReason());
    }

    // ===== 대상 가드 =====

    @Test
    void requireTargetRole_WrongRole_ThrowsInvalidRole() {
        when(reader.findPrincipal(BOB)).thenReturn(Optional.of(principal(BOB, Role.INDIVIDUAL)));

        assertEquals(ReasonCode.INVALID_ROLE, assertThrows(ValidationException.class,
            () -> policy.requireTargetRole(BOB, Role.MECHANIC)).getReason());
    }

    @Test
    void requirePrincipalByDid_UnboundDid_ThrowsDidNotFound() {
        when(reader.findAddressByDid(ALICE_E)).thenReturn(Optional.empty());

        assertEquals(ReasonCode.DID_NOT_FOUND, assertThrows(NotFoundException.class,
            () -> policy.requirePrincipalByDid(ALICE_E)).getReason());
    }

    // ===== 차량 가드 =====

    @Test
    void requireVehicleOwner_OtherCaller_ThrowsNotVehicleOwner() {
        when(reader.findVehicle(VIN)).thenReturn(Optional.of(vehicle(ALICE)));

        assertEquals(ReasonCode.NOT_VEHICLE_OWNER, assertThrows(AuthorizationException.class,
            () -> policy.requireVehicleOwner(BOB, VIN)).getReason());
        assertEquals(VIN, policy.requireVehicleOwner(ALICE, VIN).vin());
    }

    @Test
    void requireMechanicAuthorized_NoGrant_ThrowsMechanicNotAuthorized() {
        when(reader.findVehicle(VIN)).thenReturn(Optional.of(vehicle(ALICE)));
        when(reader.findPrincipal(BOB)).thenReturn(Optional.of(principal(BOB, Role.MECHANIC)));
        when(reader.isMechanicAuthorized(VIN, BOB)).thenReturn(false);

        assertEquals(ReasonCode.MECHANIC_NOT_AUTHORIZED, assertThrows(AuthorizationException.class,
            () -> policy.requireMechanicAuthorized(BOB, VIN)).getReason());
    }

    @Test
    void requireMechanicAuthorized_UnknownVin_ChecksVehicleFirst() {
        when(reader.findVehicle(VIN)).thenReturn(Optional.empty());

        assertEquals(ReasonCode.VEHICLE_NOT_FOUND, assertThrows(NotFoundException.class,
            () -> policy.requireMechanicAuthorized(BOB, VIN)).getReason());
    }

    @Test
    void requireInsurableVehicle_NonInsurerCaller_ThrowsInvalidRole() {
        when(reader.findPrincipal(ALICE)).thenReturn(Optional.of(principal(ALICE, Role.INDIVIDUAL)));

        assertEquals(ReasonCode.INVALID_ROLE, assertThrows(ValidationException.class,
            () -> policy.requireInsurableVehicle(ALICE, VIN)).getReason());
    }

    @Test
    void requireInsurableVehicle_UnknownVin_ThrowsVehicleNotRegistered() {
        when(reader.findPrincipal(BOB)).thenReturn(Optional.of(principal(BOB, Role.INSURANCE_COMPANY)));
        when(reader.findVehicle(VIN)).thenReturn(Optional.empty());

        assertEquals(ReasonCode.VEHICLE_NOT_REGISTERED, assertThrows(ValidationException.class,
            () -> policy.requireInsurableVehicle(BOB, VIN)).getReason());
    }

    @Test
    void requireInsurableVehicle_InsurerAndOwnedVehicle_ReturnsVehicle() {
        when(reader.findPrincipal(BOB)).thenReturn(Optional.of(principal(BOB, Role.INSURANCE_COMPANY)));
        when(reader.findVehicle(VIN)).thenReturn(Optional.of(vehicle(ALICE)));

        assertEquals(ALICE, policy.requireInsurableVehicle(BOB, VIN).currentOwner());
    }

    // ===== DID 가드 =====

    @Test
    void isValidDid_RegisteredWithoutDocument_ReturnsTrue() {
        when(reader.isDidRegistered(ALICE_E)).thenReturn(true);
        when(reader.findDidDocument(ALICE_E)).thenReturn(Optional.empty());

        assertTrue(policy.isValidDid(ALICE_E));
    }

    @Test
    void isValidDid_RevokedDocument_ReturnsFalse() {
        when(reader.isDidRegistered(ALICE_E)).thenReturn(true);
        when(reader.findDidDocument(ALICE_E)).thenReturn(Optional.of(
            new DidDocument(ALICE_E, "{}", 1, false, ALICE)));

        assertFalse(policy.isValidDid(ALICE_E));
        assertEquals(ReasonCode.INVALID_DID, assertThrows(ValidationException.class,
            () -> policy.requireValidDid(ALICE_E, "subjectDid")).getReason());
    }

    @Test
    void isValidDid_Unregistered_ReturnsFalse() {
        when(reader.isDidRegistered(ALICE_E)).thenReturn(false);

        assertFalse(policy.isValidDid(ALICE_E));
    }

    @Test
    void requireDidController_NoDocument_Passes() {
        when(reader.findDidDocument(ALICE_E)).thenReturn(Optional.empty());

        assertDoesNotThrow(() -> policy.requireDidController(BOB, ALICE_E));
    }

    @Test
    void requireDidController_OtherController_ThrowsNotDidController() {
        when(reader.findDidDocument(ALICE_E)).thenReturn(Optional.of(new DidDocument(ALICE_E, "{}", 1, true, ALICE)));

        assertEquals(ReasonCode.NOT_DID_CONTROLLER, assertThrows(AuthorizationException.class,
            () -> policy.requireDidController(BOB, ALICE_E)).getReason());
        assertDoesNotThrow(() -> policy.requireDidController(ALICE, ALICE_E));
    }

    @Test
    void requireDidUnregistered_TakenDid_ThrowsConflict() {
        when(reader.isDidRegistered(ALICE_E)).thenReturn(true);

        assertEquals(ReasonCode.DID_ALREADY_REGISTERED, assertThrows(ConflictException.class,
            () -> policy.requireDidUnregistered(ALICE_E)).getReason());
    }

    @Test
    void constructor_NullReader_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> new AuthorizationPolicy(null));
    }

    private static Principal principal(Address address, Role role) {
        String name = address.getValue().substring(2);
        return new Principal(address, name, role, Did.of("did:" + name + ":e"), Did.of("did:" + name + ":w"), true, 0);
    }

    private static Vehicle vehicle(Address owner) {
        return Vehicle.register(VIN, "Tesla", "Model 3", 2022, owner,
            Did.of("did:vehicle:VIN001-e"), Did.of("did:vehicle:VIN001-w"), null, 0);
    }
}
