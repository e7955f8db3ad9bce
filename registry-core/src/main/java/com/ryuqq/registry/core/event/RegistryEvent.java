package com.ryuqq.registry.core.event;

import com.ryuqq.registry.core.model.Address;
import com.ryuqq.registry.core.model.CredentialId;
import com.ryuqq.registry.core.model.Did;
import com.ryuqq.registry.core.model.Role;
import com.ryuqq.registry.core.model.Vin;

/**
 * 레지스트리 상태 변경 알림.
 *
 * <p>각 이벤트는 변경을 재구성하는 데 필요한 식별 필드를 담으며,
 * 트랜잭션이 커밋된 뒤에만 발행됩니다. occurredAt은 epoch seconds입니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public sealed interface RegistryEvent {

    long occurredAt();

    record PrincipalRegistered(Address address, Role role, Did entityDid, Did walletDid, long occurredAt)
        implements RegistryEvent {
    }

    record RoadsideUnitRegistered(Address address, String location, Did entityDid, Did walletDid, long occurredAt)
        implements RegistryEvent {
    }

    record RoadsideUnitDeactivated(Address address, long occurredAt) implements RegistryEvent {
    }

    /**
     * DID 신규 등록. boundTo는 DID가 바인딩된 주소 또는 VIN 문자열입니다.
     */
    record DidRegistered(Did did, String boundTo, long occurredAt) implements RegistryEvent {
    }

    record VehicleRegistered(Vin vin, Address owner, Did entityDid, Did walletDid, long occurredAt)
        implements RegistryEvent {
    }

    record OwnershipTransferred(Vin vin, Address previousOwner, Address newOwner, long occurredAt)
        implements RegistryEvent {
    }

    record VehicleConfigurationUpdated(Vin vin, Address owner, long occurredAt) implements RegistryEvent {
    }

    record MechanicAuthorized(Vin vin, Address owner, Address mechanic, long occurredAt) implements RegistryEvent {
    }

    record MaintenanceAdded(Vin vin, Address mechanic, boolean critical, long occurredAt) implements RegistryEvent {
    }

    record PolicyCreated(Vin vin, Address insurer, Address vehicleOwner, long startDate, long endDate, long occurredAt)
        implements RegistryEvent {
    }

    record DidDocumentUpdated(Did did, Address controller, long occurredAt) implements RegistryEvent {
    }

    record DidDocumentRevoked(Did did, Address controller, long occurredAt) implements RegistryEvent {
    }

    record CredentialStored(CredentialId credentialId, Address issuer, Did subjectDid, long occurredAt)
        implements RegistryEvent {
    }

    record InteractionRecorded(
        long sequence,
        Address source,
        Address destination,
        String sourceIdentifier,
        String destinationIdentifier,
        String interactionType,
        long occurredAt
    ) implements RegistryEvent {
    }
}
