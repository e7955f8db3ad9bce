package com.ryuqq.registry.core.contract;

import com.ryuqq.registry.core.model.Address;
import com.ryuqq.registry.core.model.CredentialId;
import com.ryuqq.registry.core.model.Did;
import com.ryuqq.registry.core.model.Payload;
import com.ryuqq.registry.core.model.Role;
import com.ryuqq.registry.core.model.Vin;

/**
 * 레지스트리 상태 변경 명령.
 *
 * <p>상태를 변경하는 연산마다 하나의 record가 대응됩니다. 호출자 주소는 Command가 아니라
 * {@link Envelope}에 담깁니다.</p>
 *
 * <p>식별자 필드는 null일 수 없습니다. 문자열 필드(이름, 설명, 문서 등)의 공백 검사는
 * 실행 시점에 레지스트리 가드가 수행하며, 위반 시 ValidationException이 발생합니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public sealed interface Command {

    /**
     * Command 유형 이름 (로그, 메시지용).
     *
     * @return 유형 이름
     */
    default String type() {
        return getClass().getSimpleName();
    }

    /**
     * 호출자를 Principal로 등록.
     */
    record RegisterPrincipal(String name, Role role, Did entityDid, Did walletDid) implements Command {
        public RegisterPrincipal {
            requireNonNull(role, "role");
            requireNonNull(entityDid, "entityDid");
            requireNonNull(walletDid, "walletDid");
        }
    }

    /**
     * 호출자를 노변 기지국으로 등록.
     */
    record RegisterRoadsideUnit(String name, String location, Did entityDid, Did walletDid) implements Command {
        public RegisterRoadsideUnit {
            requireNonNull(entityDid, "entityDid");
            requireNonNull(walletDid, "walletDid");
        }
    }

    /**
     * 호출자 자신의 노변 기지국 비활성화.
     */
    record DeactivateRoadsideUnit() implements Command {
    }

    /**
     * 차량 등록. credentialDid는 null 가능.
     */
    record RegisterVehicle(
        Vin vin,
        Did ownerDid,
        Did entityDid,
        int year,
        String make,
        String model,
        Did walletDid,
        Did credentialDid
    ) implements Command {
        public RegisterVehicle {
            requireNonNull(vin, "vin");
            requireNonNull(ownerDid, "ownerDid");
            requireNonNull(entityDid, "entityDid");
            requireNonNull(walletDid, "walletDid");
        }
    }

    record TransferOwnership(Vin vin, Address newOwner) implements Command {
        public TransferOwnership {
            requireNonNull(vin, "vin");
            requireNonNull(newOwner, "newOwner");
        }
    }

    record UpdateVehicleConfiguration(Vin vin, String configuration) implements Command {
        public UpdateVehicleConfiguration {
            requireNonNull(vin, "vin");
        }
    }

    record AuthorizeMechanic(Vin vin, Address mechanic) implements Command {
        public AuthorizeMechanic {
            requireNonNull(vin, "vin");
            requireNonNull(mechanic, "mechanic");
        }
    }

    record AddMaintenanceRecord(Vin vin, String description, boolean critical) implements Command {
        public AddMaintenanceRecord {
            requireNonNull(vin, "vin");
        }
    }

    /**
     * 보험 증권 생성. 기간은 epoch seconds.
     */
    record CreateInsurancePolicy(Vin vin, long startDate, long endDate) implements Command {
        public CreateInsurancePolicy {
            requireNonNull(vin, "vin");
        }
    }

    record StoreDidDocument(Did did, String document) implements Command {
        public StoreDidDocument {
            requireNonNull(did, "did");
        }
    }

    record RevokeDidDocument(Did did) implements Command {
        public RevokeDidDocument {
            requireNonNull(did, "did");
        }
    }

    record StoreCredential(CredentialId credentialId, Did issuerDid, Did subjectDid, String data) implements Command {
        public StoreCredential {
            requireNonNull(credentialId, "credentialId");
            requireNonNull(issuerDid, "issuerDid");
            requireNonNull(subjectDid, "subjectDid");
        }
    }

    /**
     * 상호작용 기록. 발신 주소는 Envelope의 호출자입니다.
     */
    record RecordInteraction(
        Address destination,
        String sourceIdentifier,
        String destinationIdentifier,
        String interactionType,
        Payload payload
    ) implements Command {
        public RecordInteraction {
            requireNonNull(destination, "destination");
            payload = payload == null ? Payload.empty() : payload;
        }
    }

    private static void requireNonNull(Object value, String field) {
        if (value == null) {
            throw new IllegalArgumentException(field + " cannot be null");
        }
    }
}
