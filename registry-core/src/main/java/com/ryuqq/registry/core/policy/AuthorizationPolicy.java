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

import java.util.Optional;

/**
 * 권한 및 사전조건 가드.
 *
 * <p>모든 가드는 커밋된 상태만 읽고 부작용이 없습니다. 조건을 만족하지 못하면 안정적인
 * {@link ReasonCode}를 가진 타입 예외를 던지며, 레지스트리는 첫 위반에서 즉시 중단합니다.</p>
 *
 * <p><strong>예외 매핑:</strong></p>
 * <ul>
 *   <li>입력 형식, 대상 자격 위반: {@link ValidationException}</li>
 *   <li>호출자 자격 위반: {@link AuthorizationException}</li>
 *   <li>존재하지 않는 VIN, DID: {@link NotFoundException}</li>
 *   <li>중복 등록: {@link ConflictException}</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class AuthorizationPolicy {

    private final RegistryReader reader;

    /**
     * AuthorizationPolicy 생성.
     *
     * @param reader 커밋된 상태 조회
     * @throws IllegalArgumentException reader가 null인 경우
     */
    public AuthorizationPolicy(RegistryReader reader) {
        if (reader == null) {
            throw new IllegalArgumentException("reader cannot be null");
        }
        this.reader = reader;
    }

    // ===== 입력 검증 =====

    /**
     * 문자열 필드가 비어있지 않은지 확인.
     *
     * @throws ValidationException null이거나 공백인 경우 (EMPTY_FIELD)
     */
    public static String requireNotBlank(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new ValidationException(ReasonCode.EMPTY_FIELD, field + " cannot be empty");
        }
        return value;
    }

    /**
     * 길이 상한 확인.
     *
     * @throws ValidationException 상한을 초과한 경우 (SIZE_LIMIT_EXCEEDED)
     */
    public static void requireMaxLength(long length, long max, String field) {
        if (length > max) {
            throw new ValidationException(ReasonCode.SIZE_LIMIT_EXCEEDED,
                field + " exceeds maximum size (" + length + " > " + max + ")");
        }
    }

    // ===== 호출자 가드 =====

    /**
     * 호출자가 등록된 Principal인지 확인.
     *
     * @return 호출자 Principal
     * @throws AuthorizationException 등록되지 않은 경우 (NOT_REGISTERED)
     */
    public Principal requireRegistered(Address caller) {
        return reader.findPrincipal(caller)
            .filter(Principal::registered)
            .orElseThrow(() -> new AuthorizationException(ReasonCode.NOT_REGISTERED,
                "Caller is not a registered principal: " + caller.getValue()));
    }

    /**
     * 호출자가 아직 Principal이나 노변 기지국으로 등록되지 않았는지 확인.
     *
     * @throws ConflictException 이미 등록된 경우 (ADDRESS_ALREADY_REGISTERED)
     */
    public void requireUnregistered(Address caller) {
        if (reader.findPrincipal(caller).isPresent() || reader.findRoadsideUnit(caller).isPresent()) {
            throw new ConflictException(ReasonCode.ADDRESS_ALREADY_REGISTERED,
                "Address already registered: " + caller.getValue());
        }
    }

    /**
     * 호출자가 등록되어 있고 지정된 역할인지 확인.
     *
     * @return 호출자 Principal
     * @throws AuthorizationException 미등록 (NOT_REGISTERED) 또는 역할 불일치 (ROLE_REQUIRED)
     */
    public Principal requireRole(Address caller, Role role) {
        Principal principal = requireRegistered(caller);
        if (!principal.hasRole(role)) {
            throw new AuthorizationException(ReasonCode.ROLE_REQUIRED,
                "Caller must have role " + role.displayName() + " (current: " + principal.role().displayName() + ")");
        }
        return principal;
    }

    /**
     * 호출자가 등록된 노변 기지국인지 확인.
     *
     * @return 호출자 RoadsideUnit
     * @throws AuthorizationException 노변 기지국으로 등록되지 않은 경우 (NOT_REGISTERED)
     */
    public RoadsideUnit requireRoadsideUnit(Address caller) {
        return reader.findRoadsideUnit(caller)
            .orElseThrow(() -> new AuthorizationException(ReasonCode.NOT_REGISTERED,
                "Caller is not a registered roadside unit: " + caller.getValue()));
    }

    // ===== 대상 가드 =====

    /**
     * 대상 주소가 등록된 Principal인지 확인.
     *
     * @throws ValidationException 등록되지 않은 경우 (TARGET_NOT_REGISTERED)
     */
    public Principal requireRegisteredTarget(Address target) {
        return reader.findPrincipal(target)
            .filter(Principal::registered)
            .orElseThrow(() -> new ValidationException(ReasonCode.TARGET_NOT_REGISTERED,
                "Target is not a registered principal: " + target.getValue()));
    }

    /**
     * 대상 주소가 등록된 Principal이며 지정된 역할인지 확인.
     *
     * @throws ValidationException 미등록 (TARGET_NOT_REGISTERED) 또는 역할 불일치 (INVALID_ROLE)
     */
    public Principal requireTargetRole(Address target, Role role) {
        Principal principal = requireRegisteredTarget(target);
        if (!principal.hasRole(role)) {
            throw new ValidationException(ReasonCode.INVALID_ROLE,
                "Target must have role " + role.displayName() + ": " + target.getValue());
        }
        return principal;
    }

    /**
     * DID를 등록된 Principal로 해석.
     *
     * @throws NotFoundException 바인딩이 없거나 Principal이 아닌 경우 (DID_NOT_FOUND)
     */
    public Principal requirePrincipalByDid(Did did) {
        return reader.findAddressByDid(did)
            .flatMap(reader::findPrincipal)
            .filter(Principal::registered)
            .orElseThrow(() -> new NotFoundException(ReasonCode.DID_NOT_FOUND,
                "DID does not resolve to a registered principal: " + did.getValue()));
    }

    // ===== 차량 가드 =====

    /**
     * @throws NotFoundException 존재하지 않는 VIN (VEHICLE_NOT_FOUND)
     */
    public Vehicle requireVehicle(Vin vin) {
        return reader.findVehicle(vin)
            .filter(Vehicle::registered)
            .orElseThrow(() -> new NotFoundException(ReasonCode.VEHICLE_NOT_FOUND,
                "Vehicle not found: " + vin.getValue()));
    }

    /**
     * 호출자가 차량의 현재 소유자인지 확인.
     *
     * @return 차량
     * @throws NotFoundException 존재하지 않는 VIN
     * @throws AuthorizationException 소유자가 아닌 경우 (NOT_VEHICLE_OWNER)
     */
    public Vehicle requireVehicleOwner(Address caller, Vin vin) {
        Vehicle vehicle = requireVehicle(vin);
        if (!vehicle.isOwnedBy(caller)) {
            throw new AuthorizationException(ReasonCode.NOT_VEHICLE_OWNER,
                "Caller is not the owner of vehicle " + vin.getValue());
        }
        return vehicle;
    }

    /**
     * 호출자가 해당 차량에 대해 권한을 부여받은 정비사인지 확인.
     *
     * @return 차량
     * @throws NotFoundException 존재하지 않는 VIN
     * @throws AuthorizationException 정비사가 아니거나 (ROLE_REQUIRED) 권한이 없는 경우 (MECHANIC_NOT_AUTHORIZED)
     */
    public Vehicle requireMechanicAuthorized(Address caller, Vin vin) {
        Vehicle vehicle = requireVehicle(vin);
        requireRole(caller, Role.MECHANIC);
        if (!reader.isMechanicAuthorized(vin, caller)) {
            throw new AuthorizationException(ReasonCode.MECHANIC_NOT_AUTHORIZED,
                "Mechanic " + caller.getValue() + " is not authorized for vehicle " + vin.getValue());
        }
        return vehicle;
    }

    /**
     * 보험 계약 대상 확인.
     *
     * <p>보험사 역할, 차량 등록, 소유자 존재 순서로 확인하며 위반은 모두 {@link ValidationException}입니다.</p>
     *
     * @return 소유자가 있는 등록 차량
     * @throws ValidationException 보험사가 아닌 호출자 (INVALID_ROLE), 등록되지 않은 VIN (VEHICLE_NOT_REGISTERED),
     *                             소유자 없는 차량 (VEHICLE_WITHOUT_OWNER)
     */
    public Vehicle requireInsurableVehicle(Address caller, Vin vin) {
        boolean insurer = reader.findPrincipal(caller)
            .filter(Principal::registered)
            .filter(principal -> principal.hasRole(Role.INSURANCE_COMPANY))
            .isPresent();
        if (!insurer) {
            throw new ValidationException(ReasonCode.INVALID_ROLE,
                "Caller must be a registered " + Role.INSURANCE_COMPANY.displayName() + ": " + caller.getValue());
        }
        Vehicle vehicle = reader.findVehicle(vin)
            .filter(Vehicle::registered)
            .orElseThrow(() -> new ValidationException(ReasonCode.VEHICLE_NOT_REGISTERED,
                "Vehicle is not registered: " + vin.getValue()));
        if (vehicle.currentOwner() == null) {
            throw new ValidationException(ReasonCode.VEHICLE_WITHOUT_OWNER,
                "Vehicle has no owner: " + vin.getValue());
        }
        return vehicle;
    }

    // ===== DID 가드 =====

    /**
     * @throws ConflictException 이미 등록된 DID (DID_ALREADY_REGISTERED)
     */
    public void requireDidUnregistered(Did did) {
        if (reader.isDidRegistered(did)) {
            throw new ConflictException(ReasonCode.DID_ALREADY_REGISTERED,
                "DID already registered: " + did.getValue());
        }
    }

    /**
     * DID가 등록되어 있고 폐기되지 않았는지 확인.
     */
    public boolean isValidDid(Did did) {
        if (!reader.isDidRegistered(did)) {
            return false;
        }
        Optional<DidDocument> document = reader.findDidDocument(did);
        return document.map(doc -> !doc.isRevoked()).orElse(true);
    }

    /**
     * @throws ValidationException 미등록 또는 폐기된 DID (INVALID_DID)
     */
    public void requireValidDid(Did did, String field) {
        if (!isValidDid(did)) {
            throw new ValidationException(ReasonCode.INVALID_DID,
                field + " is not a valid DID (unregistered or revoked): " + did.getValue());
        }
    }

    /**
     * 컨트롤러가 설정된 DID 문서는 해당 컨트롤러만 변경할 수 있습니다.
     * 문서가 없거나 컨트롤러가 없으면 통과합니다.
     *
     * @throws AuthorizationException 호출자가 컨트롤러가 아닌 경우 (NOT_DID_CONTROLLER)
     */
    public void requireDidController(Address caller, Did did) {
        reader.findDidDocument(did)
            .filter(DidDocument::hasController)
            .filter(doc -> !doc.controller().equals(caller))
            .ifPresent(doc -> {
                throw new AuthorizationException(ReasonCode.NOT_DID_CONTROLLER,
                    "Caller is not the controller of " + did.getValue());
            });
    }
}
