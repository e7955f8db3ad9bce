package com.ryuqq.registry.application.dispatch;

import com.ryuqq.registry.application.registry.Registry;
import com.ryuqq.registry.core.contract.Command;
import com.ryuqq.registry.core.contract.Envelope;
import com.ryuqq.registry.core.error.RegistryException;
import com.ryuqq.registry.core.model.Address;
import com.ryuqq.registry.core.outcome.Fail;
import com.ryuqq.registry.core.outcome.Ok;
import com.ryuqq.registry.core.outcome.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Envelope을 {@link Registry} 호출로 변환하고 결과를 {@link Outcome}으로 매핑합니다.
 *
 * <p><strong>매핑 규칙:</strong></p>
 * <ul>
 *   <li>정상 완료 → {@link Ok} (commandId, "&lt;type&gt; committed")</li>
 *   <li>{@link RegistryException} → {@link Fail} (reason code, message, error kind)</li>
 *   <li>그 외 예외 → {@link Fail} ("SYS-001", message, 예외 클래스명) + ERROR 로그</li>
 * </ul>
 *
 * <p>예외를 던지지 않으므로 러너는 결과를 그대로 Future에 전달할 수 있습니다.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public final class CommandDispatcher {

    /**
     * 예기치 않은 시스템 오류 코드.
     */
    public static final String SYSTEM_ERROR_CODE = "SYS-001";

    private static final Logger log = LoggerFactory.getLogger(CommandDispatcher.class);

    private final Registry registry;

    /**
     * 생성자.
     *
     * @param registry 레지스트리
     * @throws IllegalArgumentException registry가 null인 경우
     */
    public CommandDispatcher(Registry registry) {
        if (registry == null) {
            throw new IllegalArgumentException("registry cannot be null");
        }
        this.registry = registry;
    }

    /**
     * Envelope 실행.
     *
     * @param envelope 실행할 Envelope
     * @return 실행 결과 (Ok 또는 Fail)
     * @throws IllegalArgumentException envelope이 null인 경우
     */
    public Outcome execute(Envelope envelope) {
        if (envelope == null) {
            throw new IllegalArgumentException("envelope cannot be null");
        }
        Command command = envelope.command();
        try {
            String detail = apply(envelope.caller(), command);
            return new Ok(envelope.commandId(), command.type() + " committed" + detail);
        } catch (RegistryException e) {
            log.debug("Command {} ({}) rejected: {} - {}",
                envelope.commandId().getValue(), command.type(), e.getCode(), e.getMessage());
            return Fail.of(e.getCode(), e.getMessage(), e.getKind().name());
        } catch (RuntimeException e) {
            log.error("Command {} ({}) failed unexpectedly", envelope.commandId().getValue(), command.type(), e);
            String message = e.getMessage() == null || e.getMessage().isBlank()
                ? "Unexpected error while executing " + command.type()
                : e.getMessage();
            return Fail.of(SYSTEM_ERROR_CODE, message, e.getClass().getSimpleName());
        }
    }

    /**
     * Command를 레지스트리 연산으로 라우팅.
     *
     * @return Ok 메시지에 덧붙일 상세 (없으면 빈 문자열)
     */
    private String apply(Address caller, Command command) {
        if (command instanceof Command.RegisterPrincipal c) {
            registry.registerPrincipal(caller, c.name(), c.role(), c.entityDid(), c.walletDid());
        } else if (command instanceof Command.RegisterRoadsideUnit c) {
            registry.registerRoadsideUnit(caller, c.name(), c.location(), c.entityDid(), c.walletDid());
        } else if (command instanceof Command.DeactivateRoadsideUnit) {
            registry.deactivateRoadsideUnit(caller);
        } else if (command instanceof Command.RegisterVehicle c) {
            registry.registerVehicle(c.vin(), c.ownerDid(), c.entityDid(), c.year(), c.make(), c.model(),
                c.walletDid(), c.credentialDid());
        } else if (command instanceof Command.TransferOwnership c) {
            registry.transferOwnership(caller, c.vin(), c.newOwner());
        } else if (command instanceof Command.UpdateVehicleConfiguration c) {
            registry.updateVehicleConfiguration(caller, c.vin(), c.configuration());
        } else if (command instanceof Command.AuthorizeMechanic c) {
            registry.authorizeMechanic(caller, c.vin(), c.mechanic());
        } else if (command instanceof Command.AddMaintenanceRecord c) {
            registry.addMaintenanceRecord(caller, c.vin(), c.description(), c.critical());
        } else if (command instanceof Command.CreateInsurancePolicy c) {
            registry.createInsurancePolicy(caller, c.vin(), c.startDate(), c.endDate());
        } else if (command instanceof Command.StoreDidDocument c) {
            registry.storeDidDocument(caller, c.did(), c.document());
        } else if (command instanceof Command.RevokeDidDocument c) {
            registry.revokeDidDocument(caller, c.did());
        } else if (command instanceof Command.StoreCredential c) {
            registry.storeCredential(caller, c.credentialId(), c.issuerDid(), c.subjectDid(), c.data());
        } else if (command instanceof Command.RecordInteraction c) {
            long sequence = registry.recordInteraction(caller, c.destination(), c.sourceIdentifier(),
                c.destinationIdentifier(), c.interactionType(), c.payload());
            return " (sequence=" + sequence + ")";
        } else {
            throw new IllegalStateException("Unsupported command type: " + command.type());
        }
        return "";
    }
}
