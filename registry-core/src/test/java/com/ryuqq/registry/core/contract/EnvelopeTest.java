package com.ryuqq.registry.core.contract;

import com.ryuqq.registry.core.model.Address;
import com.ryuqq.registry.core.model.Did;
import com.ryuqq.registry.core.model.Payload;
import com.ryuqq.registry.core.model.Vin;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Envelope, CommandId, Command 테스트.
 *
 * @author Registry Team
 * @since 1.0.0
 */
class EnvelopeTest {

    private static final Address ALICE = Address.of("0xalice");

    @Test
    void of_ValidArguments_CreatesEnvelope() {
        // Given
        CommandId commandId = CommandId.of("cmd-1");
        Command command = new Command.RevokeDidDocument(Did.of("did:alice:e"));

        // When
        Envelope envelope = Envelope.of(commandId, ALICE, command, 1_700_000_000_000L);

        // Then
        assertEquals(commandId, envelope.commandId());
        assertEquals(ALICE, envelope.caller());
        assertEquals(command, envelope.command());
        assertEquals(1_700_000_000_000L, envelope.acceptedAt());
    }

    @Test
    void of_InvalidArguments_ThrowsException() {
        Command command = new Command.DeactivateRoadsideUnit();
        CommandId commandId = CommandId.of("cmd-1");

        assertThrows(IllegalArgumentException.class, () -> Envelope.of(null, ALICE, command, 0));
        assertThrows(IllegalArgumentException.class, () -> Envelope.of(commandId, null, command, 0));
        assertThrows(IllegalArgumentException.class, () -> Envelope.of(commandId, ALICE, null, 0));
        assertThrows(IllegalArgumentException.class, () -> Envelope.of(commandId, ALICE, command, -1));
    }

    @Test
    void commandId_Random_IsUniqueAndValid() {
        CommandId first = CommandId.random();
        CommandId second = CommandId.random();

        assertNotEquals(first, second);
        assertEquals(36, first.getValue().length());
    }

    @Test
    void commandId_InvalidCharacters_ThrowsException() {
        assertThrows(IllegalArgumentException.class, () -> CommandId.of("cmd 1"));
        assertThrows(IllegalArgumentException.class, () -> CommandId.of("cmd/1"));
        assertThrows(IllegalArgumentException.class, () -> CommandId.of(""));
    }

    @Test
    void command_TypeIsSimpleRecordName() {
        assertEquals("TransferOwnership", new Command.TransferOwnership(Vin.of("VIN001"), ALICE).type());
        assertEquals("DeactivateRoadsideUnit", new Command.DeactivateRoadsideUnit().type());
    }

    @Test
    void command_RequiredFields_ThrowException() {
        assertThrows(IllegalArgumentException.class, () -> new Command.TransferOwnership(null, ALICE));
        assertThrows(IllegalArgumentException.class, () -> new Command.AuthorizeMechanic(Vin.of("VIN001"), null));
    }

    @Test
    void recordInteraction_NullPayload_BecomesEmpty() {
        Command.RecordInteraction command = new Command.RecordInteraction(ALICE, "did:a:e", "did:b:e", "V2V", null);

        assertEquals(Payload.empty(), command.payload());
    }
}
