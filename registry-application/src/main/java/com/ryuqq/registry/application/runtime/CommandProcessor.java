package com.ryuqq.registry.application.runtime;

import com.ryuqq.registry.core.contract.Command;
import com.ryuqq.registry.core.contract.Envelope;
import com.ryuqq.registry.core.model.Address;
import com.ryuqq.registry.core.outcome.Outcome;

import java.util.concurrent.CompletableFuture;

/**
 * Command submission runtime.
 *
 * <p>This interface defines how callers hand mutating commands to the registry outside of the
 * synchronous {@code Registry} API.</p>
 *
 * <p><strong>Guarantees:</strong></p>
 * <ul>
 *   <li>The returned future always completes with an {@link Outcome}; registry errors surface as
 *       {@code Fail}, never as exceptional completion</li>
 *   <li>No internal timeouts, no cancellation, no automatic retry</li>
 *   <li>Commands accepted by one processor are applied in submission order</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * CompletableFuture&lt;Outcome&gt; future = processor.submit(
 *     Address.of("0xA11CE"),
 *     new Command.TransferOwnership(Vin.of("VIN123"), Address.of("0xB0B"))
 * );
 * Outcome outcome = future.join();
 * </pre>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public interface CommandProcessor {

    /**
     * Wraps the command in a fresh envelope and submits it.
     *
     * @param caller transaction sender
     * @param command command to apply
     * @return future outcome
     * @throws IllegalArgumentException if caller or command is null
     * @throws IllegalStateException if the processor has been shut down
     */
    CompletableFuture<Outcome> submit(Address caller, Command command);

    /**
     * Submits a pre-built envelope.
     *
     * @param envelope envelope to apply
     * @return future outcome
     * @throws IllegalArgumentException if envelope is null
     * @throws IllegalStateException if the processor has been shut down
     */
    CompletableFuture<Outcome> submit(Envelope envelope);
}
