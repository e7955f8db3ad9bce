package com.ryuqq.registry.core.spi;

/**
 * Durable registry state (SPI).
 *
 * <p>A store exposes committed state through {@link RegistryReader} and accepts writes only
 * as whole {@link Transaction}s.</p>
 *
 * <p><strong>Commit Contract:</strong></p>
 * <ul>
 *   <li>All-or-nothing: either every staged write becomes visible or none does</li>
 *   <li>Readers never observe a partially applied transaction</li>
 *   <li>Secondary indices (owner, DID bindings, interaction positions) change in the same commit
 *       as the primary records they derive from</li>
 *   <li>Credentials are write-once and the interaction log is append-only; a transaction that
 *       would violate either is rejected with {@link IllegalStateException} before anything is
 *       applied</li>
 * </ul>
 *
 * @author Registry Team
 * @since 1.0.0
 */
public interface RegistryStore extends RegistryReader {

    /**
     * Applies a transaction atomically.
     *
     * @param transaction staged writes
     * @throws IllegalArgumentException if transaction is null
     * @throws IllegalStateException if the transaction conflicts with committed append-only data
     */
    void commit(Transaction transaction);
}
