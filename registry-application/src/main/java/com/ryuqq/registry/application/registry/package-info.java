/**
 * Registry state machine package.
 *
 * <h2>Core Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.application.registry.Registry} - Synchronous operation contract</li>
 *   <li>{@link com.ryuqq.registry.application.registry.LedgerRegistry} - Single-writer implementation over a
 *       {@link com.ryuqq.registry.core.spi.RegistryStore}</li>
 *   <li>{@link com.ryuqq.registry.application.registry.RegistryConfig} - Size limits</li>
 * </ul>
 *
 * <h2>Atomicity</h2>
 * <p>Every mutating operation validates all guards against committed state, stages its writes in a
 * {@link com.ryuqq.registry.core.spi.Transaction}, commits it whole, and publishes events only after
 * the commit. A failed guard leaves no trace.</p>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.application.registry;
