/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines the seams that infrastructure adapters implement to give the
 * registry state machine durable state and a notification sink.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.core.spi.RegistryReader} - Committed-state queries and indices</li>
 *   <li>{@link com.ryuqq.registry.core.spi.RegistryStore} - Reader plus atomic transaction commit</li>
 *   <li>{@link com.ryuqq.registry.core.spi.EventPublisher} - Post-commit notifications</li>
 * </ul>
 *
 * <h2>Write Path</h2>
 * <p>Writes never reach a store one field at a time. The registry stages them in a
 * {@link com.ryuqq.registry.core.spi.Transaction} and commits the whole buffer.</p>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., registry-adapter-inmemory) provide concrete implementations.
 * The registry-testkit module ships a contract suite any store implementation can extend.</p>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.spi;
