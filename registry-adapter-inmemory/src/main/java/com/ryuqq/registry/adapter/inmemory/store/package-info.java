/**
 * In-memory RegistryStore adapter implementation package.
 *
 * <p>This package provides the reference implementation of the
 * {@link com.ryuqq.registry.core.spi.RegistryStore} SPI for tests and local use.</p>
 *
 * <p><strong>Design Principles:</strong></p>
 * <ul>
 *   <li><strong>Atomic Commit:</strong> A transaction is applied whole under the write half of a
 *       {@link java.util.concurrent.locks.ReentrantReadWriteLock}</li>
 *   <li><strong>Consistent Reads:</strong> Every read takes the read half, so no reader observes a partial commit</li>
 *   <li><strong>Derived Indices:</strong> Owner, DID binding and interaction-position indices change in the same commit as their records</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @see com.ryuqq.registry.core.spi.RegistryStore
 * @author Registry Team
 * @since 1.0.0
 */
package com.ryuqq.registry.adapter.inmemory.store;
