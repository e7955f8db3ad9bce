/**
 * Identifier and value object package.
 *
 * <h2>Value Objects</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.core.model.Address} - Account address of a caller</li>
 *   <li>{@link com.ryuqq.registry.core.model.Did} - Decentralized identifier ({@code did:<method>:<id>})</li>
 *   <li>{@link com.ryuqq.registry.core.model.Vin} - Vehicle identification number</li>
 *   <li>{@link com.ryuqq.registry.core.model.CredentialId} - Write-once credential key</li>
 *   <li>{@link com.ryuqq.registry.core.model.Payload} - Opaque interaction bytes</li>
 *   <li>{@link com.ryuqq.registry.core.model.Role} - Principal role</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All value objects are final and immutable</li>
 *   <li><strong>Validation at Construction:</strong> Malformed input raises ValidationException</li>
 *   <li><strong>Value Semantics:</strong> Equality by value, not identity</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.model;
