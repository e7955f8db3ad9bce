/**
 * Command contract package.
 *
 * <h2>Core Types</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.core.contract.Command} - Sealed hierarchy, one record per mutating operation</li>
 *   <li>{@link com.ryuqq.registry.core.contract.Envelope} - Command + CommandId + caller + acceptance time</li>
 *   <li>{@link com.ryuqq.registry.core.contract.CommandId} - Submission identifier</li>
 * </ul>
 *
 * <h2>Design Principles</h2>
 * <ul>
 *   <li><strong>Immutability:</strong> All contract types are records or final value objects</li>
 *   <li><strong>Caller Separation:</strong> The caller address travels in the envelope, never in the command</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.contract;
