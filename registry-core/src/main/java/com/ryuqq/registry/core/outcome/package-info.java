/**
 * Command execution outcome package.
 *
 * <h2>Sealed Interface</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.core.outcome.Outcome} - Sealed interface (permits Ok, Fail)</li>
 * </ul>
 *
 * <h2>Outcome Cases</h2>
 * <ul>
 *   <li>{@link com.ryuqq.registry.core.outcome.Ok} - Command committed</li>
 *   <li>{@link com.ryuqq.registry.core.outcome.Fail} - Command rejected, no state change</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.outcome;
