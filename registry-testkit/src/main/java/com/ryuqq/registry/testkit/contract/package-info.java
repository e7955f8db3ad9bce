/**
 * Store-agnostic contract suites for the registry.
 *
 * <p>Each suite is abstract and exercises a {@link com.ryuqq.registry.application.registry.LedgerRegistry}
 * wired over the store returned by {@code createStore()}. A store implementation proves conformance
 * by extending every suite with a one-line subclass in its own test sources.</p>
 *
 * @author Registry Team
 * @since 1.0.0
 */
package com.ryuqq.registry.testkit.contract;
