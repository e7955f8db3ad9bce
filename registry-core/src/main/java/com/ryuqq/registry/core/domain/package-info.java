/**
 * Registry records.
 *
 * <p>Immutable records for principals, roadside units, vehicles, insurance policies,
 * maintenance records, DID documents, credentials and interactions. Cross references are held
 * by key ({@link com.ryuqq.registry.core.model.Address}, {@link com.ryuqq.registry.core.model.Vin}),
 * never by object reference. Nothing is ever destroyed; records are superseded or marked inactive.</p>
 *
 * @since 1.0.0
 * @author Registry Team
 */
package com.ryuqq.registry.core.domain;
