/**
 * Value objects for maintenance parameters and the manifest entries that carry them.
 *
 * <h2>Parameters</h2>
 * <ul>
 *   <li>{@link com.ryuqq.maintenance.core.model.MaintenanceParams} - The persisted configuration record</li>
 *   <li>{@link com.ryuqq.maintenance.core.model.CycleParams} - Enabled flag and interval of one cycle</li>
 *   <li>{@link com.ryuqq.maintenance.core.model.LogRetentionOptions} - Maintenance log retention policy</li>
 * </ul>
 *
 * <h2>Manifest Entries</h2>
 * <ul>
 *   <li>{@link com.ryuqq.maintenance.core.model.ManifestId} - Opaque, totally ordered entry identifier</li>
 *   <li>{@link com.ryuqq.maintenance.core.model.ManifestLabels} - Classification labels with subset matching</li>
 *   <li>{@link com.ryuqq.maintenance.core.model.EntryMetadata} - Entry metadata returned by label queries</li>
 *   <li>{@link com.ryuqq.maintenance.core.model.ClientIdentity} - {@code user@host} identity of a connected client</li>
 * </ul>
 *
 * <p>All types are immutable. Parameter records carry no serialization annotations;
 * the manifest backend decides the wire format.</p>
 *
 * @since 1.0.0
 * @author Maintenance Team
 */
package com.ryuqq.maintenance.core.model;
