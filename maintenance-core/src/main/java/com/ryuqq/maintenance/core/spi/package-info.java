/**
 * Service Provider Interface (SPI) package.
 *
 * <p>This package defines interfaces that must be implemented by infrastructure adapters
 * to give the maintenance params store access to a repository's manifest index.</p>
 *
 * <h2>SPI Interfaces</h2>
 * <ul>
 *   <li>{@link com.ryuqq.maintenance.core.spi.ManifestReader} - Label query and payload load</li>
 *   <li>{@link com.ryuqq.maintenance.core.spi.ManifestWriter} - Create and idempotent delete</li>
 *   <li>{@link com.ryuqq.maintenance.core.spi.Repository} - Manifest reader plus the connected client identity</li>
 *   <li>{@link com.ryuqq.maintenance.core.spi.RepositoryWriter} - Repository with a writable manifest index</li>
 * </ul>
 *
 * <h2>Implementation Responsibility</h2>
 * <p>Adapter layers (e.g., maintenance-adapter-inmemory) provide concrete implementations.
 * The contract tests in maintenance-testkit describe the behavior every implementation must show.</p>
 *
 * <h2>Implementation Guidelines</h2>
 * <ul>
 *   <li><strong>Append-only:</strong> Entries are immutable once created</li>
 *   <li><strong>Multi-writer:</strong> Concurrent creates under the same labels must all be kept and returned by find</li>
 *   <li><strong>Idempotent delete:</strong> Deleting an unknown id is a no-op</li>
 *   <li><strong>Errors:</strong> Report failures as {@link com.ryuqq.maintenance.core.spi.ManifestIndexException}</li>
 * </ul>
 *
 * @since 1.0.0
 * @author Maintenance Team
 */
package com.ryuqq.maintenance.core.spi;
