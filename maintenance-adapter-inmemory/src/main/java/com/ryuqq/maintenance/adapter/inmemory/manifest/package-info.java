/**
 * In-memory manifest index adapter package.
 *
 * <p>This package provides reference implementations of the manifest SPI
 * for testing and educational purposes.</p>
 *
 * <p><strong>Main Components:</strong></p>
 * <ul>
 *   <li>{@link com.ryuqq.maintenance.adapter.inmemory.manifest.InMemoryManifestIndex}:
 *       Thread-safe implementation of {@link com.ryuqq.maintenance.core.spi.ManifestWriter}</li>
 *   <li>{@link com.ryuqq.maintenance.adapter.inmemory.manifest.InMemoryRepository}:
 *       {@link com.ryuqq.maintenance.core.spi.RepositoryWriter} over a shared index</li>
 * </ul>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 *   <li>Suitable for Contract Tests and reference implementation</li>
 * </ul>
 *
 * @see com.ryuqq.maintenance.core.spi.ManifestWriter
 * @author Maintenance Team
 * @since 1.0.0
 */
package com.ryuqq.maintenance.adapter.inmemory.manifest;
