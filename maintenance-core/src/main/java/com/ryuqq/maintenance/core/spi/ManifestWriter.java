package com.ryuqq.maintenance.core.spi;

import com.ryuqq.maintenance.core.model.ManifestId;
import com.ryuqq.maintenance.core.model.ManifestLabels;

/**
 * Write side of the manifest index SPI.
 *
 * <p>The backend offers no update-in-place and no locking; only "create a new immutable
 * entry" and "delete an entry by id".</p>
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public interface ManifestWriter extends ManifestReader {

    /**
     * Stores a new immutable entry.
     *
     * <p>When this method returns, the entry is durable and visible to
     * {@link #find(ManifestLabels)}.</p>
     *
     * @param labels the labels to attach
     * @param payload the value to serialize
     * @return the identifier of the new entry
     * @throws IllegalArgumentException if labels or payload is null
     * @throws ManifestIndexException if the entry cannot be stored
     */
    ManifestId create(ManifestLabels labels, Object payload);

    /**
     * Removes an entry.
     *
     * <p><strong>Idempotency:</strong> deleting an identifier that does not exist,
     * including one another writer already removed, must succeed as a no-op.</p>
     *
     * @param id the entry identifier
     * @throws IllegalArgumentException if id is null
     * @throws ManifestIndexException if the backend fails to delete an existing entry
     */
    void delete(ManifestId id);
}
