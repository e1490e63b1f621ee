package com.ryuqq.maintenance.core.spi;

import com.ryuqq.maintenance.core.model.EntryMetadata;
import com.ryuqq.maintenance.core.model.ManifestId;
import com.ryuqq.maintenance.core.model.ManifestLabels;

import java.util.List;

/**
 * Read side of the manifest index SPI.
 *
 * <p>The manifest index is an append-only store of immutable entries. Each entry
 * has an opaque {@link ManifestId}, a label set and a serialized payload. Entries are
 * never updated in place.</p>
 *
 * <p><strong>Consistency:</strong></p>
 * <ul>
 *   <li>Independent writers may create several entries under the same labels;
 *       {@link #find(ManifestLabels)} returns all of them</li>
 *   <li>No ordering is guaranteed for query results</li>
 * </ul>
 *
 * <p><strong>Blocking:</strong> every method may block on network or disk I/O.
 * Implementations should respond to thread interruption by failing with
 * {@link ManifestIndexException}; they must not swallow the interrupt flag.</p>
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public interface ManifestReader {

    /**
     * Finds all entries whose labels contain every label in {@code labels}.
     *
     * @param labels the label set to match (subset match)
     * @return metadata of the matching entries, possibly empty, in no particular order
     * @throws IllegalArgumentException if labels is null
     * @throws ManifestIndexException if the query fails
     */
    List<EntryMetadata> find(ManifestLabels labels);

    /**
     * Loads and deserializes the payload of an entry.
     *
     * @param id the entry identifier
     * @param type the type to deserialize the payload into
     * @param <T> payload type
     * @return the deserialized payload
     * @throws IllegalArgumentException if id or type is null
     * @throws ManifestIndexException if the entry does not exist or its payload cannot be decoded
     */
    <T> T load(ManifestId id, Class<T> type);
}
