package com.ryuqq.maintenance.adapter.inmemory.manifest;

import com.ryuqq.maintenance.adapter.inmemory.codec.ManifestCodec;
import com.ryuqq.maintenance.core.model.EntryMetadata;
import com.ryuqq.maintenance.core.model.ManifestId;
import com.ryuqq.maintenance.core.model.ManifestLabels;
import com.ryuqq.maintenance.core.spi.ManifestIndexException;
import com.ryuqq.maintenance.core.spi.ManifestWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;

/**
 * In-memory implementation of the manifest index SPI for testing and reference purposes.
 *
 * <p>Entries live in a {@link ConcurrentHashMap} keyed by {@link ManifestId}. Payloads are
 * encoded to JSON on create and decoded on every load, so callers never share mutable
 * state with the index.</p>
 *
 * <p><strong>Behavior:</strong></p>
 * <ul>
 *   <li><strong>create:</strong> 16 random bytes from {@link SecureRandom}, hex encoded, as the id;
 *       {@code modTime} taken from the injected {@link Clock}</li>
 *   <li><strong>find:</strong> subset label match, no ordering guarantee</li>
 *   <li><strong>delete:</strong> no-op for unknown ids</li>
 * </ul>
 *
 * <p>Several {@link InMemoryRepository} instances sharing one index model independent
 * clients racing on the same backend.</p>
 *
 * <p><strong>Limitations:</strong></p>
 * <ul>
 *   <li>Data lost on process restart</li>
 *   <li>Not suitable for production use</li>
 * </ul>
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public class InMemoryManifestIndex implements ManifestWriter {

    private static final Logger log = LoggerFactory.getLogger(InMemoryManifestIndex.class);
    private static final int ID_BYTES = 16;

    private final ConcurrentHashMap<ManifestId, StoredEntry> entries;
    private final ManifestCodec codec;
    private final Clock clock;
    private final SecureRandom random;

    /**
     * Creates an empty index using the system UTC clock.
     */
    public InMemoryManifestIndex() {
        this(Clock.systemUTC());
    }

    /**
     * Creates an empty index with a custom clock.
     *
     * @param clock the clock used for {@code modTime}
     */
    public InMemoryManifestIndex(Clock clock) {
        this(new ManifestCodec(), clock);
    }

    /**
     * Creates an empty index.
     *
     * @param codec the payload codec
     * @param clock the clock used for {@code modTime}
     * @throws IllegalArgumentException if codec or clock is null
     */
    public InMemoryManifestIndex(ManifestCodec codec, Clock clock) {
        if (codec == null) {
            throw new IllegalArgumentException("codec cannot be null");
        }
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        this.entries = new ConcurrentHashMap<>();
        this.codec = codec;
        this.clock = clock;
        this.random = new SecureRandom();
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public List<EntryMetadata> find(ManifestLabels labels) {
        if (labels == null) {
            throw new IllegalArgumentException("labels cannot be null");
        }
        return entries.values().stream()
            .filter(entry -> labels.matches(entry.labels()))
            .map(StoredEntry::metadata)
            .collect(Collectors.toList());
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public <T> T load(ManifestId id, Class<T> type) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (type == null) {
            throw new IllegalArgumentException("type cannot be null");
        }

        StoredEntry entry = entries.get(id);
        if (entry == null) {
            throw new ManifestIndexException("manifest not found: " + id.getValue());
        }
        return codec.decode(entry.payload(), type);
    }

    /**
     * {@inheritDoc}
     *
     * <p>The payload is encoded before an id is allocated, so an encoding failure
     * leaves the index unchanged.</p>
     */
    @Override
    public ManifestId create(ManifestLabels labels, Object payload) {
        if (labels == null) {
            throw new IllegalArgumentException("labels cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        return store(labels, codec.encode(payload));
    }

    /**
     * {@inheritDoc}
     */
    @Override
    public void delete(ManifestId id) {
        if (id == null) {
            throw new IllegalArgumentException("id cannot be null");
        }
        if (entries.remove(id) == null) {
            log.debug("Manifest {} already deleted", id.getValue());
        }
    }

    /**
     * Stores raw payload bytes without encoding.
     *
     * <p>This method is used by tests to plant undecodable entries.</p>
     *
     * @param labels the labels to attach
     * @param payload raw bytes
     * @return the identifier of the new entry
     */
    public ManifestId putRaw(ManifestLabels labels, byte[] payload) {
        if (labels == null) {
            throw new IllegalArgumentException("labels cannot be null");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        return store(labels, payload.clone());
    }

    /**
     * Returns the number of stored entries across all labels.
     *
     * @return entry count
     */
    public int size() {
        return entries.size();
    }

    /**
     * Clears all stored entries.
     *
     * <p>This method is used for test cleanup.</p>
     */
    public void clear() {
        entries.clear();
    }

    private ManifestId store(ManifestLabels labels, byte[] payload) {
        Instant modTime = clock.instant();
        while (true) {
            ManifestId id = ManifestId.of(nextId());
            StoredEntry entry = new StoredEntry(id, labels.asMap(), payload, modTime);
            if (entries.putIfAbsent(id, entry) == null) {
                log.debug("Created manifest {} with labels {}", id.getValue(), labels.asMap());
                return id;
            }
        }
    }

    private String nextId() {
        byte[] bytes = new byte[ID_BYTES];
        random.nextBytes(bytes);
        return HexFormat.of().formatHex(bytes);
    }

    /**
     * Internal record representing a stored manifest entry.
     *
     * @param id the entry identifier
     * @param labels the entry labels
     * @param payload encoded payload bytes
     * @param modTime creation timestamp
     */
    private record StoredEntry(ManifestId id, Map<String, String> labels, byte[] payload, Instant modTime) {

        EntryMetadata metadata() {
            return new EntryMetadata(id, labels, payload.length, modTime);
        }
    }
}
