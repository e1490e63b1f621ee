package com.ryuqq.maintenance.adapter.inmemory.manifest;

import com.ryuqq.maintenance.core.exception.ParamsLoadException;
import com.ryuqq.maintenance.core.model.ClientIdentity;
import com.ryuqq.maintenance.core.model.EntryMetadata;
import com.ryuqq.maintenance.core.model.MaintenanceParams;
import com.ryuqq.maintenance.core.model.ManifestId;
import com.ryuqq.maintenance.core.model.ManifestLabels;
import com.ryuqq.maintenance.core.spi.ManifestIndexException;
import com.ryuqq.maintenance.core.store.MaintenanceParamsStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * InMemoryManifestIndex 고유 동작 테스트.
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
class InMemoryManifestIndexTest {

    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private InMemoryManifestIndex index;

    @BeforeEach
    void setUp() {
        index = new InMemoryManifestIndex(Clock.fixed(T0, ZoneOffset.UTC));
    }

    @Test
    void create_ModTimeFromClockAndHexId() {
        // When
        ManifestId id = index.create(ManifestLabels.MAINTENANCE, MaintenanceParams.defaults());

        // Then
        EntryMetadata metadata = index.find(ManifestLabels.MAINTENANCE).get(0);
        assertThat(metadata.modTime()).isEqualTo(T0);
        assertThat(metadata.length()).isPositive();
        assertThat(id.getValue()).matches("[0-9a-f]{32}");
    }

    @Test
    void getParams_LaterEntryWinsRegardlessOfId() {
        // Given
        MutableClock clock = new MutableClock(T0);
        InMemoryManifestIndex ticking = new InMemoryManifestIndex(clock);
        InMemoryRepository repository = new InMemoryRepository(ticking, ClientIdentity.of("alice", "host-a"));
        ticking.create(ManifestLabels.MAINTENANCE, MaintenanceParams.defaults().withOwner("first@host"));

        // When
        clock.advance(Duration.ofSeconds(10));
        ticking.create(ManifestLabels.MAINTENANCE, MaintenanceParams.defaults().withOwner("second@host"));

        // Then
        assertThat(new MaintenanceParamsStore().getParams(repository).owner()).isEqualTo("second@host");
    }

    @Test
    void load_StoredPayloadIsNotSharedWithCaller() {
        // Given
        ManifestId id = index.create(ManifestLabels.MAINTENANCE, MaintenanceParams.defaults());

        // When
        MaintenanceParams first = index.load(id, MaintenanceParams.class);
        MaintenanceParams second = index.load(id, MaintenanceParams.class);

        // Then
        assertThat(first).isEqualTo(second).isNotSameAs(second);
    }

    @Test
    void load_CorruptPayload_ThrowsManifestIndexException() {
        // Given
        ManifestId id = index.putRaw(ManifestLabels.MAINTENANCE, "{not json".getBytes(StandardCharsets.UTF_8));

        // When & Then
        assertThatThrownBy(() -> index.load(id, MaintenanceParams.class))
            .isInstanceOf(ManifestIndexException.class)
            .hasMessageContaining("decode");
    }

    @Test
    void getParams_CorruptEntry_ReportedAsLoadFailureNotDefaults() {
        // Given
        ManifestId id = index.putRaw(ManifestLabels.MAINTENANCE,
            "{\"owner\":\"x@y\",\"quickCycle\":{\"enabled\":true}}".getBytes(StandardCharsets.UTF_8));
        InMemoryRepository repository = new InMemoryRepository(index, ClientIdentity.of("alice", "host-a"));

        // When & Then
        assertThatThrownBy(() -> new MaintenanceParamsStore().getParams(repository))
            .isInstanceOf(ParamsLoadException.class)
            .satisfies(e -> assertThat(((ParamsLoadException) e).getManifestId()).isEqualTo(id));
    }

    @Test
    void sizeAndClear_CountAllLabels() {
        // Given
        index.create(ManifestLabels.MAINTENANCE, MaintenanceParams.defaults());
        index.create(ManifestLabels.of(Map.of("type", "policy")), MaintenanceParams.defaults());

        // When & Then
        assertThat(index.size()).isEqualTo(2);
        index.clear();
        assertThat(index.size()).isZero();
        assertThat(index.find(ManifestLabels.MAINTENANCE)).isEqualTo(List.of());
    }

    @Test
    void repository_NullArguments_ThrowException() {
        assertThatThrownBy(() -> new InMemoryRepository(null, ClientIdentity.of("a", "b")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("manifests cannot be null");
        assertThatThrownBy(() -> new InMemoryRepository(index, null))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("clientIdentity cannot be null");
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneOffset getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
