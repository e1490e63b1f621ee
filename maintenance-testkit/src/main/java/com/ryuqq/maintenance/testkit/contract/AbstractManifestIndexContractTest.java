package com.ryuqq.maintenance.testkit.contract;

import com.ryuqq.maintenance.core.model.CycleParams;
import com.ryuqq.maintenance.core.model.EntryMetadata;
import com.ryuqq.maintenance.core.model.MaintenanceParams;
import com.ryuqq.maintenance.core.model.ManifestId;
import com.ryuqq.maintenance.core.model.ManifestLabels;
import com.ryuqq.maintenance.core.spi.ManifestIndexException;
import com.ryuqq.maintenance.core.spi.ManifestWriter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contract Tests for {@link ManifestWriter} implementations.
 *
 * <p>Subclasses provide a fresh, empty manifest index per test and inherit every test.</p>
 *
 * <p><strong>Test Scenarios:</strong></p>
 * <ul>
 *   <li>Label queries: empty result, subset matching, duplicates kept</li>
 *   <li>Create and load: payload survives the round trip, ids are distinct</li>
 *   <li>Delete: entry disappears, unknown and repeated deletes are no-ops</li>
 * </ul>
 *
 * <p><strong>Usage:</strong></p>
 * <pre>
 * class MyManifestIndexContractTest extends AbstractManifestIndexContractTest {
 *     {@literal @}Override
 *     protected ManifestWriter createManifestIndex() {
 *         return new MyManifestIndex();
 *     }
 * }
 * </pre>
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
public abstract class AbstractManifestIndexContractTest {

    protected ManifestWriter manifests;

    /**
     * Creates an empty manifest index.
     *
     * @return a new index with no entries
     */
    protected abstract ManifestWriter createManifestIndex();

    @BeforeEach
    void setUpManifestIndex() {
        manifests = createManifestIndex();
    }

    @Test
    void find_NoEntries_ReturnsEmptyList() {
        assertThat(manifests.find(ManifestLabels.MAINTENANCE)).isEmpty();
    }

    @Test
    void create_ThenFind_ReturnsEntryWithLabels() {
        // When
        ManifestId id = manifests.create(ManifestLabels.MAINTENANCE, MaintenanceParams.defaults());

        // Then
        List<EntryMetadata> found = manifests.find(ManifestLabels.MAINTENANCE);
        assertThat(found).hasSize(1);
        assertThat(found.get(0).id()).isEqualTo(id);
        assertThat(found.get(0).labels()).containsEntry("type", "maintenance");
    }

    @Test
    void find_MatchesLabelSubsetOnly() {
        // Given
        ManifestId tagged = manifests.create(
            ManifestLabels.of(Map.of("type", "maintenance", "hostname", "host-a")), MaintenanceParams.defaults());
        manifests.create(ManifestLabels.of(Map.of("type", "snapshot")), MaintenanceParams.defaults());

        // When
        List<EntryMetadata> found = manifests.find(ManifestLabels.MAINTENANCE);

        // Then
        assertThat(found).extracting(EntryMetadata::id).containsExactly(tagged);
    }

    @Test
    void create_SameLabelsTwice_KeepsBothEntries() {
        // When: two writers create entries under the same labels
        ManifestId first = manifests.create(ManifestLabels.MAINTENANCE, MaintenanceParams.defaults());
        ManifestId second = manifests.create(ManifestLabels.MAINTENANCE, MaintenanceParams.defaults());

        // Then
        assertThat(manifests.find(ManifestLabels.MAINTENANCE))
            .extracting(EntryMetadata::id)
            .containsExactlyInAnyOrder(first, second);
    }

    @Test
    void create_ReturnsDistinctIds() {
        Set<ManifestId> ids = new HashSet<>();
        for (int i = 0; i < 50; i++) {
            ids.add(manifests.create(ManifestLabels.MAINTENANCE, MaintenanceParams.defaults()));
        }
        assertThat(ids).hasSize(50);
    }

    @Test
    void create_ThenLoad_ReturnsEqualPayload() {
        // Given
        MaintenanceParams params = MaintenanceParams.defaults()
            .withOwner("alice@host-a")
            .withQuickCycle(CycleParams.disabled(Duration.ofMinutes(90)))
            .withFullCycle(CycleParams.enabled(Duration.ofDays(7)));

        // When
        ManifestId id = manifests.create(ManifestLabels.MAINTENANCE, params);

        // Then
        assertThat(manifests.load(id, MaintenanceParams.class)).isEqualTo(params);
    }

    @Test
    void delete_RemovesEntry() {
        // Given
        ManifestId id = manifests.create(ManifestLabels.MAINTENANCE, MaintenanceParams.defaults());

        // When
        manifests.delete(id);

        // Then
        assertThat(manifests.find(ManifestLabels.MAINTENANCE)).isEmpty();
        assertThatThrownBy(() -> manifests.load(id, MaintenanceParams.class))
            .isInstanceOf(ManifestIndexException.class);
    }

    @Test
    void delete_UnknownId_IsNoOp() {
        assertThatCode(() -> manifests.delete(ManifestId.of("0123456789abcdef")))
            .doesNotThrowAnyException();
    }

    @Test
    void delete_Twice_IsNoOp() {
        // Given: another writer already removed the entry
        ManifestId id = manifests.create(ManifestLabels.MAINTENANCE, MaintenanceParams.defaults());
        manifests.delete(id);

        // When & Then
        assertThatCode(() -> manifests.delete(id)).doesNotThrowAnyException();
    }

    @Test
    void delete_LeavesOtherEntries() {
        // Given
        ManifestId kept = manifests.create(ManifestLabels.MAINTENANCE, MaintenanceParams.defaults());
        ManifestId removed = manifests.create(ManifestLabels.MAINTENANCE, MaintenanceParams.defaults());

        // When
        manifests.delete(removed);

        // Then
        assertThat(manifests.find(ManifestLabels.MAINTENANCE))
            .extracting(EntryMetadata::id)
            .containsExactly(kept);
    }
}
