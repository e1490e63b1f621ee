package com.ryuqq.maintenance.core.model;

import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ManifestLabels 테스트.
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
class ManifestLabelsTest {

    @Test
    void maintenanceLabels_MatchExactAndSuperset() {
        assertThat(ManifestLabels.MAINTENANCE.matches(Map.of("type", "maintenance"))).isTrue();
        assertThat(ManifestLabels.MAINTENANCE.matches(Map.of("type", "maintenance", "hostname", "h"))).isTrue();
    }

    @Test
    void maintenanceLabels_DoNotMatchOtherTypesOrMissingKey() {
        assertThat(ManifestLabels.MAINTENANCE.matches(Map.of("type", "snapshot"))).isFalse();
        assertThat(ManifestLabels.MAINTENANCE.matches(Map.of("kind", "maintenance"))).isFalse();
        assertThat(ManifestLabels.MAINTENANCE.matches(null)).isFalse();
    }

    @Test
    void of_CopiesInput() {
        Map<String, String> source = new HashMap<>();
        source.put("type", "maintenance");
        ManifestLabels labels = ManifestLabels.of(source);

        source.put("type", "changed");

        assertThat(labels).isEqualTo(ManifestLabels.MAINTENANCE);
        assertThatThrownBy(() -> labels.asMap().put("x", "y")).isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void of_EmptyMap_ThrowsException() {
        assertThatThrownBy(() -> ManifestLabels.of(Map.of()))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be null or empty");
    }
}
