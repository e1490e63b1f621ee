package com.ryuqq.maintenance.core.model;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * ManifestId 테스트.
 *
 * @author Maintenance Team
 * @since 1.0.0
 */
class ManifestIdTest {

    @Test
    void of_ValidValue_CreatesId() {
        ManifestId id = ManifestId.of("0a1b2c");

        assertThat(id.getValue()).isEqualTo("0a1b2c");
        assertThat(id).isEqualTo(ManifestId.of("0a1b2c"));
        assertThat(id).hasSameHashCodeAs(ManifestId.of("0a1b2c"));
    }

    @Test
    void compareTo_OrdersByValue() {
        assertThat(ManifestId.of("0a")).isLessThan(ManifestId.of("0b"));
        assertThat(ManifestId.of("ff")).isGreaterThan(ManifestId.of("f"));
        assertThat(ManifestId.of("ab")).isEqualByComparingTo(ManifestId.of("ab"));
    }

    @Test
    void compareTo_SupplementaryCharacter_FollowsUtf16CodeUnits() {
        // U+1F600 is the surrogate pair D83D DE00, which sorts below U+FFFF by code unit
        ManifestId supplementary = ManifestId.of("\uD83D\uDE00");
        ManifestId bmpMax = ManifestId.of("\uFFFF");

        assertThat(supplementary).isLessThan(bmpMax);
        assertThat(bmpMax).isGreaterThan(supplementary);
    }

    @Test
    void of_Blank_ThrowsException() {
        assertThatThrownBy(() -> ManifestId.of(" "))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("cannot be null or blank");
        assertThatThrownBy(() -> ManifestId.of(null))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void of_TooLong_ThrowsException() {
        assertThatThrownBy(() -> ManifestId.of("a".repeat(256)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("255");
        assertThat(ManifestId.of("a".repeat(255)).getValue()).hasSize(255);
    }
}
