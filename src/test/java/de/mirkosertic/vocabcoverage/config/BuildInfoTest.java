package de.mirkosertic.vocabcoverage.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("BuildInfo Tests")
class BuildInfoTest {

    @Test
    @DisplayName("Should provide version and timestamp")
    void shouldProvideVersionAndTimestamp() {
        // Filtered by Maven, or the fallbacks when run from an IDE
        assertThat(BuildInfo.getVersion())
                .isNotEmpty()
                .matches("^(\\d+\\.\\d+\\.\\d+.*|dev)$");
        assertThat(BuildInfo.getBuildTimestamp())
                .isNotEmpty()
                .matches("^(\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}Z|unknown)$");
    }

    @Test
    @DisplayName("Description should name the program and version")
    void descriptionShouldContainVersion() {
        assertThat(BuildInfo.describe())
                .startsWith("vocabcoverage ")
                .contains(BuildInfo.getVersion());
    }
}
