package com.example.sectionfinder.util.similarity.scoring;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ScoringConfigTest {

    @TempDir
    Path tempDir;

    @Test
    void loadDefault_shouldUseBuiltInWeights() {
        ScoringConfig config = ScoringConfig.loadDefault();

        assertThat(config.getWeight(ScoringConfig.HORIZONTAL_POSITION)).isEqualTo(0.25);
        assertThat(config.getWeight(ScoringConfig.FONT_FAMILY)).isEqualTo(0.20);
        assertThat(config.getWeights().values().stream().mapToDouble(Double::doubleValue).sum())
                .isCloseTo(1.10, org.assertj.core.api.Assertions.within(1e-9));
        assertThat(config.getWeight("unknown_feature")).isZero();
    }

    @Test
    void loadFromJson_shouldOverrideOnlyGivenKeys() throws IOException {
        // Arrange
        Path file = tempDir.resolve("scoring.json");
        Files.write(file, ("{\"COLUMN_TOLERANCE_PX\": 30, \"weights\": {\"bold_match\": 0.0}}")
                .getBytes(StandardCharsets.UTF_8));

        // Act
        ScoringConfig config = ScoringConfig.loadFromJson(file.toString());

        // Assert
        assertThat(config.COLUMN_TOLERANCE_PX).isEqualTo(30.0);
        assertThat(config.HORIZONTAL_FALLOFF_PX).isEqualTo(200.0);
        assertThat(config.getWeight(ScoringConfig.BOLD_MATCH)).isZero();
        assertThat(config.getWeight(ScoringConfig.FONT_SIZE)).isEqualTo(0.15);
    }

    @Test
    void loadFromJson_shouldFallBackToDefaults_whenFileIsMissing() {
        ScoringConfig config = ScoringConfig.loadFromJson(tempDir.resolve("missing.json").toString());

        assertThat(config.getWeights()).isEqualTo(ScoringConfig.loadDefault().getWeights());
    }

    @Test
    void loadFromJson_shouldFallBackToDefaults_whenWeightIsNegative() throws IOException {
        Path file = tempDir.resolve("negative.json");
        Files.write(file, "{\"weights\": {\"font_size\": -1}}".getBytes(StandardCharsets.UTF_8));

        ScoringConfig config = ScoringConfig.loadFromJson(file.toString());

        assertThat(config.getWeight(ScoringConfig.FONT_SIZE)).isEqualTo(0.15);
    }

    @Test
    void withWeight_shouldRejectNegativeWeight() {
        assertThatThrownBy(() -> ScoringConfig.loadDefault().withWeight(ScoringConfig.BOLD_MATCH, -0.1))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
