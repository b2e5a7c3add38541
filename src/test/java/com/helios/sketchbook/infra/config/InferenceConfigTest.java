package com.helios.sketchbook.infra.config;

import com.helios.sketchbook.core.inference.InferenceType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("Inference configuration")
class InferenceConfigTest {

    @Test
    @DisplayName("Should expose the documented defaults")
    void shouldUseDefaults() {
        InferenceConfig config = InferenceConfig.defaults();

        assertThat(config.getMaxVariables()).isEqualTo(12);
        assertThat(config.getMaxColors()).isEqualTo(1_000_000L);
        assertThat(config.getPredicateCacheSize()).isEqualTo(1_024L);
        assertThat(config.getInferenceType()).isEqualTo(InferenceType.FULL);
        assertThat(config.isStopWhenEmpty()).isTrue();
    }

    @Test
    @DisplayName("Should copy every field through toBuilder")
    void shouldCopyThroughBuilder() {
        InferenceConfig original = InferenceConfig.defaults().toBuilder()
                .maxVariables(5)
                .maxColors(100)
                .predicateCacheSize(8)
                .inferenceType(InferenceType.DYNAMIC)
                .stopWhenEmpty(false)
                .build();

        InferenceConfig copy = original.toBuilder().build();

        assertThat(copy.toString()).isEqualTo(original.toString());
        assertThat(copy.getInferenceType()).isEqualTo(InferenceType.DYNAMIC);
        assertThat(copy.isStopWhenEmpty()).isFalse();
    }

    @Test
    @DisplayName("Should reject out-of-range limits")
    void shouldValidateLimits() {
        assertThatThrownBy(() -> InferenceConfig.defaults().toBuilder().maxVariables(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxVariables");
        assertThatThrownBy(() -> InferenceConfig.defaults().toBuilder().maxVariables(31).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> InferenceConfig.defaults().toBuilder().maxColors(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxColors");
        assertThatThrownBy(() -> InferenceConfig.defaults().toBuilder().predicateCacheSize(-1).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("predicateCacheSize");
    }

    @Test
    @DisplayName("Should load values from a properties file")
    void shouldLoadFromProperties(@TempDir Path dir) throws IOException {
        Path file = dir.resolve("sketchbook.properties");
        Files.writeString(file, String.join("\n",
                "sketch.max.variables=6",
                "sketch.max.colors=5000",
                "sketch.inference.type=static",
                "sketch.stop.when.empty=false"));

        InferenceConfig config = InferenceConfig.loadFromProperties(file.toString());

        assertThat(config.getMaxVariables()).isEqualTo(6);
        assertThat(config.getMaxColors()).isEqualTo(5000L);
        assertThat(config.getPredicateCacheSize()).isEqualTo(1_024L);
        assertThat(config.getInferenceType()).isEqualTo(InferenceType.STATIC);
        assertThat(config.isStopWhenEmpty()).isFalse();
    }

    @Test
    @DisplayName("Should fall back to defaults when the file is missing or the type unknown")
    void shouldFallBackToDefaults(@TempDir Path dir) throws IOException {
        assertThat(InferenceConfig.loadFromProperties(dir.resolve("missing.properties").toString())
                .getMaxVariables()).isEqualTo(12);

        Path file = dir.resolve("bad.properties");
        Files.writeString(file, "sketch.inference.type=everything\n");
        assertThat(InferenceConfig.loadFromProperties(file.toString()).getInferenceType())
                .isEqualTo(InferenceType.FULL);
    }
}
