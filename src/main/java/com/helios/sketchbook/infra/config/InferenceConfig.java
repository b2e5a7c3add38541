package com.helios.sketchbook.infra.config;

import com.helios.sketchbook.core.inference.InferenceType;

import java.io.FileInputStream;
import java.io.InputStream;
import java.util.Optional;
import java.util.Properties;
import java.util.logging.Logger;

/**
 * Configuration of an inference run and of the explicit engine.
 *
 * <p><b>Environment Variable Override:</b> every property can be set through
 * {@code SKETCH_<PROPERTY_NAME>}:
 * <pre>
 * SKETCH_MAX_VARIABLES=14
 * SKETCH_MAX_COLORS=2000000
 * SKETCH_PREDICATE_CACHE_SIZE=256
 * SKETCH_INFERENCE_TYPE=STATIC
 * SKETCH_STOP_WHEN_EMPTY=false
 * </pre>
 *
 * <p><b>Usage Example:</b>
 * <pre>{@code
 * InferenceConfig config = InferenceConfig.builder()
 *         .maxVariables(8)
 *         .inferenceType(InferenceType.DYNAMIC)
 *         .build();
 * }</pre>
 */
public final class InferenceConfig {

    private static final Logger logger = Logger.getLogger(InferenceConfig.class.getName());

    // ========================================================================
    // ENVIRONMENT VARIABLE KEYS
    // ========================================================================

    private static final String ENV_MAX_VARIABLES = "SKETCH_MAX_VARIABLES";
    private static final String ENV_MAX_COLORS = "SKETCH_MAX_COLORS";
    private static final String ENV_PREDICATE_CACHE_SIZE = "SKETCH_PREDICATE_CACHE_SIZE";
    private static final String ENV_INFERENCE_TYPE = "SKETCH_INFERENCE_TYPE";
    private static final String ENV_STOP_WHEN_EMPTY = "SKETCH_STOP_WHEN_EMPTY";

    // ========================================================================
    // CONFIGURATION FIELDS
    // ========================================================================

    private final int maxVariables;
    private final long maxColors;
    private final long predicateCacheSize;
    private final InferenceType inferenceType;
    private final boolean stopWhenEmpty;

    private InferenceConfig(Builder builder) {
        this.maxVariables = builder.maxVariables;
        this.maxColors = builder.maxColors;
        this.predicateCacheSize = builder.predicateCacheSize;
        this.inferenceType = builder.inferenceType;
        this.stopWhenEmpty = builder.stopWhenEmpty;

        validate();
    }

    // ========================================================================
    // FACTORY METHODS
    // ========================================================================

    /**
     * Defaults without environment overrides. Used by tests.
     */
    public static InferenceConfig defaults() {
        return new Builder(false).build();
    }

    /**
     * Create configuration from environment variables only.
     */
    public static InferenceConfig fromEnvironment() {
        return builder().build();
    }

    /**
     * Load configuration from a properties file, searched on the classpath, then on the file system.
     * Environment variables override file values.
     *
     * <p><b>Example sketchbook.properties:</b>
     * <pre>
     * sketch.max.variables=10
     * sketch.max.colors=500000
     * sketch.predicate.cache.size=512
     * sketch.inference.type=FULL
     * sketch.stop.when.empty=true
     * </pre>
     */
    public static InferenceConfig loadFromProperties(String propertiesPath) {
        logger.info("Loading inference configuration from: " + propertiesPath);
        Properties props = new Properties();

        try (InputStream is = InferenceConfig.class.getClassLoader().getResourceAsStream(propertiesPath)) {
            if (is != null) {
                props.load(is);
                logger.info("Loaded " + props.size() + " properties from classpath: " + propertiesPath);
            }
        } catch (Exception e) {
            logger.fine("Could not load from classpath: " + propertiesPath);
        }

        if (props.isEmpty()) {
            try (FileInputStream fis = new FileInputStream(propertiesPath)) {
                props.load(fis);
                logger.info("Loaded " + props.size() + " properties from file: " + propertiesPath);
            } catch (Exception e) {
                logger.warning("Could not load properties file: " + propertiesPath + ". Using defaults.");
            }
        }

        Builder builder = new Builder(false);
        applyProperties(builder, props);
        builder.applyEnvironmentVariables();
        return builder.build();
    }

    public static Builder builder() {
        return new Builder(true);
    }

    public Builder toBuilder() {
        Builder builder = new Builder(false);
        builder.maxVariables = maxVariables;
        builder.maxColors = maxColors;
        builder.predicateCacheSize = predicateCacheSize;
        builder.inferenceType = inferenceType;
        builder.stopWhenEmpty = stopWhenEmpty;
        return builder;
    }

    private static void applyProperties(Builder builder, Properties props) {
        String maxVariables = props.getProperty("sketch.max.variables");
        if (maxVariables != null) {
            builder.maxVariables = Integer.parseInt(maxVariables.trim());
        }
        String maxColors = props.getProperty("sketch.max.colors");
        if (maxColors != null) {
            builder.maxColors = Long.parseLong(maxColors.trim());
        }
        String cacheSize = props.getProperty("sketch.predicate.cache.size");
        if (cacheSize != null) {
            builder.predicateCacheSize = Long.parseLong(cacheSize.trim());
        }
        String type = props.getProperty("sketch.inference.type");
        if (type != null) {
            InferenceType parsed = InferenceType.fromString(type);
            if (parsed != null) {
                builder.inferenceType = parsed;
            } else {
                logger.warning("Invalid sketch.inference.type in properties: " + type);
            }
        }
        String stopWhenEmpty = props.getProperty("sketch.stop.when.empty");
        if (stopWhenEmpty != null) {
            builder.stopWhenEmpty = Boolean.parseBoolean(stopWhenEmpty.trim());
        }
    }

    // ========================================================================
    // GETTERS
    // ========================================================================

    /** Largest network the explicit engine accepts. */
    public int getMaxVariables() {
        return maxVariables;
    }

    /** Largest parameter space the explicit engine enumerates. */
    public long getMaxColors() {
        return maxColors;
    }

    public long getPredicateCacheSize() {
        return predicateCacheSize;
    }

    public InferenceType getInferenceType() {
        return inferenceType;
    }

    /** Skip the remaining properties once no candidate is left. */
    public boolean isStopWhenEmpty() {
        return stopWhenEmpty;
    }

    private void validate() {
        if (maxVariables <= 0 || maxVariables > 30) {
            throw new IllegalArgumentException("maxVariables must be in [1, 30]: " + maxVariables);
        }
        if (maxColors <= 0 || maxColors > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("maxColors must be in [1, " + Integer.MAX_VALUE + "]: " + maxColors);
        }
        if (predicateCacheSize <= 0) {
            throw new IllegalArgumentException("predicateCacheSize must be positive: " + predicateCacheSize);
        }
    }

    @Override
    public String toString() {
        return "InferenceConfig{maxVariables=" + maxVariables
                + ", maxColors=" + maxColors
                + ", predicateCacheSize=" + predicateCacheSize
                + ", inferenceType=" + inferenceType
                + ", stopWhenEmpty=" + stopWhenEmpty + "}";
    }

    // ========================================================================
    // BUILDER
    // ========================================================================

    public static class Builder {

        private int maxVariables = 12;
        private long maxColors = 1_000_000;
        private long predicateCacheSize = 1_024;
        private InferenceType inferenceType = InferenceType.FULL;
        private boolean stopWhenEmpty = true;

        private Builder(boolean loadEnvironment) {
            if (loadEnvironment) {
                applyEnvironmentVariables();
            }
        }

        private void applyEnvironmentVariables() {
            getEnvInt(ENV_MAX_VARIABLES).ifPresent(val -> this.maxVariables = val);
            getEnvLong(ENV_MAX_COLORS).ifPresent(val -> this.maxColors = val);
            getEnvLong(ENV_PREDICATE_CACHE_SIZE).ifPresent(val -> this.predicateCacheSize = val);
            getEnv(ENV_INFERENCE_TYPE).ifPresent(val -> {
                InferenceType parsed = InferenceType.fromString(val);
                if (parsed != null) {
                    this.inferenceType = parsed;
                } else {
                    logger.warning("Invalid " + ENV_INFERENCE_TYPE + ": " + val + ", using default: " + inferenceType);
                }
            });
            getEnv(ENV_STOP_WHEN_EMPTY).ifPresent(val -> this.stopWhenEmpty = Boolean.parseBoolean(val));
        }

        public Builder maxVariables(int maxVariables) {
            this.maxVariables = maxVariables;
            return this;
        }

        public Builder maxColors(long maxColors) {
            this.maxColors = maxColors;
            return this;
        }

        public Builder predicateCacheSize(long predicateCacheSize) {
            this.predicateCacheSize = predicateCacheSize;
            return this;
        }

        public Builder inferenceType(InferenceType inferenceType) {
            this.inferenceType = inferenceType;
            return this;
        }

        public Builder stopWhenEmpty(boolean stopWhenEmpty) {
            this.stopWhenEmpty = stopWhenEmpty;
            return this;
        }

        public InferenceConfig build() {
            return new InferenceConfig(this);
        }

        private static Optional<String> getEnv(String key) {
            String value = System.getenv(key);
            if (value != null && !value.trim().isEmpty()) {
                logger.fine("Loaded env var: " + key + "=" + value);
                return Optional.of(value.trim());
            }
            return Optional.empty();
        }

        private static Optional<Integer> getEnvInt(String key) {
            return getEnv(key).map(val -> {
                try {
                    return Integer.parseInt(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid int value for " + key + ": " + val);
                    return null;
                }
            });
        }

        private static Optional<Long> getEnvLong(String key) {
            return getEnv(key).map(val -> {
                try {
                    return Long.parseLong(val);
                } catch (NumberFormatException e) {
                    logger.warning("Invalid long value for " + key + ": " + val);
                    return null;
                }
            });
        }
    }
}
