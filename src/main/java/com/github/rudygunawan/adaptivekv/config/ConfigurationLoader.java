package com.github.rudygunawan.adaptivekv.config;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.rudygunawan.adaptivekv.quantization.QuantizationType;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.util.Locale;
import java.util.Objects;

/**
 * Reads a {@link CacheConfiguration} from a JSON document. Options that are absent keep their
 * defaults; present options are validated like any other configuration.
 *
 * <pre>{@code
 * {
 *   "maxSize": 5000,
 *   "maxMemoryMB": 128,
 *   "defaultTTL": 1800000,
 *   "quantization": { "enabled": true, "type": "int8", "thresholdBytes": 2048, "aggressive": false },
 *   "adaptiveResize": { "enabled": true, "minSize": 500, "maxSize": 20000,
 *                       "resizeThreshold": 0.8, "shrinkFactor": 0.7, "growthFactor": 1.3 },
 *   "mlPrediction": { "enabled": true, "predictionWindowMs": 3600000, "confidenceThreshold": 0.7 },
 *   "monitoring": { "enabled": true, "metricsIntervalMs": 60000,
 *                   "alertThresholds": { "hitRate": 0.8, "memoryUsage": 0.9, "evictionRate": 0.1 } }
 * }
 * }</pre>
 *
 * @since 0.1.0
 */
public final class ConfigurationLoader {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    private ConfigurationLoader() {
    }

    /**
     * Parses a configuration from JSON text.
     *
     * @throws IllegalArgumentException if the text is not valid JSON or an option has the wrong type
     * @throws InvalidConfigurationException if an option is out of range
     */
    public static CacheConfiguration parse(String json) {
        Objects.requireNonNull(json, "json cannot be null");
        try {
            return fromTree(MAPPER.readTree(json));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed cache configuration: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Reads a configuration from a JSON stream. The stream is not closed.
     *
     * @throws UncheckedIOException if the stream cannot be read
     */
    public static CacheConfiguration load(InputStream in) {
        Objects.requireNonNull(in, "input stream cannot be null");
        try {
            return fromTree(MAPPER.readTree(in));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("malformed cache configuration: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to read cache configuration", e);
        }
    }

    /**
     * Reads a configuration from a classpath resource.
     *
     * @throws IllegalArgumentException if the resource does not exist
     */
    public static CacheConfiguration fromResource(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = ConfigurationLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new IllegalArgumentException("configuration resource not found: " + resource);
            }
            return load(in);
        } catch (IOException e) {
            throw new UncheckedIOException("failed to close configuration resource " + resource, e);
        }
    }

    static CacheConfiguration fromTree(JsonNode root) {
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("cache configuration must be a JSON object");
        }
        CacheConfiguration.Builder builder = CacheConfiguration.newBuilder();

        if (root.has("maxSize")) {
            builder.maxSize(intValue(root, "maxSize"));
        }
        if (root.has("maxMemoryMB")) {
            builder.maxMemoryMB(doubleValue(root, "maxMemoryMB"));
        }
        if (root.has("defaultTTL")) {
            builder.defaultTTL(longValue(root, "defaultTTL"));
        }

        JsonNode quantization = root.path("quantization");
        if (quantization.isObject()) {
            if (quantization.has("enabled")) {
                builder.quantizationEnabled(booleanValue(quantization, "enabled"));
            }
            if (quantization.has("type")) {
                builder.quantizationType(quantizationType(quantization.get("type")));
            }
            // "threshold" is accepted as a shorter alias
            if (quantization.has("thresholdBytes")) {
                builder.quantizationThresholdBytes(longValue(quantization, "thresholdBytes"));
            } else if (quantization.has("threshold")) {
                builder.quantizationThresholdBytes(longValue(quantization, "threshold"));
            }
            if (quantization.has("aggressive")) {
                builder.quantizationAggressive(booleanValue(quantization, "aggressive"));
            }
        }

        JsonNode resize = root.path("adaptiveResize");
        if (resize.isObject()) {
            CacheConfiguration defaults = CacheConfiguration.defaults();
            if (resize.has("enabled")) {
                builder.adaptiveResizeEnabled(booleanValue(resize, "enabled"));
            }
            int minSize = resize.has("minSize")
                    ? intValue(resize, "minSize") : defaults.getAdaptiveResize().getMinSize();
            int maxSize = resize.has("maxSize")
                    ? intValue(resize, "maxSize") : defaults.getAdaptiveResize().getMaxSize();
            builder.adaptiveResizeBounds(minSize, maxSize);
            if (resize.has("resizeThreshold")) {
                builder.resizeThreshold(doubleValue(resize, "resizeThreshold"));
            }
            if (resize.has("shrinkFactor")) {
                builder.shrinkFactor(doubleValue(resize, "shrinkFactor"));
            }
            if (resize.has("growthFactor")) {
                builder.growthFactor(doubleValue(resize, "growthFactor"));
            }
        }

        JsonNode prediction = root.path("mlPrediction");
        if (prediction.isObject()) {
            if (prediction.has("enabled")) {
                builder.predictionEnabled(booleanValue(prediction, "enabled"));
            }
            if (prediction.has("predictionWindowMs")) {
                builder.predictionWindowMs(longValue(prediction, "predictionWindowMs"));
            } else if (prediction.has("predictionWindow")) {
                builder.predictionWindowMs(longValue(prediction, "predictionWindow"));
            }
            if (prediction.has("confidenceThreshold")) {
                builder.confidenceThreshold(doubleValue(prediction, "confidenceThreshold"));
            }
        }

        JsonNode monitoring = root.path("monitoring");
        if (monitoring.isObject()) {
            if (monitoring.has("enabled")) {
                builder.monitoringEnabled(booleanValue(monitoring, "enabled"));
            }
            if (monitoring.has("metricsIntervalMs")) {
                builder.metricsIntervalMs(longValue(monitoring, "metricsIntervalMs"));
            } else if (monitoring.has("metricsInterval")) {
                builder.metricsIntervalMs(longValue(monitoring, "metricsInterval"));
            }
            JsonNode thresholds = monitoring.path("alertThresholds");
            if (thresholds.isObject()) {
                CacheConfiguration.AlertThresholds current = CacheConfiguration.defaults()
                        .getMonitoring().getAlertThresholds();
                builder.alertThresholds(
                        thresholds.has("hitRate") ? doubleValue(thresholds, "hitRate") : current.getHitRate(),
                        thresholds.has("memoryUsage") ? doubleValue(thresholds, "memoryUsage") : current.getMemoryUsage(),
                        thresholds.has("evictionRate") ? doubleValue(thresholds, "evictionRate") : current.getEvictionRate());
            }
        }

        return builder.build();
    }

    private static QuantizationType quantizationType(JsonNode node) {
        if (!node.isTextual()) {
            throw new IllegalArgumentException("quantization.type must be a string");
        }
        try {
            return QuantizationType.valueOf(node.asText().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("unknown quantization type: " + node.asText(), e);
        }
    }

    private static int intValue(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (!node.canConvertToInt()) {
            throw new IllegalArgumentException(field + " must be an integer, was " + node);
        }
        return node.intValue();
    }

    private static long longValue(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (!node.canConvertToLong()) {
            throw new IllegalArgumentException(field + " must be an integer, was " + node);
        }
        return node.longValue();
    }

    private static double doubleValue(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (!node.isNumber()) {
            throw new IllegalArgumentException(field + " must be a number, was " + node);
        }
        return node.doubleValue();
    }

    private static boolean booleanValue(JsonNode parent, String field) {
        JsonNode node = parent.get(field);
        if (!node.isBoolean()) {
            throw new IllegalArgumentException(field + " must be a boolean, was " + node);
        }
        return node.booleanValue();
    }
}
