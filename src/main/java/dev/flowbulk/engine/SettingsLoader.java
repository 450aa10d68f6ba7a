package dev.flowbulk.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.flowbulk.model.AnalyzerSettings;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Loads analyzer settings from a JSON file. Missing keys keep their defaults.
 */
public final class SettingsLoader {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private SettingsLoader() {}

    /**
     * Load settings from a JSON file.
     */
    public static AnalyzerSettings loadFromFile(Path path) throws IOException {
        return parseSettings(MAPPER.readTree(path.toFile()));
    }

    /**
     * Load settings from a JSON string.
     */
    public static AnalyzerSettings loadFromString(String json) throws IOException {
        return parseSettings(MAPPER.readTree(json));
    }

    private static AnalyzerSettings parseSettings(JsonNode root) throws IOException {
        if (root == null || root.isMissingNode() || root.isNull()) {
            return AnalyzerSettings.defaults();
        }
        if (!root.isObject()) {
            throw new IOException("Settings must be a JSON object");
        }
        try {
            return new AnalyzerSettings(
                intValue(root, "maxRecursionDepth", AnalyzerSettings.DEFAULT_MAX_RECURSION_DEPTH),
                intValue(root, "splitComplexityThreshold", AnalyzerSettings.DEFAULT_SPLIT_COMPLEXITY_THRESHOLD),
                intValue(root, "splitOperationsThreshold", AnalyzerSettings.DEFAULT_SPLIT_OPERATIONS_THRESHOLD),
                intValue(root, "bulkifyScoreThreshold", AnalyzerSettings.DEFAULT_BULKIFY_SCORE_THRESHOLD),
                intValue(root, "bulkifyComplexityThreshold", AnalyzerSettings.DEFAULT_BULKIFY_COMPLEXITY_THRESHOLD));
        } catch (IllegalArgumentException e) {
            throw new IOException("Invalid settings: " + e.getMessage(), e);
        }
    }

    private static int intValue(JsonNode root, String field, int defaultValue) throws IOException {
        JsonNode value = root.get(field);
        if (value == null || value.isNull()) {
            return defaultValue;
        }
        if (!value.canConvertToInt() || !value.isIntegralNumber()) {
            throw new IOException("Setting '%s' must be an integer, was %s".formatted(field, value));
        }
        return value.asInt();
    }
}
