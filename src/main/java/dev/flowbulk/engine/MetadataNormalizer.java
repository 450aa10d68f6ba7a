package dev.flowbulk.engine;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import dev.flowbulk.fetch.MalformedMetadataException;
import dev.flowbulk.fetch.RawMetadata;
import dev.flowbulk.model.FlowDefinition;
import dev.flowbulk.model.FlowVersion;
import dev.flowbulk.model.StepKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.HashSet;
import java.util.Set;

/**
 * Turns raw XML or JSON workflow metadata into the canonical tree the analysis reads:
 * step categories and nested list fields are always arrays, every other field is a single value.
 */
public final class MetadataNormalizer {

    private static final Logger LOG = LoggerFactory.getLogger(MetadataNormalizer.class);

    private static final ObjectMapper JSON = new ObjectMapper();
    private static final XmlMapper XML = new XmlMapper();

    private static final Set<String> WRAPPERS = Set.of("Flow", "Metadata");

    /** Fields that hold a list whatever their cardinality in the source. */
    static final Set<String> LIST_FIELDS;

    static {
        var fields = new HashSet<String>();
        Arrays.stream(StepKind.values()).map(StepKind::category).forEach(fields::add);
        fields.addAll(Set.of(
            "rules", "conditions", "inputAssignments", "outputAssignments", "inputParameters",
            "outputParameters", "assignmentItems", "filters", "fields", "queriedFields", "formulas",
            "dynamicChoiceSets", "variables", "processMetadataValues"));
        LIST_FIELDS = Set.copyOf(fields);
    }

    private MetadataNormalizer() {}

    /**
     * Parse and canonicalise fetched metadata.
     *
     * @throws MalformedMetadataException if the content is empty, unparseable, or its root is not an object
     */
    public static FlowDefinition normalize(RawMetadata raw) throws MalformedMetadataException {
        JsonNode parsed = parse(raw.name(), raw.content());
        ObjectNode root = canonicalRoot(raw.name(), parsed);

        FlowVersion version = raw.version() != null ? raw.version() : FlowVersion.unknown();
        JsonNode status = root.get("status");
        if (status != null && status.isValueNode() && !status.asText().isBlank()) {
            version = version.withStatus(status.asText());
        }
        return new FlowDefinition(raw.name(), version, root);
    }

    private static JsonNode parse(String name, String content) throws MalformedMetadataException {
        if (content == null || content.isBlank()) {
            throw new MalformedMetadataException("Workflow '%s' has empty metadata".formatted(name));
        }
        String trimmed = content.strip();
        try {
            if (trimmed.startsWith("<")) {
                LOG.debug("Parsing metadata of {} as XML", name);
                return XML.readTree(trimmed);
            }
            if (trimmed.startsWith("{")) {
                LOG.debug("Parsing metadata of {} as JSON", name);
                return JSON.readTree(trimmed);
            }
        } catch (JsonProcessingException e) {
            throw new MalformedMetadataException(
                "Failed to parse metadata of workflow '%s': %s".formatted(name, e.getOriginalMessage()), e);
        }
        throw new MalformedMetadataException("Unsupported metadata format for workflow '%s'".formatted(name));
    }

    private static ObjectNode canonicalRoot(String name, JsonNode parsed) throws MalformedMetadataException {
        JsonNode root = parsed;
        while (root != null && root.isObject() && root.size() == 1) {
            String only = root.fieldNames().next();
            if (!WRAPPERS.contains(only) || !root.get(only).isObject()) {
                break;
            }
            root = root.get(only);
        }
        if (root == null || !root.isObject()) {
            throw new MalformedMetadataException("Workflow '%s' has no root metadata element".formatted(name));
        }
        return (ObjectNode) canonical(root);
    }

    private static JsonNode canonical(JsonNode node) {
        if (node.isObject()) {
            ObjectNode out = JsonNodeFactory.instance.objectNode();
            for (var entry : node.properties()) {
                String field = entry.getKey();
                JsonNode value = entry.getValue();
                if (LIST_FIELDS.contains(field)) {
                    out.set(field, asList(value));
                } else {
                    out.set(field, canonical(unwrapSingle(value)));
                }
            }
            return out;
        }
        if (node.isArray()) {
            ArrayNode out = JsonNodeFactory.instance.arrayNode();
            node.forEach(item -> out.add(canonical(item)));
            return out;
        }
        return node;
    }

    private static ArrayNode asList(JsonNode value) {
        ArrayNode out = JsonNodeFactory.instance.arrayNode();
        if (value == null || value.isNull() || isEmptyText(value)) {
            return out;
        }
        if (value.isArray()) {
            value.forEach(item -> out.add(canonical(item)));
        } else {
            out.add(canonical(value));
        }
        return out;
    }

    private static JsonNode unwrapSingle(JsonNode value) {
        JsonNode current = value;
        while (current.isArray() && current.size() == 1) {
            current = current.get(0);
        }
        return current;
    }

    // <fields/> in XML reads as an empty string
    private static boolean isEmptyText(JsonNode value) {
        return value.isTextual() && value.asText().isBlank();
    }
}
