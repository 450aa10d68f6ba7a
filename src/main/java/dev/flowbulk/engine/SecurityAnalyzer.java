package dev.flowbulk.engine;

import com.fasterxml.jackson.databind.JsonNode;
import dev.flowbulk.model.Element;
import dev.flowbulk.model.ElementDetails;
import dev.flowbulk.model.ElementGraph;
import dev.flowbulk.model.FlowDefinition;
import dev.flowbulk.model.SecurityContext;
import dev.flowbulk.model.StepKind;

import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

/**
 * Derives a workflow's security context from its run mode and its record operations.
 *
 * <p>{@code SYSTEM} and the {@code SystemMode...} values run in system mode. {@code USER} and
 * {@code DefaultMode} enforce object, field and sharing checks; {@code SystemModeWithSharing}
 * enforces sharing only. Without a run mode nothing is enforced.
 */
public final class SecurityAnalyzer {

    static final Map<StepKind, String> OPERATIONS = new EnumMap<>(Map.of(
        StepKind.RECORD_CREATE, "Create",
        StepKind.RECORD_UPDATE, "Edit",
        StepKind.RECORD_DELETE, "Delete",
        StepKind.RECORD_LOOKUP, "Read"));

    private SecurityAnalyzer() {}

    public static SecurityContext analyze(FlowDefinition definition, ElementGraph graph) {
        String mode = runInMode(definition);
        boolean systemMode = mode != null && mode.regionMatches(true, 0, "System", 0, 6);
        boolean userMode = "USER".equalsIgnoreCase(mode) || "DefaultMode".equalsIgnoreCase(mode);
        boolean sharing = userMode || "SystemModeWithSharing".equalsIgnoreCase(mode);

        var permissions = new HashSet<String>();
        var objects = new HashSet<String>();
        var fields = new HashMap<String, Set<String>>();
        for (Element element : graph.elements().values()) {
            if (!(element.details() instanceof ElementDetails.RecordOperation operation)) {
                continue;
            }
            String object = operation.targetObject();
            if (object == null || object.isBlank()) {
                continue;
            }
            objects.add(object);
            permissions.add(OPERATIONS.get(element.kind()) + "_" + object);
            if (!operation.fields().isEmpty()) {
                fields.computeIfAbsent(object, k -> new HashSet<>()).addAll(operation.fields());
            }
        }
        return new SecurityContext(mode, systemMode, userMode, userMode, sharing, permissions, objects, fields);
    }

    private static String runInMode(FlowDefinition definition) {
        JsonNode mode = definition.root().path("runInMode");
        return mode.isValueNode() && !mode.asText().isBlank() ? mode.asText() : null;
    }
}
