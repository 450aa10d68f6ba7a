package dev.flowbulk.engine;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dev.flowbulk.model.Condition;
import dev.flowbulk.model.Edge;
import dev.flowbulk.model.EdgeKind;
import dev.flowbulk.model.Element;
import dev.flowbulk.model.ElementDetails;
import dev.flowbulk.model.ElementGraph;
import dev.flowbulk.model.FlowDefinition;
import dev.flowbulk.model.FlowTraits;
import dev.flowbulk.model.StepKind;
import dev.flowbulk.model.ValueAssignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Builds the element graph from a canonical workflow definition in a single pass.
 */
public final class GraphBuilder {

    private static final Logger LOG = LoggerFactory.getLogger(GraphBuilder.class);

    /** Connector properties in the order their edges are recorded. */
    private static final List<Map.Entry<String, EdgeKind>> CONNECTORS = List.of(
        Map.entry("connector", EdgeKind.PRIMARY),
        Map.entry("nextValueConnector", EdgeKind.NEXT_VALUE),
        Map.entry("noMoreValuesConnector", EdgeKind.DEFAULT),
        Map.entry("defaultConnector", EdgeKind.DEFAULT),
        Map.entry("faultConnector", EdgeKind.FAULT));

    private GraphBuilder() {}

    public static ElementGraph build(FlowDefinition definition) {
        ObjectNode root = definition.root();
        var elements = new ArrayList<Element>();

        for (StepKind kind : StepKind.values()) {
            for (JsonNode node : root.path(kind.category())) {
                elements.add(parseElement(kind, node));
            }
        }

        var graph = new ElementGraph(definition.name(), elements, parseTraits(root));
        LOG.debug("Built graph for {}: {} elements", definition.name(), graph.size());
        return graph;
    }

    static Element parseElement(StepKind kind, JsonNode node) {
        String name = text(node, "name");
        if (name == null || name.isBlank()) {
            LOG.debug("{} element without a name recorded as {}", kind.label(), Element.UNNAMED);
            name = Element.UNNAMED;
        }
        return new Element(name, kind, parseDetails(kind, node), parseEdges(kind, node));
    }

    private static List<Edge> parseEdges(StepKind kind, JsonNode node) {
        var edges = new ArrayList<Edge>();
        for (var entry : CONNECTORS) {
            String target = targetOf(node.get(entry.getKey()));
            if (target != null) {
                edges.add(Edge.of(target, entry.getValue()));
            }
        }
        if (kind == StepKind.DECISION) {
            for (JsonNode rule : node.path("rules")) {
                String target = targetOf(rule.get("connector"));
                if (target != null) {
                    edges.add(new Edge(target, EdgeKind.RULE, text(rule, "conditionLogic"), parseConditions(rule)));
                }
            }
        }
        return edges;
    }

    private static List<Condition> parseConditions(JsonNode rule) {
        var conditions = new ArrayList<Condition>();
        for (JsonNode condition : rule.path("conditions")) {
            conditions.add(new Condition(
                text(condition, "leftValueReference"),
                text(condition, "operator"),
                valueExpression(condition.get("rightValue"))));
        }
        return conditions;
    }

    private static ElementDetails parseDetails(StepKind kind, JsonNode node) {
        return switch (kind) {
            case RECORD_CREATE, RECORD_UPDATE, RECORD_DELETE, RECORD_LOOKUP -> parseRecordOperation(node);
            case ASSIGNMENT -> new ElementDetails.Assignment(assignments(node.path("assignmentItems"), "assignToReference"));
            case DECISION -> new ElementDetails.Decision(names(node.path("rules")));
            case LOOP -> new ElementDetails.Loop(
                text(node, "collectionReference"),
                text(node, "iterationOrder"),
                text(node, "assignNextValueToReference"));
            case SUBFLOW -> new ElementDetails.Subflow(
                text(node, "flowName"),
                assignments(node.path("inputAssignments"), "name"),
                outputs(node.path("outputAssignments")));
            case ACTION_CALL -> new ElementDetails.ActionCall(
                text(node, "actionName"),
                text(node, "actionType"),
                assignments(node.path("inputParameters"), "name"));
            case SCREEN -> new ElementDetails.Screen(names(node.path("fields")));
            case RECORD_ROLLBACK -> new ElementDetails.Rollback();
        };
    }

    private static ElementDetails.RecordOperation parseRecordOperation(JsonNode node) {
        var fields = new ArrayList<String>();
        fields.addAll(names(node.path("queriedFields")));
        fields.addAll(names(node.path("fields")));
        var inputs = new ArrayList<ValueAssignment>();
        inputs.addAll(assignments(node.path("inputAssignments"), "field"));
        inputs.addAll(assignments(node.path("filters"), "field"));
        inputs.forEach(input -> {
            if (input.name() != null && !fields.contains(input.name())) {
                fields.add(input.name());
            }
        });
        return new ElementDetails.RecordOperation(text(node, "object"), fields, inputs, text(node, "inputReference"));
    }

    /** Names of list items that are either bare values or objects with a {@code name}. */
    private static List<String> names(JsonNode items) {
        var names = new ArrayList<String>();
        for (JsonNode item : items) {
            String name = item.isValueNode() ? item.asText() : text(item, "name");
            if (name != null && !name.isBlank()) {
                names.add(name);
            }
        }
        return names;
    }

    private static List<ValueAssignment> assignments(JsonNode items, String nameField) {
        var result = new ArrayList<ValueAssignment>();
        for (JsonNode item : items) {
            result.add(new ValueAssignment(text(item, nameField), valueExpression(item.get("value"))));
        }
        return result;
    }

    private static List<ValueAssignment> outputs(JsonNode items) {
        var result = new ArrayList<ValueAssignment>();
        for (JsonNode item : items) {
            result.add(new ValueAssignment(text(item, "name"), text(item, "assignToReference")));
        }
        return result;
    }

    private static FlowTraits parseTraits(ObjectNode root) {
        int choiceSets = root.path("dynamicChoiceSets").size();

        String triggerType = text(root.path("start"), "triggerType");
        if (triggerType == null) {
            triggerType = text(root.path("trigger"), "type");
        }
        boolean recordTriggered = triggerType != null && triggerType.startsWith("Record");

        int crossObject = 0;
        for (JsonNode formula : root.path("formulas")) {
            String expression = text(formula, "expression");
            if (expression != null && expression.contains(".")) {
                crossObject++;
            }
        }
        return new FlowTraits(choiceSets, recordTriggered, crossObject);
    }

    private static String targetOf(JsonNode connector) {
        if (connector == null || connector.isNull()) {
            return null;
        }
        String target = connector.isValueNode() ? connector.asText() : text(connector, "targetReference");
        return target == null || target.isBlank() ? null : target;
    }

    /**
     * Reference text of a value node: its {@code elementReference}, else its {@code stringValue};
     * merge-field syntax {@code {!X.Y}} is reduced to {@code X.Y}.
     */
    static String valueExpression(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        String expression = value.isValueNode() ? value.asText() : text(value, "elementReference");
        if (expression == null && value.isObject()) {
            expression = text(value, "stringValue");
        }
        if (expression == null) {
            return null;
        }
        expression = expression.strip();
        if (expression.startsWith("{!") && expression.endsWith("}")) {
            expression = expression.substring(2, expression.length() - 1).strip();
        }
        return expression.isEmpty() ? null : expression;
    }

    private static String text(JsonNode node, String field) {
        if (node == null) {
            return null;
        }
        JsonNode value = node.get(field);
        return value != null && value.isValueNode() && !value.isNull() ? value.asText() : null;
    }
}
