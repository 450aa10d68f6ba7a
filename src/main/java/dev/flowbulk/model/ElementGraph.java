package dev.flowbulk.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The element graph of one workflow: elements by name plus the derived adjacency
 * (union of all edge kinds). Iteration order follows the order elements were added.
 */
public final class ElementGraph {

    private final String workflowName;
    private final Map<String, Element> elements;
    private final Map<String, Set<String>> adjacency;
    private final FlowTraits traits;

    public ElementGraph(String workflowName, List<Element> elements, FlowTraits traits) {
        this.workflowName = workflowName;
        this.traits = traits;
        var byName = new LinkedHashMap<String, Element>();
        var targets = new LinkedHashMap<String, Set<String>>();
        for (Element element : elements) {
            // A duplicate name keeps its first registration; later ones only add edges.
            byName.putIfAbsent(element.name(), element);
            Set<String> out = targets.computeIfAbsent(element.name(), k -> new LinkedHashSet<>());
            element.edges().forEach(edge -> out.add(edge.target()));
        }
        targets.replaceAll((k, v) -> Collections.unmodifiableSet(v));
        this.elements = Collections.unmodifiableMap(byName);
        this.adjacency = Collections.unmodifiableMap(targets);
    }

    public String workflowName() { return workflowName; }
    public Map<String, Element> elements() { return elements; }
    public Map<String, Set<String>> adjacency() { return adjacency; }
    public FlowTraits traits() { return traits; }
    public int size() { return elements.size(); }

    public Element element(String name) {
        return elements.get(name);
    }

    public boolean contains(String name) {
        return elements.containsKey(name);
    }

    /** Targets directly reachable from {@code name}, including dangling ones. */
    public Set<String> targets(String name) {
        return adjacency.getOrDefault(name, Set.of());
    }

    /** Objects the record operations work on, each once, in graph order. */
    public List<String> objectDependencies() {
        var objects = new LinkedHashSet<String>();
        for (Element element : elements.values()) {
            if (element.details() instanceof ElementDetails.RecordOperation operation
                && operation.targetObject() != null && !operation.targetObject().isBlank()) {
                objects.add(operation.targetObject());
            }
        }
        return List.copyOf(objects);
    }

    public List<Element> ofKind(StepKind kind) {
        return elements.values().stream().filter(e -> e.kind() == kind).toList();
    }

    public int count(StepKind kind) {
        return (int) elements.values().stream().filter(e -> e.kind() == kind).count();
    }

    /**
     * Edge targets that name no element, as {@code source -> target} pairs in graph order.
     */
    public List<Map.Entry<String, String>> danglingTargets() {
        var dangling = new ArrayList<Map.Entry<String, String>>();
        for (var entry : adjacency.entrySet()) {
            for (String target : entry.getValue()) {
                if (!elements.containsKey(target)) {
                    dangling.add(Map.entry(entry.getKey(), target));
                }
            }
        }
        return dangling;
    }
}
