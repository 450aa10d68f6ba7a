package dev.flowbulk.model;

import java.util.List;

/**
 * A directed connection from one element to the element named by {@code target}.
 * Only rule edges carry condition logic and conditions.
 */
public record Edge(
    String target,
    EdgeKind kind,
    String conditionLogic, // nullable
    List<Condition> conditions
) {
    public Edge {
        conditions = conditions == null ? List.of() : List.copyOf(conditions);
    }

    public static Edge of(String target, EdgeKind kind) {
        return new Edge(target, kind, null, List.of());
    }
}
