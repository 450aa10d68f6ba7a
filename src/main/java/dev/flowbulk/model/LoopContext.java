package dev.flowbulk.model;

import java.util.ArrayList;
import java.util.List;

/**
 * How an element is reached from an iteration construct.
 * {@code path} runs from the loop's immediate successor to the element; {@code pathKinds} is parallel to it.
 */
public record LoopContext(
    boolean inLoop,
    String loopReferenceName,
    int depth,
    List<String> path,
    List<StepKind> pathKinds
) {
    public LoopContext {
        path = List.copyOf(path);
        pathKinds = List.copyOf(pathKinds);
        if (path.size() != pathKinds.size()) {
            throw new IllegalArgumentException("path and pathKinds differ in length: %s vs %s"
                .formatted(path, pathKinds));
        }
    }

    /** Context of an element directly targeted by a loop, or found through a value reference. */
    public static LoopContext start(String loopName, int depth, String element, StepKind kind) {
        return new LoopContext(true, loopName, depth, List.of(element), List.of(kind));
    }

    /** This context carried one edge further, keeping the owning loop and depth. */
    public LoopContext extend(String target, StepKind kind) {
        return extend(loopReferenceName, depth, target, kind);
    }

    /** This context carried one edge further under a different owning loop or depth. */
    public LoopContext extend(String loopName, int newDepth, String target, StepKind kind) {
        var newPath = new ArrayList<>(path);
        newPath.add(target);
        var newKinds = new ArrayList<>(pathKinds);
        newKinds.add(kind);
        return new LoopContext(true, loopName, newDepth, newPath, newKinds);
    }

    /** True when both contexts name the same owning loop at the same depth. */
    public boolean sameClassification(LoopContext other) {
        return other != null
            && depth == other.depth
            && loopReferenceName.equals(other.loopReferenceName);
    }
}
