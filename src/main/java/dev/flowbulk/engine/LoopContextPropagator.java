package dev.flowbulk.engine;

import dev.flowbulk.model.Element;
import dev.flowbulk.model.ElementDetails;
import dev.flowbulk.model.ElementGraph;
import dev.flowbulk.model.LoopContext;
import dev.flowbulk.model.StepKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumSet;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Classifies every element of a workflow as executed once or per iteration of some loop.
 *
 * <p>Pass A seeds every edge target of each loop, its exit connector included (first loop to
 * claim a target wins), and then carries contexts along edges until a full scan changes nothing.
 * Every target of a loop reached inside another loop starts a context one level deeper.
 * Pass B then marks elements that read a loop's current item through a value expression
 * without being reachable from the loop.
 * Pass B does not feed back into Pass A.
 *
 * <p>Termination of Pass A: a seeded context only ever deepens under its own loop, every other
 * context is only replaced by a {@code (loop, depth)} pair the element has never held, and depth
 * is capped by the number of loops and calls in the graph.
 */
public final class LoopContextPropagator {

    private static final Logger LOG = LoggerFactory.getLogger(LoopContextPropagator.class);

    /** Kinds whose value expressions are checked for current-item references. */
    static final Set<StepKind> REFERENCE_CHECKED = EnumSet.of(
        StepKind.ASSIGNMENT, StepKind.RECORD_LOOKUP, StepKind.RECORD_CREATE, StepKind.RECORD_UPDATE,
        StepKind.RECORD_DELETE, StepKind.SUBFLOW, StepKind.ACTION_CALL);

    private final ElementGraph graph;
    private final List<Element> loops;
    private final int maxDepth;

    private final Map<String, LoopContext> contexts = new HashMap<>();
    private final Set<String> seeded = new HashSet<>();
    private final Map<String, Set<String>> heldPairs = new HashMap<>();
    private int rounds;

    public LoopContextPropagator(ElementGraph graph) {
        this.graph = graph;
        this.loops = graph.ofKind(StepKind.LOOP);
        this.maxDepth = loops.size() + graph.count(StepKind.SUBFLOW) + graph.count(StepKind.ACTION_CALL) + 1;
    }

    /**
     * Convenience for a one-off propagation.
     */
    public static Map<String, LoopContext> propagate(ElementGraph graph) {
        return new LoopContextPropagator(graph).run();
    }

    /**
     * Run both passes. Elements that are never reached from a loop have no entry.
     *
     * @return loop contexts keyed by element name, in graph order
     */
    public Map<String, LoopContext> run() {
        contexts.clear();
        seeded.clear();
        heldPairs.clear();
        rounds = 0;

        seed();
        propagateDirect();
        detectIndirectReferences();

        var ordered = new LinkedHashMap<String, LoopContext>();
        for (String name : graph.elements().keySet()) {
            LoopContext context = contexts.get(name);
            if (context != null) {
                ordered.put(name, context);
            }
        }
        LOG.debug("Loop contexts for {}: {} of {} elements in loops after {} rounds",
            graph.workflowName(), ordered.size(), graph.size(), rounds);
        return Collections.unmodifiableMap(ordered);
    }

    /** Number of full scans Pass A needed to reach its fixed point in the last run. */
    public int rounds() {
        return rounds;
    }

    private void seed() {
        for (Element loop : loops) {
            for (String target : graph.targets(loop.name())) {
                Element element = graph.element(target);
                if (element == null || contexts.containsKey(target)) {
                    continue;
                }
                put(target, LoopContext.start(loop.name(), 1, target, element.kind()));
                seeded.add(target);
                LOG.debug("Seeded {} in loop {}", target, loop.name());
            }
        }
    }

    private void propagateDirect() {
        boolean changed = true;
        while (changed) {
            changed = false;
            rounds++;
            for (String name : graph.elements().keySet()) {
                LoopContext context = contexts.get(name);
                if (context == null || !context.inLoop()) {
                    continue;
                }
                Element source = graph.element(name);
                for (String target : graph.targets(name)) {
                    Element element = graph.element(target);
                    if (element == null) {
                        continue;
                    }
                    if (element.kind() == StepKind.LOOP && isOwnedBy(context, element.name())) {
                        // back edge from a loop's own body
                        continue;
                    }
                    LoopContext candidate = candidate(source, context, element);
                    if (offer(target, candidate)) {
                        changed = true;
                        LOG.debug("Propagated loop {} (depth {}) to {} from {}",
                            candidate.loopReferenceName(), candidate.depth(), target, name);
                    }
                }
            }
        }
    }

    private LoopContext candidate(Element source, LoopContext context, Element target) {
        if (source.kind() == StepKind.LOOP && !source.name().equals(context.loopReferenceName())) {
            // the body of a loop that itself runs inside another loop
            return LoopContext.start(source.name(), context.depth() + 1, target.name(), target.kind());
        }
        if (target.kind().isInvocation()) {
            String referenced = referencedLoop(target);
            if (referenced != null && !referenced.equals(context.loopReferenceName())) {
                return context.extend(referenced, context.depth() + 1, target.name(), target.kind());
            }
        }
        return context.extend(target.name(), target.kind());
    }

    private boolean offer(String target, LoopContext candidate) {
        LoopContext existing = contexts.get(target);
        if (existing != null && existing.sameClassification(candidate)) {
            return false;
        }
        if (candidate.depth() > maxDepth) {
            return false;
        }
        if (existing != null && seeded.contains(target)
            && !(existing.loopReferenceName().equals(candidate.loopReferenceName())
                 && candidate.depth() > existing.depth())) {
            return false;
        }
        if (heldPairs.getOrDefault(target, Set.of()).contains(pairKey(candidate))) {
            return false;
        }
        put(target, candidate);
        return true;
    }

    private void put(String target, LoopContext context) {
        contexts.put(target, context);
        heldPairs.computeIfAbsent(target, k -> new HashSet<>()).add(pairKey(context));
    }

    private static String pairKey(LoopContext context) {
        return context.loopReferenceName() + '#' + context.depth();
    }

    /**
     * True when a context lies, directly or through enclosing loops, inside the body of {@code loopName}.
     */
    private boolean isOwnedBy(LoopContext context, String loopName) {
        var visited = new HashSet<String>();
        LoopContext current = context;
        while (current != null && visited.add(current.loopReferenceName())) {
            if (current.loopReferenceName().equals(loopName)) {
                return true;
            }
            current = contexts.get(current.loopReferenceName());
        }
        return false;
    }

    private void detectIndirectReferences() {
        for (Element element : graph.elements().values()) {
            if (!REFERENCE_CHECKED.contains(element.kind())) {
                continue;
            }
            LoopContext existing = contexts.get(element.name());
            if (existing != null && existing.inLoop()) {
                continue;
            }
            String loopName = referencedLoop(element);
            if (loopName != null) {
                put(element.name(), LoopContext.start(loopName, 1, element.name(), element.kind()));
                LOG.debug("{} reads the current item of loop {}", element.name(), loopName);
            }
        }
    }

    /**
     * Name of the first loop whose current item one of the element's value expressions reads, or null.
     */
    String referencedLoop(Element element) {
        for (String expression : element.details().valueExpressions()) {
            for (Element loop : loops) {
                if (refersTo(expression, loop.name())) {
                    return loop.name();
                }
                var details = (ElementDetails.Loop) loop.details();
                String itemVariable = details.assignNextValueToReference();
                if (itemVariable != null && refersTo(expression, itemVariable)) {
                    return loop.name();
                }
            }
        }
        return null;
    }

    static boolean refersTo(String expression, String variable) {
        return expression.equals(variable) || expression.startsWith(variable + ".");
    }
}
