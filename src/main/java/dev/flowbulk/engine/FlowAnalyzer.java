package dev.flowbulk.engine;

import dev.flowbulk.fetch.FlowAnalysisException;
import dev.flowbulk.fetch.RawMetadata;
import dev.flowbulk.fetch.WorkflowFetcher;
import dev.flowbulk.model.AnalyzerSettings;
import dev.flowbulk.model.Element;
import dev.flowbulk.model.ElementGraph;
import dev.flowbulk.model.FlowDefinition;
import dev.flowbulk.model.FlowMetrics;
import dev.flowbulk.model.LoopContext;
import dev.flowbulk.model.Recommendation;
import dev.flowbulk.model.StepKind;
import dev.flowbulk.model.SubflowCall;
import dev.flowbulk.model.WorkflowAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs the full analysis of a workflow and everything it calls.
 * One instance covers one run: its cache and its record of unresolved sub-workflows are never reset.
 */
public final class FlowAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(FlowAnalyzer.class);

    private final WorkflowFetcher fetcher;
    private final AnalyzerSettings settings;
    private final SubflowResolver resolver;
    private final Set<String> unresolved = ConcurrentHashMap.newKeySet();

    public FlowAnalyzer(WorkflowFetcher fetcher, AnalyzerSettings settings) {
        this(fetcher, settings, new AnalysisCache());
    }

    public FlowAnalyzer(WorkflowFetcher fetcher, AnalyzerSettings settings, AnalysisCache cache) {
        this.fetcher = fetcher;
        this.settings = settings;
        this.resolver = new SubflowResolver(fetcher, cache, settings.maxRecursionDepth());
    }

    /**
     * Analyse the top-level workflow {@code nameOrPath}.
     *
     * @throws FlowAnalysisException if the workflow cannot be fetched or its metadata is malformed
     */
    public WorkflowAnalysis analyze(String nameOrPath) throws FlowAnalysisException {
        LOG.info("Analyzing {} from {}", nameOrPath, fetcher.describe());
        RawMetadata raw = fetcher.fetch(nameOrPath);
        FlowDefinition definition = MetadataNormalizer.normalize(raw);
        WorkflowAnalysis analysis = analyzeDefinition(definition, 0, List.of(definition.name()));
        LOG.info("Finished {}: cumulative complexity {}, {} sub-workflow analyses computed, {} cache hits",
            analysis.name(), analysis.cumulativeComplexity(), cache().computations(), cache().hits());
        return analysis;
    }

    /**
     * Analyse one already normalised definition and resolve its sub-workflows.
     *
     * @param path workflow names from the top-level workflow down to this one, inclusive
     */
    public WorkflowAnalysis analyzeDefinition(FlowDefinition definition, int depth, List<String> path) {
        var warnings = new ArrayList<String>();

        ElementGraph graph = GraphBuilder.build(definition);
        for (var dangling : graph.danglingTargets()) {
            LOG.warn("{}: element {} connects to unknown element {}",
                definition.name(), dangling.getKey(), dangling.getValue());
            warnings.add("Element '%s' connects to unknown element '%s'"
                .formatted(dangling.getKey(), dangling.getValue()));
        }

        Map<String, LoopContext> loopContexts = LoopContextPropagator.propagate(graph);
        FlowMetrics metrics = MetricsCalculator.calculate(graph, loopContexts, depth > 0, settings);
        LOG.info("{} (depth {}): {} elements, {} in loops, complexity {}, bulkification score {}",
            definition.name(), depth, graph.size(), loopContexts.size(), metrics.complexity(),
            metrics.bulkificationScore());

        List<SubflowCall> calls = subflowCalls(graph, loopContexts, warnings);
        List<WorkflowAnalysis> children = resolveChildren(calls, loopContexts, depth, path, warnings);

        int cumulativeComplexity = metrics.complexity();
        int cumulativeDml = metrics.dmlCount();
        int cumulativeSoql = metrics.soqlCount();
        int cumulativeElements = metrics.elementCount();
        for (WorkflowAnalysis child : children) {
            cumulativeComplexity += child.cumulativeComplexity();
            cumulativeDml += child.cumulativeDmlCount();
            cumulativeSoql += child.cumulativeSoqlCount();
            cumulativeElements += child.cumulativeElementCount();
        }

        var recommendations = new ArrayList<Recommendation>();
        recommendations.add(RecommendationGenerator.generate(
            cumulativeComplexity, cumulativeDml, cumulativeSoql, children, path, settings));
        recommendations.addAll(RecommendationGenerator.loopAdvice(metrics));

        return new WorkflowAnalysis(
            definition.name(), depth, definition.version(),
            metrics.elementCount(), metrics.elementCounts(), cumulativeElements,
            metrics.dmlCount(), metrics.soqlCount(), metrics.dmlSources(), metrics.soqlSources(),
            metrics.complexity(), cumulativeComplexity, cumulativeDml, cumulativeSoql,
            metrics.bulkificationScore(), metrics.shouldBulkify(), metrics.reason(),
            loopContexts, metrics.loops(), graph.objectDependencies(), SecurityAnalyzer.analyze(definition, graph),
            calls, children, recommendations, warnings);
    }

    private static List<SubflowCall> subflowCalls(ElementGraph graph, Map<String, LoopContext> loopContexts,
                                                  List<String> warnings) {
        var calls = new ArrayList<SubflowCall>();
        for (Element element : graph.elements().values()) {
            if (!element.kind().isInvocation()) {
                continue;
            }
            String called = element.calledWorkflow();
            if (called == null || called.isBlank()) {
                if (element.kind() == StepKind.SUBFLOW) {
                    warnings.add("Subflow element '%s' names no workflow".formatted(element.name()));
                }
                continue;
            }
            LoopContext context = loopContexts.get(element.name());
            boolean inLoop = context != null && context.inLoop();
            calls.add(new SubflowCall(element.name(), called, inLoop, inLoop ? context.loopReferenceName() : null));
        }
        return calls;
    }

    private List<WorkflowAnalysis> resolveChildren(List<SubflowCall> calls, Map<String, LoopContext> loopContexts,
                                                   int depth, List<String> path, List<String> warnings) {
        // one child per call site; repeats of a name are served from the cache
        var children = new ArrayList<WorkflowAnalysis>();
        var reported = new HashSet<String>();
        for (SubflowCall site : calls) {
            LoopContext hint = loopContexts.get(site.elementName());
            try {
                children.add(resolver.resolve(site.flowName(), depth + 1, hint, path, this::analyzeDefinition));
            } catch (FlowAnalysisException e) {
                unresolved.add(site.flowName());
                if (reported.add(site.flowName())) {
                    LOG.warn("Could not resolve sub-workflow {} called by {}: {}",
                        site.flowName(), site.elementName(), e.getMessage());
                    warnings.add("Sub-workflow '%s' could not be resolved: %s"
                        .formatted(site.flowName(), e.getMessage()));
                }
            }
        }
        return children;
    }

    /** Names of sub-workflows that could not be fetched or parsed during this analyzer's runs, sorted. */
    public Set<String> unresolvedWorkflows() {
        return Collections.unmodifiableSet(new TreeSet<>(unresolved));
    }

    public AnalysisCache cache() {
        return resolver.cache();
    }

    public AnalyzerSettings settings() {
        return settings;
    }
}
