package dev.flowbulk.engine;

import dev.flowbulk.fetch.FlowAnalysisException;
import dev.flowbulk.fetch.RawMetadata;
import dev.flowbulk.fetch.WorkflowFetcher;
import dev.flowbulk.model.FlowDefinition;
import dev.flowbulk.model.LoopContext;
import dev.flowbulk.model.WorkflowAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Fetches and analyses referenced sub-workflows, bounded by a maximum nesting depth.
 *
 * <p>Each distinct name is analysed once per cache. A name that is already being resolved
 * higher up the same call chain is a reference cycle: it is analysed again outside the cache
 * and the depth limit ends the chain with a sentinel.
 */
public final class SubflowResolver {

    private static final Logger LOG = LoggerFactory.getLogger(SubflowResolver.class);

    /** Runs the per-workflow stages on a fetched definition. */
    @FunctionalInterface
    public interface DefinitionAnalyzer {
        /**
         * @param path names of the workflows from the top-level one down to {@code definition}, inclusive
         */
        WorkflowAnalysis analyze(FlowDefinition definition, int depth, List<String> path) throws FlowAnalysisException;
    }

    private final WorkflowFetcher fetcher;
    private final AnalysisCache cache;
    private final int maxDepth;

    public SubflowResolver(WorkflowFetcher fetcher, AnalysisCache cache, int maxDepth) {
        if (maxDepth < 1) {
            throw new IllegalArgumentException("maxDepth must be at least 1, was " + maxDepth);
        }
        this.fetcher = fetcher;
        this.cache = cache;
        this.maxDepth = maxDepth;
    }

    /**
     * Analyse the sub-workflow {@code name} at nesting {@code depth}.
     *
     * @param loopHint context of the calling element when the call happens inside a loop, else null
     * @param path     names of the workflows on the call chain above this one
     * @throws FlowAnalysisException if the sub-workflow cannot be fetched or parsed
     */
    public WorkflowAnalysis resolve(String name, int depth, LoopContext loopHint, List<String> path,
                                    DefinitionAnalyzer analyzer) throws FlowAnalysisException {
        if (depth >= maxDepth) {
            LOG.warn("Maximum recursion depth {} reached at sub-workflow {} (call chain {})", maxDepth, name, path);
            return WorkflowAnalysis.depthLimit(name, depth);
        }
        if (loopHint != null && loopHint.inLoop()) {
            LOG.debug("Resolving {} called inside loop {}", name, loopHint.loopReferenceName());
        }
        if (path.contains(name)) {
            LOG.debug("Reference cycle through {} (call chain {}); analysing outside the cache", name, path);
            return analyze(name, depth, path, analyzer);
        }
        return cache.getOrCompute(name, () -> analyze(name, depth, path, analyzer));
    }

    private WorkflowAnalysis analyze(String name, int depth, List<String> path, DefinitionAnalyzer analyzer)
            throws FlowAnalysisException {
        RawMetadata raw = fetcher.fetch(name);
        FlowDefinition definition = MetadataNormalizer.normalize(raw);
        var childPath = new ArrayList<>(path);
        childPath.add(name);
        return analyzer.analyze(definition, depth, List.copyOf(childPath));
    }

    public int maxDepth() {
        return maxDepth;
    }

    public AnalysisCache cache() {
        return cache;
    }
}
