package dev.flowbulk.engine;

import dev.flowbulk.fetch.FlowAnalysisException;
import dev.flowbulk.model.WorkflowAnalysis;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Sub-workflow analyses by name for the lifetime of one top-level run.
 * The first caller for a name computes it; concurrent callers for the same name wait for that result.
 * A failed computation stays cached and is rethrown to later callers.
 */
public final class AnalysisCache {

    private static final Logger LOG = LoggerFactory.getLogger(AnalysisCache.class);

    /** Work that produces the analysis of one sub-workflow. */
    @FunctionalInterface
    public interface Computation {
        WorkflowAnalysis compute() throws FlowAnalysisException;
    }

    private final ConcurrentHashMap<String, CompletableFuture<WorkflowAnalysis>> entries = new ConcurrentHashMap<>();
    private final AtomicInteger hits = new AtomicInteger();
    private final AtomicInteger computations = new AtomicInteger();

    /**
     * Return the analysis cached under {@code name}, running {@code computation} only if no caller has yet.
     */
    public WorkflowAnalysis getOrCompute(String name, Computation computation) throws FlowAnalysisException {
        var created = new CompletableFuture<WorkflowAnalysis>();
        CompletableFuture<WorkflowAnalysis> existing = entries.putIfAbsent(name, created);
        if (existing != null) {
            hits.incrementAndGet();
            LOG.debug("Cache hit for {}", name);
            return await(name, existing);
        }

        computations.incrementAndGet();
        LOG.debug("Cache miss for {}", name);
        try {
            WorkflowAnalysis result = computation.compute();
            created.complete(result);
            return result;
        } catch (FlowAnalysisException | RuntimeException e) {
            created.completeExceptionally(e);
            throw e;
        }
    }

    private static WorkflowAnalysis await(String name, CompletableFuture<WorkflowAnalysis> future)
            throws FlowAnalysisException {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FlowAnalysisException("Interrupted while waiting for the analysis of " + name, e);
        } catch (CancellationException e) {
            throw new FlowAnalysisException("Analysis of " + name + " was cancelled", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof FlowAnalysisException failure) {
                throw failure;
            }
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new FlowAnalysisException("Analysis of " + name + " failed", cause);
        }
    }

    /** The completed analysis for {@code name}, if one is cached and succeeded. */
    public Optional<WorkflowAnalysis> get(String name) {
        CompletableFuture<WorkflowAnalysis> future = entries.get(name);
        if (future == null || !future.isDone() || future.isCompletedExceptionally()) {
            return Optional.empty();
        }
        return Optional.of(future.join());
    }

    public boolean contains(String name) {
        return entries.containsKey(name);
    }

    public int size() {
        return entries.size();
    }

    /** Lookups answered from an existing entry. */
    public int hits() {
        return hits.get();
    }

    /** Computations started, one per distinct name. */
    public int computations() {
        return computations.get();
    }
}
