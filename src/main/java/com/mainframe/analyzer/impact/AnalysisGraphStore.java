package com.mainframe.analyzer.impact;

import com.mainframe.analyzer.impact.exception.GraphNotFoundException;
import com.mainframe.analyzer.pipeline.BatchAnalysis;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the current {@link AnalysisGraph} snapshot together with the batch it was built from.
 *
 * Publishing builds a complete new snapshot and swaps it in atomically; readers keep whatever
 * snapshot they obtained and never see a partially built graph.
 */
public class AnalysisGraphStore {
    private static final Logger log = LoggerFactory.getLogger(AnalysisGraphStore.class);

    private final AnalysisGraphBuilder builder;
    private final AtomicReference<Snapshot> current = new AtomicReference<>();

    public AnalysisGraphStore() {
        this(new AnalysisGraphBuilder());
    }

    public AnalysisGraphStore(AnalysisGraphBuilder builder) {
        this.builder = builder;
    }

    /**
     * Builds and publishes a graph for the batch. Returns the batch stamped with the new graph
     * version.
     */
    public BatchAnalysis publish(BatchAnalysis batch) {
        Snapshot published = current.updateAndGet(previous -> {
            long version = previous == null ? 1 : previous.graph.getVersion() + 1;
            BatchAnalysis stamped = batch.toBuilder().graphVersion(version).build();
            return new Snapshot(builder.build(stamped, version), stamped);
        });
        log.info("Published analysis graph v{}", published.graph.getVersion());
        return published.batch;
    }

    /**
     * Current snapshot.
     *
     * @throws GraphNotFoundException when nothing has been published yet
     */
    public AnalysisGraph current() {
        Snapshot snapshot = current.get();
        if (snapshot == null) {
            throw new GraphNotFoundException("No analysis graph has been published");
        }
        return snapshot.graph;
    }

    public Optional<AnalysisGraph> find() {
        return Optional.ofNullable(current.get()).map(s -> s.graph);
    }

    /**
     * Batch behind the current snapshot, empty before the first publication.
     */
    public Optional<BatchAnalysis> currentBatch() {
        return Optional.ofNullable(current.get()).map(s -> s.batch);
    }

    private static final class Snapshot {
        final AnalysisGraph graph;
        final BatchAnalysis batch;

        Snapshot(AnalysisGraph graph, BatchAnalysis batch) {
            this.graph = graph;
            this.batch = batch;
        }
    }
}
