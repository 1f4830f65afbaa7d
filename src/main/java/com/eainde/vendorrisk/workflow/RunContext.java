package com.eainde.vendorrisk.workflow;

import com.eainde.vendorrisk.llm.CompletionClient;
import com.eainde.vendorrisk.model.DocumentCandidate;
import com.eainde.vendorrisk.model.Finding;
import com.eainde.vendorrisk.thread.CancellationSignal;
import com.eainde.vendorrisk.thread.MdcAwareExecutor;

import java.util.List;

/**
 * Resources owned by one assessment run. Nothing in here is shared with another run.
 * <p>
 * Stages also record their output here so that a run whose graph fails part-way can still be scored
 * from what it had collected.
 */
public class RunContext implements AutoCloseable {

    private final String runId;
    private final CancellationSignal cancellation;
    private final MdcAwareExecutor executor;
    private final CompletionClient completion;

    private volatile List<DocumentCandidate> candidates = List.of();
    private volatile List<Finding> findings = List.of();

    public RunContext(String runId, CancellationSignal cancellation, MdcAwareExecutor executor,
                      CompletionClient completion) {
        this.runId = runId;
        this.cancellation = cancellation;
        this.executor = executor;
        this.completion = completion;
    }

    public String runId() { return runId; }
    public CancellationSignal cancellation() { return cancellation; }
    public MdcAwareExecutor executor() { return executor; }
    public CompletionClient completion() { return completion; }

    public boolean isCancelled() {
        return cancellation.isCancelled();
    }

    public List<DocumentCandidate> candidates() { return candidates; }
    public List<Finding> findings() { return findings; }

    public void recordCandidates(List<DocumentCandidate> candidates) {
        this.candidates = List.copyOf(candidates);
    }

    public void recordFindings(List<Finding> findings) {
        this.findings = List.copyOf(findings);
    }

    @Override
    public void close() {
        executor.close();
    }
}
