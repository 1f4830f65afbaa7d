package com.eainde.vendorrisk.nodes;

import com.eainde.vendorrisk.discovery.DocumentDiscoveryEngine;
import com.eainde.vendorrisk.model.DocumentCandidate;
import com.eainde.vendorrisk.state.AssessmentState;
import com.eainde.vendorrisk.workflow.RunContext;
import com.eainde.vendorrisk.workflow.RunContextRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

@Slf4j
@Component
@RequiredArgsConstructor
public class DiscoveryNode implements AsyncNodeAction<AssessmentState> {

    private final DocumentDiscoveryEngine discoveryEngine;
    private final RunContextRegistry runContexts;

    @Override
    public CompletableFuture<Map<String, Object>> apply(AssessmentState state) {
        RunContext ctx = runContexts.get(state.getRunId());
        List<DocumentCandidate> candidates = discoveryEngine.discover(
                state.getVendor(), ctx.executor(), ctx.cancellation(), ctx.completion());
        ctx.recordCandidates(candidates);
        log.info("Discovery produced {} candidates", candidates.size());
        return CompletableFuture.completedFuture(Map.of(
                AssessmentState.CANDIDATES, candidates,
                AssessmentState.CANCELLED, ctx.isCancelled()));
    }
}
