package com.eainde.vendorrisk.nodes;

import com.eainde.vendorrisk.model.RetrievedDocument;
import com.eainde.vendorrisk.retrieval.DocumentRetriever;
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
public class RetrievalNode implements AsyncNodeAction<AssessmentState> {

    private final DocumentRetriever retriever;
    private final RunContextRegistry runContexts;

    @Override
    public CompletableFuture<Map<String, Object>> apply(AssessmentState state) {
        RunContext ctx = runContexts.get(state.getRunId());
        List<RetrievedDocument> documents = retriever.retrieveAll(
                state.getVendor(), state.getCandidates(), ctx.executor(), ctx.cancellation());
        return CompletableFuture.completedFuture(Map.of(
                AssessmentState.DOCUMENTS, documents,
                AssessmentState.CANCELLED, ctx.isCancelled()));
    }
}
