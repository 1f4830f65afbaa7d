package com.eainde.vendorrisk.edges;

import com.eainde.vendorrisk.state.AssessmentState;
import org.bsc.langgraph4j.action.AsyncEdgeAction;
import org.springframework.stereotype.Component;

import java.util.concurrent.CompletableFuture;

/**
 * After retrieval: analyze the documents, or score right away when none came back or the run was
 * cancelled.
 */
@Component
public class DocumentRoutingEdge implements AsyncEdgeAction<AssessmentState> {

    public static final String ANALYZE = "analyze";
    public static final String SCORE = "score";

    @Override
    public CompletableFuture<String> apply(AssessmentState state) {
        String next = state.isCancelled() || state.getDocuments().isEmpty() ? SCORE : ANALYZE;
        return CompletableFuture.completedFuture(next);
    }
}
