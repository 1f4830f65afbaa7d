package com.eainde.vendorrisk.workflow;

import com.eainde.vendorrisk.edges.CandidateRoutingEdge;
import com.eainde.vendorrisk.edges.DocumentRoutingEdge;
import com.eainde.vendorrisk.nodes.AnalysisNode;
import com.eainde.vendorrisk.nodes.DiscoveryNode;
import com.eainde.vendorrisk.nodes.FollowUpNode;
import com.eainde.vendorrisk.nodes.RetrievalNode;
import com.eainde.vendorrisk.nodes.ScoringNode;
import com.eainde.vendorrisk.state.AssessmentState;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.Map;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;

/**
 * <pre>
 * START → discover ─┬─ retrieve ─┬─ analyze ─┬─ score → follow_up → END
 *                   └────────────┴───────────┘
 * </pre>
 * Discovery and retrieval skip ahead to scoring when they produce nothing or the run is cancelled.
 */
@Configuration
public class AssessmentWorkflowConfig {

    public static final String DISCOVER = "discover";
    public static final String RETRIEVE = "retrieve";
    public static final String ANALYZE = "analyze";
    public static final String SCORE = "score";
    public static final String FOLLOW_UP = "follow_up";

    @Bean
    public CompiledGraph<AssessmentState> vendorAssessmentGraph(
            DiscoveryNode discoveryNode,
            RetrievalNode retrievalNode,
            AnalysisNode analysisNode,
            ScoringNode scoringNode,
            FollowUpNode followUpNode,
            CandidateRoutingEdge candidateRoutingEdge,
            DocumentRoutingEdge documentRoutingEdge) throws GraphStateException {

        StateGraph<AssessmentState> workflow = new StateGraph<>(AssessmentState::new);

        workflow.addNode(DISCOVER, discoveryNode);
        workflow.addNode(RETRIEVE, retrievalNode);
        workflow.addNode(ANALYZE, analysisNode);
        workflow.addNode(SCORE, scoringNode);
        workflow.addNode(FOLLOW_UP, followUpNode);

        workflow.addEdge(START, DISCOVER);
        workflow.addConditionalEdges(DISCOVER, candidateRoutingEdge, Map.of(
                CandidateRoutingEdge.RETRIEVE, RETRIEVE,
                CandidateRoutingEdge.SCORE, SCORE));
        workflow.addConditionalEdges(RETRIEVE, documentRoutingEdge, Map.of(
                DocumentRoutingEdge.ANALYZE, ANALYZE,
                DocumentRoutingEdge.SCORE, SCORE));
        workflow.addEdge(ANALYZE, SCORE);
        workflow.addEdge(SCORE, FOLLOW_UP);
        workflow.addEdge(FOLLOW_UP, END);

        // runs are not resumable, so no checkpoint saver
        return workflow.compile();
    }
}
