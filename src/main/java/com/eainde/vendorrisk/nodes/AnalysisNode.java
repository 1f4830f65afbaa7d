package com.eainde.vendorrisk.nodes;

import com.eainde.vendorrisk.analysis.ComplianceAnalysisEngine;
import com.eainde.vendorrisk.config.VendorRiskProperties;
import com.eainde.vendorrisk.model.DocumentSummary;
import com.eainde.vendorrisk.model.Finding;
import com.eainde.vendorrisk.model.RetrievedDocument;
import com.eainde.vendorrisk.state.AssessmentState;
import com.eainde.vendorrisk.thread.BoundedFanOut;
import com.eainde.vendorrisk.thread.MdcAwareExecutor;
import com.eainde.vendorrisk.workflow.RunContext;
import com.eainde.vendorrisk.workflow.RunContextRegistry;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.action.AsyncNodeAction;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Analyzes every retrieved document on a pool of its own. Model completions still go through the
 * run's serialized client, so only the deterministic passes actually overlap.
 */
@Slf4j
@Component
public class AnalysisNode implements AsyncNodeAction<AssessmentState> {

    private final ComplianceAnalysisEngine analysisEngine;
    private final RunContextRegistry runContexts;
    private final VendorRiskProperties.Analysis settings;

    public AnalysisNode(ComplianceAnalysisEngine analysisEngine,
                        RunContextRegistry runContexts,
                        VendorRiskProperties properties) {
        this.analysisEngine = analysisEngine;
        this.runContexts = runContexts;
        this.settings = properties.getAnalysis();
    }

    @Override
    public CompletableFuture<Map<String, Object>> apply(AssessmentState state) {
        RunContext ctx = runContexts.get(state.getRunId());
        List<RetrievedDocument> documents = state.getDocuments();

        List<DocumentAnalysis> analyses;
        try (MdcAwareExecutor pool = new MdcAwareExecutor("analysis-" + shortId(ctx.runId()), settings.getConcurrency())) {
            analyses = BoundedFanOut.map(documents,
                    document -> Optional.of(analyze(document, ctx)),
                    pool, settings.getDocumentTimeout(), ctx.cancellation());
        }

        List<Finding> findings = new ArrayList<>();
        List<DocumentSummary> summaries = new ArrayList<>();
        for (DocumentAnalysis analysis : analyses) {
            findings.addAll(analysis.findings());
            summaries.add(analysis.summary());
        }
        ctx.recordFindings(findings);
        log.info("Analyzed {} of {} documents: {} findings", analyses.size(), documents.size(), findings.size());

        return CompletableFuture.completedFuture(Map.of(
                AssessmentState.FINDINGS, findings,
                AssessmentState.DOCUMENT_SUMMARIES, summaries,
                AssessmentState.CANCELLED, ctx.isCancelled()));
    }

    private DocumentAnalysis analyze(RetrievedDocument document, RunContext ctx) {
        List<Finding> findings = analysisEngine.analyze(document, ctx.completion(), ctx.cancellation());
        DocumentSummary summary = new DocumentSummary(document.url(), document.type(), document.title(),
                document.contentHash(), document.byteLength(), document.storageLocation(),
                findings.size(), analysisEngine.documentRiskScore(findings));
        return new DocumentAnalysis(findings, summary);
    }

    private static String shortId(String runId) {
        return runId.length() > 8 ? runId.substring(0, 8) : runId;
    }

    private record DocumentAnalysis(List<Finding> findings, DocumentSummary summary) {
    }
}
