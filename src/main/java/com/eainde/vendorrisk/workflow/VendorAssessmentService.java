package com.eainde.vendorrisk.workflow;

import com.eainde.vendorrisk.config.VendorRiskProperties;
import com.eainde.vendorrisk.followup.FollowUpEngine;
import com.eainde.vendorrisk.followup.FollowUpPlan;
import com.eainde.vendorrisk.llm.CompletionClient;
import com.eainde.vendorrisk.llm.SerializedCompletionClient;
import com.eainde.vendorrisk.model.AssessmentResult;
import com.eainde.vendorrisk.model.AuditLogEntry;
import com.eainde.vendorrisk.model.Finding;
import com.eainde.vendorrisk.model.FindingSummary;
import com.eainde.vendorrisk.model.RiskAssessment;
import com.eainde.vendorrisk.model.RiskCriteria;
import com.eainde.vendorrisk.model.RiskLevel;
import com.eainde.vendorrisk.model.ScoreBreakdown;
import com.eainde.vendorrisk.model.VendorProfile;
import com.eainde.vendorrisk.scoring.RiskScoringEngine;
import com.eainde.vendorrisk.state.AssessmentState;
import com.eainde.vendorrisk.thread.CancellationSignal;
import com.eainde.vendorrisk.thread.MdcAwareExecutor;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.RunnableConfig;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Entry point for assessing one vendor.
 * <p>
 * Each call gets its own run id, executor, serialized model client and cancellation signal, so
 * concurrent assessments of different vendors share nothing mutable. The stages run as a LangGraph4j
 * graph; see {@link AssessmentWorkflowConfig}.
 *
 * <h3>Failure handling</h3>
 * Invalid input ({@code domain}) is rejected with {@link IllegalArgumentException} before any work.
 * Anything that goes wrong after that degrades the result instead of failing the call: the findings
 * collected so far are scored, and if even that fails the neutral result (50, medium, no review)
 * is returned with a {@code workflow_failed} audit entry.
 */
@Slf4j
@Service
public class VendorAssessmentService {

    private final CompiledGraph<AssessmentState> graph;
    private final RunContextRegistry runContexts;
    private final CompletionClient completionClient;
    private final RiskScoringEngine scoringEngine;
    private final FollowUpEngine followUpEngine;
    private final VendorRiskProperties properties;
    private final Clock clock;

    public VendorAssessmentService(CompiledGraph<AssessmentState> vendorAssessmentGraph,
                                   RunContextRegistry runContexts,
                                   CompletionClient completionClient,
                                   RiskScoringEngine scoringEngine,
                                   FollowUpEngine followUpEngine,
                                   VendorRiskProperties properties,
                                   Clock clock) {
        this.graph = vendorAssessmentGraph;
        this.runContexts = runContexts;
        this.completionClient = completionClient;
        this.scoringEngine = scoringEngine;
        this.followUpEngine = followUpEngine;
        this.properties = properties;
        this.clock = clock;
    }

    public AssessmentResult assessVendor(String domain, RiskCriteria criteria) {
        return assessVendor(VendorProfile.of(domain), criteria, CancellationSignal.create());
    }

    public AssessmentResult assessVendor(String domain, RiskCriteria criteria, CancellationSignal cancellation) {
        return assessVendor(VendorProfile.of(domain), criteria, cancellation);
    }

    /**
     * @param vendor       validated vendor profile, optionally with a known trust center
     * @param criteria     {@code null} means {@link RiskCriteria#defaults()}
     * @param cancellation checked between stages and before every outstanding task
     */
    public AssessmentResult assessVendor(VendorProfile vendor, RiskCriteria criteria, CancellationSignal cancellation) {
        if (vendor == null) {
            throw new IllegalArgumentException("vendor must not be null");
        }
        RiskCriteria effectiveCriteria = criteria == null ? RiskCriteria.defaults() : criteria;
        CancellationSignal signal = cancellation == null ? CancellationSignal.create() : cancellation;

        String runId = UUID.randomUUID().toString();
        Instant startedAt = clock.instant();
        MDC.put("runId", runId);
        MDC.put("vendor", vendor.domain());
        RunContext ctx = openRun(runId, signal);
        try {
            log.info("Assessing {} (sensitivity={}, exposures={})", vendor.domain(),
                    effectiveCriteria.dataSensitivity().value(), effectiveCriteria.regulatoryExposures());

            RunnableConfig config = RunnableConfig.builder()
                    .threadId(runId)
                    .build();

            AssessmentResult result;
            try {
                Optional<AssessmentState> finalState = graph.invoke(
                        AssessmentState.initial(runId, vendor, effectiveCriteria), config);
                result = finalState
                        .filter(state -> state.getAssessment().isPresent())
                        .map(state -> fromState(state, vendor, signal.isCancelled(), startedAt))
                        .orElseGet(() -> degraded(runId, vendor, effectiveCriteria, ctx, startedAt,
                                "workflow ended without an assessment"));
            } catch (RuntimeException e) {
                log.error("Assessment workflow failed for {}: {}", vendor.domain(), e.toString(), e);
                result = degraded(runId, vendor, effectiveCriteria, ctx, startedAt, e.toString());
            }

            log.info("Assessment of {} complete: score={} ({}), review={}, actions={}, cancelled={}",
                    vendor.domain(), result.overallScore(), result.riskCategory().value(),
                    result.requiresHumanReview(), result.followUpActions().size(), result.cancelled());
            return result;
        } finally {
            runContexts.remove(runId);
            MDC.remove("runId");
            MDC.remove("vendor");
        }
    }

    private RunContext openRun(String runId, CancellationSignal signal) {
        int threads = Math.max(properties.getDiscovery().getConcurrency(), properties.getRetrieval().getConcurrency());
        MdcAwareExecutor executor = new MdcAwareExecutor("run-" + runId.substring(0, 8), threads);
        CompletionClient serialized = new SerializedCompletionClient(completionClient, properties.getLlm().getTimeout());
        RunContext ctx = new RunContext(runId, signal, executor, serialized);
        runContexts.register(ctx);
        return ctx;
    }

    private AssessmentResult fromState(AssessmentState state, VendorProfile vendor, boolean cancelled, Instant startedAt) {
        RiskAssessment assessment = state.getAssessment().orElseThrow();
        return new AssessmentResult(
                state.getRunId(),
                vendor,
                assessment.overallScore(),
                assessment.components(),
                assessment.riskCategory(),
                assessment.keyRiskFactors(),
                assessment.recommendations(),
                assessment.requiresHumanReview(),
                state.getFollowUpActions(),
                state.getCandidates(),
                state.getDocumentSummaries(),
                state.getFindings(),
                assessment.summary(),
                state.getAuditTrail(),
                cancelled,
                startedAt,
                clock.instant());
    }

    // =========================================================================
    //  Degraded results
    // =========================================================================

    private AssessmentResult degraded(String runId, VendorProfile vendor, RiskCriteria criteria,
                                      RunContext ctx, Instant startedAt, String reason) {
        List<Finding> findings = ctx.findings();
        AuditLogEntry failure = AuditLogEntry.system("workflow_failed", "vendor_assessment", runId,
                "Assessment degraded: " + reason, Map.of(), clock.instant());
        try {
            RiskAssessment assessment = scoringEngine.score(findings, criteria);
            FollowUpPlan plan = followUpEngine.generateActions(vendor, findings, assessment, runId);
            List<AuditLogEntry> audit = new ArrayList<>(plan.auditEntries());
            audit.add(failure);
            return new AssessmentResult(runId, vendor, assessment.overallScore(), assessment.components(),
                    assessment.riskCategory(), assessment.keyRiskFactors(), assessment.recommendations(),
                    assessment.requiresHumanReview(), plan.actions(), ctx.candidates(), List.of(), findings,
                    assessment.summary(), audit, ctx.isCancelled(), startedAt, clock.instant());
        } catch (RuntimeException e) {
            log.error("Could not score partial findings for {}: {}", vendor.domain(), e.toString(), e);
            return new AssessmentResult(runId, vendor, 50.0, ScoreBreakdown.neutral(), RiskLevel.MEDIUM,
                    List.of("Assessment could not be completed"),
                    List.of("Perform a manual review of this vendor"),
                    false, List.of(), ctx.candidates(), List.of(), List.of(), FindingSummary.of(List.of()),
                    List.of(failure), ctx.isCancelled(), startedAt, clock.instant());
        }
    }
}
