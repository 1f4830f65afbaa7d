package com.eainde.vendorrisk.state;

import com.eainde.vendorrisk.model.AuditLogEntry;
import com.eainde.vendorrisk.model.DocumentCandidate;
import com.eainde.vendorrisk.model.DocumentSummary;
import com.eainde.vendorrisk.model.Finding;
import com.eainde.vendorrisk.model.FollowUpAction;
import com.eainde.vendorrisk.model.RetrievedDocument;
import com.eainde.vendorrisk.model.RiskAssessment;
import com.eainde.vendorrisk.model.RiskCriteria;
import com.eainde.vendorrisk.model.VendorProfile;
import org.bsc.langgraph4j.state.AgentState;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Graph state of one vendor assessment. Every value is {@link java.io.Serializable}; run-scoped
 * resources that are not (executor, cancellation, model client) live in the run context registry
 * and are looked up by {@link #getRunId()}.
 */
public class AssessmentState extends AgentState {

    public static final String RUN_ID = "runId";
    public static final String VENDOR = "vendor";
    public static final String CRITERIA = "criteria";
    public static final String CANDIDATES = "candidates";
    public static final String DOCUMENTS = "documents";
    public static final String DOCUMENT_SUMMARIES = "documentSummaries";
    public static final String FINDINGS = "findings";
    public static final String ASSESSMENT = "assessment";
    public static final String FOLLOW_UP_ACTIONS = "followUpActions";
    public static final String AUDIT_TRAIL = "auditTrail";
    public static final String CANCELLED = "cancelled";

    public AssessmentState(Map<String, Object> initData) {
        super(initData);
    }

    public String getRunId() { return (String) this.data().get(RUN_ID); }
    public VendorProfile getVendor() { return (VendorProfile) this.data().get(VENDOR); }

    public RiskCriteria getCriteria() {
        return this.<RiskCriteria>value(CRITERIA).orElseGet(RiskCriteria::defaults);
    }

    public List<DocumentCandidate> getCandidates() { return list(CANDIDATES); }
    public List<RetrievedDocument> getDocuments() { return list(DOCUMENTS); }
    public List<DocumentSummary> getDocumentSummaries() { return list(DOCUMENT_SUMMARIES); }
    public List<Finding> getFindings() { return list(FINDINGS); }
    public List<FollowUpAction> getFollowUpActions() { return list(FOLLOW_UP_ACTIONS); }
    public List<AuditLogEntry> getAuditTrail() { return list(AUDIT_TRAIL); }

    public Optional<RiskAssessment> getAssessment() { return value(ASSESSMENT); }

    public boolean isCancelled() {
        return this.data().containsKey(CANCELLED) && (boolean) this.data().get(CANCELLED);
    }

    // Helpers for node outputs

    public static Map<String, Object> initial(String runId, VendorProfile vendor, RiskCriteria criteria) {
        return Map.of(RUN_ID, runId, VENDOR, vendor, CRITERIA, criteria);
    }

    @SuppressWarnings("unchecked")
    private <T> List<T> list(String key) {
        Object value = this.data().get(key);
        return value == null ? List.of() : (List<T>) value;
    }
}
