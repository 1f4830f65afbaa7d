package com.eainde.vendorrisk.followup;

import com.eainde.vendorrisk.config.VendorRiskProperties;
import com.eainde.vendorrisk.model.ActionPriority;
import com.eainde.vendorrisk.model.ActionType;
import com.eainde.vendorrisk.model.AuditLogEntry;
import com.eainde.vendorrisk.model.Finding;
import com.eainde.vendorrisk.model.FindingCategory;
import com.eainde.vendorrisk.model.FindingType;
import com.eainde.vendorrisk.model.FollowUpAction;
import com.eainde.vendorrisk.model.RiskAssessment;
import com.eainde.vendorrisk.model.VendorProfile;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Evaluates the rule table against a finding set and renders the resulting actions.
 *
 * <h3>Two passes:</h3>
 * <ol>
 *   <li>every rule whose trigger holds contributes exactly one action</li>
 *   <li>{@code missing} findings are grouped by category; a category with two or more of them gets one
 *       consolidated document request, merged into the rule-generated request for that category when
 *       one exists</li>
 * </ol>
 */
@Slf4j
public class FollowUpEngine {

    static final String CONSOLIDATED_RULE = "consolidated_missing_documents";
    private static final int CONSOLIDATION_MINIMUM = 2;
    private static final int CONSOLIDATED_DUE_DAYS = 7;

    private final VendorRiskProperties.FollowUp settings;
    private final List<FollowUpRule> rules;
    private final Clock clock;

    public FollowUpEngine(VendorRiskProperties.FollowUp settings, List<FollowUpRule> rules, Clock clock) {
        this.settings = settings;
        this.rules = List.copyOf(rules);
        this.clock = clock;
    }

    public FollowUpEngine(VendorRiskProperties.FollowUp settings, Clock clock) {
        this(settings, FollowUpRules.DEFAULT, clock);
    }

    public FollowUpPlan generateActions(VendorProfile vendor, List<Finding> findings, RiskAssessment assessment) {
        return generateActions(vendor, findings, assessment, vendor.domain());
    }

    /**
     * @param runId identifies the assessment in audit entries
     */
    public FollowUpPlan generateActions(VendorProfile vendor, List<Finding> findings, RiskAssessment assessment,
                                        String runId) {
        List<Finding> safeFindings = findings == null ? List.of() : findings;
        FollowUpContext ctx = new FollowUpContext(safeFindings, assessment);
        List<AuditLogEntry> audit = new ArrayList<>();
        audit.add(AuditLogEntry.system("workflow_started", "vendor_assessment", runId,
                "Follow-up generation started for " + vendor.domain(),
                Map.of("findings", String.valueOf(safeFindings.size())), clock.instant()));

        // ── Pass 1: rule table ──
        List<Draft> drafts = new ArrayList<>();
        for (FollowUpRule rule : rules) {
            if (rule.trigger().test(ctx)) {
                drafts.add(new Draft(rule.name(), rule.category(), rule.actionType(), rule.priority(),
                        rule.dueInDays(), rule.template(), rule.subject(), descriptions(rule.items().apply(ctx))));
                log.debug("Rule {} fired for {}", rule.name(), vendor.domain());
            }
        }

        // ── Pass 2: consolidate missing findings per category ──
        for (Map.Entry<String, List<Finding>> group : missingByCategory(safeFindings).entrySet()) {
            if (group.getValue().size() < CONSOLIDATION_MINIMUM) {
                continue;
            }
            Set<String> items = descriptions(group.getValue());
            Optional<Draft> existing = drafts.stream()
                    .filter(d -> d.actionType == ActionType.DOCUMENT_REQUEST && group.getKey().equals(d.category))
                    .findFirst();
            if (existing.isPresent()) {
                existing.get().items.addAll(items);
            } else {
                drafts.add(new Draft(CONSOLIDATED_RULE, group.getKey(), ActionType.DOCUMENT_REQUEST,
                        ActionPriority.MEDIUM, CONSOLIDATED_DUE_DAYS, MessageTemplate.DOCUMENT_REQUEST,
                        "Missing " + documentationTitle(group.getKey()) + " Documentation - {vendor}", items));
            }
        }

        LocalDate today = LocalDate.now(clock);
        List<FollowUpAction> actions = new ArrayList<>(drafts.size());
        for (Draft draft : drafts) {
            FollowUpAction action = render(draft, vendor, assessment, today);
            actions.add(action);
            audit.add(AuditLogEntry.system("follow_up_generated", "follow_up_action",
                    runId + "-" + actions.size(), action.getSubject(),
                    Map.of("rule", draft.ruleName,
                            "action_type", action.getActionType().value(),
                            "priority", action.getPriority().value(),
                            "due_date", action.getDueDate().toString()),
                    clock.instant()));
        }

        audit.add(AuditLogEntry.system("workflow_completed", "vendor_assessment", runId,
                "Generated " + actions.size() + " follow-up action(s)",
                Map.of("actions", String.valueOf(actions.size())), clock.instant()));
        log.info("Generated {} follow-up actions for {}", actions.size(), vendor.domain());
        return new FollowUpPlan(actions, audit);
    }

    // =========================================================================
    //  Rendering
    // =========================================================================

    private FollowUpAction render(Draft draft, VendorProfile vendor, RiskAssessment assessment, LocalDate today) {
        LocalDate due = today.plusDays(draft.dueInDays);
        List<String> itemLines = new ArrayList<>(draft.items);
        if (draft.actionType == ActionType.INTERNAL_REVIEW && assessment != null) {
            itemLines = new ArrayList<>(assessment.keyRiskFactors());
        }
        Map<String, String> values = new LinkedHashMap<>();
        values.put("vendor", vendor.displayName());
        values.put("contact", settings.getContactName());
        values.put("sender", settings.getSenderName());
        values.put("items", bullets(itemLines));
        values.put("due_date", due.toString());
        values.put("score", assessment == null ? "n/a" : String.format(Locale.ROOT, "%.1f", assessment.overallScore()));
        values.put("category", assessment == null ? "n/a" : assessment.riskCategory().value());

        return FollowUpAction.builder()
                .actionType(draft.actionType)
                .priority(draft.priority)
                .subject(draft.subject.replace("{vendor}", vendor.displayName()))
                .message(draft.template.render(values))
                .recipient(draft.actionType.isInternal() ? settings.getInternalReviewer() : vendorRecipient(vendor))
                .dueDate(due)
                .attempts(0)
                .escalated(false)
                .ruleName(draft.ruleName)
                .category(draft.category)
                .build();
    }

    String vendorRecipient(VendorProfile vendor) {
        return settings.getVendorContactLocalPart() + "@" + vendor.domain();
    }

    private static String bullets(List<String> lines) {
        if (lines.isEmpty()) {
            return "- (see attached assessment)";
        }
        StringBuilder sb = new StringBuilder();
        for (String line : lines) {
            if (sb.length() > 0) sb.append('\n');
            sb.append("- ").append(line);
        }
        return sb.toString();
    }

    private static Set<String> descriptions(List<Finding> findings) {
        Set<String> out = new LinkedHashSet<>();
        for (Finding f : findings) {
            out.add(f.description().isBlank() ? FindingCategory.title(f.category()) : f.description());
        }
        return out;
    }

    private static Map<String, List<Finding>> missingByCategory(List<Finding> findings) {
        Map<String, List<Finding>> groups = new LinkedHashMap<>();
        for (Finding f : findings) {
            if (f.type() == FindingType.MISSING) {
                groups.computeIfAbsent(f.category(), k -> new ArrayList<>()).add(f);
            }
        }
        return groups;
    }

    private static String documentationTitle(String category) {
        return FindingCategory.MISSING_ELEMENTS.equals(category)
                ? "Required Document Content"
                : FindingCategory.title(category);
    }

    /** Mutable action under construction; items can grow during consolidation. */
    private static final class Draft {
        final String ruleName;
        final String category;
        final ActionType actionType;
        final ActionPriority priority;
        final int dueInDays;
        final MessageTemplate template;
        final String subject;
        final Set<String> items;

        Draft(String ruleName, String category, ActionType actionType, ActionPriority priority, int dueInDays,
              MessageTemplate template, String subject, Set<String> items) {
            this.ruleName = ruleName;
            this.category = category;
            this.actionType = actionType;
            this.priority = priority;
            this.dueInDays = dueInDays;
            this.template = template;
            this.subject = subject;
            this.items = new LinkedHashSet<>(items);
        }
    }
}
