package com.eainde.vendorrisk.followup;

import com.eainde.vendorrisk.config.VendorRiskProperties;
import com.eainde.vendorrisk.model.ActionPriority;
import com.eainde.vendorrisk.model.ActionType;
import com.eainde.vendorrisk.model.AuditLogEntry;
import com.eainde.vendorrisk.model.FollowUpAction;
import com.eainde.vendorrisk.model.VendorProfile;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Sweeps a previously generated action queue.
 * <p>
 * Each overdue action has its attempt counter incremented. When the counter reaches the configured
 * maximum the action becomes escalated: it leaves normal processing for good and an internal notice is
 * raised. Escalation happens once; escalated actions are skipped by later sweeps.
 */
@Slf4j
public class EscalationProcessor {

    private final VendorRiskProperties.FollowUp settings;
    private final Clock clock;

    public EscalationProcessor(VendorRiskProperties.FollowUp settings, Clock clock) {
        this.settings = settings;
        this.clock = clock;
    }

    public QueueProcessingResult processQueue(VendorProfile vendor, List<FollowUpAction> queue) {
        return processQueue(vendor, queue, LocalDate.now(clock));
    }

    public QueueProcessingResult processQueue(VendorProfile vendor, List<FollowUpAction> queue, LocalDate today) {
        List<FollowUpAction> ready = new ArrayList<>();
        List<FollowUpAction> reminders = new ArrayList<>();
        List<FollowUpAction> escalated = new ArrayList<>();
        List<FollowUpAction> notices = new ArrayList<>();
        List<AuditLogEntry> audit = new ArrayList<>();
        int skipped = 0;
        int overdue = 0;

        for (FollowUpAction action : queue) {
            if (action.isEscalated()) {
                skipped++;
                continue;
            }
            if (!action.isOverdue(today)) {
                ready.add(action);
                continue;
            }

            overdue++;
            action.setAttempts(action.getAttempts() + 1);
            if (action.getAttempts() >= settings.getMaxAttempts()) {
                action.setEscalated(true);
                escalated.add(action);
                notices.add(escalationNotice(vendor, action, today));
                audit.add(AuditLogEntry.system("follow_up_escalated", "follow_up_action", action.getRuleName(),
                        "Escalated after " + action.getAttempts() + " attempts: " + action.getSubject(),
                        Map.of("recipient", nullToEmpty(action.getRecipient()),
                                "due_date", String.valueOf(action.getDueDate())),
                        clock.instant()));
                log.warn("Escalating '{}' for {} after {} attempts",
                        action.getSubject(), vendor.domain(), action.getAttempts());
            } else {
                ready.add(action);
                reminders.add(reminder(vendor, action));
                audit.add(AuditLogEntry.system("follow_up_reminder", "follow_up_action", action.getRuleName(),
                        "Reminder " + action.getAttempts() + " for: " + action.getSubject(),
                        Map.of("attempt", String.valueOf(action.getAttempts())), clock.instant()));
            }
        }

        Map<String, Integer> stats = new LinkedHashMap<>();
        stats.put("processed", queue.size() - skipped);
        stats.put("skipped", skipped);
        stats.put("overdue", overdue);
        stats.put("escalated", escalated.size());
        stats.put("ready", ready.size());
        log.info("Processed follow-up queue for {}: {}", vendor.domain(), stats);
        return new QueueProcessingResult(List.copyOf(ready), List.copyOf(reminders), List.copyOf(escalated),
                List.copyOf(notices), List.copyOf(audit), Map.copyOf(stats));
    }

    private FollowUpAction reminder(VendorProfile vendor, FollowUpAction action) {
        return FollowUpAction.builder()
                .actionType(action.getActionType())
                .priority(action.getPriority())
                .subject("Reminder: " + action.getSubject())
                .message(MessageTemplate.REMINDER.render(values(vendor, action)))
                .recipient(action.getRecipient())
                .dueDate(action.getDueDate())
                .attempts(action.getAttempts())
                .ruleName(action.getRuleName())
                .category(action.getCategory())
                .build();
    }

    private FollowUpAction escalationNotice(VendorProfile vendor, FollowUpAction action, LocalDate today) {
        return FollowUpAction.builder()
                .actionType(ActionType.INTERNAL_REVIEW)
                .priority(ActionPriority.URGENT)
                .subject("Escalation: " + action.getSubject())
                .message(MessageTemplate.ESCALATION.render(values(vendor, action)))
                .recipient(settings.getInternalReviewer())
                .dueDate(today.plusDays(1))
                .ruleName(action.getRuleName())
                .category(action.getCategory())
                .build();
    }

    private Map<String, String> values(VendorProfile vendor, FollowUpAction action) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("vendor", vendor.displayName());
        values.put("contact", settings.getContactName());
        values.put("sender", settings.getSenderName());
        values.put("subject", action.getSubject());
        values.put("recipient", nullToEmpty(action.getRecipient()));
        values.put("due_date", String.valueOf(action.getDueDate()));
        values.put("attempt", String.valueOf(action.getAttempts()));
        return values;
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
