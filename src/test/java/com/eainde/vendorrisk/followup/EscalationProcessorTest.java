package com.eainde.vendorrisk.followup;

import com.eainde.vendorrisk.config.VendorRiskProperties;
import com.eainde.vendorrisk.model.ActionPriority;
import com.eainde.vendorrisk.model.ActionType;
import com.eainde.vendorrisk.model.AuditLogEntry;
import com.eainde.vendorrisk.model.FollowUpAction;
import com.eainde.vendorrisk.model.VendorProfile;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EscalationProcessorTest {

    private static final LocalDate TODAY = LocalDate.of(2026, 1, 20);
    private static final VendorProfile ACME = VendorProfile.of("acme.com");

    private final VendorRiskProperties.FollowUp settings = new VendorRiskProperties.FollowUp();
    private final EscalationProcessor processor = new EscalationProcessor(settings,
            Clock.fixed(Instant.parse("2026-01-20T09:00:00Z"), ZoneOffset.UTC));

    private static FollowUpAction action(LocalDate due, int attempts) {
        return FollowUpAction.builder()
                .actionType(ActionType.DOCUMENT_REQUEST)
                .priority(ActionPriority.HIGH)
                .subject("SOC 2 Type II Report Request - Acme")
                .recipient("security@acme.com")
                .dueDate(due)
                .attempts(attempts)
                .ruleName("missing_attestation_report")
                .build();
    }

    @Test
    @DisplayName("should leave actions that are not yet due untouched")
    void notDue() {
        FollowUpAction pending = action(TODAY, 0);

        QueueProcessingResult result = processor.processQueue(ACME, List.of(pending), TODAY);

        assertThat(result.ready()).containsExactly(pending);
        assertThat(result.reminders()).isEmpty();
        assertThat(pending.getAttempts()).isZero();
    }

    @Test
    @DisplayName("should send a reminder for an overdue action below the attempt limit")
    void reminder() {
        FollowUpAction overdue = action(TODAY.minusDays(2), 0);

        QueueProcessingResult result = processor.processQueue(ACME, List.of(overdue), TODAY);

        assertThat(overdue.getAttempts()).isEqualTo(1);
        assertThat(result.ready()).containsExactly(overdue);
        assertThat(result.reminders()).singleElement().satisfies(r -> {
            assertThat(r.getSubject()).startsWith("Reminder: ");
            assertThat(r.getRecipient()).isEqualTo("security@acme.com");
        });
        assertThat(result.auditEntries()).extracting(AuditLogEntry::eventType).containsExactly("follow_up_reminder");
    }

    @Test
    @DisplayName("should escalate internally once the attempt limit is reached")
    void escalates() {
        FollowUpAction overdue = action(TODAY.minusDays(10), settings.getMaxAttempts() - 1);

        QueueProcessingResult result = processor.processQueue(ACME, List.of(overdue), TODAY);

        assertThat(overdue.isEscalated()).isTrue();
        assertThat(result.escalated()).containsExactly(overdue);
        assertThat(result.ready()).isEmpty();
        assertThat(result.escalationNotices()).singleElement().satisfies(notice -> {
            assertThat(notice.getActionType()).isEqualTo(ActionType.INTERNAL_REVIEW);
            assertThat(notice.getPriority()).isEqualTo(ActionPriority.URGENT);
            assertThat(notice.getRecipient()).isEqualTo(settings.getInternalReviewer());
            assertThat(notice.getDueDate()).isEqualTo(TODAY.plusDays(1));
        });
        assertThat(result.auditEntries()).extracting(AuditLogEntry::eventType).containsExactly("follow_up_escalated");
    }

    @Test
    @DisplayName("should skip actions that were already escalated")
    void skipsEscalated() {
        FollowUpAction done = action(TODAY.minusDays(30), 3);
        done.setEscalated(true);

        QueueProcessingResult result = processor.processQueue(ACME, List.of(done, action(TODAY.plusDays(1), 0)), TODAY);

        assertThat(result.escalated()).isEmpty();
        assertThat(result.stats())
                .containsEntry("processed", 1)
                .containsEntry("skipped", 1)
                .containsEntry("ready", 1);
        assertThat(done.getAttempts()).isEqualTo(3);
    }
}
