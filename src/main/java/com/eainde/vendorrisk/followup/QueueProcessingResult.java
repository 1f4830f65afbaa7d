package com.eainde.vendorrisk.followup;

import com.eainde.vendorrisk.model.AuditLogEntry;
import com.eainde.vendorrisk.model.FollowUpAction;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one sweep over an action queue.
 *
 * @param ready             actions still in normal processing (not escalated)
 * @param reminders         reminder messages to send now, one per overdue but still retryable action
 * @param escalated         actions that reached the attempt limit during this sweep
 * @param escalationNotices internal notices for {@code escalated}
 * @param auditEntries      audit trail of the sweep
 * @param stats             counts: processed, skipped, overdue, escalated, ready
 */
public record QueueProcessingResult(
        List<FollowUpAction> ready,
        List<FollowUpAction> reminders,
        List<FollowUpAction> escalated,
        List<FollowUpAction> escalationNotices,
        List<AuditLogEntry> auditEntries,
        Map<String, Integer> stats
) {
}
