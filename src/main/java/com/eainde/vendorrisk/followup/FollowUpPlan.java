package com.eainde.vendorrisk.followup;

import com.eainde.vendorrisk.model.AuditLogEntry;
import com.eainde.vendorrisk.model.FollowUpAction;

import java.util.List;

/**
 * @param actions      generated actions, rule table order followed by consolidated requests
 * @param auditEntries audit trail of the generation
 */
public record FollowUpPlan(List<FollowUpAction> actions, List<AuditLogEntry> auditEntries) {

    public FollowUpPlan {
        actions = List.copyOf(actions);
        auditEntries = List.copyOf(auditEntries);
    }
}
