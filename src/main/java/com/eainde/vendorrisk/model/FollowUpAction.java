package com.eainde.vendorrisk.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDate;

/**
 * An outbound request to the vendor or an internal task.
 * <p>
 * Unlike the other model types this one is mutable: the escalation sweep bumps {@link #attempts}
 * and flips {@link #escalated}. Once escalated an action is terminal.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FollowUpAction implements Serializable {

    private ActionType actionType;
    private ActionPriority priority;
    private String subject;
    private String message;
    private String recipient;
    private LocalDate dueDate;
    private int attempts;
    private boolean escalated;

    /** Rule that produced this action, or {@code consolidated_missing_documents}. */
    private String ruleName;

    /** Finding category the action is about, when it concerns a single one. */
    private String category;

    public boolean isOverdue(LocalDate today) {
        return dueDate != null && today.isAfter(dueDate);
    }
}
