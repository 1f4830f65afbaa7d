package com.eainde.vendorrisk.followup;

import com.eainde.vendorrisk.model.ActionPriority;
import com.eainde.vendorrisk.model.ActionType;
import com.eainde.vendorrisk.model.Finding;

import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * One row of the follow-up rule table.
 *
 * @param name       stable identifier, recorded on the generated action
 * @param category   finding category the rule is about, {@code null} for cross-cutting rules
 * @param trigger    whether the rule fires for a finding set
 * @param items      findings listed in the message
 * @param actionType type of generated action
 * @param priority   priority of generated action
 * @param dueInDays  due date offset from today
 * @param template   message body
 * @param subject    subject line, may contain {@code {vendor}}
 */
public record FollowUpRule(
        String name,
        String category,
        Predicate<FollowUpContext> trigger,
        Function<FollowUpContext, List<Finding>> items,
        ActionType actionType,
        ActionPriority priority,
        int dueInDays,
        MessageTemplate template,
        String subject
) {

    /** Fires when at least {@code minimum} findings match {@code selector}; lists those findings. */
    public static FollowUpRule whenFindings(String name, String category, Predicate<Finding> selector, int minimum,
                                            ActionType actionType, ActionPriority priority, int dueInDays,
                                            MessageTemplate template, String subject) {
        return new FollowUpRule(name, category,
                ctx -> ctx.select(selector).size() >= minimum,
                ctx -> ctx.select(selector),
                actionType, priority, dueInDays, template, subject);
    }
}
