package com.eainde.vendorrisk.followup;

import java.util.Map;

/**
 * Message bodies. Placeholders are written as {@code {name}} and filled by {@link #render(Map)};
 * unknown placeholders are left as they are.
 */
public enum MessageTemplate {

    DOCUMENT_REQUEST("""
            Dear {contact},

            As part of our vendor risk assessment of {vendor}, we were unable to locate the following \
            documentation:

            {items}

            Please provide these documents by {due_date}. If any of them are not available, let us know \
            when we can expect them.

            Best regards,
            {sender}"""),

    CLARIFICATION("""
            Dear {contact},

            While reviewing the published documentation of {vendor} we found statements that need \
            clarification:

            {items}

            Please describe the controls in place, ideally with supporting evidence, by {due_date}.

            Best regards,
            {sender}"""),

    COMPLIANCE_GAPS("""
            Dear {contact},

            Our assessment of {vendor} identified compliance gaps that must be addressed before we can \
            continue the engagement (overall risk score {score}/100, {category}):

            {items}

            Please respond with a remediation plan by {due_date}.

            Best regards,
            {sender}"""),

    REMINDER("""
            Dear {contact},

            This is a reminder about our request "{subject}" sent to {vendor}, which was due on \
            {due_date}. This is follow-up attempt {attempt}.

            Please respond at your earliest convenience.

            Best regards,
            {sender}"""),

    ESCALATION("""
            The request "{subject}" to {vendor} ({recipient}) is overdue since {due_date} and remained \
            unanswered after {attempt} attempts. Automatic follow-ups have stopped; please take over \
            manually."""),

    INTERNAL_REVIEW("""
            The automated assessment of {vendor} requires analyst review.

            Overall risk score: {score}/100 ({category})
            Key risk factors:
            {items}

            Please complete the review by {due_date}.""");

    private final String body;

    MessageTemplate(String body) {
        this.body = body;
    }

    public String body() {
        return body;
    }

    public String render(Map<String, String> values) {
        String out = body;
        for (Map.Entry<String, String> e : values.entrySet()) {
            out = out.replace("{" + e.getKey() + "}", e.getValue() == null ? "" : e.getValue());
        }
        return out;
    }
}
