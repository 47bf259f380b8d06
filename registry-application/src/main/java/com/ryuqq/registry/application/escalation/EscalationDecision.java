package com.ryuqq.registry.application.escalation;

import java.util.List;

/**
 * Result of an escalation evaluation.
 *
 * @param required whether the attachment fetch must run
 * @param matchedKeywords triggers that matched, in first-seen order
 * @param matchedItems number of items that matched at least one trigger
 * @author Orchestrator Team
 * @since 1.0.0
 */
public record EscalationDecision(boolean required, List<String> matchedKeywords, int matchedItems) {

    public EscalationDecision {
        matchedKeywords = matchedKeywords == null ? List.of() : List.copyOf(matchedKeywords);
        if (required && matchedKeywords.isEmpty()) {
            throw new IllegalArgumentException("required decision must carry at least one matched keyword");
        }
    }

    public static EscalationDecision notRequired() {
        return new EscalationDecision(false, List.of(), 0);
    }

    public static EscalationDecision required(List<String> matchedKeywords, int matchedItems) {
        return new EscalationDecision(true, matchedKeywords, matchedItems);
    }
}
