package com.ryuqq.registry.application.escalation;

import com.ryuqq.registry.core.model.TrackedItem;

import java.util.List;

/**
 * Decides whether new items justify the expensive attachment fetch.
 *
 * @author Orchestrator Team
 * @since 1.0.0
 */
public interface EscalationPolicy {

    /**
     * @param items new items of one entity
     * @return the decision with the triggers that matched
     */
    EscalationDecision evaluate(List<TrackedItem> items);
}
