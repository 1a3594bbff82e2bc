package com.storyline.narrative.service.lifecycle;

import com.storyline.narrative.entity.LifecycleState;
import com.storyline.narrative.entity.Momentum;
import lombok.Builder;

/**
 * Inputs of one lifecycle evaluation.
 *
 * @param articleCount        total articles in the narrative
 * @param mentionVelocity     articles per day over the trailing window
 * @param momentum            trend inside the trailing window
 * @param daysSinceLastUpdate fractional days since the relevant last article
 * @param articlesLast24h     articles published in the last 24 hours
 * @param articlesLast48h     articles published in the last 48 hours
 * @param previousState       state before this evaluation, null for a new narrative
 */
@Builder
public record LifecycleSignals(
        int articleCount,
        double mentionVelocity,
        Momentum momentum,
        double daysSinceLastUpdate,
        int articlesLast24h,
        int articlesLast48h,
        LifecycleState previousState
) {
}
