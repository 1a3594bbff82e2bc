package com.storyline.narrative.dto;

import com.storyline.narrative.entity.LifecycleState;
import com.storyline.narrative.entity.Momentum;

import java.time.LocalDateTime;

/**
 * Light narrative view used by list endpoints.
 */
public record NarrativeSummaryDto(
        Long id,
        String title,
        String summary,
        LifecycleState lifecycleState,
        int articleCount,
        double mentionVelocity,
        Momentum momentum,
        LocalDateTime firstSeen,
        LocalDateTime lastUpdated,
        int reawakeningCount,
        Double resurrectionVelocity
) {
}
