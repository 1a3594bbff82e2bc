package com.storyline.narrative.dto;

import com.storyline.narrative.entity.LifecycleState;
import com.storyline.narrative.entity.Momentum;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * Full narrative view including fingerprint, lifecycle history and merge provenance.
 */
public record NarrativeDetailDto(
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
        Double resurrectionVelocity,
        LocalDateTime dormantSince,
        LocalDateTime reawakenedFrom,
        boolean needsSummaryUpdate,
        FingerprintDto fingerprint,
        Map<String, Double> entitySalience,
        List<String> articleIds,
        List<LifecycleTransitionDto> lifecycleHistory,
        List<Long> mergedFrom,
        LocalDateTime mergedAt,
        List<MergeRecordDto> mergeHistory
) {
}
