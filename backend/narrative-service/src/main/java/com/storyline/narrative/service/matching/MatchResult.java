package com.storyline.narrative.service.matching;

import com.storyline.narrative.entity.Narrative;

/**
 * A candidate narrative that passed its threshold.
 */
public record MatchResult(Narrative narrative, double similarity, double threshold) {
}
