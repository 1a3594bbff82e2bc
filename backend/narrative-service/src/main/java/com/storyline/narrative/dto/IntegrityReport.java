package com.storyline.narrative.dto;

import java.util.List;
import java.util.Map;

/**
 * Data integrity findings over the narrative store.
 *
 * @param danglingReferences narrative id to the number of article ids that do not resolve
 */
public record IntegrityReport(
        int totalNarratives,
        List<Long> emptyNucleus,
        List<Long> reversedTimestamps,
        List<Long> countMismatches,
        Map<Long, Integer> danglingReferences,
        int repaired
) {

    public boolean isHealthy() {
        return emptyNucleus.isEmpty() && reversedTimestamps.isEmpty()
                && countMismatches.isEmpty() && danglingReferences.isEmpty();
    }
}
