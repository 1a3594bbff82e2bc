package com.storyline.narrative.service;

/**
 * Outcome of one narrative cycle.
 */
public record CycleReport(
        int articles,
        int clusters,
        int created,
        int extended,
        int excluded,
        int failed,
        long durationMs
) {

    public static CycleReport empty() {
        return new CycleReport(0, 0, 0, 0, 0, 0, 0);
    }
}
