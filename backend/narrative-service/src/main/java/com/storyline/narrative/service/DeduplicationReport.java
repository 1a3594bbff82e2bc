package com.storyline.narrative.service;

/**
 * Outcome of one deduplication pass.
 *
 * @param deferred duplicate pairs skipped because one side already took part in a merge this pass
 */
public record DeduplicationReport(
        int narratives,
        int groups,
        int comparisons,
        int merged,
        int deferred,
        int failed,
        long durationMs
) {
}
