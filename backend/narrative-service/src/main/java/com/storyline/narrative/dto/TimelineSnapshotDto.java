package com.storyline.narrative.dto;

import java.time.LocalDate;
import java.util.List;

/**
 * One day of a narrative's history.
 *
 * @param velocity articles per day over the trailing window ending on this day
 */
public record TimelineSnapshotDto(
        LocalDate date,
        int articleCount,
        int cumulativeCount,
        List<String> entities,
        double velocity
) {
}
