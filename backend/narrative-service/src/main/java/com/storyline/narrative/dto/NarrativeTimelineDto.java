package com.storyline.narrative.dto;

import java.util.List;

public record NarrativeTimelineDto(
        Long narrativeId,
        String title,
        List<TimelineSnapshotDto> snapshots
) {
}
