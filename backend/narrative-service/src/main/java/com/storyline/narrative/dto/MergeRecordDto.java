package com.storyline.narrative.dto;

import com.storyline.narrative.entity.MergeTrigger;

import java.time.LocalDateTime;

public record MergeRecordDto(
        Long mergedNarrativeId,
        String mergedTitle,
        String mergedNucleus,
        int mergedArticleCount,
        Double similarity,
        MergeTrigger trigger,
        LocalDateTime mergedAt
) {
}
