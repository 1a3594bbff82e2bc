package com.storyline.narrative.entity;

public enum SummaryUpdateReason {
    ARTICLES_ADDED,
    NARRATIVES_MERGED,
    INTEGRITY_REPAIR
}
