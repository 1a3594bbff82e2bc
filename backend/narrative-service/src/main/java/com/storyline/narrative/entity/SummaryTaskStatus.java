package com.storyline.narrative.entity;

public enum SummaryTaskStatus {
    PENDING,
    DONE,
    FAILED
}
