package com.storyline.narrative.entity;

/**
 * Entity extraction state of an article.
 */
public enum ExtractionStatus {
    PENDING,
    EXTRACTED,
    FAILED
}
