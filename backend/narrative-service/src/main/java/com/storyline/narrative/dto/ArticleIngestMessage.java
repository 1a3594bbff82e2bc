package com.storyline.narrative.dto;

import com.storyline.narrative.entity.ExtractionResult;

/**
 * Article published on the ingest topic. {@code extraction} is optional; articles without it
 * are queued for entity extraction.
 */
public record ArticleIngestMessage(
        String externalId,
        String title,
        String url,
        String source,
        String publishedAt,
        ExtractionResult extraction
) {
}
