package com.storyline.narrative.service;

import com.storyline.narrative.entity.ArticleRecord;
import com.storyline.narrative.entity.NarrativeFingerprint;

import java.util.List;

/**
 * Produces the human readable title and summary of a narrative.
 */
public interface SummaryGenerator {

    GeneratedSummary generate(NarrativeFingerprint fingerprint, List<ArticleRecord> articles);

    record GeneratedSummary(String title, String summary) {
    }
}
