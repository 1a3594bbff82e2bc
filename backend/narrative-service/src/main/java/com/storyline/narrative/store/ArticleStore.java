package com.storyline.narrative.store;

import com.storyline.narrative.entity.ArticleRecord;

import java.util.Collection;
import java.util.List;

/**
 * Read/write access to articles for the narrative engine.
 */
public interface ArticleStore {

    /**
     * Extracted articles that are not yet linked to a narrative, oldest first.
     */
    List<ArticleRecord> findPendingForClustering(int limit);

    /**
     * Articles still waiting for extraction, oldest first.
     */
    List<ArticleRecord> findPendingExtraction(int limit, int maxAttempts);

    List<ArticleRecord> findByExternalIds(Collection<String> externalIds);

    boolean exists(String externalId);

    ArticleRecord save(ArticleRecord article);

    void linkToNarrative(Collection<String> externalIds, Long narrativeId);

    /**
     * Marks articles that can never join a narrative.
     */
    void markExcluded(Collection<String> externalIds);
}
