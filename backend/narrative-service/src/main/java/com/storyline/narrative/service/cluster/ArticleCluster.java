package com.storyline.narrative.service.cluster;

import com.storyline.narrative.entity.ArticleRecord;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Articles of one cycle that tell the same story, with their aggregated entities.
 *
 * @param nucleusEntity     majority nucleus of the member articles
 * @param articles          members in publish order
 * @param actorSalience     per-actor salience averaged over the articles that mention the actor
 * @param actions           distinct actions, most frequent first
 * @param earliestPublished earliest member publish time
 * @param latestPublished   latest member publish time
 */
public record ArticleCluster(
        String nucleusEntity,
        List<ArticleRecord> articles,
        Map<String, Double> actorSalience,
        List<String> actions,
        LocalDateTime earliestPublished,
        LocalDateTime latestPublished
) {

    public Set<String> articleIds() {
        Set<String> ids = new LinkedHashSet<>();
        articles.forEach(article -> ids.add(article.getExternalId()));
        return ids;
    }

    public int size() {
        return articles.size();
    }

    /**
     * Lexicographically smallest article id, stable across re-runs of the same batch.
     */
    public String anchorArticleId() {
        return articles.stream()
                .map(ArticleRecord::getExternalId)
                .min(String::compareTo)
                .orElseThrow();
    }
}
