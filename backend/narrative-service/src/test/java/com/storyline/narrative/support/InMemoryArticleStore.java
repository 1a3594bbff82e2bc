package com.storyline.narrative.support;

import com.storyline.narrative.entity.ArticleRecord;
import com.storyline.narrative.entity.ClusteringStatus;
import com.storyline.narrative.entity.ExtractionStatus;
import com.storyline.narrative.store.ArticleStore;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Thread-safe in-memory {@link ArticleStore}. Hands out copies so callers cannot mutate stored rows.
 */
public class InMemoryArticleStore implements ArticleStore {

    private final Map<String, ArticleRecord> articles = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    public void put(ArticleRecord... records) {
        for (ArticleRecord record : records) {
            save(record);
        }
    }

    public ArticleRecord get(String externalId) {
        return copy(articles.get(externalId));
    }

    public int size() {
        return articles.size();
    }

    @Override
    public List<ArticleRecord> findPendingForClustering(int limit) {
        return articles.values().stream()
                .filter(a -> a.getExtractionStatus() == ExtractionStatus.EXTRACTED)
                .filter(a -> a.getClusteringStatus() == ClusteringStatus.PENDING)
                .filter(a -> a.getNarrativeId() == null)
                .sorted(Comparator.comparing(ArticleRecord::getPublishedAt).thenComparing(ArticleRecord::getExternalId))
                .limit(limit)
                .map(InMemoryArticleStore::copy)
                .toList();
    }

    @Override
    public List<ArticleRecord> findPendingExtraction(int limit, int maxAttempts) {
        return articles.values().stream()
                .filter(a -> a.getExtractionStatus() == ExtractionStatus.PENDING)
                .filter(a -> a.getExtractionAttempts() < maxAttempts)
                .sorted(Comparator.comparing(ArticleRecord::getPublishedAt))
                .limit(limit)
                .map(InMemoryArticleStore::copy)
                .toList();
    }

    @Override
    public List<ArticleRecord> findByExternalIds(Collection<String> externalIds) {
        return externalIds.stream()
                .map(articles::get)
                .filter(Objects::nonNull)
                .map(InMemoryArticleStore::copy)
                .toList();
    }

    @Override
    public boolean exists(String externalId) {
        return articles.containsKey(externalId);
    }

    @Override
    public ArticleRecord save(ArticleRecord article) {
        ArticleRecord stored = copy(article);
        if (stored.getId() == null) {
            stored.setId(sequence.incrementAndGet());
        }
        articles.put(stored.getExternalId(), stored);
        return copy(stored);
    }

    @Override
    public void linkToNarrative(Collection<String> externalIds, Long narrativeId) {
        externalIds.forEach(id -> articles.computeIfPresent(id, (key, article) -> {
            article.setNarrativeId(narrativeId);
            article.setClusteringStatus(ClusteringStatus.ASSIGNED);
            return article;
        }));
    }

    public void reassign(Long fromNarrativeId, Long toNarrativeId) {
        articles.values().stream()
                .filter(a -> fromNarrativeId.equals(a.getNarrativeId()))
                .forEach(a -> a.setNarrativeId(toNarrativeId));
    }

    @Override
    public void markExcluded(Collection<String> externalIds) {
        externalIds.forEach(id -> articles.computeIfPresent(id, (key, article) -> {
            article.setClusteringStatus(ClusteringStatus.EXCLUDED);
            return article;
        }));
    }

    private static ArticleRecord copy(ArticleRecord source) {
        if (source == null) {
            return null;
        }
        return ArticleRecord.builder()
                .id(source.getId())
                .externalId(source.getExternalId())
                .title(source.getTitle())
                .url(source.getUrl())
                .source(source.getSource())
                .publishedAt(source.getPublishedAt())
                .extraction(source.getExtraction())
                .extractionStatus(source.getExtractionStatus())
                .extractionAttempts(source.getExtractionAttempts())
                .lastExtractionError(source.getLastExtractionError())
                .narrativeId(source.getNarrativeId())
                .clusteringStatus(source.getClusteringStatus())
                .createdAt(source.getCreatedAt())
                .updatedAt(source.getUpdatedAt())
                .build();
    }
}
