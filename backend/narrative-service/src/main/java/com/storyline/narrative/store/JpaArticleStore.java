package com.storyline.narrative.store;

import com.storyline.narrative.entity.ArticleRecord;
import com.storyline.narrative.entity.ClusteringStatus;
import com.storyline.narrative.entity.ExtractionStatus;
import com.storyline.narrative.repository.ArticleRecordRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;

@Component
@RequiredArgsConstructor
@Slf4j
public class JpaArticleStore implements ArticleStore {

    private final ArticleRecordRepository articleRecordRepository;

    @Override
    @Transactional(readOnly = true)
    public List<ArticleRecord> findPendingForClustering(int limit) {
        return articleRecordRepository
                .findByExtractionStatusAndClusteringStatusAndNarrativeIdIsNullOrderByPublishedAtAscExternalIdAsc(
                        ExtractionStatus.EXTRACTED, ClusteringStatus.PENDING, PageRequest.of(0, limit));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ArticleRecord> findPendingExtraction(int limit, int maxAttempts) {
        return articleRecordRepository.findByExtractionStatusAndExtractionAttemptsLessThanOrderByPublishedAtAsc(
                ExtractionStatus.PENDING, maxAttempts, PageRequest.of(0, limit));
    }

    @Override
    @Transactional(readOnly = true)
    public List<ArticleRecord> findByExternalIds(Collection<String> externalIds) {
        if (externalIds.isEmpty()) {
            return List.of();
        }
        return articleRecordRepository.findByExternalIdIn(externalIds);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean exists(String externalId) {
        return articleRecordRepository.existsByExternalId(externalId);
    }

    @Override
    @Transactional
    public ArticleRecord save(ArticleRecord article) {
        return articleRecordRepository.save(article);
    }

    @Override
    @Transactional
    public void linkToNarrative(Collection<String> externalIds, Long narrativeId) {
        if (externalIds.isEmpty()) {
            return;
        }
        articleRecordRepository.linkToNarrative(externalIds, narrativeId, ClusteringStatus.ASSIGNED);
    }

    @Override
    @Transactional
    public void markExcluded(Collection<String> externalIds) {
        if (externalIds.isEmpty()) {
            return;
        }
        int updated = articleRecordRepository.updateClusteringStatus(externalIds, ClusteringStatus.EXCLUDED);
        log.debug("Marked {} articles as excluded from clustering", updated);
    }
}
