package com.storyline.narrative.repository;

import com.storyline.narrative.entity.ArticleRecord;
import com.storyline.narrative.entity.ClusteringStatus;
import com.storyline.narrative.entity.ExtractionStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ArticleRecordRepository extends JpaRepository<ArticleRecord, Long> {

    boolean existsByExternalId(String externalId);

    List<ArticleRecord> findByExternalIdIn(Collection<String> externalIds);

    /**
     * 클러스터링 대기 기사 (추출 완료, narrative 미할당)
     */
    List<ArticleRecord> findByExtractionStatusAndClusteringStatusAndNarrativeIdIsNullOrderByPublishedAtAscExternalIdAsc(
            ExtractionStatus extractionStatus, ClusteringStatus clusteringStatus, Pageable pageable);

    List<ArticleRecord> findByExtractionStatusAndExtractionAttemptsLessThanOrderByPublishedAtAsc(
            ExtractionStatus extractionStatus, int maxAttempts, Pageable pageable);

    @Modifying
    @Query("UPDATE ArticleRecord a SET a.narrativeId = :narrativeId, a.clusteringStatus = :status " +
           "WHERE a.externalId IN :externalIds")
    int linkToNarrative(@Param("externalIds") Collection<String> externalIds,
                        @Param("narrativeId") Long narrativeId,
                        @Param("status") ClusteringStatus status);

    @Modifying
    @Query("UPDATE ArticleRecord a SET a.narrativeId = :toId WHERE a.narrativeId = :fromId")
    int reassignNarrative(@Param("fromId") Long fromId, @Param("toId") Long toId);

    @Modifying
    @Query("UPDATE ArticleRecord a SET a.clusteringStatus = :status WHERE a.externalId IN :externalIds")
    int updateClusteringStatus(@Param("externalIds") Collection<String> externalIds,
                               @Param("status") ClusteringStatus status);
}
