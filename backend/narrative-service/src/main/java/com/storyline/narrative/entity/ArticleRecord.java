package com.storyline.narrative.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;

/**
 * 수집된 기사와 추출된 엔티티.
 *
 * 기사 본문 필드는 수집 이후 변경되지 않는다. 엔진은 추출 결과와 narrative 연결 정보만 기록한다.
 */
@Entity
@Table(name = "narrative_articles", indexes = {
    @Index(name = "idx_article_external_id", columnList = "external_id", unique = true),
    @Index(name = "idx_article_narrative_id", columnList = "narrative_id"),
    @Index(name = "idx_article_extraction_status", columnList = "extraction_status"),
    @Index(name = "idx_article_clustering_status", columnList = "clustering_status"),
    @Index(name = "idx_article_published_at", columnList = "published_at")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ArticleRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "external_id", nullable = false, unique = true, length = 255)
    private String externalId;

    @Column(name = "title", columnDefinition = "TEXT")
    private String title;

    @Column(name = "url", columnDefinition = "TEXT")
    private String url;

    @Column(name = "source", length = 255)
    private String source;

    @Column(name = "published_at", nullable = false)
    private LocalDateTime publishedAt;

    @Column(name = "extraction", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private ExtractionResult extraction;

    @Enumerated(EnumType.STRING)
    @Column(name = "extraction_status", nullable = false, length = 20)
    @Builder.Default
    private ExtractionStatus extractionStatus = ExtractionStatus.PENDING;

    @Column(name = "extraction_attempts", nullable = false)
    @Builder.Default
    private int extractionAttempts = 0;

    @Column(name = "last_extraction_error", columnDefinition = "TEXT")
    private String lastExtractionError;

    /**
     * 소속 narrative ID (null = 미할당)
     */
    @Column(name = "narrative_id")
    private Long narrativeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "clustering_status", nullable = false, length = 20)
    @Builder.Default
    private ClusteringStatus clusteringStatus = ClusteringStatus.PENDING;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public String nucleus() {
        return extraction != null && extraction.hasNucleus() ? extraction.getNucleusEntity().trim() : null;
    }
}
