package com.storyline.narrative.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 병합으로 삭제된 narrative의 이력.
 */
@Entity
@Table(name = "narrative_merge_records", indexes = {
    @Index(name = "idx_merge_primary", columnList = "primary_narrative_id"),
    @Index(name = "idx_merge_merged", columnList = "merged_narrative_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NarrativeMergeRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "primary_narrative_id", nullable = false)
    private Long primaryNarrativeId;

    @Column(name = "merged_narrative_id", nullable = false)
    private Long mergedNarrativeId;

    @Column(name = "merged_title", columnDefinition = "TEXT")
    private String mergedTitle;

    @Column(name = "merged_nucleus", length = 255)
    private String mergedNucleus;

    @Column(name = "merged_article_count")
    private int mergedArticleCount;

    @Column(name = "similarity")
    private Double similarity;

    @Enumerated(EnumType.STRING)
    @Column(name = "merge_trigger", nullable = false, length = 20)
    private MergeTrigger trigger;

    @Column(name = "merged_at", nullable = false)
    private LocalDateTime mergedAt;
}
