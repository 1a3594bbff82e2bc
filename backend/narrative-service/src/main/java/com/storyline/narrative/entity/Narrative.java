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
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Narrative 엔티티.
 *
 * 여러 기사에 걸쳐 이어지는 하나의 이야기. fingerprint로 식별되고 lifecycle 상태를 가진다.
 * firstSeen/lastUpdated는 항상 소속 기사의 발행 시각에서 계산된다.
 */
@Entity
@Table(name = "narratives", indexes = {
    @Index(name = "idx_narrative_nucleus", columnList = "nucleus_entity"),
    @Index(name = "idx_narrative_state", columnList = "lifecycle_state"),
    @Index(name = "idx_narrative_last_updated", columnList = "last_updated"),
    @Index(name = "idx_narrative_creation_key", columnList = "creation_key", unique = true)
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Narrative {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "title", columnDefinition = "TEXT")
    private String title;

    @Column(name = "summary", columnDefinition = "TEXT")
    private String summary;

    /**
     * fingerprint.nucleusEntity 사본 (인덱스/그룹핑용)
     */
    @Column(name = "nucleus_entity", nullable = false, length = 255)
    private String nucleusEntity;

    /**
     * nucleus + 최초 클러스터의 가장 작은 기사 ID. 동시 생성 방지용 유니크 키
     */
    @Column(name = "creation_key", nullable = false, unique = true, length = 512)
    private String creationKey;

    @Column(name = "fingerprint", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    private NarrativeFingerprint fingerprint;

    @Column(name = "article_ids", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    @Builder.Default
    private Set<String> articleIds = new LinkedHashSet<>();

    @Column(name = "article_count", nullable = false)
    @Builder.Default
    private int articleCount = 0;

    @Column(name = "entity_salience", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    @Builder.Default
    private Map<String, Double> entitySalience = new LinkedHashMap<>();

    @Enumerated(EnumType.STRING)
    @Column(name = "lifecycle_state", nullable = false, length = 20)
    @Builder.Default
    private LifecycleState lifecycleState = LifecycleState.EMERGING;

    @Column(name = "lifecycle_history", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    @Builder.Default
    private List<LifecycleTransition> lifecycleHistory = new ArrayList<>();

    @Column(name = "first_seen", nullable = false)
    private LocalDateTime firstSeen;

    @Column(name = "last_updated", nullable = false)
    private LocalDateTime lastUpdated;

    @Column(name = "mention_velocity", nullable = false)
    @Builder.Default
    private double mentionVelocity = 0.0;

    @Enumerated(EnumType.STRING)
    @Column(name = "momentum", nullable = false, length = 20)
    @Builder.Default
    private Momentum momentum = Momentum.UNKNOWN;

    @Column(name = "reawakening_count", nullable = false)
    @Builder.Default
    private int reawakeningCount = 0;

    @Column(name = "resurrection_velocity")
    private Double resurrectionVelocity;

    @Column(name = "dormant_since")
    private LocalDateTime dormantSince;

    @Column(name = "reawakened_from")
    private LocalDateTime reawakenedFrom;

    @Column(name = "needs_summary_update", nullable = false)
    @Builder.Default
    private boolean needsSummaryUpdate = false;

    /**
     * 이 narrative에 흡수된 narrative ID 목록
     */
    @Column(name = "merged_from", columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    @Builder.Default
    private List<Long> mergedFrom = new ArrayList<>();

    @Column(name = "merged_at")
    private LocalDateTime mergedAt;

    @Version
    @Column(name = "version")
    private Long version;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * 상태가 바뀐 경우에만 history에 기록한다.
     */
    public boolean transitionTo(LifecycleState next, LocalDateTime at) {
        if (next == lifecycleState && !lifecycleHistory.isEmpty()) {
            return false;
        }
        lifecycleState = next;
        lifecycleHistory.add(LifecycleTransition.builder()
                .state(next)
                .timestamp(at)
                .articleCount(articleCount)
                .mentionVelocity(Math.round(mentionVelocity * 100.0) / 100.0)
                .build());
        return true;
    }

    public void replaceArticleIds(Set<String> ids) {
        this.articleIds = new LinkedHashSet<>(ids);
        this.articleCount = this.articleIds.size();
    }
}
