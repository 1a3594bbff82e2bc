package com.storyline.narrative.entity;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * 요약 재생성 대기열 (outbox).
 */
@Entity
@Table(name = "narrative_summary_tasks", indexes = {
    @Index(name = "idx_summary_task_status", columnList = "status"),
    @Index(name = "idx_summary_task_narrative", columnList = "narrative_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SummaryUpdateTask {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "narrative_id", nullable = false)
    private Long narrativeId;

    @Enumerated(EnumType.STRING)
    @Column(name = "reason", nullable = false, length = 30)
    private SummaryUpdateReason reason;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 20)
    @Builder.Default
    private SummaryTaskStatus status = SummaryTaskStatus.PENDING;

    @Column(name = "attempts", nullable = false)
    @Builder.Default
    private int attempts = 0;

    @Column(name = "last_error", columnDefinition = "TEXT")
    private String lastError;

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "processed_at")
    private LocalDateTime processedAt;
}
