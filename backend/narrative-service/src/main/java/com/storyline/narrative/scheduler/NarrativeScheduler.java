package com.storyline.narrative.scheduler;

import com.storyline.narrative.config.NarrativeProperties;
import com.storyline.narrative.service.CycleReport;
import com.storyline.narrative.service.DeduplicationReport;
import com.storyline.narrative.service.NarrativeCycleService;
import com.storyline.narrative.service.NarrativeDeduplicationService;
import com.storyline.narrative.service.SummaryOutboxService;
import com.storyline.narrative.service.extraction.ExtractionBatchService;
import com.storyline.narrative.service.lifecycle.NarrativeLifecycleService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * 주기 작업 스케줄러.
 * 추출 → 사이클 → 요약 순으로 파이프라인이 흘러가고, 중복 병합과 라이프사이클 갱신은 별도 주기로 실행된다.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NarrativeScheduler {

    private final ExtractionBatchService extractionBatchService;
    private final NarrativeCycleService cycleService;
    private final NarrativeDeduplicationService deduplicationService;
    private final NarrativeLifecycleService lifecycleService;
    private final SummaryOutboxService summaryOutboxService;
    private final NarrativeProperties properties;

    @Scheduled(fixedDelayString = "${narrative.schedule.extraction-delay-ms:60000}",
            initialDelayString = "${narrative.schedule.initial-delay-ms:30000}")
    public void scheduledExtraction() {
        if (!properties.getExtraction().isEnabled()) {
            return;
        }
        try {
            extractionBatchService.processPending();
        } catch (Exception e) {
            log.error("Scheduled extraction failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${narrative.schedule.cycle-delay-ms:300000}",
            initialDelayString = "${narrative.schedule.initial-delay-ms:30000}")
    public void scheduledCycle() {
        if (!properties.getSchedule().isCycleEnabled()) {
            log.debug("Scheduled narrative cycle is disabled");
            return;
        }
        // 관리자 API로 수동 실행 중이면 스킵
        if (cycleService.isRunning()) {
            log.info("Skipping scheduled narrative cycle: already running");
            return;
        }
        try {
            CycleReport report = cycleService.runCycle();
            if (report.articles() == 0) {
                log.debug("Scheduled narrative cycle found nothing to do");
            }
        } catch (Exception e) {
            log.error("Scheduled narrative cycle failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${narrative.schedule.dedup-cron:0 15 * * * ?}")
    public void scheduledDeduplication() {
        if (!properties.getSchedule().isDedupEnabled()) {
            return;
        }
        try {
            DeduplicationReport report = deduplicationService.deduplicate();
            if (report.merged() > 0) {
                log.info("Scheduled dedup merged {} narratives", report.merged());
            }
        } catch (Exception e) {
            log.error("Scheduled dedup failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(cron = "${narrative.schedule.lifecycle-cron:0 45 * * * ?}")
    public void scheduledLifecycleRefresh() {
        if (!properties.getSchedule().isLifecycleRefreshEnabled()) {
            return;
        }
        try {
            lifecycleService.refreshAll();
        } catch (Exception e) {
            log.error("Scheduled lifecycle refresh failed: {}", e.getMessage(), e);
        }
    }

    @Scheduled(fixedDelayString = "${narrative.schedule.summary-delay-ms:60000}",
            initialDelayString = "${narrative.schedule.initial-delay-ms:30000}")
    public void scheduledSummaryUpdate() {
        if (!properties.getSchedule().isSummaryEnabled()) {
            return;
        }
        try {
            summaryOutboxService.processPending();
        } catch (Exception e) {
            log.error("Scheduled summary update failed: {}", e.getMessage(), e);
        }
    }
}
