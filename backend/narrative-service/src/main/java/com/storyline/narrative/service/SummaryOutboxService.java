package com.storyline.narrative.service;

import com.storyline.narrative.config.NarrativeProperties;
import com.storyline.narrative.entity.ArticleRecord;
import com.storyline.narrative.entity.Narrative;
import com.storyline.narrative.entity.SummaryTaskStatus;
import com.storyline.narrative.entity.SummaryUpdateTask;
import com.storyline.narrative.repository.SummaryUpdateTaskRepository;
import com.storyline.narrative.store.ArticleStore;
import com.storyline.narrative.store.NarrativeStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Drains the summary outbox: regenerates title and summary of narratives whose article set changed.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class SummaryOutboxService {

    private final SummaryUpdateTaskRepository taskRepository;
    private final NarrativeStore narrativeStore;
    private final ArticleStore articleStore;
    private final SummaryGenerator summaryGenerator;
    private final NarrativeProperties properties;
    private final Clock clock;

    /**
     * @return number of tasks completed
     */
    @CacheEvict(cacheNames = {"activeNarratives", "archivedNarratives", "resurrectedNarratives"}, allEntries = true)
    public int processPending() {
        List<SummaryUpdateTask> tasks = taskRepository.findByStatusOrderByCreatedAtAsc(
                SummaryTaskStatus.PENDING, PageRequest.of(0, properties.getSummary().getBatchSize()));
        if (tasks.isEmpty()) {
            return 0;
        }

        int done = 0;
        for (SummaryUpdateTask task : tasks) {
            try {
                regenerate(task);
                task.setStatus(SummaryTaskStatus.DONE);
                task.setProcessedAt(LocalDateTime.now(clock));
                done++;
            } catch (Exception e) {
                task.setAttempts(task.getAttempts() + 1);
                task.setLastError(e.getMessage());
                if (task.getAttempts() >= properties.getSummary().getMaxAttempts()) {
                    task.setStatus(SummaryTaskStatus.FAILED);
                    log.error("Summary task {} for narrative {} failed permanently: {}",
                            task.getId(), task.getNarrativeId(), e.getMessage(), e);
                } else {
                    log.warn("Summary task {} for narrative {} failed (attempt {}): {}",
                            task.getId(), task.getNarrativeId(), task.getAttempts(), e.getMessage());
                }
            }
            taskRepository.save(task);
        }
        log.info("Summary outbox processed: {} of {} tasks completed", done, tasks.size());
        return done;
    }

    private void regenerate(SummaryUpdateTask task) {
        Optional<Narrative> found = narrativeStore.findById(task.getNarrativeId());
        if (found.isEmpty()) {
            // 병합으로 삭제됨, 흡수한 쪽에 별도 작업이 있다
            log.debug("Narrative {} gone, closing summary task {}", task.getNarrativeId(), task.getId());
            return;
        }
        Narrative narrative = found.get();
        List<ArticleRecord> articles = articleStore.findByExternalIds(narrative.getArticleIds());
        SummaryGenerator.GeneratedSummary text = summaryGenerator.generate(narrative.getFingerprint(), articles);

        narrative.setTitle(text.title());
        narrative.setSummary(text.summary());
        narrative.setNeedsSummaryUpdate(false);
        narrativeStore.save(narrative);
        log.debug("Regenerated summary for narrative {} ({})", narrative.getId(), task.getReason());
    }
}
