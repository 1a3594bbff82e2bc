package com.storyline.narrative.store;

import com.storyline.narrative.entity.ClusteringStatus;
import com.storyline.narrative.entity.LifecycleState;
import com.storyline.narrative.entity.MergeTrigger;
import com.storyline.narrative.entity.Narrative;
import com.storyline.narrative.entity.NarrativeMergeRecord;
import com.storyline.narrative.entity.SummaryTaskStatus;
import com.storyline.narrative.entity.SummaryUpdateReason;
import com.storyline.narrative.entity.SummaryUpdateTask;
import com.storyline.narrative.exception.DuplicateNarrativeException;
import com.storyline.narrative.exception.NarrativeMergeException;
import com.storyline.narrative.repository.ArticleRecordRepository;
import com.storyline.narrative.repository.NarrativeMergeRecordRepository;
import com.storyline.narrative.repository.NarrativeRepository;
import com.storyline.narrative.repository.SummaryUpdateTaskRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * PostgreSQL backed {@link NarrativeStore}. Each public method is its own transaction.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class JpaNarrativeStore implements NarrativeStore {

    private final NarrativeRepository narrativeRepository;
    private final ArticleRecordRepository articleRecordRepository;
    private final NarrativeMergeRecordRepository mergeRecordRepository;
    private final SummaryUpdateTaskRepository summaryUpdateTaskRepository;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<Narrative> findById(Long id) {
        return narrativeRepository.findById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Narrative> findByCreationKey(String creationKey) {
        return narrativeRepository.findByCreationKey(creationKey);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean exists(Long id) {
        return narrativeRepository.existsById(id);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Narrative> findAll() {
        return narrativeRepository.findAll();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Narrative> findUpdatedSince(LocalDateTime since) {
        return narrativeRepository.findByLastUpdatedGreaterThanEqual(since);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Narrative> findDormantUpdatedSince(LocalDateTime since) {
        return narrativeRepository.findByLifecycleStateAndLastUpdatedGreaterThanEqual(LifecycleState.DORMANT, since);
    }

    @Override
    @Transactional
    public Narrative create(Narrative narrative) {
        NarrativeValidator.validate(narrative);
        Narrative saved;
        try {
            saved = narrativeRepository.saveAndFlush(narrative);
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateNarrativeException(narrative.getCreationKey(), e);
        }
        articleRecordRepository.linkToNarrative(saved.getArticleIds(), saved.getId(), ClusteringStatus.ASSIGNED);
        log.info("Created narrative: id={}, nucleus={}, articles={}",
                saved.getId(), saved.getNucleusEntity(), saved.getArticleCount());
        return saved;
    }

    @Override
    @Transactional
    public Narrative extend(Narrative narrative, Collection<String> addedArticleIds) {
        NarrativeValidator.validate(narrative);
        Narrative saved = narrativeRepository.save(narrative);
        articleRecordRepository.linkToNarrative(addedArticleIds, saved.getId(), ClusteringStatus.ASSIGNED);
        enqueueSummaryTask(saved.getId(), SummaryUpdateReason.ARTICLES_ADDED);
        return saved;
    }

    @Override
    @Transactional
    public Narrative absorb(Narrative primary, Narrative absorbed, double similarity, MergeTrigger trigger) {
        if (primary.getId().equals(absorbed.getId())) {
            throw NarrativeMergeException.selfMerge(primary.getId());
        }
        if (!narrativeRepository.existsById(absorbed.getId())) {
            throw NarrativeMergeException.vanished(absorbed.getId());
        }
        NarrativeValidator.validate(primary);

        Narrative saved = narrativeRepository.save(primary);
        int relinked = articleRecordRepository.reassignNarrative(absorbed.getId(), saved.getId());
        narrativeRepository.deleteById(absorbed.getId());

        mergeRecordRepository.save(NarrativeMergeRecord.builder()
                .primaryNarrativeId(saved.getId())
                .mergedNarrativeId(absorbed.getId())
                .mergedTitle(absorbed.getTitle())
                .mergedNucleus(absorbed.getNucleusEntity())
                .mergedArticleCount(absorbed.getArticleCount())
                .similarity(similarity)
                .trigger(trigger)
                .mergedAt(LocalDateTime.now(clock))
                .build());
        enqueueSummaryTask(saved.getId(), SummaryUpdateReason.NARRATIVES_MERGED);

        log.info("Merged narrative {} into {} ({} articles re-linked, trigger={})",
                absorbed.getId(), saved.getId(), relinked, trigger);
        return saved;
    }

    @Override
    @Transactional
    public Narrative save(Narrative narrative) {
        NarrativeValidator.validate(narrative);
        return narrativeRepository.save(narrative);
    }

    @Override
    @Transactional
    public void requestSummaryUpdate(Long narrativeId, SummaryUpdateReason reason) {
        enqueueSummaryTask(narrativeId, reason);
    }

    @Override
    @Transactional(readOnly = true)
    public List<Narrative> findByStates(Set<LifecycleState> states, int limit) {
        return narrativeRepository.findByLifecycleStateInOrderByLastUpdatedDesc(states, PageRequest.of(0, limit));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Narrative> findByStateUpdatedSince(LifecycleState state, LocalDateTime since, int limit) {
        return narrativeRepository.findByLifecycleStateAndLastUpdatedGreaterThanEqualOrderByLastUpdatedDesc(
                state, since, PageRequest.of(0, limit));
    }

    @Override
    @Transactional(readOnly = true)
    public List<Narrative> findReawakenedSince(LocalDateTime since, int limit) {
        return narrativeRepository.findByReawakeningCountGreaterThanAndLastUpdatedGreaterThanEqualOrderByLastUpdatedDesc(
                0, since, PageRequest.of(0, limit));
    }

    @Override
    @Transactional(readOnly = true)
    public List<NarrativeMergeRecord> findMergeHistory(Long primaryId) {
        return mergeRecordRepository.findByPrimaryNarrativeIdOrderByMergedAtDesc(primaryId);
    }

    // 대기 중인 작업이 이미 있으면 새로 만들지 않는다
    private void enqueueSummaryTask(Long narrativeId, SummaryUpdateReason reason) {
        if (summaryUpdateTaskRepository.existsByNarrativeIdAndStatus(narrativeId, SummaryTaskStatus.PENDING)) {
            return;
        }
        summaryUpdateTaskRepository.save(SummaryUpdateTask.builder()
                .narrativeId(narrativeId)
                .reason(reason)
                .build());
    }
}
