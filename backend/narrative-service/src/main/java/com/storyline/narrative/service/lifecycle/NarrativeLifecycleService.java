package com.storyline.narrative.service.lifecycle;

import com.storyline.narrative.config.NarrativeProperties;
import com.storyline.narrative.entity.ArticleRecord;
import com.storyline.narrative.entity.LifecycleState;
import com.storyline.narrative.entity.Narrative;
import com.storyline.narrative.store.ArticleStore;
import com.storyline.narrative.store.NarrativeStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Applies lifecycle decisions to narratives.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NarrativeLifecycleService {

    private final LifecycleEngine lifecycleEngine;
    private final LifecycleSignalsFactory signalsFactory;
    private final NarrativeStore narrativeStore;
    private final ArticleStore articleStore;
    private final NarrativeProperties properties;
    private final Clock clock;

    /**
     * Recomputes velocity, momentum and state in place.
     *
     * @return true when the lifecycle state changed
     */
    public boolean apply(Narrative narrative, Collection<LocalDateTime> publishDates, LocalDateTime now) {
        LifecycleState previous = narrative.getLifecycleHistory().isEmpty() ? null : narrative.getLifecycleState();
        LifecycleSignals signals = signalsFactory.from(
                narrative.getArticleCount(), publishDates, narrative.getLastUpdated(), previous, now);
        LifecycleDecision decision = lifecycleEngine.evaluate(signals);

        narrative.setMentionVelocity(signals.mentionVelocity());
        narrative.setMomentum(signals.momentum());

        if (decision.state() == LifecycleState.REACTIVATED) {
            narrative.setResurrectionVelocity(decision.resurrectionVelocity());
            if (decision.reawakened()) {
                narrative.setReawakeningCount(narrative.getReawakeningCount() + 1);
                narrative.setReawakenedFrom(narrative.getDormantSince());
                log.info("Narrative reawakened: id={}, articlesIn48h={}, count={}",
                        narrative.getId(), signals.articlesLast48h(), narrative.getReawakeningCount());
            }
        }
        // ECHO -> DORMANT는 같은 휴면 구간이므로 시작 시점을 유지
        if (decision.state() == LifecycleState.DORMANT && (previous == null || !previous.isResting())) {
            narrative.setDormantSince(now);
        }

        boolean changed = narrative.transitionTo(decision.state(), now);
        if (changed) {
            log.debug("Lifecycle transition: id={}, {} -> {}, velocity={}, momentum={}",
                    narrative.getId(), previous, decision.state(), signals.mentionVelocity(), signals.momentum());
        }
        return changed;
    }

    /**
     * Re-evaluates narratives touched within the reactivation window so they cool down
     * and go dormant without new articles.
     *
     * @return number of narratives whose state changed
     */
    @CacheEvict(cacheNames = {"activeNarratives", "archivedNarratives", "resurrectedNarratives"}, allEntries = true)
    public int refreshAll() {
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime since = now.minusDays(properties.getMatching().getReactivationWindowDays());
        List<Narrative> narratives = narrativeStore.findUpdatedSince(since);

        int changed = 0;
        for (Narrative narrative : narratives) {
            try {
                List<LocalDateTime> dates = articleStore.findByExternalIds(narrative.getArticleIds()).stream()
                        .map(ArticleRecord::getPublishedAt)
                        .toList();
                if (apply(narrative, dates, now)) {
                    changed++;
                }
                narrativeStore.save(narrative);
            } catch (Exception e) {
                log.error("Lifecycle refresh failed for narrative {}: {}", narrative.getId(), e.getMessage(), e);
            }
        }
        log.info("Lifecycle refresh completed: evaluated={}, changed={}", narratives.size(), changed);
        return changed;
    }
}
