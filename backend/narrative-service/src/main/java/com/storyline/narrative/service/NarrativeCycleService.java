package com.storyline.narrative.service;

import com.storyline.narrative.config.NarrativeProperties;
import com.storyline.narrative.entity.ArticleRecord;
import com.storyline.narrative.entity.Narrative;
import com.storyline.narrative.entity.NarrativeFingerprint;
import com.storyline.narrative.exception.DenyListedEntityException;
import com.storyline.narrative.exception.DuplicateNarrativeException;
import com.storyline.narrative.exception.FingerprintValidationException;
import com.storyline.narrative.service.cluster.ArticleCluster;
import com.storyline.narrative.service.cluster.ClusterBuildResult;
import com.storyline.narrative.service.cluster.ClusterBuilder;
import com.storyline.narrative.service.fingerprint.FingerprintCalculator;
import com.storyline.narrative.service.matching.MatchResult;
import com.storyline.narrative.service.matching.NarrativeMatcher;
import com.storyline.narrative.store.ArticleStore;
import com.storyline.narrative.store.NarrativeStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Narrative cycle: cluster pending articles, then extend a matching narrative or create a new one.
 *
 * Clusters are processed one at a time. The narrative map is refreshed after every write so
 * a later cluster in the same cycle sees the current state of a narrative extended earlier.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NarrativeCycleService {

    private final ArticleStore articleStore;
    private final NarrativeStore narrativeStore;
    private final ClusterBuilder clusterBuilder;
    private final FingerprintCalculator fingerprintCalculator;
    private final NarrativeMatcher narrativeMatcher;
    private final NarrativeMergeService mergeService;
    private final NarrativeFactory narrativeFactory;
    private final NarrativeProperties properties;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    private final AtomicBoolean running = new AtomicBoolean(false);

    @CacheEvict(cacheNames = {"activeNarratives", "archivedNarratives", "resurrectedNarratives"}, allEntries = true)
    public CycleReport runCycle() {
        if (!running.compareAndSet(false, true)) {
            log.warn("Narrative cycle already running, skipping");
            return CycleReport.empty();
        }
        try {
            return doRunCycle();
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private CycleReport doRunCycle() {
        long startTime = System.currentTimeMillis();
        LocalDateTime now = LocalDateTime.now(clock);

        List<ArticleRecord> articles = articleStore.findPendingForClustering(properties.getClustering().getBatchSize());
        if (articles.isEmpty()) {
            log.debug("No pending articles for narrative cycle");
            return CycleReport.empty();
        }

        ClusterBuildResult result = clusterBuilder.build(articles);
        int excluded = result.excluded().size();
        articleStore.markExcluded(result.excluded().stream().map(ArticleRecord::getExternalId).toList());

        Map<Long, Narrative> candidates = loadCandidates(now);
        int created = 0;
        int extended = 0;
        int failed = 0;

        for (ArticleCluster cluster : result.clusters()) {
            try {
                NarrativeFingerprint fingerprint = fingerprintCalculator.compute(cluster);
                Optional<MatchResult> match = narrativeMatcher.findBestMatch(fingerprint, candidates.values(), now);

                Narrative current = match.flatMap(m -> refetch(m.narrative().getId(), candidates)).orElse(null);
                if (current != null) {
                    log.debug("Cluster {} matched narrative {} (similarity={})",
                            cluster.anchorArticleId(), current.getId(), match.get().similarity());
                    Narrative updated = mergeService.mergeCluster(current, cluster, now);
                    candidates.put(updated.getId(), updated);
                    extended++;
                } else {
                    Narrative narrative = narrativeFactory.create(cluster, fingerprint, now);
                    try {
                        narrative = narrativeStore.create(narrative);
                        created++;
                    } catch (DuplicateNarrativeException e) {
                        narrative = joinExisting(e, cluster, now);
                        extended++;
                    }
                    candidates.put(narrative.getId(), narrative);
                }
            } catch (DenyListedEntityException e) {
                log.warn("Dropping cluster {} with deny-listed nucleus: {}", cluster.anchorArticleId(), e.getEntity());
                articleStore.markExcluded(cluster.articleIds());
                excluded += cluster.size();
            } catch (FingerprintValidationException e) {
                log.warn("Skipping cluster {}: {}", cluster.anchorArticleId(), e.getMessage());
                articleStore.markExcluded(cluster.articleIds());
                excluded += cluster.size();
            } catch (Exception e) {
                log.error("Failed to process cluster {} (nucleus={}): {}",
                        cluster.anchorArticleId(), cluster.nucleusEntity(), e.getMessage(), e);
                failed++;
            }
        }

        meterRegistry.counter("narrative.cycle.clusters", "outcome", "created").increment(created);
        meterRegistry.counter("narrative.cycle.clusters", "outcome", "extended").increment(extended);
        meterRegistry.counter("narrative.cycle.clusters", "outcome", "failed").increment(failed);
        meterRegistry.counter("narrative.cycle.articles.excluded").increment(excluded);

        long duration = System.currentTimeMillis() - startTime;
        log.info("Narrative cycle completed: articles={}, clusters={}, created={}, extended={}, excluded={}, failed={}, duration={}ms",
                articles.size(), result.clusters().size(), created, extended, excluded, failed, duration);
        return new CycleReport(articles.size(), result.clusters().size(), created, extended, excluded, failed, duration);
    }

    /**
     * Narratives inside the sliding window plus dormant narratives inside the reactivation window.
     */
    private Map<Long, Narrative> loadCandidates(LocalDateTime now) {
        Map<Long, Narrative> candidates = new LinkedHashMap<>();
        narrativeStore.findUpdatedSince(now.minusDays(properties.getMatching().getSlidingWindowDays()))
                .forEach(narrative -> candidates.put(narrative.getId(), narrative));
        narrativeStore.findDormantUpdatedSince(now.minusDays(properties.getMatching().getReactivationWindowDays()))
                .forEach(narrative -> candidates.putIfAbsent(narrative.getId(), narrative));
        return candidates;
    }

    private Optional<Narrative> refetch(Long id, Map<Long, Narrative> candidates) {
        Optional<Narrative> current = narrativeStore.findById(id);
        if (current.isEmpty()) {
            log.info("Matched narrative {} no longer exists, creating instead", id);
            candidates.remove(id);
        }
        return current;
    }

    // 동시에 다른 사이클이 같은 narrative를 만들었으면 그쪽에 병합
    private Narrative joinExisting(DuplicateNarrativeException e, ArticleCluster cluster, LocalDateTime now) {
        Narrative holder = narrativeStore.findByCreationKey(e.getCreationKey())
                .orElseThrow(() -> e);
        log.info("Narrative for key {} already exists as {}, merging cluster into it",
                e.getCreationKey(), holder.getId());
        return mergeService.mergeCluster(holder, cluster, now);
    }
}
