package com.storyline.narrative.service;

import com.storyline.narrative.entity.MergeTrigger;
import com.storyline.narrative.entity.Narrative;
import com.storyline.narrative.service.fingerprint.FingerprintSimilarity;
import com.storyline.narrative.service.matching.MatchThresholdPolicy;
import com.storyline.narrative.store.NarrativeStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Batch reconciliation of duplicate narratives across the whole store.
 *
 * A narrative that takes part in a merge is consumed for the rest of the pass. Chained
 * duplicates (A absorbs B, the result matches C) are left for the next run.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NarrativeDeduplicationService {

    /**
     * Primary first: most articles, most recent update, earliest creation, lowest id.
     */
    static final Comparator<Narrative> PRIMARY_ORDER = Comparator
            .comparingInt(Narrative::getArticleCount).reversed()
            .thenComparing(Narrative::getLastUpdated, Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()))
            .thenComparing(Narrative::getCreatedAt, Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder()))
            .thenComparing(Narrative::getId, Comparator.nullsLast(Comparator.<Long>naturalOrder()));

    private final NarrativeStore narrativeStore;
    private final FingerprintSimilarity similarity;
    private final MatchThresholdPolicy thresholdPolicy;
    private final NarrativeMergeService mergeService;
    private final MeterRegistry meterRegistry;
    private final Clock clock;

    @CacheEvict(cacheNames = {"activeNarratives", "archivedNarratives", "resurrectedNarratives"}, allEntries = true)
    public DeduplicationReport deduplicate() {
        long startTime = System.currentTimeMillis();
        LocalDateTime now = LocalDateTime.now(clock);

        List<Narrative> narratives = narrativeStore.findAll().stream()
                .filter(narrative -> narrative.getFingerprint() != null && narrative.getFingerprint().isValid())
                .toList();

        Map<String, List<Narrative>> groups = narratives.stream()
                .collect(Collectors.groupingBy(
                        narrative -> narrative.getFingerprint().getNucleusEntity().trim().toLowerCase(Locale.ROOT),
                        TreeMap::new,
                        Collectors.toList()));

        Set<Long> consumed = new HashSet<>();
        int groupCount = 0;
        int comparisons = 0;
        int merged = 0;
        int deferred = 0;
        int failed = 0;

        for (Map.Entry<String, List<Narrative>> group : groups.entrySet()) {
            List<Narrative> members = group.getValue().stream()
                    .sorted(Comparator.comparing(Narrative::getId))
                    .toList();
            if (members.size() < 2) {
                continue;
            }
            groupCount++;

            for (int i = 0; i < members.size(); i++) {
                for (int j = i + 1; j < members.size(); j++) {
                    Narrative a = members.get(i);
                    Narrative b = members.get(j);
                    comparisons++;

                    double score = similarity.calculate(a.getFingerprint(), b.getFingerprint());
                    double threshold = thresholdPolicy.thresholdFor(sinceMostRecentUpdate(a, b, now));
                    if (score < threshold) {
                        continue;
                    }
                    if (consumed.contains(a.getId()) || consumed.contains(b.getId())) {
                        log.debug("Deferring duplicate pair {} / {} to next run", a.getId(), b.getId());
                        deferred++;
                        continue;
                    }

                    consumed.add(a.getId());
                    consumed.add(b.getId());
                    if (mergePair(a, b, score, now)) {
                        merged++;
                    } else {
                        failed++;
                    }
                }
            }
        }

        meterRegistry.counter("narrative.dedup.merged").increment(merged);
        meterRegistry.counter("narrative.dedup.failed").increment(failed);

        long duration = System.currentTimeMillis() - startTime;
        log.info("Narrative dedup completed: narratives={}, groups={}, comparisons={}, merged={}, deferred={}, failed={}, duration={}ms",
                narratives.size(), groupCount, comparisons, merged, deferred, failed, duration);
        return new DeduplicationReport(narratives.size(), groupCount, comparisons, merged, deferred, failed, duration);
    }

    /**
     * Re-reads both narratives before merging. The store may have changed since the pass started.
     */
    private boolean mergePair(Narrative a, Narrative b, double score, LocalDateTime now) {
        Optional<Narrative> currentA = narrativeStore.findById(a.getId());
        Optional<Narrative> currentB = narrativeStore.findById(b.getId());
        if (currentA.isEmpty() || currentB.isEmpty()) {
            log.info("Skipping merge of {} / {}: narrative no longer exists", a.getId(), b.getId());
            return false;
        }

        Narrative primary = PRIMARY_ORDER.compare(currentA.get(), currentB.get()) <= 0 ? currentA.get() : currentB.get();
        Narrative secondary = primary == currentA.get() ? currentB.get() : currentA.get();
        try {
            Narrative result = mergeService.mergeNarratives(primary, secondary, score, MergeTrigger.DEDUP, now);
            log.info("Dedup merged narrative {} ({} articles) into {} (now {} articles, similarity={})",
                    secondary.getId(), secondary.getArticleCount(), result.getId(), result.getArticleCount(),
                    String.format("%.3f", score));
            return true;
        } catch (Exception e) {
            log.error("Dedup merge of {} into {} failed, will retry next run: {}",
                    secondary.getId(), primary.getId(), e.getMessage(), e);
            return false;
        }
    }

    private static Duration sinceMostRecentUpdate(Narrative a, Narrative b, LocalDateTime now) {
        LocalDateTime latest = a.getLastUpdated().isAfter(b.getLastUpdated()) ? a.getLastUpdated() : b.getLastUpdated();
        return latest.isAfter(now) ? Duration.ZERO : Duration.between(latest, now);
    }
}
