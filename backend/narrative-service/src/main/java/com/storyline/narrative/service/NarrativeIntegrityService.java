package com.storyline.narrative.service;

import com.storyline.narrative.dto.IntegrityReport;
import com.storyline.narrative.entity.ArticleRecord;
import com.storyline.narrative.entity.Narrative;
import com.storyline.narrative.entity.SummaryUpdateReason;
import com.storyline.narrative.store.ArticleStore;
import com.storyline.narrative.store.NarrativeStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.CacheEvict;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Detects and repairs inconsistent narrative records.
 *
 * Checks: empty nucleus, firstSeen after lastUpdated, stale article counts and article ids
 * that no longer resolve.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NarrativeIntegrityService {

    private final NarrativeStore narrativeStore;
    private final ArticleStore articleStore;

    public IntegrityReport validate() {
        return scan(false);
    }

    /**
     * Drops dangling article ids and recomputes counts and dates from the remaining articles.
     * Narratives with an empty nucleus or without any resolvable article are reported, not touched.
     */
    @CacheEvict(cacheNames = {"activeNarratives", "archivedNarratives", "resurrectedNarratives"}, allEntries = true)
    public IntegrityReport repair() {
        return scan(true);
    }

    private IntegrityReport scan(boolean repair) {
        List<Narrative> narratives = narrativeStore.findAll();
        List<Long> emptyNucleus = new ArrayList<>();
        List<Long> reversed = new ArrayList<>();
        List<Long> countMismatches = new ArrayList<>();
        Map<Long, Integer> dangling = new LinkedHashMap<>();
        int repaired = 0;

        for (Narrative narrative : narratives) {
            Long id = narrative.getId();
            boolean nucleusMissing = narrative.getFingerprint() == null || !narrative.getFingerprint().isValid();
            if (nucleusMissing) {
                emptyNucleus.add(id);
            }
            boolean isReversed = narrative.getFirstSeen() != null && narrative.getLastUpdated() != null
                    && narrative.getFirstSeen().isAfter(narrative.getLastUpdated());
            if (isReversed) {
                reversed.add(id);
            }
            if (narrative.getArticleCount() != narrative.getArticleIds().size()) {
                countMismatches.add(id);
            }

            List<ArticleRecord> articles = articleStore.findByExternalIds(narrative.getArticleIds());
            Set<String> resolved = articles.stream().map(ArticleRecord::getExternalId).collect(Collectors.toSet());
            int missing = (int) narrative.getArticleIds().stream().filter(articleId -> !resolved.contains(articleId)).count();
            if (missing > 0) {
                dangling.put(id, missing);
            }

            boolean broken = isReversed || missing > 0 || narrative.getArticleCount() != narrative.getArticleIds().size();
            if (repair && broken && !nucleusMissing && !articles.isEmpty()) {
                try {
                    fix(narrative, articles);
                    repaired++;
                } catch (Exception e) {
                    log.error("Failed to repair narrative {}: {}", id, e.getMessage(), e);
                }
            }
        }

        IntegrityReport report = new IntegrityReport(
                narratives.size(), emptyNucleus, reversed, countMismatches, dangling, repaired);
        if (report.isHealthy()) {
            log.info("Narrative integrity check passed: {} narratives", narratives.size());
        } else {
            log.warn("Narrative integrity issues: emptyNucleus={}, reversed={}, countMismatch={}, dangling={}, repaired={}",
                    emptyNucleus.size(), reversed.size(), countMismatches.size(), dangling.size(), repaired);
        }
        return report;
    }

    private void fix(Narrative narrative, List<ArticleRecord> articles) {
        Set<String> kept = new LinkedHashSet<>();
        Set<String> resolved = articles.stream().map(ArticleRecord::getExternalId).collect(Collectors.toSet());
        narrative.getArticleIds().stream().filter(resolved::contains).forEach(kept::add);

        LocalDateTime first = articles.stream().map(ArticleRecord::getPublishedAt).min(LocalDateTime::compareTo).orElseThrow();
        LocalDateTime last = articles.stream().map(ArticleRecord::getPublishedAt).max(LocalDateTime::compareTo).orElseThrow();

        narrative.replaceArticleIds(kept);
        narrative.setFirstSeen(first);
        narrative.setLastUpdated(last);
        narrative.setNeedsSummaryUpdate(true);
        narrativeStore.save(narrative);
        narrativeStore.requestSummaryUpdate(narrative.getId(), SummaryUpdateReason.INTEGRITY_REPAIR);
        log.info("Repaired narrative {}: articles={}, firstSeen={}, lastUpdated={}",
                narrative.getId(), kept.size(), first, last);
    }
}
