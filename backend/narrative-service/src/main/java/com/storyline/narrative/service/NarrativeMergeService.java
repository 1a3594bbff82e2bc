package com.storyline.narrative.service;

import com.storyline.narrative.entity.ArticleRecord;
import com.storyline.narrative.entity.MergeTrigger;
import com.storyline.narrative.entity.Narrative;
import com.storyline.narrative.entity.NarrativeFingerprint;
import com.storyline.narrative.service.cluster.ArticleCluster;
import com.storyline.narrative.service.cluster.ClusterBuilder;
import com.storyline.narrative.service.fingerprint.FingerprintCalculator;
import com.storyline.narrative.service.lifecycle.NarrativeLifecycleService;
import com.storyline.narrative.store.ArticleStore;
import com.storyline.narrative.store.NarrativeStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Union of a narrative with new articles or with another narrative.
 *
 * The result always derives firstSeen and lastUpdated from the publish dates of the union,
 * carries a recomputed fingerprint and is flagged for a summary refresh.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NarrativeMergeService {

    private final ArticleStore articleStore;
    private final NarrativeStore narrativeStore;
    private final ClusterBuilder clusterBuilder;
    private final FingerprintCalculator fingerprintCalculator;
    private final NarrativeLifecycleService lifecycleService;

    /**
     * Extends {@code target} with the articles of {@code cluster}.
     * Articles already in the narrative are ignored; with nothing new, the narrative is not written.
     */
    public Narrative mergeCluster(Narrative target, ArticleCluster cluster, LocalDateTime now) {
        Set<String> added = new LinkedHashSet<>(cluster.articleIds());
        added.removeAll(target.getArticleIds());
        if (added.isEmpty()) {
            log.debug("Cluster {} already part of narrative {}", cluster.anchorArticleId(), target.getId());
            articleStore.linkToNarrative(cluster.articleIds(), target.getId());
            return target;
        }

        Set<String> union = new LinkedHashSet<>(target.getArticleIds());
        union.addAll(added);
        combine(target, union, cluster.actorSalience(), cluster.actions(),
                cluster.earliestPublished(), cluster.latestPublished(), now);

        Narrative saved = narrativeStore.extend(target, added);
        log.info("Extended narrative {} with {} articles (total={}, state={})",
                saved.getId(), added.size(), saved.getArticleCount(), saved.getLifecycleState());
        return saved;
    }

    /**
     * Folds {@code secondary} into {@code primary} and deletes it.
     */
    public Narrative mergeNarratives(Narrative primary, Narrative secondary, double similarity,
                                     MergeTrigger trigger, LocalDateTime now) {
        Set<String> union = new LinkedHashSet<>(primary.getArticleIds());
        union.addAll(secondary.getArticleIds());

        List<String> otherActions = secondary.getFingerprint() == null
                ? List.of()
                : secondary.getFingerprint().getKeyActions();
        combine(primary, union, secondary.getEntitySalience(), otherActions,
                secondary.getFirstSeen(), secondary.getLastUpdated(), now);

        List<Long> mergedFrom = new ArrayList<>(primary.getMergedFrom());
        mergedFrom.add(secondary.getId());
        secondary.getMergedFrom().stream().filter(id -> !mergedFrom.contains(id)).forEach(mergedFrom::add);
        primary.setMergedFrom(mergedFrom);
        primary.setMergedAt(now);

        return narrativeStore.absorb(primary, secondary, similarity, trigger);
    }

    private void combine(Narrative target, Set<String> union, Map<String, Double> otherSalience,
                         List<String> otherActions, LocalDateTime otherFirst, LocalDateTime otherLast,
                         LocalDateTime now) {
        List<ArticleRecord> articles = articleStore.findByExternalIds(union);
        Map<String, Double> salience = averageShared(target.getEntitySalience(), otherSalience);

        NarrativeFingerprint fingerprint;
        if (articles.isEmpty()) {
            List<String> actions = new ArrayList<>(target.getFingerprint().getKeyActions());
            actions.addAll(otherActions);
            fingerprint = fingerprintCalculator.compute(target.getNucleusEntity(), salience, actions);
        } else {
            ArticleCluster aggregate = clusterBuilder.aggregate(articles, target.getNucleusEntity());
            // 일부 기사를 읽지 못하면 병합된 salience로 대체
            Map<String, Double> actors = articles.size() == union.size() ? aggregate.actorSalience() : salience;
            fingerprint = fingerprintCalculator.compute(aggregate.nucleusEntity(), actors, aggregate.actions());
        }

        List<LocalDateTime> dates = articles.stream().map(ArticleRecord::getPublishedAt).toList();
        List<LocalDateTime> bounds = new ArrayList<>(dates);
        if (articles.size() < union.size()) {
            log.warn("Narrative {} references {} articles that could not be loaded",
                    target.getId(), union.size() - articles.size());
            addIfPresent(bounds, target.getFirstSeen(), target.getLastUpdated(), otherFirst, otherLast);
        }
        LocalDateTime firstSeen = bounds.stream().min(LocalDateTime::compareTo).orElseThrow();
        LocalDateTime lastUpdated = bounds.stream().max(LocalDateTime::compareTo).orElseThrow();

        target.replaceArticleIds(union);
        target.setEntitySalience(salience);
        target.setFingerprint(fingerprint);
        target.setNucleusEntity(fingerprint.getNucleusEntity());
        target.setFirstSeen(firstSeen);
        target.setLastUpdated(lastUpdated);
        target.setNeedsSummaryUpdate(true);

        lifecycleService.apply(target, dates, now);
    }

    private static void addIfPresent(List<LocalDateTime> bounds, LocalDateTime... values) {
        for (LocalDateTime value : values) {
            if (value != null) {
                bounds.add(value);
            }
        }
    }

    /**
     * Shared entities take the mean of both sides; one-sided entities keep their score.
     */
    static Map<String, Double> averageShared(Map<String, Double> left, Map<String, Double> right) {
        Map<String, Double> merged = new LinkedHashMap<>(left);
        if (right == null) {
            return merged;
        }
        right.forEach((entity, score) -> merged.merge(entity, score,
                (a, b) -> Math.round((a + b) / 2.0 * 10.0) / 10.0));
        return merged;
    }
}
