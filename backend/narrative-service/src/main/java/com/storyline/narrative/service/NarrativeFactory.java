package com.storyline.narrative.service;

import com.storyline.narrative.entity.ArticleRecord;
import com.storyline.narrative.entity.Narrative;
import com.storyline.narrative.entity.NarrativeFingerprint;
import com.storyline.narrative.service.cluster.ArticleCluster;
import com.storyline.narrative.service.lifecycle.NarrativeLifecycleService;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;

/**
 * Builds a new narrative from an unmatched cluster.
 *
 * firstSeen and lastUpdated come from the cluster's publish dates, never from the wall clock.
 */
@Component
@RequiredArgsConstructor
public class NarrativeFactory {

    private final SummaryGenerator summaryGenerator;
    private final NarrativeLifecycleService lifecycleService;

    public Narrative create(ArticleCluster cluster, NarrativeFingerprint fingerprint, LocalDateTime now) {
        SummaryGenerator.GeneratedSummary text = summaryGenerator.generate(fingerprint, cluster.articles());

        Narrative narrative = Narrative.builder()
                .title(text.title())
                .summary(text.summary())
                .nucleusEntity(fingerprint.getNucleusEntity())
                .creationKey(creationKey(fingerprint.getNucleusEntity(), cluster.anchorArticleId()))
                .fingerprint(fingerprint)
                .entitySalience(new LinkedHashMap<>(cluster.actorSalience()))
                .firstSeen(cluster.earliestPublished())
                .lastUpdated(cluster.latestPublished())
                .needsSummaryUpdate(false)
                .build();
        narrative.replaceArticleIds(cluster.articleIds());

        List<LocalDateTime> dates = cluster.articles().stream().map(ArticleRecord::getPublishedAt).toList();
        lifecycleService.apply(narrative, dates, now);
        return narrative;
    }

    /**
     * Same nucleus and same founding article always yield the same key.
     */
    public static String creationKey(String nucleus, String anchorArticleId) {
        return nucleus.trim().toLowerCase(Locale.ROOT) + ":" + anchorArticleId;
    }
}
