package com.storyline.narrative.service;

import com.storyline.narrative.config.NarrativeProperties;
import com.storyline.narrative.dto.NarrativeDetailDto;
import com.storyline.narrative.dto.NarrativeSummaryDto;
import com.storyline.narrative.dto.NarrativeTimelineDto;
import com.storyline.narrative.dto.TimelineSnapshotDto;
import com.storyline.narrative.entity.ArticleRecord;
import com.storyline.narrative.entity.ExtractedActor;
import com.storyline.narrative.entity.LifecycleState;
import com.storyline.narrative.entity.Narrative;
import com.storyline.narrative.exception.NarrativeNotFoundException;
import com.storyline.narrative.mapper.NarrativeMapper;
import com.storyline.narrative.store.ArticleStore;
import com.storyline.narrative.store.NarrativeStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.cache.annotation.Cacheable;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Read views over narratives. List views are light; heavy fields only appear in detail.
 *
 * Narratives without a valid fingerprint are never returned.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class NarrativeQueryService {

    private final NarrativeStore narrativeStore;
    private final ArticleStore articleStore;
    private final NarrativeMapper narrativeMapper;
    private final NarrativeProperties properties;
    private final Clock clock;

    /**
     * Emerging, rising, hot, cooling and reactivated narratives, newest first.
     *
     * @param state optional filter, must be an active state
     */
    @Cacheable(cacheNames = "activeNarratives", key = "#limit + ':' + #state")
    public List<NarrativeSummaryDto> getActive(int limit, LifecycleState state) {
        Set<LifecycleState> states;
        if (state == null) {
            states = LifecycleState.activeStates();
        } else if (state.isActive()) {
            states = Set.of(state);
        } else {
            throw new IllegalArgumentException("Not an active lifecycle state: " + state);
        }
        return toSummaries(narrativeStore.findByStates(states, limit));
    }

    /**
     * Dormant narratives updated within the last {@code days} days.
     */
    @Cacheable(cacheNames = "archivedNarratives", key = "#limit + ':' + #days")
    public List<NarrativeSummaryDto> getArchived(int limit, int days) {
        LocalDateTime since = LocalDateTime.now(clock).minusDays(days);
        return toSummaries(narrativeStore.findByStateUpdatedSince(LifecycleState.DORMANT, since, limit));
    }

    /**
     * Narratives that came back at least once, in any current state.
     */
    @Cacheable(cacheNames = "resurrectedNarratives", key = "#limit + ':' + #days")
    public List<NarrativeSummaryDto> getResurrections(int limit, int days) {
        LocalDateTime since = LocalDateTime.now(clock).minusDays(days);
        return toSummaries(narrativeStore.findReawakenedSince(since, limit));
    }

    public NarrativeDetailDto getDetail(Long id) {
        Narrative narrative = findVisible(id);
        return narrativeMapper.toDetailDto(narrative, narrativeStore.findMergeHistory(id));
    }

    /**
     * Daily snapshots computed from the narrative's articles.
     */
    public NarrativeTimelineDto getTimeline(Long id) {
        Narrative narrative = findVisible(id);
        List<ArticleRecord> articles = articleStore.findByExternalIds(narrative.getArticleIds());

        Map<LocalDate, List<ArticleRecord>> byDay = articles.stream()
                .collect(Collectors.groupingBy(a -> a.getPublishedAt().toLocalDate(), TreeMap::new, Collectors.toList()));
        List<LocalDate> allDays = articles.stream().map(a -> a.getPublishedAt().toLocalDate()).toList();
        int windowDays = properties.getLifecycle().getVelocityWindowDays();

        List<TimelineSnapshotDto> snapshots = new ArrayList<>();
        int cumulative = 0;
        for (Map.Entry<LocalDate, List<ArticleRecord>> day : byDay.entrySet()) {
            cumulative += day.getValue().size();
            LocalDate windowStart = day.getKey().minusDays(windowDays - 1L);
            long inWindow = allDays.stream()
                    .filter(d -> !d.isBefore(windowStart) && !d.isAfter(day.getKey()))
                    .count();
            snapshots.add(new TimelineSnapshotDto(
                    day.getKey(),
                    day.getValue().size(),
                    cumulative,
                    entitiesOf(day.getValue()),
                    Math.round((double) inWindow / windowDays * 100.0) / 100.0
            ));
        }
        return new NarrativeTimelineDto(narrative.getId(), narrative.getTitle(), snapshots);
    }

    private Narrative findVisible(Long id) {
        return narrativeStore.findById(id)
                .filter(NarrativeQueryService::isVisible)
                .orElseThrow(() -> new NarrativeNotFoundException(id));
    }

    private List<NarrativeSummaryDto> toSummaries(List<Narrative> narratives) {
        return narratives.stream()
                .filter(narrative -> {
                    boolean visible = isVisible(narrative);
                    if (!visible) {
                        log.warn("Hiding narrative {} with invalid fingerprint", narrative.getId());
                    }
                    return visible;
                })
                .map(narrativeMapper::toSummaryDto)
                .toList();
    }

    private static boolean isVisible(Narrative narrative) {
        return narrative.getFingerprint() != null && narrative.getFingerprint().isValid();
    }

    private static List<String> entitiesOf(List<ArticleRecord> articles) {
        Set<String> entities = new LinkedHashSet<>();
        for (ArticleRecord article : articles) {
            if (article.getExtraction() == null) {
                continue;
            }
            if (article.getExtraction().hasNucleus()) {
                entities.add(article.getExtraction().getNucleusEntity().trim());
            }
            if (article.getExtraction().getActors() != null) {
                article.getExtraction().getActors().stream()
                        .map(ExtractedActor::getName)
                        .filter(name -> name != null && !name.isBlank())
                        .forEach(name -> entities.add(name.trim()));
            }
        }
        return new ArrayList<>(entities);
    }
}
