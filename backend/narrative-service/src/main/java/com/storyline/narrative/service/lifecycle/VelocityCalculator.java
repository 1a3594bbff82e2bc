package com.storyline.narrative.service.lifecycle;

import com.storyline.narrative.config.NarrativeProperties;
import com.storyline.narrative.entity.Momentum;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

/**
 * Mention velocity and momentum over a fixed trailing window.
 *
 * Velocity never depends on the narrative's total age: a 60 day old narrative with one
 * article per day in the last week has velocity 1.0.
 */
@Component
@RequiredArgsConstructor
public class VelocityCalculator {

    private final NarrativeProperties properties;

    /**
     * Articles per day published within the trailing window, rounded to 2 decimals.
     */
    public double velocity(Collection<LocalDateTime> publishDates, LocalDateTime now) {
        int windowDays = properties.getLifecycle().getVelocityWindowDays();
        long count = recent(publishDates, now).size();
        return Math.round((double) count / windowDays * 100.0) / 100.0;
    }

    /**
     * Compares the later half of the recent activity span with the earlier half.
     */
    public Momentum momentum(Collection<LocalDateTime> publishDates, LocalDateTime now) {
        NarrativeProperties.Lifecycle config = properties.getLifecycle();
        List<LocalDateTime> recent = recent(publishDates, now);
        if (recent.size() < config.getMomentumMinArticles()) {
            return Momentum.UNKNOWN;
        }

        LocalDateTime start = recent.get(0);
        LocalDateTime end = recent.get(recent.size() - 1).isAfter(now) ? recent.get(recent.size() - 1) : now;
        Duration span = Duration.between(start, end);
        if (span.isZero()) {
            return Momentum.STABLE;
        }
        LocalDateTime mid = start.plus(span.dividedBy(2));

        long earlier = recent.stream().filter(date -> date.isBefore(mid)).count();
        long later = recent.size() - earlier;

        // 두 구간의 길이가 같으므로 건수 비교가 곧 속도 비교
        if (later >= config.getGrowingRatio() * earlier) {
            return Momentum.GROWING;
        }
        if (later <= config.getDecliningRatio() * earlier) {
            return Momentum.DECLINING;
        }
        return Momentum.STABLE;
    }

    public long countSince(Collection<LocalDateTime> publishDates, LocalDateTime since) {
        return publishDates.stream().filter(date -> !date.isBefore(since)).count();
    }

    private List<LocalDateTime> recent(Collection<LocalDateTime> publishDates, LocalDateTime now) {
        LocalDateTime windowStart = now.minusDays(properties.getLifecycle().getVelocityWindowDays());
        return publishDates.stream()
                .filter(date -> !date.isBefore(windowStart))
                .sorted()
                .toList();
    }
}
