package com.storyline.narrative.service.lifecycle;

import com.storyline.narrative.config.NarrativeProperties;
import com.storyline.narrative.entity.LifecycleState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collection;

/**
 * Derives {@link LifecycleSignals} from a narrative's article publish dates.
 */
@Component
@RequiredArgsConstructor
public class LifecycleSignalsFactory {

    private final NarrativeProperties properties;
    private final VelocityCalculator velocityCalculator;

    public LifecycleSignals from(int articleCount,
                                 Collection<LocalDateTime> publishDates,
                                 LocalDateTime lastUpdated,
                                 LifecycleState previousState,
                                 LocalDateTime now) {
        LocalDateTime pulseStart = now.minusHours(properties.getLifecycle().getReactivationPulseHours());

        return LifecycleSignals.builder()
                .articleCount(articleCount)
                .mentionVelocity(velocityCalculator.velocity(publishDates, now))
                .momentum(velocityCalculator.momentum(publishDates, now))
                .daysSinceLastUpdate(daysSince(quietReference(publishDates, lastUpdated, previousState, pulseStart), now))
                .articlesLast24h((int) velocityCalculator.countSince(publishDates, now.minusHours(24)))
                .articlesLast48h((int) velocityCalculator.countSince(publishDates, pulseStart))
                .previousState(previousState)
                .build();
    }

    /**
     * For a resting narrative the quiet period is measured up to the last article before the
     * pulse window, so that a fresh pulse does not hide how long it has been dormant.
     */
    private static LocalDateTime quietReference(Collection<LocalDateTime> publishDates,
                                                LocalDateTime lastUpdated,
                                                LifecycleState previousState,
                                                LocalDateTime pulseStart) {
        if (previousState == null || !previousState.isResting()) {
            return lastUpdated;
        }
        return publishDates.stream()
                .filter(date -> date.isBefore(pulseStart))
                .max(LocalDateTime::compareTo)
                .orElse(lastUpdated);
    }

    private static double daysSince(LocalDateTime reference, LocalDateTime now) {
        if (reference == null || reference.isAfter(now)) {
            return 0.0;
        }
        return Duration.between(reference, now).toMinutes() / (24.0 * 60.0);
    }
}
