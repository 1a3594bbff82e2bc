package com.storyline.narrative.service.matching;

import com.storyline.narrative.config.NarrativeProperties;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Acceptance threshold as a function of how long ago a narrative was last updated.
 *
 * Recently updated narratives have noisier fingerprints and accept a lower score.
 */
@Component
@RequiredArgsConstructor
public class MatchThresholdPolicy {

    private final NarrativeProperties properties;

    /**
     * 0.5 within 48 hours of the last update, the base threshold (0.6) otherwise.
     */
    public double thresholdFor(Duration sinceLastUpdate) {
        NarrativeProperties.Matching config = properties.getMatching();
        if (sinceLastUpdate.compareTo(Duration.ofHours(config.getRecentHours())) <= 0) {
            return config.getRecentThreshold();
        }
        return config.getBaseThreshold();
    }

    /**
     * Threshold for a matcher candidate. Dormant narratives outside the sliding window
     * need the stricter reactivation threshold.
     */
    public double candidateThreshold(Duration sinceLastUpdate) {
        NarrativeProperties.Matching config = properties.getMatching();
        if (sinceLastUpdate.compareTo(Duration.ofDays(config.getSlidingWindowDays())) > 0) {
            return config.getReactivationThreshold();
        }
        return thresholdFor(sinceLastUpdate);
    }
}
