package com.storyline.narrative.service.matching;

import com.storyline.narrative.entity.Narrative;
import com.storyline.narrative.entity.NarrativeFingerprint;
import com.storyline.narrative.service.fingerprint.FingerprintSimilarity;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

/**
 * Picks the best existing narrative for a cluster fingerprint.
 *
 * Ranking among candidates above their threshold: similarity, article count,
 * most recent update, earliest creation, lowest id.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class NarrativeMatcher {

    static final Comparator<MatchResult> RANKING = Comparator
            .comparingDouble(MatchResult::similarity).reversed()
            .thenComparing(result -> result.narrative().getArticleCount(), Comparator.<Integer>reverseOrder())
            .thenComparing(result -> result.narrative().getLastUpdated(), Comparator.nullsLast(Comparator.<LocalDateTime>reverseOrder()))
            .thenComparing(result -> result.narrative().getCreatedAt(), Comparator.nullsLast(Comparator.<LocalDateTime>naturalOrder()))
            .thenComparing(result -> result.narrative().getId(), Comparator.nullsLast(Comparator.<Long>naturalOrder()));

    private final FingerprintSimilarity similarity;
    private final MatchThresholdPolicy thresholdPolicy;

    public Optional<MatchResult> findBestMatch(NarrativeFingerprint fingerprint,
                                               Collection<Narrative> candidates,
                                               LocalDateTime now) {
        return candidates.stream()
                .filter(candidate -> candidate.getFingerprint() != null && candidate.getFingerprint().isValid())
                .map(candidate -> score(fingerprint, candidate, now))
                .filter(result -> result.similarity() >= result.threshold())
                .min(RANKING);
    }

    private MatchResult score(NarrativeFingerprint fingerprint, Narrative candidate, LocalDateTime now) {
        double score = similarity.calculate(fingerprint, candidate.getFingerprint());
        Duration age = candidate.getLastUpdated() == null || candidate.getLastUpdated().isAfter(now)
                ? Duration.ZERO
                : Duration.between(candidate.getLastUpdated(), now);
        double threshold = thresholdPolicy.candidateThreshold(age);
        log.debug("Candidate narrative {}: similarity={}, threshold={}",
                candidate.getId(), String.format("%.3f", score), threshold);
        return new MatchResult(candidate, score, threshold);
    }
}
