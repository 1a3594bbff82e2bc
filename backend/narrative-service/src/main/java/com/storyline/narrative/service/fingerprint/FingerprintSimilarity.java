package com.storyline.narrative.service.fingerprint;

import com.storyline.narrative.config.NarrativeProperties;
import com.storyline.narrative.entity.NarrativeFingerprint;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Weighted fingerprint similarity in [0, 1].
 *
 * <pre>
 * 0.45 * nucleus equal + 0.35 * actor Jaccard + 0.20 * action Jaccard
 * + 0.03 tie-breaker when the nuclei match exactly
 * </pre>
 */
@Component
@RequiredArgsConstructor
public class FingerprintSimilarity {

    private final NarrativeProperties properties;

    public double calculate(NarrativeFingerprint a, NarrativeFingerprint b) {
        if (a == null || b == null || !a.isValid() || !b.isValid()) {
            return 0.0;
        }
        NarrativeProperties.Similarity weights = properties.getSimilarity();

        String nucleusA = a.getNucleusEntity().trim();
        String nucleusB = b.getNucleusEntity().trim();

        boolean sameNucleus = nucleusA.equals(nucleusB);

        double score = 0.0;
        if (sameNucleus) {
            score += weights.getNucleusWeight() + weights.getExactNucleusBonus();
        }
        score += weights.getActorWeight() * jaccard(a.getTopActors().keySet(), b.getTopActors().keySet());
        score += weights.getActionWeight() * jaccard(lower(a.getKeyActions()), lower(b.getKeyActions()));
        return Math.max(0.0, Math.min(1.0, score));
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 0.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    private static Set<String> lower(List<String> values) {
        return values.stream()
                .map(value -> value.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }
}
