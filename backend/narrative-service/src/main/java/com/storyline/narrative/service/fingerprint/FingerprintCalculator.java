package com.storyline.narrative.service.fingerprint;

import com.storyline.narrative.config.NarrativeProperties;
import com.storyline.narrative.entity.NarrativeFingerprint;
import com.storyline.narrative.exception.DenyListedEntityException;
import com.storyline.narrative.exception.FingerprintValidationException;
import com.storyline.narrative.service.cluster.ArticleCluster;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Computes narrative fingerprints: nucleus, top 5 actors by salience and top 3 distinct actions.
 */
@Component
@RequiredArgsConstructor
public class FingerprintCalculator {

    private final NarrativeProperties properties;
    private final Clock clock;

    public NarrativeFingerprint compute(ArticleCluster cluster) {
        return compute(cluster.nucleusEntity(), cluster.actorSalience(), cluster.actions());
    }

    /**
     * @param actorSalience aggregated salience per actor
     * @param actions       candidate actions, most important first
     * @throws FingerprintValidationException when the nucleus is empty
     * @throws DenyListedEntityException      when the nucleus is on the deny-list
     */
    public NarrativeFingerprint compute(String nucleus, Map<String, Double> actorSalience, List<String> actions) {
        if (nucleus == null || nucleus.isBlank()) {
            throw FingerprintValidationException.emptyNucleus();
        }
        String trimmed = nucleus.trim();
        if (isDenyListed(trimmed)) {
            throw new DenyListedEntityException(trimmed);
        }

        return NarrativeFingerprint.builder()
                .nucleusEntity(trimmed)
                .topActors(topActors(actorSalience))
                .keyActions(topActions(actions))
                .computedAt(LocalDateTime.now(clock))
                .build();
    }

    public boolean isDenyListed(String entity) {
        if (entity == null) {
            return false;
        }
        String normalized = entity.trim();
        return properties.getDenyList().getEntities().stream()
                .anyMatch(denied -> denied.trim().equalsIgnoreCase(normalized));
    }

    private static Map<String, Double> topActors(Map<String, Double> actorSalience) {
        Map<String, Double> top = new LinkedHashMap<>();
        if (actorSalience == null) {
            return top;
        }
        actorSalience.entrySet().stream()
                .filter(e -> e.getKey() != null && !e.getKey().isBlank() && e.getValue() != null)
                .sorted(Map.Entry.<String, Double>comparingByValue(Comparator.reverseOrder())
                        .thenComparing(Map.Entry.comparingByKey()))
                .limit(NarrativeFingerprint.MAX_ACTORS)
                .forEach(e -> top.put(e.getKey(), e.getValue()));
        return top;
    }

    private static List<String> topActions(List<String> actions) {
        List<String> top = new ArrayList<>();
        if (actions == null) {
            return top;
        }
        Set<String> seen = new HashSet<>();
        for (String action : actions) {
            if (action == null || action.isBlank()) {
                continue;
            }
            String trimmed = action.trim();
            if (seen.add(trimmed.toLowerCase(Locale.ROOT))) {
                top.add(trimmed);
            }
            if (top.size() == NarrativeFingerprint.MAX_ACTIONS) {
                break;
            }
        }
        return top;
    }
}
