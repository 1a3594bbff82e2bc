package com.storyline.narrative.service.cluster;

import com.storyline.narrative.config.NarrativeProperties;
import com.storyline.narrative.entity.ArticleRecord;
import com.storyline.narrative.entity.ExtractedActor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Groups extracted articles into candidate narrative clusters.
 *
 * Articles are first grouped by exact nucleus. Each group is then split greedily by
 * salience-weighted actor overlap and tension overlap, so two unrelated stories about
 * the same entity end up in different clusters.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ClusterBuilder {

    private static final Comparator<ArticleRecord> ARTICLE_ORDER =
            Comparator.comparing(ArticleRecord::getPublishedAt)
                    .thenComparing(ArticleRecord::getExternalId);

    private final NarrativeProperties properties;

    public ClusterBuildResult build(List<ArticleRecord> articles) {
        List<ArticleRecord> excluded = new ArrayList<>();
        Map<String, List<ArticleRecord>> byNucleus = new LinkedHashMap<>();

        List<ArticleRecord> ordered = articles.stream().sorted(ARTICLE_ORDER).toList();
        for (ArticleRecord article : ordered) {
            String nucleus = article.nucleus();
            if (nucleus == null) {
                log.warn("Skipping article without nucleus entity: {}", article.getExternalId());
                excluded.add(article);
                continue;
            }
            if (isDenyListedSource(article.getSource())) {
                log.warn("Skipping article from deny-listed source: id={}, source={}",
                        article.getExternalId(), article.getSource());
                excluded.add(article);
                continue;
            }
            byNucleus.computeIfAbsent(nucleus, k -> new ArrayList<>()).add(article);
        }

        List<ArticleCluster> clusters = new ArrayList<>();
        for (List<ArticleRecord> group : byNucleus.values()) {
            for (List<ArticleRecord> members : subdivide(group)) {
                clusters.add(aggregate(members, null));
            }
        }
        clusters.sort(Comparator.comparing(ArticleCluster::earliestPublished)
                .thenComparing(ArticleCluster::anchorArticleId));

        log.info("Built {} clusters from {} articles ({} excluded)",
                clusters.size(), articles.size(), excluded.size());
        return new ClusterBuildResult(clusters, excluded);
    }

    /**
     * Aggregates articles into one cluster.
     *
     * @param preferredNucleus nucleus that wins a tied vote, may be null
     */
    public ArticleCluster aggregate(List<ArticleRecord> members, String preferredNucleus) {
        List<ArticleRecord> ordered = members.stream().sorted(ARTICLE_ORDER).toList();
        if (ordered.isEmpty()) {
            throw new IllegalArgumentException("Cannot aggregate an empty article list");
        }

        return new ArticleCluster(
                majorityNucleus(ordered, preferredNucleus),
                ordered,
                averageActorSalience(ordered),
                rankActions(ordered),
                ordered.get(0).getPublishedAt(),
                ordered.stream().map(ArticleRecord::getPublishedAt).max(LocalDateTime::compareTo).orElseThrow()
        );
    }

    // 탐욕적 분할: 가장 잘 맞는 하위 클러스터에 합류, 임계값 미만이면 새로 시작
    private List<List<ArticleRecord>> subdivide(List<ArticleRecord> group) {
        List<SubCluster> subClusters = new ArrayList<>();
        double threshold = properties.getClustering().getGroupingThreshold();

        for (ArticleRecord article : group) {
            Map<String, Double> actors = actorProfile(article);
            Set<String> tensions = normalized(article.getExtraction().getTensions());

            SubCluster best = null;
            double bestScore = -1.0;
            for (SubCluster candidate : subClusters) {
                double score = overlap(actors, tensions, candidate.actorProfile(), candidate.tensions);
                if (score > bestScore) {
                    bestScore = score;
                    best = candidate;
                }
            }

            if (best != null && bestScore >= threshold) {
                best.add(article, actors, tensions);
            } else {
                SubCluster created = new SubCluster();
                created.add(article, actors, tensions);
                subClusters.add(created);
            }
        }
        return subClusters.stream().map(sub -> sub.members).toList();
    }

    double overlap(Map<String, Double> actorsA, Set<String> tensionsA,
                   Map<String, Double> actorsB, Set<String> tensionsB) {
        double actorScore = weightedJaccard(actorsA, actorsB);
        if (tensionsA.isEmpty() && tensionsB.isEmpty()) {
            return actorScore;
        }
        NarrativeProperties.Clustering config = properties.getClustering();
        return config.getActorWeight() * actorScore + config.getTensionWeight() * jaccard(tensionsA, tensionsB);
    }

    static double weightedJaccard(Map<String, Double> a, Map<String, Double> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        Set<String> keys = new HashSet<>(a.keySet());
        keys.addAll(b.keySet());
        double minSum = 0.0;
        double maxSum = 0.0;
        for (String key : keys) {
            double x = a.getOrDefault(key, 0.0);
            double y = b.getOrDefault(key, 0.0);
            minSum += Math.min(x, y);
            maxSum += Math.max(x, y);
        }
        return maxSum == 0.0 ? 0.0 : minSum / maxSum;
    }

    static double jaccard(Set<String> a, Set<String> b) {
        if (a.isEmpty() && b.isEmpty()) {
            return 1.0;
        }
        Set<String> intersection = new HashSet<>(a);
        intersection.retainAll(b);
        Set<String> union = new HashSet<>(a);
        union.addAll(b);
        return (double) intersection.size() / union.size();
    }

    private String majorityNucleus(List<ArticleRecord> ordered, String preferredNucleus) {
        Map<String, Integer> votes = new LinkedHashMap<>();
        for (ArticleRecord article : ordered) {
            String nucleus = article.nucleus();
            if (nucleus != null) {
                votes.merge(nucleus, 1, Integer::sum);
            }
        }
        if (votes.isEmpty()) {
            return preferredNucleus;
        }
        int top = votes.values().stream().max(Integer::compareTo).orElse(0);
        if (preferredNucleus != null && votes.getOrDefault(preferredNucleus, 0) == top) {
            return preferredNucleus;
        }
        // 동률이면 먼저 등장한 nucleus
        return votes.entrySet().stream()
                .filter(e -> e.getValue() == top)
                .map(Map.Entry::getKey)
                .findFirst()
                .orElse(preferredNucleus);
    }

    private Map<String, Double> averageActorSalience(List<ArticleRecord> ordered) {
        Map<String, double[]> totals = new LinkedHashMap<>();
        for (ArticleRecord article : ordered) {
            for (Map.Entry<String, Integer> entry : actorsOf(article).entrySet()) {
                double[] acc = totals.computeIfAbsent(entry.getKey(), k -> new double[2]);
                acc[0] += entry.getValue();
                acc[1] += 1;
            }
        }
        Map<String, Double> averaged = new LinkedHashMap<>();
        totals.forEach((name, acc) -> averaged.put(name, Math.round(acc[0] / acc[1] * 10.0) / 10.0));
        return averaged;
    }

    private List<String> rankActions(List<ArticleRecord> ordered) {
        Map<String, String> spelling = new LinkedHashMap<>();
        Map<String, Integer> counts = new HashMap<>();
        for (ArticleRecord article : ordered) {
            List<String> actions = article.getExtraction() == null ? null : article.getExtraction().getActions();
            if (actions == null) {
                continue;
            }
            for (String action : actions) {
                if (action == null || action.isBlank()) {
                    continue;
                }
                String key = action.trim().toLowerCase(Locale.ROOT);
                spelling.putIfAbsent(key, action.trim());
                counts.merge(key, 1, Integer::sum);
            }
        }
        List<String> keys = new ArrayList<>(spelling.keySet());
        // stable sort keeps first-appearance order among equal counts
        keys.sort(Comparator.comparing((String key) -> counts.get(key)).reversed());
        return keys.stream().map(spelling::get).collect(Collectors.toList());
    }

    /**
     * One entry per actor name; the highest salience wins when an article repeats an actor.
     */
    private static Map<String, Integer> actorsOf(ArticleRecord article) {
        Map<String, Integer> actors = new LinkedHashMap<>();
        List<ExtractedActor> extracted = article.getExtraction() == null ? null : article.getExtraction().getActors();
        if (extracted == null) {
            return actors;
        }
        extracted.stream()
                .filter(Objects::nonNull)
                .filter(actor -> actor.getName() != null && !actor.getName().isBlank())
                .forEach(actor -> actors.merge(actor.getName().trim(), actor.effectiveSalience(), Math::max));
        return actors;
    }

    private static Map<String, Double> actorProfile(ArticleRecord article) {
        Map<String, Double> profile = new HashMap<>();
        actorsOf(article).forEach((name, salience) ->
                profile.merge(name.toLowerCase(Locale.ROOT), salience.doubleValue(), Math::max));
        return profile;
    }

    private static Set<String> normalized(List<String> values) {
        if (values == null) {
            return Set.of();
        }
        return values.stream()
                .filter(value -> value != null && !value.isBlank())
                .map(value -> value.trim().toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());
    }

    private boolean isDenyListedSource(String source) {
        if (source == null) {
            return false;
        }
        String normalizedSource = source.trim();
        return properties.getDenyList().getSources().stream()
                .anyMatch(denied -> denied.equalsIgnoreCase(normalizedSource));
    }

    private static final class SubCluster {
        private final List<ArticleRecord> members = new ArrayList<>();
        private final Map<String, double[]> salienceTotals = new HashMap<>();
        private final Set<String> tensions = new HashSet<>();

        void add(ArticleRecord article, Map<String, Double> actors, Set<String> articleTensions) {
            members.add(article);
            actors.forEach((name, salience) -> {
                double[] acc = salienceTotals.computeIfAbsent(name, k -> new double[2]);
                acc[0] += salience;
                acc[1] += 1;
            });
            tensions.addAll(articleTensions);
        }

        Map<String, Double> actorProfile() {
            Map<String, Double> profile = new HashMap<>();
            salienceTotals.forEach((name, acc) -> profile.put(name, acc[0] / acc[1]));
            return profile;
        }
    }
}
