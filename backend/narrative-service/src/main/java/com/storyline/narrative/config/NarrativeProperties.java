package com.storyline.narrative.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Tunables for narrative clustering, matching and lifecycle tracking.
 *
 * Scores range from 0.0 to 1.0. Windows are expressed in days or hours as named.
 * Every value has a working default so the engine runs with an empty config.
 */
@Configuration
@ConfigurationProperties(prefix = "narrative")
@Data
public class NarrativeProperties {

    private Clustering clustering = new Clustering();

    private Similarity similarity = new Similarity();

    private Matching matching = new Matching();

    private Lifecycle lifecycle = new Lifecycle();

    private Dedup dedup = new Dedup();

    private DenyList denyList = new DenyList();

    private Extraction extraction = new Extraction();

    private Summary summary = new Summary();

    private Schedule schedule = new Schedule();

    @Data
    public static class Clustering {
        /** Minimum overlap for an article to join an existing sub-cluster */
        private double groupingThreshold = 0.30;

        /** Weight of salience-weighted actor overlap */
        private double actorWeight = 0.7;

        /** Weight of tension overlap */
        private double tensionWeight = 0.3;

        /** Max articles pulled per cycle */
        private int batchSize = 500;
    }

    @Data
    public static class Similarity {
        private double nucleusWeight = 0.45;
        private double actorWeight = 0.35;
        private double actionWeight = 0.20;

        /**
         * Tie-breaker added on an exact nucleus match. Keep it below
         * {@code matching.recentThreshold - nucleusWeight} so a shared nucleus alone never matches.
         */
        private double exactNucleusBonus = 0.03;
    }

    @Data
    public static class Matching {
        /** Narratives updated within this many days are candidates */
        private int slidingWindowDays = 14;

        private double baseThreshold = 0.6;

        /** Threshold for narratives updated within {@link #recentHours} */
        private double recentThreshold = 0.5;

        private int recentHours = 48;

        /** Dormant narratives updated within this many days may be reactivated */
        private int reactivationWindowDays = 30;

        /** Threshold for dormant candidates outside the sliding window */
        private double reactivationThreshold = 0.80;
    }

    @Data
    public static class Lifecycle {
        private int velocityWindowDays = 7;
        private int coolingDays = 3;
        private int dormantDays = 7;
        private int hotArticleCount = 7;
        private double hotVelocity = 3.0;
        private double risingVelocity = 1.5;

        /** Articles within the pulse window needed for a reawakening */
        private int reactivationArticles = 4;
        private int reactivationPulseHours = 48;

        /** Max articles in the last 24h for an echo */
        private int echoMaxArticles = 3;

        private double growingRatio = 1.3;
        private double decliningRatio = 0.7;
        private int momentumMinArticles = 3;
    }

    @Data
    public static class Dedup {
        private boolean enabled = true;
    }

    @Data
    public static class DenyList {
        /** Nucleus entities that never form a narrative (compared ignoring case) */
        private List<String> entities = new ArrayList<>();

        /** Article sources excluded from clustering (compared ignoring case) */
        private List<String> sources = new ArrayList<>();
    }

    @Data
    public static class Extraction {
        private boolean enabled = true;
        private int batchSize = 50;
        private int concurrency = 4;
        private int timeoutSeconds = 60;
        private int maxRetries = 3;
        private long retryBackoffMs = 2000;
        private int maxAttempts = 3;
    }

    @Data
    public static class Summary {
        private int batchSize = 50;
        private int maxAttempts = 3;
        private int maxActorsInTitle = 2;
    }

    @Data
    public static class Schedule {
        private boolean cycleEnabled = true;
        private boolean dedupEnabled = true;
        private boolean lifecycleRefreshEnabled = true;
        private boolean summaryEnabled = true;
    }
}
