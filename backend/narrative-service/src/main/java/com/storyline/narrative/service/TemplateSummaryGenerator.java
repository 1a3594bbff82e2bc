package com.storyline.narrative.service;

import com.storyline.narrative.config.NarrativeProperties;
import com.storyline.narrative.entity.ArticleRecord;
import com.storyline.narrative.entity.NarrativeFingerprint;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;

/**
 * Builds narrative text from the fingerprint and the newest article summary, without an LLM call.
 */
@Component
@RequiredArgsConstructor
public class TemplateSummaryGenerator implements SummaryGenerator {

    private final NarrativeProperties properties;

    @Override
    public GeneratedSummary generate(NarrativeFingerprint fingerprint, List<ArticleRecord> articles) {
        String nucleus = fingerprint.getNucleusEntity();
        List<String> others = fingerprint.getTopActors().keySet().stream()
                .filter(actor -> !actor.equalsIgnoreCase(nucleus))
                .limit(properties.getSummary().getMaxActorsInTitle())
                .toList();

        StringBuilder title = new StringBuilder(nucleus);
        if (!fingerprint.getKeyActions().isEmpty()) {
            title.append(' ').append(fingerprint.getKeyActions().get(0));
        }
        if (!others.isEmpty()) {
            title.append(" (").append(String.join(", ", others)).append(')');
        }

        String summary = articles.stream()
                .filter(article -> article.getExtraction() != null)
                .filter(article -> article.getExtraction().getSummary() != null
                        && !article.getExtraction().getSummary().isBlank())
                .max(Comparator.comparing(ArticleRecord::getPublishedAt))
                .map(article -> article.getExtraction().getSummary().trim())
                .orElseGet(() -> fallbackSummary(nucleus, others, articles.size()));

        return new GeneratedSummary(title.toString(), summary);
    }

    private static String fallbackSummary(String nucleus, List<String> others, int articleCount) {
        String involving = others.isEmpty() ? "" : " involving " + String.join(", ", others);
        return String.format("%d %s about %s%s.",
                articleCount, articleCount == 1 ? "article" : "articles", nucleus, involving);
    }
}
