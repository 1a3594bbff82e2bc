package com.storyline.narrative.service;

import com.storyline.narrative.config.NarrativeProperties;
import com.storyline.narrative.entity.NarrativeFingerprint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.storyline.narrative.support.TestArticles.article;
import static org.assertj.core.api.Assertions.assertThat;

class TemplateSummaryGeneratorTest {

    private final TemplateSummaryGenerator generator = new TemplateSummaryGenerator(new NarrativeProperties());

    private static NarrativeFingerprint fingerprint(List<String> actions, String... actors) {
        Map<String, Double> top = new LinkedHashMap<>();
        double salience = 5.0;
        for (String actor : actors) {
            top.put(actor, salience--);
        }
        return NarrativeFingerprint.builder().nucleusEntity("SEC").topActors(top).keyActions(actions).build();
    }

    @Test
    @DisplayName("제목은 nucleus, 대표 행동, nucleus를 제외한 상위 행위자 2명")
    void titleFromFingerprint() {
        SummaryGenerator.GeneratedSummary text = generator.generate(
                fingerprint(List.of("sue", "settle"), "SEC", "Ripple", "Coinbase", "Kraken"), List.of());

        assertThat(text.title()).isEqualTo("SEC sue (Ripple, Coinbase)");
    }

    @Test
    @DisplayName("기사 요약이 없으면 기사 수로 요약을 만든다")
    void fallbackSummary() {
        SummaryGenerator.GeneratedSummary text = generator.generate(
                fingerprint(List.of(), "SEC", "Ripple"),
                List.of(article("a-1").nucleus("SEC").build(), article("a-2").nucleus("SEC").build()));

        assertThat(text.title()).isEqualTo("SEC (Ripple)");
        assertThat(text.summary()).isEqualTo("2 articles about SEC involving Ripple.");
    }
}
