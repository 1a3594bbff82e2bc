package com.storyline.narrative.service;

import com.storyline.narrative.dto.NarrativeDetailDto;
import com.storyline.narrative.dto.NarrativeSummaryDto;
import com.storyline.narrative.dto.NarrativeTimelineDto;
import com.storyline.narrative.entity.ArticleRecord;
import com.storyline.narrative.entity.LifecycleState;
import com.storyline.narrative.entity.MergeTrigger;
import com.storyline.narrative.entity.Narrative;
import com.storyline.narrative.entity.NarrativeFingerprint;
import com.storyline.narrative.exception.NarrativeNotFoundException;
import com.storyline.narrative.support.NarrativeEngineFixture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static com.storyline.narrative.support.TestArticles.article;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class NarrativeQueryServiceTest {

    private final NarrativeEngineFixture fixture = new NarrativeEngineFixture();

    private static ArticleRecord sec(String id, LocalDateTime publishedAt, String actor) {
        return article(id).nucleus("SEC").actor("SEC", 5).actor(actor, 3).actions("sue").publishedAt(publishedAt).build();
    }

    @Nested
    @DisplayName("목록 조회")
    class Lists {

        @Test
        @DisplayName("active 목록은 활성 상태만, 최근 갱신 순으로 돌려준다")
        void activeNewestFirst() {
            Narrative older = fixture.seedNarrative(List.of(sec("o-1", fixture.now().minusHours(20), "Ripple")));
            Narrative newer = fixture.seedNarrative(List.of(sec("n-1", fixture.now().minusHours(2), "Coinbase")));
            fixture.seedNarrative(List.of(sec("d-1", fixture.now().minusDays(20), "Kraken")));

            List<NarrativeSummaryDto> active = fixture.queryService.getActive(10, null);

            assertThat(active).extracting(NarrativeSummaryDto::id).containsExactly(newer.getId(), older.getId());
            assertThat(fixture.queryService.getActive(1, LifecycleState.EMERGING)).hasSize(1);
        }

        @Test
        @DisplayName("active 필터에 휴면 상태를 주면 IllegalArgumentException")
        void rejectsRestingStateFilter() {
            assertThatThrownBy(() -> fixture.queryService.getActive(10, LifecycleState.DORMANT))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("archived 목록은 기간 안에 갱신된 DORMANT narrative")
        void archivedWithinDays() {
            Narrative dormant = fixture.seedNarrative(List.of(sec("d-1", fixture.now().minusDays(20), "Kraken")));
            fixture.seedNarrative(List.of(sec("d-2", fixture.now().minusDays(50), "Binance")));

            assertThat(fixture.queryService.getArchived(10, 30))
                    .extracting(NarrativeSummaryDto::id)
                    .containsExactly(dormant.getId());
        }

        @Test
        @DisplayName("fingerprint가 유효하지 않은 narrative는 목록에서 숨긴다")
        void hidesInvalidFingerprints() {
            Narrative visible = fixture.seedNarrative(List.of(sec("v-1", fixture.now().minusHours(1), "Ripple")));
            Narrative hidden = fixture.narrativeStore.findById(visible.getId()).orElseThrow();
            hidden.setId(null);
            hidden.setCreationKey("hidden");
            hidden.setFingerprint(NarrativeFingerprint.builder().nucleusEntity("").build());
            Long hiddenId = fixture.narrativeStore.putRaw(hidden).getId();

            assertThat(fixture.queryService.getActive(10, null))
                    .extracting(NarrativeSummaryDto::id)
                    .containsExactly(visible.getId());
            assertThatThrownBy(() -> fixture.queryService.getDetail(hiddenId))
                    .isInstanceOf(NarrativeNotFoundException.class);
        }

        @Test
        @DisplayName("resurrection 목록은 한 번이라도 재활성화된 narrative")
        void resurrections() {
            Narrative narrative = fixture.seedNarrative(List.of(sec("r-1", fixture.now().minusHours(5), "Ripple")));
            fixture.seedNarrative(List.of(sec("x-1", fixture.now().minusHours(4), "Kraken")));
            Narrative reawakened = fixture.narrativeStore.findById(narrative.getId()).orElseThrow();
            reawakened.setReawakeningCount(1);
            fixture.narrativeStore.save(reawakened);

            assertThat(fixture.queryService.getResurrections(10, 7))
                    .extracting(NarrativeSummaryDto::id)
                    .containsExactly(narrative.getId());
        }
    }

    @Nested
    @DisplayName("상세와 타임라인")
    class DetailAndTimeline {

        @Test
        @DisplayName("없는 narrative는 NarrativeNotFoundException")
        void notFound() {
            assertThatThrownBy(() -> fixture.queryService.getDetail(404L))
                    .isInstanceOf(NarrativeNotFoundException.class)
                    .hasMessageContaining("404");
            assertThatThrownBy(() -> fixture.queryService.getTimeline(404L))
                    .isInstanceOf(NarrativeNotFoundException.class);
        }

        @Test
        @DisplayName("상세에는 fingerprint, history, 병합 이력이 들어간다")
        void detailCarriesProvenance() {
            Narrative primary = fixture.seedNarrative(List.of(
                    sec("p-1", fixture.now().minusHours(3), "Ripple"), sec("p-2", fixture.now().minusHours(2), "Ripple")));
            Narrative secondary = fixture.seedNarrative(List.of(sec("q-1", fixture.now().minusHours(1), "Ripple")));
            fixture.mergeService.mergeNarratives(primary, secondary, 1.0, MergeTrigger.DEDUP, fixture.now());

            NarrativeDetailDto detail = fixture.queryService.getDetail(primary.getId());

            assertThat(detail.fingerprint().nucleusEntity()).isEqualTo("SEC");
            assertThat(detail.articleIds()).containsExactlyInAnyOrder("p-1", "p-2", "q-1");
            assertThat(detail.lifecycleHistory()).isNotEmpty();
            assertThat(detail.mergedFrom()).containsExactly(secondary.getId());
            assertThat(detail.mergeHistory()).singleElement()
                    .satisfies(record -> assertThat(record.mergedNarrativeId()).isEqualTo(secondary.getId()));
        }

        @Test
        @DisplayName("타임라인은 일별 건수, 누적 건수, 엔티티와 7일 속도를 담는다")
        void dailySnapshots() {
            LocalDateTime day1 = LocalDateTime.of(2025, 3, 8, 9, 0);
            LocalDateTime day2 = LocalDateTime.of(2025, 3, 9, 9, 0);
            Narrative narrative = fixture.seedNarrative(List.of(
                    sec("t-1", day1, "Ripple"), sec("t-2", day1.plusHours(3), "Gensler"), sec("t-3", day2, "Ripple")));

            NarrativeTimelineDto timeline = fixture.queryService.getTimeline(narrative.getId());

            assertThat(timeline.narrativeId()).isEqualTo(narrative.getId());
            assertThat(timeline.snapshots()).hasSize(2);
            assertThat(timeline.snapshots().get(0).date()).isEqualTo(LocalDate.of(2025, 3, 8));
            assertThat(timeline.snapshots().get(0).articleCount()).isEqualTo(2);
            assertThat(timeline.snapshots().get(0).entities()).containsExactly("SEC", "Ripple", "Gensler");
            assertThat(timeline.snapshots().get(0).velocity()).isEqualTo(0.29);
            assertThat(timeline.snapshots().get(1).cumulativeCount()).isEqualTo(3);
            assertThat(timeline.snapshots().get(1).velocity()).isEqualTo(0.43);
        }
    }
}
