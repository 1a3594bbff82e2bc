package com.storyline.narrative.service;

import com.storyline.narrative.config.NarrativeProperties;
import com.storyline.narrative.entity.Narrative;
import com.storyline.narrative.entity.SummaryTaskStatus;
import com.storyline.narrative.entity.SummaryUpdateReason;
import com.storyline.narrative.entity.SummaryUpdateTask;
import com.storyline.narrative.repository.SummaryUpdateTaskRepository;
import com.storyline.narrative.support.NarrativeEngineFixture;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static com.storyline.narrative.support.TestArticles.article;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class SummaryOutboxServiceTest {

    @Mock
    private SummaryUpdateTaskRepository taskRepository;

    private NarrativeEngineFixture fixture;
    private SummaryOutboxService service;

    @BeforeEach
    void setUp() {
        fixture = new NarrativeEngineFixture();
        service = new SummaryOutboxService(taskRepository, fixture.narrativeStore, fixture.articleStore,
                new TemplateSummaryGenerator(fixture.properties), fixture.properties, fixture.clock);
    }

    private static SummaryUpdateTask task(long id, Long narrativeId) {
        return SummaryUpdateTask.builder().id(id).narrativeId(narrativeId).reason(SummaryUpdateReason.ARTICLES_ADDED).build();
    }

    @Test
    @DisplayName("대기 작업이 없으면 아무것도 하지 않는다")
    void noPendingTasks() {
        when(taskRepository.findByStatusOrderByCreatedAtAsc(eq(SummaryTaskStatus.PENDING), any())).thenReturn(List.of());

        assertThat(service.processPending()).isZero();
        verify(taskRepository, never()).save(any());
    }

    @Test
    @DisplayName("작업을 처리하면 제목과 요약을 새로 만들고 플래그를 내린다")
    void regeneratesTitleAndSummary() {
        Narrative narrative = fixture.seedNarrative(List.of(
                article("s-1").nucleus("SEC").actor("SEC", 5).actor("Ripple", 4).actions("sue")
                        .summary("The SEC sued Ripple.").publishedAt(fixture.now().minusHours(3)).build(),
                article("s-2").nucleus("SEC").actor("SEC", 5).actor("Ripple", 4).actions("sue")
                        .summary("Ripple responds to the SEC lawsuit.").publishedAt(fixture.now().minusHours(1)).build()));
        Narrative stale = fixture.narrativeStore.findById(narrative.getId()).orElseThrow();
        stale.setTitle("old title");
        stale.setNeedsSummaryUpdate(true);
        fixture.narrativeStore.save(stale);

        SummaryUpdateTask task = task(1L, narrative.getId());
        when(taskRepository.findByStatusOrderByCreatedAtAsc(eq(SummaryTaskStatus.PENDING), any())).thenReturn(List.of(task));

        int done = service.processPending();

        assertThat(done).isEqualTo(1);
        assertThat(task.getStatus()).isEqualTo(SummaryTaskStatus.DONE);
        assertThat(task.getProcessedAt()).isEqualTo(fixture.now());
        Narrative updated = fixture.narrativeStore.findById(narrative.getId()).orElseThrow();
        assertThat(updated.getTitle()).isEqualTo("SEC sue (Ripple)");
        assertThat(updated.getSummary()).isEqualTo("Ripple responds to the SEC lawsuit.");
        assertThat(updated.isNeedsSummaryUpdate()).isFalse();
        verify(taskRepository).save(task);
    }

    @Test
    @DisplayName("병합으로 사라진 narrative의 작업은 그냥 닫는다")
    void closesTaskOfVanishedNarrative() {
        SummaryUpdateTask task = task(2L, 999L);
        when(taskRepository.findByStatusOrderByCreatedAtAsc(eq(SummaryTaskStatus.PENDING), any())).thenReturn(List.of(task));

        assertThat(service.processPending()).isEqualTo(1);
        assertThat(task.getStatus()).isEqualTo(SummaryTaskStatus.DONE);
    }

    @Test
    @DisplayName("생성기가 실패하면 재시도 횟수를 올리고, 한도에 이르면 FAILED")
    void failuresAreRetriedThenMarkedFailed() {
        Narrative narrative = fixture.seedNarrative(List.of(
                article("s-1").nucleus("SEC").actor("SEC", 5).publishedAt(fixture.now().minusHours(1)).build()));
        SummaryGenerator broken = mock(SummaryGenerator.class);
        when(broken.generate(any(), any())).thenThrow(new IllegalStateException("generator down"));
        NarrativeProperties properties = fixture.properties;
        properties.getSummary().setMaxAttempts(2);
        SummaryOutboxService failing = new SummaryOutboxService(taskRepository, fixture.narrativeStore,
                fixture.articleStore, broken, properties, fixture.clock);

        SummaryUpdateTask task = task(3L, narrative.getId());
        when(taskRepository.findByStatusOrderByCreatedAtAsc(eq(SummaryTaskStatus.PENDING), any())).thenReturn(List.of(task));

        assertThat(failing.processPending()).isZero();
        assertThat(task.getStatus()).isEqualTo(SummaryTaskStatus.PENDING);
        assertThat(task.getAttempts()).isEqualTo(1);
        assertThat(task.getLastError()).isEqualTo("generator down");

        failing.processPending();
        assertThat(task.getStatus()).isEqualTo(SummaryTaskStatus.FAILED);
        verify(taskRepository, times(2)).save(task);
    }
}
