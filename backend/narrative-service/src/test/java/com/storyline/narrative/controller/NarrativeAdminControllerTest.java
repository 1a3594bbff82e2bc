package com.storyline.narrative.controller;

import com.storyline.narrative.dto.IntegrityReport;
import com.storyline.narrative.service.CycleReport;
import com.storyline.narrative.service.DeduplicationReport;
import com.storyline.narrative.service.NarrativeCycleService;
import com.storyline.narrative.service.NarrativeDeduplicationService;
import com.storyline.narrative.service.NarrativeIntegrityService;
import com.storyline.narrative.service.lifecycle.NarrativeLifecycleService;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.reactive.WebFluxTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.reactive.server.WebTestClient;

import java.util.List;
import java.util.Map;

import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@WebFluxTest(controllers = NarrativeAdminController.class)
@ActiveProfiles("test")
class NarrativeAdminControllerTest {

    @Autowired
    private WebTestClient webTestClient;

    @MockBean
    private NarrativeCycleService cycleService;

    @MockBean
    private NarrativeDeduplicationService deduplicationService;

    @MockBean
    private NarrativeLifecycleService lifecycleService;

    @MockBean
    private NarrativeIntegrityService integrityService;

    @Test
    @DisplayName("POST /cycle - 사이클 결과를 반환")
    void runCycle() {
        when(cycleService.runCycle()).thenReturn(new CycleReport(5, 2, 1, 1, 0, 0, 12L));

        webTestClient.post().uri("/api/v1/narratives/admin/cycle")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.created").isEqualTo(1)
                .jsonPath("$.extended").isEqualTo(1);

        verify(cycleService).runCycle();
    }

    @Test
    @DisplayName("POST /dedup - 병합/보류 건수를 반환")
    void runDedup() {
        when(deduplicationService.deduplicate()).thenReturn(new DeduplicationReport(3, 1, 3, 1, 2, 0, 5L));

        webTestClient.post().uri("/api/v1/narratives/admin/dedup")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.merged").isEqualTo(1)
                .jsonPath("$.deferred").isEqualTo(2);
    }

    @Test
    @DisplayName("POST /lifecycle-refresh - 변경 건수를 반환")
    void refreshLifecycle() {
        when(lifecycleService.refreshAll()).thenReturn(4);

        webTestClient.post().uri("/api/v1/narratives/admin/lifecycle-refresh")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.success").isEqualTo(true)
                .jsonPath("$.changed").isEqualTo(4);
    }

    @Test
    @DisplayName("GET /integrity - 문제 목록을 보고")
    void validateIntegrity() {
        when(integrityService.validate()).thenReturn(
                new IntegrityReport(2, List.of(), List.of(7L), List.of(), Map.of(8L, 2), 0));

        webTestClient.get().uri("/api/v1/narratives/admin/integrity")
                .exchange()
                .expectStatus().isOk()
                .expectBody()
                .jsonPath("$.totalNarratives").isEqualTo(2)
                .jsonPath("$.reversedTimestamps[0]").isEqualTo(7)
                .jsonPath("$.danglingReferences['8']").isEqualTo(2);
    }

    @Test
    @DisplayName("서비스 오류는 500 공통 에러 응답")
    void unexpectedErrorIs500() {
        when(integrityService.repair()).thenThrow(new IllegalStateException("db down"));

        webTestClient.post().uri("/api/v1/narratives/admin/integrity")
                .exchange()
                .expectStatus().is5xxServerError()
                .expectBody()
                .jsonPath("$.error").isEqualTo("INTERNAL_ERROR");
    }
}
