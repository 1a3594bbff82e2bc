package com.storyline.narrative.controller;

import com.storyline.narrative.dto.NarrativeDetailDto;
import com.storyline.narrative.dto.NarrativeSummaryDto;
import com.storyline.narrative.dto.NarrativeTimelineDto;
import com.storyline.narrative.entity.LifecycleState;
import com.storyline.narrative.service.NarrativeQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

/**
 * Narrative 조회 API
 */
@RestController
@RequestMapping("/api/v1/narratives")
@RequiredArgsConstructor
@Tag(name = "Narratives", description = "내러티브 목록/상세/타임라인 조회 API")
public class NarrativeController {

    private static final int MAX_LIMIT = 200;

    private final NarrativeQueryService queryService;

    /**
     * GET /api/v1/narratives/active - 활성 내러티브 (state 필터 선택)
     */
    @GetMapping("/active")
    @Operation(summary = "활성 내러티브 목록", description = "EMERGING, RISING, HOT, COOLING, REACTIVATED 상태를 최신순으로 반환합니다.")
    public ResponseEntity<List<NarrativeSummaryDto>> getActive(
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(required = false) LifecycleState state) {
        return ResponseEntity.ok(queryService.getActive(clamp(limit), state));
    }

    /**
     * GET /api/v1/narratives/archived - 휴면 내러티브
     */
    @GetMapping("/archived")
    @Operation(summary = "휴면 내러티브 목록", description = "최근 days일 내 갱신된 DORMANT 내러티브를 반환합니다.")
    public ResponseEntity<List<NarrativeSummaryDto>> getArchived(
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "30") int days) {
        return ResponseEntity.ok(queryService.getArchived(clamp(limit), requirePositive(days)));
    }

    /**
     * GET /api/v1/narratives/resurrections - 부활한 내러티브
     */
    @GetMapping("/resurrections")
    @Operation(summary = "부활 내러티브 목록", description = "한 번 이상 재점화된 내러티브를 반환합니다.")
    public ResponseEntity<List<NarrativeSummaryDto>> getResurrections(
            @RequestParam(defaultValue = "50") int limit,
            @RequestParam(defaultValue = "7") int days) {
        return ResponseEntity.ok(queryService.getResurrections(clamp(limit), requirePositive(days)));
    }

    @GetMapping("/{id}")
    @Operation(summary = "내러티브 상세", description = "핑거프린트, 라이프사이클 이력, 병합 이력을 포함합니다.")
    public ResponseEntity<NarrativeDetailDto> getDetail(@PathVariable Long id) {
        return ResponseEntity.ok(queryService.getDetail(id));
    }

    @GetMapping("/{id}/timeline")
    @Operation(summary = "내러티브 타임라인", description = "기사가 있는 날짜별 스냅샷을 반환합니다.")
    public ResponseEntity<NarrativeTimelineDto> getTimeline(@PathVariable Long id) {
        return ResponseEntity.ok(queryService.getTimeline(id));
    }

    private static int clamp(int limit) {
        if (limit < 1) {
            throw new IllegalArgumentException("limit must be positive: " + limit);
        }
        return Math.min(limit, MAX_LIMIT);
    }

    private static int requirePositive(int days) {
        if (days < 1) {
            throw new IllegalArgumentException("days must be positive: " + days);
        }
        return days;
    }
}
