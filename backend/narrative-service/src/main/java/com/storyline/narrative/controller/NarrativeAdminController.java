package com.storyline.narrative.controller;

import com.storyline.narrative.dto.IntegrityReport;
import com.storyline.narrative.service.CycleReport;
import com.storyline.narrative.service.DeduplicationReport;
import com.storyline.narrative.service.NarrativeCycleService;
import com.storyline.narrative.service.NarrativeDeduplicationService;
import com.storyline.narrative.service.NarrativeIntegrityService;
import com.storyline.narrative.service.lifecycle.NarrativeLifecycleService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.util.Map;

/**
 * 관리자용 수동 실행 API. 작업은 blocking이므로 boundedElastic에서 실행한다.
 */
@RestController
@RequestMapping("/api/v1/narratives/admin")
@RequiredArgsConstructor
@Slf4j
@Tag(name = "Narrative Admin", description = "사이클/중복 병합/라이프사이클/무결성 수동 실행 API")
public class NarrativeAdminController {

    private final NarrativeCycleService cycleService;
    private final NarrativeDeduplicationService deduplicationService;
    private final NarrativeLifecycleService lifecycleService;
    private final NarrativeIntegrityService integrityService;

    @PostMapping("/cycle")
    @Operation(summary = "내러티브 사이클 실행", description = "대기 중인 기사를 클러스터링하고 내러티브에 병합하거나 새로 생성합니다.")
    public Mono<ResponseEntity<CycleReport>> runCycle() {
        log.info("Manual narrative cycle requested");
        return Mono.fromCallable(cycleService::runCycle)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/dedup")
    @Operation(summary = "중복 내러티브 병합", description = "같은 핵심 엔티티를 가진 유사 내러티브를 병합합니다.")
    public Mono<ResponseEntity<DeduplicationReport>> runDeduplication() {
        log.info("Manual dedup requested");
        return Mono.fromCallable(deduplicationService::deduplicate)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/lifecycle-refresh")
    @Operation(summary = "라이프사이클 재평가", description = "최근 내러티브의 상태, 속도, 모멘텀을 다시 계산합니다.")
    public Mono<ResponseEntity<Map<String, Object>>> refreshLifecycle() {
        log.info("Manual lifecycle refresh requested");
        return Mono.fromCallable(lifecycleService::refreshAll)
                .subscribeOn(Schedulers.boundedElastic())
                .map(changed -> ResponseEntity.ok(Map.<String, Object>of("success", true, "changed", changed)));
    }

    @GetMapping("/integrity")
    @Operation(summary = "무결성 검사", description = "빈 핵심 엔티티, 역전된 타임스탬프, 기사 수 불일치, 끊어진 참조를 보고합니다.")
    public Mono<ResponseEntity<IntegrityReport>> validateIntegrity() {
        return Mono.fromCallable(integrityService::validate)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }

    @PostMapping("/integrity")
    @Operation(summary = "무결성 복구", description = "타임스탬프와 기사 수를 재계산하고 끊어진 참조를 제거합니다.")
    public Mono<ResponseEntity<IntegrityReport>> repairIntegrity() {
        log.info("Manual integrity repair requested");
        return Mono.fromCallable(integrityService::repair)
                .subscribeOn(Schedulers.boundedElastic())
                .map(ResponseEntity::ok);
    }
}
