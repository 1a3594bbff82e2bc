package com.storyline.narrative.service.extraction;

import com.storyline.narrative.client.EntityExtractionClient;
import com.storyline.narrative.config.NarrativeProperties;
import com.storyline.narrative.entity.ArticleRecord;
import com.storyline.narrative.entity.ExtractionResult;
import com.storyline.narrative.entity.ExtractionStatus;
import com.storyline.narrative.exception.ExtractionException;
import com.storyline.narrative.support.InMemoryArticleStore;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ExtractionBatchServiceTest {

    private final InMemoryArticleStore articleStore = new InMemoryArticleStore();
    private final EntityExtractionClient client = mock(EntityExtractionClient.class);
    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final NarrativeProperties properties = new NarrativeProperties();
    private ExtractionBatchService service;

    private final ExtractionResult secResult = ExtractionResult.builder()
            .nucleusEntity("SEC")
            .actors(List.of())
            .actions(List.of("sue"))
            .tensions(List.of())
            .summary("The SEC sued Ripple.")
            .build();

    @BeforeEach
    void setUp() {
        properties.getExtraction().setRetryBackoffMs(1);
        properties.getExtraction().setMaxRetries(3);
        properties.getExtraction().setMaxAttempts(2);
        properties.getExtraction().setConcurrency(2);
        service = new ExtractionBatchService(articleStore, client, properties, meterRegistry);
    }

    private static ArticleRecord pending(String id) {
        return ArticleRecord.builder()
                .externalId(id)
                .title("Article " + id)
                .source("Reuters")
                .publishedAt(LocalDateTime.of(2025, 3, 10, 9, 0))
                .build();
    }

    @Test
    @DisplayName("추출 결과를 저장하고 상태를 EXTRACTED로 바꾼다")
    void storesExtraction() {
        articleStore.put(pending("a-1"), pending("a-2"));
        when(client.extract(any())).thenReturn(Mono.just(secResult));

        ExtractionBatchReport report = service.processPending();

        assertThat(report).isEqualTo(new ExtractionBatchReport(2, 2, 0));
        ArticleRecord stored = articleStore.get("a-1");
        assertThat(stored.getExtractionStatus()).isEqualTo(ExtractionStatus.EXTRACTED);
        assertThat(stored.getExtraction().getNucleusEntity()).isEqualTo("SEC");
        assertThat(stored.getExtractionAttempts()).isEqualTo(1);
        assertThat(articleStore.findPendingForClustering(10)).hasSize(2);
        assertThat(meterRegistry.counter("narrative.extraction.articles", "outcome", "extracted").count()).isEqualTo(2.0);
    }

    @Test
    @DisplayName("rate limit은 backoff 후 재시도해서 성공한다")
    void retriesRateLimit() {
        articleStore.put(pending("a-1"));
        AtomicInteger calls = new AtomicInteger();
        when(client.extract(any())).thenReturn(Mono.defer(() -> calls.incrementAndGet() == 1
                ? Mono.error(ExtractionException.rateLimited("a-1"))
                : Mono.just(secResult)));

        ExtractionBatchReport report = service.processPending();

        assertThat(report.extracted()).isEqualTo(1);
        assertThat(calls.get()).isEqualTo(2);
        assertThat(articleStore.get("a-1").getExtractionStatus()).isEqualTo(ExtractionStatus.EXTRACTED);
    }

    @Test
    @DisplayName("다른 오류는 재시도하지 않고 시도 횟수만 올린다. 한도에 이르면 FAILED")
    void failuresCountAttempts() {
        articleStore.put(pending("a-1"), pending("a-2"));
        AtomicInteger calls = new AtomicInteger();
        when(client.extract(argThat(article -> article != null && "a-1".equals(article.getExternalId()))))
                .thenReturn(Mono.defer(() -> {
                    calls.incrementAndGet();
                    return Mono.error(new IllegalStateException("model overloaded"));
                }));
        when(client.extract(argThat(article -> article != null && "a-2".equals(article.getExternalId()))))
                .thenReturn(Mono.just(secResult));

        ExtractionBatchReport first = service.processPending();

        assertThat(first).isEqualTo(new ExtractionBatchReport(2, 1, 1));
        assertThat(calls.get()).isEqualTo(1);
        ArticleRecord failedOnce = articleStore.get("a-1");
        assertThat(failedOnce.getExtractionStatus()).isEqualTo(ExtractionStatus.PENDING);
        assertThat(failedOnce.getExtractionAttempts()).isEqualTo(1);
        assertThat(failedOnce.getLastExtractionError()).isEqualTo("model overloaded");

        service.processPending();

        ArticleRecord failed = articleStore.get("a-1");
        assertThat(failed.getExtractionStatus()).isEqualTo(ExtractionStatus.FAILED);
        assertThat(failed.getExtractionAttempts()).isEqualTo(2);
        assertThat(articleStore.findPendingExtraction(10, 2)).isEmpty();
    }

    @Test
    @DisplayName("비활성화되어 있으면 클라이언트를 호출하지 않는다")
    void disabled() {
        properties.getExtraction().setEnabled(false);
        articleStore.put(pending("a-1"));

        assertThat(service.processPending()).isEqualTo(ExtractionBatchReport.empty());
        verify(client, never()).extract(any());
    }
}
