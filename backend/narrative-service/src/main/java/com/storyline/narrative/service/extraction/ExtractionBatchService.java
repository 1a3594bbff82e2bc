package com.storyline.narrative.service.extraction;

import com.storyline.narrative.client.EntityExtractionClient;
import com.storyline.narrative.config.NarrativeProperties;
import com.storyline.narrative.entity.ArticleRecord;
import com.storyline.narrative.entity.ExtractionResult;
import com.storyline.narrative.entity.ExtractionStatus;
import com.storyline.narrative.exception.ExtractionException;
import com.storyline.narrative.store.ArticleStore;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;
import reactor.util.retry.Retry;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs entity extraction for pending articles in bounded parallel batches.
 *
 * Rate limited calls are retried with exponential backoff. Other failures count
 * as an attempt; the article is marked FAILED once attempts reach the maximum.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ExtractionBatchService {

    private final ArticleStore articleStore;
    private final EntityExtractionClient extractionClient;
    private final NarrativeProperties properties;
    private final MeterRegistry meterRegistry;

    public ExtractionBatchReport processPending() {
        NarrativeProperties.Extraction config = properties.getExtraction();
        if (!config.isEnabled()) {
            return ExtractionBatchReport.empty();
        }

        List<ArticleRecord> articles = articleStore.findPendingExtraction(config.getBatchSize(), config.getMaxAttempts());
        if (articles.isEmpty()) {
            return ExtractionBatchReport.empty();
        }

        long startTime = System.currentTimeMillis();
        AtomicInteger extracted = new AtomicInteger();
        AtomicInteger failed = new AtomicInteger();

        Flux.fromIterable(articles)
                .flatMap(article -> extractionClient.extract(article)
                        .timeout(Duration.ofSeconds(config.getTimeoutSeconds()))
                        .retryWhen(Retry.backoff(config.getMaxRetries(), Duration.ofMillis(config.getRetryBackoffMs()))
                                .filter(ExtractionBatchService::isRateLimited)
                                .doBeforeRetry(signal -> log.debug("Retrying extraction for {} (attempt {})",
                                        article.getExternalId(), signal.totalRetries() + 1)))
                        .publishOn(Schedulers.boundedElastic())
                        .map(result -> {
                            onSuccess(article, result);
                            extracted.incrementAndGet();
                            return article;
                        })
                        .onErrorResume(e -> Mono.fromCallable(() -> {
                            onFailure(article, e);
                            failed.incrementAndGet();
                            return article;
                        }).subscribeOn(Schedulers.boundedElastic())),
                        config.getConcurrency())
                .then()
                .block();

        meterRegistry.counter("narrative.extraction.articles", "outcome", "extracted").increment(extracted.get());
        meterRegistry.counter("narrative.extraction.articles", "outcome", "failed").increment(failed.get());
        log.info("Extraction batch completed: attempted={}, extracted={}, failed={}, duration={}ms",
                articles.size(), extracted.get(), failed.get(), System.currentTimeMillis() - startTime);
        return new ExtractionBatchReport(articles.size(), extracted.get(), failed.get());
    }

    private void onSuccess(ArticleRecord article, ExtractionResult result) {
        article.setExtraction(result);
        article.setExtractionStatus(ExtractionStatus.EXTRACTED);
        article.setExtractionAttempts(article.getExtractionAttempts() + 1);
        article.setLastExtractionError(null);
        articleStore.save(article);
        if (!result.hasNucleus()) {
            log.debug("Article {} has no nucleus entity", article.getExternalId());
        }
    }

    private void onFailure(ArticleRecord article, Throwable error) {
        int attempts = article.getExtractionAttempts() + 1;
        article.setExtractionAttempts(attempts);
        article.setLastExtractionError(truncate(error.getMessage()));
        if (attempts >= properties.getExtraction().getMaxAttempts()) {
            article.setExtractionStatus(ExtractionStatus.FAILED);
            log.warn("Extraction failed permanently for {} after {} attempts: {}",
                    article.getExternalId(), attempts, error.getMessage());
        } else {
            log.warn("Extraction failed for {} (attempt {}): {}", article.getExternalId(), attempts, error.getMessage());
        }
        articleStore.save(article);
    }

    private static boolean isRateLimited(Throwable error) {
        return error instanceof ExtractionException extraction && extraction.isRateLimited();
    }

    private static String truncate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() > 500 ? message.substring(0, 500) : message;
    }
}
