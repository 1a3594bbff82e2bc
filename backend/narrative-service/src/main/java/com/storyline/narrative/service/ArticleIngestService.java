package com.storyline.narrative.service;

import com.storyline.narrative.dto.ArticleIngestMessage;
import com.storyline.narrative.entity.ArticleRecord;
import com.storyline.narrative.entity.ClusteringStatus;
import com.storyline.narrative.entity.ExtractionStatus;
import com.storyline.narrative.store.ArticleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Optional;

/**
 * Stores incoming articles. Idempotent by external id.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArticleIngestService {

    // 오프셋이 있는 형식 먼저
    private static final List<DateTimeFormatter> OFFSET_FORMATTERS = List.of(
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            DateTimeFormatter.ISO_ZONED_DATE_TIME,
            DateTimeFormatter.RFC_1123_DATE_TIME
    );

    private static final List<DateTimeFormatter> LOCAL_FORMATTERS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
    );

    private final ArticleStore articleStore;
    private final Clock clock;

    /**
     * @return the stored article, or empty when the message is invalid or already known
     */
    public Optional<ArticleRecord> ingest(ArticleIngestMessage message) {
        if (message.externalId() == null || message.externalId().isBlank()) {
            log.warn("Rejecting article without external id: url={}", message.url());
            return Optional.empty();
        }
        String externalId = message.externalId().trim();
        if (articleStore.exists(externalId)) {
            log.debug("Article {} already ingested, skipping", externalId);
            return Optional.empty();
        }

        LocalDateTime publishedAt = parsePublishedAt(message.publishedAt());
        if (publishedAt == null) {
            log.warn("Article {} has unparseable publishedAt '{}', using ingest time", externalId, message.publishedAt());
            publishedAt = LocalDateTime.now(clock);
        }

        boolean extracted = message.extraction() != null;
        ArticleRecord article = ArticleRecord.builder()
                .externalId(externalId)
                .title(message.title())
                .url(message.url())
                .source(message.source())
                .publishedAt(publishedAt)
                .extraction(message.extraction())
                .extractionStatus(extracted ? ExtractionStatus.EXTRACTED : ExtractionStatus.PENDING)
                .clusteringStatus(ClusteringStatus.PENDING)
                .build();

        ArticleRecord saved = articleStore.save(article);
        log.info("Ingested article: externalId={}, source={}, extracted={}", externalId, message.source(), extracted);
        return Optional.of(saved);
    }

    /**
     * Parses ISO or RFC 1123 timestamps. Zoned values are converted to UTC; local values are taken as UTC.
     */
    static LocalDateTime parsePublishedAt(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        for (DateTimeFormatter formatter : OFFSET_FORMATTERS) {
            try {
                return OffsetDateTime.parse(trimmed, formatter)
                        .withOffsetSameInstant(ZoneOffset.UTC)
                        .toLocalDateTime();
            } catch (DateTimeParseException ignored) {
                // 다음 형식 시도
            }
        }
        for (DateTimeFormatter formatter : LOCAL_FORMATTERS) {
            try {
                return LocalDateTime.parse(trimmed, formatter);
            } catch (DateTimeParseException ignored) {
                // 다음 형식 시도
            }
        }
        return null;
    }
}
