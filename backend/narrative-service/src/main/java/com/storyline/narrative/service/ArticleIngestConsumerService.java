package com.storyline.narrative.service;

import com.storyline.narrative.dto.ArticleIngestMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.stereotype.Service;

/**
 * Kafka consumer for incoming articles. Failures go through the container error handler to the DLQ.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ArticleIngestConsumerService {

    private final ArticleIngestService articleIngestService;

    @KafkaListener(
            topics = "${narrative.kafka.articles-topic:narrative.articles}",
            groupId = "${spring.application.name}-articles",
            containerFactory = "articleIngestKafkaListenerContainerFactory",
            autoStartup = "${narrative.kafka.enabled:true}"
    )
    public void handleArticle(ArticleIngestMessage message) {
        log.debug("Received article: externalId={}, source={}", message.externalId(), message.source());
        articleIngestService.ingest(message);
    }
}
