package com.storyline.narrative.config;

import com.storyline.narrative.dto.ArticleIngestMessage;
import lombok.extern.slf4j.Slf4j;
import org.apache.kafka.clients.consumer.ConsumerConfig;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.producer.ProducerConfig;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.serialization.StringDeserializer;
import org.apache.kafka.common.serialization.StringSerializer;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.kafka.config.ConcurrentKafkaListenerContainerFactory;
import org.springframework.kafka.core.ConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaConsumerFactory;
import org.springframework.kafka.core.DefaultKafkaProducerFactory;
import org.springframework.kafka.core.KafkaTemplate;
import org.springframework.kafka.core.ProducerFactory;
import org.springframework.kafka.listener.CommonErrorHandler;
import org.springframework.kafka.listener.ContainerProperties;
import org.springframework.kafka.listener.DeadLetterPublishingRecoverer;
import org.springframework.kafka.listener.DefaultErrorHandler;
import org.springframework.kafka.support.ExponentialBackOffWithMaxRetries;
import org.springframework.kafka.support.serializer.ErrorHandlingDeserializer;
import org.springframework.kafka.support.serializer.JsonDeserializer;
import org.springframework.kafka.support.serializer.JsonSerializer;

import java.util.HashMap;
import java.util.Map;

/**
 * Kafka configuration for article ingestion.
 * - Failed records go to {@code <topic>.dlq} after exponential backoff retries
 * - Offsets are committed per record after the listener returns
 */
@Configuration
@Slf4j
public class KafkaConfig {

    @Value("${spring.kafka.bootstrap-servers:localhost:9092}")
    private String bootstrapServers;

    @Value("${spring.application.name:narrative-service}")
    private String applicationName;

    @Value("${spring.kafka.producer.acks:all}")
    private String producerAcks;

    @Value("${spring.kafka.producer.retries:3}")
    private int producerRetries;

    @Value("${spring.kafka.consumer.max-retry-attempts:3}")
    private int consumerMaxRetryAttempts;

    @Value("${spring.kafka.consumer.retry-backoff-ms:1000}")
    private long consumerRetryBackoffMs;

    @Value("${spring.kafka.consumer.retry-max-backoff-ms:30000}")
    private long consumerRetryMaxBackoffMs;

    @Value("${spring.kafka.consumer.concurrency:1}")
    private int consumerConcurrency;

    private static final String DLQ_SUFFIX = ".dlq";

    private Map<String, Object> buildProducerProps() {
        Map<String, Object> props = new HashMap<>();
        props.put(ProducerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ProducerConfig.KEY_SERIALIZER_CLASS_CONFIG, StringSerializer.class);
        props.put(ProducerConfig.VALUE_SERIALIZER_CLASS_CONFIG, JsonSerializer.class);
        props.put(ProducerConfig.ACKS_CONFIG, producerAcks);
        props.put(ProducerConfig.RETRIES_CONFIG, producerRetries);
        props.put(ProducerConfig.ENABLE_IDEMPOTENCE_CONFIG, true);
        return props;
    }

    private Map<String, Object> buildConsumerProps(String groupIdSuffix) {
        Map<String, Object> props = new HashMap<>();
        props.put(ConsumerConfig.BOOTSTRAP_SERVERS_CONFIG, bootstrapServers);
        props.put(ConsumerConfig.GROUP_ID_CONFIG, applicationName + "-" + groupIdSuffix);
        props.put(ConsumerConfig.ENABLE_AUTO_COMMIT_CONFIG, false);
        props.put(ConsumerConfig.AUTO_OFFSET_RESET_CONFIG, "earliest");
        props.put(ConsumerConfig.MAX_POLL_RECORDS_CONFIG, 100);
        return props;
    }

    // ========== DLQ ==========

    @Bean
    public ProducerFactory<String, Object> dlqProducerFactory() {
        return new DefaultKafkaProducerFactory<>(buildProducerProps());
    }

    @Bean
    public KafkaTemplate<String, Object> dlqKafkaTemplate() {
        return new KafkaTemplate<>(dlqProducerFactory());
    }

    @Bean
    public DeadLetterPublishingRecoverer deadLetterPublishingRecoverer() {
        return new DeadLetterPublishingRecoverer(dlqKafkaTemplate(),
                (ConsumerRecord<?, ?> record, Exception ex) -> {
                    String dlqTopic = record.topic() + DLQ_SUFFIX;
                    log.error("Sending to DLQ: topic={}, key={}, offset={}, error={}",
                            dlqTopic, record.key(), record.offset(), ex.getMessage());
                    return new TopicPartition(dlqTopic, record.partition());
                });
    }

    @Bean
    public CommonErrorHandler kafkaErrorHandler(DeadLetterPublishingRecoverer recoverer) {
        ExponentialBackOffWithMaxRetries backOff = new ExponentialBackOffWithMaxRetries(consumerMaxRetryAttempts);
        backOff.setInitialInterval(consumerRetryBackoffMs);
        backOff.setMaxInterval(consumerRetryMaxBackoffMs);
        backOff.setMultiplier(2.0);

        DefaultErrorHandler errorHandler = new DefaultErrorHandler(recoverer, backOff);
        errorHandler.setRetryListeners((record, ex, attempt) ->
                log.warn("Retry attempt {} for record: topic={}, key={}, offset={}, error={}",
                        attempt, record.topic(), record.key(), record.offset(), ex.getMessage()));
        return errorHandler;
    }

    // ========== Article Ingest Consumer ==========

    @Bean
    public ConsumerFactory<String, ArticleIngestMessage> articleIngestConsumerFactory() {
        JsonDeserializer<ArticleIngestMessage> valueDeserializer = new JsonDeserializer<>(ArticleIngestMessage.class);
        valueDeserializer.addTrustedPackages("com.storyline.narrative.dto");
        valueDeserializer.setUseTypeHeaders(false);
        // 역직렬화 실패도 DLQ로
        return new DefaultKafkaConsumerFactory<>(
                buildConsumerProps("articles"),
                new StringDeserializer(),
                new ErrorHandlingDeserializer<>(valueDeserializer)
        );
    }

    @Bean
    public ConcurrentKafkaListenerContainerFactory<String, ArticleIngestMessage> articleIngestKafkaListenerContainerFactory(
            CommonErrorHandler kafkaErrorHandler) {
        ConcurrentKafkaListenerContainerFactory<String, ArticleIngestMessage> factory =
                new ConcurrentKafkaListenerContainerFactory<>();
        factory.setConsumerFactory(articleIngestConsumerFactory());
        factory.setConcurrency(consumerConcurrency);
        factory.getContainerProperties().setAckMode(ContainerProperties.AckMode.RECORD);
        factory.setCommonErrorHandler(kafkaErrorHandler);
        return factory;
    }
}
