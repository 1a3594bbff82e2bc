package com.storyline.narrative.config;

import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.storyline.narrative.dto.NarrativeSummaryDto;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.cache.Cache;
import org.springframework.cache.CacheManager;
import org.springframework.cache.annotation.CachingConfigurer;
import org.springframework.cache.annotation.EnableCaching;
import org.springframework.cache.caffeine.CaffeineCacheManager;
import org.springframework.cache.interceptor.CacheErrorHandler;
import org.springframework.cache.support.CompositeCacheManager;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.data.redis.cache.RedisCacheConfiguration;
import org.springframework.data.redis.cache.RedisCacheManager;
import org.springframework.data.redis.connection.RedisConnectionFactory;
import org.springframework.data.redis.serializer.Jackson2JsonRedisSerializer;
import org.springframework.data.redis.serializer.RedisSerializationContext;
import org.springframework.data.redis.serializer.StringRedisSerializer;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 캐시 설정
 *
 * - 목록 뷰(active/archived/resurrections)를 Redis에 캐싱
 * - Redis 비활성화 시 Caffeine 로컬 캐시 사용
 * - 캐시 장애는 로깅 + 메트릭만 기록하고 조회는 계속 진행
 */
@Configuration
@EnableCaching
@Slf4j
public class RedisCacheConfig implements CachingConfigurer {

    public static final String ACTIVE_NARRATIVES = "activeNarratives";
    public static final String ARCHIVED_NARRATIVES = "archivedNarratives";
    public static final String RESURRECTED_NARRATIVES = "resurrectedNarratives";

    private static final List<String> CACHE_NAMES = List.of(ACTIVE_NARRATIVES, ARCHIVED_NARRATIVES, RESURRECTED_NARRATIVES);

    @Value("${spring.application.name:narrative-service}")
    private String applicationName;

    @Value("${spring.data.redis.enabled:true}")
    private boolean redisEnabled;

    @Value("${cache.narratives.ttl-minutes:10}")
    private int narrativesTtlMinutes;

    @Value("${cache.local.max-size:500}")
    private int localCacheMaxSize;

    private final MeterRegistry meterRegistry;
    private final ObjectProvider<RedisConnectionFactory> connectionFactoryProvider;

    public RedisCacheConfig(MeterRegistry meterRegistry,
                            ObjectProvider<RedisConnectionFactory> connectionFactoryProvider) {
        this.meterRegistry = meterRegistry;
        this.connectionFactoryProvider = connectionFactoryProvider;
    }

    /**
     * 목록 캐시 값은 List<NarrativeSummaryDto> 고정 타입으로 직렬화
     */
    private Jackson2JsonRedisSerializer<Object> summaryListSerializer() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        JavaType listType = mapper.getTypeFactory().constructCollectionType(List.class, NarrativeSummaryDto.class);
        return new Jackson2JsonRedisSerializer<>(mapper, listType);
    }

    private RedisCacheManager buildRedisCacheManager(RedisConnectionFactory connectionFactory) {
        String keyPrefix = applicationName + ":cache:";

        RedisCacheConfiguration defaultConfig = RedisCacheConfiguration.defaultCacheConfig()
                .entryTtl(Duration.ofMinutes(narrativesTtlMinutes))
                .prefixCacheNameWith(keyPrefix)
                .serializeKeysWith(RedisSerializationContext.SerializationPair.fromSerializer(new StringRedisSerializer()))
                .serializeValuesWith(RedisSerializationContext.SerializationPair.fromSerializer(summaryListSerializer()))
                .disableCachingNullValues();

        Map<String, RedisCacheConfiguration> cacheConfigurations = new HashMap<>();
        cacheConfigurations.put(ACTIVE_NARRATIVES, defaultConfig);
        // 휴면/부활 목록은 변화가 느림
        cacheConfigurations.put(ARCHIVED_NARRATIVES, defaultConfig.entryTtl(Duration.ofMinutes(narrativesTtlMinutes * 3L)));
        cacheConfigurations.put(RESURRECTED_NARRATIVES, defaultConfig);

        RedisCacheManager cacheManager = RedisCacheManager.builder(connectionFactory)
                .cacheDefaults(defaultConfig)
                .withInitialCacheConfigurations(cacheConfigurations)
                .enableStatistics()
                .build();
        cacheManager.afterPropertiesSet();

        log.info("Redis Cache Manager initialized with prefix: {}", keyPrefix);
        return cacheManager;
    }

    private CaffeineCacheManager buildCaffeineCacheManager() {
        CaffeineCacheManager cacheManager = new CaffeineCacheManager();
        cacheManager.setCaffeine(Caffeine.newBuilder()
                .maximumSize(localCacheMaxSize)
                .expireAfterWrite(Duration.ofMinutes(narrativesTtlMinutes))
                .recordStats());
        cacheManager.setCacheNames(CACHE_NAMES);
        return cacheManager;
    }

    /**
     * 복합 캐시 매니저 (Redis 우선, Caffeine 폴백)
     */
    @Bean
    @Primary
    @Override
    public CacheManager cacheManager() {
        List<CacheManager> managers = new ArrayList<>();
        RedisConnectionFactory connectionFactory = redisEnabled ? connectionFactoryProvider.getIfAvailable() : null;
        if (connectionFactory != null) {
            managers.add(buildRedisCacheManager(connectionFactory));
            log.info("Using Redis as primary cache");
        } else {
            managers.add(buildCaffeineCacheManager());
            log.info("Redis disabled, using Caffeine as primary cache");
        }

        CompositeCacheManager compositeCacheManager = new CompositeCacheManager();
        compositeCacheManager.setCacheManagers(managers);
        compositeCacheManager.setFallbackToNoOpCache(false);
        return compositeCacheManager;
    }

    /**
     * 캐시 에러 핸들러 - Redis 장애 시 로깅만 하고 계속 진행
     */
    @Override
    public CacheErrorHandler errorHandler() {
        return new CacheErrorHandler() {
            @Override
            public void handleCacheGetError(RuntimeException exception, Cache cache, Object key) {
                log.warn("Cache GET error - cache: {}, key: {}, error: {}",
                        cache.getName(), key, exception.getMessage());
                recordError(cache, "get");
            }

            @Override
            public void handleCachePutError(RuntimeException exception, Cache cache, Object key, Object value) {
                log.warn("Cache PUT error - cache: {}, key: {}, error: {}",
                        cache.getName(), key, exception.getMessage());
                recordError(cache, "put");
            }

            @Override
            public void handleCacheEvictError(RuntimeException exception, Cache cache, Object key) {
                log.warn("Cache EVICT error - cache: {}, key: {}, error: {}",
                        cache.getName(), key, exception.getMessage());
                recordError(cache, "evict");
            }

            @Override
            public void handleCacheClearError(RuntimeException exception, Cache cache) {
                log.warn("Cache CLEAR error - cache: {}, error: {}",
                        cache.getName(), exception.getMessage());
                recordError(cache, "clear");
            }
        };
    }

    private void recordError(Cache cache, String operation) {
        meterRegistry.counter("cache.error", "cache", cache.getName(), "operation", operation).increment();
    }
}
