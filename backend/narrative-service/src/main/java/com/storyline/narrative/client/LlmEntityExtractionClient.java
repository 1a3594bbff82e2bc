package com.storyline.narrative.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.storyline.narrative.entity.ArticleRecord;
import com.storyline.narrative.entity.ExtractedActor;
import com.storyline.narrative.entity.ExtractionResult;
import com.storyline.narrative.exception.ExtractionException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Entity extraction through an OpenAI-compatible chat completions endpoint.
 */
@Component
@Slf4j
public class LlmEntityExtractionClient implements EntityExtractionClient {

    private static final String SYSTEM_PROMPT = """
            You extract structured entities from news articles.
            Answer with a single JSON object and nothing else:
            {"nucleus_entity": "<primary subject>",
             "actors": [{"name": "<entity>", "salience": <1-5>}],
             "actions": ["<short phrase>"],
             "tensions": ["<short phrase>"],
             "summary": "<one sentence>"}
            Use an empty string for nucleus_entity when the article has no clear subject.
            """;

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final String model;

    public LlmEntityExtractionClient(@Qualifier("extractionWebClient") WebClient webClient,
                                     ObjectMapper objectMapper,
                                     @Value("${llm.extraction.base-url:https://api.openai.com/v1}") String baseUrl,
                                     @Value("${llm.extraction.api-key:${OPENAI_API_KEY:}}") String apiKey,
                                     @Value("${llm.extraction.model:gpt-4o-mini}") String model) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.model = model;
    }

    @Override
    public Mono<ExtractionResult> extract(ArticleRecord article) {
        Map<String, Object> body = Map.of(
                "model", model,
                "temperature", 0,
                "messages", List.of(
                        Map.of("role", "system", "content", SYSTEM_PROMPT),
                        Map.of("role", "user", "content", userPrompt(article))
                )
        );

        WebClient.RequestBodySpec request = webClient.post()
                .uri(baseUrl + "/chat/completions")
                .contentType(MediaType.APPLICATION_JSON)
                .accept(MediaType.APPLICATION_JSON);
        if (apiKey != null && !apiKey.isBlank()) {
            request = request.header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey);
        }

        return request
                .bodyValue(body)
                .retrieve()
                .onStatus(status -> status.value() == HttpStatus.TOO_MANY_REQUESTS.value(),
                        response -> Mono.error(ExtractionException.rateLimited(article.getExternalId())))
                .bodyToMono(String.class)
                .map(response -> parseResponse(article.getExternalId(), response))
                .doOnError(e -> log.debug("Extraction request failed for {}: {}", article.getExternalId(), e.getMessage()));
    }

    ExtractionResult parseResponse(String articleId, String response) {
        try {
            JsonNode root = objectMapper.readTree(response);
            String content = root.path("choices").path(0).path("message").path("content").asText("");
            return parseExtraction(stripCodeFence(content));
        } catch (JsonProcessingException e) {
            throw ExtractionException.unparseable(articleId, e);
        }
    }

    ExtractionResult parseExtraction(String json) throws JsonProcessingException {
        JsonNode node = objectMapper.readTree(json);
        return ExtractionResult.builder()
                .nucleusEntity(text(node, "nucleus_entity", "nucleusEntity"))
                .actors(actors(node.has("actors") ? node.get("actors") : node.path("actor_salience")))
                .actions(strings(node.path("actions")))
                .tensions(strings(node.path("tensions")))
                .summary(text(node, "summary", "summary"))
                .build();
    }

    /**
     * Accepts both a list of {name, salience} objects and a {name: salience} map.
     */
    private static List<ExtractedActor> actors(JsonNode node) {
        List<ExtractedActor> actors = new ArrayList<>();
        if (node.isArray()) {
            for (JsonNode actor : node) {
                String name = actor.path("name").asText("").trim();
                if (!name.isEmpty()) {
                    Integer salience = actor.path("salience").isNumber() ? actor.path("salience").asInt() : null;
                    actors.add(new ExtractedActor(name, salience));
                }
            }
        } else if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                Integer salience = field.getValue().isNumber() ? field.getValue().asInt() : null;
                actors.add(new ExtractedActor(field.getKey().trim(), salience));
            }
        }
        return actors;
    }

    private static List<String> strings(JsonNode node) {
        List<String> values = new ArrayList<>();
        if (node.isArray()) {
            node.forEach(item -> {
                String value = item.asText("").trim();
                if (!value.isEmpty()) {
                    values.add(value);
                }
            });
        }
        return values;
    }

    private static String text(JsonNode node, String snakeName, String camelName) {
        JsonNode value = node.has(snakeName) ? node.get(snakeName) : node.path(camelName);
        return value.isTextual() ? value.asText().trim() : "";
    }

    static String stripCodeFence(String content) {
        String trimmed = content.trim();
        if (trimmed.startsWith("```")) {
            int firstNewline = trimmed.indexOf('\n');
            int closing = trimmed.lastIndexOf("```");
            if (firstNewline > 0 && closing > firstNewline) {
                return trimmed.substring(firstNewline + 1, closing).trim();
            }
        }
        return trimmed;
    }

    private static String userPrompt(ArticleRecord article) {
        StringBuilder prompt = new StringBuilder();
        prompt.append("Title: ").append(article.getTitle() == null ? "" : article.getTitle()).append('\n');
        if (article.getSource() != null) {
            prompt.append("Source: ").append(article.getSource()).append('\n');
        }
        if (article.getUrl() != null) {
            prompt.append("URL: ").append(article.getUrl()).append('\n');
        }
        return prompt.toString();
    }
}
