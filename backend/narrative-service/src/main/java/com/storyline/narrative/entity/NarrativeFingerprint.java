package com.storyline.narrative.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compact identity of a narrative used for matching.
 *
 * topActors keeps insertion order: highest salience first.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class NarrativeFingerprint {

    public static final int MAX_ACTORS = 5;
    public static final int MAX_ACTIONS = 3;

    private String nucleusEntity;

    @Builder.Default
    private Map<String, Double> topActors = new LinkedHashMap<>();

    @Builder.Default
    private List<String> keyActions = new ArrayList<>();

    private LocalDateTime computedAt;

    @JsonIgnore
    public boolean isValid() {
        return nucleusEntity != null && !nucleusEntity.isBlank();
    }
}
