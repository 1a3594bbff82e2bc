package com.storyline.narrative.entity;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Entities extracted from one article by the extraction collaborator.
 * Stored as JSON on the article row.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ExtractionResult {

    private String nucleusEntity;

    @Builder.Default
    private List<ExtractedActor> actors = new ArrayList<>();

    @Builder.Default
    private List<String> actions = new ArrayList<>();

    @Builder.Default
    private List<String> tensions = new ArrayList<>();

    private String summary;

    @JsonIgnore
    public boolean hasNucleus() {
        return nucleusEntity != null && !nucleusEntity.isBlank();
    }
}
