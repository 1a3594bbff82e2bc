package com.storyline.narrative.dto;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

public record FingerprintDto(
        String nucleusEntity,
        Map<String, Double> topActors,
        List<String> keyActions,
        LocalDateTime computedAt
) {
}
