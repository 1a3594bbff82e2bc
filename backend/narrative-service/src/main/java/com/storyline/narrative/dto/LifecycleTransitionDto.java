package com.storyline.narrative.dto;

import com.storyline.narrative.entity.LifecycleState;

import java.time.LocalDateTime;

public record LifecycleTransitionDto(
        LifecycleState state,
        LocalDateTime timestamp,
        int articleCount,
        double mentionVelocity
) {
}
