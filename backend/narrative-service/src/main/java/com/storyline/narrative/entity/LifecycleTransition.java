package com.storyline.narrative.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * One entry of a narrative's lifecycle history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LifecycleTransition {

    private LifecycleState state;

    private LocalDateTime timestamp;

    private int articleCount;

    private double mentionVelocity;
}
