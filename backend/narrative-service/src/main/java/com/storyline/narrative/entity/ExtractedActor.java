package com.storyline.narrative.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An actor mentioned in an article with its salience (1 = peripheral, 5 = central).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExtractedActor {

    public static final int MIN_SALIENCE = 1;
    public static final int MAX_SALIENCE = 5;
    public static final int DEFAULT_SALIENCE = 3;

    private String name;

    private Integer salience;

    /**
     * Salience clamped into the valid range, default when missing.
     */
    public int effectiveSalience() {
        if (salience == null) {
            return DEFAULT_SALIENCE;
        }
        return Math.max(MIN_SALIENCE, Math.min(MAX_SALIENCE, salience));
    }
}
