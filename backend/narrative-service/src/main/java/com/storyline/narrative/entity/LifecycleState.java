package com.storyline.narrative.entity;

import java.util.EnumSet;
import java.util.Set;

/**
 * Narrative lifecycle states.
 */
public enum LifecycleState {
    EMERGING,
    RISING,
    HOT,
    COOLING,
    DORMANT,
    ECHO,
    REACTIVATED;

    private static final Set<LifecycleState> ACTIVE =
            EnumSet.of(EMERGING, RISING, HOT, COOLING, REACTIVATED);

    /**
     * States shown in the active view.
     */
    public static Set<LifecycleState> activeStates() {
        return EnumSet.copyOf(ACTIVE);
    }

    public boolean isActive() {
        return ACTIVE.contains(this);
    }

    /**
     * A narrative in this state can be reawakened by a burst of coverage.
     */
    public boolean isResting() {
        return this == DORMANT || this == ECHO;
    }
}
