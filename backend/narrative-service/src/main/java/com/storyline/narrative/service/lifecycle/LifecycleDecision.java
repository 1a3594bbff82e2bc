package com.storyline.narrative.service.lifecycle;

import com.storyline.narrative.entity.LifecycleState;

/**
 * Result of a lifecycle evaluation.
 *
 * @param state                the new state
 * @param reawakened           true when the narrative just came back from dormant or echo
 * @param resurrectionVelocity articles per day of the reawakening burst, null unless reactivated
 */
public record LifecycleDecision(LifecycleState state, boolean reawakened, Double resurrectionVelocity) {

    public static LifecycleDecision of(LifecycleState state) {
        return new LifecycleDecision(state, false, null);
    }
}
