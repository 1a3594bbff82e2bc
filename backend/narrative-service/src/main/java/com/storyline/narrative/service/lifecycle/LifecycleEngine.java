package com.storyline.narrative.service.lifecycle;

import com.storyline.narrative.config.NarrativeProperties;
import com.storyline.narrative.entity.LifecycleState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Deterministic lifecycle state machine.
 *
 * Rules in priority order:
 * <ol>
 *     <li>7+ quiet days: dormant, or echo on a light pulse (1-3 articles in 24h)</li>
 *     <li>dormant/echo with 4+ articles in 48h: reactivated</li>
 *     <li>dormant/echo without a burst stays resting (echo on a light pulse, else dormant)</li>
 *     <li>3-7 quiet days: cooling</li>
 *     <li>7+ articles or velocity 3.0+: hot</li>
 *     <li>velocity 1.5+: rising</li>
 *     <li>otherwise emerging</li>
 * </ol>
 */
@Component
@RequiredArgsConstructor
public class LifecycleEngine {

    private final NarrativeProperties properties;

    public LifecycleDecision evaluate(LifecycleSignals signals) {
        NarrativeProperties.Lifecycle config = properties.getLifecycle();
        LifecycleState previous = signals.previousState();
        boolean burst = signals.articlesLast48h() >= config.getReactivationArticles();
        double pulseDays = config.getReactivationPulseHours() / 24.0;

        if (signals.daysSinceLastUpdate() >= config.getDormantDays()) {
            if (previous != null && previous.isResting() && burst) {
                return reactivate(signals, true, pulseDays);
            }
            return restingState(signals, config);
        }

        if (previous != null && previous.isResting()) {
            if (burst) {
                return reactivate(signals, true, pulseDays);
            }
            // 휴면 narrative는 버스트로만 활성 상태로 돌아온다
            return restingState(signals, config);
        }
        // 재활성 상태는 버스트가 이어지는 동안 유지, 카운트는 다시 올리지 않음
        if (previous == LifecycleState.REACTIVATED && burst
                && signals.daysSinceLastUpdate() < config.getCoolingDays()) {
            return reactivate(signals, false, pulseDays);
        }

        if (signals.daysSinceLastUpdate() >= config.getCoolingDays()) {
            return LifecycleDecision.of(LifecycleState.COOLING);
        }
        if (signals.articleCount() >= config.getHotArticleCount()
                || signals.mentionVelocity() >= config.getHotVelocity()) {
            return LifecycleDecision.of(LifecycleState.HOT);
        }
        if (signals.mentionVelocity() >= config.getRisingVelocity()) {
            return LifecycleDecision.of(LifecycleState.RISING);
        }
        return LifecycleDecision.of(LifecycleState.EMERGING);
    }

    private static LifecycleDecision restingState(LifecycleSignals signals, NarrativeProperties.Lifecycle config) {
        if (signals.articlesLast24h() >= 1 && signals.articlesLast24h() <= config.getEchoMaxArticles()) {
            return LifecycleDecision.of(LifecycleState.ECHO);
        }
        return LifecycleDecision.of(LifecycleState.DORMANT);
    }

    private static LifecycleDecision reactivate(LifecycleSignals signals, boolean reawakened, double pulseDays) {
        double velocity = Math.round(signals.articlesLast48h() / pulseDays * 100.0) / 100.0;
        return new LifecycleDecision(LifecycleState.REACTIVATED, reawakened, velocity);
    }
}
