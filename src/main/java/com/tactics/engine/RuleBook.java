package com.tactics.engine;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * The stateless rule components an episode needs, bundled for injection.
 * Safe to share across any number of concurrently running episodes.
 */
@Component
@Getter
@RequiredArgsConstructor
public class RuleBook {

    private final HexGeometry geometry;
    private final ReachabilityValidator reachability;
    private final LineOfSightEngine lineOfSight;
    private final ShootingResolver shooting;
    private final ChargeResolver charging;
    private final FightResolver fighting;
    private final RewardCalculator rewards;
    private final ObservationBuilder observations;
    private final InvariantChecker invariants;
}
