package com.tactics.engine;

import com.tactics.dto.AttackOutcome;
import com.tactics.exception.IllegalActionException;
import com.tactics.exception.RejectionReason;
import com.tactics.model.Unit;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

/**
 * Resolves melee attacks between adjacent units.
 */
@Component
@RequiredArgsConstructor
public class FightResolver {

    private final HexGeometry geometry;
    private final AttackResolver attackResolver;

    public AttackOutcome resolveFight(Unit attacker, Unit target, Dice dice) {
        if (!attacker.hasMeleeWeapon()) {
            throw new IllegalActionException(RejectionReason.NO_WEAPON,
                    "Unit " + attacker.getId() + " has no melee weapon");
        }
        if (!target.isAlive() || !attacker.isEnemyOf(target)) {
            throw new IllegalActionException(RejectionReason.INVALID_TARGET,
                    "Unit " + target.getId() + " is not a live enemy of " + attacker.getId());
        }
        if (!geometry.isAdjacent(attacker.getPosition(), target.getPosition())) {
            throw new IllegalActionException(RejectionReason.NOT_ADJACENT,
                    "Unit " + target.getId() + " at " + target.getPosition() + " is not adjacent to "
                            + attacker.getId() + " at " + attacker.getPosition());
        }

        AttackOutcome outcome = attackResolver.resolve(attacker, target, attacker.getMeleeWeapon(), dice);
        target.setHp(outcome.targetHpAfter());
        return outcome;
    }
}
