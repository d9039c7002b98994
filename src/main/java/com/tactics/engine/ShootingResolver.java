package com.tactics.engine;

import com.tactics.dto.AttackOutcome;
import com.tactics.exception.IllegalActionException;
import com.tactics.exception.RejectionReason;
import com.tactics.model.Hex;
import com.tactics.model.Unit;
import com.tactics.model.WeaponProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Set;

/**
 * Resolves a ranged attack. Preconditions are checked before any die is rolled; a violated
 * precondition raises {@link IllegalActionException} and leaves the target untouched.
 */
@Component
@RequiredArgsConstructor
public class ShootingResolver {

    private final HexGeometry geometry;
    private final LineOfSightEngine lineOfSight;
    private final AttackResolver attackResolver;

    public AttackOutcome resolveShot(Unit shooter, Unit target, WeaponProfile weapon,
                                     Set<Hex> walls, Set<Hex> blockingUnits, Dice dice) {
        validateShot(shooter, target, weapon, walls, blockingUnits);

        AttackOutcome outcome = attackResolver.resolve(shooter, target, weapon, dice);
        target.setHp(outcome.targetHpAfter());
        return outcome;
    }

    public void validateShot(Unit shooter, Unit target, WeaponProfile weapon,
                             Set<Hex> walls, Set<Hex> blockingUnits) {
        if (weapon == null) {
            throw new IllegalActionException(RejectionReason.NO_WEAPON,
                    "Unit " + shooter.getId() + " has no ranged weapon");
        }
        if (!target.isAlive() || !shooter.isEnemyOf(target)) {
            throw new IllegalActionException(RejectionReason.INVALID_TARGET,
                    "Unit " + target.getId() + " is not a live enemy of " + shooter.getId());
        }
        int distance = geometry.distance(shooter.getPosition(), target.getPosition());
        if (distance > weapon.range()) {
            throw new IllegalActionException(RejectionReason.OUT_OF_RANGE,
                    "Target " + target.getId() + " is " + distance + " hexes away, "
                            + weapon.code() + " reaches " + weapon.range());
        }
        Hex obstruction = lineOfSight.firstObstruction(shooter.getPosition(), target.getPosition(), walls, blockingUnits);
        if (obstruction != null) {
            throw new IllegalActionException(RejectionReason.NO_LINE_OF_SIGHT,
                    "Line of sight from " + shooter.getPosition() + " to " + target.getPosition()
                            + " is blocked at " + obstruction);
        }
    }
}
