package com.tactics.engine;

import com.tactics.dto.ChargeOutcome;
import com.tactics.exception.IllegalActionException;
import com.tactics.exception.RejectionReason;
import com.tactics.model.Hex;
import com.tactics.model.Unit;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.OptionalInt;

/**
 * Resolves a charge: a 2d6 move that must end adjacent to the chosen enemy.
 * <p>
 * All deterministic checks run before the dice are rolled. A legal charge whose roll is
 * too short fails without moving the unit.
 */
@Component
@RequiredArgsConstructor
public class ChargeResolver {

    private final HexGeometry geometry;
    private final ReachabilityValidator reachability;

    public ChargeOutcome resolveCharge(Unit charger, Unit target, Hex destination,
                                       MovementContext context, int maxDistance, Dice dice) {
        validateCharge(charger, target, destination, context, maxDistance);

        Hex from = charger.getPosition();
        int roll = dice.roll2d6();
        OptionalInt path = reachability.shortestDistance(from, destination, roll, context);
        if (path.isEmpty()) {
            return new ChargeOutcome(roll, -1, false, from, from);
        }
        charger.setPosition(destination);
        return new ChargeOutcome(roll, path.getAsInt(), true, from, destination);
    }

    public void validateCharge(Unit charger, Unit target, Hex destination,
                               MovementContext context, int maxDistance) {
        if (!charger.hasMeleeWeapon()) {
            throw new IllegalActionException(RejectionReason.NO_WEAPON,
                    "Unit " + charger.getId() + " has no melee weapon");
        }
        if (!target.isAlive() || !charger.isEnemyOf(target)) {
            throw new IllegalActionException(RejectionReason.INVALID_TARGET,
                    "Unit " + target.getId() + " is not a live enemy of " + charger.getId());
        }
        int distance = geometry.distance(charger.getPosition(), target.getPosition());
        if (distance > maxDistance) {
            throw new IllegalActionException(RejectionReason.OUT_OF_RANGE,
                    "Target " + target.getId() + " is " + distance + " hexes away, charges reach " + maxDistance);
        }
        if (!context.board().inBounds(destination)) {
            throw new IllegalActionException(RejectionReason.OUT_OF_BOUNDS, destination + " is off the board");
        }
        if (context.board().isWall(destination)) {
            throw new IllegalActionException(RejectionReason.WALL, destination + " is a wall");
        }
        if (context.occupied().contains(destination)) {
            throw new IllegalActionException(RejectionReason.OCCUPIED, destination + " is occupied");
        }
        if (!geometry.isAdjacent(destination, target.getPosition())) {
            throw new IllegalActionException(RejectionReason.DESTINATION_NOT_ADJACENT_TO_TARGET,
                    destination + " is not adjacent to target " + target.getId() + " at " + target.getPosition());
        }
    }
}
