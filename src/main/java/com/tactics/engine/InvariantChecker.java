package com.tactics.engine;

import com.tactics.exception.InvariantViolationException;
import com.tactics.model.BoardConfig;
import com.tactics.model.GameState;
import com.tactics.model.Hex;
import com.tactics.model.Unit;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Runtime check of the state invariants: HP within [0, max], every live unit on a
 * passable in-bounds hex, and no two live units sharing a hex.
 */
@Component
public class InvariantChecker {

    public void check(GameState state) {
        BoardConfig board = state.getBoard();
        Map<Hex, String> occupancy = new HashMap<>();

        for (Unit unit : state.getUnits()) {
            if (unit.getHp() < 0 || unit.getHp() > unit.getHpMax()) {
                throw new InvariantViolationException("Unit " + unit.getId() + " has HP "
                        + unit.getHp() + " outside [0, " + unit.getHpMax() + "]", state.describe());
            }
            if (!unit.isAlive()) {
                continue;
            }
            Hex position = unit.getPosition();
            if (position == null || !board.inBounds(position)) {
                throw new InvariantViolationException("Unit " + unit.getId() + " is off the board at "
                        + position, state.describe());
            }
            if (board.isWall(position)) {
                throw new InvariantViolationException("Unit " + unit.getId() + " stands on wall "
                        + position, state.describe());
            }
            String other = occupancy.putIfAbsent(position, unit.getId());
            if (other != null) {
                throw new InvariantViolationException("Units " + other + " and " + unit.getId()
                        + " both occupy " + position, state.describe());
            }
        }
    }
}
