package com.tactics.bot;

import com.tactics.dto.ActionKind;
import com.tactics.dto.ActionRequest;
import com.tactics.engine.HexGeometry;
import com.tactics.engine.TurnPhaseStateMachine;
import com.tactics.model.GameState;
import com.tactics.model.Hex;
import com.tactics.model.Unit;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Medium bot - closes in on the nearest enemy, always charges and attacks the weakest target.
 */
@Component
@RequiredArgsConstructor
public class GreedyBotStrategy implements BotStrategy {

    private final HexGeometry geometry;

    @Override
    public BotDifficulty getDifficulty() {
        return BotDifficulty.MEDIUM;
    }

    @Override
    public ActionRequest decide(TurnPhaseStateMachine machine, String unitId, Random random) {
        List<ActionRequest> options = machine.legalActions(unitId);
        GameState view = machine.view();
        Unit unit = view.findUnit(unitId).orElse(null);
        if (unit == null || options.isEmpty()) {
            return ActionRequest.pass(unitId);
        }

        return switch (machine.getCurrentPhase()) {
            case MOVE -> closestApproach(options, view, unit);
            case SHOOT, FIGHT -> weakestTarget(options, view);
            case CHARGE -> shortestCharge(options, unit);
            case GAME_OVER -> ActionRequest.pass(unitId);
        };
    }

    private ActionRequest closestApproach(List<ActionRequest> options, GameState view, Unit unit) {
        int current = nearestEnemyDistance(view, unit, unit.getPosition());
        ActionRequest best = null;
        int bestDistance = current;
        for (ActionRequest option : options) {
            if (option.getKind() != ActionKind.MOVE) continue;
            int distance = nearestEnemyDistance(view, unit, option.getTargetHex());
            if (distance < bestDistance) {
                bestDistance = distance;
                best = option;
            }
        }
        return best != null ? best : ActionRequest.pass(unit.getId());
    }

    private ActionRequest weakestTarget(List<ActionRequest> options, GameState view) {
        return options.stream()
                .filter(o -> o.getTargetUnitId() != null)
                .min(Comparator.comparingInt(o -> view.findUnit(o.getTargetUnitId()).map(Unit::getHp).orElse(Integer.MAX_VALUE)))
                .orElse(options.get(options.size() - 1));
    }

    private ActionRequest shortestCharge(List<ActionRequest> options, Unit unit) {
        return options.stream()
                .filter(o -> o.getKind() == ActionKind.CHARGE)
                .min(Comparator.comparingInt(o -> geometry.distance(unit.getPosition(), o.getTargetHex())))
                .orElse(ActionRequest.pass(unit.getId()));
    }

    private int nearestEnemyDistance(GameState view, Unit unit, Hex from) {
        return view.liveUnits().stream()
                .filter(u -> u.isEnemyOf(unit))
                .mapToInt(u -> geometry.distance(from, u.getPosition()))
                .min()
                .orElse(0);
    }
}
