package com.tactics.bot;

import com.tactics.dto.ActionKind;
import com.tactics.dto.ActionRequest;
import com.tactics.engine.HexGeometry;
import com.tactics.engine.TurnPhaseStateMachine;
import com.tactics.model.GameState;
import com.tactics.model.Hex;
import com.tactics.model.Unit;
import com.tactics.model.WeaponProfile;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Hard bot - keeps its distance, shoots the most dangerous enemy and only charges to
 * finish off a badly wounded target.
 */
@Component
@RequiredArgsConstructor
public class DefensiveBotStrategy implements BotStrategy {

    private final HexGeometry geometry;

    @Override
    public BotDifficulty getDifficulty() {
        return BotDifficulty.HARD;
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
            case MOVE -> safestPosition(options, view, unit);
            case SHOOT, FIGHT -> mostDangerousTarget(options, view);
            case CHARGE -> finishingCharge(options, view, unit);
            case GAME_OVER -> ActionRequest.pass(unitId);
        };
    }

    /**
     * Maximise distance to the nearest enemy, but a shooter stays within range of at least one.
     */
    private ActionRequest safestPosition(List<ActionRequest> options, GameState view, Unit unit) {
        int range = unit.hasRangedWeapon() ? unit.getRangedWeapon().range() : Integer.MAX_VALUE;
        ActionRequest best = ActionRequest.pass(unit.getId());
        int bestScore = score(view, unit, unit.getPosition(), range);
        for (ActionRequest option : options) {
            if (option.getKind() != ActionKind.MOVE) continue;
            int score = score(view, unit, option.getTargetHex(), range);
            if (score > bestScore) {
                bestScore = score;
                best = option;
            }
        }
        return best;
    }

    private int score(GameState view, Unit unit, Hex hex, int range) {
        int nearest = view.liveUnits().stream()
                .filter(u -> u.isEnemyOf(unit))
                .mapToInt(u -> geometry.distance(hex, u.getPosition()))
                .min()
                .orElse(0);
        // Out of range is worth less than any in-range hex
        return nearest <= range ? nearest + 1000 : -nearest;
    }

    private ActionRequest mostDangerousTarget(List<ActionRequest> options, GameState view) {
        return options.stream()
                .filter(o -> o.getTargetUnitId() != null)
                .max(Comparator.comparingInt(o -> view.findUnit(o.getTargetUnitId()).map(this::threat).orElse(0)))
                .orElse(options.get(options.size() - 1));
    }

    private ActionRequest finishingCharge(List<ActionRequest> options, GameState view, Unit unit) {
        return options.stream()
                .filter(o -> o.getKind() == ActionKind.CHARGE)
                .filter(o -> view.findUnit(o.getTargetUnitId())
                        .map(t -> t.getHp() * 2 <= t.getHpMax())
                        .orElse(false))
                .min(Comparator.comparingInt(o -> geometry.distance(unit.getPosition(), o.getTargetHex())))
                .orElse(ActionRequest.pass(unit.getId()));
    }

    /**
     * Expected maximum damage output of a unit in one volley of its strongest weapon.
     */
    int threat(Unit enemy) {
        return Math.max(volley(enemy, enemy.getRangedWeapon()), volley(enemy, enemy.getMeleeWeapon()));
    }

    private int volley(Unit enemy, WeaponProfile weapon) {
        if (weapon == null) return 0;
        return weapon.attacks() * enemy.getAliveModels() * weapon.damage();
    }
}
