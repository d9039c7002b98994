package com.tactics.engine;

import com.tactics.config.EngineSettings;
import com.tactics.dto.ActionRecord;
import com.tactics.dto.ActionRequest;
import com.tactics.dto.ActionResult;
import com.tactics.dto.AttackOutcome;
import com.tactics.dto.ChargeOutcome;
import com.tactics.dto.UnitDelta;
import com.tactics.exception.IllegalActionException;
import com.tactics.exception.InvariantViolationException;
import com.tactics.exception.RejectionReason;
import com.tactics.model.BoardConfig;
import com.tactics.model.EndReason;
import com.tactics.model.GamePhase;
import com.tactics.model.GameState;
import com.tactics.model.GameStatus;
import com.tactics.model.Hex;
import com.tactics.model.Unit;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Sequences one episode: MOVE, SHOOT, CHARGE, FIGHT for player 0, then the same for
 * player 1, then the next turn.
 * <p>
 * Owns its {@link GameState} and dice exclusively. Each {@link #step(ActionRequest)} is
 * atomic: every rule check runs before the first mutation, so a rejected request leaves
 * the state untouched. Within a phase each unit of the activation pool acts or passes
 * once; empty phases are skipped.
 * <p>
 * Not thread-safe. Parallel episodes each use their own instance.
 */
@Slf4j
public class TurnPhaseStateMachine {

    private final GameState state;
    private final RuleBook rules;
    private final Dice dice;
    private final EngineSettings settings;

    private final List<ActionRecord> records = new ArrayList<>();

    public TurnPhaseStateMachine(GameState state, RuleBook rules, Dice dice, EngineSettings settings) {
        this.state = state;
        this.rules = rules;
        this.dice = dice;
        this.settings = settings;

        verifyInvariants();
        state.getActedThisPhase().clear();
        state.setActivationPool(buildPool(state.getCurrentPhase()));
        if (state.getActivationPool().isEmpty()) {
            advance();
        }
    }

    // ── step ────────────────────────────────────────────────────────────

    /**
     * Process one action request to completion.
     *
     * @throws InvariantViolationException if the resulting state is impossible; the episode is halted
     * @throws IllegalStateException       if the episode was already halted
     */
    public ActionResult step(ActionRequest request) {
        if (state.getStatus() == GameStatus.HALTED) {
            throw new IllegalStateException("Episode " + state.getScenarioId() + "/" + state.getSeed()
                    + " was halted by an invariant violation and must be reset");
        }
        int turn = state.getTurnNumber();
        GamePhase phase = state.getCurrentPhase();
        int player = state.getCurrentPlayer();

        try {
            return apply(request, turn, phase, player);
        } catch (IllegalActionException e) {
            return reject(request, e, turn, phase, player);
        }
    }

    private ActionResult apply(ActionRequest request, int turn, GamePhase phase, int player) {
        Unit unit = validateActor(request);
        Hex from = unit.getPosition();

        Applied applied = switch (request.getKind()) {
            case MOVE -> executeMove(unit, request);
            case SHOOT -> executeShoot(unit, request);
            case CHARGE -> executeCharge(unit, request);
            case FIGHT -> executeFight(unit, request);
            case PASS -> new Applied(rules.getRewards().pass(), List.of(), null, null);
        };

        state.getActedThisPhase().add(unit.getId());
        state.getActivationPool().remove(unit.getId());
        state.setStepCount(state.getStepCount() + 1);

        verifyInvariants();
        checkEpisodeEnd();
        if (!state.isFinished()) {
            refreshPool();
            if (state.getActivationPool().isEmpty()) {
                advance();
            }
        }

        double reward = applied.reward();
        if (state.isFinished()) {
            reward += rules.getRewards().terminal(state, player);
        }

        AttackOutcome attack = applied.attack();
        records.add(ActionRecord.builder()
                .sequence(records.size() + 1)
                .turn(turn)
                .phase(phase)
                .player(player)
                .unitId(unit.getId())
                .kind(request.getKind())
                .targetHex(request.getTargetHex())
                .targetUnitId(request.getTargetUnitId())
                .accepted(true)
                .from(from)
                .to(unit.getPosition())
                .damage(attack != null ? attack.damage() : 0)
                .targetHpAfter(attack != null ? attack.targetHpAfter() : null)
                .diceRolls(new ArrayList<>(dice.drainJournal()))
                .reward(reward)
                .terminal(state.isFinished())
                .build());

        return resultBuilder()
                .accepted(true)
                .changes(applied.changes())
                .attack(attack)
                .charge(applied.charge())
                .reward(reward)
                .build();
    }

    private ActionResult reject(ActionRequest request, IllegalActionException e,
                                int turn, GamePhase phase, int player) {
        log.debug("Rejected {} in turn {} {} (player {}): {} - {}",
                request, turn, phase, player, e.getReason(), e.getMessage());
        double reward = rules.getRewards().illegalAction();

        records.add(ActionRecord.builder()
                .sequence(records.size() + 1)
                .turn(turn)
                .phase(phase)
                .player(player)
                .unitId(request != null ? request.getUnitId() : null)
                .kind(request != null ? request.getKind() : null)
                .targetHex(request != null ? request.getTargetHex() : null)
                .targetUnitId(request != null ? request.getTargetUnitId() : null)
                .accepted(false)
                .reason(e.getReason())
                .diceRolls(new ArrayList<>(dice.drainJournal()))
                .reward(reward)
                .terminal(state.isFinished())
                .build());

        return resultBuilder()
                .accepted(false)
                .reason(e.getReason())
                .message(e.getMessage())
                .reward(reward)
                .build();
    }

    private ActionResult.ActionResultBuilder resultBuilder() {
        return ActionResult.builder()
                .terminal(state.isFinished())
                .winner(state.getWinner())
                .endReason(state.getEndReason())
                .turnNumber(state.getTurnNumber())
                .phase(state.getCurrentPhase())
                .currentPlayer(state.getCurrentPlayer())
                .observation(observe());
    }

    // ── validation ──────────────────────────────────────────────────────

    private Unit validateActor(ActionRequest request) {
        if (state.isFinished()) {
            throw new IllegalActionException(RejectionReason.GAME_OVER, "Episode is over");
        }
        if (request == null || request.getKind() == null || request.getUnitId() == null) {
            throw new IllegalActionException(RejectionReason.MALFORMED_REQUEST,
                    "Request needs a unit id and an action kind");
        }
        Unit unit = state.findUnit(request.getUnitId())
                .orElseThrow(() -> new IllegalActionException(RejectionReason.UNKNOWN_UNIT,
                        "Unknown unit: " + request.getUnitId()));
        if (!unit.isAlive()) {
            throw new IllegalActionException(RejectionReason.UNIT_DESTROYED,
                    "Unit " + unit.getId() + " has been destroyed");
        }
        if (unit.getPlayer() != state.getCurrentPlayer()) {
            throw new IllegalActionException(RejectionReason.NOT_YOUR_TURN,
                    "Unit " + unit.getId() + " belongs to player " + unit.getPlayer()
                            + ", player " + state.getCurrentPlayer() + " is acting");
        }
        if (!request.getKind().allowedIn(state.getCurrentPhase())) {
            throw new IllegalActionException(RejectionReason.WRONG_PHASE,
                    request.getKind() + " is not allowed in the " + state.getCurrentPhase() + " phase");
        }
        if (state.getActedThisPhase().contains(unit.getId())) {
            throw new IllegalActionException(RejectionReason.ALREADY_ACTED,
                    "Unit " + unit.getId() + " already acted in the " + state.getCurrentPhase() + " phase");
        }
        if (!state.getActivationPool().contains(unit.getId())) {
            RejectionReason reason = ineligibility(unit, state.getCurrentPhase());
            throw new IllegalActionException(reason != null ? reason : RejectionReason.NOT_ELIGIBLE,
                    "Unit " + unit.getId() + " cannot act in the " + state.getCurrentPhase() + " phase");
        }
        return unit;
    }

    private Hex requireHex(ActionRequest request) {
        if (request.getTargetHex() == null) {
            throw new IllegalActionException(RejectionReason.MISSING_TARGET,
                    request.getKind() + " needs a target hex");
        }
        return request.getTargetHex();
    }

    private Unit requireTarget(ActionRequest request) {
        if (request.getTargetUnitId() == null) {
            throw new IllegalActionException(RejectionReason.MISSING_TARGET,
                    request.getKind() + " needs a target unit");
        }
        return state.findUnit(request.getTargetUnitId())
                .orElseThrow(() -> new IllegalActionException(RejectionReason.INVALID_TARGET,
                        "Unknown target unit: " + request.getTargetUnitId()));
    }

    // ── actions ─────────────────────────────────────────────────────────

    private Applied executeMove(Unit unit, ActionRequest request) {
        Hex destination = requireHex(request);
        Hex start = unit.getPosition();
        BoardConfig board = state.getBoard();

        if (!board.inBounds(destination)) {
            throw new IllegalActionException(RejectionReason.OUT_OF_BOUNDS, destination + " is off the board");
        }
        if (board.isWall(destination)) {
            throw new IllegalActionException(RejectionReason.WALL, destination + " is a wall");
        }
        if (destination.equals(start)) {
            throw new IllegalActionException(RejectionReason.SAME_HEX,
                    "Unit " + unit.getId() + " is already at " + destination + "; pass instead");
        }
        MovementContext context = movementContext(unit);
        if (context.occupied().contains(destination)) {
            throw new IllegalActionException(RejectionReason.OCCUPIED, destination + " is occupied");
        }
        if (!rules.getReachability().reachable(start, destination, unit.getMove(), context)) {
            throw new IllegalActionException(RejectionReason.NO_PATH,
                    "No legal path from " + start + " to " + destination + " within " + unit.getMove() + " hexes");
        }
        if (context.enemyAdjacent().contains(destination)) {
            throw new IllegalActionException(RejectionReason.ENEMY_ADJACENT_DESTINATION,
                    "A move cannot end adjacent to an enemy: " + destination);
        }

        boolean fallingBack = isEngaged(unit);
        unit.setPosition(destination);
        if (fallingBack) {
            state.getFled().add(unit.getId());
        }
        return new Applied(rules.getRewards().move(),
                List.of(new UnitDelta(unit.getId(), start, destination, unit.getHp(), unit.getHp(), false)),
                null, null);
    }

    private Applied executeShoot(Unit unit, ActionRequest request) {
        Unit target = requireTarget(request);
        AttackOutcome outcome = rules.getShooting().resolveShot(unit, target, unit.getRangedWeapon(),
                state.getBoard().getWalls(), losBlockers(unit, target), dice);
        return attackApplied(target, outcome);
    }

    private Applied executeFight(Unit unit, ActionRequest request) {
        Unit target = requireTarget(request);
        AttackOutcome outcome = rules.getFighting().resolveFight(unit, target, dice);
        return attackApplied(target, outcome);
    }

    private Applied attackApplied(Unit target, AttackOutcome outcome) {
        UnitDelta delta = new UnitDelta(target.getId(), target.getPosition(), target.getPosition(),
                outcome.targetHpBefore(), outcome.targetHpAfter(), outcome.targetDestroyed());
        if (outcome.targetDestroyed()) {
            log.debug("Unit {} destroyed in turn {} {}", target.getId(), state.getTurnNumber(), state.getCurrentPhase());
        }
        return new Applied(rules.getRewards().attack(outcome), List.of(delta), outcome, null);
    }

    private Applied executeCharge(Unit unit, ActionRequest request) {
        Unit target = requireTarget(request);
        Hex destination = requireHex(request);
        ChargeOutcome outcome = rules.getCharging().resolveCharge(unit, target, destination,
                movementContext(unit), settings.chargeMaxDistance(), dice);
        if (outcome.success()) {
            state.getCharged().add(unit.getId());
        }
        List<UnitDelta> changes = outcome.success()
                ? List.of(new UnitDelta(unit.getId(), outcome.from(), outcome.to(), unit.getHp(), unit.getHp(), false))
                : List.of();
        return new Applied(rules.getRewards().charge(outcome), changes, null, outcome);
    }

    // ── phase flow ──────────────────────────────────────────────────────

    /**
     * Move to the next phase that has at least one eligible unit, ending turns as needed.
     */
    private void advance() {
        while (!state.isFinished()) {
            GamePhase next = state.getCurrentPhase().next();
            if (next != null) {
                state.setCurrentPhase(next);
            } else {
                endTurn();
                if (state.isFinished()) {
                    return;
                }
            }
            state.getActedThisPhase().clear();
            state.setActivationPool(buildPool(state.getCurrentPhase()));
            if (!state.getActivationPool().isEmpty()) {
                return;
            }
        }
    }

    private void endTurn() {
        int nextPlayer = 1 - state.getCurrentPlayer();
        if (nextPlayer == 0) {
            state.setTurnNumber(state.getTurnNumber() + 1);
        }
        state.setCurrentPlayer(nextPlayer);
        state.setCurrentPhase(GamePhase.MOVE);
        state.getFled().clear();
        state.getCharged().clear();

        if (state.getTurnNumber() > state.getMaxTurns()) {
            // This turn never starts
            state.setTurnNumber(state.getMaxTurns());
            finishOnBudget(EndReason.TURN_LIMIT);
        }
    }

    private void checkEpisodeEnd() {
        boolean player0Alive = !state.liveUnits(0).isEmpty();
        boolean player1Alive = !state.liveUnits(1).isEmpty();
        if (!player0Alive || !player1Alive) {
            finish(player0Alive ? 0 : (player1Alive ? 1 : null), EndReason.ELIMINATION);
        } else if (state.getStepCount() >= settings.maxSteps()) {
            finishOnBudget(EndReason.STEP_LIMIT);
        }
    }

    private void finishOnBudget(EndReason reason) {
        int hp0 = state.remainingHp(0);
        int hp1 = state.remainingHp(1);
        Integer winner = hp0 == hp1 ? null : (hp0 > hp1 ? 0 : 1);
        finish(winner, reason);
    }

    private void finish(Integer winner, EndReason reason) {
        state.setStatus(GameStatus.FINISHED);
        state.setCurrentPhase(GamePhase.GAME_OVER);
        state.setWinner(winner);
        state.setEndReason(reason);
        state.getActivationPool().clear();
        log.info("Episode {}/{} finished after {} steps in turn {}: {} ({})",
                state.getScenarioId(), state.getSeed(), state.getStepCount(), state.getTurnNumber(),
                winner == null ? "draw" : "player " + winner + " wins", reason);
    }

    private void verifyInvariants() {
        if (!settings.checkInvariants()) {
            return;
        }
        try {
            rules.getInvariants().check(state);
        } catch (InvariantViolationException e) {
            state.setStatus(GameStatus.HALTED);
            log.error("Invariant violation, halting episode {}/{}: {}", state.getScenarioId(), state.getSeed(), e.getMessage());
            throw e;
        }
    }

    // ── activation pools ────────────────────────────────────────────────

    private Set<String> buildPool(GamePhase phase) {
        Set<String> pool = new LinkedHashSet<>();
        for (Unit unit : state.liveUnits(state.getCurrentPlayer())) {
            if (ineligibility(unit, phase) == null) {
                pool.add(unit.getId());
            }
        }
        return pool;
    }

    /**
     * Drop units killed during the phase.
     */
    private void refreshPool() {
        state.getActivationPool().removeIf(id -> state.findUnit(id).map(u -> !u.isAlive()).orElse(true));
    }

    /**
     * Why a live unit of the acting player cannot take the phase action, or null if it can.
     */
    private RejectionReason ineligibility(Unit unit, GamePhase phase) {
        return switch (phase) {
            case MOVE -> null;
            case SHOOT -> {
                if (!unit.hasRangedWeapon()) yield RejectionReason.NO_WEAPON;
                if (state.getFled().contains(unit.getId())) yield RejectionReason.FLED;
                yield isEngaged(unit) ? RejectionReason.ENGAGED : null;
            }
            case CHARGE -> {
                if (!unit.hasMeleeWeapon()) yield RejectionReason.NO_WEAPON;
                if (state.getFled().contains(unit.getId())) yield RejectionReason.FLED;
                if (isEngaged(unit)) yield RejectionReason.ENGAGED;
                yield hasEnemyWithin(unit, settings.chargeMaxDistance()) ? null : RejectionReason.OUT_OF_RANGE;
            }
            case FIGHT -> {
                if (!unit.hasMeleeWeapon()) yield RejectionReason.NO_WEAPON;
                yield fightTargets(unit).isEmpty() ? RejectionReason.NOT_ADJACENT : null;
            }
            case GAME_OVER -> RejectionReason.GAME_OVER;
        };
    }

    // ── rule queries (shared with bots and action masks) ────────────────

    private boolean isEngaged(Unit unit) {
        return !fightTargets(unit).isEmpty();
    }

    private boolean hasEnemyWithin(Unit unit, int distance) {
        return state.liveUnits().stream().anyMatch(other -> other.isEnemyOf(unit)
                && rules.getGeometry().distance(unit.getPosition(), other.getPosition()) <= distance);
    }

    private MovementContext movementContext(Unit mover) {
        Set<Hex> occupied = new HashSet<>();
        Set<Hex> enemyAdjacent = new HashSet<>();
        for (Unit other : state.liveUnits()) {
            if (other.getId().equals(mover.getId())) {
                continue;
            }
            occupied.add(other.getPosition());
            if (other.isEnemyOf(mover)) {
                enemyAdjacent.addAll(rules.getGeometry().neighbors(other.getPosition(), state.getBoard()));
            }
        }
        return new MovementContext(state.getBoard(), occupied, enemyAdjacent);
    }

    private Set<Hex> losBlockers(Unit shooter, Unit target) {
        Set<Hex> blockers = new HashSet<>();
        for (Unit other : state.liveUnits()) {
            if (other.isBlocksLineOfSight() && !other.getId().equals(shooter.getId())
                    && !other.getId().equals(target.getId())) {
                blockers.add(other.getPosition());
            }
        }
        return blockers;
    }

    private List<Unit> shootTargets(Unit shooter) {
        if (!shooter.hasRangedWeapon()) {
            return List.of();
        }
        int range = shooter.getRangedWeapon().range();
        List<Unit> targets = new ArrayList<>();
        for (Unit enemy : state.liveUnits()) {
            if (enemy.isEnemyOf(shooter)
                    && rules.getGeometry().distance(shooter.getPosition(), enemy.getPosition()) <= range
                    && rules.getLineOfSight().hasLineOfSight(shooter.getPosition(), enemy.getPosition(),
                            state.getBoard().getWalls(), losBlockers(shooter, enemy))) {
                targets.add(enemy);
            }
        }
        return targets;
    }

    private List<ActionRequest> chargeOptions(Unit charger) {
        if (!charger.hasMeleeWeapon()) {
            return List.of();
        }
        MovementContext context = movementContext(charger);
        List<ActionRequest> options = new ArrayList<>();
        for (Unit enemy : state.liveUnits()) {
            if (!enemy.isEnemyOf(charger)
                    || rules.getGeometry().distance(charger.getPosition(), enemy.getPosition()) > settings.chargeMaxDistance()) {
                continue;
            }
            for (Hex hex : rules.getGeometry().neighbors(enemy.getPosition(), state.getBoard())) {
                if (!state.getBoard().isWall(hex) && !context.occupied().contains(hex)) {
                    options.add(ActionRequest.charge(charger.getId(), enemy.getId(), hex));
                }
            }
        }
        return options;
    }

    private List<Unit> fightTargets(Unit unit) {
        List<Unit> targets = new ArrayList<>();
        for (Unit enemy : state.liveUnits()) {
            if (enemy.isEnemyOf(unit) && rules.getGeometry().isAdjacent(unit.getPosition(), enemy.getPosition())) {
                targets.add(enemy);
            }
        }
        return targets;
    }

    /**
     * Every request the unit could legally submit right now, PASS included. Empty when the
     * unit cannot act in the current phase.
     */
    public List<ActionRequest> legalActions(String unitId) {
        Unit unit = state.findUnit(unitId).orElse(null);
        if (unit == null || state.isFinished() || !state.getActivationPool().contains(unitId)) {
            return List.of();
        }
        List<ActionRequest> actions = new ArrayList<>();
        switch (state.getCurrentPhase()) {
            case MOVE -> legalMoveDestinations(unitId).forEach(h -> actions.add(ActionRequest.move(unitId, h)));
            case SHOOT -> shootTargets(unit).forEach(t -> actions.add(ActionRequest.shoot(unitId, t.getId())));
            case CHARGE -> actions.addAll(chargeOptions(unit));
            case FIGHT -> fightTargets(unit).forEach(t -> actions.add(ActionRequest.fight(unitId, t.getId())));
            case GAME_OVER -> {
                return List.of();
            }
        }
        actions.add(ActionRequest.pass(unitId));
        return actions;
    }

    /**
     * Hexes the unit may legally end a move on: reachable through legal hexes, free, and not
     * adjacent to an enemy.
     */
    public Set<Hex> legalMoveDestinations(String unitId) {
        Unit unit = state.findUnit(unitId).orElse(null);
        if (unit == null || !unit.isAlive()) {
            return Set.of();
        }
        return rules.getReachability().reachableHexes(unit.getPosition(), unit.getMove(), movementContext(unit));
    }

    // ── read access ─────────────────────────────────────────────────────

    /**
     * Flattened numeric snapshot of the committed state.
     */
    public float[] observe() {
        return rules.getObservations().build(state);
    }

    /**
     * Deep copy of the current state; changes to it do not affect the episode.
     */
    public GameState view() {
        return state.copy();
    }

    public List<String> activationPool() {
        return List.copyOf(state.getActivationPool());
    }

    public List<ActionRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public boolean isTerminal() {
        return state.isFinished();
    }

    public GameStatus getStatus() {
        return state.getStatus();
    }

    public Integer getWinner() {
        return state.getWinner();
    }

    public int getTurnNumber() {
        return state.getTurnNumber();
    }

    public GamePhase getCurrentPhase() {
        return state.getCurrentPhase();
    }

    public int getCurrentPlayer() {
        return state.getCurrentPlayer();
    }

    public String getScenarioId() {
        return state.getScenarioId();
    }

    public long getSeed() {
        return state.getSeed();
    }

    private record Applied(double reward, List<UnitDelta> changes, AttackOutcome attack, ChargeOutcome charge) {}
}
