package com.tactics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * The mutable world of one episode.
 * <p>
 * Owned exclusively by a single {@code TurnPhaseStateMachine}; never shared between episodes.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GameState {

    private String scenarioId;

    private long seed;

    private BoardConfig board;

    /** Units of both players in scenario order. Destroyed units stay listed with hp 0. */
    @Builder.Default
    private List<Unit> units = new ArrayList<>();

    @Builder.Default
    private int turnNumber = 1;

    @Builder.Default
    private GamePhase currentPhase = GamePhase.MOVE;

    private int currentPlayer;

    /** Accepted actions so far. */
    private int stepCount;

    private int maxTurns;

    @Builder.Default
    private GameStatus status = GameStatus.IN_PROGRESS;

    /** Winning player, or null for a draw / unfinished episode. */
    private Integer winner;

    private EndReason endReason;

    /** Units that acted or passed in the current phase. */
    @Builder.Default
    private Set<String> actedThisPhase = new LinkedHashSet<>();

    /** Units that moved out of engagement this turn. */
    @Builder.Default
    private Set<String> fled = new LinkedHashSet<>();

    /** Units that completed a successful charge this turn. */
    @Builder.Default
    private Set<String> charged = new LinkedHashSet<>();

    /** Units of the acting player still expected to act in the current phase. */
    @Builder.Default
    private Set<String> activationPool = new LinkedHashSet<>();

    public Optional<Unit> findUnit(String unitId) {
        if (unitId == null) return Optional.empty();
        return units.stream().filter(u -> unitId.equals(u.getId())).findFirst();
    }

    public List<Unit> liveUnits() {
        return units.stream().filter(Unit::isAlive).toList();
    }

    public List<Unit> liveUnits(int player) {
        return units.stream().filter(u -> u.isAlive() && u.getPlayer() == player).toList();
    }

    public int remainingHp(int player) {
        return liveUnits(player).stream().mapToInt(Unit::getHp).sum();
    }

    public boolean isFinished() {
        return status != GameStatus.IN_PROGRESS;
    }

    /**
     * Deep copy, used for read-only views handed to bots and observers.
     */
    public GameState copy() {
        return GameState.builder()
                .scenarioId(scenarioId)
                .seed(seed)
                .board(board)
                .units(new ArrayList<>(units.stream().map(Unit::copy).toList()))
                .turnNumber(turnNumber)
                .currentPhase(currentPhase)
                .currentPlayer(currentPlayer)
                .stepCount(stepCount)
                .maxTurns(maxTurns)
                .status(status)
                .winner(winner)
                .endReason(endReason)
                .actedThisPhase(new LinkedHashSet<>(actedThisPhase))
                .fled(new LinkedHashSet<>(fled))
                .charged(new LinkedHashSet<>(charged))
                .activationPool(new LinkedHashSet<>(activationPool))
                .build();
    }

    /**
     * Multi-line dump of the full state, attached to invariant violations.
     */
    public String describe() {
        String unitLines = units.stream()
                .map(u -> String.format("  %s p%d %s hp=%d/%d models=%d%s",
                        u.getId(), u.getPlayer(), u.getPosition(), u.getHp(), u.getHpMax(),
                        u.getAliveModels(), u.isAlive() ? "" : " DEAD"))
                .collect(Collectors.joining("\n"));
        return String.format("scenario=%s seed=%d turn=%d phase=%s player=%d steps=%d status=%s%n"
                        + "board=%s pool=%s acted=%s fled=%s charged=%s%n%s",
                scenarioId, seed, turnNumber, currentPhase, currentPlayer, stepCount, status,
                board, activationPool, actedThisPhase, fled, charged, unitLines);
    }
}
