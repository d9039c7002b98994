package com.tactics.dto;

import com.tactics.exception.RejectionReason;
import com.tactics.model.EndReason;
import com.tactics.model.GamePhase;
import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * Outcome of one step: legality verdict, state changes, reward and the state that follows.
 */
@Data
@Builder
public class ActionResult {

    private boolean accepted;
    private RejectionReason reason;
    private String message;

    @Builder.Default
    private List<UnitDelta> changes = List.of();
    private AttackOutcome attack;
    private ChargeOutcome charge;

    private double reward;
    private boolean terminal;
    private Integer winner;
    private EndReason endReason;

    // State after the step
    private int turnNumber;
    private GamePhase phase;
    private int currentPlayer;
    private float[] observation;
}
