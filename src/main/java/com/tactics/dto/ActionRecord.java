package com.tactics.dto;

import com.tactics.exception.RejectionReason;
import com.tactics.model.GamePhase;
import com.tactics.model.Hex;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One line of the episode log: everything needed to re-submit the request and compare
 * the verdict during forensic replay.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ActionRecord {

    private int sequence;
    private int turn;
    private GamePhase phase;
    private int player;

    private String unitId;
    private ActionKind kind;
    private Hex targetHex;
    private String targetUnitId;

    private boolean accepted;
    private RejectionReason reason;

    private Hex from;
    private Hex to;
    private int damage;
    private Integer targetHpAfter;
    @Builder.Default
    private List<Integer> diceRolls = new ArrayList<>();

    private double reward;
    private boolean terminal;

    public ActionRequest toRequest() {
        return new ActionRequest(unitId, kind, targetHex, targetUnitId);
    }
}
