package com.tactics.dto;

import com.tactics.model.Hex;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * An external request for one unit to act.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ActionRequest {

    private String unitId;
    private ActionKind kind;
    private Hex targetHex;
    private String targetUnitId;

    public static ActionRequest move(String unitId, Hex destination) {
        return new ActionRequest(unitId, ActionKind.MOVE, destination, null);
    }

    public static ActionRequest shoot(String unitId, String targetUnitId) {
        return new ActionRequest(unitId, ActionKind.SHOOT, null, targetUnitId);
    }

    public static ActionRequest charge(String unitId, String targetUnitId, Hex destination) {
        return new ActionRequest(unitId, ActionKind.CHARGE, destination, targetUnitId);
    }

    public static ActionRequest fight(String unitId, String targetUnitId) {
        return new ActionRequest(unitId, ActionKind.FIGHT, null, targetUnitId);
    }

    public static ActionRequest pass(String unitId) {
        return new ActionRequest(unitId, ActionKind.PASS, null, null);
    }
}
