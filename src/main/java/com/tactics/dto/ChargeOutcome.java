package com.tactics.dto;

import com.tactics.model.Hex;

/**
 * Result of a charge attempt. A failed charge is still a legal, consumed action.
 *
 * @param chargeRoll   2d6 charge distance rolled
 * @param pathLength   BFS path length to the destination, or -1 if out of reach
 * @param success      whether the unit reached its destination
 * @param from         starting hex
 * @param to           hex the unit ends on (equal to {@code from} on failure)
 */
public record ChargeOutcome(
        int chargeRoll,
        int pathLength,
        boolean success,
        Hex from,
        Hex to
) {}
