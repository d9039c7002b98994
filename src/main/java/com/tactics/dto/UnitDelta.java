package com.tactics.dto;

import com.tactics.model.Hex;

/**
 * Change to one unit caused by an action.
 */
public record UnitDelta(
        String unitId,
        Hex from,
        Hex to,
        int hpBefore,
        int hpAfter,
        boolean destroyed
) {}
