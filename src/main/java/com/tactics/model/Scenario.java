package com.tactics.model;

import java.util.List;

/**
 * A validated, ready-to-play scenario: board plus initial unit placements.
 * Units are templates; every episode receives its own copies.
 */
public record Scenario(
        String id,
        String name,
        BoardConfig board,
        List<Unit> units,
        Integer maxTurns
) {

    public Scenario {
        units = List.copyOf(units);
    }

    public List<Unit> freshUnits() {
        return units.stream().map(Unit::copy).toList();
    }
}
