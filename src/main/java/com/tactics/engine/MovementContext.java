package com.tactics.engine;

import com.tactics.model.BoardConfig;
import com.tactics.model.Hex;

import java.util.Set;

/**
 * Snapshot of everything a reachability query depends on.
 *
 * @param board         bounds and walls
 * @param occupied      hexes held by other live units (the mover excluded)
 * @param enemyAdjacent in-bounds hexes adjacent to a live enemy of the mover
 */
public record MovementContext(
        BoardConfig board,
        Set<Hex> occupied,
        Set<Hex> enemyAdjacent
) {

    public MovementContext {
        occupied = Set.copyOf(occupied);
        enemyAdjacent = Set.copyOf(enemyAdjacent);
    }

    public static MovementContext empty(BoardConfig board) {
        return new MovementContext(board, Set.of(), Set.of());
    }
}
