package com.tactics.engine;

import com.tactics.model.Hex;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.OptionalInt;
import java.util.Set;

/**
 * Breadth-first movement search over the hex grid.
 * <p>
 * Candidate neighbors are pruned in this order: already visited, out of bounds, wall,
 * occupied by another live unit, adjacent to a live enemy. The last two are waived for the
 * destination hex only. Whether a destination adjacent to an enemy is an acceptable end
 * point is decided by the caller, not here.
 * <p>
 * Every method is a pure function of its arguments; the live engine and the replay
 * validator both call this one implementation.
 */
@Component
public class ReachabilityValidator {

    private final HexGeometry geometry;

    public ReachabilityValidator(HexGeometry geometry) {
        this.geometry = geometry;
    }

    public boolean reachable(Hex start, Hex end, int moveRange, MovementContext context) {
        return shortestDistance(start, end, moveRange, context).isPresent();
    }

    /**
     * BFS path length from {@code start} to {@code end} using at most {@code moveRange} steps,
     * or empty when unreachable.
     */
    public OptionalInt shortestDistance(Hex start, Hex end, int moveRange, MovementContext context) {
        if (moveRange < 0 || !context.board().isPassable(end)) {
            return OptionalInt.empty();
        }
        if (start.equals(end)) {
            return OptionalInt.of(0);
        }

        Map<Hex, Integer> visited = new HashMap<>();
        ArrayDeque<Hex> queue = new ArrayDeque<>();
        visited.put(start, 0);
        queue.add(start);

        while (!queue.isEmpty()) {
            Hex current = queue.poll();
            int depth = visited.get(current);
            if (depth >= moveRange) {
                continue;
            }
            for (Hex next : geometry.neighbors(current)) {
                if (!admit(next, end, visited.keySet(), context)) {
                    continue;
                }
                if (next.equals(end)) {
                    return OptionalInt.of(depth + 1);
                }
                visited.put(next, depth + 1);
                queue.add(next);
            }
        }
        return OptionalInt.empty();
    }

    /**
     * Every hex reachable from {@code start} within {@code moveRange} steps through legal
     * intermediate hexes, excluding {@code start}. Hexes that are occupied or enemy-adjacent
     * never appear, since they are only admissible as an explicit destination.
     */
    public Set<Hex> reachableHexes(Hex start, int moveRange, MovementContext context) {
        Map<Hex, Integer> visited = new HashMap<>();
        Set<Hex> result = new LinkedHashSet<>();
        ArrayDeque<Hex> queue = new ArrayDeque<>();
        visited.put(start, 0);
        queue.add(start);

        while (!queue.isEmpty()) {
            Hex current = queue.poll();
            int depth = visited.get(current);
            if (depth >= moveRange) {
                continue;
            }
            for (Hex next : geometry.neighbors(current)) {
                if (!admit(next, null, visited.keySet(), context)) {
                    continue;
                }
                visited.put(next, depth + 1);
                result.add(next);
                queue.add(next);
            }
        }
        return result;
    }

    private boolean admit(Hex candidate, Hex end, Set<Hex> visited, MovementContext context) {
        if (visited.contains(candidate)) {
            return false;
        }
        if (!context.board().inBounds(candidate)) {
            return false;
        }
        if (context.board().isWall(candidate)) {
            return false;
        }
        boolean destination = candidate.equals(end);
        if (context.occupied().contains(candidate) && !destination) {
            return false;
        }
        return !context.enemyAdjacent().contains(candidate) || destination;
    }
}
