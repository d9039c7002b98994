package com.tactics.engine;

import com.tactics.model.Hex;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Set;

/**
 * Decides whether a sight line between two hexes is clear.
 * <p>
 * A line is blocked when any hex strictly between the endpoints is a wall or holds a
 * LoS-blocking unit. Symmetric: {@code hasLineOfSight(a, b) == hasLineOfSight(b, a)}.
 */
@Component
public class LineOfSightEngine {

    private final HexGeometry geometry;

    public LineOfSightEngine(HexGeometry geometry) {
        this.geometry = geometry;
    }

    public boolean hasLineOfSight(Hex from, Hex to, Set<Hex> walls, Set<Hex> blockingUnits) {
        return firstObstruction(from, to, walls, blockingUnits) == null;
    }

    /**
     * First blocking hex walking from {@code from} towards {@code to}, or null when clear.
     */
    public Hex firstObstruction(Hex from, Hex to, Set<Hex> walls, Set<Hex> blockingUnits) {
        List<Hex> path = geometry.line(from, to);
        for (int i = 1; i < path.size() - 1; i++) {
            Hex hex = path.get(i);
            if (walls.contains(hex) || blockingUnits.contains(hex)) {
                return hex;
            }
        }
        return null;
    }
}
