package com.tactics.engine;

import com.tactics.model.BoardConfig;
import com.tactics.model.Hex;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;

/**
 * Pure hex-grid math for the odd-q offset layout (odd columns shifted down by half a hex).
 */
@Component
public class HexGeometry {

    private static final int[][] EVEN_COL_OFFSETS = {{0, -1}, {1, -1}, {1, 0}, {0, 1}, {-1, 0}, {-1, -1}};
    private static final int[][] ODD_COL_OFFSETS = {{0, -1}, {1, 0}, {1, 1}, {0, 1}, {-1, 1}, {-1, 0}};

    // Nudge applied to both line endpoints so samples never land exactly between two hexes.
    private static final double EPS_X = 1e-6;
    private static final double EPS_Y = 2e-6;
    private static final double EPS_Z = -3e-6;

    private static final Comparator<Hex> CANONICAL_ORDER =
            Comparator.comparingInt(Hex::col).thenComparingInt(Hex::row);

    /**
     * The six neighbors of a hex, in N, NE, SE, S, SW, NW order. May include off-board hexes.
     */
    public List<Hex> neighbors(Hex hex) {
        int[][] offsets = (hex.col() & 1) == 0 ? EVEN_COL_OFFSETS : ODD_COL_OFFSETS;
        List<Hex> result = new ArrayList<>(6);
        for (int[] offset : offsets) {
            result.add(Hex.of(hex.col() + offset[0], hex.row() + offset[1]));
        }
        return result;
    }

    /**
     * Neighbors that fall inside the board (walls included).
     */
    public List<Hex> neighbors(Hex hex, BoardConfig board) {
        List<Hex> result = neighbors(hex);
        result.removeIf(h -> !board.inBounds(h));
        return result;
    }

    public int distance(Hex a, Hex b) {
        int ax = a.col();
        int az = cubeZ(a);
        int ay = -ax - az;
        int bx = b.col();
        int bz = cubeZ(b);
        int by = -bx - bz;
        return Math.max(Math.abs(ax - bx), Math.max(Math.abs(ay - by), Math.abs(az - bz)));
    }

    public boolean isAdjacent(Hex a, Hex b) {
        return distance(a, b) == 1;
    }

    /**
     * Hexes crossed by the straight line between two hexes, endpoints included, ordered from
     * {@code a} to {@code b}.
     * <p>
     * The line is always sampled from the canonically smaller endpoint, so {@code line(a, b)}
     * and {@code line(b, a)} contain exactly the same hexes.
     */
    public List<Hex> line(Hex a, Hex b) {
        boolean swapped = CANONICAL_ORDER.compare(a, b) > 0;
        Hex from = swapped ? b : a;
        Hex to = swapped ? a : b;

        int n = distance(from, to);
        List<Hex> path = new ArrayList<>(n + 1);
        if (n == 0) {
            path.add(from);
            return path;
        }

        double fx = from.col() + EPS_X;
        double fz = cubeZ(from) + EPS_Z;
        double fy = -from.col() - cubeZ(from) + EPS_Y;
        double tx = to.col() + EPS_X;
        double tz = cubeZ(to) + EPS_Z;
        double ty = -to.col() - cubeZ(to) + EPS_Y;

        for (int i = 0; i <= n; i++) {
            double t = (double) i / n;
            path.add(cubeRound(fx + (tx - fx) * t, fy + (ty - fy) * t, fz + (tz - fz) * t));
        }
        if (swapped) {
            Collections.reverse(path);
        }
        return path;
    }

    private static int cubeZ(Hex hex) {
        return hex.row() - ((hex.col() - (hex.col() & 1)) >> 1);
    }

    private Hex cubeRound(double x, double y, double z) {
        long rx = Math.round(x);
        long ry = Math.round(y);
        long rz = Math.round(z);

        double dx = Math.abs(rx - x);
        double dy = Math.abs(ry - y);
        double dz = Math.abs(rz - z);

        if (dx > dy && dx > dz) {
            rx = -ry - rz;
        } else if (dy > dz) {
            ry = -rx - rz;
        } else {
            rz = -rx - ry;
        }
        int col = (int) rx;
        int row = (int) rz + ((col - (col & 1)) >> 1);
        return Hex.of(col, row);
    }
}
