package com.tactics.model;

import com.tactics.exception.ConfigurationException;
import lombok.Getter;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Immutable board geometry: a rectangular odd-q hex layout with static wall cells.
 */
@Getter
public final class BoardConfig {

    private final int cols;
    private final int rows;
    private final Set<Hex> walls;

    public BoardConfig(int cols, int rows, Set<Hex> walls) {
        if (cols <= 0 || rows <= 0) {
            throw new ConfigurationException("Board dimensions must be positive, got " + cols + "x" + rows);
        }
        for (Hex wall : walls) {
            if (wall.col() < 0 || wall.row() < 0 || wall.col() >= cols || wall.row() >= rows) {
                throw new ConfigurationException("Wall " + wall + " is outside the " + cols + "x" + rows + " board");
            }
        }
        this.cols = cols;
        this.rows = rows;
        this.walls = Set.copyOf(new LinkedHashSet<>(walls));
    }

    public static BoardConfig open(int cols, int rows) {
        return new BoardConfig(cols, rows, Set.of());
    }

    public boolean inBounds(Hex hex) {
        return hex.col() >= 0 && hex.row() >= 0 && hex.col() < cols && hex.row() < rows;
    }

    public boolean isWall(Hex hex) {
        return walls.contains(hex);
    }

    /** In bounds and not a wall. */
    public boolean isPassable(Hex hex) {
        return inBounds(hex) && !walls.contains(hex);
    }

    @Override
    public String toString() {
        return "BoardConfig[" + cols + "x" + rows + ", walls=" + walls.size() + "]";
    }
}
