package com.tactics.model;

import com.tactics.exception.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for BoardConfig.
 */
class BoardConfigTest {

    @Test
    @DisplayName("should classify bounds, walls and passable hexes")
    void shouldClassifyHexes() {
        BoardConfig board = new BoardConfig(5, 4, Set.of(Hex.of(2, 2)));

        assertTrue(board.inBounds(Hex.of(0, 0)));
        assertTrue(board.inBounds(Hex.of(4, 3)));
        assertFalse(board.inBounds(Hex.of(5, 0)));
        assertFalse(board.inBounds(Hex.of(0, -1)));

        assertTrue(board.isWall(Hex.of(2, 2)));
        assertFalse(board.isPassable(Hex.of(2, 2)));
        assertFalse(board.isPassable(Hex.of(-1, 2)));
        assertTrue(board.isPassable(Hex.of(2, 1)));
    }

    @Test
    @DisplayName("should reject walls outside the board")
    void shouldRejectOutOfBoundsWall() {
        assertThrows(ConfigurationException.class, () -> new BoardConfig(5, 4, Set.of(Hex.of(5, 0))));
    }

    @Test
    @DisplayName("should reject non-positive dimensions")
    void shouldRejectEmptyBoard() {
        assertThrows(ConfigurationException.class, () -> BoardConfig.open(0, 4));
    }

    @Test
    @DisplayName("wall set cannot be modified after construction")
    void shouldBeImmutable() {
        Set<Hex> walls = new HashSet<>(Set.of(Hex.of(1, 1)));
        BoardConfig board = new BoardConfig(5, 4, walls);

        walls.add(Hex.of(3, 3));

        assertFalse(board.isWall(Hex.of(3, 3)));
        assertThrows(UnsupportedOperationException.class, () -> board.getWalls().add(Hex.of(0, 0)));
    }
}
