package com.tactics.engine;

import com.tactics.model.BoardConfig;
import com.tactics.model.Hex;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.OptionalInt;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ReachabilityValidatorTest {

    private final HexGeometry geometry = new HexGeometry();
    private final ReachabilityValidator validator = new ReachabilityValidator(geometry);
    private final BoardConfig board = BoardConfig.open(25, 21);

    private static final Hex START = Hex.of(9, 12);
    private static final Hex END = Hex.of(3, 9);

    @Test
    @DisplayName("open board: (9,12) reaches (3,9) with move 6 but not with 5")
    void shouldReachOnOpenBoard() {
        MovementContext context = MovementContext.empty(board);

        assertTrue(validator.reachable(START, END, 6, context));
        assertFalse(validator.reachable(START, END, 5, context));
        assertEquals(OptionalInt.of(6), validator.shortestDistance(START, END, 10, context));
    }

    @Test
    @DisplayName("a wall on the only shortening first step lengthens the path")
    void shouldDetourAroundWall() {
        BoardConfig walled = new BoardConfig(25, 21, Set.of(Hex.of(8, 12)));
        MovementContext context = MovementContext.empty(walled);

        assertFalse(validator.reachable(START, END, 6, context));
        assertTrue(validator.reachable(START, END, 7, context));
    }

    @Test
    @DisplayName("walling off the west side of (9,12) makes (3,9) unreachable with move 6")
    void shouldBlockWhenPathSideIsWalled() {
        BoardConfig walled = new BoardConfig(25, 21,
                Set.of(Hex.of(9, 11), Hex.of(8, 12), Hex.of(8, 13), Hex.of(9, 13)));
        MovementContext context = MovementContext.empty(walled);

        assertFalse(validator.reachable(START, END, 6, context));
        assertTrue(validator.shortestDistance(START, END, 6, context).isEmpty());
        assertTrue(validator.reachable(START, END, 12, context));
    }

    @Test
    @DisplayName("walls and off-board destinations are never reachable")
    void shouldRejectImpassableDestination() {
        BoardConfig walled = new BoardConfig(25, 21, Set.of(END));

        assertFalse(validator.reachable(START, END, 20, MovementContext.empty(walled)));
        assertFalse(validator.reachable(START, Hex.of(30, 3), 50, MovementContext.empty(board)));
        assertFalse(validator.reachable(START, Hex.of(-1, 3), 50, MovementContext.empty(board)));
    }

    @Test
    @DisplayName("enemy-adjacent hexes block transit but not the destination")
    void shouldPruneEnemyAdjacentIntermediates() {
        Hex from = Hex.of(0, 5);
        Hex to = Hex.of(2, 5);
        MovementContext context = new MovementContext(board, Set.of(), Set.of(Hex.of(1, 4), Hex.of(1, 5)));

        assertFalse(validator.reachable(from, to, 2, context));
        assertTrue(validator.reachable(from, to, 4, context));

        MovementContext destinationOnly = new MovementContext(board, Set.of(), Set.of(to));
        assertTrue(validator.reachable(from, to, 2, destinationOnly));
    }

    @Test
    @DisplayName("occupied hexes cannot be moved through")
    void shouldNotPassThroughUnits() {
        Hex from = Hex.of(5, 2);
        Hex to = Hex.of(5, 4);
        MovementContext context = new MovementContext(board, Set.of(Hex.of(5, 3)), Set.of());

        assertEquals(OptionalInt.of(3), validator.shortestDistance(from, to, 10, context));
    }

    @Test
    @DisplayName("same hex is reachable with zero steps")
    void shouldReachStartImmediately() {
        assertEquals(OptionalInt.of(0), validator.shortestDistance(START, START, 0, MovementContext.empty(board)));
    }

    @Nested
    @DisplayName("reachableHexes()")
    class ReachableHexes {

        @Test
        @DisplayName("move 1 on an open board yields the six neighbors")
        void shouldReturnNeighbors() {
            assertEquals(new HashSet<>(geometry.neighbors(START)),
                    validator.reachableHexes(START, 1, MovementContext.empty(board)));
        }

        @Test
        @DisplayName("agrees with reachable() for every hex within range")
        void shouldAgreeWithReachable() {
            Set<Hex> walls = Set.of(Hex.of(8, 12), Hex.of(8, 11), Hex.of(10, 10));
            BoardConfig walled = new BoardConfig(25, 21, walls);
            MovementContext context = new MovementContext(walled, Set.of(Hex.of(9, 10)), Set.of(Hex.of(11, 12)));

            Set<Hex> reachable = validator.reachableHexes(START, 3, context);
            for (int c = 0; c < 25; c++) {
                for (int r = 0; r < 21; r++) {
                    Hex hex = Hex.of(c, r);
                    if (hex.equals(START) || context.occupied().contains(hex) || context.enemyAdjacent().contains(hex)) {
                        continue;
                    }
                    assertEquals(validator.reachable(START, hex, 3, context), reachable.contains(hex), hex.toString());
                }
            }
        }
    }

    @Test
    @DisplayName("reachability is monotonic in the move range")
    void shouldBeMonotonic() {
        Random random = new Random(3);
        Set<Hex> walls = new HashSet<>();
        for (int i = 0; i < 60; i++) {
            walls.add(Hex.of(random.nextInt(25), random.nextInt(21)));
        }
        walls.remove(START);
        BoardConfig walled = new BoardConfig(25, 21, walls);
        MovementContext context = MovementContext.empty(walled);

        for (int i = 0; i < 100; i++) {
            Hex target = Hex.of(random.nextInt(25), random.nextInt(21));
            boolean before = false;
            for (int range = 0; range <= 12; range++) {
                boolean now = validator.reachable(START, target, range, context);
                assertTrue(!before || now, "lost reachability of " + target + " at range " + range);
                before = now;
            }
        }
    }
}
