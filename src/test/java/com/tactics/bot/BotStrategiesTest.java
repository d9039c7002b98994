package com.tactics.bot;

import com.tactics.dto.ActionKind;
import com.tactics.dto.ActionRequest;
import com.tactics.engine.HexGeometry;
import com.tactics.engine.ScriptedDice;
import com.tactics.engine.TurnPhaseStateMachine;
import com.tactics.model.BoardConfig;
import com.tactics.model.GamePhase;
import com.tactics.model.Hex;
import com.tactics.model.Unit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Random;

import static com.tactics.engine.EngineFixtures.machine;
import static com.tactics.engine.EngineFixtures.state;
import static com.tactics.engine.EngineFixtures.unit;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Decision tests for the scripted bots against live state machines.
 */
class BotStrategiesTest {

    private static final BoardConfig BOARD = BoardConfig.open(16, 12);

    private final HexGeometry geometry = new HexGeometry();

    private TurnPhaseStateMachine approach() {
        return machine(state(BOARD,
                unit("a1", 0, 2, 5).build(),
                unit("b1", 1, 14, 5).build()), new ScriptedDice());
    }

    /** Player 0 in its SHOOT phase with two enemies in range. */
    private TurnPhaseStateMachine firingLine() {
        TurnPhaseStateMachine machine = machine(state(BOARD,
                unit("a1", 0, 2, 5).build(),
                unit("b1", 1, 8, 3).models(3).build(),
                unit("b2", 1, 8, 7).hp(1).build(),
                unit("b3", 1, 9, 5).hp(2).rangedWeapon(null).build()), new ScriptedDice());
        machine.step(ActionRequest.pass("a1"));
        assertEquals(GamePhase.SHOOT, machine.getCurrentPhase());
        return machine;
    }

    @Nested
    @DisplayName("RandomBotStrategy")
    class RandomBot {

        private final RandomBotStrategy strategy = new RandomBotStrategy();

        @Test
        @DisplayName("getDifficulty() should return EASY")
        void shouldReturnEasyDifficulty() {
            assertEquals(BotDifficulty.EASY, strategy.getDifficulty());
        }

        @Test
        @DisplayName("always picks one of the legal actions")
        void shouldPickLegalAction() {
            TurnPhaseStateMachine machine = approach();
            Random random = new Random(1);

            for (int i = 0; i < 20; i++) {
                ActionRequest decision = strategy.decide(machine, "a1", random);
                assertTrue(machine.legalActions("a1").contains(decision), decision.toString());
            }
        }

        @Test
        @DisplayName("passes for a unit outside the pool")
        void shouldPassWhenNothingIsLegal() {
            assertEquals(ActionKind.PASS, strategy.decide(approach(), "b1", new Random(1)).getKind());
        }
    }

    @Nested
    @DisplayName("GreedyBotStrategy")
    class GreedyBot {

        private final GreedyBotStrategy strategy = new GreedyBotStrategy(geometry);

        @Test
        @DisplayName("moves as close to the nearest enemy as it legally can")
        void shouldCloseDistance() {
            TurnPhaseStateMachine machine = approach();
            Hex enemy = Hex.of(14, 5);

            ActionRequest decision = strategy.decide(machine, "a1", new Random(1));

            assertEquals(ActionKind.MOVE, decision.getKind());
            int best = machine.legalMoveDestinations("a1").stream()
                    .mapToInt(h -> geometry.distance(h, enemy)).min().orElseThrow();
            assertEquals(best, geometry.distance(decision.getTargetHex(), enemy));
            assertTrue(machine.step(decision).isAccepted());
        }

        @Test
        @DisplayName("shoots the weakest target in sight")
        void shouldShootWeakest() {
            ActionRequest decision = strategy.decide(firingLine(), "a1", new Random(1));

            assertEquals(ActionKind.SHOOT, decision.getKind());
            assertEquals("b2", decision.getTargetUnitId());
        }
    }

    @Nested
    @DisplayName("DefensiveBotStrategy")
    class DefensiveBot {

        private final DefensiveBotStrategy strategy = new DefensiveBotStrategy(geometry);

        @Test
        @DisplayName("threat is the heavier of the two weapon volleys")
        void shouldRateThreat() {
            Unit squad = unit("s", 1, 0, 0).hp(10).hpMax(10).models(5).build();

            // rifle: 2 attacks x 5 models x 1 damage; blade: 1 x 5 x 1
            assertEquals(10, strategy.threat(squad));
            assertEquals(0, strategy.threat(unit("x", 1, 0, 0).rangedWeapon(null).meleeWeapon(null).build()));
        }

        @Test
        @DisplayName("shoots the most dangerous target")
        void shouldShootMostDangerous() {
            ActionRequest decision = strategy.decide(firingLine(), "a1", new Random(1));

            assertEquals(ActionKind.SHOOT, decision.getKind());
            assertEquals("b1", decision.getTargetUnitId());
        }

        @Test
        @DisplayName("moves away from enemies while keeping one within weapon range")
        void shouldKeepDistance() {
            TurnPhaseStateMachine machine = machine(state(BOARD,
                    unit("a1", 0, 6, 5).build(),
                    unit("b1", 1, 10, 5).build()), new ScriptedDice());
            Hex enemy = Hex.of(10, 5);

            ActionRequest decision = strategy.decide(machine, "a1", new Random(1));

            assertEquals(ActionKind.MOVE, decision.getKind());
            int distance = geometry.distance(decision.getTargetHex(), enemy);
            assertTrue(distance > geometry.distance(Hex.of(6, 5), enemy));
            assertTrue(distance <= 12);
        }

        @Test
        @DisplayName("does not charge a healthy enemy")
        void shouldHoldBackFromHealthyTarget() {
            TurnPhaseStateMachine machine = machine(state(BOARD,
                    unit("a1", 0, 5, 2).rangedWeapon(null).build(),
                    unit("b1", 1, 5, 8).build()), new ScriptedDice());
            machine.step(ActionRequest.pass("a1"));
            assertEquals(GamePhase.CHARGE, machine.getCurrentPhase());

            assertEquals(ActionKind.PASS, strategy.decide(machine, "a1", new Random(1)).getKind());
        }
    }
}
