package com.tactics.engine;

import com.tactics.dto.AttackOutcome;
import com.tactics.dto.ChargeOutcome;
import com.tactics.exception.IllegalActionException;
import com.tactics.exception.RejectionReason;
import com.tactics.model.BoardConfig;
import com.tactics.model.Hex;
import com.tactics.model.Unit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Set;

import static com.tactics.engine.EngineFixtures.unit;
import static org.junit.jupiter.api.Assertions.*;

/**
 * Shooting, fighting and charging against hand-placed units.
 */
class CombatResolversTest {

    private final HexGeometry geometry = new HexGeometry();
    private final AttackResolver attacks = new AttackResolver();
    private final LineOfSightEngine lineOfSight = new LineOfSightEngine(geometry);
    private final BoardConfig board = BoardConfig.open(25, 21);

    private static void assertRejected(RejectionReason expected, Runnable action) {
        IllegalActionException ex = assertThrows(IllegalActionException.class, action::run);
        assertEquals(expected, ex.getReason());
    }

    @Nested
    @DisplayName("ShootingResolver")
    class Shooting {

        private final ShootingResolver resolver = new ShootingResolver(geometry, lineOfSight, attacks);

        @Test
        @DisplayName("applies damage to the target")
        void shouldApplyDamage() {
            Unit shooter = unit("a", 0, 5, 2).build();
            Unit target = unit("b", 1, 5, 8).build();

            AttackOutcome outcome = resolver.resolveShot(shooter, target, shooter.getRangedWeapon(),
                    Set.of(), Set.of(), new ScriptedDice(6, 6, 1, 6, 6, 1));

            assertEquals(2, outcome.damage());
            assertEquals(1, target.getHp());
        }

        @Test
        @DisplayName("rejects before rolling: out of range, blocked, friendly, dead, unarmed")
        void shouldRejectWithoutRolling() {
            Unit shooter = unit("a", 0, 5, 2).build();
            Unit far = unit("far", 1, 5, 20).build();
            Unit target = unit("b", 1, 5, 8).build();
            Unit friend = unit("f", 0, 6, 8).build();
            Unit dead = unit("d", 1, 7, 8).hp(0).build();
            ScriptedDice noDice = new ScriptedDice();

            assertRejected(RejectionReason.OUT_OF_RANGE, () -> resolver.resolveShot(shooter, far,
                    shooter.getRangedWeapon(), Set.of(), Set.of(), noDice));
            assertRejected(RejectionReason.NO_LINE_OF_SIGHT, () -> resolver.resolveShot(shooter, target,
                    shooter.getRangedWeapon(), Set.of(Hex.of(5, 5)), Set.of(), noDice));
            assertRejected(RejectionReason.NO_LINE_OF_SIGHT, () -> resolver.resolveShot(shooter, target,
                    shooter.getRangedWeapon(), Set.of(), Set.of(Hex.of(5, 6)), noDice));
            assertRejected(RejectionReason.INVALID_TARGET, () -> resolver.resolveShot(shooter, friend,
                    shooter.getRangedWeapon(), Set.of(), Set.of(), noDice));
            assertRejected(RejectionReason.INVALID_TARGET, () -> resolver.resolveShot(shooter, dead,
                    shooter.getRangedWeapon(), Set.of(), Set.of(), noDice));
            assertRejected(RejectionReason.NO_WEAPON, () -> resolver.resolveShot(shooter, target,
                    null, Set.of(), Set.of(), noDice));
            assertEquals(3, target.getHp());
        }
    }

    @Nested
    @DisplayName("FightResolver")
    class Fighting {

        private final FightResolver resolver = new FightResolver(geometry, attacks);

        @Test
        @DisplayName("uses the melee weapon against an adjacent enemy")
        void shouldFightAdjacentEnemy() {
            Unit attacker = unit("a", 0, 5, 5).build();
            Unit target = unit("b", 1, 5, 6).build();

            AttackOutcome outcome = resolver.resolveFight(attacker, target, new ScriptedDice(6, 6, 1));

            assertEquals("test_blade", outcome.weapon());
            assertEquals(1, outcome.attacks());
            assertEquals(2, target.getHp());
        }

        @Test
        @DisplayName("rejects targets that are not adjacent and units without melee weapons")
        void shouldRejectIllegalFights() {
            Unit attacker = unit("a", 0, 5, 5).build();
            Unit distant = unit("b", 1, 5, 8).build();
            Unit unarmed = unit("c", 0, 5, 7).meleeWeapon(null).build();

            assertRejected(RejectionReason.NOT_ADJACENT,
                    () -> resolver.resolveFight(attacker, distant, new ScriptedDice()));
            assertRejected(RejectionReason.NO_WEAPON,
                    () -> resolver.resolveFight(unarmed, distant, new ScriptedDice()));
        }
    }

    @Nested
    @DisplayName("ChargeResolver")
    class Charging {

        private final ChargeResolver resolver =
                new ChargeResolver(geometry, new ReachabilityValidator(geometry));

        private final Hex destination = Hex.of(5, 7);

        private MovementContext context(Unit target) {
            return new MovementContext(board, Set.of(target.getPosition()),
                    Set.copyOf(geometry.neighbors(target.getPosition(), board)));
        }

        @Test
        @DisplayName("a roll covering the path moves the charger next to the target")
        void shouldSucceedWithLongEnoughRoll() {
            Unit charger = unit("a", 0, 5, 2).build();
            Unit target = unit("b", 1, 5, 8).build();

            ChargeOutcome outcome = resolver.resolveCharge(charger, target, destination,
                    context(target), 12, new ScriptedDice(3, 3));

            assertTrue(outcome.success());
            assertEquals(6, outcome.chargeRoll());
            assertEquals(5, outcome.pathLength());
            assertEquals(destination, charger.getPosition());
        }

        @Test
        @DisplayName("a short roll fails without moving the charger")
        void shouldFailWithShortRoll() {
            Unit charger = unit("a", 0, 5, 2).build();
            Unit target = unit("b", 1, 5, 8).build();

            ChargeOutcome outcome = resolver.resolveCharge(charger, target, destination,
                    context(target), 12, new ScriptedDice(1, 2));

            assertFalse(outcome.success());
            assertEquals(3, outcome.chargeRoll());
            assertEquals(Hex.of(5, 2), charger.getPosition());
        }

        @Test
        @DisplayName("deterministic checks run before the dice")
        void shouldValidateBeforeRolling() {
            Unit charger = unit("a", 0, 5, 2).build();
            Unit target = unit("b", 1, 5, 8).build();
            ScriptedDice noDice = new ScriptedDice();

            assertRejected(RejectionReason.DESTINATION_NOT_ADJACENT_TO_TARGET, () -> resolver.resolveCharge(
                    charger, target, Hex.of(5, 5), context(target), 12, noDice));
            assertRejected(RejectionReason.OCCUPIED, () -> resolver.resolveCharge(
                    charger, target, Hex.of(5, 8), context(target), 12, noDice));
            assertRejected(RejectionReason.OUT_OF_RANGE, () -> resolver.resolveCharge(
                    charger, target, destination, context(target), 4, noDice));
            assertRejected(RejectionReason.OUT_OF_BOUNDS, () -> resolver.resolveCharge(
                    charger, target, Hex.of(40, 40), context(target), 12, noDice));
        }
    }
}
