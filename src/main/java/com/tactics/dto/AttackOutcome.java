package com.tactics.dto;

/**
 * Result of resolving one unit's attacks (ranged volley or melee) against a target.
 *
 * @param weapon          armory code of the weapon used
 * @param attacks         attacks made
 * @param hits            successful hit rolls
 * @param wounds          successful wound rolls
 * @param unsavedWounds   wounds that got through the save
 * @param damage          HP actually removed from the target
 * @param targetHpBefore  target HP before the attack
 * @param targetHpAfter   target HP after the attack, never below zero
 * @param targetDestroyed whether the target reached zero HP
 */
public record AttackOutcome(
        String weapon,
        int attacks,
        int hits,
        int wounds,
        int unsavedWounds,
        int damage,
        int targetHpBefore,
        int targetHpAfter,
        boolean targetDestroyed
) {

    public boolean hit() {
        return hits > 0;
    }
}
