package com.tactics.engine;

import com.tactics.dto.AttackOutcome;
import com.tactics.model.Unit;
import com.tactics.model.WeaponProfile;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Hit, wound, save and damage sequence shared by shooting and fighting.
 * <p>
 * Computes the outcome only; applying it to the target is up to the caller.
 */
@Component
@Slf4j
public class AttackResolver {

    public AttackOutcome resolve(Unit attacker, Unit target, WeaponProfile weapon, Dice dice) {
        int attacks = weapon.attacks() * attacker.getAliveModels();
        int woundTarget = woundTarget(weapon.strength(), target.getToughness());
        int saveTarget = saveTarget(target, weapon.armorPenetration());

        int hpBefore = target.getHp();
        int hp = hpBefore;
        int hits = 0;
        int wounds = 0;
        int unsaved = 0;

        for (int i = 0; i < attacks && hp > 0; i++) {
            if (dice.d6() < weapon.accuracy()) {
                continue;
            }
            hits++;
            if (dice.d6() < woundTarget) {
                continue;
            }
            wounds++;
            if (dice.d6() >= saveTarget) {
                continue;
            }
            unsaved++;
            hp = Math.max(0, hp - weapon.damage());
        }

        log.trace("{} -> {} with {}: {} attacks, {} hits, {} wounds, {} unsaved, hp {} -> {}",
                attacker.getId(), target.getId(), weapon.code(), attacks, hits, wounds, unsaved, hpBefore, hp);

        return new AttackOutcome(weapon.code(), attacks, hits, wounds, unsaved,
                hpBefore - hp, hpBefore, hp, hp == 0);
    }

    /**
     * d6 result needed to wound.
     */
    public int woundTarget(int strength, int toughness) {
        if (strength >= toughness * 2) {
            return 2;
        } else if (strength > toughness) {
            return 3;
        } else if (strength == toughness) {
            return 4;
        } else if (strength * 2 <= toughness) {
            return 6;
        }
        return 5;
    }

    /**
     * d6 result needed to save: armor worsened by AP, or the invulnerable save if better,
     * clamped to 2..6.
     */
    public int saveTarget(Unit target, int armorPenetration) {
        int armor = target.getArmorSave() + armorPenetration;
        int invul = target.getInvulSave() > 0 ? target.getInvulSave() : 7;
        return Math.max(2, Math.min(Math.min(armor, invul), 6));
    }
}
