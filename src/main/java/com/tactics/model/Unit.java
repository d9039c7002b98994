package com.tactics.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A squad of one or more cohesion-linked models acting as a single tactical unit.
 * <p>
 * Wounds are pooled: {@code hp} is the remaining wounds of the whole squad and the number
 * of models still standing is derived from it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Unit {

    private String id;

    private String name;

    /** Owning player, 0 or 1. */
    private int player;

    private Hex position;

    private int hp;

    private int hpMax;

    @Builder.Default
    private int models = 1;

    private int move;

    private int toughness;

    private int armorSave;

    /** 0 means no invulnerable save. */
    private int invulSave;

    private WeaponProfile rangedWeapon;

    private WeaponProfile meleeWeapon;

    /** Whether this unit obstructs line of sight for shots passing through its hex. */
    private boolean blocksLineOfSight;

    public boolean isAlive() {
        return hp > 0;
    }

    public boolean isEnemyOf(Unit other) {
        return other.player != player;
    }

    public boolean hasRangedWeapon() {
        return rangedWeapon != null;
    }

    public boolean hasMeleeWeapon() {
        return meleeWeapon != null;
    }

    public int getWoundsPerModel() {
        return Math.max(1, (int) Math.ceil((double) hpMax / models));
    }

    /** Models still standing, rounding partially wounded models up. */
    public int getAliveModels() {
        if (hp <= 0) return 0;
        return Math.min(models, (int) Math.ceil((double) hp / getWoundsPerModel()));
    }

    public Unit copy() {
        return toBuilder().build();
    }
}
