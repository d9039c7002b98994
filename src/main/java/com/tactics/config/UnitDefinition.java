package com.tactics.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * Initial placement and profile of one unit.
 *
 * @param id           unique unit id within the scenario
 * @param name         display name, e.g. "Intercessor Squad"
 * @param player       owning player, 0 or 1
 * @param col          starting column
 * @param row          starting row
 * @param move         movement allowance in hexes
 * @param hpMax        total wounds of the squad
 * @param models       models in the squad (defaults to 1)
 * @param toughness    toughness for the wound table
 * @param armorSave    armor save (d6 target)
 * @param invulSave    invulnerable save, null or 0 for none
 * @param rangedWeapon armory code of the ranged weapon, may be null
 * @param meleeWeapon  armory code of the melee weapon, may be null
 * @param blocksLos    whether the unit blocks line of sight
 */
public record UnitDefinition(
        @NotBlank String id,
        String name,
        @Min(0) @Max(1) int player,
        int col,
        int row,
        @Min(0) int move,
        @Positive int hpMax,
        @Positive Integer models,
        @Positive int toughness,
        @Min(2) @Max(7) int armorSave,
        @Min(0) @Max(7) Integer invulSave,
        String rangedWeapon,
        String meleeWeapon,
        Boolean blocksLos
) {}
