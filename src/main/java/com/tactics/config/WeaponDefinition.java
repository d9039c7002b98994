package com.tactics.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;

/**
 * A weapon entry of an armory file.
 *
 * @param code             unique key referenced by unit definitions, e.g. "bolt_rifle"
 * @param displayName      name shown in logs
 * @param range            range in hexes; null for melee weapons
 * @param attacks          attacks per model
 * @param accuracy         d6 result needed to hit (2..6)
 * @param strength         strength for the wound table
 * @param armorPenetration worsens the target's armor save by this amount
 * @param damage           damage per unsaved wound
 */
public record WeaponDefinition(
        @NotBlank String code,
        String displayName,
        @Positive Integer range,
        @Positive int attacks,
        @Min(2) @Max(6) int accuracy,
        @Positive int strength,
        @Min(0) int armorPenetration,
        @Positive int damage
) {

    public boolean isMelee() {
        return range == null;
    }
}
