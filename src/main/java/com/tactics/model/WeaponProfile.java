package com.tactics.model;

/**
 * Resolved weapon profile used by the attack sequence.
 *
 * @param code             armory code, e.g. "bolt_rifle"
 * @param displayName      human-readable name
 * @param range            maximum range in hexes (melee weapons use 1)
 * @param attacks          attacks per alive model
 * @param accuracy         d6 result needed to hit
 * @param strength         strength used on the wound table
 * @param armorPenetration added to the target's armor save
 * @param damage           damage per unsaved wound
 */
public record WeaponProfile(
        String code,
        String displayName,
        int range,
        int attacks,
        int accuracy,
        int strength,
        int armorPenetration,
        int damage
) {}
