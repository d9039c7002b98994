package com.tactics.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;

import java.util.List;

/**
 * Root of an armory JSON file: the weapons available to one faction.
 */
public record ArmoryDefinition(
        String faction,
        @NotEmpty List<@NotNull @Valid WeaponDefinition> weapons
) {}
