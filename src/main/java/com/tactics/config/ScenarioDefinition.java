package com.tactics.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * Root definition of a playable scenario, loaded from a JSON file.
 *
 * @param id          unique slug, e.g. "open-field-duel"
 * @param name        human-readable name
 * @param description short description
 * @param board       board layout and walls
 * @param units       initial unit placements for both players
 * @param maxTurns    optional turn budget overriding the engine default
 */
public record ScenarioDefinition(
        @NotBlank String id,
        String name,
        String description,
        @NotNull @Valid BoardDefinition board,
        @NotEmpty List<@NotNull @Valid UnitDefinition> units,
        @Positive Integer maxTurns
) {}
