package com.tactics.config;

import jakarta.validation.constraints.Positive;

import java.util.List;

/**
 * Board layout of a scenario.
 *
 * @param cols  number of columns
 * @param rows  number of rows
 * @param walls wall cells as [col, row] pairs
 */
public record BoardDefinition(
        @Positive int cols,
        @Positive int rows,
        List<List<Integer>> walls
) {}
