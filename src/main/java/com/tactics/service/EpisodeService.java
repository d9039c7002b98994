package com.tactics.service;

import com.tactics.config.EngineSettings;
import com.tactics.config.ScenarioLoader;
import com.tactics.engine.Dice;
import com.tactics.engine.RuleBook;
import com.tactics.engine.SeededDice;
import com.tactics.engine.TurnPhaseStateMachine;
import com.tactics.model.GameState;
import com.tactics.model.Scenario;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;

/**
 * Creates episodes. Every call returns an independent state machine with its own state and
 * its own dice; nothing is shared between the episodes it hands out.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EpisodeService {

    private final ScenarioLoader scenarioLoader;
    private final RuleBook ruleBook;
    private final EngineSettings settings;

    /**
     * Start a new episode of a loaded scenario.
     *
     * @throws com.tactics.exception.ConfigurationException if the scenario id is unknown
     */
    public TurnPhaseStateMachine reset(String scenarioId, long seed) {
        return reset(scenarioLoader.getScenario(scenarioId), seed);
    }

    public TurnPhaseStateMachine reset(Scenario scenario, long seed) {
        return reset(scenario, seed, new SeededDice(seed));
    }

    /**
     * Start an episode with caller-supplied dice.
     */
    public TurnPhaseStateMachine reset(Scenario scenario, long seed, Dice dice) {
        GameState state = GameState.builder()
                .scenarioId(scenario.id())
                .seed(seed)
                .board(scenario.board())
                .units(new ArrayList<>(scenario.freshUnits()))
                .maxTurns(scenario.maxTurns() != null ? scenario.maxTurns() : settings.maxTurns())
                .build();

        log.info("Starting episode {}/{} ({} units, {} turns max)",
                scenario.id(), seed, state.getUnits().size(), state.getMaxTurns());
        return new TurnPhaseStateMachine(state, ruleBook, dice, settings);
    }
}
