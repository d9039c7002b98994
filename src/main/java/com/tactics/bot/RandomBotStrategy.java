package com.tactics.bot;

import com.tactics.dto.ActionRequest;
import com.tactics.engine.TurnPhaseStateMachine;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Random;

/**
 * Easy bot - picks uniformly among the unit's legal options, pass included.
 */
@Component
public class RandomBotStrategy implements BotStrategy {

    @Override
    public BotDifficulty getDifficulty() {
        return BotDifficulty.EASY;
    }

    @Override
    public ActionRequest decide(TurnPhaseStateMachine machine, String unitId, Random random) {
        List<ActionRequest> options = machine.legalActions(unitId);
        if (options.isEmpty()) {
            return ActionRequest.pass(unitId);
        }
        return options.get(random.nextInt(options.size()));
    }
}
