package com.tactics.service;

import com.tactics.bot.BotDifficulty;
import com.tactics.bot.BotStrategy;
import com.tactics.bot.BotStrategyFactory;
import com.tactics.dto.ActionRecord;
import com.tactics.dto.ActionRequest;
import com.tactics.dto.ActionResult;
import com.tactics.engine.TurnPhaseStateMachine;
import com.tactics.model.GameState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Random;

/**
 * Plays complete episodes between two scripted strategies, synchronously.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BotMatchService {

    private final EpisodeService episodeService;
    private final BotStrategyFactory strategyFactory;

    public MatchSummary play(String scenarioId, BotDifficulty player0Bot, BotDifficulty player1Bot, long seed) {
        TurnPhaseStateMachine machine = episodeService.reset(scenarioId, seed);
        BotStrategy[] strategies = {
                strategyFactory.getStrategy(player0Bot),
                strategyFactory.getStrategy(player1Bot)
        };
        Random random = new Random(seed);
        int illegal = 0;

        while (!machine.isTerminal()) {
            List<String> pool = machine.activationPool();
            String unitId = pool.get(0);
            ActionRequest request = strategies[machine.getCurrentPlayer()].decide(machine, unitId, random);

            ActionResult result = machine.step(request);
            if (!result.isAccepted()) {
                illegal++;
                log.debug("Bot request {} rejected ({}), passing instead", request, result.getReason());
                machine.step(ActionRequest.pass(unitId));
            }
        }

        GameState finalState = machine.view();
        List<ActionRecord> records = machine.getRecords();
        MatchSummary summary = new MatchSummary(scenarioId, seed, player0Bot, player1Bot,
                finalState.getWinner(), finalState.getEndReason(), finalState.getTurnNumber(),
                finalState.getStepCount(), illegal, finalState.remainingHp(0), finalState.remainingHp(1), records);

        log.info("Match {}/{} {} vs {}: {} after {} turns, {} steps ({})",
                scenarioId, seed, player0Bot, player1Bot,
                summary.winner() == null ? "draw" : "player " + summary.winner() + " wins",
                summary.turns(), summary.steps(), summary.endReason());
        return summary;
    }
}
