package com.tactics.service;

import com.tactics.bot.BotDifficulty;
import com.tactics.dto.ActionRecord;
import com.tactics.model.EndReason;

import java.util.List;

/**
 * Outcome of one bot-versus-bot episode.
 *
 * @param winner null for a draw
 */
public record MatchSummary(
        String scenarioId,
        long seed,
        BotDifficulty player0Bot,
        BotDifficulty player1Bot,
        Integer winner,
        EndReason endReason,
        int turns,
        int steps,
        int illegalActions,
        int player0Hp,
        int player1Hp,
        List<ActionRecord> records
) {

    public MatchSummary {
        records = List.copyOf(records);
    }
}
