package com.tactics.service;

import com.tactics.bot.BotDifficulty;
import com.tactics.replay.ReplayHeader;
import com.tactics.replay.ReplayLogWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Plays a batch of bot matches at startup when {@code tactics.match.enabled=true}.
 * Seeds run from {@code tactics.match.seed} upwards, one per episode.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MatchRunner implements CommandLineRunner {

    private final BotMatchService matchService;
    private final ReplayLogWriter replayWriter;

    @Value("${tactics.match.enabled:false}")
    private boolean enabled;

    @Value("${tactics.match.episodes:1}")
    private int episodes;

    @Value("${tactics.match.scenario:skirmish}")
    private String scenarioId;

    @Value("${tactics.match.player0-bot:MEDIUM}")
    private BotDifficulty player0Bot;

    @Value("${tactics.match.player1-bot:HARD}")
    private BotDifficulty player1Bot;

    @Value("${tactics.match.seed:1}")
    private long firstSeed;

    @Value("${tactics.match.replay-dir:}")
    private String replayDir;

    @Override
    public void run(String... args) throws IOException {
        if (!enabled) {
            return;
        }

        int[] wins = new int[2];
        int draws = 0;
        for (int i = 0; i < episodes; i++) {
            long seed = firstSeed + i;
            MatchSummary summary = matchService.play(scenarioId, player0Bot, player1Bot, seed);
            if (summary.winner() == null) {
                draws++;
            } else {
                wins[summary.winner()]++;
            }

            if (!replayDir.isBlank()) {
                Path file = Paths.get(replayDir, scenarioId + "-" + seed + ".jsonl");
                replayWriter.write(file, ReplayHeader.of(scenarioId, seed), summary.records());
            }
        }

        log.info("{} episodes of {}: {} (player 0) won {}, {} (player 1) won {}, {} draws",
                episodes, scenarioId, player0Bot, wins[0], player1Bot, wins[1], draws);
    }
}
