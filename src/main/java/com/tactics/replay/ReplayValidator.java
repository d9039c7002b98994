package com.tactics.replay;

import com.tactics.dto.ActionRecord;
import com.tactics.engine.TurnPhaseStateMachine;
import com.tactics.exception.InvariantViolationException;
import com.tactics.service.EpisodeService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Forensic check of a recorded episode: recreates it from scenario and seed, re-submits
 * every recorded request through a fresh state machine and compares the outcomes.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReplayValidator {

    private final EpisodeService episodeService;

    public ReplayReport validate(ReplayLog replay) {
        ReplayHeader header = replay.header();
        TurnPhaseStateMachine machine = episodeService.reset(header.scenarioId(), header.seed());
        List<Divergence> divergences = new ArrayList<>();

        int replayed = 0;
        for (ActionRecord recorded : replay.records()) {
            ActionRecord actual;
            try {
                machine.step(recorded.toRequest());
                List<ActionRecord> records = machine.getRecords();
                actual = records.get(records.size() - 1);
            } catch (InvariantViolationException e) {
                divergences.add(new Divergence(recorded.getSequence(), "invariant", "none", e.getMessage()));
                log.warn("Replay {}/{} hit an invariant violation at record {}:\n{}",
                        header.scenarioId(), header.seed(), recorded.getSequence(), e.getStateDump());
                break;
            }
            replayed++;
            compare(recorded, actual, divergences);
        }

        ReplayReport report = new ReplayReport(header.scenarioId(), header.seed(), replayed, divergences);
        if (report.isConsistent()) {
            log.info("Replay {}/{} consistent over {} records", header.scenarioId(), header.seed(), replayed);
        } else {
            log.warn("Replay {}/{} diverged in {} places, first: {}",
                    header.scenarioId(), header.seed(), divergences.size(), divergences.get(0));
        }
        return report;
    }

    private void compare(ActionRecord recorded, ActionRecord actual, List<Divergence> out) {
        int seq = recorded.getSequence();
        check(seq, "accepted", recorded.isAccepted(), actual.isAccepted(), out);
        check(seq, "reason", recorded.getReason(), actual.getReason(), out);
        check(seq, "turn", recorded.getTurn(), actual.getTurn(), out);
        check(seq, "phase", recorded.getPhase(), actual.getPhase(), out);
        check(seq, "player", recorded.getPlayer(), actual.getPlayer(), out);
        check(seq, "from", recorded.getFrom(), actual.getFrom(), out);
        check(seq, "to", recorded.getTo(), actual.getTo(), out);
        check(seq, "damage", recorded.getDamage(), actual.getDamage(), out);
        check(seq, "targetHpAfter", recorded.getTargetHpAfter(), actual.getTargetHpAfter(), out);
        check(seq, "diceRolls", recorded.getDiceRolls(), actual.getDiceRolls(), out);
        check(seq, "terminal", recorded.isTerminal(), actual.isTerminal(), out);
    }

    private void check(int sequence, String field, Object recorded, Object replayed, List<Divergence> out) {
        if (!Objects.equals(recorded, replayed)) {
            out.add(new Divergence(sequence, field, recorded, replayed));
        }
    }
}
