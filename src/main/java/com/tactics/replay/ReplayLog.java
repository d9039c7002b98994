package com.tactics.replay;

import com.tactics.dto.ActionRecord;

import java.util.List;

public record ReplayLog(ReplayHeader header, List<ActionRecord> records) {

    public ReplayLog {
        records = List.copyOf(records);
    }
}
