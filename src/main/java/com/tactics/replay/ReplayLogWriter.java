package com.tactics.replay;

import com.tactics.dto.ActionRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import tools.jackson.databind.ObjectMapper;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes an episode as JSON lines: the header, then one action record per line.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReplayLogWriter {

    private final ObjectMapper objectMapper;

    public void write(Path file, ReplayHeader header, List<ActionRecord> records) throws IOException {
        if (file.getParent() != null) {
            Files.createDirectories(file.getParent());
        }
        try (BufferedWriter out = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
            write(out, header, records);
        }
        log.info("Wrote replay {} ({} records)", file, records.size());
    }

    public void write(Writer out, ReplayHeader header, List<ActionRecord> records) throws IOException {
        out.write(objectMapper.writeValueAsString(header));
        out.write('\n');
        for (ActionRecord record : records) {
            out.write(objectMapper.writeValueAsString(record));
            out.write('\n');
        }
        out.flush();
    }
}
