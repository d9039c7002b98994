package com.tactics.replay;

import com.tactics.dto.ActionRecord;
import com.tactics.exception.ConfigurationException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import tools.jackson.core.JacksonException;
import tools.jackson.databind.ObjectMapper;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads logs produced by {@link ReplayLogWriter}. Blank lines are ignored.
 */
@Component
@RequiredArgsConstructor
public class ReplayLogReader {

    private final ObjectMapper objectMapper;

    public ReplayLog read(Path file) throws IOException {
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            return read(in);
        }
    }

    /**
     * @throws ConfigurationException if the header is missing or a line is not valid JSON
     */
    public ReplayLog read(Reader source) throws IOException {
        BufferedReader in = source instanceof BufferedReader buffered ? buffered : new BufferedReader(source);
        ReplayHeader header = null;
        List<ActionRecord> records = new ArrayList<>();

        String line;
        int lineNumber = 0;
        while ((line = in.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) continue;
            try {
                if (header == null) {
                    header = objectMapper.readValue(line, ReplayHeader.class);
                } else {
                    records.add(objectMapper.readValue(line, ActionRecord.class));
                }
            } catch (JacksonException e) {
                throw new ConfigurationException("Malformed replay line " + lineNumber + ": " + e.getMessage(), e);
            }
        }

        if (header == null || header.scenarioId() == null) {
            throw new ConfigurationException("Replay log has no header");
        }
        if (header.formatVersion() != ReplayHeader.CURRENT_VERSION) {
            throw new ConfigurationException("Unsupported replay format version " + header.formatVersion());
        }
        return new ReplayLog(header, records);
    }
}
