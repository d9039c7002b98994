package com.tactics;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main entry point for the hex tactics rules engine.
 *
 * Features:
 * - Deterministic move / shoot / charge / fight turn sequencing on a hex board
 * - Per-episode isolated game state for parallel training workers
 * - Scripted bot opponents for evaluation matches
 * - JSON-lines replay logs with forensic re-validation
 */
@SpringBootApplication
public class TacticsEngineApplication {

    public static void main(String[] args) {
        SpringApplication.run(TacticsEngineApplication.class, args);
    }
}
