package com.tactics.engine;

import java.util.List;

/**
 * Source of six-sided die rolls for one episode.
 */
public interface Dice {

    int d6();

    default int roll2d6() {
        return d6() + d6();
    }

    /**
     * Rolls made since the previous call, oldest first.
     */
    List<Integer> drainJournal();
}
