package com.tactics.engine;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Reproducible dice: the same seed always yields the same roll sequence.
 * Rolls are journaled so each action can record exactly which results it consumed.
 */
public class SeededDice implements Dice {

    private final Random random;
    private final List<Integer> journal = new ArrayList<>();

    public SeededDice(long seed) {
        this.random = new Random(seed);
    }

    @Override
    public int d6() {
        int roll = random.nextInt(6) + 1;
        journal.add(roll);
        return roll;
    }

    @Override
    public List<Integer> drainJournal() {
        List<Integer> rolls = List.copyOf(journal);
        journal.clear();
        return rolls;
    }
}
