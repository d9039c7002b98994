package com.tactics.replay;

/**
 * A field whose replayed value differs from the recorded one.
 */
public record Divergence(int sequence, String field, Object recorded, Object replayed) {

    @Override
    public String toString() {
        return "#" + sequence + " " + field + ": recorded " + recorded + ", replayed " + replayed;
    }
}
