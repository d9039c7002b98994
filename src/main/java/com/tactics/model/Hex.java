package com.tactics.model;

/**
 * One cell of the board, addressed by offset (column, row) coordinates.
 */
public record Hex(int col, int row) {

    public static Hex of(int col, int row) {
        return new Hex(col, row);
    }

    @Override
    public String toString() {
        return "(" + col + "," + row + ")";
    }
}
