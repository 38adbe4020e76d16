package com.othello.core;

/**
 * Conversions between board indices and the usual "column name + row number" labels,
 * e.g. {@code d3} for the fourth column of the third row. Columns past {@code z} continue
 * as {@code aa}, {@code ab}, ..., {@code az}, {@code ba}, so every board size has labels.
 */
public final class Notation {

    private static final int LETTERS = 26;

    private Notation() {
    }

    /**
     * Returns the lower-case name of a zero-based column: {@code a} for 0, {@code z} for 25,
     * {@code aa} for 26.
     *
     * @throws IllegalArgumentException if {@code column} is negative
     */
    public static String columnName(int column) {
        if (column < 0) {
            throw new IllegalArgumentException("Column must not be negative: " + column);
        }
        StringBuilder name = new StringBuilder();
        int remaining = column + 1;
        while (remaining > 0) {
            remaining--;
            name.append((char) ('a' + remaining % LETTERS));
            remaining /= LETTERS;
        }
        return name.reverse().toString();
    }

    /**
     * Returns the zero-based column named by one or more letters, ignoring case.
     *
     * @throws IllegalArgumentException if the name is empty, contains a non-letter or is too long
     */
    public static int columnOf(String name) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Column name must not be empty");
        }
        long value = 0;
        for (int i = 0; i < name.length(); i++) {
            char lower = Character.toLowerCase(name.charAt(i));
            if (lower < 'a' || lower > 'z') {
                throw new IllegalArgumentException("Not a column name: " + name);
            }
            value = value * LETTERS + (lower - 'a' + 1);
            if (value > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("Column name too long: " + name);
            }
        }
        return (int) value - 1;
    }

    /**
     * Returns the label of the square at zero-based {@code row} and {@code column}.
     */
    public static String label(int row, int column) {
        return columnName(column) + (row + 1);
    }

    /**
     * Returns the label of the square with the provided row-major index.
     */
    public static String label(int index, Board board) {
        return label(board.row(index), board.column(index));
    }
}
