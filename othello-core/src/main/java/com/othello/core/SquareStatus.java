package com.othello.core;

/**
 * Ownership state of a single board square.
 */
public enum SquareStatus {
    EMPTY(" "),
    BLACK("B"),
    WHITE("W");

    private final String symbol;

    SquareStatus(String symbol) {
        this.symbol = symbol;
    }

    /**
     * Returns the single-character marker used by text renderers.
     */
    public String symbol() {
        return symbol;
    }
}
