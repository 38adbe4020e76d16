package com.othello.core;

/**
 * The two sides of an Othello match. Black always moves first.
 */
public enum Player {
    BLACK(SquareStatus.BLACK, "Black"),
    WHITE(SquareStatus.WHITE, "White");

    private final SquareStatus status;
    private final String displayName;

    Player(SquareStatus status, String displayName) {
        this.status = status;
        this.displayName = displayName;
    }

    /**
     * Returns the square status that marks a disc owned by this player.
     */
    public SquareStatus status() {
        return status;
    }

    /**
     * Returns the other player.
     */
    public Player opponent() {
        return this == BLACK ? WHITE : BLACK;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
