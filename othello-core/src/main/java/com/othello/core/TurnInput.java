package com.othello.core;

import java.util.Objects;

/**
 * Pre-validated input supplied for one turn: either a placement or a request to stop the game.
 * Placement rows are one-based, columns zero-based (column {@code a} is {@code 0}).
 */
public record TurnInput(Kind kind, int row, int column) {

    private static final TurnInput QUIT = new TurnInput(Kind.QUIT, 0, 0);

    public TurnInput {
        Objects.requireNonNull(kind, "kind");
    }

    public static TurnInput placement(int row, int column) {
        return new TurnInput(Kind.PLACEMENT, row, column);
    }

    public static TurnInput quit() {
        return QUIT;
    }

    public boolean isQuit() {
        return kind == Kind.QUIT;
    }

    @Override
    public String toString() {
        if (isQuit()) {
            return "quit";
        }
        return "(" + row + ", " + column + ")";
    }

    public enum Kind {
        PLACEMENT,
        QUIT
    }
}
