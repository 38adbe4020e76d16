package com.othello.core;

/**
 * Supplies the input for each turn, e.g. from an operator at a console.
 */
@FunctionalInterface
public interface MoveSource {

    /**
     * Returns the placement or quit signal for the player to move in {@code snapshot}.
     * Implementations may block while waiting for the operator.
     */
    TurnInput nextInput(GameSnapshot snapshot);
}
