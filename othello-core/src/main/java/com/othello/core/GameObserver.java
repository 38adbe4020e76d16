package com.othello.core;

/**
 * Callbacks through which {@link GameRunner} reports a match to a display. Observers only
 * receive snapshots and resolved moves; they never touch the live board.
 */
public interface GameObserver {

    /**
     * Called before input is requested for a turn.
     */
    void onTurnStart(GameSnapshot snapshot);

    /**
     * Called after a placement and its flips were committed.
     */
    default void onMoveApplied(Move move, GameSnapshot snapshot) {
    }

    /**
     * Called when a placement broke the capture rules; the same player moves again.
     */
    default void onMoveRejected(IllegalMoveException rejection) {
    }

    /**
     * Called when the input did not describe a square on the board.
     */
    default void onInputRejected(InvalidInputException rejection) {
    }

    /**
     * Called when {@code player} had no legal placement and lost their turn.
     */
    default void onTurnSkipped(Player player, GameSnapshot snapshot) {
    }

    /**
     * Called once the match has terminated.
     */
    void onGameOver(GameSnapshot snapshot);
}
