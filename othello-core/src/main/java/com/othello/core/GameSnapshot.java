package com.othello.core;

import java.util.Objects;
import java.util.Optional;

/**
 * Point-in-time copy of a match handed to display collaborators. The board is a private copy,
 * so renderers can neither observe later moves nor change the live game.
 */
public record GameSnapshot(
        Board board,
        int size,
        Player activePlayer,
        int blackCount,
        int whiteCount,
        int turnNumber,
        GameStatus status,
        TerminationReason terminationReason) {

    public GameSnapshot {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(activePlayer, "activePlayer");
        Objects.requireNonNull(status, "status");
        if (status == GameStatus.TERMINATED) {
            Objects.requireNonNull(terminationReason, "terminationReason");
        }
        board = board.copy();
    }

    @Override
    public Board board() {
        return board.copy();
    }

    /**
     * Returns the status of a square in the copied position.
     */
    public SquareStatus status(int index) {
        return board.status(index);
    }

    /**
     * Returns {@code true} if the match had ended when the snapshot was taken.
     */
    public boolean isTerminated() {
        return status == GameStatus.TERMINATED;
    }

    /**
     * Returns the termination reason, or empty for a running match.
     */
    public Optional<TerminationReason> reason() {
        return Optional.ofNullable(terminationReason);
    }

    /**
     * Returns the disc counts as a {@link Score}.
     */
    public Score score() {
        return new Score(blackCount, whiteCount);
    }
}
