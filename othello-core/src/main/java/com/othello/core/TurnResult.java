package com.othello.core;

import java.util.Objects;

/**
 * Outcome of an accepted placement. {@code skippedPlayer} names the player whose following turn
 * was passed over for lack of a legal placement, or is {@code null} if nobody was skipped.
 */
public record TurnResult(Move move, Player skippedPlayer, GameSnapshot snapshot) {

    public TurnResult {
        Objects.requireNonNull(move, "move");
        Objects.requireNonNull(snapshot, "snapshot");
    }

    /**
     * Returns {@code true} if the opponent had to pass after this placement.
     */
    public boolean hasSkippedTurn() {
        return skippedPlayer != null;
    }
}
