package com.othello.core;

import java.util.Objects;

/**
 * Signals a placement that breaks the capture rules. The game state is left untouched and the
 * same player is expected to try again.
 */
public final class IllegalMoveException extends RuntimeException {

    private final MoveRejection rejection;
    private final Player player;
    private final int targetIndex;

    public IllegalMoveException(MoveRejection rejection, Player player, int targetIndex, String squareLabel) {
        super(String.format("%s cannot play %s: square %s", player, squareLabel,
                Objects.requireNonNull(rejection, "rejection").description()));
        this.rejection = rejection;
        this.player = player;
        this.targetIndex = targetIndex;
    }

    public MoveRejection getRejection() {
        return rejection;
    }

    public Player getPlayer() {
        return player;
    }

    public int getTargetIndex() {
        return targetIndex;
    }
}
