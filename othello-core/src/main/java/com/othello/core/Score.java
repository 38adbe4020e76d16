package com.othello.core;

import java.util.Optional;

/**
 * Disc counts for both players.
 */
public record Score(int black, int white) {

    public Score {
        if (black < 0 || white < 0) {
            throw new IllegalArgumentException("Disc counts must not be negative");
        }
    }

    /**
     * Counts the discs of both colours on the board.
     */
    public static Score of(Board board) {
        return new Score(board.count(SquareStatus.BLACK), board.count(SquareStatus.WHITE));
    }

    /**
     * Returns the disc count of one player.
     */
    public int of(Player player) {
        return player == Player.BLACK ? black : white;
    }

    /**
     * Returns the player with more discs, or an empty result on a draw.
     */
    public Optional<Player> winner() {
        if (black == white) {
            return Optional.empty();
        }
        return Optional.of(black > white ? Player.BLACK : Player.WHITE);
    }

    /**
     * Returns {@code true} if both players own the same number of discs.
     */
    public boolean isDraw() {
        return black == white;
    }
}
