package com.othello.core;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalInt;
import java.util.stream.IntStream;

/**
 * Decides whether a placement is legal and which opponent discs it flips.
 * All methods are pure: the board is only read.
 */
public final class CaptureResolver {

    private CaptureResolver() {
    }

    /**
     * Resolves a placement of {@code player}'s disc on {@code targetIndex}.
     *
     * @return the move with every capture line that the placement closes
     * @throws IllegalMoveException if the square is occupied or nothing would be captured
     */
    public static Move resolve(Board board, Player player, int targetIndex) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(player, "player");
        if (!board.isEmpty(targetIndex)) {
            throw new IllegalMoveException(MoveRejection.OCCUPIED_SQUARE, player, targetIndex,
                    Notation.label(targetIndex, board));
        }

        Map<Direction, List<Integer>> captures = new EnumMap<>(Direction.class);
        for (Direction direction : Direction.values()) {
            List<Integer> line = captureLine(board, player, targetIndex, direction);
            if (!line.isEmpty()) {
                captures.put(direction, line);
            }
        }
        if (captures.isEmpty()) {
            throw new IllegalMoveException(MoveRejection.NO_CAPTURES, player, targetIndex,
                    Notation.label(targetIndex, board));
        }
        return new Move(targetIndex, player, captures);
    }

    /**
     * Returns the opponent squares captured in one direction, closest first. The list is empty
     * unless the run of opponent discs is non-empty and ends on a disc owned by {@code player}.
     */
    public static List<Integer> captureLine(Board board, Player player, int targetIndex, Direction direction) {
        SquareStatus own = player.status();
        SquareStatus opponent = player.opponent().status();
        List<Integer> line = new ArrayList<>();

        OptionalInt next = direction.step(targetIndex, board.size());
        while (next.isPresent()) {
            int index = next.getAsInt();
            SquareStatus status = board.status(index);
            if (status == opponent) {
                line.add(index);
                next = direction.step(index, board.size());
            } else if (status == own) {
                return List.copyOf(line);
            } else {
                return List.of();
            }
        }
        // Ran off the board without meeting an own disc.
        return List.of();
    }

    /**
     * Returns {@code true} if {@code player} may place a disc on {@code targetIndex}.
     */
    public static boolean isLegal(Board board, Player player, int targetIndex) {
        Objects.requireNonNull(board, "board");
        Objects.requireNonNull(player, "player");
        if (!board.isEmpty(targetIndex)) {
            return false;
        }
        for (Direction direction : Direction.values()) {
            if (!captureLine(board, player, targetIndex, direction).isEmpty()) {
                return true;
            }
        }
        return false;
    }

    /**
     * Returns every legal target for {@code player} in ascending index order.
     */
    public static int[] legalMoves(Board board, Player player) {
        Objects.requireNonNull(board, "board");
        return IntStream.of(board.emptyIndices())
                .filter(index -> isLegal(board, player, index))
                .toArray();
    }

    /**
     * Returns {@code true} if {@code player} has at least one legal placement.
     */
    public static boolean hasLegalMove(Board board, Player player) {
        Objects.requireNonNull(board, "board");
        return IntStream.of(board.emptyIndices()).anyMatch(index -> isLegal(board, player, index));
    }
}
