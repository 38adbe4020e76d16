package com.othello.visualizer.model;

import com.othello.core.GameController;
import com.othello.core.GameSnapshot;
import com.othello.core.Move;
import com.othello.core.TurnResult;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Snapshot of a single position shown by the visualizer, together with the placement that led
 * to it and the squares the side to move may play.
 */
public record GameFrame(
        GameSnapshot snapshot,
        Move lastMove,
        List<Integer> legalTargets,
        String message) {

    public GameFrame {
        Objects.requireNonNull(snapshot, "snapshot");
        legalTargets = legalTargets == null ? List.of() : List.copyOf(legalTargets);
        message = message == null ? "" : message;
    }

    /**
     * Builds the frame for the controller's current position before any placement is shown.
     */
    public static GameFrame initial(GameController controller) {
        Objects.requireNonNull(controller, "controller");
        GameSnapshot snapshot = controller.snapshot();
        String message = snapshot.isTerminated()
                ? describeResult(snapshot)
                : snapshot.activePlayer() + " to move";
        return new GameFrame(snapshot, null, targetsOf(controller), message);
    }

    /**
     * Builds the frame following an accepted placement.
     */
    public static GameFrame afterTurn(GameController controller, TurnResult result) {
        Objects.requireNonNull(controller, "controller");
        Objects.requireNonNull(result, "result");
        GameSnapshot snapshot = result.snapshot();
        String message;
        if (snapshot.isTerminated()) {
            message = describeResult(snapshot);
        } else if (result.hasSkippedTurn()) {
            message = result.skippedPlayer() + " cannot move and passes; " + snapshot.activePlayer() + " to move";
        } else {
            message = snapshot.activePlayer() + " to move";
        }
        return new GameFrame(snapshot, result.move(), targetsOf(controller), message);
    }

    public GameFrame withMessage(String newMessage) {
        return new GameFrame(snapshot, lastMove, legalTargets, newMessage);
    }

    public boolean hasLastMove() {
        return lastMove != null;
    }

    public boolean isLegalTarget(int index) {
        return legalTargets.contains(index);
    }

    /**
     * Returns {@code true} if the square changed owner in the last placement.
     */
    public boolean wasFlipped(int index) {
        return hasLastMove() && lastMove.capturedIndices().contains(index);
    }

    /**
     * Returns a one-line summary of a finished game, e.g. "Board full. Black wins 40 to 24".
     */
    public static String describeResult(GameSnapshot snapshot) {
        String reason = switch (snapshot.reason().orElseThrow()) {
            case QUIT -> "Game abandoned";
            case NO_LEGAL_MOVES -> "No moves left";
            case BOARD_FULL -> "Board full";
        };
        int black = snapshot.blackCount();
        int white = snapshot.whiteCount();
        String outcome = snapshot.score().winner()
                .map(winner -> winner + " wins " + Math.max(black, white) + " to " + Math.min(black, white))
                .orElse("Draw at " + black);
        return reason + ". " + outcome;
    }

    private static List<Integer> targetsOf(GameController controller) {
        return IntStream.of(controller.legalMoves()).boxed().toList();
    }
}
