package com.othello.core;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Drives a {@link GameController} to completion, pulling input from a {@link MoveSource} and
 * reporting every step to a {@link GameObserver}.
 */
public final class GameRunner {

    private static final Logger LOGGER = Logger.getLogger(GameRunner.class.getName());

    private final GameController controller;
    private final MoveSource moveSource;
    private final GameObserver observer;

    public GameRunner(GameController controller, MoveSource moveSource, GameObserver observer) {
        this.controller = Objects.requireNonNull(controller, "controller");
        this.moveSource = Objects.requireNonNull(moveSource, "moveSource");
        this.observer = Objects.requireNonNull(observer, "observer");
    }

    /**
     * Plays turns until the match terminates and returns the final score.
     */
    public Score run() {
        while (controller.isInProgress()) {
            GameSnapshot snapshot = controller.snapshot();
            observer.onTurnStart(snapshot);
            TurnInput input = Objects.requireNonNull(moveSource.nextInput(snapshot), "input");
            try {
                Optional<TurnResult> result = controller.submit(input);
                result.ifPresent(this::report);
            } catch (IllegalMoveException ex) {
                LOGGER.fine(() -> "Rejected placement: " + ex.getMessage());
                observer.onMoveRejected(ex);
            } catch (InvalidInputException ex) {
                LOGGER.fine(() -> "Rejected input " + input + ": " + ex.getMessage());
                observer.onInputRejected(ex);
            }
        }
        GameSnapshot finalSnapshot = controller.snapshot();
        observer.onGameOver(finalSnapshot);
        return finalSnapshot.score();
    }

    private void report(TurnResult result) {
        observer.onMoveApplied(result.move(), result.snapshot());
        if (result.hasSkippedTurn()) {
            observer.onTurnSkipped(result.skippedPlayer(), result.snapshot());
        }
    }
}
