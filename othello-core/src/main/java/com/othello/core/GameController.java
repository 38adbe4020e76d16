package com.othello.core;

import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * Turn-based state machine for a single Othello match. The controller owns the authoritative
 * {@link Board} and is its only writer; collaborators see the game through {@link GameSnapshot}s.
 *
 * <p>A match starts {@link GameStatus#IN_PROGRESS} with Black to move. After each accepted
 * placement the turn passes to the opponent, unless the opponent has no legal placement, in which
 * case their turn is skipped. The match terminates when the board is full, when neither player can
 * move, or when the operator quits. Instances are not thread-safe.
 */
public final class GameController {

    private static final Logger LOGGER = Logger.getLogger(GameController.class.getName());

    private final Board board;
    private Player activePlayer;
    private int turnNumber;
    private GameStatus status = GameStatus.IN_PROGRESS;
    private TerminationReason terminationReason;

    /**
     * Creates a standard 8×8 match.
     */
    public GameController() {
        this(Board.DEFAULT_SIZE);
    }

    /**
     * Creates a match on a fresh board with the provided edge length.
     *
     * @throws IllegalArgumentException if the size is odd or too small
     */
    public GameController(int size) {
        this(Board.create(size), Player.BLACK);
    }

    GameController(Board board, Player firstPlayer) {
        this.board = Objects.requireNonNull(board, "board");
        Objects.requireNonNull(firstPlayer, "firstPlayer");
        advanceTo(firstPlayer);
    }

    /**
     * Places the active player's disc on the square at one-based {@code row} and zero-based
     * {@code column}.
     *
     * @throws InvalidInputException if the coordinates lie outside the board
     * @throws IllegalMoveException if the square is occupied or the placement captures nothing
     * @throws IllegalStateException if the match has already terminated
     */
    public TurnResult play(int row, int column) {
        ensureInProgress();
        int size = board.size();
        if (row < 1 || row > size) {
            throw new InvalidInputException("Row must be between 1 and " + size + ": " + row);
        }
        if (column < 0 || column >= size) {
            throw new InvalidInputException("Column must be between 0 and " + (size - 1) + ": " + column);
        }
        return place(board.index(row - 1, column));
    }

    /**
     * Places the active player's disc on the square with the provided row-major index.
     *
     * @throws IndexOutOfBoundsException if the index lies outside the board
     * @throws IllegalMoveException if the square is occupied or the placement captures nothing
     * @throws IllegalStateException if the match has already terminated
     */
    public TurnResult place(int index) {
        ensureInProgress();
        Player mover = activePlayer;
        Move move = CaptureResolver.resolve(board, mover, index);

        board.replace(move.changes());
        turnNumber++;
        LOGGER.fine(() -> String.format("Turn %d: %s played %s and flipped %d",
                turnNumber, mover, Notation.label(index, board), move.captureCount()));

        Player skipped = advanceTo(mover.opponent());
        return new TurnResult(move, skipped, snapshot());
    }

    /**
     * Dispatches one turn's input: quits on a quit signal, otherwise plays the placement.
     *
     * @return the outcome of an accepted placement, or an empty result after quitting
     */
    public Optional<TurnResult> submit(TurnInput input) {
        Objects.requireNonNull(input, "input");
        if (input.isQuit()) {
            quit();
            return Optional.empty();
        }
        return Optional.of(play(input.row(), input.column()));
    }

    /**
     * Stops the match at the operator's request.
     */
    public void quit() {
        ensureInProgress();
        terminate(TerminationReason.QUIT);
    }

    /**
     * Returns the player to move, or the player who would have moved once the match has ended.
     */
    public Player getActivePlayer() {
        return activePlayer;
    }

    /**
     * Returns the number of accepted placements so far. Skipped turns are not counted.
     */
    public int getTurnNumber() {
        return turnNumber;
    }

    /**
     * Returns whether the match is still running.
     */
    public GameStatus getStatus() {
        return status;
    }

    /**
     * Returns why the match ended, or empty while it is in progress.
     */
    public Optional<TerminationReason> getTerminationReason() {
        return Optional.ofNullable(terminationReason);
    }

    /**
     * Returns {@code true} until the match terminates.
     */
    public boolean isInProgress() {
        return status == GameStatus.IN_PROGRESS;
    }

    /**
     * Returns the edge length of the board.
     */
    public int getBoardSize() {
        return board.size();
    }

    /**
     * Returns the current disc count of both players.
     */
    public Score getScore() {
        return Score.of(board);
    }

    /**
     * Returns the legal targets for the player to move, or none once the match has terminated.
     */
    public int[] legalMoves() {
        if (!isInProgress()) {
            return new int[0];
        }
        return CaptureResolver.legalMoves(board, activePlayer);
    }

    /**
     * Returns a detached view of the current position for display collaborators.
     */
    public GameSnapshot snapshot() {
        Score score = getScore();
        return new GameSnapshot(board, board.size(), activePlayer, score.black(), score.white(),
                turnNumber, status, terminationReason);
    }

    /**
     * Hands the turn to {@code next}, skipping them if they cannot move and terminating the match
     * when nobody can.
     *
     * @return the player whose turn was skipped, or {@code null}
     */
    private Player advanceTo(Player next) {
        activePlayer = next;
        if (board.isFull()) {
            terminate(TerminationReason.BOARD_FULL);
            return null;
        }
        if (CaptureResolver.hasLegalMove(board, next)) {
            return null;
        }
        Player other = next.opponent();
        if (CaptureResolver.hasLegalMove(board, other)) {
            activePlayer = other;
            LOGGER.info(() -> next + " has no legal placement; " + other + " moves again");
            return next;
        }
        terminate(TerminationReason.NO_LEGAL_MOVES);
        return null;
    }

    private void terminate(TerminationReason reason) {
        status = GameStatus.TERMINATED;
        terminationReason = reason;
        Score score = getScore();
        LOGGER.info(() -> String.format("Game over after %d turns (%s): Black %d, White %d",
                turnNumber, reason, score.black(), score.white()));
    }

    private void ensureInProgress() {
        if (status != GameStatus.IN_PROGRESS) {
            throw new IllegalStateException("Game is over: " + terminationReason);
        }
    }
}
