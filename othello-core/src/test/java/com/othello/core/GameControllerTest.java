package com.othello.core;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class GameControllerTest {

    private static final int A = 0;
    private static final int B = 1;
    private static final int C = 2;
    private static final int D = 3;
    private static final int E = 4;
    private static final int F = 5;

    @Test
    void newGameStartsWithBlackToMove() {
        GameController controller = new GameController();
        assertEquals(Player.BLACK, controller.getActivePlayer());
        assertEquals(0, controller.getTurnNumber());
        assertEquals(GameStatus.IN_PROGRESS, controller.getStatus());
        assertTrue(controller.getTerminationReason().isEmpty());
        assertEquals(new Score(2, 2), controller.getScore());
        assertEquals(8, controller.getBoardSize());
    }

    @Test
    void blackCapturingLeftOfCentreFlipsOneWhiteDisc() {
        GameController controller = new GameController(8);
        TurnResult result = controller.play(4, C);

        assertEquals(List.of(27), result.move().capturedIndices());
        assertFalse(result.hasSkippedTurn());
        assertEquals(new Score(4, 1), controller.getScore());
        assertEquals(Player.WHITE, controller.getActivePlayer());
        assertEquals(1, controller.getTurnNumber());

        GameSnapshot snapshot = result.snapshot();
        assertEquals(4, snapshot.blackCount());
        assertEquals(1, snapshot.whiteCount());
        assertEquals(Player.WHITE, snapshot.activePlayer());
        assertEquals(SquareStatus.BLACK, snapshot.status(26));
        assertEquals(SquareStatus.BLACK, snapshot.status(27));
    }

    @Test
    void occupiedSquareLeavesGameUnchanged() {
        GameController controller = new GameController();
        GameSnapshot before = controller.snapshot();

        IllegalMoveException ex = assertThrows(IllegalMoveException.class, () -> controller.play(4, D));

        assertEquals(MoveRejection.OCCUPIED_SQUARE, ex.getRejection());
        assertEquals(before, controller.snapshot());
        assertEquals(Player.BLACK, controller.getActivePlayer());
        assertEquals(0, controller.getTurnNumber());
    }

    @Test
    void placementWithoutCaptureLeavesGameUnchanged() {
        GameController controller = new GameController();
        GameSnapshot before = controller.snapshot();

        IllegalMoveException ex = assertThrows(IllegalMoveException.class, () -> controller.play(1, A));

        assertEquals(MoveRejection.NO_CAPTURES, ex.getRejection());
        assertEquals(before, controller.snapshot());
    }

    @Test
    void coordinatesOutsideBoardAreInvalidInput() {
        GameController controller = new GameController();
        assertThrows(InvalidInputException.class, () -> controller.play(0, A));
        assertThrows(InvalidInputException.class, () -> controller.play(9, A));
        assertThrows(InvalidInputException.class, () -> controller.play(1, -1));
        assertThrows(InvalidInputException.class, () -> controller.play(1, 8));
        assertEquals(0, controller.getTurnNumber());
    }

    @Test
    void regressionSequenceReachesFixedBoard() {
        GameController controller = new GameController();
        int[][] moves = {{3, D}, {5, C}, {6, D}, {3, E}, {3, F}, {2, E}, {5, F}};
        Player expectedMover = Player.BLACK;
        for (int[] move : moves) {
            assertEquals(expectedMover, controller.getActivePlayer());
            controller.play(move[0], move[1]);
            expectedMover = expectedMover.opponent();
        }

        Board expected = Board.fromRows(
                "........",
                "....W...",
                "...BWB..",
                "...WB...",
                "..WBBB..",
                "...B....",
                "........",
                "........");
        GameSnapshot snapshot = controller.snapshot();
        assertEquals(expected, snapshot.board());
        assertEquals(new Score(7, 4), snapshot.score());
        assertEquals(7, snapshot.turnNumber());
        assertEquals(Player.WHITE, snapshot.activePlayer());
    }

    @Test
    void submitDispatchesPlacementsAndQuit() {
        GameController controller = new GameController();
        Optional<TurnResult> placed = controller.submit(TurnInput.placement(3, D));
        assertTrue(placed.isPresent());
        assertEquals(19, placed.get().move().targetIndex());

        assertTrue(controller.submit(TurnInput.quit()).isEmpty());
        assertEquals(GameStatus.TERMINATED, controller.getStatus());
        assertEquals(Optional.of(TerminationReason.QUIT), controller.getTerminationReason());
    }

    @Test
    void terminatedGameRejectsFurtherTurns() {
        GameController controller = new GameController();
        controller.quit();

        assertFalse(controller.isInProgress());
        assertThrows(IllegalStateException.class, () -> controller.play(3, D));
        assertThrows(IllegalStateException.class, controller::quit);
        assertArrayEquals(new int[0], controller.legalMoves());
        assertEquals(0, controller.getTurnNumber());
    }

    @Test
    void playerWithoutLegalMoveIsSkipped() {
        Board board = Board.fromRows(
                "B...",
                "B...",
                "W...",
                "..WB");
        GameController controller = new GameController(board, Player.BLACK);
        assertArrayEquals(new int[] {12, 13}, controller.legalMoves());

        TurnResult result = controller.play(4, B);

        assertTrue(result.hasSkippedTurn());
        assertEquals(Player.WHITE, result.skippedPlayer());
        assertEquals(Player.BLACK, controller.getActivePlayer());
        assertEquals(GameStatus.IN_PROGRESS, controller.getStatus());
        assertEquals(1, controller.getTurnNumber());
    }

    @Test
    void gameEndsWhenNeitherPlayerCanMove() {
        Board board = Board.fromRows(
                "B...",
                "B...",
                "W...",
                "..WB");
        GameController controller = new GameController(board, Player.BLACK);
        controller.play(4, B);
        TurnResult result = controller.play(4, A);

        assertFalse(result.hasSkippedTurn());
        assertEquals(GameStatus.TERMINATED, controller.getStatus());
        assertEquals(Optional.of(TerminationReason.NO_LEGAL_MOVES), controller.getTerminationReason());
        assertEquals(new Score(7, 0), controller.getScore());
        assertEquals(Optional.of(Player.BLACK), controller.getScore().winner());
        assertEquals(2, controller.getTurnNumber());
        assertTrue(result.snapshot().isTerminated());
    }

    @Test
    void gameEndsWhenBoardIsFull() {
        Board board = Board.fromRows(
                "BBBB",
                "BBBB",
                "BBBB",
                "BBW.");
        GameController controller = new GameController(board, Player.BLACK);
        controller.play(4, D);

        assertEquals(Optional.of(TerminationReason.BOARD_FULL), controller.getTerminationReason());
        assertEquals(new Score(16, 0), controller.getScore());
    }

    @Test
    void positionWithoutMovesTerminatesImmediately() {
        Board board = Board.fromRows(
                "....",
                ".BB.",
                ".BB.",
                "....");
        GameController controller = new GameController(board, Player.WHITE);
        assertEquals(Optional.of(TerminationReason.NO_LEGAL_MOVES), controller.getTerminationReason());
        assertEquals(new Score(4, 0), controller.getScore());
    }

    @Test
    void snapshotIsDetachedFromLiveBoard() {
        GameController controller = new GameController();
        GameSnapshot snapshot = controller.snapshot();
        snapshot.board().replace(Map.of(0, SquareStatus.BLACK));

        assertEquals(SquareStatus.EMPTY, snapshot.status(0));
        assertEquals(SquareStatus.EMPTY, controller.snapshot().status(0));
        assertNull(snapshot.terminationReason());
    }

    @Test
    void fullGameOnSmallBoardAlwaysTerminates() {
        GameController controller = new GameController(4);
        int turns = 0;
        while (controller.isInProgress()) {
            int[] legal = controller.legalMoves();
            assertTrue(legal.length > 0, "active player must have a move while the game runs");
            controller.place(legal[0]);
            turns++;
            assertTrue(turns <= 12, "more placements than empty squares");
        }
        Score score = controller.getScore();
        assertTrue(score.black() + score.white() <= 16);
        assertTrue(controller.getTerminationReason().isPresent());
    }

    @Test
    void wideBoardRejectionsKeepTheirExceptionTypes() {
        GameController controller = new GameController(28);

        IllegalMoveException rejected = assertThrows(IllegalMoveException.class, () -> controller.play(1, 27));
        assertEquals(MoveRejection.NO_CAPTURES, rejected.getRejection());
        assertThrows(InvalidInputException.class, () -> controller.play(1, 28));
        assertThrows(InvalidInputException.class, () -> controller.play(29, 0));

        assertEquals(Player.BLACK, controller.getActivePlayer());
        assertEquals(0, controller.getTurnNumber());
        assertEquals(new Score(2, 2), controller.getScore());
    }
}
