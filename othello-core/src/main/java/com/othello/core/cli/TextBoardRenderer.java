package com.othello.core.cli;

import com.othello.core.Board;
import com.othello.core.GameObserver;
import com.othello.core.GameSnapshot;
import com.othello.core.IllegalMoveException;
import com.othello.core.InvalidInputException;
import com.othello.core.Move;
import com.othello.core.Notation;
import com.othello.core.Player;
import com.othello.core.Score;
import com.othello.core.TerminationReason;
import java.io.PrintStream;
import java.util.Locale;
import java.util.Objects;

/**
 * Console display: prints the board as a lettered grid together with scores and game events.
 */
public final class TextBoardRenderer implements GameObserver {

    private final PrintStream out;

    public TextBoardRenderer(PrintStream out) {
        this.out = Objects.requireNonNull(out, "out");
    }

    /**
     * Renders the board, e.g. for a 4×4 start:
     * <pre>
     *     A   B   C   D
     *  1|   |   |   |   |
     *  2|   | W | B |   |
     * </pre>
     */
    public static String render(Board board) {
        int size = board.size();
        int rowWidth = Math.max(2, Integer.toString(size).length());
        StringBuilder builder = new StringBuilder(" ".repeat(rowWidth + 1));
        for (int column = 0; column < size; column++) {
            String name = Notation.columnName(column).toUpperCase(Locale.ROOT);
            builder.append(' ').append(String.format("%-3s", name));
        }
        trimTrailing(builder);
        builder.append(System.lineSeparator());

        String rowFormat = "%" + rowWidth + "d|";
        for (int row = 0; row < size; row++) {
            builder.append(String.format(rowFormat, row + 1));
            for (int column = 0; column < size; column++) {
                builder.append(' ').append(board.status(board.index(row, column)).symbol()).append(" |");
            }
            builder.append(System.lineSeparator());
        }
        return builder.toString();
    }

    @Override
    public void onTurnStart(GameSnapshot snapshot) {
        out.print(render(snapshot.board()));
        out.printf("Black: %d  White: %d%n", snapshot.blackCount(), snapshot.whiteCount());
        out.printf("Turn %d, %s to move%n", snapshot.turnNumber() + 1, snapshot.activePlayer());
    }

    @Override
    public void onMoveApplied(Move move, GameSnapshot snapshot) {
        Board board = snapshot.board();
        out.printf("%s played %s and flipped %d%n", move.player(), Notation.label(move.targetIndex(), board),
                move.captureCount());
    }

    @Override
    public void onMoveRejected(IllegalMoveException rejection) {
        out.println("Invalid move: " + rejection.getMessage() + ". Try again.");
    }

    @Override
    public void onInputRejected(InvalidInputException rejection) {
        out.println("Invalid input: " + rejection.getMessage());
    }

    @Override
    public void onTurnSkipped(Player player, GameSnapshot snapshot) {
        out.printf("%s has no legal move and passes.%n", player);
    }

    @Override
    public void onGameOver(GameSnapshot snapshot) {
        out.print(render(snapshot.board()));
        Score score = snapshot.score();
        out.printf("Final score: Black %d, White %d%n", score.black(), score.white());
        TerminationReason reason = snapshot.reason().orElse(TerminationReason.QUIT);
        switch (reason) {
            case QUIT -> out.println("Game abandoned.");
            case NO_LEGAL_MOVES -> out.println("Neither player can move.");
            case BOARD_FULL -> out.println("The board is full.");
        }
        out.println(score.winner().map(winner -> "Winner: " + winner).orElse("Draw"));
    }

    private static void trimTrailing(StringBuilder builder) {
        int length = builder.length();
        while (length > 0 && builder.charAt(length - 1) == ' ') {
            length--;
        }
        builder.setLength(length);
    }
}
