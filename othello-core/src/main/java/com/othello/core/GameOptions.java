package com.othello.core;

import java.util.List;
import java.util.Objects;

/**
 * Command line options shared by the console and the visualizer front-ends.
 */
public record GameOptions(int boardSize) {

    private static final String SIZE_OPTION = "--size=";

    public GameOptions {
        if (boardSize < Board.MIN_SIZE || boardSize % 2 != 0) {
            throw new IllegalArgumentException("Board size must be an even number of at least "
                    + Board.MIN_SIZE + ": " + boardSize);
        }
    }

    /**
     * Returns the options of a standard 8×8 game.
     */
    public static GameOptions defaults() {
        return new GameOptions(Board.DEFAULT_SIZE);
    }

    /**
     * Parses {@code --size=<n>}; any other argument is rejected.
     *
     * @throws NumberFormatException if the size is not a number
     * @throws IllegalArgumentException if an argument is unknown or the size is invalid
     */
    public static GameOptions parse(List<String> args) {
        Objects.requireNonNull(args, "args");
        int boardSize = Board.DEFAULT_SIZE;
        boolean sizeSeen = false;
        for (String option : args) {
            if (option.startsWith(SIZE_OPTION)) {
                if (sizeSeen) {
                    throw new IllegalArgumentException("Board size specified more than once");
                }
                boardSize = Integer.parseInt(option.substring(SIZE_OPTION.length()));
                sizeSeen = true;
            } else {
                throw new IllegalArgumentException("Unrecognised argument: " + option);
            }
        }
        return new GameOptions(boardSize);
    }

    /**
     * Returns the usage text for a launcher called {@code program}.
     */
    public static String usage(String program) {
        return "Usage: " + program + " [" + SIZE_OPTION + "<even number >= " + Board.MIN_SIZE + ">]";
    }
}
