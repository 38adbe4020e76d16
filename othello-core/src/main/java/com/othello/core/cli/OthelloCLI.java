package com.othello.core.cli;

import com.othello.core.GameController;
import com.othello.core.GameOptions;
import com.othello.core.GameRunner;
import java.util.Arrays;
import java.util.Scanner;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Console front-end for playing a full Othello match between two humans.
 */
public final class OthelloCLI {

    private static final Logger LOGGER = Logger.getLogger(OthelloCLI.class.getName());

    private OthelloCLI() {
    }

    public static void main(String[] args) {
        GameOptions options;
        try {
            options = GameOptions.parse(Arrays.asList(args));
        } catch (NumberFormatException ex) {
            LOGGER.log(Level.SEVERE, "Failed to parse arguments", ex);
            System.err.println(GameOptions.usage("OthelloCLI"));
            return;
        } catch (IllegalArgumentException ex) {
            LOGGER.log(Level.SEVERE, ex.getMessage(), ex);
            System.err.println(GameOptions.usage("OthelloCLI"));
            return;
        }

        System.out.println("Othello, console edition");
        GameController controller = new GameController(options.boardSize());
        GameRunner runner = new GameRunner(controller,
                new ConsoleMoveSource(new Scanner(System.in), System.out),
                new TextBoardRenderer(System.out));
        runner.run();
    }
}
