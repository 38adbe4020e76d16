package com.othello.core.cli;

import com.othello.core.GameSnapshot;
import com.othello.core.InvalidInputException;
import com.othello.core.MoveSource;
import com.othello.core.TurnInput;
import java.io.PrintStream;
import java.util.Objects;
import java.util.Scanner;

/**
 * Reads one line per turn from the operator and re-prompts until it names a square or quits.
 * End of input is treated as a quit request.
 */
public final class ConsoleMoveSource implements MoveSource {

    private final Scanner scanner;
    private final PrintStream out;

    public ConsoleMoveSource(Scanner scanner, PrintStream out) {
        this.scanner = Objects.requireNonNull(scanner, "scanner");
        this.out = Objects.requireNonNull(out, "out");
    }

    @Override
    public TurnInput nextInput(GameSnapshot snapshot) {
        while (true) {
            out.printf("%s, choose a square (e.g. d3) or q to quit: ", snapshot.activePlayer());
            if (!scanner.hasNextLine()) {
                out.println();
                return TurnInput.quit();
            }
            String line = scanner.nextLine();
            try {
                return CoordinateParser.parse(line, snapshot.size());
            } catch (InvalidInputException ex) {
                out.println(ex.getMessage());
            }
        }
    }
}
