package com.othello.core.cli;

import com.othello.core.InvalidInputException;
import com.othello.core.Notation;
import com.othello.core.TurnInput;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns operator text into {@link TurnInput}. Accepts {@code q}/{@code quit}, letter-first labels
 * such as {@code d3} and row-first pairs such as {@code 3 d}; letters are case-insensitive.
 */
public final class CoordinateParser {

    private static final Pattern LETTER_FIRST = Pattern.compile("([a-z]+)\\s*,?\\s*(\\d+)");
    private static final Pattern ROW_FIRST = Pattern.compile("(\\d+)\\s*,?\\s*([a-z]+)");

    private CoordinateParser() {
    }

    /**
     * Parses one line of input for a board with the provided edge length.
     *
     * @throws InvalidInputException if the text is not a quit command or a square on the board
     */
    public static TurnInput parse(String text, int size) {
        if (text == null || text.isBlank()) {
            throw new InvalidInputException("Please enter a square such as d3, or q to quit.");
        }
        String normalized = text.trim().toLowerCase(Locale.ROOT);
        if (normalized.equals("q") || normalized.equals("quit")) {
            return TurnInput.quit();
        }

        String letters;
        String digits;
        Matcher matcher = LETTER_FIRST.matcher(normalized);
        if (matcher.matches()) {
            letters = matcher.group(1);
            digits = matcher.group(2);
        } else {
            matcher = ROW_FIRST.matcher(normalized);
            if (!matcher.matches()) {
                throw new InvalidInputException("Cannot read a square from '" + text.trim() + "'.");
            }
            digits = matcher.group(1);
            letters = matcher.group(2);
        }

        int column;
        try {
            column = Notation.columnOf(letters);
        } catch (IllegalArgumentException ex) {
            throw new InvalidInputException(columnRangeMessage(size), ex);
        }
        if (column >= size) {
            throw new InvalidInputException(columnRangeMessage(size));
        }
        int row;
        try {
            row = Integer.parseInt(digits);
        } catch (NumberFormatException ex) {
            throw new InvalidInputException("Row is not a number: " + digits, ex);
        }
        if (row < 1 || row > size) {
            throw new InvalidInputException("Row must be between 1 and " + size + ".");
        }
        return TurnInput.placement(row, column);
    }

    private static String columnRangeMessage(int size) {
        return "Column must be between " + Notation.columnName(0) + " and " + Notation.columnName(size - 1) + ".";
    }
}
