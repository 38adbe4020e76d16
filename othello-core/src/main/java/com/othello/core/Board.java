package com.othello.core;

import java.util.Arrays;
import java.util.Map;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Square Othello board stored as a row-major array of {@link SquareStatus} values.
 * The edge length is even, at least {@value #MIN_SIZE}, and fixed for the lifetime of the board.
 * Squares only change through {@link #replace(Map)}, which commits a whole set of changes or none.
 */
public final class Board {

    public static final int MIN_SIZE = 4;
    public static final int DEFAULT_SIZE = 8;

    private final int size;
    private final SquareStatus[] squares;

    private Board(int size, SquareStatus[] squares) {
        this.size = size;
        this.squares = squares;
    }

    /**
     * Creates a board with the four centre squares occupied and every other square empty.
     *
     * @throws IllegalArgumentException if {@code size} is odd or smaller than {@value #MIN_SIZE}
     */
    public static Board create(int size) {
        if (size < MIN_SIZE) {
            throw new IllegalArgumentException("Board size must be at least " + MIN_SIZE + ": " + size);
        }
        if (size % 2 != 0) {
            throw new IllegalArgumentException("Board size must be even: " + size);
        }
        SquareStatus[] squares = new SquareStatus[size * size];
        Arrays.fill(squares, SquareStatus.EMPTY);

        // Colours follow the position in the list, not the geometry: 1st and 4th white.
        int[] starting = startingIndices(size);
        squares[starting[0]] = SquareStatus.WHITE;
        squares[starting[1]] = SquareStatus.BLACK;
        squares[starting[2]] = SquareStatus.BLACK;
        squares[starting[3]] = SquareStatus.WHITE;
        return new Board(size, squares);
    }

    /**
     * Builds a board from rows of {@code B}, {@code W} and {@code .} characters, top row first.
     * Used to set up positions that cannot be reached from the standard start.
     */
    static Board fromRows(String... rows) {
        int size = rows.length;
        if (size < MIN_SIZE || size % 2 != 0) {
            throw new IllegalArgumentException("Board size must be an even number of at least " + MIN_SIZE + ": " + size);
        }
        SquareStatus[] squares = new SquareStatus[size * size];
        for (int row = 0; row < size; row++) {
            if (rows[row].length() != size) {
                throw new IllegalArgumentException("Row " + row + " must have " + size + " squares: " + rows[row]);
            }
            for (int column = 0; column < size; column++) {
                char symbol = rows[row].charAt(column);
                squares[row * size + column] = switch (symbol) {
                    case 'B' -> SquareStatus.BLACK;
                    case 'W' -> SquareStatus.WHITE;
                    case '.' -> SquareStatus.EMPTY;
                    default -> throw new IllegalArgumentException("Unknown square symbol: " + symbol);
                };
            }
        }
        return new Board(size, squares);
    }

    /**
     * Returns the index of the top-left square of the central 2×2 block.
     */
    public static int centerIndex(int size) {
        return (size / 2 - 1) * (size + 1);
    }

    /**
     * Returns the four starting squares in their fixed order: centre, right, down, down-right.
     */
    public static int[] startingIndices(int size) {
        int center = centerIndex(size);
        return new int[] {
                center,
                Direction.RIGHT.step(center, size).getAsInt(),
                Direction.DOWN.step(center, size).getAsInt(),
                Direction.DOWN_RIGHT.step(center, size).getAsInt()
        };
    }

    /**
     * Returns the edge length of the board.
     */
    public int size() {
        return size;
    }

    /**
     * Returns the total number of squares, {@code size * size}.
     */
    public int squareCount() {
        return squares.length;
    }

    /**
     * Returns the square at the provided row-major index.
     *
     * @throws IndexOutOfBoundsException if the index lies outside the grid
     */
    public Square at(int index) {
        return new Square(status(index), index);
    }

    /**
     * Returns the status of the square at the provided index.
     *
     * @throws IndexOutOfBoundsException if the index lies outside the grid
     */
    public SquareStatus status(int index) {
        checkIndex(index);
        return squares[index];
    }

    /**
     * Returns {@code true} if no disc occupies the square at the provided index.
     */
    public boolean isEmpty(int index) {
        return status(index) == SquareStatus.EMPTY;
    }

    /**
     * Applies all status changes in one step. Every entry is validated before any square is
     * touched, so a rejected mapping leaves the board unchanged.
     *
     * @throws IndexOutOfBoundsException if an index lies outside the grid
     * @throws IllegalArgumentException if an entry would clear a square
     */
    public void replace(Map<Integer, SquareStatus> changes) {
        Objects.requireNonNull(changes, "changes");
        for (Map.Entry<Integer, SquareStatus> change : changes.entrySet()) {
            Integer index = Objects.requireNonNull(change.getKey(), "index");
            checkIndex(index);
            SquareStatus status = change.getValue();
            if (status == null || status == SquareStatus.EMPTY) {
                throw new IllegalArgumentException("Square " + index + " cannot be cleared");
            }
        }
        changes.forEach((index, status) -> squares[index] = status);
    }

    /**
     * Returns the number of squares with the provided status.
     */
    public int count(SquareStatus status) {
        Objects.requireNonNull(status, "status");
        int count = 0;
        for (SquareStatus square : squares) {
            if (square == status) {
                count++;
            }
        }
        return count;
    }

    /**
     * Returns {@code true} if no empty square is left.
     */
    public boolean isFull() {
        return count(SquareStatus.EMPTY) == 0;
    }

    /**
     * Returns the indices of all empty squares in ascending order.
     */
    public int[] emptyIndices() {
        return IntStream.range(0, squares.length)
                .filter(index -> squares[index] == SquareStatus.EMPTY)
                .toArray();
    }

    /**
     * Returns an independent copy of this board.
     */
    public Board copy() {
        return new Board(size, squares.clone());
    }

    /**
     * Returns the zero-based row of the provided index.
     */
    public int row(int index) {
        checkIndex(index);
        return index / size;
    }

    /**
     * Returns the zero-based column of the provided index.
     */
    public int column(int index) {
        checkIndex(index);
        return index % size;
    }

    /**
     * Converts zero-based row and column coordinates to a row-major index.
     */
    public int index(int row, int column) {
        if (row < 0 || row >= size || column < 0 || column >= size) {
            throw new IndexOutOfBoundsException("Coordinates out of range: (" + row + ", " + column + ")");
        }
        return row * size + column;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Board board)) {
            return false;
        }
        return size == board.size && Arrays.equals(squares, board.squares);
    }

    @Override
    public int hashCode() {
        return 31 * size + Arrays.hashCode(squares);
    }

    private void checkIndex(int index) {
        if (index < 0 || index >= squares.length) {
            throw new IndexOutOfBoundsException("Square index out of range: " + index);
        }
    }
}
