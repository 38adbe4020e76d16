package com.othello.core;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.OptionalInt;

/**
 * The eight compass directions on a square board. Each direction moves a fixed number of rows
 * and columns; steps are evaluated in two dimensions so that horizontal and diagonal moves
 * never wrap into a neighbouring row.
 */
public enum Direction {
    UP(-1, 0),
    DOWN(1, 0),
    LEFT(0, -1),
    RIGHT(0, 1),
    UP_LEFT(-1, -1),
    UP_RIGHT(-1, 1),
    DOWN_LEFT(1, -1),
    DOWN_RIGHT(1, 1);

    private final int rowDelta;
    private final int columnDelta;

    Direction(int rowDelta, int columnDelta) {
        this.rowDelta = rowDelta;
        this.columnDelta = columnDelta;
    }

    /**
     * Returns the row offset of one step, -1, 0 or 1.
     */
    public int rowDelta() {
        return rowDelta;
    }

    /**
     * Returns the column offset of one step, -1, 0 or 1.
     */
    public int columnDelta() {
        return columnDelta;
    }

    /**
     * Returns the change in linear row-major index produced by one step on a board with the
     * provided edge length, e.g. {@code +1} for {@link #RIGHT} and {@code size + 1} for
     * {@link #DOWN_RIGHT}.
     */
    public int delta(int size) {
        return rowDelta * size + columnDelta;
    }

    /**
     * Returns the direction pointing the opposite way.
     */
    public Direction inverse() {
        return switch (this) {
            case UP -> DOWN;
            case DOWN -> UP;
            case LEFT -> RIGHT;
            case RIGHT -> LEFT;
            case UP_LEFT -> DOWN_RIGHT;
            case UP_RIGHT -> DOWN_LEFT;
            case DOWN_LEFT -> UP_RIGHT;
            case DOWN_RIGHT -> UP_LEFT;
        };
    }

    /**
     * Returns the index one step away from {@code index} in this direction, or an empty result if
     * the step leaves the {@code size}×{@code size} grid.
     */
    public OptionalInt step(int index, int size) {
        if (size < 1) {
            throw new IllegalArgumentException("Board size must be positive: " + size);
        }
        if (index < 0 || index >= size * size) {
            throw new IndexOutOfBoundsException("Square index out of range: " + index);
        }
        int row = index / size + rowDelta;
        int column = index % size + columnDelta;
        if (row < 0 || row >= size || column < 0 || column >= size) {
            return OptionalInt.empty();
        }
        return OptionalInt.of(row * size + column);
    }

    /**
     * Returns every on-board neighbour of {@code index}, keyed by the direction that reaches it.
     * Iteration follows declaration order of the directions.
     */
    public static Map<Direction, Integer> neighbors(int index, int size) {
        Map<Direction, Integer> neighbors = new EnumMap<>(Direction.class);
        for (Direction direction : values()) {
            direction.step(index, size).ifPresent(neighbor -> neighbors.put(direction, neighbor));
        }
        return Collections.unmodifiableMap(neighbors);
    }
}
