package com.othello.core;

import java.util.Objects;

/**
 * Read-only view of one board square: its ownership status and row-major index.
 */
public record Square(SquareStatus status, int index) {

    public Square {
        Objects.requireNonNull(status, "status");
        if (index < 0) {
            throw new IllegalArgumentException("index must not be negative");
        }
    }

    public boolean isEmpty() {
        return status == SquareStatus.EMPTY;
    }
}
