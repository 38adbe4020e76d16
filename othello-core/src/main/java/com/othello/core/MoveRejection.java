package com.othello.core;

/**
 * Reasons a placement can be refused by {@link CaptureResolver}.
 */
public enum MoveRejection {
    OCCUPIED_SQUARE("is already occupied"),
    NO_CAPTURES("does not capture any disc");

    private final String description;

    MoveRejection(String description) {
        this.description = description;
    }

    public String description() {
        return description;
    }
}
