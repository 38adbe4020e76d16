package com.othello.core;

/**
 * Why a match stopped.
 */
public enum TerminationReason {
    /** The operator asked to stop. */
    QUIT,
    /** Neither player can place a disc. */
    NO_LEGAL_MOVES,
    /** Every square is occupied. */
    BOARD_FULL
}
