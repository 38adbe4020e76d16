package com.othello.core;

public enum GameStatus {
    IN_PROGRESS,
    TERMINATED
}
