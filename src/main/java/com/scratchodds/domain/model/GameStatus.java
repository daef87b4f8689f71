package com.scratchodds.domain.model;

/**
 * Lifecycle of a game record within one snapshot.
 * PENDING moves to exactly one of the terminal states.
 */
public enum GameStatus {
    PENDING,
    RESOLVED,
    FAILED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
