package com.uno.model;

/**
 * Represents the current status of a game.
 */
public enum GameStatus {
    WAITING,
    STARTED,
    FINISHED
}
