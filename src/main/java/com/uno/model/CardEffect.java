package com.uno.model;

/**
 * What playing a card does to turn order. Resolved exhaustively by the turn state machine.
 */
public enum CardEffect {
    NONE,
    SKIP,
    REVERSE,
    DRAW_TWO,
    DRAW_FOUR
}
