package com.uno.exception;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Failure kinds reported by game operations.
 */
@Getter
@AllArgsConstructor
public enum GameErrorCode {

    NOT_FOUND("Game or player not found", HttpStatus.NOT_FOUND),
    INVALID_GAME_STATE("Game is not in a state that allows this action", HttpStatus.CONFLICT),
    NOT_YOUR_TURN("It's not your turn", HttpStatus.CONFLICT),
    CARD_NOT_IN_HAND("Card not found in hand", HttpStatus.BAD_REQUEST),
    ILLEGAL_CARD("Invalid card. Please play a card that matches the top card on the discard pile.", HttpStatus.BAD_REQUEST),
    MISSING_COLOR_CHOICE("You must choose a color when playing a Wild card", HttpStatus.BAD_REQUEST),
    INVALID_COLOR_CHOICE("Invalid color. Choose one of: Red, Blue, Green, Yellow", HttpStatus.BAD_REQUEST),
    DECK_EXHAUSTED("No cards left to draw", HttpStatus.CONFLICT),
    INVALID_UNO_DECLARATION("You can only say UNO once, when holding exactly 1 card", HttpStatus.BAD_REQUEST),
    INVALID_CHALLENGE("Challenge not allowed: player does not have exactly 1 card", HttpStatus.BAD_REQUEST),
    INVALID_ACTION("Invalid action. Use \"play-card\" or \"draw-card\"", HttpStatus.BAD_REQUEST),
    GAME_FULL("Game is full", HttpStatus.CONFLICT),
    ALREADY_SEATED("Player already joined this game", HttpStatus.CONFLICT),
    NOT_ENOUGH_PLAYERS("At least 2 players are needed to start", HttpStatus.CONFLICT),
    NOT_GAME_CREATOR("Only the game creator can do this", HttpStatus.FORBIDDEN),
    GAME_BUSY("Another action is in progress for this game, try again", HttpStatus.CONFLICT);

    private final String message;
    private final HttpStatus status;
}
