package com.uno.dto;

import com.uno.model.Card;
import com.uno.model.CardColor;
import lombok.Builder;
import lombok.Data;

/**
 * Outcome of a play-card or draw-card action.
 */
@Data
@Builder
public class TurnResult {
    private String action;
    private String message;
    private String playerId;
    private Card cardPlayed;
    private Card cardDrawn;
    private CardColor currentColor;
    private int direction;
    private String nextPlayerId;
    private String nextPlayer;
    private String skippedPlayerId;
    private String skippedPlayer;
    private int penaltyCards;
    private int remainingCards;
    /** set when the acting player is down to one card */
    private String unoWarning;
    private String winnerId;
    private String winner;
    private int pointsWon;
    private boolean gameOver;
}
