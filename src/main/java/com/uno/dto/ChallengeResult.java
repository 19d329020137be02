package com.uno.dto;

import lombok.Builder;
import lombok.Data;

/**
 * Outcome of an UNO challenge. A failed challenge is a normal result, not an error.
 */
@Data
@Builder
public class ChallengeResult {
    private boolean successful;
    private String challengerId;
    private String challengedId;
    private int cardsDrawn;
    private int challengedCardCount;
    private String message;
}
