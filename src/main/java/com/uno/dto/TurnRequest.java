package com.uno.dto;

import jakarta.validation.constraints.NotBlank;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A turn action: {@code "play-card"} with a card (and a color for wilds), or {@code "draw-card"}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TurnRequest {

    @NotBlank(message = "Player id is required")
    private String playerId;

    @NotBlank(message = "Action is required")
    private String action;

    private String card;

    private String chosenColor;
}
