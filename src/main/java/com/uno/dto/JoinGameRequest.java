package com.uno.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for joining a game.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class JoinGameRequest {

    @NotBlank(message = "Player id is required")
    private String playerId;

    @Size(max = 30, message = "Player name must be at most 30 characters")
    private String playerName;

    public String getPlayerName() {
        return playerName != null && !playerName.isBlank() ? playerName : playerId;
    }
}
