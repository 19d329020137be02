package com.uno.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * DTO for creating a new game. The creator takes the first seat.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class CreateGameRequest {

    @NotBlank(message = "Game name is required")
    @Size(min = 3, max = 100, message = "Game name must be between 3 and 100 characters")
    private String gameName;

    @NotBlank(message = "Player id is required")
    private String playerId;

    @Size(max = 30, message = "Player name must be at most 30 characters")
    private String playerName;

    @Min(value = 2, message = "At least 2 players")
    @Max(value = 10, message = "At most 10 players")
    private Integer maxPlayers;

    public String getPlayerName() {
        return playerName != null && !playerName.isBlank() ? playerName : playerId;
    }
}
