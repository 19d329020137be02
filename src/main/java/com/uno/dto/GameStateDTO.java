package com.uno.dto;

import com.uno.model.Card;
import com.uno.model.CardColor;
import com.uno.model.Game;
import com.uno.model.GameStatus;
import com.uno.model.PlayerSeat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;
import java.util.List;

/**
 * DTO for game state representation.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class GameStateDTO {

    private String gameId;
    private String gameName;
    private GameStatus status;
    private int direction;
    private Card topCard;
    private CardColor currentColor;
    private int deckSize;
    private int discardPileSize;
    private SeatDTO currentPlayer;
    private List<SeatDTO> players;
    private int maxPlayers;
    private String creatorId;
    private String winnerId;
    private String winnerName;
    private LocalDateTime createdAt;
    private LocalDateTime startedAt;
    private LocalDateTime endedAt;

    public static GameStateDTO fromGame(Game game) {
        PlayerSeat current = game.isStarted() ? game.getCurrentSeat() : null;
        return GameStateDTO.builder()
                .gameId(game.getId())
                .gameName(game.getName())
                .status(game.getStatus())
                .direction(game.getDirection())
                .topCard(game.getTopCard())
                .currentColor(game.getCurrentColor())
                .deckSize(game.getDeck().size())
                .discardPileSize(game.getDiscardPile().size())
                .currentPlayer(current != null ? SeatDTO.fromSeat(current) : null)
                .players(game.getSeats().stream()
                    .map(SeatDTO::fromSeat)
                    .toList())
                .maxPlayers(game.getMaxPlayers())
                .creatorId(game.getCreatorId())
                .winnerId(game.getWinnerId())
                .winnerName(game.getWinnerId() != null
                    ? game.findSeat(game.getWinnerId())
                        .map(PlayerSeat::getPlayerName)
                        .orElse(null)
                    : null)
                .createdAt(game.getCreatedAt())
                .startedAt(game.getStartedAt())
                .endedAt(game.getEndedAt())
                .build();
    }
}
