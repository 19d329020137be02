package com.uno.websocket;

import com.uno.dto.ChallengeResult;
import com.uno.dto.GameStateDTO;
import com.uno.dto.SeatDTO;
import com.uno.dto.TurnResult;
import com.uno.model.Card;
import com.uno.service.CardPlayService;
import com.uno.service.GameService;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.simp.SimpMessagingTemplate;
import org.springframework.stereotype.Component;

/**
 * Pushes game events to {@code /topic/game/{gameId}}. Only public state is sent: hands appear as card counts.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GameWebSocketHandler {

    private static final String TOPIC_PREFIX = "/topic/game/";

    private final SimpMessagingTemplate messagingTemplate;
    private final GameService gameService;

    /**
     * Broadcast game state update to all players in a game.
     */
    public void broadcastGameUpdate(String gameId) {
        try {
            GameStateDTO gameState = gameService.getGameState(gameId);
            send(gameId, GameMessage.of("GAME_UPDATE", gameState));
            log.debug("Broadcast game update for game {}", gameId);
        } catch (RuntimeException e) {
            log.error("Error broadcasting game update for game {}", gameId, e);
        }
    }

    /**
     * Broadcast everything that follows a turn: the action, the new state, and the end of the game if it ended.
     */
    public void broadcastTurn(String gameId, TurnResult result) {
        if (CardPlayService.DRAW_CARD.equals(result.getAction())) {
            broadcastCardDrawn(gameId, result);
        } else {
            broadcastCardPlayed(gameId, result);
        }
        broadcastGameUpdate(gameId);
        if (result.isGameOver()) {
            broadcastGameOver(gameId, result.getWinner());
        }
    }

    public void broadcastCardPlayed(String gameId, TurnResult result) {
        CardPlayedMessage message = CardPlayedMessage.builder()
                .playerId(result.getPlayerId())
                .card(result.getCardPlayed())
                .currentColor(result.getCurrentColor() != null ? result.getCurrentColor().getLabel() : null)
                .direction(result.getDirection())
                .nextPlayerId(result.getNextPlayerId())
                .skippedPlayerId(result.getSkippedPlayerId())
                .penaltyCards(result.getPenaltyCards())
                .remainingCards(result.getRemainingCards())
                .unoWarning(result.getUnoWarning())
                .build();
        send(gameId, GameMessage.of("CARD_PLAYED", message));
    }

    /**
     * The drawn card itself stays private to the drawing player.
     */
    public void broadcastCardDrawn(String gameId, TurnResult result) {
        CardDrawnMessage message = new CardDrawnMessage(
                result.getPlayerId(), result.getRemainingCards(), result.getNextPlayerId());
        send(gameId, GameMessage.of("CARD_DRAWN", message));
    }

    public void broadcastUnoSaid(String gameId, SeatDTO seat) {
        send(gameId, GameMessage.of("UNO_SAID", seat));
    }

    public void broadcastChallenge(String gameId, ChallengeResult result) {
        send(gameId, GameMessage.of("UNO_CHALLENGE", result));
    }

    /**
     * Broadcast player left notification.
     */
    public void broadcastPlayerLeft(String gameId, String playerId) {
        send(gameId, GameMessage.of("PLAYER_LEFT", playerId));
    }

    /**
     * Broadcast game over notification. A {@code null} winner means the game was ended early.
     */
    public void broadcastGameOver(String gameId, String winnerName) {
        send(gameId, GameMessage.of("GAME_OVER", winnerName));
    }

    /**
     * Broadcast an error message to all players (clients can filter by playerId).
     */
    public void broadcastError(String gameId, String playerId, String error) {
        send(gameId, GameMessage.of("ERROR", new GameErrorMessage(playerId, error)));
    }

    private void send(String gameId, GameMessage message) {
        messagingTemplate.convertAndSend(TOPIC_PREFIX + gameId, message);
    }

    /**
     * Generic game message wrapper.
     */
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class GameMessage {
        private String type;
        private Object payload;
        private long timestamp;

        public static GameMessage of(String type, Object payload) {
            return GameMessage.builder()
                    .type(type)
                    .payload(payload)
                    .timestamp(System.currentTimeMillis())
                    .build();
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class CardPlayedMessage {
        private String playerId;
        private Card card;
        private String currentColor;
        private int direction;
        private String nextPlayerId;
        private String skippedPlayerId;
        private int penaltyCards;
        private int remainingCards;
        private String unoWarning;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CardDrawnMessage {
        private String playerId;
        private int cardCount;
        private String nextPlayerId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GameErrorMessage {
        private String playerId;
        private String error;
    }
}
