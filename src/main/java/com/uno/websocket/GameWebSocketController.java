package com.uno.websocket;

import com.uno.dto.ChallengeResult;
import com.uno.dto.SeatDTO;
import com.uno.dto.TurnResult;
import com.uno.exception.UnoGameException;
import com.uno.model.Card;
import com.uno.model.PlayerSeat;
import com.uno.service.GameLockRegistry;
import com.uno.service.GameService;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.messaging.handler.annotation.DestinationVariable;
import org.springframework.messaging.handler.annotation.MessageMapping;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Controller;

/**
 * WebSocket controller for real-time game interactions.
 */
@Controller
@RequiredArgsConstructor
@Slf4j
public class GameWebSocketController {

    private final GameService gameService;
    private final GameLockRegistry lockRegistry;
    private final GameWebSocketHandler webSocketHandler;

    /**
     * Handle a play-card or draw-card action.
     */
    @MessageMapping("/game/{gameId}/turn")
    public void handleTurn(@DestinationVariable String gameId, @Payload TurnMessage message) {
        log.debug("Turn request: {} {} {} in game {}",
                message.getPlayerId(), message.getAction(), message.getCard(), gameId);

        try {
            Card card = message.getCard() != null ? Card.parse(message.getCard()) : null;
            TurnResult result = lockRegistry.execute(gameId, () -> gameService.executeTurn(
                    gameId, message.getPlayerId(), message.getAction(), card, message.getChosenColor()));
            webSocketHandler.broadcastTurn(gameId, result);
        } catch (UnoGameException | IllegalArgumentException e) {
            sendError(gameId, message.getPlayerId(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error processing turn", e);
            sendError(gameId, message.getPlayerId(), e.getMessage());
        }
    }

    /**
     * Handle an UNO declaration.
     */
    @MessageMapping("/game/{gameId}/uno")
    public void handleSayUno(@DestinationVariable String gameId, @Payload PlayerIdMessage message) {
        log.debug("UNO declared by {} in game {}", message.getPlayerId(), gameId);

        try {
            PlayerSeat seat = lockRegistry.execute(gameId,
                    () -> gameService.sayUno(gameId, message.getPlayerId()));
            webSocketHandler.broadcastUnoSaid(gameId, SeatDTO.fromSeat(seat));
            webSocketHandler.broadcastGameUpdate(gameId);
        } catch (UnoGameException e) {
            sendError(gameId, message.getPlayerId(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error processing UNO declaration", e);
            sendError(gameId, message.getPlayerId(), e.getMessage());
        }
    }

    /**
     * Handle an UNO challenge.
     */
    @MessageMapping("/game/{gameId}/challenge")
    public void handleChallenge(@DestinationVariable String gameId, @Payload ChallengeMessage message) {
        log.debug("Challenge by {} against {} in game {}",
                message.getChallengerId(), message.getChallengedId(), gameId);

        try {
            ChallengeResult result = lockRegistry.execute(gameId, () -> gameService.challengeUno(
                    gameId, message.getChallengerId(), message.getChallengedId()));
            webSocketHandler.broadcastChallenge(gameId, result);
            webSocketHandler.broadcastGameUpdate(gameId);
        } catch (UnoGameException e) {
            sendError(gameId, message.getChallengerId(), e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error processing challenge", e);
            sendError(gameId, message.getChallengerId(), e.getMessage());
        }
    }

    private void sendError(String gameId, String playerId, String error) {
        log.warn("Error in game {}: {}", gameId, error);
        webSocketHandler.broadcastError(gameId, playerId, error);
    }

    // Message DTOs
    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class TurnMessage {
        private String playerId;
        private String action;
        private String card;
        private String chosenColor;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PlayerIdMessage {
        private String playerId;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    public static class ChallengeMessage {
        private String challengerId;
        private String challengedId;
    }
}
