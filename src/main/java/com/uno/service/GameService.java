package com.uno.service;

import com.uno.config.GameProperties;
import com.uno.dto.ChallengeResult;
import com.uno.dto.CreateGameRequest;
import com.uno.dto.GameStateDTO;
import com.uno.dto.JoinGameRequest;
import com.uno.dto.SeatDTO;
import com.uno.dto.TurnResult;
import com.uno.model.Card;
import com.uno.model.Game;
import com.uno.model.PlayerSeat;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;

/**
 * Entry point for every game operation. Delegates to the lifecycle, play, rules and query services.
 * <p>
 * Calls that mutate one game must be serialized by the caller, see {@link GameLockRegistry}.
 */
@Service
@RequiredArgsConstructor
public class GameService {

    private final GameLifecycleService lifecycleService;
    private final CardPlayService cardPlayService;
    private final UnoRulesService unoRulesService;
    private final GameQueryService queryService;
    private final GameProperties gameProperties;

    // Lifecycle

    public Game createGame(CreateGameRequest request) {
        return lifecycleService.createGame(request);
    }

    public PlayerSeat joinGame(String gameId, JoinGameRequest request) {
        return lifecycleService.joinGame(gameId, request);
    }

    public Game dealInitialHands(String gameId, String playerId) {
        return lifecycleService.dealInitialHands(gameId, playerId, gameProperties.cardsPerPlayer());
    }

    public Game dealInitialHands(String gameId, String playerId, int cardsPerPlayer) {
        return lifecycleService.dealInitialHands(gameId, playerId, cardsPerPlayer);
    }

    public Game leaveGame(String gameId, String playerId) {
        return lifecycleService.leaveGame(gameId, playerId);
    }

    public Game endGame(String gameId, String playerId) {
        return lifecycleService.endGame(gameId, playerId);
    }

    // Turns

    public TurnResult playCard(String gameId, String playerId, Card card, String chosenColor) {
        return cardPlayService.playCard(gameId, playerId, card, chosenColor);
    }

    public TurnResult drawCard(String gameId, String playerId) {
        return cardPlayService.drawCard(gameId, playerId);
    }

    public TurnResult executeTurn(String gameId, String playerId, String action, Card card, String chosenColor) {
        return cardPlayService.executeTurn(gameId, playerId, action, card, chosenColor);
    }

    // UNO

    public PlayerSeat sayUno(String gameId, String playerId) {
        return unoRulesService.sayUno(gameId, playerId);
    }

    public ChallengeResult challengeUno(String gameId, String challengerId, String challengedId) {
        return unoRulesService.challengeUno(gameId, challengerId, challengedId);
    }

    // Queries

    public Game getGame(String gameId) {
        return queryService.getGame(gameId);
    }

    public GameStateDTO getGameState(String gameId) {
        return queryService.getGameState(gameId);
    }

    public List<Card> getHand(String gameId, String playerId) {
        return queryService.getHand(gameId, playerId);
    }

    public List<Card> getLegalCards(String gameId, String playerId) {
        return queryService.getLegalCards(gameId, playerId);
    }

    public SeatDTO getCurrentPlayer(String gameId) {
        return queryService.getCurrentPlayer(gameId);
    }

    public Card getTopCard(String gameId) {
        return queryService.getTopCard(gameId);
    }

    public Map<String, Integer> getScores(String gameId) {
        return queryService.getScores(gameId);
    }

    public List<Game> getJoinableGames() {
        return queryService.getJoinableGames();
    }

    public List<Game> getAllGames() {
        return queryService.getAllGames();
    }
}
