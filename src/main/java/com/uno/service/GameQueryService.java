package com.uno.service;

import com.uno.dto.GameStateDTO;
import com.uno.dto.SeatDTO;
import com.uno.exception.GameErrorCode;
import com.uno.exception.UnoGameException;
import com.uno.model.Card;
import com.uno.model.Game;
import com.uno.model.PlayerSeat;
import com.uno.repository.GameRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Service responsible for game lookups, precondition checks and read-only views.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class GameQueryService {

    private final GameRepository gameRepository;
    private final PlayValidationService playValidationService;

    /**
     * Get game by ID.
     */
    public Game getGame(String gameId) {
        return gameRepository.findById(gameId)
                .orElseThrow(() -> new UnoGameException(GameErrorCode.NOT_FOUND, "Game not found: " + gameId));
    }

    /**
     * Get the seat a player holds in the game.
     */
    public PlayerSeat getSeat(Game game, String playerId) {
        return game.findSeat(playerId)
                .orElseThrow(() -> new UnoGameException(GameErrorCode.NOT_FOUND,
                        "Player " + playerId + " is not in this game"));
    }

    /**
     * Game lookup for turn actions: the game must exist and be in play.
     */
    public Game getStartedGame(String gameId) {
        Game game = getGame(gameId);
        requireStarted(game);
        return game;
    }

    public void requireStarted(Game game) {
        if (!game.isStarted()) {
            throw new UnoGameException(GameErrorCode.INVALID_GAME_STATE,
                    "Game is not in progress (status: " + game.getStatus() + ")");
        }
    }

    /**
     * Validate that the given seat holds the turn.
     */
    public void validateCurrentPlayer(PlayerSeat seat) {
        if (!seat.isCurrentTurn()) {
            throw new UnoGameException(GameErrorCode.NOT_YOUR_TURN);
        }
    }

    /**
     * Get full game state as DTO.
     */
    public GameStateDTO getGameState(String gameId) {
        return GameStateDTO.fromGame(getGame(gameId));
    }

    /**
     * A player's own hand.
     */
    public List<Card> getHand(String gameId, String playerId) {
        Game game = getGame(gameId);
        return List.copyOf(getSeat(game, playerId).getHand());
    }

    /**
     * Cards the player could legally play on the current discard, in hand order.
     */
    public List<Card> getLegalCards(String gameId, String playerId) {
        Game game = getStartedGame(gameId);
        PlayerSeat seat = getSeat(game, playerId);
        List<Card> legal = new ArrayList<>();
        playValidationService.legalCards(seat.getHand(), game.getTopCard(), game.getCurrentColor())
                .forEach(legal::add);
        return legal;
    }

    public SeatDTO getCurrentPlayer(String gameId) {
        Game game = getStartedGame(gameId);
        return SeatDTO.fromSeat(game.getCurrentSeat());
    }

    public Card getTopCard(String gameId) {
        Game game = getGame(gameId);
        if (game.getTopCard() == null) {
            throw new UnoGameException(GameErrorCode.INVALID_GAME_STATE, "Cards have not been dealt yet");
        }
        return game.getTopCard();
    }

    /**
     * Scores by player id, in turn order.
     */
    public Map<String, Integer> getScores(String gameId) {
        Map<String, Integer> scores = new LinkedHashMap<>();
        for (PlayerSeat seat : getGame(gameId).getSeats()) {
            scores.put(seat.getPlayerId(), seat.getScore());
        }
        return scores;
    }

    public List<Game> getJoinableGames() {
        return gameRepository.findJoinableGames();
    }

    public List<Game> getAllGames() {
        return gameRepository.findAll();
    }
}
