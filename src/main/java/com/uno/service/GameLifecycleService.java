package com.uno.service;

import com.uno.config.GameProperties;
import com.uno.dto.CreateGameRequest;
import com.uno.dto.JoinGameRequest;
import com.uno.exception.GameErrorCode;
import com.uno.exception.UnoGameException;
import com.uno.model.Game;
import com.uno.model.GameStatus;
import com.uno.model.PlayerSeat;
import com.uno.repository.GameRepository;
import com.uno.repository.PlayerSeatRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Comparator;
import java.util.List;

/**
 * Service responsible for game lifecycle: creation, joining, dealing, leaving and ending.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class GameLifecycleService {

    private final GameRepository gameRepository;
    private final PlayerSeatRepository playerSeatRepository;
    private final GameQueryService gameQueryService;
    private final DealingService dealingService;
    private final TurnManagementService turnManagementService;
    private final WinConditionService winConditionService;
    private final GameProperties gameProperties;

    /**
     * Create a new game. The creator takes the first seat.
     */
    public Game createGame(CreateGameRequest request) {
        log.info("Creating new game: {}", request.getGameName());

        int maxPlayers = request.getMaxPlayers() != null
                ? request.getMaxPlayers()
                : gameProperties.defaultMaxPlayers();
        if (maxPlayers < gameProperties.minPlayers() || maxPlayers > gameProperties.maxPlayers()) {
            throw new IllegalArgumentException("maxPlayers must be between "
                    + gameProperties.minPlayers() + " and " + gameProperties.maxPlayers());
        }

        Game game = Game.builder()
                .name(request.getGameName())
                .status(GameStatus.WAITING)
                .currentPlayerIndex(0)
                .maxPlayers(maxPlayers)
                .creatorId(request.getPlayerId())
                .build();

        game = gameRepository.save(game);
        addSeat(game, request.getPlayerId(), request.getPlayerName());
        return gameRepository.save(game);
    }

    /**
     * Join a game that has not been dealt yet.
     */
    public PlayerSeat joinGame(String gameId, JoinGameRequest request) {
        Game game = gameQueryService.getGame(gameId);

        if (game.getStatus() != GameStatus.WAITING) {
            throw new UnoGameException(GameErrorCode.INVALID_GAME_STATE, "Game is not accepting new players");
        }
        if (game.isFull()) {
            throw new UnoGameException(GameErrorCode.GAME_FULL);
        }
        if (playerSeatRepository.existsByGameIdAndPlayerId(gameId, request.getPlayerId())) {
            throw new UnoGameException(GameErrorCode.ALREADY_SEATED);
        }

        return addSeat(game, request.getPlayerId(), request.getPlayerName());
    }

    /**
     * Deal the opening hands and start play. Only the creator may deal.
     */
    public Game dealInitialHands(String gameId, String playerId, int cardsPerPlayer) {
        Game game = gameQueryService.getGame(gameId);

        requireCreator(game, playerId);
        if (game.getStatus() != GameStatus.WAITING) {
            throw new UnoGameException(GameErrorCode.INVALID_GAME_STATE, "Cards have already been dealt");
        }
        if (game.getSeats().size() < gameProperties.minPlayers()) {
            throw new UnoGameException(GameErrorCode.NOT_ENOUGH_PLAYERS,
                    "Need at least " + gameProperties.minPlayers() + " players to deal");
        }
        if (cardsPerPlayer < 1) {
            throw new IllegalArgumentException("cardsPerPlayer must be positive");
        }

        dealingService.dealInitialHands(game, cardsPerPlayer);
        game.setStatus(GameStatus.STARTED);
        game.setStartedAt(LocalDateTime.now());

        log.info("Game {} started with {} players", game.getId(), game.getSeats().size());
        return gameRepository.save(game);
    }

    /**
     * Remove a player from the game.
     * <p>
     * Before the deal the seat is simply dropped. During play the hand goes back under the deck,
     * the remaining seats close ranks, and the turn passes on if it was the leaver's.
     * A single remaining seat wins.
     */
    public Game leaveGame(String gameId, String playerId) {
        Game game = gameQueryService.getGame(gameId);
        PlayerSeat seat = gameQueryService.getSeat(game, playerId);

        if (game.getStatus() == GameStatus.FINISHED) {
            throw new UnoGameException(GameErrorCode.INVALID_GAME_STATE, "Game has already finished");
        }

        List<PlayerSeat> seats = game.getSeats();
        seats.sort(Comparator.comparingInt(PlayerSeat::getTurnOrder));

        if (game.getStatus() == GameStatus.WAITING) {
            seats.remove(seat);
            compactTurnOrders(seats);
            log.info("Player {} left game {}", seat.getPlayerName(), game.getId());
            if (seats.isEmpty()) {
                game.setStatus(GameStatus.FINISHED);
                game.setEndedAt(LocalDateTime.now());
                log.info("Game {} closed: no players left", game.getId());
            } else {
                passCreatorRole(game, seat);
            }
            return gameRepository.save(game);
        }

        int oldTotal = seats.size();
        int leaverOrder = seat.getTurnOrder();
        int stillActing = seat.isCurrentTurn()
                ? turnManagementService.nextIndex(leaverOrder, game.getDirection(), oldTotal)
                : game.getCurrentPlayerIndex();

        game.getDeck().addAll(0, seat.getHand());
        seat.getHand().clear();
        seats.remove(seat);
        compactTurnOrders(seats);
        passCreatorRole(game, seat);

        log.info("Player {} left game {} in progress", seat.getPlayerName(), game.getId());

        if (winConditionService.checkLastPlayerStanding(game)) {
            return game;
        }

        int newIndex = stillActing > leaverOrder ? stillActing - 1 : stillActing;
        turnManagementService.advanceTurn(game, newIndex);
        return gameRepository.save(game);
    }

    /**
     * End a game in progress without a winner. Only the creator may do this.
     */
    public Game endGame(String gameId, String playerId) {
        Game game = gameQueryService.getGame(gameId);

        requireCreator(game, playerId);
        gameQueryService.requireStarted(game);

        winConditionService.endWithoutWinner(game);
        return game;
    }

    PlayerSeat addSeat(Game game, String playerId, String playerName) {
        PlayerSeat seat = PlayerSeat.builder()
                .playerId(playerId)
                .playerName(playerName)
                .game(game)
                .turnOrder(game.getSeats().size())
                .joinedAt(LocalDateTime.now())
                .build();

        seat = playerSeatRepository.save(seat);
        game.getSeats().add(seat);

        log.info("Player {} joined game {}", playerName, game.getId());
        return seat;
    }

    private void requireCreator(Game game, String playerId) {
        if (!playerId.equals(game.getCreatorId()) || game.findSeat(playerId).isEmpty()) {
            throw new UnoGameException(GameErrorCode.NOT_GAME_CREATOR);
        }
    }

    /**
     * A departing creator hands the role to the first remaining seat in turn order.
     */
    private void passCreatorRole(Game game, PlayerSeat leaver) {
        if (!leaver.getPlayerId().equals(game.getCreatorId()) || game.getSeats().isEmpty()) {
            return;
        }
        PlayerSeat successor = game.getSeats().get(0);
        game.setCreatorId(successor.getPlayerId());
        log.info("Game {}: {} is now the creator", game.getId(), successor.getPlayerName());
    }

    private void compactTurnOrders(List<PlayerSeat> seats) {
        for (int i = 0; i < seats.size(); i++) {
            seats.get(i).setTurnOrder(i);
        }
    }
}
