package com.uno.controller;

import com.uno.dto.ChallengeRequest;
import com.uno.dto.ChallengeResult;
import com.uno.dto.CreateGameRequest;
import com.uno.dto.GameStateDTO;
import com.uno.dto.GameSummaryDTO;
import com.uno.dto.JoinGameRequest;
import com.uno.dto.SeatDTO;
import com.uno.dto.TurnRequest;
import com.uno.dto.TurnResult;
import com.uno.model.Card;
import com.uno.model.Game;
import com.uno.model.GameStatus;
import com.uno.model.PlayerSeat;
import com.uno.service.GameLockRegistry;
import com.uno.service.GameService;
import com.uno.websocket.GameWebSocketHandler;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Map;

/**
 * REST API controller for game management and play.
 * <p>
 * Every mutating call runs under the game's lock; players identify themselves with {@code playerId}.
 */
@RestController
@RequestMapping("/api/games")
@RequiredArgsConstructor
@Slf4j
@CrossOrigin(origins = "*")
public class GameController {

    private final GameService gameService;
    private final GameLockRegistry lockRegistry;
    private final GameWebSocketHandler webSocketHandler;

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");

    /**
     * Create a new game.
     */
    @PostMapping
    public ResponseEntity<GameStateDTO> createGame(@Valid @RequestBody CreateGameRequest request) {
        Game game = gameService.createGame(request);
        return ResponseEntity.ok(gameService.getGameState(game.getId()));
    }

    /**
     * Get all games, or only those still accepting players.
     */
    @GetMapping
    public ResponseEntity<List<GameSummaryDTO>> getGames(
            @RequestParam(required = false, defaultValue = "false") boolean joinableOnly) {

        List<Game> games = joinableOnly ?
                gameService.getJoinableGames() :
                gameService.getAllGames();

        return ResponseEntity.ok(games.stream()
                .map(this::toGameSummary)
                .toList());
    }

    @GetMapping("/{gameId}")
    public ResponseEntity<GameStateDTO> getGame(@PathVariable String gameId) {
        return ResponseEntity.ok(gameService.getGameState(gameId));
    }

    /**
     * Join a game.
     */
    @PostMapping("/{gameId}/join")
    public ResponseEntity<SeatDTO> joinGame(@PathVariable String gameId,
                                            @Valid @RequestBody JoinGameRequest request) {
        log.info("Player {} joining game {}", request.getPlayerName(), gameId);
        PlayerSeat seat = lockRegistry.execute(gameId, () -> gameService.joinGame(gameId, request));

        SeatDTO seatDTO = SeatDTO.fromSeat(seat);
        webSocketHandler.broadcastGameUpdate(gameId);
        return ResponseEntity.ok(seatDTO);
    }

    /**
     * Deal the opening hands and start the game. Creator only.
     */
    @PostMapping("/{gameId}/deal")
    public ResponseEntity<GameStateDTO> dealInitialHands(@PathVariable String gameId,
                                                         @RequestParam String playerId,
                                                         @RequestParam(required = false) Integer cardsPerPlayer) {
        log.info("Player {} dealing game {}", playerId, gameId);
        lockRegistry.execute(gameId, () -> cardsPerPlayer != null
                ? gameService.dealInitialHands(gameId, playerId, cardsPerPlayer)
                : gameService.dealInitialHands(gameId, playerId));

        webSocketHandler.broadcastGameUpdate(gameId);
        return ResponseEntity.ok(gameService.getGameState(gameId));
    }

    /**
     * Play a card. {@code chosenColor} is required for wild cards.
     */
    @PostMapping("/{gameId}/play")
    public ResponseEntity<TurnResult> playCard(@PathVariable String gameId,
                                               @RequestParam String playerId,
                                               @RequestParam String card,
                                               @RequestParam(required = false) String chosenColor) {
        Card parsed = Card.parse(card);
        TurnResult result = lockRegistry.execute(gameId,
                () -> gameService.playCard(gameId, playerId, parsed, chosenColor));
        webSocketHandler.broadcastTurn(gameId, result);
        return ResponseEntity.ok(result);
    }

    /**
     * Draw a card; the turn passes on.
     */
    @PostMapping("/{gameId}/draw")
    public ResponseEntity<TurnResult> drawCard(@PathVariable String gameId,
                                               @RequestParam String playerId) {
        TurnResult result = lockRegistry.execute(gameId, () -> gameService.drawCard(gameId, playerId));
        webSocketHandler.broadcastTurn(gameId, result);
        return ResponseEntity.ok(result);
    }

    /**
     * Play or draw in one request.
     */
    @PostMapping("/{gameId}/turn")
    public ResponseEntity<TurnResult> executeTurn(@PathVariable String gameId,
                                                  @Valid @RequestBody TurnRequest request) {
        Card card = request.getCard() != null ? Card.parse(request.getCard()) : null;
        TurnResult result = lockRegistry.execute(gameId, () -> gameService.executeTurn(
                gameId, request.getPlayerId(), request.getAction(), card, request.getChosenColor()));
        webSocketHandler.broadcastTurn(gameId, result);
        return ResponseEntity.ok(result);
    }

    @GetMapping("/{gameId}/legal-cards")
    public ResponseEntity<List<Card>> getLegalCards(@PathVariable String gameId,
                                                    @RequestParam String playerId) {
        return ResponseEntity.ok(gameService.getLegalCards(gameId, playerId));
    }

    @GetMapping("/{gameId}/hand")
    public ResponseEntity<List<Card>> getHand(@PathVariable String gameId,
                                              @RequestParam String playerId) {
        return ResponseEntity.ok(gameService.getHand(gameId, playerId));
    }

    /**
     * Declare UNO.
     */
    @PostMapping("/{gameId}/uno")
    public ResponseEntity<SeatDTO> sayUno(@PathVariable String gameId,
                                          @RequestParam String playerId) {
        PlayerSeat seat = lockRegistry.execute(gameId, () -> gameService.sayUno(gameId, playerId));
        SeatDTO seatDTO = SeatDTO.fromSeat(seat);
        webSocketHandler.broadcastUnoSaid(gameId, seatDTO);
        webSocketHandler.broadcastGameUpdate(gameId);
        return ResponseEntity.ok(seatDTO);
    }

    /**
     * Challenge a player with one card who has not declared UNO.
     */
    @PostMapping("/{gameId}/challenge")
    public ResponseEntity<ChallengeResult> challengeUno(@PathVariable String gameId,
                                                        @Valid @RequestBody ChallengeRequest request) {
        ChallengeResult result = lockRegistry.execute(gameId, () -> gameService.challengeUno(
                gameId, request.getChallengerId(), request.getChallengedId()));
        webSocketHandler.broadcastChallenge(gameId, result);
        webSocketHandler.broadcastGameUpdate(gameId);
        return ResponseEntity.ok(result);
    }

    /**
     * Leave a game. During play this may end it.
     */
    @PostMapping("/{gameId}/leave")
    public ResponseEntity<GameStateDTO> leaveGame(@PathVariable String gameId,
                                                  @RequestParam String playerId) {
        log.info("Player {} leaving game {}", playerId, gameId);
        lockRegistry.execute(gameId, () -> gameService.leaveGame(gameId, playerId));
        GameStateDTO state = gameService.getGameState(gameId);

        webSocketHandler.broadcastPlayerLeft(gameId, playerId);
        webSocketHandler.broadcastGameUpdate(gameId);
        if (state.getStatus() == GameStatus.FINISHED) {
            webSocketHandler.broadcastGameOver(gameId, state.getWinnerName());
        }
        return ResponseEntity.ok(state);
    }

    /**
     * End the game early. Creator only.
     */
    @PostMapping("/{gameId}/end")
    public ResponseEntity<GameStateDTO> endGame(@PathVariable String gameId,
                                                @RequestParam String playerId) {
        log.info("Player {} ending game {}", playerId, gameId);
        lockRegistry.execute(gameId, () -> gameService.endGame(gameId, playerId));

        webSocketHandler.broadcastGameUpdate(gameId);
        webSocketHandler.broadcastGameOver(gameId, null);
        return ResponseEntity.ok(gameService.getGameState(gameId));
    }

    @GetMapping("/{gameId}/players")
    public ResponseEntity<List<SeatDTO>> getPlayers(@PathVariable String gameId) {
        return ResponseEntity.ok(gameService.getGameState(gameId).getPlayers());
    }

    @GetMapping("/{gameId}/current-player")
    public ResponseEntity<SeatDTO> getCurrentPlayer(@PathVariable String gameId) {
        return ResponseEntity.ok(gameService.getCurrentPlayer(gameId));
    }

    @GetMapping("/{gameId}/top-card")
    public ResponseEntity<Card> getTopCard(@PathVariable String gameId) {
        return ResponseEntity.ok(gameService.getTopCard(gameId));
    }

    @GetMapping("/{gameId}/scores")
    public ResponseEntity<Map<String, Integer>> getScores(@PathVariable String gameId) {
        return ResponseEntity.ok(gameService.getScores(gameId));
    }

    private GameSummaryDTO toGameSummary(Game game) {
        String hostName = game.findSeat(game.getCreatorId())
                .map(PlayerSeat::getPlayerName)
                .orElse("Unknown");

        return GameSummaryDTO.builder()
                .id(game.getId())
                .name(game.getName())
                .status(game.getStatus().name())
                .playerCount(game.getSeats().size())
                .maxPlayers(game.getMaxPlayers())
                .createdAt(game.getCreatedAt() != null ? game.getCreatedAt().format(DATE_FORMAT) : null)
                .canJoin(game.getStatus() == GameStatus.WAITING && !game.isFull())
                .hostName(hostName)
                .build();
    }
}
