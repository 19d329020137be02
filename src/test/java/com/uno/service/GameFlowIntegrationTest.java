package com.uno.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.transaction.annotation.Transactional;

import com.uno.dto.CreateGameRequest;
import com.uno.dto.GameStateDTO;
import com.uno.dto.JoinGameRequest;
import com.uno.dto.TurnResult;
import com.uno.exception.GameErrorCode;
import com.uno.exception.UnoGameException;
import com.uno.model.Card;
import com.uno.model.Game;
import com.uno.model.GameStatus;

/**
 * Full game flow through the service layer against the in-memory database.
 */
@SpringBootTest
@Transactional
class GameFlowIntegrationTest {

    @Autowired
    private GameService gameService;

    private String gameId;

    @BeforeEach
    void setUp() {
        Game game = gameService.createGame(CreateGameRequest.builder()
                .gameName("Friday").playerId("alice").playerName("Alice").maxPlayers(3).build());
        gameId = game.getId();
        gameService.joinGame(gameId, JoinGameRequest.builder().playerId("bob").playerName("Bob").build());
        gameService.joinGame(gameId, JoinGameRequest.builder().playerId("carol").playerName("Carol").build());
    }

    @Test
    @DisplayName("dealing starts the game with 108 cards accounted for")
    void dealStartsGame() {
        Game game = gameService.dealInitialHands(gameId, "alice");

        assertEquals(GameStatus.STARTED, game.getStatus());
        assertEquals(108, game.totalCardCount());
        game.getSeats().forEach(seat -> assertEquals(7, seat.handSize()));
        assertNotNull(game.getTopCard());
        assertNotNull(gameService.getCurrentPlayer(gameId));
    }

    @Test
    @DisplayName("full table rejects another player")
    void fullTable() {
        UnoGameException ex = assertThrows(UnoGameException.class, () -> gameService.joinGame(gameId,
                JoinGameRequest.builder().playerId("dave").playerName("Dave").build()));

        assertEquals(GameErrorCode.GAME_FULL, ex.getCode());
    }

    @Test
    @DisplayName("turns keep every card in the game")
    void turnsConserveCards() {
        gameService.dealInitialHands(gameId, "alice");

        for (int i = 0; i < 30; i++) {
            GameStateDTO state = gameService.getGameState(gameId);
            if (state.getStatus() != GameStatus.STARTED) {
                break;
            }
            String current = state.getCurrentPlayer().getPlayerId();
            List<Card> legal = gameService.getLegalCards(gameId, current);

            TurnResult result = legal.isEmpty()
                    ? gameService.drawCard(gameId, current)
                    : gameService.playCard(gameId, current, legal.get(0), legal.get(0).isWild() ? "Green" : null);

            assertNotNull(result.getMessage());
            assertEquals(108, gameService.getGame(gameId).totalCardCount());
        }
    }

    @Test
    @DisplayName("acting out of turn is rejected")
    void outOfTurn() {
        gameService.dealInitialHands(gameId, "alice");
        String current = gameService.getCurrentPlayer(gameId).getPlayerId();
        String other = "alice".equals(current) ? "bob" : "alice";

        UnoGameException ex = assertThrows(UnoGameException.class, () -> gameService.drawCard(gameId, other));

        assertEquals(GameErrorCode.NOT_YOUR_TURN, ex.getCode());
    }

    @Test
    @DisplayName("players leaving until one remains finishes the game")
    void lastPlayerStanding() {
        gameService.dealInitialHands(gameId, "alice");

        gameService.leaveGame(gameId, "bob");
        assertEquals(108, gameService.getGame(gameId).totalCardCount());
        gameService.leaveGame(gameId, "carol");

        GameStateDTO state = gameService.getGameState(gameId);
        assertEquals(GameStatus.FINISHED, state.getStatus());
        assertEquals("Alice", state.getWinnerName());
    }

    @Test
    @DisplayName("creator can end the game early without a winner")
    void endEarly() {
        gameService.dealInitialHands(gameId, "alice");

        gameService.endGame(gameId, "alice");

        GameStateDTO state = gameService.getGameState(gameId);
        assertEquals(GameStatus.FINISHED, state.getStatus());
        assertNull(state.getWinnerId());
        assertTrue(gameService.getScores(gameId).values().stream().allMatch(score -> score == 0));
    }
}
