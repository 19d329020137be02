package com.uno.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.uno.model.Card;
import com.uno.model.Game;
import com.uno.model.GameStatus;
import com.uno.model.PlayerSeat;

/**
 * Unit tests for turn arithmetic and card effects.
 */
class TurnManagementServiceTest {

    private TurnManagementService turnService;

    @BeforeEach
    void setUp() {
        turnService = new TurnManagementService(new DeckService(new Random(11)));
    }

    private Game gameWithSeats(int seats, int current) {
        List<PlayerSeat> list = new ArrayList<>();
        for (int i = 0; i < seats; i++) {
            list.add(PlayerSeat.builder()
                    .playerId("p" + i).playerName("P" + i).turnOrder(i)
                    .hand(new ArrayList<>(List.of(Card.parse("Red 1"), Card.parse("Blue 2"))))
                    .currentTurn(i == current)
                    .build());
        }
        List<Card> deck = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            deck.add(Card.parse("Green " + (i % 10)));
        }
        return Game.builder()
                .id("g1").name("Turns").status(GameStatus.STARTED).maxPlayers(10)
                .currentPlayerIndex(current)
                .deck(deck)
                .discardPile(new ArrayList<>(List.of(Card.parse("Red 5"))))
                .seats(list)
                .build();
    }

    private long currentSeats(Game game) {
        return game.getSeats().stream().filter(PlayerSeat::isCurrentTurn).count();
    }

    @Nested
    @DisplayName("nextIndex()")
    class NextIndexTests {

        @Test
        @DisplayName("matches modular arithmetic for every position, direction, table size and step")
        void matchesModularArithmetic() {
            for (int total = 2; total <= 10; total++) {
                for (int current = 0; current < total; current++) {
                    for (int direction : new int[]{Game.CLOCKWISE, Game.COUNTER_CLOCKWISE}) {
                        for (int step = 1; step <= 2; step++) {
                            int expected = Math.floorMod(current + direction * step, total);
                            int actual = turnService.nextIndex(current, direction, total, step);
                            assertEquals(expected, actual,
                                    "current=" + current + " dir=" + direction + " total=" + total + " step=" + step);
                            assertTrue(actual >= 0 && actual < total);
                        }
                    }
                }
            }
        }

        @Test
        @DisplayName("wraps around at both ends")
        void wrapsAround() {
            assertEquals(0, turnService.nextIndex(3, Game.CLOCKWISE, 4));
            assertEquals(3, turnService.nextIndex(0, Game.COUNTER_CLOCKWISE, 4));
            assertEquals(1, turnService.nextIndex(3, Game.CLOCKWISE, 4, 2));
            assertEquals(2, turnService.nextIndex(0, Game.COUNTER_CLOCKWISE, 4, 2));
        }
    }

    @Nested
    @DisplayName("resolveEffect()")
    class ResolveEffectTests {

        @Test
        @DisplayName("number card passes to the next seat")
        void numberCardAdvancesOne() {
            Game game = gameWithSeats(4, 1);

            TurnManagementService.TurnOutcome outcome = turnService.resolveEffect(game, Card.parse("Red 7"));

            assertEquals(2, outcome.nextSeat().getTurnOrder());
            assertNull(outcome.skippedSeat());
            assertEquals(2, game.getCurrentPlayerIndex());
            assertEquals(1, currentSeats(game));
        }

        @Test
        @DisplayName("plain wild passes to the next seat counter-clockwise")
        void wildAdvancesInDirection() {
            Game game = gameWithSeats(4, 0);
            game.setDirection(Game.COUNTER_CLOCKWISE);

            TurnManagementService.TurnOutcome outcome = turnService.resolveEffect(game, Card.wild());

            assertEquals(3, outcome.nextSeat().getTurnOrder());
        }

        @Test
        @DisplayName("two players: Reverse flips direction and the same player goes again")
        void reverseWithTwoPlayers() {
            Game game = gameWithSeats(2, 0);

            TurnManagementService.TurnOutcome outcome = turnService.resolveEffect(game, Card.parse("Red Reverse"));

            assertEquals(Game.COUNTER_CLOCKWISE, game.getDirection());
            assertEquals(Game.COUNTER_CLOCKWISE, outcome.direction());
            assertEquals(0, game.getCurrentPlayerIndex());
            assertTrue(game.seatAt(0).isCurrentTurn());
            assertFalse(game.seatAt(1).isCurrentTurn());
        }

        @Test
        @DisplayName("more than two players: Reverse flips direction and the previous seat plays")
        void reverseWithFourPlayers() {
            Game game = gameWithSeats(4, 0);

            TurnManagementService.TurnOutcome outcome = turnService.resolveEffect(game, Card.parse("Red Reverse"));

            assertEquals(Game.COUNTER_CLOCKWISE, game.getDirection());
            assertEquals(3, outcome.nextSeat().getTurnOrder());
            assertNull(outcome.skippedSeat());
        }

        @Test
        @DisplayName("Skip: four players, seat 1 is skipped and seat 2 plays")
        void skipWithFourPlayers() {
            Game game = gameWithSeats(4, 0);

            TurnManagementService.TurnOutcome outcome = turnService.resolveEffect(game, Card.parse("Blue Skip"));

            assertSame(game.seatAt(1), outcome.skippedSeat());
            assertEquals(2, outcome.nextSeat().getTurnOrder());
            assertEquals(2, game.getCurrentPlayerIndex());
            assertEquals(1, currentSeats(game));
        }

        @Test
        @DisplayName("Skip wraps around counter-clockwise")
        void skipWrapsCounterClockwise() {
            Game game = gameWithSeats(3, 0);
            game.setDirection(Game.COUNTER_CLOCKWISE);

            TurnManagementService.TurnOutcome outcome = turnService.resolveEffect(game, Card.parse("Blue Skip"));

            assertEquals(2, outcome.skippedSeat().getTurnOrder());
            assertEquals(1, outcome.nextSeat().getTurnOrder());
        }

        @Test
        @DisplayName("Draw Two: next seat draws two and is skipped")
        void drawTwo() {
            Game game = gameWithSeats(3, 2);
            int deckBefore = game.getDeck().size();

            TurnManagementService.TurnOutcome outcome = turnService.resolveEffect(game, Card.parse("Red Draw Two"));

            assertEquals(0, outcome.skippedSeat().getTurnOrder());
            assertEquals(4, outcome.skippedSeat().handSize());
            assertEquals(2, outcome.penaltyCards());
            assertEquals(1, outcome.nextSeat().getTurnOrder());
            assertEquals(deckBefore - 2, game.getDeck().size());
        }

        @Test
        @DisplayName("Wild Draw Four: next seat draws four and is skipped; with two players the player goes again")
        void wildDrawFourTwoPlayers() {
            Game game = gameWithSeats(2, 0);

            TurnManagementService.TurnOutcome outcome = turnService.resolveEffect(game, Card.wildDrawFour());

            assertEquals(1, outcome.skippedSeat().getTurnOrder());
            assertEquals(6, outcome.skippedSeat().handSize());
            assertEquals(4, outcome.penaltyCards());
            assertEquals(0, outcome.nextSeat().getTurnOrder());
            assertEquals(1, currentSeats(game));
        }
    }

    @Test
    @DisplayName("penaltyFor is 2 for Draw Two, 4 for Wild Draw Four, else 0")
    void penaltyFor() {
        assertEquals(2, turnService.penaltyFor(Card.parse("Yellow Draw Two")));
        assertEquals(4, turnService.penaltyFor(Card.wildDrawFour()));
        assertEquals(0, turnService.penaltyFor(Card.wild()));
        assertEquals(0, turnService.penaltyFor(Card.parse("Yellow Skip")));
        assertEquals(0, turnService.penaltyFor(Card.parse("Yellow 3")));
    }
}
