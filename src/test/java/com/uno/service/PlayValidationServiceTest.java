package com.uno.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Random;
import java.util.Set;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import com.uno.model.Card;
import com.uno.model.CardColor;

/**
 * Unit tests for card legality.
 */
class PlayValidationServiceTest {

    private final PlayValidationService validation = new PlayValidationService();

    @Nested
    @DisplayName("isLegal()")
    class IsLegalTests {

        @Test
        @DisplayName("color match is legal")
        void colorMatch() {
            assertTrue(validation.isLegal(Card.parse("Red 3"), Card.parse("Red 9"), CardColor.RED));
        }

        @Test
        @DisplayName("rank match is legal across colors")
        void rankMatch() {
            assertTrue(validation.isLegal(Card.parse("Blue 9"), Card.parse("Red 9"), CardColor.RED));
            assertTrue(validation.isLegal(Card.parse("Blue Skip"), Card.parse("Red Skip"), CardColor.RED));
        }

        @Test
        @DisplayName("wild cards are always legal")
        void wildAlwaysLegal() {
            assertTrue(validation.isLegal(Card.wild(), Card.parse("Red 9"), CardColor.RED));
            assertTrue(validation.isLegal(Card.wildDrawFour(), Card.parse("Green Skip"), CardColor.GREEN));
        }

        @Test
        @DisplayName("current color wins over the color printed on the top card")
        void chosenColorOnWild() {
            assertTrue(validation.isLegal(Card.parse("Yellow 2"), Card.wild(), CardColor.YELLOW));
            assertFalse(validation.isLegal(Card.parse("Red 2"), Card.wild(), CardColor.YELLOW));
        }

        @Test
        @DisplayName("neither color nor rank matches")
        void noMatch() {
            assertFalse(validation.isLegal(Card.parse("Blue 3"), Card.parse("Red 9"), CardColor.RED));
            assertFalse(validation.isLegal(Card.parse("Blue Reverse"), Card.parse("Red Skip"), CardColor.RED));
        }

        @Test
        @DisplayName("agrees with the legality rule for every pair of cards and every color")
        void soundOverAllPairs() {
            Set<Card> distinct = new LinkedHashSet<>(new DeckService(new Random(1)).buildStandardDeck());
            for (Card card : distinct) {
                for (Card top : distinct) {
                    for (CardColor color : CardColor.playable()) {
                        boolean expected = card.isWild() || card.color() == color || card.rank() == top.rank();
                        assertEquals(expected, validation.isLegal(card, top, color), card + " on " + top + " / " + color);
                    }
                }
            }
        }
    }

    @Nested
    @DisplayName("legalCards()")
    class LegalCardsTests {

        @Test
        @DisplayName("yields playable cards in hand order")
        void yieldsInHandOrder() {
            List<Card> hand = new ArrayList<>(List.of(
                    Card.parse("Blue 1"), Card.parse("Red 4"), Card.wild(), Card.parse("Green 9"), Card.parse("Red 9")));

            List<Card> legal = new ArrayList<>();
            validation.legalCards(hand, Card.parse("Red 9"), CardColor.RED).forEach(legal::add);

            assertEquals(List.of(Card.parse("Red 4"), Card.wild(), Card.parse("Green 9"), Card.parse("Red 9")), legal);
        }

        @Test
        @DisplayName("is restartable and sees the hand as it is at iteration time")
        void restartsFromCurrentHand() {
            List<Card> hand = new ArrayList<>(List.of(Card.parse("Red 1")));
            Iterable<Card> legal = validation.legalCards(hand, Card.parse("Red 9"), CardColor.RED);

            List<Card> first = new ArrayList<>();
            legal.forEach(first::add);
            hand.add(Card.parse("Red 2"));
            List<Card> second = new ArrayList<>();
            legal.forEach(second::add);

            assertEquals(List.of(Card.parse("Red 1")), first);
            assertEquals(List.of(Card.parse("Red 1"), Card.parse("Red 2")), second);
        }

        @Test
        @DisplayName("empty when nothing matches")
        void emptyWhenNothingMatches() {
            List<Card> hand = new ArrayList<>(List.of(Card.parse("Blue 1")));

            assertFalse(validation.legalCards(hand, Card.parse("Red 9"), CardColor.RED).iterator().hasNext());
        }
    }
}
