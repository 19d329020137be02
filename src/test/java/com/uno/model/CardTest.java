package com.uno.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for Card text form and classification.
 */
class CardTest {

    @Nested
    @DisplayName("parse()")
    class ParseTests {

        @Test
        @DisplayName("should parse colored number and action cards")
        void shouldParseColoredCards() {
            assertEquals(Card.of(CardColor.RED, CardRank.SEVEN), Card.parse("Red 7"));
            assertEquals(Card.of(CardColor.BLUE, CardRank.SKIP), Card.parse("Blue Skip"));
            assertEquals(Card.of(CardColor.GREEN, CardRank.DRAW_TWO), Card.parse("Green Draw Two"));
            assertEquals(Card.of(CardColor.YELLOW, CardRank.REVERSE), Card.parse("Yellow Reverse"));
        }

        @Test
        @DisplayName("should parse wild cards without a color")
        void shouldParseWildCards() {
            assertEquals(Card.wild(), Card.parse("Wild"));
            assertEquals(Card.wildDrawFour(), Card.parse("Wild Draw Four"));
        }

        @Test
        @DisplayName("should ignore case and extra whitespace")
        void shouldBeLenientOnFormatting() {
            assertEquals(Card.of(CardColor.RED, CardRank.DRAW_TWO), Card.parse("  red   draw two "));
            assertEquals(Card.wildDrawFour(), Card.parse("wild draw four"));
        }

        @Test
        @DisplayName("should reject malformed text")
        void shouldRejectMalformedText() {
            assertThrows(IllegalArgumentException.class, () -> Card.parse(null));
            assertThrows(IllegalArgumentException.class, () -> Card.parse(" "));
            assertThrows(IllegalArgumentException.class, () -> Card.parse("Red"));
            assertThrows(IllegalArgumentException.class, () -> Card.parse("Purple 7"));
            assertThrows(IllegalArgumentException.class, () -> Card.parse("Red 10"));
            assertThrows(IllegalArgumentException.class, () -> Card.parse("Red Wild"));
            assertThrows(IllegalArgumentException.class, () -> Card.parse("Wild Red"));
        }
    }

    @Nested
    @DisplayName("construction")
    class ConstructionTests {

        @Test
        @DisplayName("wild ranks must have no color")
        void wildRanksMustBeColorless() {
            assertThrows(IllegalArgumentException.class, () -> Card.of(CardColor.RED, CardRank.WILD));
        }

        @Test
        @DisplayName("colored ranks must have a color")
        void coloredRanksMustHaveColor() {
            assertThrows(IllegalArgumentException.class, () -> Card.of(CardColor.NONE, CardRank.FIVE));
        }

        @Test
        @DisplayName("label should round-trip through parse for every rank")
        void labelShouldMatchParse() {
            for (CardRank rank : CardRank.values()) {
                Card card = rank.isWild() ? new Card(CardColor.NONE, rank) : Card.of(CardColor.BLUE, rank);
                assertEquals(card, Card.parse(card.label()), card.label());
            }
        }
    }

    @Test
    @DisplayName("should expose effect and points from the rank")
    void shouldExposeEffectAndPoints() {
        assertEquals(CardEffect.NONE, Card.parse("Red 9").effect());
        assertEquals(9, Card.parse("Red 9").points());
        assertEquals(CardEffect.DRAW_TWO, Card.parse("Red Draw Two").effect());
        assertEquals(20, Card.parse("Red Draw Two").points());
        assertEquals(CardEffect.NONE, Card.wild().effect());
        assertEquals(CardEffect.DRAW_FOUR, Card.wildDrawFour().effect());
        assertEquals(50, Card.wildDrawFour().points());
    }

    @Test
    @DisplayName("isNumber() is true only for 0-9")
    void shouldClassifyNumbers() {
        assertTrue(Card.parse("Green 0").isNumber());
        assertFalse(Card.parse("Green Skip").isNumber());
        assertFalse(Card.wild().isNumber());
    }

    @Test
    @DisplayName("CardColor.fromLabel accepts only the four playable colors")
    void colorFromLabel() {
        assertEquals(CardColor.GREEN, CardColor.fromLabel("green"));
        assertEquals(CardColor.YELLOW, CardColor.fromLabel(" Yellow "));
        assertThrows(IllegalArgumentException.class, () -> CardColor.fromLabel("None"));
        assertThrows(IllegalArgumentException.class, () -> CardColor.fromLabel("Purple"));
        assertThrows(IllegalArgumentException.class, () -> CardColor.fromLabel(null));
    }
}
