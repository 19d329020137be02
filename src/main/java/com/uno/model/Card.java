package com.uno.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Objects;

/**
 * An UNO card. Cards carry no identity: two "Red 5" cards are equal.
 * <p>
 * The text form is {@code "<Color> <Rank>"} for colored cards ({@code "Blue Draw Two"})
 * and just the rank label for wild cards ({@code "Wild Draw Four"}).
 */
public record Card(CardColor color, CardRank rank) {

    public Card {
        Objects.requireNonNull(color, "color");
        Objects.requireNonNull(rank, "rank");
        if (rank.isWild() != (color == CardColor.NONE)) {
            throw new IllegalArgumentException("Wild cards, and only wild cards, have no color: "
                    + color + " " + rank);
        }
    }

    public static Card of(CardColor color, CardRank rank) {
        return new Card(color, rank);
    }

    public static Card wild() {
        return new Card(CardColor.NONE, CardRank.WILD);
    }

    public static Card wildDrawFour() {
        return new Card(CardColor.NONE, CardRank.WILD_DRAW_FOUR);
    }

    /**
     * Parse the text form of a card, e.g. {@code "Red 7"} or {@code "Wild"}.
     *
     * @throws IllegalArgumentException for malformed text
     */
    @JsonCreator
    public static Card parse(String text) {
        if (text == null || text.isBlank()) {
            throw new IllegalArgumentException("Card text is required");
        }
        String trimmed = text.trim().replaceAll("\\s+", " ");
        if (trimmed.regionMatches(true, 0, "Wild", 0, 4)) {
            return new Card(CardColor.NONE, CardRank.fromLabel(trimmed));
        }
        int space = trimmed.indexOf(' ');
        if (space < 0) {
            throw new IllegalArgumentException("Invalid card: " + text);
        }
        CardColor color = CardColor.fromLabel(trimmed.substring(0, space));
        CardRank rank = CardRank.fromLabel(trimmed.substring(space + 1));
        if (rank.isWild()) {
            throw new IllegalArgumentException("Invalid card: " + text);
        }
        return new Card(color, rank);
    }

    public boolean isWild() {
        return rank.isWild();
    }

    public boolean isNumber() {
        return rank.isNumber();
    }

    public CardEffect effect() {
        return rank.getEffect();
    }

    public int points() {
        return rank.getPoints();
    }

    @JsonValue
    public String label() {
        return isWild() ? rank.getLabel() : color.getLabel() + " " + rank.getLabel();
    }

    @Override
    public String toString() {
        return label();
    }
}
