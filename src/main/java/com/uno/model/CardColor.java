package com.uno.model;

import java.util.Locale;

/**
 * Card colors. {@link #NONE} is only carried by wild cards.
 */
public enum CardColor {
    RED("Red"),
    BLUE("Blue"),
    GREEN("Green"),
    YELLOW("Yellow"),
    NONE("None");

    private static final CardColor[] PLAYABLE = {RED, BLUE, GREEN, YELLOW};

    private final String label;

    CardColor(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    public boolean isPlayable() {
        return this != NONE;
    }

    /**
     * The four colors a card can be played as, in deck-building order.
     */
    public static CardColor[] playable() {
        return PLAYABLE.clone();
    }

    /**
     * Parse a color label such as {@code "Red"}; case-insensitive.
     *
     * @throws IllegalArgumentException if the label is not a playable color
     */
    public static CardColor fromLabel(String label) {
        if (label != null) {
            String normalized = label.trim().toUpperCase(Locale.ROOT);
            for (CardColor color : PLAYABLE) {
                if (color.name().equals(normalized)) {
                    return color;
                }
            }
        }
        throw new IllegalArgumentException("Unknown color: " + label);
    }
}
