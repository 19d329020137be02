package com.uno.model;

/**
 * Card ranks with their display label, scoring value and turn effect.
 */
public enum CardRank {
    ZERO("0", 0, CardEffect.NONE),
    ONE("1", 1, CardEffect.NONE),
    TWO("2", 2, CardEffect.NONE),
    THREE("3", 3, CardEffect.NONE),
    FOUR("4", 4, CardEffect.NONE),
    FIVE("5", 5, CardEffect.NONE),
    SIX("6", 6, CardEffect.NONE),
    SEVEN("7", 7, CardEffect.NONE),
    EIGHT("8", 8, CardEffect.NONE),
    NINE("9", 9, CardEffect.NONE),
    SKIP("Skip", 20, CardEffect.SKIP),
    REVERSE("Reverse", 20, CardEffect.REVERSE),
    DRAW_TWO("Draw Two", 20, CardEffect.DRAW_TWO),
    WILD("Wild", 50, CardEffect.NONE),
    WILD_DRAW_FOUR("Wild Draw Four", 50, CardEffect.DRAW_FOUR);

    private final String label;
    private final int points;
    private final CardEffect effect;

    CardRank(String label, int points, CardEffect effect) {
        this.label = label;
        this.points = points;
        this.effect = effect;
    }

    public String getLabel() {
        return label;
    }

    public int getPoints() {
        return points;
    }

    public CardEffect getEffect() {
        return effect;
    }

    public boolean isNumber() {
        return ordinal() <= NINE.ordinal();
    }

    public boolean isWild() {
        return this == WILD || this == WILD_DRAW_FOUR;
    }

    /**
     * Ranks that exist once per color.
     */
    public static CardRank[] numbers() {
        return new CardRank[]{ZERO, ONE, TWO, THREE, FOUR, FIVE, SIX, SEVEN, EIGHT, NINE};
    }

    /**
     * Colored action ranks, two of each per color.
     */
    public static CardRank[] actions() {
        return new CardRank[]{SKIP, REVERSE, DRAW_TWO};
    }

    static CardRank fromLabel(String label) {
        for (CardRank rank : values()) {
            if (rank.label.equalsIgnoreCase(label)) {
                return rank;
            }
        }
        throw new IllegalArgumentException("Unknown rank: " + label);
    }
}
