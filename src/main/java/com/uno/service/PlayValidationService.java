package com.uno.service;

import com.uno.model.Card;
import com.uno.model.CardColor;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Card legality against the discard pile.
 */
@Service
public class PlayValidationService {

    /**
     * A card is playable if it is wild, matches the current color, or matches the top card's rank.
     * The current color is used rather than the top card's own color, so a wild on top is
     * matched by the color chosen for it.
     */
    public boolean isLegal(Card card, Card topCard, CardColor currentColor) {
        if (card.isWild()) {
            return true;
        }
        if (card.color() == currentColor) {
            return true;
        }
        return topCard != null && card.rank() == topCard.rank();
    }

    /**
     * The playable cards of a hand, in hand order. Evaluated lazily; each iteration
     * starts over from the hand's current contents.
     */
    public Iterable<Card> legalCards(List<Card> hand, Card topCard, CardColor currentColor) {
        return () -> hand.stream()
                .filter(card -> isLegal(card, topCard, currentColor))
                .iterator();
    }
}
