package com.uno.service;

import com.uno.exception.GameErrorCode;
import com.uno.exception.UnoGameException;
import com.uno.model.Card;
import com.uno.model.CardColor;
import com.uno.model.CardRank;
import com.uno.model.Game;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;

/**
 * Builds, shuffles and draws from the UNO deck.
 * <p>
 * The deck is a stack: the last element of {@link Game#getDeck()} is the next card drawn.
 * When a draw finds the deck empty, the discard pile minus its top card is shuffled back in.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DeckService {

    public static final int STANDARD_DECK_SIZE = 108;
    private static final int WILDS_OF_EACH_KIND = 4;

    private final Random shuffleRandom;

    /**
     * The 108-card deck in a fixed order: per color one 0, two of 1-9 and two of each action,
     * then four Wild and four Wild Draw Four.
     */
    public List<Card> buildStandardDeck() {
        List<Card> deck = new ArrayList<>(STANDARD_DECK_SIZE);
        for (CardColor color : CardColor.playable()) {
            for (CardRank rank : CardRank.numbers()) {
                deck.add(Card.of(color, rank));
                if (rank != CardRank.ZERO) {
                    deck.add(Card.of(color, rank));
                }
            }
            for (CardRank action : CardRank.actions()) {
                deck.add(Card.of(color, action));
                deck.add(Card.of(color, action));
            }
        }
        for (int i = 0; i < WILDS_OF_EACH_KIND; i++) {
            deck.add(Card.wild());
            deck.add(Card.wildDrawFour());
        }
        return deck;
    }

    /**
     * Fisher-Yates shuffle into a new list; the input is left untouched.
     */
    public List<Card> shuffle(List<Card> cards) {
        List<Card> shuffled = new ArrayList<>(cards);
        for (int i = shuffled.size() - 1; i > 0; i--) {
            int j = shuffleRandom.nextInt(i + 1);
            Collections.swap(shuffled, i, j);
        }
        return shuffled;
    }

    /**
     * Fail with {@code DECK_EXHAUSTED} unless {@code count} cards can be drawn from the deck
     * plus everything under the discard top.
     *
     * @param pendingDiscards cards about to be pushed onto the discard pile before the draw,
     *                        each of which buries the current top card and makes it drawable
     */
    public void ensureCanDraw(Game game, int count, int pendingDiscards) {
        int discardAfter = game.getDiscardPile().size() + pendingDiscards;
        int available = game.getDeck().size() + Math.max(0, discardAfter - 1);
        if (available < count) {
            throw new UnoGameException(GameErrorCode.DECK_EXHAUSTED);
        }
    }

    /**
     * Pop {@code count} cards off the deck, reshuffling the discard pile into it when empty.
     * Nothing is drawn if fewer than {@code count} cards are reachable.
     */
    public List<Card> drawCards(Game game, int count) {
        ensureCanDraw(game, count, 0);
        List<Card> drawn = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            if (game.getDeck().isEmpty()) {
                reshuffleDiscardIntoDeck(game);
            }
            List<Card> deck = game.getDeck();
            drawn.add(deck.remove(deck.size() - 1));
        }
        return drawn;
    }

    public Card drawCard(Game game) {
        return drawCards(game, 1).get(0);
    }

    /**
     * Keep the discard top in place and shuffle the rest of the pile into a new deck.
     */
    public void reshuffleDiscardIntoDeck(Game game) {
        List<Card> discard = game.getDiscardPile();
        if (discard.size() <= 1) {
            throw new UnoGameException(GameErrorCode.DECK_EXHAUSTED);
        }
        Card top = discard.get(discard.size() - 1);
        List<Card> recycled = new ArrayList<>(discard.subList(0, discard.size() - 1));

        List<Card> newDeck = new ArrayList<>(game.getDeck());
        newDeck.addAll(shuffle(recycled));
        game.setDeck(newDeck);

        List<Card> newDiscard = new ArrayList<>();
        newDiscard.add(top);
        game.setDiscardPile(newDiscard);

        log.debug("Game {}: reshuffled {} discarded cards into the deck", game.getId(), recycled.size());
    }
}
