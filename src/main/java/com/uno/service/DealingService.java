package com.uno.service;

import com.uno.model.Card;
import com.uno.model.CardColor;
import com.uno.model.Game;
import com.uno.model.PlayerSeat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * Deals hands round-robin and picks the card that opens the discard pile.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DealingService {

    private final DeckService deckService;

    /**
     * Deal one card at a time to each player in turn order, {@code cardsPerPlayer} rounds,
     * popping from the end of the deck. A short deck leaves later players with fewer cards.
     *
     * @param playerIds players ordered by turn order
     * @param deck      shuffled deck; not modified
     */
    public Deal deal(List<String> playerIds, int cardsPerPlayer, List<Card> deck) {
        if (playerIds.isEmpty()) {
            throw new IllegalArgumentException("No players to deal to");
        }
        List<Card> remaining = new ArrayList<>(deck);
        Map<String, List<Card>> hands = new LinkedHashMap<>();
        for (String playerId : playerIds) {
            hands.put(playerId, new ArrayList<>());
        }

        for (int round = 0; round < cardsPerPlayer; round++) {
            for (String playerId : playerIds) {
                if (!remaining.isEmpty()) {
                    hands.get(playerId).add(remaining.remove(remaining.size() - 1));
                }
            }
        }
        return new Deal(hands, remaining);
    }

    /**
     * Take the opening discard from the deck, searching from the top: first a colored number card,
     * then any colored card, and if the deck holds only wilds, the top card.
     *
     * @param deck deck after dealing; not modified
     */
    public InitialDiscard selectInitialDiscard(List<Card> deck) {
        if (deck.isEmpty()) {
            throw new IllegalArgumentException("Cannot open the discard pile from an empty deck");
        }
        List<Card> remaining = new ArrayList<>(deck);

        int index = findFromTop(remaining, Card::isNumber);
        if (index < 0) {
            index = findFromTop(remaining, card -> !card.isWild());
        }
        if (index < 0) {
            index = remaining.size() - 1;
        }
        Card card = remaining.remove(index);
        return new InitialDiscard(card, remaining);
    }

    /**
     * Build and shuffle a fresh deck, deal to every seat, and open the discard pile.
     * The first seat in turn order starts and play runs clockwise.
     */
    public void dealInitialHands(Game game, int cardsPerPlayer) {
        List<PlayerSeat> seats = game.getSeats();
        List<String> playerIds = seats.stream().map(PlayerSeat::getPlayerId).toList();

        List<Card> deck = deckService.shuffle(deckService.buildStandardDeck());
        Deal deal = deal(playerIds, cardsPerPlayer, deck);
        InitialDiscard opening = selectInitialDiscard(deal.remainingDeck());

        for (PlayerSeat seat : seats) {
            seat.setHand(new ArrayList<>(deal.hands().get(seat.getPlayerId())));
            seat.setSaidUno(false);
            seat.setCurrentTurn(seat.getTurnOrder() == 0);
        }

        List<Card> discardPile = new ArrayList<>();
        discardPile.add(opening.card());
        game.setDeck(new ArrayList<>(opening.remainingDeck()));
        game.setDiscardPile(discardPile);
        game.setCurrentColor(opening.card().isWild() ? CardColor.RED : opening.card().color());
        game.setDirection(Game.CLOCKWISE);
        game.setCurrentPlayerIndex(0);

        log.debug("Game {}: dealt {} cards to {} players, opening card {}",
                game.getId(), cardsPerPlayer, seats.size(), opening.card());
    }

    private int findFromTop(List<Card> cards, Predicate<Card> wanted) {
        for (int i = cards.size() - 1; i >= 0; i--) {
            if (wanted.test(cards.get(i))) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Hands keyed by player id in turn order, plus the undealt cards.
     */
    public record Deal(Map<String, List<Card>> hands, List<Card> remainingDeck) {}

    /**
     * The opening discard and the deck without it.
     */
    public record InitialDiscard(Card card, List<Card> remainingDeck) {}
}
