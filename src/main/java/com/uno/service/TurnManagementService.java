package com.uno.service;

import com.uno.model.Card;
import com.uno.model.Game;
import com.uno.model.PlayerSeat;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Service responsible for turn transitions and action-card effects.
 * <p>
 * Seats are addressed by turn order. Every advance goes through {@link #nextIndex}, so
 * wrap-around works the same in both directions for any table size.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TurnManagementService {

    private final DeckService deckService;

    /**
     * The seat {@code step} positions away from {@code current} in {@code direction}.
     */
    public int nextIndex(int current, int direction, int total, int step) {
        return ((current + direction * step) % total + total) % total;
    }

    public int nextIndex(int current, int direction, int total) {
        return nextIndex(current, direction, total, 1);
    }

    /**
     * Cards the next seat must draw when this card is played.
     */
    public int penaltyFor(Card card) {
        return switch (card.effect()) {
            case DRAW_TWO -> 2;
            case DRAW_FOUR -> 4;
            case NONE, SKIP, REVERSE -> 0;
        };
    }

    /**
     * Apply the effect of a card just played by the current seat and hand the turn on.
     * <ul>
     *   <li>number or plain Wild: next seat plays</li>
     *   <li>Reverse: direction flips; with two seats the player who reversed goes again</li>
     *   <li>Skip: next seat is skipped</li>
     *   <li>Draw Two / Wild Draw Four: next seat draws the penalty and is skipped</li>
     * </ul>
     */
    public TurnOutcome resolveEffect(Game game, Card played) {
        int total = game.getSeats().size();
        int current = game.getCurrentPlayerIndex();
        int direction = game.getDirection();
        PlayerSeat skipped = null;
        int penalty = 0;

        int next = switch (played.effect()) {
            case NONE -> nextIndex(current, direction, total);
            case REVERSE -> {
                direction = -direction;
                yield total == 2 ? current : nextIndex(current, direction, total);
            }
            case SKIP -> {
                skipped = game.seatAt(nextIndex(current, direction, total));
                yield nextIndex(current, direction, total, 2);
            }
            case DRAW_TWO, DRAW_FOUR -> {
                penalty = penaltyFor(played);
                skipped = game.seatAt(nextIndex(current, direction, total));
                skipped.addCards(deckService.drawCards(game, penalty));
                yield nextIndex(current, direction, total, 2);
            }
        };

        game.setDirection(direction);
        PlayerSeat nextSeat = advanceTurn(game, next);

        log.debug("Game {}: {} resolved, next seat {} ({}), direction {}",
                game.getId(), played, next, nextSeat.getPlayerName(), direction);
        return new TurnOutcome(nextSeat, skipped, penalty, direction);
    }

    /**
     * Make the seat at {@code nextIndex} the only current seat.
     */
    public PlayerSeat advanceTurn(Game game, int nextIndex) {
        game.setCurrentPlayerIndex(nextIndex);
        for (PlayerSeat seat : game.getSeats()) {
            seat.setCurrentTurn(seat.getTurnOrder() == nextIndex);
        }
        return game.seatAt(nextIndex);
    }

    /**
     * Result of resolving a played card.
     *
     * @param skippedSeat seat that lost its turn, or {@code null}
     * @param penaltyCards cards drawn by the skipped seat
     */
    public record TurnOutcome(PlayerSeat nextSeat, PlayerSeat skippedSeat, int penaltyCards, int direction) {}
}
