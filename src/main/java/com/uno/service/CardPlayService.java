package com.uno.service;

import com.uno.dto.TurnResult;
import com.uno.exception.GameErrorCode;
import com.uno.exception.UnoGameException;
import com.uno.model.Card;
import com.uno.model.CardColor;
import com.uno.model.Game;
import com.uno.model.PlayerSeat;
import com.uno.repository.GameRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Service responsible for the two turn actions: playing a card and drawing one.
 * <p>
 * All checks run before the first mutation, so a rejected action leaves the game untouched.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class CardPlayService {

    public static final String PLAY_CARD = "play-card";
    public static final String DRAW_CARD = "draw-card";

    private final GameRepository gameRepository;
    private final GameQueryService gameQueryService;
    private final PlayValidationService playValidationService;
    private final TurnManagementService turnManagementService;
    private final DeckService deckService;
    private final WinConditionService winConditionService;

    /**
     * Play a card from the current player's hand.
     *
     * @param chosenColor color label for Wild and Wild Draw Four; ignored for colored cards
     */
    public TurnResult playCard(String gameId, String playerId, Card card, String chosenColor) {
        Game game = gameQueryService.getStartedGame(gameId);
        PlayerSeat seat = gameQueryService.getSeat(game, playerId);
        gameQueryService.validateCurrentPlayer(seat);

        if (!seat.hasCard(card)) {
            throw new UnoGameException(GameErrorCode.CARD_NOT_IN_HAND, "Card not found in hand: " + card);
        }
        if (!playValidationService.isLegal(card, game.getTopCard(), game.getCurrentColor())) {
            throw new UnoGameException(GameErrorCode.ILLEGAL_CARD);
        }
        CardColor newColor = card.isWild() ? resolveChosenColor(chosenColor) : card.color();

        boolean winningCard = seat.handSize() == 1;
        int penalty = turnManagementService.penaltyFor(card);
        if (!winningCard && penalty > 0) {
            deckService.ensureCanDraw(game, penalty, 1);
        }

        seat.removeCard(card);
        game.getDiscardPile().add(card);
        game.setCurrentColor(newColor);
        seat.setCurrentTurn(false);

        if (winningCard) {
            int points = winConditionService.finishGame(game, seat);
            return TurnResult.builder()
                    .action(PLAY_CARD)
                    .message(seat.getPlayerName() + " played " + card + ". " + seat.getPlayerName() + " wins!")
                    .playerId(playerId)
                    .cardPlayed(card)
                    .currentColor(newColor)
                    .direction(game.getDirection())
                    .remainingCards(0)
                    .winnerId(playerId)
                    .winner(seat.getPlayerName())
                    .pointsWon(points)
                    .gameOver(true)
                    .build();
        }

        TurnManagementService.TurnOutcome outcome = turnManagementService.resolveEffect(game, card);
        gameRepository.save(game);

        log.debug("Game {}: {} played {}", game.getId(), seat.getPlayerName(), card);

        PlayerSeat skipped = outcome.skippedSeat();
        return TurnResult.builder()
                .action(PLAY_CARD)
                .message("Card played successfully.")
                .playerId(playerId)
                .cardPlayed(card)
                .currentColor(newColor)
                .direction(outcome.direction())
                .nextPlayerId(outcome.nextSeat().getPlayerId())
                .nextPlayer(outcome.nextSeat().getPlayerName())
                .skippedPlayerId(skipped != null ? skipped.getPlayerId() : null)
                .skippedPlayer(skipped != null ? skipped.getPlayerName() : null)
                .penaltyCards(outcome.penaltyCards())
                .remainingCards(seat.handSize())
                .unoWarning(seat.handSize() == 1
                        ? seat.getPlayerName() + " has UNO! (1 card left)"
                        : null)
                .build();
    }

    /**
     * Draw one card and pass the turn to the next seat. A voluntary draw never skips anyone.
     */
    public TurnResult drawCard(String gameId, String playerId) {
        Game game = gameQueryService.getStartedGame(gameId);
        PlayerSeat seat = gameQueryService.getSeat(game, playerId);
        gameQueryService.validateCurrentPlayer(seat);

        Card drawn = deckService.drawCard(game);
        seat.addCards(List.of(drawn));
        seat.setCurrentTurn(false);

        int next = turnManagementService.nextIndex(
                game.getCurrentPlayerIndex(), game.getDirection(), game.getSeats().size());
        PlayerSeat nextSeat = turnManagementService.advanceTurn(game, next);
        gameRepository.save(game);

        log.debug("Game {}: {} drew a card", game.getId(), seat.getPlayerName());

        return TurnResult.builder()
                .action(DRAW_CARD)
                .message(seat.getPlayerName() + " drew a card from the deck.")
                .playerId(playerId)
                .cardDrawn(drawn)
                .currentColor(game.getCurrentColor())
                .direction(game.getDirection())
                .nextPlayerId(nextSeat.getPlayerId())
                .nextPlayer(nextSeat.getPlayerName())
                .remainingCards(seat.handSize())
                .build();
    }

    /**
     * Play or draw in one call; the turn ends after either.
     *
     * @param action {@value #PLAY_CARD} or {@value #DRAW_CARD}
     * @param card   required when playing
     */
    public TurnResult executeTurn(String gameId, String playerId, String action, Card card, String chosenColor) {
        if (PLAY_CARD.equals(action)) {
            if (card == null) {
                throw new UnoGameException(GameErrorCode.INVALID_ACTION, "You must specify which card to play");
            }
            TurnResult result = playCard(gameId, playerId, card, chosenColor);
            if (!result.isGameOver()) {
                result.setMessage(playerName(gameId, playerId) + " played " + card + ". Turn ended.");
            }
            return result;
        }
        if (DRAW_CARD.equals(action)) {
            TurnResult result = drawCard(gameId, playerId);
            result.setMessage(playerName(gameId, playerId) + " drew a card. Turn ended.");
            return result;
        }
        throw new UnoGameException(GameErrorCode.INVALID_ACTION);
    }

    private String playerName(String gameId, String playerId) {
        Game game = gameQueryService.getGame(gameId);
        return gameQueryService.getSeat(game, playerId).getPlayerName();
    }

    private CardColor resolveChosenColor(String chosenColor) {
        if (chosenColor == null || chosenColor.isBlank()) {
            throw new UnoGameException(GameErrorCode.MISSING_COLOR_CHOICE);
        }
        try {
            return CardColor.fromLabel(chosenColor);
        } catch (IllegalArgumentException e) {
            throw new UnoGameException(GameErrorCode.INVALID_COLOR_CHOICE,
                    "Invalid color '" + chosenColor + "'. Choose one of: Red, Blue, Green, Yellow");
        }
    }
}
