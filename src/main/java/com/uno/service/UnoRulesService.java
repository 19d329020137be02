package com.uno.service;

import com.uno.dto.ChallengeResult;
import com.uno.exception.GameErrorCode;
import com.uno.exception.UnoGameException;
import com.uno.model.Card;
import com.uno.model.Game;
import com.uno.model.PlayerSeat;
import com.uno.repository.GameRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Service responsible for UNO declarations and challenges.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class UnoRulesService {

    public static final int CHALLENGE_PENALTY = 2;

    private final GameRepository gameRepository;
    private final GameQueryService gameQueryService;
    private final DeckService deckService;

    /**
     * Declare UNO. Allowed on or off turn, once, while holding exactly one card.
     */
    public PlayerSeat sayUno(String gameId, String playerId) {
        Game game = gameQueryService.getStartedGame(gameId);
        PlayerSeat seat = gameQueryService.getSeat(game, playerId);

        if (seat.handSize() != 1) {
            throw new UnoGameException(GameErrorCode.INVALID_UNO_DECLARATION,
                    "Can only say UNO with exactly one card (holding " + seat.handSize() + ")");
        }
        if (seat.isSaidUno()) {
            throw new UnoGameException(GameErrorCode.INVALID_UNO_DECLARATION, "UNO already declared");
        }

        seat.setSaidUno(true);
        gameRepository.save(game);
        log.info("Game {}: {} said UNO", game.getId(), seat.getPlayerName());
        return seat;
    }

    /**
     * Challenge a seat holding one card. If it has not declared UNO it draws
     * {@value #CHALLENGE_PENALTY} cards; otherwise the challenge fails and nothing changes.
     */
    public ChallengeResult challengeUno(String gameId, String challengerId, String challengedId) {
        Game game = gameQueryService.getStartedGame(gameId);
        PlayerSeat challenger = gameQueryService.getSeat(game, challengerId);
        PlayerSeat challenged = gameQueryService.getSeat(game, challengedId);

        if (challenger == challenged) {
            throw new UnoGameException(GameErrorCode.INVALID_CHALLENGE, "Players cannot challenge themselves");
        }
        if (challenged.handSize() != 1) {
            throw new UnoGameException(GameErrorCode.INVALID_CHALLENGE,
                    challenged.getPlayerName() + " does not have exactly one card");
        }

        if (challenged.isSaidUno()) {
            log.debug("Game {}: challenge by {} failed, {} had said UNO",
                    game.getId(), challenger.getPlayerName(), challenged.getPlayerName());
            return ChallengeResult.builder()
                    .successful(false)
                    .challengerId(challengerId)
                    .challengedId(challengedId)
                    .cardsDrawn(0)
                    .challengedCardCount(challenged.handSize())
                    .message("Challenge failed. " + challenged.getPlayerName() + " had said UNO.")
                    .build();
        }

        List<Card> penalty = deckService.drawCards(game, CHALLENGE_PENALTY);
        challenged.addCards(penalty);
        gameRepository.save(game);

        log.info("Game {}: {} caught {} without UNO", game.getId(),
                challenger.getPlayerName(), challenged.getPlayerName());
        return ChallengeResult.builder()
                .successful(true)
                .challengerId(challengerId)
                .challengedId(challengedId)
                .cardsDrawn(penalty.size())
                .challengedCardCount(challenged.handSize())
                .message("Challenge successful! " + challenged.getPlayerName()
                        + " draws " + CHALLENGE_PENALTY + " cards.")
                .build();
    }
}
