package com.uno.service;

import com.uno.model.Game;
import com.uno.model.GameStatus;
import com.uno.model.PlayerSeat;
import com.uno.repository.GameRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;

/**
 * Service responsible for ending games and scoring the winner.
 */
@Service
@RequiredArgsConstructor
@Slf4j
@Transactional
public class WinConditionService {

    private final GameRepository gameRepository;

    /**
     * Finish the game with the given winner, who scores the point value of every card
     * still held by the other seats.
     *
     * @return points awarded to the winner
     */
    public int finishGame(Game game, PlayerSeat winner) {
        int points = game.getSeats().stream()
                .filter(seat -> seat != winner)
                .mapToInt(PlayerSeat::handPoints)
                .sum();
        winner.setScore(winner.getScore() + points);

        close(game);
        game.setWinnerId(winner.getPlayerId());
        gameRepository.save(game);
        log.info("Game {} won by {} for {} points", game.getId(), winner.getPlayerName(), points);
        return points;
    }

    /**
     * Finish the game with no winner.
     */
    public void endWithoutWinner(Game game) {
        close(game);
        gameRepository.save(game);
        log.info("Game {} ended without a winner", game.getId());
    }

    /**
     * A started game left with a single seat is won by that seat.
     *
     * @return true if the game was finished
     */
    public boolean checkLastPlayerStanding(Game game) {
        if (game.getStatus() == GameStatus.STARTED && game.getSeats().size() == 1) {
            finishGame(game, game.getSeats().get(0));
            return true;
        }
        return false;
    }

    private void close(Game game) {
        game.setStatus(GameStatus.FINISHED);
        game.setEndedAt(LocalDateTime.now());
        game.getSeats().forEach(seat -> seat.setCurrentTurn(false));
    }
}
