package com.uno.repository;

import com.uno.model.Game;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Repository for Game entities.
 */
@Repository
public interface GameRepository extends JpaRepository<Game, String> {

    @Query("SELECT g FROM Game g WHERE g.status = com.uno.model.GameStatus.WAITING AND SIZE(g.seats) < g.maxPlayers")
    List<Game> findJoinableGames();
}
