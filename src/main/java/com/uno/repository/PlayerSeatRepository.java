package com.uno.repository;

import com.uno.model.PlayerSeat;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Repository for PlayerSeat entities.
 */
@Repository
public interface PlayerSeatRepository extends JpaRepository<PlayerSeat, String> {

    boolean existsByGameIdAndPlayerId(String gameId, String playerId);
}
