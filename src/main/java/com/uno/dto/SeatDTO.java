package com.uno.dto;

import com.uno.model.PlayerSeat;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Public view of a seat. Hand contents are not included, only the card count.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SeatDTO {

    private String playerId;
    private String playerName;
    private int turnOrder;
    private int cardCount;
    private boolean currentTurn;
    private boolean saidUno;
    private int score;

    public static SeatDTO fromSeat(PlayerSeat seat) {
        return SeatDTO.builder()
                .playerId(seat.getPlayerId())
                .playerName(seat.getPlayerName())
                .turnOrder(seat.getTurnOrder())
                .cardCount(seat.handSize())
                .currentTurn(seat.isCurrentTurn())
                .saidUno(seat.isSaidUno())
                .score(seat.getScore())
                .build();
    }
}
