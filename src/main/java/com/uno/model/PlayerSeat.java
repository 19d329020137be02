package com.uno.model;

import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.FetchType;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.JoinColumn;
import jakarta.persistence.ManyToOne;
import jakarta.persistence.Table;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * A player's state within one game: hand, turn flag, UNO declaration and score.
 */
@Entity
@Table(name = "player_seats")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class PlayerSeat {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String playerId;

    @Column(nullable = false)
    private String playerName;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "game_id", nullable = false)
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private Game game;

    @Column(nullable = false)
    private int turnOrder;

    @Convert(converter = CardListConverter.class)
    @Column(length = 4000)
    @Builder.Default
    private List<Card> hand = new ArrayList<>();

    @Column(nullable = false)
    @Builder.Default
    private boolean currentTurn = false;

    @Column(nullable = false)
    @Builder.Default
    private boolean saidUno = false;

    @Column(nullable = false)
    @Builder.Default
    private int score = 0;

    @Column
    private LocalDateTime joinedAt;

    public int handSize() {
        return hand.size();
    }

    public boolean hasCard(Card card) {
        return hand.contains(card);
    }

    /**
     * Append cards to the hand. The hand grows, so any UNO declaration lapses.
     */
    public void addCards(List<Card> cards) {
        hand.addAll(cards);
        saidUno = false;
    }

    /**
     * Remove one copy of the card. Clears the UNO declaration unless exactly one card remains.
     */
    public boolean removeCard(Card card) {
        boolean removed = hand.remove(card);
        if (removed && hand.size() != 1) {
            saidUno = false;
        }
        return removed;
    }

    public int handPoints() {
        return hand.stream().mapToInt(Card::points).sum();
    }
}
