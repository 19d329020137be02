package com.uno.model;

import jakarta.persistence.CascadeType;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.OneToMany;
import jakarta.persistence.OrderBy;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;
import jakarta.persistence.Version;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * An UNO game: the aggregate root owning the deck, the discard pile and the seats.
 */
@Entity
@Table(name = "games")
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Game {

    public static final int CLOCKWISE = 1;
    public static final int COUNTER_CLOCKWISE = -1;

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(nullable = false)
    private String name;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false)
    private GameStatus status;

    /** +1 clockwise, -1 counter-clockwise */
    @Column(nullable = false)
    @Builder.Default
    private int direction = CLOCKWISE;

    /** turnOrder of the seat whose turn it is */
    @Column(nullable = false)
    private int currentPlayerIndex;

    /** Undealt cards; the last element is the top of the stack. */
    @Convert(converter = CardListConverter.class)
    @Column(length = 4000)
    @Builder.Default
    private List<Card> deck = new ArrayList<>();

    /** Played cards; the last element is the visible top card. */
    @Convert(converter = CardListConverter.class)
    @Column(length = 4000)
    @Builder.Default
    private List<Card> discardPile = new ArrayList<>();

    @Enumerated(EnumType.STRING)
    @Column
    private CardColor currentColor;

    @OneToMany(mappedBy = "game", cascade = CascadeType.ALL, orphanRemoval = true)
    @OrderBy("turnOrder ASC")
    @Builder.Default
    private List<PlayerSeat> seats = new ArrayList<>();

    @Column(nullable = false)
    private int maxPlayers;

    @Column
    private String creatorId;

    @Column
    private String winnerId;

    @Column(nullable = false)
    private LocalDateTime createdAt;

    @Column
    private LocalDateTime startedAt;

    @Column
    private LocalDateTime endedAt;

    @Version
    private Long version;

    @PrePersist
    public void prePersist() {
        if (createdAt == null) {
            createdAt = LocalDateTime.now();
        }
        if (status == null) {
            status = GameStatus.WAITING;
        }
    }

    public boolean isStarted() {
        return status == GameStatus.STARTED;
    }

    public Optional<PlayerSeat> findSeat(String playerId) {
        return seats.stream()
                .filter(s -> s.getPlayerId().equals(playerId))
                .findFirst();
    }

    public PlayerSeat seatAt(int turnOrder) {
        return seats.stream()
                .filter(s -> s.getTurnOrder() == turnOrder)
                .findFirst()
                .orElseThrow(() -> new IllegalStateException("No seat at turn order " + turnOrder));
    }

    public PlayerSeat getCurrentSeat() {
        if (seats.isEmpty()) return null;
        return seatAt(currentPlayerIndex);
    }

    public Card getTopCard() {
        return discardPile.isEmpty() ? null : discardPile.get(discardPile.size() - 1);
    }

    /**
     * Cards in the deck, the discard pile and every hand. Constant once dealt.
     */
    public int totalCardCount() {
        return deck.size() + discardPile.size()
                + seats.stream().mapToInt(PlayerSeat::handSize).sum();
    }

    public boolean isFull() {
        return seats.size() >= maxPlayers;
    }
}
