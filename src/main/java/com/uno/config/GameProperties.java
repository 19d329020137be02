package com.uno.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Game rule settings bound from {@code uno.game.*}.
 */
@ConfigurationProperties(prefix = "uno.game")
public record GameProperties(
        @DefaultValue("7") int cardsPerPlayer,
        @DefaultValue("2") int minPlayers,
        @DefaultValue("10") int maxPlayers,
        @DefaultValue("4") int defaultMaxPlayers,
        @DefaultValue("2000") long lockTimeoutMs,
        // fixed seed for reproducible shuffles; unset in production
        Long shuffleSeed
) {}
