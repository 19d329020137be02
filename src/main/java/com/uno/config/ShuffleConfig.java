package com.uno.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Provides the random source used for shuffling.
 */
@Configuration
@Slf4j
public class ShuffleConfig {

    @Bean
    public Random shuffleRandom(GameProperties properties) {
        if (properties.shuffleSeed() != null) {
            log.warn("Shuffling with fixed seed {}; games are reproducible", properties.shuffleSeed());
            return new Random(properties.shuffleSeed());
        }
        return new SecureRandom();
    }
}
