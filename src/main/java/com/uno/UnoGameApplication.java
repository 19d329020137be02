package com.uno;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main entry point for the UNO game server.
 * 
 * Features:
 * - Turn engine with action-card effects and UNO challenges
 * - REST API and STOMP WebSocket access
 * - Real-time game updates
 * - Persistent game state
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class UnoGameApplication {

    public static void main(String[] args) {
        SpringApplication.run(UnoGameApplication.class, args);
    }
}
