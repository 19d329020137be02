package com.uno.service;

import com.uno.config.GameProperties;
import com.uno.exception.GameErrorCode;
import com.uno.exception.UnoGameException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Serializes mutations per game: at most one action runs against a game id at a time.
 * Actions on different games run in parallel.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GameLockRegistry {

    private final GameProperties gameProperties;

    private final ConcurrentHashMap<String, ReentrantLock> gameLocks = new ConcurrentHashMap<>();

    /**
     * Run {@code action} while holding the game's lock.
     *
     * @throws UnoGameException with {@link GameErrorCode#GAME_BUSY} if the lock is not acquired in time
     */
    public <T> T execute(String gameId, Supplier<T> action) {
        ReentrantLock lock = acquire(gameId);
        try {
            return action.get();
        } finally {
            lock.unlock();
            if (!lock.isLocked() && !lock.hasQueuedThreads()) {
                gameLocks.remove(gameId, lock);
            }
        }
    }

    public void run(String gameId, Runnable action) {
        execute(gameId, () -> {
            action.run();
            return null;
        });
    }

    /**
     * Number of games with a live lock entry.
     */
    int activeLocks() {
        return gameLocks.size();
    }

    private ReentrantLock acquire(String gameId) {
        long deadline = System.nanoTime() + TimeUnit.MILLISECONDS.toNanos(gameProperties.lockTimeoutMs());
        while (true) {
            ReentrantLock lock = gameLocks.computeIfAbsent(gameId, id -> new ReentrantLock());
            long remaining = deadline - System.nanoTime();
            boolean acquired;
            try {
                acquired = lock.tryLock(Math.max(remaining, 0), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new UnoGameException(GameErrorCode.GAME_BUSY, "Interrupted waiting for game " + gameId);
            }
            if (!acquired) {
                log.warn("Timed out waiting for lock on game {}", gameId);
                throw new UnoGameException(GameErrorCode.GAME_BUSY);
            }
            // the entry may have been dropped by the previous holder while we waited
            if (gameLocks.get(gameId) == lock) {
                return lock;
            }
            lock.unlock();
        }
    }
}
