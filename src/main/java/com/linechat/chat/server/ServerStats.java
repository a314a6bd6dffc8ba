package com.linechat.chat.server;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-lifetime counters reported by {@code /stats}. Never reset.
 */
public class ServerStats {
    private final AtomicLong messageCount = new AtomicLong();
    private final Clock clock;
    private final Instant startTime;

    public ServerStats() {
        this(Clock.systemUTC());
    }

    public ServerStats(Clock clock) {
        this.clock = clock;
        this.startTime = clock.instant();
    }

    /** Counts one routed chat line. Command replies are not counted. */
    long recordMessage() {
        return messageCount.incrementAndGet();
    }

    public long getMessageCount() {
        return messageCount.get();
    }

    public Instant getStartTime() {
        return startTime;
    }

    public Duration uptime() {
        Duration elapsed = Duration.between(startTime, clock.instant());
        return elapsed.isNegative() ? Duration.ZERO : elapsed;
    }

    /**
     * Formats as {@code H:MM:SS}; hours are not capped at 24.
     */
    public static String formatUptime(Duration uptime) {
        long seconds = uptime.getSeconds();
        return String.format("%d:%02d:%02d", seconds / 3600, (seconds % 3600) / 60, seconds % 60);
    }
}
