package org.cortexview.observatory.broadcast;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;
import java.util.Map;

/**
 * Settings of the {@link BroadcastHub}.
 *
 * @param queueDepth   Maximum number of undelivered snapshots per session.
 * @param writeTimeout Maximum duration of one session write before the session is evicted.
 */
public record BroadcastSettings(int queueDepth, Duration writeTimeout) {

    public BroadcastSettings {
        if (queueDepth <= 0) {
            throw new IllegalArgumentException("queueDepth must be positive, got " + queueDepth);
        }
        if (writeTimeout.isNegative() || writeTimeout.isZero()) {
            throw new IllegalArgumentException("writeTimeoutMs must be positive, got " + writeTimeout.toMillis());
        }
    }

    /**
     * Parses the {@code broadcast} configuration block.
     *
     * @throws IllegalArgumentException if a value is missing or invalid.
     */
    public static BroadcastSettings fromConfig(final Config options) {
        final Config config = options.withFallback(ConfigFactory.parseMap(Map.of(
            "queueDepth", 1,
            "writeTimeoutMs", 150
        )));
        try {
            return new BroadcastSettings(config.getInt("queueDepth"), Duration.ofMillis(config.getLong("writeTimeoutMs")));
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid broadcast configuration: " + e.getMessage(), e);
        }
    }
}
