package org.cortexview.observatory.resources;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.cortexview.observatory.api.stores.IStreamStoreReader;
import org.cortexview.observatory.api.stores.SourceUnavailableException;
import org.cortexview.observatory.api.stores.StreamRecord;
import org.cortexview.observatory.api.stores.StreamWindow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import redis.clients.jedis.AbstractTransaction;
import redis.clients.jedis.JedisPooled;
import redis.clients.jedis.Response;
import redis.clients.jedis.exceptions.JedisException;
import redis.clients.jedis.resps.StreamEntry;

import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the trailing window of the awake thought stream from Redis using {@code XLEN} and
 * {@code XREVRANGE} in one {@code MULTI}/{@code EXEC} block. Only read commands are ever issued.
 * <p>
 * Configuration:
 * <pre>
 * stream {
 *   url = "redis://localhost:6379"
 *   key = "daneel:stream:awake"
 *   timeoutMs = 100
 * }
 * </pre>
 */
public class RedisStreamStore extends AbstractStoreResource implements IStreamStoreReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(RedisStreamStore.class);

    private final String streamKey;
    private final JedisPooled jedis;

    /**
     * Creates the store and its connection pool. No connection is opened until the first read.
     *
     * @param name    The store name.
     * @param options The store configuration.
     * @throws IllegalArgumentException if the URL or timeout is invalid.
     */
    public RedisStreamStore(final String name, final Config options) {
        this(name, options, null);
    }

    RedisStreamStore(final String name, final Config options, final JedisPooled client) {
        super(name, options.withFallback(defaults()));
        final Config finalConfig = this.options;
        try {
            this.streamKey = finalConfig.getString("key");
            final int timeoutMs = finalConfig.getInt("timeoutMs");
            if (timeoutMs <= 0) {
                throw new IllegalArgumentException("timeoutMs must be positive for stream store '" + name + "'.");
            }
            this.jedis = client != null ? client : new JedisPooled(parseUri(finalConfig.getString("url")), timeoutMs);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for stream store '" + name + "'", e);
        }
        LOGGER.debug("Stream store '{}' reads key '{}'", name, streamKey);
    }

    private static Config defaults() {
        return ConfigFactory.parseMap(Map.of(
            "url", "redis://localhost:6379",
            "key", "daneel:stream:awake",
            "timeoutMs", 100
        ));
    }

    static URI parseUri(final String url) {
        final URI uri;
        try {
            uri = URI.create(url);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unparsable stream store URL: " + url, e);
        }
        if (!"redis".equals(uri.getScheme()) && !"rediss".equals(uri.getScheme())) {
            throw new IllegalArgumentException("Stream store URL must use the redis:// or rediss:// scheme: " + url);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("Stream store URL has no host: " + url);
        }
        return uri;
    }

    @Override
    public StreamWindow readLatest(final int count) throws SourceUnavailableException {
        countRequest();
        try {
            final long length;
            final List<StreamEntry> entries;
            // MULTI/EXEC so that the length and the window describe the same stream state.
            try (AbstractTransaction transaction = jedis.multi()) {
                final Response<Long> lengthResponse = transaction.xlen(streamKey);
                final Response<List<StreamEntry>> entriesResponse = transaction.xrevrange(streamKey, "+", "-", count);
                transaction.exec();
                length = lengthResponse.get();
                entries = entriesResponse.get();
            }
            final List<StreamRecord> records = new ArrayList<>(entries.size());
            for (final StreamEntry entry : entries) {
                records.add(new StreamRecord(
                    entry.getID().toString(),
                    Instant.ofEpochMilli(entry.getID().getTime()),
                    entry.getFields()));
            }
            markSuccess();
            return new StreamWindow(length, records);
        } catch (JedisException e) {
            LOGGER.debug("Reading stream '{}' failed: {}", streamKey, e.getMessage());
            throw unavailable("STREAM_READ_FAILED", "Failed to read stream '" + streamKey + "'", e);
        }
    }

    public String getStreamKey() {
        return streamKey;
    }

    @Override
    public void close() {
        jedis.close();
    }
}
