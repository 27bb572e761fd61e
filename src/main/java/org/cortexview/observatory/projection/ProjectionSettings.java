package org.cortexview.observatory.projection;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Settings of the {@link ProjectionEngine}.
 *
 * @param type              {@code random} or {@code pca}.
 * @param dimension         Embedding dimensionality; vectors of any other length are dropped.
 * @param seed              Seed for the random basis and the PCA start vectors.
 * @param sampleCount       Maximum number of points sampled per refresh.
 * @param refreshInterval   Delay between refreshes.
 * @param samplesCollection Collection sampled for points.
 * @param anchorCollection  Collection holding the anchor embeddings, keyed by payload {@code label}.
 * @param anchorScanLimit   Maximum number of points read from the anchor collection.
 * @param anchors           Anchor definitions in display order.
 */
public record ProjectionSettings(
    String type,
    int dimension,
    long seed,
    int sampleCount,
    Duration refreshInterval,
    String samplesCollection,
    String anchorCollection,
    int anchorScanLimit,
    List<AnchorDefinition> anchors
) {

    public ProjectionSettings {
        type = type.toLowerCase(Locale.ROOT);
        if (!RandomProjectionBasis.TYPE.equals(type) && !PcaProjectionBasis.TYPE.equals(type)) {
            throw new IllegalArgumentException("Unknown projection type '" + type + "', expected 'random' or 'pca'");
        }
        if (dimension <= 3) {
            throw new IllegalArgumentException("Projection dimension must be greater than 3, got " + dimension);
        }
        if (sampleCount <= 0) {
            throw new IllegalArgumentException("sampleCount must be positive, got " + sampleCount);
        }
        if (refreshInterval.isNegative() || refreshInterval.isZero()) {
            throw new IllegalArgumentException("refreshIntervalMs must be positive, got " + refreshInterval.toMillis());
        }
        if (anchorScanLimit <= 0) {
            throw new IllegalArgumentException("anchorScanLimit must be positive, got " + anchorScanLimit);
        }
        anchors = List.copyOf(anchors);
    }

    /**
     * Parses the {@code projection} configuration block.
     *
     * @param options The projection options.
     * @return The validated settings.
     * @throws IllegalArgumentException if a value is missing or invalid.
     */
    public static ProjectionSettings fromConfig(final Config options) {
        final Config config = options.withFallback(ConfigFactory.parseMap(Map.of(
            "type", RandomProjectionBasis.TYPE,
            "dimension", 384,
            "seed", RandomProjectionBasis.DEFAULT_SEED,
            "sampleCount", 500,
            "refreshIntervalMs", 2000,
            "samplesCollection", "memories",
            "anchorCollection", "anchors",
            "anchorScanLimit", 64
        )));
        try {
            final List<AnchorDefinition> anchors;
            if (config.hasPath("anchors")) {
                anchors = new ArrayList<>();
                for (final Config anchor : config.getConfigList("anchors")) {
                    anchors.add(new AnchorDefinition(
                        anchor.getString("label"),
                        anchor.getDouble("x"),
                        anchor.getDouble("y"),
                        anchor.getDouble("z")));
                }
            } else {
                anchors = AnchorDefinition.DEFAULTS;
            }
            return new ProjectionSettings(
                config.getString("type"),
                config.getInt("dimension"),
                config.getLong("seed"),
                config.getInt("sampleCount"),
                Duration.ofMillis(config.getLong("refreshIntervalMs")),
                config.getString("samplesCollection"),
                config.getString("anchorCollection"),
                config.getInt("anchorScanLimit"),
                anchors);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid projection configuration: " + e.getMessage(), e);
        }
    }
}
