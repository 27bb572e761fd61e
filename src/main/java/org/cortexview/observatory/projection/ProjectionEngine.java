package org.cortexview.observatory.projection;

import org.cortexview.observatory.api.resources.IMonitorable;
import org.cortexview.observatory.api.resources.OperationalError;
import org.cortexview.observatory.api.stores.IVectorStoreReader;
import org.cortexview.observatory.api.stores.SourceUnavailableException;
import org.cortexview.observatory.api.stores.VectorRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Turns sampled memory embeddings into a 3-D {@link PointCloud}.
 * <p>
 * The basis and the anchor coordinates are established together on the first refresh that
 * can read samples, and then stay fixed until {@link #reset()}. If the anchor embeddings cannot
 * be read at that point, later refreshes read them again through the same basis. Every later refresh projects
 * through the same basis, so points and anchors of different clouds remain comparable. A random
 * basis is created up front; a PCA basis is fitted on the first non-empty sample batch.
 * <p>
 * Thread Safety: {@link #refresh()} and {@link #reset()} are serialized. The current cloud is
 * an atomic-replace cell readable from any thread.
 */
public class ProjectionEngine implements IMonitorable {

    private static final Logger LOGGER = LoggerFactory.getLogger(ProjectionEngine.class);

    private static final double DEFAULT_SALIENCE = 0.5;

    private final IVectorStoreReader store;
    private final ProjectionSettings settings;
    private final Clock clock;

    private final AtomicReference<BasisState> basis = new AtomicReference<>();
    private final AtomicReference<PointCloud> cloud = new AtomicReference<>();

    private volatile boolean stale = false;
    private volatile int consecutiveFailures = 0;
    private final AtomicLong refreshes = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();
    private final AtomicLong droppedSamples = new AtomicLong();
    private final ConcurrentLinkedDeque<OperationalError> errors = new ConcurrentLinkedDeque<>();

    public ProjectionEngine(final IVectorStoreReader store, final ProjectionSettings settings, final Clock clock) {
        this.store = Objects.requireNonNull(store, "store");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Samples the vector store and publishes a new cloud. If the store cannot be read the
     * previous cloud is kept and the engine is marked stale.
     */
    public synchronized void refresh() {
        final List<VectorRecord> samples;
        try {
            samples = store.sample(settings.samplesCollection(), settings.sampleCount());
        } catch (SourceUnavailableException e) {
            markFailed(e.getMessage());
            return;
        }
        markRecovered();

        final List<VectorRecord> usable = new ArrayList<>(samples.size());
        int dropped = 0;
        for (final VectorRecord sample : samples) {
            if (sample.dimension() == settings.dimension()) {
                usable.add(sample);
            } else {
                dropped++;
                recordError("MALFORMED_SAMPLE", "Dropped vector with dimension " + sample.dimension()
                    + ", expected " + settings.dimension(), sample.id());
            }
        }
        if (dropped > 0) {
            droppedSamples.addAndGet(dropped);
            LOGGER.debug("Dropped {} of {} sampled vector(s) with wrong dimension", dropped, samples.size());
        }

        final Instant now = clock.instant();
        final BasisState state = establishBasis(usable);
        if (state == null) {
            // No basis can be fitted yet, show the landmarks alone.
            publish(new PointCloud(List.of(), fallbackAnchors(), now, settings.type(), dropped));
            return;
        }

        final List<PointCloud.VectorPoint> points = new ArrayList<>(usable.size());
        for (final VectorRecord sample : usable) {
            final double[] xyz = state.basis().project(sample.vector());
            points.add(new PointCloud.VectorPoint(
                sample.id(),
                xyz[0], xyz[1], xyz[2],
                sample.payloadDouble("semantic_salience", DEFAULT_SALIENCE),
                ageSeconds(sample.payloadString("encoded_at"), now)));
        }
        publish(new PointCloud(points, state.anchors(), now, state.basis().type(), dropped));
    }

    private void publish(final PointCloud next) {
        cloud.set(next);
        refreshes.incrementAndGet();
    }

    private BasisState establishBasis(final List<VectorRecord> usable) {
        final BasisState existing = basis.get();
        if (existing != null) {
            return existing.anchorsRead() ? existing : retryAnchors(existing);
        }
        final ProjectionBasis created;
        if (PcaProjectionBasis.TYPE.equals(settings.type())) {
            if (usable.isEmpty()) {
                return null;
            }
            final List<float[]> vectors = new ArrayList<>(usable.size());
            for (final VectorRecord sample : usable) {
                vectors.add(sample.vector());
            }
            created = PcaProjectionBasis.fit(vectors, settings.dimension(), settings.seed());
        } else {
            created = new RandomProjectionBasis(settings.dimension(), settings.seed());
        }
        final BasisState state = projectAnchors(created, false);
        basis.set(state);
        LOGGER.info("Established {} projection basis for dimension {} with {} anchor(s)",
            created.type(), created.dimension(), state.anchors().size());
        return state;
    }

    /**
     * Reads the anchor embeddings again for a basis whose first anchor read failed. The basis
     * itself is kept.
     */
    private BasisState retryAnchors(final BasisState existing) {
        final BasisState retried = projectAnchors(existing.basis(), true);
        if (!retried.anchorsRead()) {
            return existing;
        }
        basis.set(retried);
        LOGGER.info("Anchor embeddings available again, projected {} anchor(s)", retried.anchors().size());
        return retried;
    }

    /**
     * Projects the anchor embeddings through the basis. A label without a readable embedding of
     * the right dimension is placed at its configured fallback coordinates.
     */
    private BasisState projectAnchors(final ProjectionBasis projectionBasis, final boolean retry) {
        final Map<String, VectorRecord> embeddings = new HashMap<>();
        boolean read = true;
        try {
            for (final VectorRecord record : store.sample(settings.anchorCollection(), settings.anchorScanLimit())) {
                final String label = record.payloadString("label");
                if (label != null && record.dimension() == projectionBasis.dimension()) {
                    embeddings.putIfAbsent(label, record);
                }
            }
        } catch (SourceUnavailableException e) {
            read = false;
            if (retry) {
                LOGGER.debug("Anchor embeddings still unavailable: {}", e.getMessage());
            } else {
                LOGGER.warn("Anchor embeddings unavailable, using fallback coordinates: {}", e.getMessage());
            }
        }

        final List<PointCloud.AnchorPoint> anchors = new ArrayList<>(settings.anchors().size());
        for (final AnchorDefinition definition : settings.anchors()) {
            final VectorRecord embedding = embeddings.get(definition.label());
            if (embedding == null) {
                anchors.add(definition.fallback());
            } else {
                final double[] xyz = projectionBasis.project(embedding.vector());
                anchors.add(new PointCloud.AnchorPoint(definition.label(), xyz[0], xyz[1], xyz[2]));
            }
        }
        return new BasisState(projectionBasis, anchors, read);
    }

    private List<PointCloud.AnchorPoint> fallbackAnchors() {
        final List<PointCloud.AnchorPoint> anchors = new ArrayList<>(settings.anchors().size());
        for (final AnchorDefinition definition : settings.anchors()) {
            anchors.add(definition.fallback());
        }
        return anchors;
    }

    static long ageSeconds(final String encodedAt, final Instant now) {
        if (encodedAt == null) {
            return 0L;
        }
        try {
            final Instant encoded = OffsetDateTime.parse(encodedAt).toInstant();
            return Math.max(0L, Duration.between(encoded, now).getSeconds());
        } catch (DateTimeParseException e) {
            return 0L;
        }
    }

    private void markFailed(final String reason) {
        failures.incrementAndGet();
        consecutiveFailures++;
        recordError("SOURCE_UNAVAILABLE", "Vector sample failed", reason);
        if (!stale) {
            LOGGER.warn("Vector store unavailable, keeping previous point cloud: {}", reason);
        }
        stale = true;
    }

    private void markRecovered() {
        if (stale) {
            LOGGER.info("Vector store recovered after {} failed refresh(es)", consecutiveFailures);
        }
        stale = false;
        consecutiveFailures = 0;
    }

    private void recordError(final String code, final String message, final String details) {
        errors.add(new OperationalError(Instant.now(), code, message, details));
        while (errors.size() > 1000) {
            errors.pollFirst();
        }
    }

    /**
     * Discards the basis and anchors; the next refresh establishes new ones. The current cloud
     * stays readable until then.
     */
    public synchronized void reset() {
        basis.set(null);
        LOGGER.info("Projection basis reset");
    }

    /**
     * @return The latest cloud, or empty before the first successful refresh.
     */
    public Optional<PointCloud> current() {
        return Optional.ofNullable(cloud.get());
    }

    /**
     * @return The basis in use, or empty if none has been established yet.
     */
    public Optional<ProjectionBasis> basis() {
        final BasisState state = basis.get();
        return state == null ? Optional.empty() : Optional.of(state.basis());
    }

    public boolean isStale() {
        return stale;
    }

    public ProjectionSettings getSettings() {
        return settings;
    }

    @Override
    public Map<String, Number> getMetrics() {
        final Map<String, Number> metrics = new LinkedHashMap<>();
        final PointCloud latest = cloud.get();
        metrics.put("refreshes", refreshes.get());
        metrics.put("points", latest == null ? 0 : latest.points().size());
        metrics.put("dropped_samples", droppedSamples.get());
        metrics.put("vectors_stale", stale ? 1 : 0);
        metrics.put("vectors_consecutive_failures", consecutiveFailures);
        metrics.put("vectors_failures", failures.get());
        return metrics;
    }

    @Override
    public List<OperationalError> getErrors() {
        return new ArrayList<>(errors);
    }

    @Override
    public void clearErrors() {
        errors.clear();
    }

    @Override
    public boolean isHealthy() {
        return !stale;
    }

    /**
     * @param anchorsRead Whether the anchor collection could be read; if not, the anchors sit at
     *                    their fallback coordinates and are read again on the next refresh.
     */
    private record BasisState(ProjectionBasis basis, List<PointCloud.AnchorPoint> anchors, boolean anchorsRead) {
        BasisState {
            anchors = List.copyOf(anchors);
        }
    }
}
