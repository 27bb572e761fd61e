package org.cortexview.observatory.projection;

import com.typesafe.config.ConfigFactory;
import org.cortexview.junit.extensions.logging.ExpectLog;
import org.cortexview.junit.extensions.logging.LogLevel;
import org.cortexview.junit.extensions.logging.LogWatchExtension;
import org.cortexview.observatory.api.stores.IVectorStoreReader;
import org.cortexview.observatory.api.stores.SourceUnavailableException;
import org.cortexview.observatory.api.stores.VectorRecord;
import org.cortexview.testutils.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ProjectionEngineTest {

    private static final int DIMENSION = 8;
    private static final Instant NOW = Instant.parse("2026-01-01T00:01:30Z");

    private IVectorStoreReader store;
    private MutableClock clock;

    @BeforeEach
    void setUp() throws Exception {
        store = mock(IVectorStoreReader.class);
        clock = new MutableClock(NOW);
        when(store.sample("anchors", 64)).thenReturn(List.of());
    }

    private static ProjectionSettings settings(final String type) {
        return new ProjectionSettings(type, DIMENSION, 42L, 100, Duration.ofSeconds(2),
            "memories", "anchors", 64, AnchorDefinition.DEFAULTS);
    }

    private static float[] vector(final int dimension, final float seed) {
        final float[] vector = new float[dimension];
        for (int i = 0; i < dimension; i++) {
            vector[i] = seed * (i + 1) - i * i * 0.1f;
        }
        return vector;
    }

    private static VectorRecord memory(final String id, final int dimension, final float seed) {
        return new VectorRecord(id, vector(dimension, seed), Map.of(
            "semantic_salience", 0.9,
            "encoded_at", "2026-01-01T00:00:00Z"));
    }

    @Test
    @DisplayName("Vectors of the wrong dimension are dropped and counted")
    @ExpectLog(level = LogLevel.INFO, messagePattern = "Established random projection basis for dimension 8 with 4 anchor\\(s\\)")
    void refresh_dropsWrongDimension() throws Exception {
        when(store.sample("memories", 100)).thenReturn(List.of(
            memory("a", DIMENSION, 1f),
            memory("b", DIMENSION, -2f),
            memory("c", DIMENSION - 1, 3f)));
        final ProjectionEngine engine = new ProjectionEngine(store, settings("random"), clock);

        engine.refresh();

        final PointCloud cloud = engine.current().orElseThrow();
        assertThat(cloud.points()).extracting(PointCloud.VectorPoint::id).containsExactly("a", "b");
        assertThat(cloud.droppedSamples()).isEqualTo(1);
        assertThat(cloud.projectionType()).isEqualTo("random");
        assertThat(cloud.generatedAt()).isEqualTo(NOW);
        assertThat(engine.getMetrics()).containsEntry("dropped_samples", 1L).containsEntry("points", 2);
        assertThat(engine.getErrors()).hasSize(1);
    }

    @Test
    @DisplayName("Points carry salience and age from their payload")
    void refresh_readsSalienceAndAge() throws Exception {
        when(store.sample("memories", 100)).thenReturn(List.of(
            memory("a", DIMENSION, 1f),
            new VectorRecord("bare", vector(DIMENSION, 2f), Map.of())));
        final ProjectionEngine engine = new ProjectionEngine(store, settings("random"), clock);

        engine.refresh();

        final List<PointCloud.VectorPoint> points = engine.current().orElseThrow().points();
        assertThat(points.get(0).salience()).isEqualTo(0.9);
        assertThat(points.get(0).ageSeconds()).isEqualTo(90);
        assertThat(points.get(1).salience()).isEqualTo(0.5);
        assertThat(points.get(1).ageSeconds()).isZero();

        final double[] expected = engine.basis().orElseThrow().project(vector(DIMENSION, 1f));
        assertThat(points.get(0).x()).isEqualTo(expected[0]);
        assertThat(points.get(0).y()).isEqualTo(expected[1]);
        assertThat(points.get(0).z()).isEqualTo(expected[2]);
    }

    @Test
    @DisplayName("Anchors are projected once and stay identical across refreshes")
    void refresh_anchorsAreStable() throws Exception {
        final float[] humanity = vector(DIMENSION, 0.5f);
        when(store.sample("anchors", 64)).thenReturn(List.of(
            new VectorRecord("x", humanity, Map.of("label", "Law 0: Humanity")),
            new VectorRecord("y", vector(DIMENSION - 2, 1f), Map.of("label", "Law 1: No Harm"))));
        when(store.sample("memories", 100)).thenReturn(List.of(memory("a", DIMENSION, 1f)));
        final ProjectionEngine engine = new ProjectionEngine(store, settings("random"), clock);

        engine.refresh();
        final List<PointCloud.AnchorPoint> first = engine.current().orElseThrow().anchors();
        clock.advance(Duration.ofSeconds(2));
        engine.refresh();
        final List<PointCloud.AnchorPoint> second = engine.current().orElseThrow().anchors();

        assertThat(second).isEqualTo(first);
        verify(store, times(1)).sample("anchors", 64);

        final double[] projected = engine.basis().orElseThrow().project(humanity);
        assertThat(first.get(0)).isEqualTo(new PointCloud.AnchorPoint("Law 0: Humanity", projected[0], projected[1], projected[2]));
        assertThat(first.get(1)).isEqualTo(new PointCloud.AnchorPoint("Law 1: No Harm", 1.4, -0.5, 0.0));
        assertThat(first).extracting(PointCloud.AnchorPoint::label).containsExactly(
            "Law 0: Humanity", "Law 1: No Harm", "Law 2: Obey", "Law 3: Self");
    }

    @Test
    @DisplayName("An unavailable store keeps the previous cloud and marks the engine stale")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Vector store unavailable, keeping previous point cloud: connection refused")
    @ExpectLog(level = LogLevel.INFO, messagePattern = "Vector store recovered after 2 failed refresh\\(es\\)")
    void refresh_keepsPreviousCloudWhileUnavailable() throws Exception {
        when(store.sample("memories", 100)).thenReturn(List.of(memory("a", DIMENSION, 1f)));
        final ProjectionEngine engine = new ProjectionEngine(store, settings("random"), clock);
        engine.refresh();
        final PointCloud before = engine.current().orElseThrow();

        when(store.sample("memories", 100)).thenThrow(new SourceUnavailableException("vectors", "connection refused"));
        engine.refresh();
        engine.refresh();

        assertThat(engine.current()).containsSame(before);
        assertThat(engine.isStale()).isTrue();
        assertThat(engine.isHealthy()).isFalse();
        assertThat(engine.getMetrics()).containsEntry("vectors_stale", 1).containsEntry("vectors_failures", 2L);

        doReturn(List.of(memory("a", DIMENSION, 1f), memory("b", DIMENSION, 2f))).when(store).sample("memories", 100);
        engine.refresh();

        assertThat(engine.isStale()).isFalse();
        assertThat(engine.current().orElseThrow().points()).hasSize(2);
    }

    @Test
    @DisplayName("An unavailable anchor collection falls back to configured coordinates")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Anchor embeddings unavailable, using fallback coordinates: timeout")
    void refresh_anchorFallbackOnFailure() throws Exception {
        when(store.sample("anchors", 64)).thenThrow(new SourceUnavailableException("vectors", "timeout"));
        when(store.sample("memories", 100)).thenReturn(List.of(memory("a", DIMENSION, 1f)));
        final ProjectionEngine engine = new ProjectionEngine(store, settings("random"), clock);

        engine.refresh();

        assertThat(engine.current().orElseThrow().anchors().get(0))
            .isEqualTo(new PointCloud.AnchorPoint("Law 0: Humanity", 0.0, 1.5, 0.0));
        assertThat(engine.isStale()).isFalse();
    }

    @Test
    @DisplayName("Anchors missed on the first refresh are read again through the same basis")
    @ExpectLog(level = LogLevel.WARN, messagePattern = "Anchor embeddings unavailable, using fallback coordinates: timeout")
    @ExpectLog(level = LogLevel.INFO, messagePattern = "Anchor embeddings available again, projected 4 anchor\\(s\\)")
    void refresh_retriesAnchorsAfterFailure() throws Exception {
        final float[] humanity = vector(DIMENSION, 0.5f);
        when(store.sample("anchors", 64))
            .thenThrow(new SourceUnavailableException("vectors", "timeout"))
            .thenReturn(List.of(new VectorRecord("x", humanity, Map.of("label", "Law 0: Humanity"))));
        when(store.sample("memories", 100)).thenReturn(List.of(memory("a", DIMENSION, 1f)));
        final ProjectionEngine engine = new ProjectionEngine(store, settings("random"), clock);

        engine.refresh();
        final ProjectionBasis basis = engine.basis().orElseThrow();
        assertThat(engine.current().orElseThrow().anchors().get(0))
            .isEqualTo(new PointCloud.AnchorPoint("Law 0: Humanity", 0.0, 1.5, 0.0));

        engine.refresh();
        engine.refresh();

        assertThat(engine.basis()).get().isSameAs(basis);
        final double[] projected = basis.project(humanity);
        assertThat(engine.current().orElseThrow().anchors().get(0))
            .isEqualTo(new PointCloud.AnchorPoint("Law 0: Humanity", projected[0], projected[1], projected[2]));
        verify(store, times(2)).sample("anchors", 64);
    }

    @ParameterizedTest(name = "{0}")
    @ValueSource(strings = {"random", "pca"})
    @DisplayName("Points keep their coordinates while the store population is unchanged")
    void refresh_pointsAreStableAcrossRefreshes(final String type) throws Exception {
        when(store.sample("memories", 100)).thenReturn(List.of(
            memory("a", DIMENSION, 1f),
            memory("b", DIMENSION, -1.5f),
            memory("c", DIMENSION, 2.5f),
            memory("d", DIMENSION, 0.25f)));
        final ProjectionEngine engine = new ProjectionEngine(store, settings(type), clock);

        engine.refresh();
        final List<PointCloud.VectorPoint> first = engine.current().orElseThrow().points();
        for (int i = 0; i < 3; i++) {
            clock.advance(Duration.ofSeconds(2));
            engine.refresh();
        }
        final List<PointCloud.VectorPoint> last = engine.current().orElseThrow().points();

        assertThat(last).hasSameSizeAs(first);
        for (int i = 0; i < first.size(); i++) {
            assertThat(last.get(i).id()).isEqualTo(first.get(i).id());
            assertThat(last.get(i).x()).isCloseTo(first.get(i).x(), within(1e-9));
            assertThat(last.get(i).y()).isCloseTo(first.get(i).y(), within(1e-9));
            assertThat(last.get(i).z()).isCloseTo(first.get(i).z(), within(1e-9));
        }
        assertThat(engine.current().orElseThrow().projectionType()).isEqualTo(type);
    }

    @Test
    @DisplayName("PCA waits for samples before fixing its basis")
    void refresh_pcaWithoutSamplesPublishesAnchorsOnly() throws Exception {
        when(store.sample("memories", 100)).thenReturn(List.of());
        final ProjectionEngine engine = new ProjectionEngine(store, settings("pca"), clock);

        engine.refresh();

        final PointCloud empty = engine.current().orElseThrow();
        assertThat(empty.points()).isEmpty();
        assertThat(empty.anchors()).hasSize(4);
        assertThat(empty.projectionType()).isEqualTo("pca");
        assertThat(engine.basis()).isEmpty();

        doReturn(List.of(memory("a", DIMENSION, 1f), memory("b", DIMENSION, -1f), memory("c", DIMENSION, 2f)))
            .when(store).sample("memories", 100);
        engine.refresh();

        assertThat(engine.basis()).get().isInstanceOf(PcaProjectionBasis.class);
        assertThat(engine.current().orElseThrow().points()).hasSize(3);
    }

    @Test
    @ExpectLog(level = LogLevel.INFO, messagePattern = "Projection basis reset")
    void reset_establishesNewBasisOnNextRefresh() throws Exception {
        when(store.sample("memories", 100)).thenReturn(List.of(memory("a", DIMENSION, 1f)));
        final ProjectionEngine engine = new ProjectionEngine(store, settings("random"), clock);
        engine.refresh();

        engine.reset();
        assertThat(engine.basis()).isEmpty();
        assertThat(engine.current()).isPresent();

        engine.refresh();
        assertThat(engine.basis()).isPresent();
        verify(store, times(2)).sample("anchors", 64);
    }

    @Test
    void ageSeconds_handlesMissingUnparsableAndFutureTimestamps() {
        assertThat(ProjectionEngine.ageSeconds("2026-01-01T00:00:00Z", NOW)).isEqualTo(90);
        assertThat(ProjectionEngine.ageSeconds("2026-01-01T01:00:00+01:00", NOW)).isEqualTo(90);
        assertThat(ProjectionEngine.ageSeconds(null, NOW)).isZero();
        assertThat(ProjectionEngine.ageSeconds("yesterday", NOW)).isZero();
        assertThat(ProjectionEngine.ageSeconds("2027-01-01T00:00:00Z", NOW)).isZero();
    }

    @Test
    void settings_fromConfig() {
        final ProjectionSettings defaults = ProjectionSettings.fromConfig(ConfigFactory.empty());
        assertThat(defaults.type()).isEqualTo("random");
        assertThat(defaults.dimension()).isEqualTo(384);
        assertThat(defaults.anchors()).isEqualTo(AnchorDefinition.DEFAULTS);

        final ProjectionSettings custom = ProjectionSettings.fromConfig(ConfigFactory.parseString("""
            type = PCA
            anchors = [ { label = "North", x = 0, y = 2, z = 0 } ]
            """));
        assertThat(custom.type()).isEqualTo("pca");
        assertThat(custom.anchors()).containsExactly(new AnchorDefinition("North", 0, 2, 0));

        assertThatThrownBy(() -> ProjectionSettings.fromConfig(ConfigFactory.parseMap(Map.of("type", "tsne"))))
            .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> ProjectionSettings.fromConfig(ConfigFactory.parseMap(Map.of("dimension", 2))))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
