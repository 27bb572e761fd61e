package org.cortexview.observatory.resources;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.cortexview.observatory.api.stores.IVectorStoreReader;
import org.cortexview.observatory.api.stores.SourceUnavailableException;
import org.cortexview.observatory.api.stores.VectorRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only client for the Qdrant REST API. Only the collection info, point retrieval and
 * scroll endpoints are used; none of them mutate the store.
 * <p>
 * Configuration:
 * <pre>
 * vectors {
 *   url = "http://localhost:6333"
 *   timeoutMs = 150
 *   apiKey = ""          # sent as 'api-key' header when non-empty
 *   vectorName = ""      # name of the dense vector for collections with named vectors
 * }
 * </pre>
 * <p>
 * Thread Safety: instances are thread-safe; the underlying {@link HttpClient} is shared.
 */
public class QdrantVectorStore extends AbstractStoreResource implements IVectorStoreReader {

    private static final Logger LOGGER = LoggerFactory.getLogger(QdrantVectorStore.class);
    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() { };

    private final URI baseUri;
    private final Duration timeout;
    private final String apiKey;
    private final String vectorName;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * Creates the client. No request is sent until the first read.
     *
     * @param name    The store name.
     * @param options The store configuration.
     * @throws IllegalArgumentException if the URL or timeout is invalid.
     */
    public QdrantVectorStore(final String name, final Config options) {
        super(name, options.withFallback(defaults()));
        try {
            this.baseUri = parseUri(this.options.getString("url"));
            final int timeoutMs = this.options.getInt("timeoutMs");
            if (timeoutMs <= 0) {
                throw new IllegalArgumentException("timeoutMs must be positive for vector store '" + name + "'.");
            }
            this.timeout = Duration.ofMillis(timeoutMs);
            this.apiKey = this.options.getString("apiKey");
            this.vectorName = this.options.getString("vectorName");
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid configuration for vector store '" + name + "'", e);
        }
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(timeout)
            .version(HttpClient.Version.HTTP_1_1)
            .build();
    }

    private static Config defaults() {
        return ConfigFactory.parseMap(Map.of(
            "url", "http://localhost:6333",
            "timeoutMs", 150,
            "apiKey", "",
            "vectorName", ""
        ));
    }

    static URI parseUri(final String url) {
        final URI uri;
        try {
            uri = URI.create(url.endsWith("/") ? url.substring(0, url.length() - 1) : url);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unparsable vector store URL: " + url, e);
        }
        if (!"http".equals(uri.getScheme()) && !"https".equals(uri.getScheme())) {
            throw new IllegalArgumentException("Vector store URL must use http:// or https://: " + url);
        }
        if (uri.getHost() == null) {
            throw new IllegalArgumentException("Vector store URL has no host: " + url);
        }
        return uri;
    }

    @Override
    public long countPoints(final String collection) throws SourceUnavailableException {
        final HttpRequest request = requestBuilder("/collections/" + encode(collection)).GET().build();
        final JsonNode body = send(request, collection);
        if (body == null) {
            return 0L;
        }
        return body.path("result").path("points_count").asLong(0L);
    }

    @Override
    public Optional<VectorRecord> retrieve(final String collection, final String pointId) throws SourceUnavailableException {
        final ObjectNode query = mapper.createObjectNode();
        query.putArray("ids").add(pointId);
        query.put("with_payload", true);
        query.put("with_vector", false);

        final JsonNode body = send(post("/collections/" + encode(collection) + "/points", query), collection);
        if (body == null) {
            return Optional.empty();
        }
        final JsonNode result = body.path("result");
        if (!result.isArray() || result.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(toRecord(result.get(0)));
    }

    @Override
    public List<VectorRecord> sample(final String collection, final int limit) throws SourceUnavailableException {
        final ObjectNode query = mapper.createObjectNode();
        query.put("limit", limit);
        query.put("with_payload", true);
        query.put("with_vector", true);

        final JsonNode body = send(post("/collections/" + encode(collection) + "/points/scroll", query), collection);
        if (body == null) {
            return Collections.emptyList();
        }
        final JsonNode points = body.path("result").path("points");
        final List<VectorRecord> records = new ArrayList<>(points.size());
        for (final JsonNode point : points) {
            records.add(toRecord(point));
        }
        return records;
    }

    /**
     * Sends a request and parses the JSON body.
     *
     * @return The parsed body, or null if the collection does not exist (HTTP 404).
     */
    private JsonNode send(final HttpRequest request, final String collection) throws SourceUnavailableException {
        countRequest();
        try {
            final HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() == 404) {
                markSuccess();
                LOGGER.debug("Collection '{}' does not exist", collection);
                return null;
            }
            if (response.statusCode() / 100 != 2) {
                throw unavailable("BAD_STATUS",
                    "Vector store answered " + response.statusCode() + " for " + request.uri().getPath(), null);
            }
            final JsonNode body = mapper.readTree(response.body());
            markSuccess();
            return body;
        } catch (IOException e) {
            LOGGER.debug("Request {} failed: {}", request.uri(), e.getMessage());
            throw unavailable("REQUEST_FAILED", "Vector store request to " + request.uri().getPath() + " failed", e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw unavailable("INTERRUPTED", "Vector store request to " + request.uri().getPath() + " was interrupted", e);
        }
    }

    private HttpRequest post(final String path, final JsonNode body) {
        return requestBuilder(path)
            .header("Content-Type", "application/json")
            .POST(HttpRequest.BodyPublishers.ofString(body.toString()))
            .build();
    }

    private HttpRequest.Builder requestBuilder(final String path) {
        final HttpRequest.Builder builder = HttpRequest.newBuilder(URI.create(baseUri + path))
            .timeout(timeout)
            .header("Accept", "application/json");
        if (!apiKey.isEmpty()) {
            builder.header("api-key", apiKey);
        }
        return builder;
    }

    private VectorRecord toRecord(final JsonNode point) {
        final String id = point.path("id").asText();
        final JsonNode payloadNode = point.path("payload");
        final Map<String, Object> payload = payloadNode.isObject()
            ? mapper.convertValue(payloadNode, PAYLOAD_TYPE)
            : Map.of();
        return new VectorRecord(id, extractVector(point.path("vector")), payload);
    }

    private float[] extractVector(final JsonNode vectorNode) {
        JsonNode dense = vectorNode;
        if (vectorNode.isObject()) {
            dense = null;
            if (!vectorName.isEmpty()) {
                dense = vectorNode.get(vectorName);
            } else {
                final Iterator<JsonNode> values = vectorNode.elements();
                while (values.hasNext() && dense == null) {
                    final JsonNode candidate = values.next();
                    if (candidate.isArray()) {
                        dense = candidate;
                    }
                }
            }
        }
        if (dense == null || !dense.isArray()) {
            return new float[0];
        }
        final float[] vector = new float[dense.size()];
        for (int i = 0; i < vector.length; i++) {
            vector[i] = (float) dense.get(i).asDouble();
        }
        return vector;
    }

    private static String encode(final String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8);
    }

    public URI getBaseUri() {
        return baseUri;
    }
}
