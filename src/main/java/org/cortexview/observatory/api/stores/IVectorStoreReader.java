package org.cortexview.observatory.api.stores;

import java.util.List;
import java.util.Optional;

/**
 * Read-only access to the vector memory store.
 * <p>
 * Implementations must never issue a mutating request.
 */
public interface IVectorStoreReader {

    /**
     * Returns the number of points in a collection. A collection that does not exist counts as empty.
     *
     * @param collection The collection name.
     * @return The point count.
     * @throws SourceUnavailableException if the store could not be read.
     */
    long countPoints(String collection) throws SourceUnavailableException;

    /**
     * Retrieves a single point by id, payload only.
     *
     * @param collection The collection name.
     * @param pointId    The point id.
     * @return The point, or empty if it does not exist.
     * @throws SourceUnavailableException if the store could not be read.
     */
    Optional<VectorRecord> retrieve(String collection, String pointId) throws SourceUnavailableException;

    /**
     * Samples up to {@code limit} points of a collection including their embeddings and payloads.
     *
     * @param collection The collection name.
     * @param limit      The maximum number of points.
     * @return The sampled points, possibly empty.
     * @throws SourceUnavailableException if the store could not be read.
     */
    List<VectorRecord> sample(String collection, int limit) throws SourceUnavailableException;
}
