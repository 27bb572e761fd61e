package org.cortexview.observatory.api.stores;

/**
 * Read-only access to the append-only thought stream.
 */
public interface IStreamStoreReader {

    /**
     * Reads the trailing entries of the thought stream together with its length.
     *
     * @param count The maximum number of entries to return.
     * @return The stream window, entries newest first.
     * @throws SourceUnavailableException if the store could not be read.
     */
    StreamWindow readLatest(int count) throws SourceUnavailableException;
}
