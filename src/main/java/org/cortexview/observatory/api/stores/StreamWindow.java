package org.cortexview.observatory.api.stores;

import java.util.List;

/**
 * The trailing window of a stream as read in one call.
 *
 * @param length  The total number of entries currently held by the stream.
 * @param entries The most recent entries, newest first.
 */
public record StreamWindow(long length, List<StreamRecord> entries) {

    public StreamWindow {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
