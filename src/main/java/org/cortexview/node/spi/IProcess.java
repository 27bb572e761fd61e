package org.cortexview.node.spi;

/**
 * A long-running process managed by the {@link org.cortexview.node.Node}.
 */
public interface IProcess {

    /**
     * Starts the process. Must not block; continuous work runs on the process's own threads.
     */
    void start();

    /**
     * Stops the process and releases its resources.
     */
    void stop();
}
