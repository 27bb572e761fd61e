package org.cortexview.node.processes.observatory;

import com.typesafe.config.Config;
import org.cortexview.node.processes.AbstractProcess;
import org.cortexview.node.spi.IServiceProvider;
import org.cortexview.observatory.Observatory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Runs the observation pipeline inside the Node and exposes the {@link Observatory} to
 * dependent processes such as the HTTP server.
 */
public class ObservatoryProcess extends AbstractProcess implements IServiceProvider {

    private static final Logger LOGGER = LoggerFactory.getLogger(ObservatoryProcess.class);

    private final Observatory observatory;

    /**
     * @param processName  The name of this process in the configuration.
     * @param dependencies Unused; the observatory depends on no other process.
     * @param options      The observatory options, see {@link Observatory}.
     * @throws IllegalArgumentException if the options are invalid.
     */
    public ObservatoryProcess(final String processName, final Map<String, Object> dependencies, final Config options) {
        super(processName, dependencies, options);
        this.observatory = Observatory.fromConfig(options);
        LOGGER.debug("Observatory process '{}' initialized", processName);
    }

    @Override
    public void start() {
        observatory.start();
    }

    @Override
    public void stop() {
        observatory.stop();
    }

    @Override
    public Object getExposedService() {
        return observatory;
    }
}
