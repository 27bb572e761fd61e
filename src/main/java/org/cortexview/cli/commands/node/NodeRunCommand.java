package org.cortexview.cli.commands.node;

import com.typesafe.config.Config;
import org.cortexview.node.Node;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.ParentCommand;

import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Starts the CortexView node in the foreground. Stop it with Ctrl+C or SIGTERM."
)
public class NodeRunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(NodeRunCommand.class);

    @ParentCommand
    private NodeCommand parent;

    @Override
    public Integer call() {
        final Config config = parent.getParent().getConfig();

        LOGGER.info("Starting node in foreground...");
        final Node node = new Node(config);
        node.start();

        // The shutdown hook registered by the node stops it; keep the main thread alive until then.
        try {
            Thread.currentThread().join();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            node.stop();
        }
        return 0;
    }
}
