package org.cortexview.node.processes.observatory;

import com.typesafe.config.ConfigFactory;
import org.cortexview.junit.extensions.logging.LogWatchExtension;
import org.cortexview.observatory.Observatory;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Tag("unit")
@ExtendWith(LogWatchExtension.class)
class ObservatoryProcessTest {

    @Test
    @DisplayName("The process exposes its observatory as a service")
    void getExposedService_returnsObservatory() {
        final ObservatoryProcess process = new ObservatoryProcess("observatory", Map.of(), ConfigFactory.empty());
        try {
            assertThat(process.getExposedService()).isInstanceOf(Observatory.class);
            assertThat(process.getProcessName()).isEqualTo("observatory");
            assertThat(((Observatory) process.getExposedService()).isRunning()).isFalse();
        } finally {
            process.stop();
        }
    }

    @Test
    @DisplayName("Invalid options fail process creation")
    void constructor_rejectsInvalidOptions() {
        assertThatThrownBy(() -> new ObservatoryProcess("observatory", Map.of(),
            ConfigFactory.parseString("broadcast.queueDepth = 0")))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("queueDepth");
    }
}
