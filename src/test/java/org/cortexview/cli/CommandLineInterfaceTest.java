package org.cortexview.cli;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@Tag("unit")
class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    @Test
    @DisplayName("The command line is named cortexview")
    void createCommandLine_hasCommandName() {
        final CommandLine cmd = CommandLineInterface.createCommandLine();

        assertThat(cmd.getCommandName()).isEqualTo("cortexview");
        assertThat(cmd.getSubcommands()).containsKey("node");
        assertThat(cmd.getSubcommands().get("node").getSubcommands()).containsKey("run");
    }

    @Test
    @DisplayName("A missing configuration file exits with the configuration error code")
    void execute_missingConfigFileExitsWithTwo() {
        final CommandLine cmd = CommandLineInterface.createCommandLine();
        final StringWriter err = new StringWriter();
        cmd.setErr(new PrintWriter(err));

        final int exitCode = cmd.execute("-c", tempDir.resolve("missing.conf").toString(), "node", "run");

        assertThat(exitCode).isEqualTo(2);
        assertThat(err.toString()).contains("Configuration file not found");
    }

    @Test
    @DisplayName("Without a subcommand the usage is printed")
    void execute_withoutSubcommandSucceeds() {
        final int exitCode = CommandLineInterface.createCommandLine().execute();

        assertThat(exitCode).isZero();
    }
}
