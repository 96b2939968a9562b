package com.routine.loader.cli;

import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import picocli.CommandLine;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the exit codes of LoadCommand that do not need a database.
 */
class LoadCommandTest {

    @TempDir
    Path tempDir;

    @Test
    void testInvalidOptionsExitWithOne() {
        int exitCode = new CommandLine(new LoadCommand()).execute("--url", "mysql://localhost/test");

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void testUnreachableDatabaseExitsWithOne() {
        int exitCode = new CommandLine(new LoadCommand()).execute(
                "--source-dir", tempDir.toString(),
                "--url", "jdbc:routine-loader-test://localhost/none");

        assertThat(exitCode).isEqualTo(1);
    }

    @Test
    void testHelp() {
        assertThat(new CommandLine(new LoadCommand()).execute("--help")).isZero();
    }
}
