package com.routine.loader.batch.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for RoutineDiscoveryService.
 */
class RoutineDiscoveryServiceTest {

    @TempDir
    Path tempDir;

    private final RoutineDiscoveryService service = new RoutineDiscoveryService();

    @BeforeEach
    void setUp() throws IOException {
        Files.createDirectories(tempDir.resolve("sub"));
        Files.writeString(tempDir.resolve("tst_b.psql"), "");
        Files.writeString(tempDir.resolve("tst_a.psql"), "");
        Files.writeString(tempDir.resolve("notes.txt"), "");
        Files.writeString(tempDir.resolve(".psql"), "");
        Files.writeString(tempDir.resolve("sub").resolve("tst_c.psql"), "");
    }

    @Test
    void testDiscoverTopLevelOnly() throws IOException {
        assertThat(service.discoverRoutineFiles(tempDir, ".psql", false))
                .containsExactly(tempDir.resolve("tst_a.psql"), tempDir.resolve("tst_b.psql"));
    }

    @Test
    void testDiscoverRecursively() throws IOException {
        assertThat(service.discoverRoutineFiles(tempDir, ".psql", true))
                .containsExactlyInAnyOrder(tempDir.resolve("tst_a.psql"), tempDir.resolve("tst_b.psql"),
                        tempDir.resolve("sub").resolve("tst_c.psql"));
    }
}
