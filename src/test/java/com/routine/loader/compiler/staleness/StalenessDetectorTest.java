package com.routine.loader.compiler.staleness;

import java.util.Map;
import java.util.TreeMap;

import org.junit.jupiter.api.Test;

import com.routine.loader.compiler.metadata.BuildMetadata;
import com.routine.loader.model.DesignationType;
import com.routine.loader.model.RoutineCatalogEntry;
import com.routine.loader.model.RoutineKind;
import com.routine.loader.model.SessionSettings;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for StalenessDetector.
 */
class StalenessDetectorTest {

    private static final long MTIME = 1_700_000_000_000L;
    private static final SessionSettings SETTINGS = new SessionSettings("STRICT_ALL_TABLES", "utf8mb4",
            "utf8mb4_general_ci");

    private final StalenessDetector detector = new StalenessDetector();

    private static BuildMetadata previous(Map<String, String> replace) {
        return BuildMetadata.builder()
                .routineName("tst_routine")
                .designation(DesignationType.ROWS)
                .timestamp(MTIME)
                .replace(new TreeMap<>(replace))
                .build();
    }

    private static RoutineCatalogEntry catalogEntry(String sqlMode, String characterSet, String collation) {
        return RoutineCatalogEntry.builder()
                .routineName("tst_routine")
                .kind(RoutineKind.PROCEDURE)
                .sqlMode(sqlMode)
                .characterSetClient(characterSet)
                .collationConnection(collation)
                .build();
    }

    private static RoutineCatalogEntry upToDateEntry() {
        return catalogEntry("STRICT_ALL_TABLES", "utf8mb4", "utf8mb4_general_ci");
    }

    @Test
    void testStaleWithoutPreviousMetadata() {
        assertThat(detector.mustReload(null, MTIME, Map.of(), upToDateEntry(), SETTINGS)).isTrue();
    }

    @Test
    void testUpToDate() {
        BuildMetadata previous = previous(Map.of("@TST_ID@", "1"));

        assertThat(detector.mustReload(previous, MTIME, Map.of("@TST_ID@", "1"), upToDateEntry(), SETTINGS))
                .isFalse();
    }

    @Test
    void testStaleWhenSourceModified() {
        assertThat(detector.mustReload(previous(Map.of()), MTIME + 1, Map.of(), upToDateEntry(), SETTINGS))
                .isTrue();
    }

    @Test
    void testStaleWhenPlaceholderValueChanged() {
        BuildMetadata previous = previous(Map.of("@TST_ID@", "1"));

        assertThat(detector.mustReload(previous, MTIME, Map.of("@TST_ID@", "2"), upToDateEntry(), SETTINGS))
                .isTrue();
    }

    @Test
    void testStaleWhenPlaceholderRemoved() {
        BuildMetadata previous = previous(Map.of("@TST_ID@", "1"));

        assertThat(detector.mustReload(previous, MTIME, Map.of(), upToDateEntry(), SETTINGS)).isTrue();
    }

    @Test
    void testRecordedPlaceholderIsLookedUpInUpperCase() {
        BuildMetadata previous = previous(Map.of("@tst_id@", "1"));

        assertThat(detector.mustReload(previous, MTIME, Map.of("@TST_ID@", "1"), upToDateEntry(), SETTINGS))
                .isFalse();
    }

    @Test
    void testNewPlaceholdersDoNotMakeStale() {
        BuildMetadata previous = previous(Map.of("@TST_ID@", "1"));

        assertThat(detector.mustReload(previous, MTIME, Map.of("@TST_ID@", "1", "@TST_NEW@", "x"),
                upToDateEntry(), SETTINGS)).isFalse();
    }

    @Test
    void testStaleWhenRoutineMissingFromDatabase() {
        assertThat(detector.mustReload(previous(Map.of()), MTIME, Map.of(), null, SETTINGS)).isTrue();
    }

    @Test
    void testStaleWhenSessionSettingsDiffer() {
        BuildMetadata previous = previous(Map.of());

        assertThat(detector.mustReload(previous, MTIME, Map.of(),
                catalogEntry("ANSI_QUOTES", "utf8mb4", "utf8mb4_general_ci"), SETTINGS)).isTrue();
        assertThat(detector.mustReload(previous, MTIME, Map.of(),
                catalogEntry("STRICT_ALL_TABLES", "latin1", "utf8mb4_general_ci"), SETTINGS)).isTrue();
        assertThat(detector.mustReload(previous, MTIME, Map.of(),
                catalogEntry("STRICT_ALL_TABLES", "utf8mb4", "utf8mb4_bin"), SETTINGS)).isTrue();
    }
}
