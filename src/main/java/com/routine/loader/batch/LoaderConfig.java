package com.routine.loader.batch;

import java.nio.file.Path;
import java.util.List;

import com.routine.loader.model.SessionSettings;

import lombok.Builder;
import lombok.Value;

/**
 * Configuration for a run of the routine loader.
 */
@Value
@Builder
public class LoaderConfig {
    Path sourceDir;
    @Builder.Default
    String extension = ".psql";
    boolean recursive;
    Path metadataFile;
    Path placeholderFile;
    SessionSettings sessionSettings;

    /**
     * Routines to load. Empty means all routines; only then are obsolete routines dropped.
     */
    @Builder.Default
    List<String> routineNames = List.of();

    public boolean isSelectiveLoad() {
        return routineNames != null && !routineNames.isEmpty();
    }
}
