package com.routine.loader.compiler;

import java.nio.file.Path;
import java.util.Map;

import com.routine.loader.compiler.metadata.BuildMetadata;
import com.routine.loader.model.RoutineCatalogEntry;
import com.routine.loader.model.SessionSettings;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Input for loading one stored routine.
 */
@Value
@Builder
public class CompileRequest {
    @NonNull
    Path sourceFile;

    @NonNull
    String extension;

    /**
     * Metadata of the previous load, or {@code null} if the routine was never loaded.
     */
    BuildMetadata previous;

    /**
     * Placeholder values keyed by upper case placeholder, e.g. {@code @TST_ID@}.
     */
    @NonNull
    Map<String, String> replacePairs;

    /**
     * The routine as currently present in the database, or {@code null}.
     */
    RoutineCatalogEntry catalogEntry;

    @NonNull
    SessionSettings sessionSettings;
}
