package com.routine.loader.compiler;

import java.nio.file.Path;
import java.util.List;

import com.routine.loader.compiler.metadata.BuildMetadata;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of loading one stored routine.
 */
@Value
@Builder
public class CompileResult {

    public enum Status {
        /**
         * The routine has been (re)loaded; {@link #getMetadata()} is the new metadata.
         */
        LOADED,

        /**
         * Nothing changed; {@link #getMetadata()} is the previous metadata.
         */
        UP_TO_DATE,

        /**
         * Loading failed; the previous metadata remains valid.
         */
        FAILED
    }

    Status status;
    String routineName;
    Path sourceFile;
    BuildMetadata metadata;
    @Builder.Default
    List<String> warnings = List.of();
    String errorMessage;

    public boolean isSuccess() {
        return status != Status.FAILED;
    }

    public static CompileResult loaded(Path sourceFile, BuildMetadata metadata, List<String> warnings) {
        return CompileResult.builder()
                .status(Status.LOADED)
                .routineName(metadata.getRoutineName())
                .sourceFile(sourceFile)
                .metadata(metadata)
                .warnings(List.copyOf(warnings))
                .build();
    }

    public static CompileResult upToDate(Path sourceFile, BuildMetadata previous) {
        return CompileResult.builder()
                .status(Status.UP_TO_DATE)
                .routineName(previous.getRoutineName())
                .sourceFile(sourceFile)
                .metadata(previous)
                .build();
    }

    public static CompileResult failure(String routineName, Path sourceFile, String errorMessage,
                                        List<String> warnings) {
        return CompileResult.builder()
                .status(Status.FAILED)
                .routineName(routineName)
                .sourceFile(sourceFile)
                .errorMessage(errorMessage)
                .warnings(List.copyOf(warnings))
                .build();
    }
}
