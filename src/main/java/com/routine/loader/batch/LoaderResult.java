package com.routine.loader.batch;

import java.util.List;

import com.routine.loader.compiler.CompileResult;

import lombok.Builder;
import lombok.Data;

/**
 * Result of a run of the routine loader.
 */
@Data
@Builder
public class LoaderResult {
    private boolean success;
    private String errorMessage;

    private int routinesFound;
    private int routinesLoaded;
    private int routinesUpToDate;
    private int warningCount;

    @Builder.Default
    private List<CompileResult> failures = List.of();

    @Builder.Default
    private List<String> batchErrors = List.of();

    @Builder.Default
    private List<String> droppedRoutines = List.of();

    public static LoaderResult failure(String errorMessage) {
        return LoaderResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .build();
    }
}
