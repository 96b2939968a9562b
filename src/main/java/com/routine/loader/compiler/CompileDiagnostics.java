package com.routine.loader.compiler;

import java.util.ArrayList;
import java.util.List;

import lombok.Getter;

/**
 * Warnings and errors accumulated while loading one stored routine.
 *
 * Pure structure only: no logging, no formatting, no IO.
 */
@Getter
public class CompileDiagnostics {
    private final List<String> errors = new ArrayList<>();
    private final List<String> warnings = new ArrayList<>();

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }
}
