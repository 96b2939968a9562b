package com.routine.loader.model;

import java.nio.file.Path;
import java.util.List;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

/**
 * Immutable view of the source file of one stored routine.
 */
@Value
@Builder
public class RoutineSource {
    @NonNull
    Path path;
    @NonNull
    String extension;
    @NonNull
    String routineName;
    @NonNull
    String text;
    @NonNull
    List<String> lines;
    long lastModified;

    /**
     * Index of the first line that is exactly {@code begin}, or -1.
     */
    public int beginLineIndex() {
        return lines.indexOf("begin");
    }

    public String fileName() {
        return path.toString();
    }
}
