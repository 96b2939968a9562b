package com.routine.loader.parser;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import com.routine.loader.model.RoutineSource;

import lombok.NoArgsConstructor;

/**
 * Reads the source file of a stored routine.
 */
@NoArgsConstructor
public class RoutineSourceReader {

    public RoutineSource read(Path path, String extension) throws IOException {
        String text = Files.readString(path, StandardCharsets.UTF_8);

        return RoutineSource.builder()
                .path(path)
                .extension(extension)
                .routineName(routineName(path, extension))
                .text(text)
                .lines(List.of(text.split("\r?\n", -1)))
                .lastModified(lastModified(path))
                .build();
    }

    public long lastModified(Path path) throws IOException {
        return Files.getLastModifiedTime(path).toMillis();
    }

    /**
     * The routine name is the file name without the extension.
     */
    public static String routineName(Path path, String extension) {
        String file = path.getFileName().toString();
        if (file.endsWith(extension) && file.length() > extension.length()) {
            return file.substring(0, file.length() - extension.length());
        }
        return file;
    }
}
