package com.routine.loader.batch.service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import lombok.NoArgsConstructor;

/**
 * Finds the source files of stored routines.
 */
@NoArgsConstructor
public class RoutineDiscoveryService {

    public List<Path> discoverRoutineFiles(Path sourceDir, String extension, boolean recursive) throws IOException {
        int depth = recursive ? Integer.MAX_VALUE : 1;
        try (Stream<Path> stream = Files.walk(sourceDir, depth)) {
            return stream.filter(Files::isRegularFile)
                    .filter(path -> isRoutineFile(path, extension))
                    .sorted()
                    .collect(Collectors.toList());
        }
    }

    private boolean isRoutineFile(Path path, String extension) {
        String name = path.getFileName().toString();
        return name.endsWith(extension) && name.length() > extension.length();
    }
}
