package com.routine.loader.compiler.executor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.HashMap;
import java.util.Map;

import com.routine.loader.database.DataLayer;
import com.routine.loader.model.RoutineSource;

/**
 * Placeholders whose values come from the routine being loaded instead of from configuration. They exist only
 * while the create statement is built.
 */
public final class MagicConstants {

    public static final String FILE = "__FILE__";
    public static final String ROUTINE = "__ROUTINE__";
    public static final String DIR = "__DIR__";
    public static final String LINE = "__LINE__";

    private MagicConstants() {
    }

    /**
     * Returns the placeholders plus {@link #FILE}, {@link #ROUTINE} and {@link #DIR}. {@link #LINE} is bound
     * per line by the caller.
     */
    public static Map<String, String> withMagicConstants(Map<String, String> placeholders,
                                                         RoutineSource source,
                                                         DataLayer dataLayer) {
        Path realPath = realPath(source.getPath());
        Path dir = realPath.getParent();

        Map<String, String> replace = new HashMap<>(placeholders);
        replace.put(FILE, dataLayer.quoteString(realPath.toString()));
        replace.put(ROUTINE, dataLayer.quoteString(source.getRoutineName()));
        replace.put(DIR, dataLayer.quoteString(dir == null ? "" : dir.toString()));
        return replace;
    }

    private static Path realPath(Path path) {
        try {
            return path.toRealPath();
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to resolve real path of " + path, e);
        }
    }
}
