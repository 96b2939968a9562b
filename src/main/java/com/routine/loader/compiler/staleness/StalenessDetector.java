package com.routine.loader.compiler.staleness;

import java.util.Locale;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.routine.loader.compiler.metadata.BuildMetadata;
import com.routine.loader.model.RoutineCatalogEntry;
import com.routine.loader.model.SessionSettings;

/**
 * Decides whether a stored routine must be (re)loaded. The first rule that fires wins:
 * <ol>
 * <li>the routine has no previous metadata;</li>
 * <li>the source file has been modified;</li>
 * <li>the value of a previously used placeholder has changed or is gone;</li>
 * <li>the routine does not exist in the database;</li>
 * <li>the routine was created under another SQL mode, character set or collation.</li>
 * </ol>
 */
public class StalenessDetector {
    private static final Logger log = LoggerFactory.getLogger(StalenessDetector.class);

    public boolean mustReload(BuildMetadata previous,
                              long lastModified,
                              Map<String, String> replacePairs,
                              RoutineCatalogEntry catalogEntry,
                              SessionSettings settings) {
        if (previous == null) {
            return true;
        }

        String routine = previous.getRoutineName();

        if (previous.getTimestamp() != lastModified) {
            log.debug("{}: source modified", routine);
            return true;
        }

        // Only placeholders recorded by the previous load are checked. A placeholder added to the source
        // comes with a new modification time.
        for (Map.Entry<String, String> entry : previous.getReplace().entrySet()) {
            String current = replacePairs.get(entry.getKey().toUpperCase(Locale.ROOT));
            if (!Objects.equals(current, entry.getValue())) {
                log.debug("{}: value of placeholder {} changed", routine, entry.getKey());
                return true;
            }
        }

        if (catalogEntry == null) {
            log.debug("{}: not found in database", routine);
            return true;
        }

        if (!Objects.equals(catalogEntry.getSqlMode(), settings.getSqlMode())
                || !Objects.equals(catalogEntry.getCharacterSetClient(), settings.getCharacterSet())
                || !Objects.equals(catalogEntry.getCollationConnection(), settings.getCollation())) {
            log.debug("{}: session settings changed", routine);
            return true;
        }

        return false;
    }
}
