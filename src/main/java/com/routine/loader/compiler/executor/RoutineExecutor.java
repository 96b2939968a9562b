package com.routine.loader.compiler.executor;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.routine.loader.database.DataLayer;
import com.routine.loader.model.RoutineCatalogEntry;
import com.routine.loader.model.RoutineSource;
import com.routine.loader.model.SessionSettings;
import com.routine.loader.parser.RoutineAnnotations;
import com.routine.loader.parser.RoutineHeader;

import lombok.RequiredArgsConstructor;

/**
 * Creates a stored routine in the database from its source.
 */
@RequiredArgsConstructor
public class RoutineExecutor {
    private static final Logger log = LoggerFactory.getLogger(RoutineExecutor.class);

    private final DataLayer dataLayer;

    /**
     * Drops the old routine (if any), sets the session settings and creates the routine.
     */
    public void load(RoutineSource source,
                     RoutineAnnotations annotations,
                     RoutineCatalogEntry catalogEntry,
                     SessionSettings settings) {
        RoutineHeader header = annotations.getHeader();
        log.info("Loading {} {}", header.getKind().sqlKeyword(), header.getName());

        String routineSql = buildCreateStatement(source, annotations.getPlaceholders());

        if (catalogEntry != null) {
            dataLayer.executeNone(String.format("drop %s if exists %s",
                    catalogEntry.getKind().sqlKeyword(), header.getName()));
        }

        dataLayer.executeNone(String.format("set sql_mode = %s", dataLayer.quoteString(settings.getSqlMode())));

        dataLayer.executeNone(String.format("set names %s collate %s",
                dataLayer.quoteString(settings.getCharacterSet()),
                dataLayer.quoteString(settings.getCollation())));

        dataLayer.executeNone(routineSql);
    }

    /**
     * Calls a routine without arguments. Used to materialize the temporary table of a bulk insert routine.
     */
    public void call(String routineName) {
        dataLayer.executeNone("call " + routineName + "()");
    }

    /**
     * Replaces placeholders and magic constants in the source. {@code __LINE__} is the 1-based line number.
     */
    String buildCreateStatement(RoutineSource source, Map<String, String> placeholders) {
        Map<String, String> replace = MagicConstants.withMagicConstants(placeholders, source, dataLayer);
        replace.put(MagicConstants.LINE, "0");
        PlaceholderSubstitutor substitutor = new PlaceholderSubstitutor(replace);

        List<String> lines = source.getLines();
        List<String> substituted = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            replace.put(MagicConstants.LINE, String.valueOf(i + 1));
            substituted.add(substitutor.substitute(lines.get(i)));
        }

        return String.join("\n", substituted);
    }
}
