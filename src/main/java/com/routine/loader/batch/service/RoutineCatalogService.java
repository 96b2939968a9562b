package com.routine.loader.batch.service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.routine.loader.database.DataLayer;
import com.routine.loader.model.RoutineCatalogEntry;
import com.routine.loader.model.RoutineKind;
import com.routine.loader.model.SessionSettings;
import com.routine.loader.util.SqlValues;

import lombok.RequiredArgsConstructor;

/**
 * Catalog queries that concern all stored routines of the current schema.
 */
@RequiredArgsConstructor
public class RoutineCatalogService {
    private static final Logger log = LoggerFactory.getLogger(RoutineCatalogService.class);

    private static final String ROUTINES_QUERY = """
            select routine_name         as routine_name
            ,      routine_type         as routine_type
            ,      sql_mode             as sql_mode
            ,      character_set_client as character_set_client
            ,      collation_connection as collation_connection
            from   information_schema.ROUTINES
            where  routine_schema = database()
            order by routine_name""";

    private final DataLayer dataLayer;

    /**
     * @return the stored routines currently in the schema, keyed by routine name
     */
    public Map<String, RoutineCatalogEntry> findRoutines() {
        List<Map<String, Object>> rows = dataLayer.executeRows(ROUTINES_QUERY);

        Map<String, RoutineCatalogEntry> routines = new LinkedHashMap<>();
        for (Map<String, Object> row : rows) {
            RoutineCatalogEntry entry = RoutineCatalogEntry.builder()
                    .routineName(SqlValues.asString(row.get("routine_name")))
                    .kind(RoutineKind.fromSql(SqlValues.asString(row.get("routine_type"))))
                    .sqlMode(SqlValues.asString(row.get("sql_mode")))
                    .characterSetClient(SqlValues.asString(row.get("character_set_client")))
                    .collationConnection(SqlValues.asString(row.get("collation_connection")))
                    .build();
            routines.put(entry.getRoutineName(), entry);
        }
        return routines;
    }

    /**
     * Sets the SQL mode and reads it back. The returned settings carry the server's normalized spelling.
     */
    public SessionSettings resolveSessionSettings(SessionSettings configured) {
        dataLayer.executeNone(String.format("set sql_mode = %s", dataLayer.quoteString(configured.getSqlMode())));
        String canonical = SqlValues.asString(dataLayer.executeSingleton0("select @@sql_mode"));
        if (canonical != null && !canonical.equals(configured.getSqlMode())) {
            log.debug("SQL mode '{}' normalized to '{}'", configured.getSqlMode(), canonical);
        }
        return canonical == null ? configured : configured.withSqlMode(canonical);
    }

    public void dropRoutine(RoutineCatalogEntry entry) {
        log.info("Dropping {} {}", entry.getKind().sqlKeyword(), entry.getRoutineName());
        dataLayer.executeNone(String.format("drop %s if exists %s",
                entry.getKind().sqlKeyword(), entry.getRoutineName()));
    }
}
