package com.routine.loader.model;

import lombok.Builder;
import lombok.Value;

/**
 * A stored routine as currently present in {@code information_schema.ROUTINES}, including the session
 * settings it was created under.
 */
@Value
@Builder
public class RoutineCatalogEntry {
    String routineName;
    RoutineKind kind;
    String sqlMode;
    String characterSetClient;
    String collationConnection;
}
