package com.routine.loader.compiler.metadata;

import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

import com.routine.loader.model.DesignationType;
import com.routine.loader.model.ExtendedParameter;
import com.routine.loader.model.RoutineParameter;

import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

/**
 * Metadata of a loaded stored routine. It is persisted between runs to decide whether the routine must be
 * reloaded, and it is the input of the wrapper generator.
 */
@Value
@Builder
@Jacksonized
public class BuildMetadata {
    String routineName;
    DesignationType designation;

    // bulk_insert only
    String tableName;

    @Builder.Default
    List<RoutineParameter> parameters = List.of();

    /**
     * Key or index columns for rows_with_key and rows_with_index, field names for bulk_insert.
     */
    @Builder.Default
    List<String> columns = List.of();

    /**
     * Column names of the bulk insert table.
     */
    @Builder.Default
    List<String> fields = List.of();

    /**
     * Base column types of the bulk insert table.
     */
    @Builder.Default
    List<String> columnTypes = List.of();

    /**
     * Modification time of the source file in milliseconds since the epoch.
     */
    long timestamp;

    /**
     * Placeholders used by the source and their values, sorted by placeholder.
     */
    @Builder.Default
    SortedMap<String, String> replace = new TreeMap<>();

    RoutineDocumentation documentation;

    @Builder.Default
    Map<String, ExtendedParameter> extendedParameters = Map.of();
}
