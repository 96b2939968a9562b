package com.routine.loader.compiler.metadata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.TreeMap;

import com.routine.loader.compiler.catalog.BulkInsertTable;
import com.routine.loader.compiler.catalog.ReconciledRoutine;
import com.routine.loader.model.Designation;
import com.routine.loader.model.RoutineSource;
import com.routine.loader.parser.RoutineAnnotations;

/**
 * Assembles the metadata of a successfully loaded stored routine.
 */
public class MetadataSynthesizer {

    public BuildMetadata synthesize(RoutineSource source,
                                    RoutineAnnotations annotations,
                                    ReconciledRoutine reconciled,
                                    RoutineDocumentation documentation) {
        Designation designation = annotations.getDesignation();

        BuildMetadata.BuildMetadataBuilder builder = BuildMetadata.builder()
                .routineName(annotations.getHeader().getName())
                .designation(designation.getType())
                .tableName(designation.getTableName())
                .parameters(reconciled.getParameters())
                .columns(designation.getColumns())
                .timestamp(source.getLastModified())
                .replace(new TreeMap<>(annotations.getPlaceholders()))
                .documentation(documentation)
                .extendedParameters(Collections.unmodifiableMap(
                        new LinkedHashMap<>(annotations.getExtendedParameters())));

        reconciled.getBulkInsertTable().ifPresent((BulkInsertTable table) -> builder
                .fields(table.getFields())
                .columnTypes(table.getColumnTypes()));

        return builder.build();
    }
}
