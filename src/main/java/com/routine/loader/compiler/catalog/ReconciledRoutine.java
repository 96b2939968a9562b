package com.routine.loader.compiler.catalog;

import java.util.List;
import java.util.Optional;

import com.routine.loader.model.RoutineParameter;

import lombok.Value;

/**
 * Parameters of a loaded routine, merged with its extended parameters, and for bulk insert routines the
 * columns of the target table.
 */
@Value
public class ReconciledRoutine {
    List<RoutineParameter> parameters;
    BulkInsertTable bulkInsertTable;

    public Optional<BulkInsertTable> getBulkInsertTable() {
        return Optional.ofNullable(bulkInsertTable);
    }
}
