package com.routine.loader.compiler.catalog;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.routine.loader.compiler.catalog.exception.RoutineReconciliationException;
import com.routine.loader.compiler.executor.RoutineExecutor;
import com.routine.loader.database.DataLayer;
import com.routine.loader.model.Designation;
import com.routine.loader.model.ExtendedParameter;
import com.routine.loader.model.RoutineParameter;
import com.routine.loader.model.RoutineSource;
import com.routine.loader.parser.RoutineAnnotations;
import com.routine.loader.util.SqlValues;

import lombok.RequiredArgsConstructor;

/**
 * Reads the parameters of a freshly loaded routine back from the database catalog and reconciles them with
 * the annotations found in its source.
 */
@RequiredArgsConstructor
public class CatalogReconciler {
    private static final Logger log = LoggerFactory.getLogger(CatalogReconciler.class);

    private static final Pattern BASE_TYPE_PATTERN = Pattern.compile("\\w+");

    private static final String PARAMETERS_QUERY = """
            select t2.parameter_name     as parameter_name
            ,      t2.data_type          as data_type
            ,      t2.numeric_precision  as numeric_precision
            ,      t2.numeric_scale      as numeric_scale
            ,      t2.character_set_name as character_set_name
            ,      t2.collation_name     as collation_name
            ,      t2.dtd_identifier     as dtd_identifier
            from            information_schema.ROUTINES   t1
            left outer join information_schema.PARAMETERS t2  on  t2.specific_schema = t1.routine_schema and
                                                                  t2.specific_name   = t1.routine_name and
                                                                  t2.parameter_mode  is not null
            where t1.routine_schema = database()
            and   t1.routine_name   = %s
            order by t2.ordinal_position""";

    private static final String TABLE_EXISTS_QUERY = """
            select 1
            from   information_schema.TABLES
            where  table_schema = database()
            and    table_name   = %s""";

    private final DataLayer dataLayer;
    private final RoutineExecutor executor;

    public ReconciledRoutine reconcile(RoutineSource source, RoutineAnnotations annotations) {
        String routineName = annotations.getHeader().getName();

        BulkInsertTable bulkInsertTable = null;
        if (annotations.getDesignation().isBulkInsert()) {
            bulkInsertTable = introspectBulkInsertTable(source, routineName, annotations.getDesignation());
        }

        List<RoutineParameter> parameters = queryParameters(routineName);
        parameters = mergeExtendedParameters(source, parameters, annotations.getExtendedParameters());

        return new ReconciledRoutine(List.copyOf(parameters), bulkInsertTable);
    }

    List<RoutineParameter> queryParameters(String routineName) {
        List<Map<String, Object>> rows = dataLayer.executeRows(
                PARAMETERS_QUERY.formatted(dataLayer.quoteString(routineName)));

        List<RoutineParameter> parameters = new ArrayList<>();
        for (Map<String, Object> row : rows) {
            String name = SqlValues.asString(row.get("parameter_name"));
            if (name == null || name.isEmpty()) {
                // routine without parameters
                continue;
            }

            String characterSet = SqlValues.asString(row.get("character_set_name"));
            String collation = SqlValues.asString(row.get("collation_name"));
            String dtdIdentifier = SqlValues.asString(row.get("dtd_identifier"));

            StringBuilder descriptor = new StringBuilder(dtdIdentifier == null ? "" : dtdIdentifier);
            if (characterSet != null) {
                descriptor.append(" character set ").append(characterSet);
            }
            if (collation != null) {
                descriptor.append(" collation ").append(collation);
            }

            parameters.add(RoutineParameter.builder()
                    .name(name)
                    .dataType(SqlValues.asString(row.get("data_type")))
                    .numericPrecision(SqlValues.asString(row.get("numeric_precision")))
                    .numericScale(SqlValues.asString(row.get("numeric_scale")))
                    .characterSetName(characterSet)
                    .collationName(collation)
                    .dtdIdentifier(dtdIdentifier)
                    .dataTypeDescriptor(descriptor.toString())
                    .build());
        }
        return parameters;
    }

    List<RoutineParameter> mergeExtendedParameters(RoutineSource source,
                                                   List<RoutineParameter> parameters,
                                                   Map<String, ExtendedParameter> extendedParameters) {
        List<RoutineParameter> merged = new ArrayList<>(parameters);
        for (ExtendedParameter extended : extendedParameters.values()) {
            int index = indexOf(merged, extended.getName());
            if (index < 0) {
                throw new RoutineReconciliationException("Specific parameter '%s' does not exist in file '%s'.",
                        extended.getName(), source.fileName());
            }
            merged.set(index, merged.get(index).mergeWith(extended));
        }
        return merged;
    }

    /**
     * A bulk insert routine inserts into either a permanent table or a temporary table created by the routine
     * itself. In the latter case the routine is called once and the temporary table is dropped afterwards.
     */
    BulkInsertTable introspectBulkInsertTable(RoutineSource source, String routineName, Designation designation) {
        String tableName = designation.getTableName();

        boolean permanent = dataLayer.executeSingleton0(
                TABLE_EXISTS_QUERY.formatted(dataLayer.quoteString(tableName))) != null;

        List<Map<String, Object>> columns;
        if (permanent) {
            columns = describe(tableName);
        } else {
            log.debug("Table {} is a temporary table, calling {} to create it", tableName, routineName);
            try (TemporaryTable ignored = new TemporaryTable(tableName)) {
                executor.call(routineName);
                columns = describe(tableName);
            }
        }

        int fieldCount = designation.getColumns().size();
        int columnCount = columns.size();
        if (fieldCount != columnCount) {
            throw new RoutineReconciliationException(
                    "Number of fields %d and number of columns %d don't match in file '%s'.",
                    fieldCount, columnCount, source.fileName());
        }

        List<String> fields = new ArrayList<>();
        List<String> columnTypes = new ArrayList<>();
        for (Map<String, Object> column : columns) {
            fields.add(SqlValues.asString(column.get("Field")));
            columnTypes.add(baseType(SqlValues.asString(column.get("Type"))));
        }

        return new BulkInsertTable(tableName, List.copyOf(fields), List.copyOf(columnTypes));
    }

    private List<Map<String, Object>> describe(String tableName) {
        return dataLayer.executeRows(String.format("describe `%s`", tableName));
    }

    private static String baseType(String columnType) {
        if (columnType == null) {
            return null;
        }
        Matcher matcher = BASE_TYPE_PATTERN.matcher(columnType);
        return matcher.find() ? matcher.group() : columnType;
    }

    private static int indexOf(List<RoutineParameter> parameters, String name) {
        for (int i = 0; i < parameters.size(); i++) {
            if (parameters.get(i).getName().equals(name)) {
                return i;
            }
        }
        return -1;
    }

    /**
     * Drops the temporary table on every exit path.
     */
    private final class TemporaryTable implements AutoCloseable {
        private final String tableName;

        private TemporaryTable(String tableName) {
            this.tableName = tableName;
        }

        @Override
        public void close() {
            dataLayer.executeNone(String.format("drop temporary table if exists `%s`", tableName));
        }
    }
}
