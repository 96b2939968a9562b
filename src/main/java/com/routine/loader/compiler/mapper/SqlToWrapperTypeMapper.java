package com.routine.loader.compiler.mapper;

import com.routine.loader.model.RoutineParameter;

import lombok.experimental.UtilityClass;

@UtilityClass
public class SqlToWrapperTypeMapper {

    public static final String LIST_OF_INT = "list_of_int";

    /**
     * Maps the data type of a routine parameter to its wrapper type.
     *
     * @throws UnsupportedColumnTypeException for any data type not listed here
     */
    public WrapperType toWrapperType(RoutineParameter parameter) {
        return toWrapperType(parameter.getDataType(), parameter.getNumericScale(), parameter.getName());
    }

    public WrapperType toWrapperType(String dataType, String numericScale, String parameterName) {
        if (dataType == null) {
            throw new UnsupportedColumnTypeException(null, parameterName);
        }
        return switch (dataType) {
            case "tinyint", "smallint", "mediumint", "int", "bigint",
                 "year",
                 "bit" -> WrapperType.INTEGER;

            case "decimal" -> "0".equals(numericScale) ? WrapperType.INTEGER : WrapperType.FLOAT;

            case "float", "double" -> WrapperType.FLOAT;

            case "varbinary", "binary",
                 "char", "varchar",
                 "time", "timestamp",
                 "date", "datetime",
                 "enum", "set",
                 "tinytext", "text", "mediumtext", "longtext",
                 "tinyblob", "blob", "mediumblob", "longblob" -> WrapperType.TEXT;

            case LIST_OF_INT -> WrapperType.TEXT_OR_INTEGER_LIST;

            default -> throw new UnsupportedColumnTypeException(dataType, parameterName);
        };
    }
}
