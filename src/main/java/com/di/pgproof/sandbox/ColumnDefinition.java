package com.di.pgproof.sandbox;

import com.di.pgproof.util.InputValidator;
import lombok.Builder;
import lombok.Value;

/**
 * Column as reported by {@code information_schema.columns}, rendered back into a column definition.
 */
@Value
@Builder
class ColumnDefinition {
    String name;
    String dataType;
    String udtSchema;
    String udtName;
    Integer characterMaximumLength;
    Integer numericPrecision;
    Integer numericScale;
    boolean nullable;

    String toSql() {
        return InputValidator.quoteIdentifier(name) + " " + typeSql() + (nullable ? "" : " NOT NULL");
    }

    String typeSql() {
        switch (dataType) {
            case "ARRAY":
                // udt_name of an array type is the element type with a leading underscore
                return (udtName.startsWith("_") ? udtName.substring(1) : udtName) + "[]";
            case "USER-DEFINED":
                return InputValidator.qualify(udtSchema, udtName);
            case "character varying":
            case "character":
                return characterMaximumLength != null ? dataType + "(" + characterMaximumLength + ")" : dataType;
            case "numeric":
                if (numericPrecision != null && numericScale != null) {
                    return "numeric(" + numericPrecision + "," + numericScale + ")";
                }
                return dataType;
            default:
                return dataType;
        }
    }
}
