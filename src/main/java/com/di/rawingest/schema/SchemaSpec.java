package com.di.rawingest.schema;

import com.google.api.services.bigquery.model.TableFieldSchema;
import com.google.api.services.bigquery.model.TableSchema;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Destination schema as supplied on the command line: {@code col1:STRING,col2:DATE,...}.
 * <p>
 * Column names drive line parsing; names plus type tags declare the BigQuery table.
 * The original string is kept verbatim because the write declaration is built by appending
 * the provenance columns to it. Names and types are taken exactly as written: whitespace around
 * either is rejected rather than trimmed, so the verbatim string and the parsed columns always agree.
 */
public final class SchemaSpec implements Serializable {

    public static final String FILE_NAME_COLUMN = "file_name";
    public static final String INGESTION_TIME_COLUMN = "ingestion_time";

    /** Appended to the declared schema for every write, in this order. */
    public static final String PROVENANCE_COLUMNS =
            "," + FILE_NAME_COLUMN + ":STRING," + INGESTION_TIME_COLUMN + ":TIMESTAMP";

    private static final String FIELD_MODE = "NULLABLE";

    private final String spec;
    private final List<ColumnSpec> columns;

    private SchemaSpec(String spec, List<ColumnSpec> columns) {
        this.spec = spec;
        this.columns = Collections.unmodifiableList(columns);
    }

    /**
     * Parses a {@code name:TYPE,...} schema string.
     *
     * @throws IllegalArgumentException if the string is blank, an entry is not a single
     *                                  {@code name:TYPE} pair, a name or type has surrounding
     *                                  whitespace, or a column name repeats
     */
    public static SchemaSpec parse(String spec) {
        return new SchemaSpec(spec, parseColumns(spec));
    }

    /**
     * Parses a schema string into a BigQuery {@link TableSchema}, every field {@code NULLABLE}.
     */
    public static TableSchema toTableSchema(String spec) {
        List<TableFieldSchema> fields = new ArrayList<>();
        for (ColumnSpec column : parseColumns(spec)) {
            fields.add(new TableFieldSchema()
                    .setName(column.name())
                    .setType(column.type())
                    .setMode(FIELD_MODE));
        }
        return new TableSchema().setFields(fields);
    }

    private static List<ColumnSpec> parseColumns(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("Schema cannot be null or empty");
        }
        List<ColumnSpec> columns = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (String entry : spec.split(",", -1)) {
            String[] parts = entry.split(":", -1);
            if (parts.length != 2) {
                throw new IllegalArgumentException(String.format(
                        "Invalid schema entry '%s' in '%s': expected name:TYPE", entry, spec));
            }
            String name = parts[0];
            String type = parts[1];
            if (name.isBlank() || type.isBlank()) {
                throw new IllegalArgumentException(String.format(
                        "Invalid schema entry '%s' in '%s': name and type are required", entry, spec));
            }
            if (!name.equals(name.strip()) || !type.equals(type.strip())) {
                throw new IllegalArgumentException(String.format(
                        "Invalid schema entry '%s' in '%s': whitespace around name or type", entry, spec));
            }
            if (!seen.add(name)) {
                throw new IllegalArgumentException(String.format(
                        "Duplicate column '%s' in schema '%s'", name, spec));
            }
            columns.add(new ColumnSpec(name, type));
        }
        return columns;
    }

    /** The schema string exactly as supplied. */
    public String getSpec() {
        return spec;
    }

    public List<ColumnSpec> getColumns() {
        return columns;
    }

    /** Declared column names in declared order (provenance columns excluded). */
    public List<String> getColumnNames() {
        List<String> names = new ArrayList<>(columns.size());
        for (ColumnSpec column : columns) {
            names.add(column.name());
        }
        return names;
    }

    /** Schema string used for the destination: the declared schema followed by the provenance columns. */
    public String toDestinationSchemaString() {
        return spec + PROVENANCE_COLUMNS;
    }

    public TableSchema toDestinationTableSchema() {
        return toTableSchema(toDestinationSchemaString());
    }

    @Override
    public String toString() {
        return spec;
    }
}
