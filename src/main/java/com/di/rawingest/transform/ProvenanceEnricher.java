package com.di.rawingest.transform;

import com.di.rawingest.schema.SchemaSpec;
import com.di.rawingest.util.GcsPaths;
import com.google.api.services.bigquery.model.TableRow;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;

/**
 * Adds the provenance columns ({@code file_name}, {@code ingestion_time}) to a parsed row.
 * Both methods extend the row they are given and return it.
 */
public final class ProvenanceEnricher {

    /** Local wall-clock time without zone; BigQuery reads it as a TIMESTAMP literal. */
    public static final DateTimeFormatter INGESTION_TIME_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSSSSS");

    private ProvenanceEnricher() {
    }

    /** Stamps the row with the current time. Each call reads the clock again. */
    public static TableRow addIngestionTime(TableRow row) {
        return addIngestionTime(row, LocalDateTime.now());
    }

    public static TableRow addIngestionTime(TableRow row, LocalDateTime ingestionTime) {
        row.set(SchemaSpec.INGESTION_TIME_COLUMN, INGESTION_TIME_FORMAT.format(ingestionTime));
        return row;
    }

    public static TableRow addFileName(TableRow row, String sourcePath) {
        row.set(SchemaSpec.FILE_NAME_COLUMN, GcsPaths.baseName(sourcePath));
        return row;
    }
}
