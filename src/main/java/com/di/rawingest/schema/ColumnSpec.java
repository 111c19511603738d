package com.di.rawingest.schema;

import java.io.Serializable;

/**
 * One declared destination column: a name and an opaque BigQuery type tag (e.g. STRING, DATE).
 * The type tag is never interpreted here; it is handed to BigQuery verbatim.
 */
public record ColumnSpec(String name, String type) implements Serializable {
}
