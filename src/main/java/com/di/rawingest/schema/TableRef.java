package com.di.rawingest.schema;

import com.google.api.services.bigquery.model.TableReference;
import com.google.cloud.bigquery.TableId;

import java.io.Serializable;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Fully qualified BigQuery table: {@code project.dataset.table} or {@code project:dataset.table}.
 * Domain-scoped projects ({@code example.com:proj.dataset.table}) are accepted.
 * The project may be omitted ({@code dataset.table}); the BigQuery client's or pipeline's
 * default project is then used.
 */
public final class TableRef implements Serializable {

    // Project: plain id, or domain-scoped id whose domain has at least one dot (example.com:proj).
    private static final Pattern TABLE_SPEC = Pattern.compile(
            "^(?:(?<project>(?:[^:.]+(?:\\.[^:.]+)+:)?[^:.]+)[:.])?(?<dataset>[A-Za-z0-9_]+)\\.(?<table>[^.:]+)$");

    private final String project;
    private final String dataset;
    private final String table;

    private TableRef(String project, String dataset, String table) {
        this.project = project;
        this.dataset = dataset;
        this.table = table;
    }

    /**
     * @throws IllegalArgumentException if {@code spec} is not a dataset.table reference with an optional project
     */
    public static TableRef parse(String spec) {
        if (spec == null || spec.isBlank()) {
            throw new IllegalArgumentException("Destination table cannot be null or empty");
        }
        Matcher m = TABLE_SPEC.matcher(spec.trim());
        if (!m.matches()) {
            throw new IllegalArgumentException(
                    "Invalid destination table '" + spec + "': expected project.dataset.table");
        }
        return new TableRef(m.group("project"), m.group("dataset"), m.group("table"));
    }

    /** Project id, or {@code null} when the reference relies on the default project. */
    public String getProject() {
        return project;
    }

    public String getDataset() {
        return dataset;
    }

    public String getTable() {
        return table;
    }

    public boolean hasProject() {
        return project != null;
    }

    /** Identifier for the BigQuery client library (catalog lookups). */
    public TableId toTableId() {
        return hasProject() ? TableId.of(project, dataset, table) : TableId.of(dataset, table);
    }

    /** Reference for {@code BigQueryIO}; a null project is filled from the pipeline options. */
    public TableReference toTableReference() {
        return new TableReference()
                .setProjectId(project)
                .setDatasetId(dataset)
                .setTableId(table);
    }

    @Override
    public String toString() {
        return hasProject() ? project + "." + dataset + "." + table : dataset + "." + table;
    }
}
