package com.di.rawingest.options;

import org.apache.beam.sdk.options.Description;
import org.apache.beam.sdk.options.PipelineOptions;
import org.apache.beam.sdk.options.Validation;

/**
 * Command-line options of one ingest run. Runner flags ({@code --runner}, {@code --project},
 * {@code --region}, {@code --tempLocation}, ...) are handled by Beam itself.
 */
public interface RawIngestOptions extends PipelineOptions {

    @Description("Path to CSV file: local path or gs://bucket/path/file.csv")
    @Validation.Required
    String getInput();

    void setInput(String input);

    @Description("BQ raw table: project.dataset.table")
    @Validation.Required
    String getRawTable();

    void setRawTable(String rawTable);

    @Description("Schema: col1:STRING,col2:DATE,...")
    @Validation.Required
    String getSchema();

    void setSchema(String schema);
}
