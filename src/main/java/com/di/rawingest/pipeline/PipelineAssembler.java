package com.di.rawingest.pipeline;

import com.di.rawingest.schema.SchemaSpec;
import com.di.rawingest.schema.TableRef;
import org.apache.beam.sdk.options.PipelineOptions;

/**
 * Builds the ingest graph for one file and runs it to completion.
 */
public interface PipelineAssembler {

    /**
     * Blocks until every record has been written, or throws. Failures are not retried and
     * rows already written are left in place.
     *
     * @param options     execution settings (runner, project, temp location, ...)
     * @param inputPath   local path or {@code gs://} URI of the CSV file
     * @param destination BigQuery table the rows are appended to
     * @param schema      declared columns of the file
     */
    void build(PipelineOptions options, String inputPath, TableRef destination, SchemaSpec schema);
}
