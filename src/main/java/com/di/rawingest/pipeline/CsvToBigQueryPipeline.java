package com.di.rawingest.pipeline;

import com.di.rawingest.exception.PipelineRunException;
import com.di.rawingest.schema.SchemaSpec;
import com.di.rawingest.schema.TableRef;
import com.di.rawingest.transform.CsvRecordTransforms;
import com.google.api.services.bigquery.model.TableRow;
import lombok.extern.slf4j.Slf4j;
import org.apache.beam.sdk.Pipeline;
import org.apache.beam.sdk.PipelineResult;
import org.apache.beam.sdk.io.gcp.bigquery.BigQueryIO;
import org.apache.beam.sdk.io.gcp.bigquery.BigQueryIO.Write.CreateDisposition;
import org.apache.beam.sdk.io.gcp.bigquery.BigQueryIO.Write.WriteDisposition;
import org.apache.beam.sdk.metrics.MetricNameFilter;
import org.apache.beam.sdk.metrics.MetricQueryResults;
import org.apache.beam.sdk.metrics.MetricResult;
import org.apache.beam.sdk.metrics.MetricsFilter;
import org.apache.beam.sdk.options.PipelineOptions;
import org.apache.beam.sdk.values.PCollection;
import org.springframework.stereotype.Component;

import java.util.Objects;
import java.util.stream.StreamSupport;

/**
 * CSV file to BigQuery raw table:
 * <pre>
 *   ReadCSV (header skipped) -> ParseCSV -> AddFileName -> AddIngestionTime -> WriteToBQ
 * </pre>
 * The write appends and creates the table when needed, declaring the file's columns followed by
 * {@code file_name:STRING} and {@code ingestion_time:TIMESTAMP}.
 */
@Component
@Slf4j
public class CsvToBigQueryPipeline implements PipelineAssembler {

    static final int HEADER_LINES = 1;
    static final WriteDisposition WRITE_DISPOSITION = WriteDisposition.WRITE_APPEND;
    static final CreateDisposition CREATE_DISPOSITION = CreateDisposition.CREATE_IF_NEEDED;

    @Override
    public void build(PipelineOptions options, String inputPath, TableRef destination, SchemaSpec schema) {
        Pipeline pipeline = Pipeline.create(options);

        readAndEnrich(pipeline, inputPath, schema)
                .apply("WriteToBQ", writeTo(destination, schema));

        log.info("[PIPELINE] Loading {} into {} (schema: {})", inputPath, destination, schema.toDestinationSchemaString());
        long parsed = runToCompletion(pipeline, inputPath);
        log.info("[PIPELINE] Total records parsed from {}: {}", inputPath, parsed);
    }

    /** ReadCSV and ParseAndEnrich: everything up to the write. */
    static PCollection<TableRow> readAndEnrich(Pipeline pipeline, String inputPath, SchemaSpec schema) {
        return pipeline
                .apply("ReadCSV", CsvRecordTransforms.readLines(inputPath, HEADER_LINES))
                .apply("ParseAndEnrich", CsvRecordTransforms.parseAndEnrich(schema.getColumnNames(), inputPath));
    }

    static BigQueryIO.Write<TableRow> writeTo(TableRef destination, SchemaSpec schema) {
        return BigQueryIO.writeTableRows()
                .to(destination.toTableReference())
                .withSchema(schema.toDestinationTableSchema())
                .withWriteDisposition(WRITE_DISPOSITION)
                .withCreateDisposition(CREATE_DISPOSITION);
    }

    /**
     * Runs the pipeline and blocks until it ends.
     *
     * @return number of records parsed, from the {@code records_parsed} counter
     * @throws PipelineRunException if the pipeline ends in any state other than DONE
     */
    static long runToCompletion(Pipeline pipeline, String inputPath) {
        PipelineResult result = pipeline.run();
        PipelineResult.State state = result.waitUntilFinish();
        if (state != PipelineResult.State.DONE) {
            throw new PipelineRunException("Pipeline for " + inputPath + " ended in state " + state);
        }
        return recordsParsed(result);
    }

    private static long recordsParsed(PipelineResult result) {
        MetricQueryResults mqr = result.metrics().queryMetrics(
                MetricsFilter.builder()
                        .addNameFilter(MetricNameFilter.named(
                                CsvRecordTransforms.METRICS_NAMESPACE, CsvRecordTransforms.RECORDS_PARSED))
                        .build());
        return StreamSupport.stream(mqr.getCounters().spliterator(), false)
                .map(MetricResult::getAttempted)
                .filter(Objects::nonNull)
                .mapToLong(Long::longValue)
                .sum();
    }
}
