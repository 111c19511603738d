package com.di.rawingest.runner;

import com.di.rawingest.exception.ErrorCategory;
import com.di.rawingest.options.RawIngestOptions;
import com.di.rawingest.options.RawIngestOptionsParser;
import com.di.rawingest.pipeline.PipelineAssembler;
import com.di.rawingest.precheck.IngestPrechecks;
import com.di.rawingest.schema.SchemaSpec;
import com.di.rawingest.schema.TableRef;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Entry point of one ingest run.
 * <ol>
 *   <li>Input missing: logged as an error, run ends with {@link IngestOutcome#INPUT_UNREACHABLE}.
 *       No catalog lookup and no pipeline.</li>
 *   <li>Destination table missing: logged as a warning; the write creates it.</li>
 *   <li>Otherwise the pipeline is built and run to completion.</li>
 * </ol>
 * Any exception along the way is logged with its message and rethrown as is.
 */
@Service
@Slf4j
public class CsvIngestRunnerService {

    private final IngestPrechecks prechecks;
    private final PipelineAssembler pipelineAssembler;

    public CsvIngestRunnerService(IngestPrechecks prechecks, PipelineAssembler pipelineAssembler) {
        this.prechecks = prechecks;
        this.pipelineAssembler = pipelineAssembler;
    }

    public IngestOutcome run(String... args) {
        String jobId = "job-" + UUID.randomUUID();
        MDC.put("jobId", jobId);
        try {
            RawIngestOptions options = RawIngestOptionsParser.parse(args);
            String input = options.getInput();

            if (!prechecks.inputReachable(input)) {
                log.error("[RUNNER] File {} does not exist", input);
                return IngestOutcome.INPUT_UNREACHABLE;
            }

            TableRef destination = TableRef.parse(options.getRawTable());
            if (!prechecks.destinationExists(destination)) {
                log.warn("[RUNNER] Table {} does not exist. It will be created.", options.getRawTable());
            }

            SchemaSpec schema = SchemaSpec.parse(options.getSchema());
            pipelineAssembler.build(options, input, destination, schema);
            log.info("[RUNNER] Pipeline finished.");
            return IngestOutcome.COMPLETED;
        } catch (RuntimeException e) {
            log.error("[RUNNER] Pipeline error [{}]: {}", ErrorCategory.categorize(e), e.getMessage(), e);
            throw e;
        } finally {
            MDC.remove("jobId");
        }
    }
}
