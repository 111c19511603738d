package com.di.rawingest.transform;

import com.google.api.services.bigquery.model.TableRow;
import org.apache.beam.sdk.io.FileIO;
import org.apache.beam.sdk.io.gcp.bigquery.TableRowJsonCoder;
import org.apache.beam.sdk.metrics.Counter;
import org.apache.beam.sdk.metrics.Metrics;
import org.apache.beam.sdk.transforms.DoFn;
import org.apache.beam.sdk.transforms.PTransform;
import org.apache.beam.sdk.transforms.ParDo;
import org.apache.beam.sdk.values.PBegin;
import org.apache.beam.sdk.values.PCollection;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.channels.Channels;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Beam building blocks of the ingest graph: reading the CSV lines and turning them into
 * provenance-tagged {@link TableRow}s.
 * <p>
 * Every DoFn here is stateless per element. Rows coming in are copied before being extended,
 * since Beam does not allow a DoFn to modify its input.
 */
public final class CsvRecordTransforms {

    public static final String METRICS_NAMESPACE = "rawingest";
    public static final String RECORDS_PARSED = "records_parsed";

    private CsvRecordTransforms() {
    }

    public static ReadCsvLines readLines(String inputPath, int headerLines) {
        return new ReadCsvLines(inputPath, headerLines);
    }

    public static ParseAndEnrich parseAndEnrich(List<String> fieldNames, String sourcePath) {
        return new ParseAndEnrich(fieldNames, sourcePath);
    }

    /** Reads every line of a single file, skipping the first {@code headerLines}. */
    public static class ReadCsvLines extends PTransform<PBegin, PCollection<String>> {
        private final String inputPath;
        private final int headerLines;

        ReadCsvLines(String inputPath, int headerLines) {
            this.inputPath = inputPath;
            this.headerLines = headerLines;
        }

        @Override
        public PCollection<String> expand(PBegin input) {
            return input
                    .apply("MatchInput", FileIO.match().filepattern(inputPath))
                    .apply("OpenInput", FileIO.readMatches())
                    .apply("ReadLines", ParDo.of(new ReadLinesFn(headerLines)));
        }
    }

    /** ParseCSV, then AddFileName, then AddIngestionTime. */
    public static class ParseAndEnrich extends PTransform<PCollection<String>, PCollection<TableRow>> {
        private final List<String> fieldNames;
        private final String sourcePath;

        ParseAndEnrich(List<String> fieldNames, String sourcePath) {
            this.fieldNames = new ArrayList<>(fieldNames);
            this.sourcePath = sourcePath;
        }

        @Override
        public PCollection<TableRow> expand(PCollection<String> lines) {
            return lines
                    .apply("ParseCSV", ParDo.of(new ParseCsvLineFn(fieldNames)))
                    .setCoder(TableRowJsonCoder.of())
                    .apply("AddFileName", ParDo.of(new AddFileNameFn(sourcePath)))
                    .setCoder(TableRowJsonCoder.of())
                    .apply("AddIngestionTime", ParDo.of(new AddIngestionTimeFn()))
                    .setCoder(TableRowJsonCoder.of());
        }
    }

    public static class ReadLinesFn extends DoFn<FileIO.ReadableFile, String> {
        private final int headerLines;

        public ReadLinesFn(int headerLines) {
            this.headerLines = headerLines;
        }

        @ProcessElement
        public void processElement(@Element FileIO.ReadableFile file, OutputReceiver<String> out) throws IOException {
            try (BufferedReader reader = new BufferedReader(
                    Channels.newReader(file.open(), StandardCharsets.UTF_8.name()))) {
                int skipped = 0;
                String line;
                while ((line = reader.readLine()) != null) {
                    if (skipped < headerLines) {
                        skipped++;
                        continue;
                    }
                    out.output(line);
                }
            }
        }
    }

    public static class ParseCsvLineFn extends DoFn<String, TableRow> {
        private final Counter parsed = Metrics.counter(METRICS_NAMESPACE, RECORDS_PARSED);
        private final ArrayList<String> fieldNames;

        public ParseCsvLineFn(List<String> fieldNames) {
            this.fieldNames = new ArrayList<>(fieldNames);
        }

        @ProcessElement
        public void processElement(@Element String line, OutputReceiver<TableRow> out) {
            out.output(CsvRecordParser.parse(line, fieldNames));
            parsed.inc();
        }
    }

    public static class AddFileNameFn extends DoFn<TableRow, TableRow> {
        private final String sourcePath;

        public AddFileNameFn(String sourcePath) {
            this.sourcePath = sourcePath;
        }

        @ProcessElement
        public void processElement(@Element TableRow row, OutputReceiver<TableRow> out) {
            out.output(ProvenanceEnricher.addFileName(row.clone(), sourcePath));
        }
    }

    public static class AddIngestionTimeFn extends DoFn<TableRow, TableRow> {
        @ProcessElement
        public void processElement(@Element TableRow row, OutputReceiver<TableRow> out) {
            out.output(ProvenanceEnricher.addIngestionTime(row.clone()));
        }
    }
}
