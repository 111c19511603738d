package com.di.rawingest.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Job settings from application.yml ({@code rawingest.*}).
 * Per-run inputs (file, table, schema) come from the command line instead; see
 * {@link com.di.rawingest.options.RawIngestOptions}.
 */
@Data
@ConfigurationProperties(prefix = "rawingest")
public class RawIngestProperties {

    /**
     * Local mount point of GCS buckets. A {@code gs://} prefix in a local input path is rewritten
     * to this before the local existence check (e.g. {@code gs://b/f.csv} -> {@code /gcs/b/f.csv}).
     */
    private String gcsMountPrefix = "/gcs/";

    /**
     * Process exit code when the run stops early because the input file does not exist.
     * 0 keeps the soft exit indistinguishable from success; set non-zero to let a scheduler notice it.
     */
    private int exitCodeOnSoftExit = 0;
}
