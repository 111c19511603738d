package com.di.rawingest.options;

import org.apache.beam.sdk.options.PipelineOptionsFactory;
import org.apache.beam.sdk.options.StreamingOptions;

/**
 * Builds {@link RawIngestOptions} from job arguments ({@code --name=value}).
 */
public final class RawIngestOptionsParser {

    static {
        PipelineOptionsFactory.register(RawIngestOptions.class);
    }

    private RawIngestOptionsParser() {
    }

    /**
     * @throws IllegalArgumentException if a required option is missing or an option is unknown to Beam
     */
    public static RawIngestOptions parse(String... args) {
        RawIngestOptions options = PipelineOptionsFactory.fromArgs(args)
                .withValidation()
                .as(RawIngestOptions.class);
        // Single file, single pass.
        options.as(StreamingOptions.class).setStreaming(false);
        return options;
    }
}
