package com.di.rawingest;

import com.di.rawingest.config.RawIngestProperties;
import com.di.rawingest.runner.CsvIngestRunnerService;
import com.di.rawingest.runner.IngestOutcome;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.WebApplicationType;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.ConfigurableApplicationContext;

import java.util.ArrayList;
import java.util.List;

/**
 * Loads one CSV file into a BigQuery raw table and exits.
 * <p>
 * Example:
 * <pre>
 * java -jar rawingest.jar --input=gs://raw-bucket/customers.csv \
 *     --rawTable=my-project.raw_data_dataset.customer_raw \
 *     --schema=customer_id:STRING,first_name:STRING,creation_date:TIMESTAMP \
 *     --runner=DataflowRunner --project=my-project --region=europe-west2 --tempLocation=gs://tmp-bucket/temp
 * </pre>
 * Arguments starting with {@code --rawingest.}, {@code --spring.} or {@code --logging.} configure the
 * application; everything else goes to the pipeline.
 */
@SpringBootApplication
@EnableConfigurationProperties(RawIngestProperties.class)
public class RawIngestApplication {

	private static final List<String> APPLICATION_ARG_PREFIXES = List.of("--rawingest.", "--spring.", "--logging.");

	public static void main(String[] args) {
		SpringApplication app = new SpringApplication(RawIngestApplication.class);
		app.setWebApplicationType(WebApplicationType.NONE);

		int exitCode;
		try (ConfigurableApplicationContext ctx = app.run(applicationArgs(args))) {
			IngestOutcome outcome = ctx.getBean(CsvIngestRunnerService.class).run(jobArgs(args));
			exitCode = exitCodeFor(outcome, ctx.getBean(RawIngestProperties.class));
		}
		System.exit(exitCode);
	}

	static int exitCodeFor(IngestOutcome outcome, RawIngestProperties properties) {
		return outcome == IngestOutcome.INPUT_UNREACHABLE ? properties.getExitCodeOnSoftExit() : 0;
	}

	/** Arguments meant for Spring Boot configuration. */
	static String[] applicationArgs(String[] args) {
		List<String> out = new ArrayList<>();
		for (String arg : args) {
			if (isApplicationArg(arg)) {
				out.add(arg);
			}
		}
		return out.toArray(new String[0]);
	}

	/** Arguments meant for the ingest job and Beam. */
	static String[] jobArgs(String[] args) {
		List<String> out = new ArrayList<>();
		for (String arg : args) {
			if (!isApplicationArg(arg)) {
				out.add(arg);
			}
		}
		return out.toArray(new String[0]);
	}

	private static boolean isApplicationArg(String arg) {
		for (String prefix : APPLICATION_ARG_PREFIXES) {
			if (arg.startsWith(prefix)) {
				return true;
			}
		}
		return false;
	}
}
