package org.gamma.geobatch;

import org.gamma.geobatch.client.OpenCageGeocoder;
import org.gamma.geobatch.config.AppConfig;
import org.gamma.geobatch.config.BatchSettings;
import org.gamma.geobatch.config.ConfigManager;
import org.gamma.geobatch.config.GeocoderSettings;
import org.gamma.geobatch.error.ErrorClassifier;
import org.gamma.geobatch.error.GeocoderException;
import org.gamma.geobatch.metrics.BatchSummary;
import org.gamma.geobatch.processing.BatchGeocoder;
import org.gamma.geobatch.processing.BatchOptions;
import org.gamma.geobatch.retry.RetryingRequestExecutor;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Command line entry point: geocodes the CSV file named in the YAML configuration.
 * <p>
 * Usage: {@code GeoBatch [config.yaml]}, defaulting to {@code conf/config.yaml}.
 */
public class GeoBatch {

    private final AppConfig appConfig;

    public GeoBatch(final AppConfig appConfig) {
        this.appConfig = Objects.requireNonNull(appConfig, "Configuration cannot be null");
    }

    // --- Main Method ---
    public static void main(final String[] args) {
        final AppConfig appConfig;
        try {
            appConfig = args.length > 0 ? ConfigManager.load(Path.of(args[0])) : ConfigManager.getConfig();
        } catch (IOException e) {
            System.err.println(">>> Could not load configuration: " + e.getMessage());
            System.exit(2);
            return;
        }

        try {
            System.out.println("========================================================");
            System.out.println(" Starting Batch Geocoding ");
            System.out.println("========================================================");

            final BatchSummary summary = new GeoBatch(appConfig).execute();

            System.out.println("\n========================================================");
            System.out.println(" Batch Finished ");
            System.out.println("========================================================");
            printSummary(summary);
        } catch (final GeocoderException e) {
            System.err.println("\n>>> Batch failed: " + e.getMessage());
            System.exit(1);
        }
    }

    public BatchSummary execute() throws GeocoderException {
        final BatchSettings batch = appConfig.batch();
        if (batch == null || batch.input() == null || batch.output() == null) {
            throw GeocoderException.invalidInput("batch.input and batch.output must be configured");
        }
        final GeocoderSettings settings = appConfig.geocoderOrDefaults();
        final BatchOptions options = batch.toBatchOptions();
        final RetryingRequestExecutor executor = new RetryingRequestExecutor(new ErrorClassifier(),
                settings.retryOptions().withMaxRetries(options.retries()));

        final OpenCageGeocoder geocoder = new OpenCageGeocoder(settings, options.workers());
        System.out.printf("Geocoding %s -> %s with %d worker(s)%n", batch.input(), batch.output(), options.workers());
        return new BatchGeocoder(geocoder, options, executor).run(batch.input(), batch.output());
    }

    private static void printSummary(final BatchSummary summary) {
        System.out.println("Total Execution Time: " + summary.duration().toMillis() + " ms");
        System.out.println("---------------------- SUMMARY ----------------------");
        System.out.printf("State: %-9s | Workers: %d%n", summary.state(), summary.workers());
        System.out.printf("Rows read: %d | Queued: %d | Written: %d | Failed: %d | Skipped: %d%n",
                summary.rowsRead(), summary.jobsQueued(), summary.rowsWritten(), summary.rowsFailed(),
                summary.rowsSkipped());
        System.out.println("-----------------------------------------------------");
    }
}
