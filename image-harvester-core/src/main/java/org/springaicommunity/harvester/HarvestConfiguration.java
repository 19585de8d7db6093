package org.springaicommunity.harvester;

import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

/**
 * Immutable settings of one harvest run, resolved once at start-up from parsed arguments
 * and {@link HarvesterProperties}.
 *
 * @param queriesFile file holding the search queries
 * @param targetCount hits requested per work unit
 * @param outputDirectory directory receiving saved images
 * @param filenamePrefix prefix of every saved file name
 * @param filterMode filter axes spanning the work grid
 * @param fresh discard any existing checkpoint before starting
 * @param checkpointFile location of the checkpoint
 * @param requestTimeout timeout of every HTTP request
 * @param maxSearchRetries retries for a failed (non-quota) search page
 * @param retryDelay initial delay between search retries
 * @param verbose debug logging requested
 */
public record HarvestConfiguration(Path queriesFile, int targetCount, Path outputDirectory, String filenamePrefix,
		FilterMode filterMode, boolean fresh, Path checkpointFile, Duration requestTimeout, int maxSearchRetries,
		Duration retryDelay, boolean verbose) {

	public HarvestConfiguration {
		Objects.requireNonNull(queriesFile, "queriesFile");
		Objects.requireNonNull(outputDirectory, "outputDirectory");
		Objects.requireNonNull(filenamePrefix, "filenamePrefix");
		Objects.requireNonNull(filterMode, "filterMode");
		Objects.requireNonNull(checkpointFile, "checkpointFile");
		Objects.requireNonNull(requestTimeout, "requestTimeout");
		Objects.requireNonNull(retryDelay, "retryDelay");
		if (targetCount <= 0) {
			throw new IllegalArgumentException("Target count must be positive: " + targetCount);
		}
		if (maxSearchRetries < 0) {
			throw new IllegalArgumentException("Search retries must not be negative: " + maxSearchRetries);
		}
	}

	/**
	 * Combine parsed command-line arguments with the remaining property defaults.
	 * @param parsed validated command-line arguments
	 * @param properties defaults for settings without a command-line flag
	 * @return the run configuration
	 */
	public static HarvestConfiguration from(ParsedConfiguration parsed, HarvesterProperties properties) {
		return new HarvestConfiguration(Path.of(parsed.queriesFile), parsed.targetCount,
				Path.of(parsed.outputDirectory), parsed.filenamePrefix, parsed.filterMode, parsed.fresh,
				Path.of(parsed.checkpointFile), Duration.ofSeconds(properties.getRequestTimeoutSeconds()),
				properties.getMaxSearchRetries(), Duration.ofMillis(properties.getRetryDelayMs()), parsed.verbose);
	}

	/**
	 * Build a configuration from properties alone.
	 * @param properties configured properties
	 * @return the run configuration
	 */
	public static HarvestConfiguration fromProperties(HarvesterProperties properties) {
		return from(new ParsedConfiguration(properties), properties);
	}

}
