package org.springaicommunity.harvester.cli;

import ch.qos.logback.classic.Level;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springaicommunity.harvester.ArgumentParser;
import org.springaicommunity.harvester.Credential;
import org.springaicommunity.harvester.CredentialLoader;
import org.springaicommunity.harvester.EnvironmentSupport;
import org.springaicommunity.harvester.FilterCombination;
import org.springaicommunity.harvester.HarvestConfiguration;
import org.springaicommunity.harvester.HarvestOrchestrator;
import org.springaicommunity.harvester.HarvestOutcome;
import org.springaicommunity.harvester.HarvestResult;
import org.springaicommunity.harvester.HarvesterProperties;
import org.springaicommunity.harvester.ImageHarvesterBuilder;
import org.springaicommunity.harvester.NoResultEntry;
import org.springaicommunity.harvester.ParsedConfiguration;
import org.springaicommunity.harvester.QueryFileReader;

import java.time.Duration;
import java.util.List;
import java.util.function.Function;

/**
 * Image Harvester CLI Application
 *
 * Plain Java command-line application that harvests images for every query and filter
 * combination of a query file. Progress is checkpointed after every work unit, so an
 * interrupted or quota-paused run continues where it stopped. No Spring dependencies -
 * uses ImageHarvesterBuilder for wiring.
 *
 * Usage: java -jar image-harvester-cli.jar [OPTIONS]
 *
 * Environment Variables: API_KEY_1/CX_1, API_KEY_2/CX_2, ... or API_KEY/CX
 *
 * Exit codes: 0 completed, 1 error, 3 paused because every credential is exhausted, 4
 * units left open by search errors, 130 interrupted.
 */
public class ImageHarvesterCli {

	private static final Logger logger = LoggerFactory.getLogger(ImageHarvesterCli.class);

	static final int EXIT_COMPLETED = 0;

	static final int EXIT_ERROR = 1;

	static final int EXIT_PAUSED = 3;

	static final int EXIT_INCOMPLETE = 4;

	static final int EXIT_INTERRUPTED = 130;

	private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(15);

	private static final String LOGGER_ROOT = "org.springaicommunity.harvester";

	public static void main(String[] args) {
		try {
			int exitCode = run(args);
			if (exitCode != 0) {
				System.exit(exitCode);
			}
		}
		catch (Exception e) {
			logger.error("Harvest failed: {}", e.getMessage(), e);
			System.exit(EXIT_ERROR);
		}
	}

	public static int run(String[] args) throws Exception {
		return run(args, EnvironmentSupport::get);
	}

	static int run(String[] args, Function<String, @Nullable String> environment) throws Exception {
		HarvesterProperties properties = new HarvesterProperties();
		ArgumentParser argumentParser = new ArgumentParser(properties);

		if (argumentParser.isHelpRequested(args)) {
			System.out.println(argumentParser.generateHelpText());
			return EXIT_COMPLETED;
		}

		HarvestConfiguration configuration;
		List<Credential> credentials;
		List<String> queries;
		try {
			ParsedConfiguration parsed = argumentParser.parseAndValidate(args);
			if (parsed.verbose) {
				enableVerboseLogging();
			}
			configuration = HarvestConfiguration.from(parsed, properties);
			credentials = new CredentialLoader(environment).loadRequired();
			queries = QueryFileReader.read(configuration.queriesFile());
		}
		catch (IllegalArgumentException | IllegalStateException e) {
			logger.error(e.getMessage());
			logger.error("Run with --help for usage");
			return EXIT_ERROR;
		}

		List<FilterCombination> filters = configuration.filterMode().combinations();
		logConfiguration(configuration, credentials.size(), queries.size(), filters.size());

		HarvestOrchestrator orchestrator = ImageHarvesterBuilder.create()
			.properties(properties)
			.configuration(configuration)
			.credentials(credentials)
			.buildOrchestrator();

		orchestrator.prepare();
		HarvestResult result = runWithShutdownHook(orchestrator, queries, filters);
		logResults(result, configuration);
		return exitCodeFor(result.outcome());
	}

	static int exitCodeFor(HarvestOutcome outcome) {
		switch (outcome) {
			case COMPLETED:
				return EXIT_COMPLETED;
			case PAUSED_EXHAUSTED:
				return EXIT_PAUSED;
			case INCOMPLETE:
				return EXIT_INCOMPLETE;
			case INTERRUPTED:
				return EXIT_INTERRUPTED;
			default:
				throw new IllegalArgumentException("Unknown outcome: " + outcome);
		}
	}

	private static HarvestResult runWithShutdownHook(HarvestOrchestrator orchestrator, List<String> queries,
			List<FilterCombination> filters) {
		Thread worker = Thread.currentThread();
		Thread shutdownHook = new Thread(() -> {
			logger.info("Shutdown requested, saving progress...");
			orchestrator.requestStop();
			worker.interrupt();
			try {
				if (!orchestrator.awaitCompletion(SHUTDOWN_GRACE)) {
					logger.warn("Harvest did not stop within {}s, the last unit may be repeated on resume",
							SHUTDOWN_GRACE.toSeconds());
				}
			}
			catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
		}, "harvest-shutdown");

		Runtime.getRuntime().addShutdownHook(shutdownHook);
		try {
			return orchestrator.run(queries, filters);
		}
		finally {
			removeShutdownHook(shutdownHook);
			// Clears an interrupt delivered after the run finished
			Thread.interrupted();
		}
	}

	private static void removeShutdownHook(Thread shutdownHook) {
		try {
			Runtime.getRuntime().removeShutdownHook(shutdownHook);
		}
		catch (IllegalStateException e) {
			logger.debug("JVM is shutting down, shutdown hook stays registered");
		}
	}

	private static void enableVerboseLogging() {
		org.slf4j.Logger harvesterLogger = LoggerFactory.getLogger(LOGGER_ROOT);
		if (harvesterLogger instanceof ch.qos.logback.classic.Logger) {
			((ch.qos.logback.classic.Logger) harvesterLogger).setLevel(Level.DEBUG);
		}
	}

	private static void logConfiguration(HarvestConfiguration configuration, int credentialCount, int queryCount,
			int filterCount) {
		logger.info("Configuration:");
		logger.info("  Queries file: {} ({} queries)", configuration.queriesFile(), queryCount);
		logger.info("  Filter mode: {} ({} combination(s))", configuration.filterMode(), filterCount);
		logger.info("  Images per unit: {}", configuration.targetCount());
		logger.info("  Output directory: {}", configuration.outputDirectory());
		logger.info("  File prefix: {}", configuration.filenamePrefix());
		logger.info("  Checkpoint: {}", configuration.checkpointFile());
		logger.info("  Fresh start: {}", configuration.fresh());
		logger.info("  Credentials: {}", credentialCount);
	}

	private static void logResults(HarvestResult result, HarvestConfiguration configuration) {
		switch (result.outcome()) {
			case COMPLETED:
				logger.info("Harvest completed!");
				break;
			case PAUSED_EXHAUSTED:
				logger.warn("Harvest paused: every credential has reached its quota. Run again later to resume.");
				break;
			case INCOMPLETE:
				logger.warn("Harvest pass finished with failed units. Run again to retry them.");
				break;
			case INTERRUPTED:
				logger.info("Harvest interrupted. Run again to resume.");
				break;
			default:
				break;
		}
		logger.info("  Units completed: {}/{}", result.completedUnits(), result.totalUnits());
		logger.info("  Images saved: {}", result.stats().imagesSaved());
		logger.info("  Duplicates skipped: {}", result.stats().duplicatesSkipped());
		logger.info("  Units without results: {}", result.stats().noResults());
		logger.info("  Errors: {}", result.stats().errors());
		logger.info("  Credential in use: #{} of {} ({} exhausted)", result.rotatorStatus().currentOrdinal(),
				result.rotatorStatus().total(), result.rotatorStatus().exhaustedCount());
		if (!result.isComplete()) {
			logger.info("  Resume position: {}", result.position().describe());
		}
		logger.info("  Output directory: {}", configuration.outputDirectory());

		if (!result.noResults().isEmpty()) {
			logger.info("Units without results:");
			for (NoResultEntry entry : result.noResults()) {
				logger.info("  - \"{}\" ({})", entry.query(), entry.filters());
			}
		}
	}

}
