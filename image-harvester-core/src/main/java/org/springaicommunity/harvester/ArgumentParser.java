package org.springaicommunity.harvester;

import java.util.ArrayList;
import java.util.List;

/**
 * Command-line argument parser for the image harvester. Pure Java implementation with no
 * Spring dependencies for maximum testability.
 */
public class ArgumentParser {

	private final HarvesterProperties defaultProperties;

	public ArgumentParser(HarvesterProperties defaultProperties) {
		this.defaultProperties = defaultProperties;
	}

	/**
	 * Parse command-line arguments and return configuration.
	 * @param args Command-line arguments
	 * @return Parsed configuration object
	 * @throws IllegalArgumentException if arguments are invalid
	 */
	public ParsedConfiguration parseAndValidate(String[] args) {
		ParsedConfiguration config = new ParsedConfiguration(defaultProperties);

		for (int i = 0; i < args.length; i++) {
			String arg = args[i];

			switch (arg) {
				case "-q", "--queries":
					config.queriesFile = getRequiredValue(args, i, "queries");
					i++; // Skip next argument since we consumed it
					break;

				case "-c", "--count":
					String countStr = getRequiredValue(args, i, "count");
					try {
						config.targetCount = Integer.parseInt(countStr);
					}
					catch (NumberFormatException e) {
						throw new IllegalArgumentException(
								"Invalid count '" + countStr + "': must be a positive integer");
					}
					i++;
					break;

				case "-o", "--output":
					config.outputDirectory = getRequiredValue(args, i, "output");
					i++;
					break;

				case "-p", "--prefix":
					config.filenamePrefix = getRequiredValue(args, i, "prefix");
					i++;
					break;

				case "--checkpoint":
					config.checkpointFile = getRequiredValue(args, i, "checkpoint");
					i++;
					break;

				case "--no-filters":
					config.filterMode = FilterMode.NONE;
					config.filterFlagCount++;
					break;

				case "--date-only":
					config.filterMode = FilterMode.DATE_ONLY;
					config.filterFlagCount++;
					break;

				case "--size-only":
					config.filterMode = FilterMode.SIZE_ONLY;
					config.filterFlagCount++;
					break;

				case "--all-filters":
					config.filterMode = FilterMode.ALL;
					config.filterFlagCount++;
					break;

				case "--fresh":
					config.fresh = true;
					break;

				case "-v", "--verbose":
					config.verbose = true;
					break;

				case "-h", "--help":
					config.helpRequested = true;
					break;

				default:
					if (arg.startsWith("-")) {
						throw new IllegalArgumentException("Unknown option: " + arg);
					}
					throw new IllegalArgumentException("Unexpected argument: " + arg);
			}
		}

		validateConfiguration(config);

		return config;
	}

	/**
	 * Check if help is requested without full parsing.
	 * @param args Command-line arguments
	 * @return true if help is requested
	 */
	public boolean isHelpRequested(String[] args) {
		for (String arg : args) {
			if ("-h".equals(arg) || "--help".equals(arg)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Generate help text for command-line usage.
	 * @return Help text string
	 */
	public String generateHelpText() {
		StringBuilder help = new StringBuilder();
		help.append("Usage: image-harvester [OPTIONS]\n");
		help.append("\n");
		help.append("Harvest images for every query and filter combination, resuming where the last run stopped.\n");
		help.append("\n");
		help.append("OPTIONS:\n");
		help.append("    -h, --help               Show this help message\n");
		help.append("    -q, --queries FILE       Query file, one query per line (default: ")
			.append(defaultProperties.getQueriesFile())
			.append(")\n");
		help.append("    -c, --count N            Images requested per query and filter, max 100 (default: ")
			.append(defaultProperties.getTargetCount())
			.append(")\n");
		help.append("    -o, --output DIR         Output directory for images (default: ")
			.append(defaultProperties.getOutputDirectory())
			.append(")\n");
		help.append("    -p, --prefix PREFIX      Prefix of saved file names (default: ")
			.append(defaultProperties.getFilenamePrefix())
			.append(")\n");
		help.append("    --checkpoint FILE        Checkpoint file (default: ")
			.append(defaultProperties.getCheckpointFile())
			.append(")\n");
		help.append("    --fresh                  Ignore the checkpoint and start a new session\n");
		help.append("    -v, --verbose            Enable verbose logging\n");
		help.append("\n");
		help.append("FILTER OPTIONS (at most one, default: ")
			.append(defaultProperties.getFilterMode().name().toLowerCase().replace('_', '-'))
			.append("):\n");
		help.append("    --no-filters             One search per query, no filters\n");
		help.append("    --date-only              Date filters only (d30, m6, y1, y5)\n");
		help.append("    --size-only              Size filters only (large, xlarge, xxlarge, huge)\n");
		help.append("    --all-filters            Every date x size combination\n");
		help.append("\n");
		help.append("ENVIRONMENT VARIABLES:\n");
		help.append("    API_KEY_1, CX_1, API_KEY_2, CX_2, ...   Credential pool, read until the first gap\n");
		help.append("    API_KEY, CX                              Single credential, used when no numbered pair exists\n");
		help.append("    A .env file in the working or home directory is read as well.\n");
		help.append("\n");
		help.append("EXIT CODES:\n");
		help.append("    0 completed, 1 error, 3 paused (all credentials exhausted), 4 failed units left open, 130 interrupted\n");
		help.append("\n");
		help.append("EXAMPLES:\n");
		help.append("    image-harvester --queries potholes.txt --count 50\n");
		help.append("    image-harvester --no-filters --prefix pothole --output ./image/potholes\n");
		help.append("    image-harvester --fresh --date-only\n");
		help.append("\n");

		return help.toString();
	}

	/**
	 * Validate the environment (at least one credential pair).
	 * @throws IllegalStateException if no credential is configured
	 */
	public void validateEnvironment() {
		new CredentialLoader(EnvironmentSupport::get).loadRequired();
	}

	private String getRequiredValue(String[] args, int currentIndex, String optionName) {
		if (currentIndex + 1 >= args.length) {
			throw new IllegalArgumentException("Missing value for " + optionName + " option");
		}
		return args[currentIndex + 1];
	}

	private void validateConfiguration(ParsedConfiguration config) {
		List<String> errors = new ArrayList<>();

		if (config.queriesFile == null || config.queriesFile.isBlank()) {
			errors.add("Queries file cannot be empty");
		}

		if (config.targetCount <= 0) {
			errors.add("Count must be positive (got: " + config.targetCount + ")");
		}
		else if (config.targetCount > SearchDriver.MAX_RESULTS) {
			errors.add("Count too large (got: " + config.targetCount + ", max: " + SearchDriver.MAX_RESULTS + ")");
		}

		if (config.outputDirectory == null || config.outputDirectory.isBlank()) {
			errors.add("Output directory cannot be empty");
		}

		if (config.filenamePrefix == null || config.filenamePrefix.isBlank()) {
			errors.add("Prefix cannot be empty");
		}
		else if (!config.filenamePrefix.matches("[A-Za-z0-9._-]+")) {
			errors.add("Prefix may only contain letters, digits, '.', '_' and '-' (got: " + config.filenamePrefix
					+ ")");
		}

		if (config.checkpointFile == null || config.checkpointFile.isBlank()) {
			errors.add("Checkpoint file cannot be empty");
		}

		if (config.filterFlagCount > 1) {
			errors.add("Only one of --no-filters, --date-only, --size-only, --all-filters may be given");
		}

		if (!errors.isEmpty()) {
			StringBuilder errorMsg = new StringBuilder("Configuration validation failed:");
			for (String error : errors) {
				errorMsg.append("\n  - ").append(error);
			}
			throw new IllegalArgumentException(errorMsg.toString());
		}
	}

}
