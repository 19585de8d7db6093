package org.springaicommunity.harvester;

/**
 * Configuration properties for a harvest run.
 *
 * <p>
 * Properties can be set directly via setters or passed to {@link ImageHarvesterBuilder}.
 * Command-line arguments parsed by {@link ArgumentParser} take precedence over these
 * values.
 *
 * <p>
 * Default values are suitable for most use cases.
 */
public class HarvesterProperties {

	/**
	 * File holding one search query per line.
	 */
	private String queriesFile = "queries.txt";

	/**
	 * Number of hits requested per work unit (the API serves at most 100).
	 */
	private int targetCount = 100;

	/**
	 * Directory receiving the saved images.
	 */
	private String outputDirectory = "./image/harvest";

	/**
	 * Prefix of every saved file name.
	 */
	private String filenamePrefix = "image";

	/**
	 * File path for the resumable checkpoint.
	 */
	private String checkpointFile = "progress.json";

	/**
	 * Which filter axes span the work grid.
	 */
	private FilterMode filterMode = FilterMode.SIZE_ONLY;

	/**
	 * Timeout in seconds for every HTTP request.
	 */
	private int requestTimeoutSeconds = 30;

	/**
	 * Retries for a search page that failed for a reason other than quota.
	 */
	private int maxSearchRetries = 2;

	/**
	 * Initial delay in milliseconds between search retries (doubles per attempt).
	 */
	private long retryDelayMs = 1000;

	/**
	 * Enable debug-level logging output.
	 */
	private boolean verbose = false;

	public String getQueriesFile() {
		return queriesFile;
	}

	public void setQueriesFile(String queriesFile) {
		this.queriesFile = queriesFile;
	}

	public int getTargetCount() {
		return targetCount;
	}

	public void setTargetCount(int targetCount) {
		this.targetCount = targetCount;
	}

	public String getOutputDirectory() {
		return outputDirectory;
	}

	public void setOutputDirectory(String outputDirectory) {
		this.outputDirectory = outputDirectory;
	}

	public String getFilenamePrefix() {
		return filenamePrefix;
	}

	public void setFilenamePrefix(String filenamePrefix) {
		this.filenamePrefix = filenamePrefix;
	}

	public String getCheckpointFile() {
		return checkpointFile;
	}

	public void setCheckpointFile(String checkpointFile) {
		this.checkpointFile = checkpointFile;
	}

	public FilterMode getFilterMode() {
		return filterMode;
	}

	public void setFilterMode(FilterMode filterMode) {
		this.filterMode = filterMode;
	}

	public int getRequestTimeoutSeconds() {
		return requestTimeoutSeconds;
	}

	public void setRequestTimeoutSeconds(int requestTimeoutSeconds) {
		this.requestTimeoutSeconds = requestTimeoutSeconds;
	}

	public int getMaxSearchRetries() {
		return maxSearchRetries;
	}

	public void setMaxSearchRetries(int maxSearchRetries) {
		this.maxSearchRetries = maxSearchRetries;
	}

	public long getRetryDelayMs() {
		return retryDelayMs;
	}

	public void setRetryDelayMs(long retryDelayMs) {
		this.retryDelayMs = retryDelayMs;
	}

	public boolean isVerbose() {
		return verbose;
	}

	public void setVerbose(boolean verbose) {
		this.verbose = verbose;
	}

}
