package org.springaicommunity.harvester;

/**
 * Parsed configuration result from command-line arguments.
 */
public class ParsedConfiguration {

	// Input and output
	public String queriesFile;

	public int targetCount;

	public String outputDirectory;

	public String filenamePrefix;

	public String checkpointFile;

	// Filter selection
	public FilterMode filterMode;

	public int filterFlagCount = 0;

	// Mode flags
	public boolean fresh = false;

	public boolean verbose = false;

	public boolean helpRequested = false;

	public ParsedConfiguration(HarvesterProperties defaultProperties) {
		this.queriesFile = defaultProperties.getQueriesFile();
		this.targetCount = defaultProperties.getTargetCount();
		this.outputDirectory = defaultProperties.getOutputDirectory();
		this.filenamePrefix = defaultProperties.getFilenamePrefix();
		this.checkpointFile = defaultProperties.getCheckpointFile();
		this.filterMode = defaultProperties.getFilterMode();
		this.verbose = defaultProperties.isVerbose();
	}

	@Override
	public String toString() {
		return "ParsedConfiguration{" + "queriesFile='" + queriesFile + '\'' + ", targetCount=" + targetCount
				+ ", outputDirectory='" + outputDirectory + '\'' + ", filenamePrefix='" + filenamePrefix + '\''
				+ ", checkpointFile='" + checkpointFile + '\'' + ", filterMode=" + filterMode + ", fresh=" + fresh
				+ ", verbose=" + verbose + ", helpRequested=" + helpRequested + '}';
	}

}
