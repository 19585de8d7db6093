package org.springaicommunity.harvester;

/**
 * How a harvest run ended.
 */
public enum HarvestOutcome {

	/**
	 * Every work unit is done; the checkpoint is marked completed.
	 */
	COMPLETED,

	/**
	 * Every credential hit its quota; the checkpoint stays resumable.
	 */
	PAUSED_EXHAUSTED,

	/**
	 * The pass reached the end of the grid but transient search errors left units open;
	 * the checkpoint stays resumable and the next run retries only those units.
	 */
	INCOMPLETE,

	/**
	 * A stop was requested; the unit in flight was abandoned and the checkpoint saved.
	 */
	INTERRUPTED

}
