package org.springaicommunity.harvester;

import java.util.List;

/**
 * Summary of a harvest run.
 *
 * @param outcome how the run ended
 * @param totalUnits number of (query, filter) pairs in the grid
 * @param completedUnits work units done, including those done by earlier runs
 * @param stats counters accumulated over the whole session
 * @param noResults units whose search succeeded without hits
 * @param rotatorStatus credential in use and how many are exhausted
 * @param position last work unit the run touched
 */
public record HarvestResult(HarvestOutcome outcome, int totalUnits, int completedUnits, HarvestStats stats,
		List<NoResultEntry> noResults, RotatorStatus rotatorStatus, WorkUnit position) {

	public HarvestResult {
		noResults = List.copyOf(noResults);
	}

	public boolean isComplete() {
		return outcome == HarvestOutcome.COMPLETED;
	}

}
