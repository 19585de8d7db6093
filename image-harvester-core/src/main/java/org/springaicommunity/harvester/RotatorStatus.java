package org.springaicommunity.harvester;

/**
 * Snapshot of the credential pool for reporting.
 *
 * @param currentOrdinal 1-based position of the credential in use
 * @param total number of credentials in the pool
 * @param exhaustedCount credentials marked as out of quota
 * @param availableCount credentials still usable
 */
public record RotatorStatus(int currentOrdinal, int total, int exhaustedCount, int availableCount) {
}
