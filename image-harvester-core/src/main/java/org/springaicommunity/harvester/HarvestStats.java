package org.springaicommunity.harvester;

/**
 * Run statistics. All counters only grow within a session.
 *
 * @param imagesSaved unique images written to the output directory
 * @param duplicatesSkipped downloads whose content was already in the ledger
 * @param errors failed searches plus failed downloads and writes
 * @param noResults work units whose search succeeded with no hits
 */
public record HarvestStats(int imagesSaved, int duplicatesSkipped, int errors, int noResults) {

	public static final HarvestStats EMPTY = new HarvestStats(0, 0, 0, 0);

}
