package org.springaicommunity.harvester;

/**
 * A work unit whose search succeeded without hits, kept for the end-of-run report.
 *
 * @param queryIndex 0-based query index
 * @param filterIndex 0-based filter index
 * @param query the query text
 * @param filters the filter combination in display form
 */
public record NoResultEntry(int queryIndex, int filterIndex, String query, String filters) {
}
