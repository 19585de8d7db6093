package org.springaicommunity.harvester;

/**
 * Per-unit tally of the item loop.
 *
 * @param found hits returned by the search
 * @param saved new images written
 * @param duplicates hits whose content was already known
 * @param errors failed downloads or writes
 * @param interrupted whether a stop cut the unit short
 */
public record UnitReport(int found, int saved, int duplicates, int errors, boolean interrupted) {
}
