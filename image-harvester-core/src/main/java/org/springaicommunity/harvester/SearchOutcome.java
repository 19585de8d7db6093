package org.springaicommunity.harvester;

import java.util.List;

/**
 * Result of resolving one work unit's search through {@link SearchDriver}.
 *
 * <p>
 * The three cases must stay distinguishable: a successful search with no hits completes
 * its unit, a transient failure leaves the unit open for the next run, and credential
 * exhaustion pauses the whole run.
 */
public interface SearchOutcome {

	/**
	 * Paging finished normally.
	 *
	 * @param items accumulated hits, possibly empty
	 */
	record Success(List<ImageItem> items) implements SearchOutcome {

		public Success {
			items = List.copyOf(items);
		}

	}

	/**
	 * A page request failed for a reason other than quota.
	 *
	 * @param detail failure description
	 * @param partialItems hits gathered before the failure; the unit must still be retried
	 */
	record TransientError(String detail, List<ImageItem> partialItems) implements SearchOutcome {

		public TransientError {
			partialItems = List.copyOf(partialItems);
		}

	}

	/**
	 * Every credential in the pool reported quota exhaustion.
	 *
	 * @param totalCredentials size of the exhausted pool
	 */
	record AllCredentialsExhausted(int totalCredentials) implements SearchOutcome {
	}

}
