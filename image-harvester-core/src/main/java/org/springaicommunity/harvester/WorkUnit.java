package org.springaicommunity.harvester;

import java.util.Comparator;

/**
 * One (query, filter combination) pair, addressed by its indexes into the run's query
 * list and filter list. Ordered row-major: query first, then filter.
 *
 * @param queryIndex 0-based query index
 * @param filterIndex 0-based filter combination index
 */
public record WorkUnit(int queryIndex, int filterIndex) implements Comparable<WorkUnit> {

	private static final Comparator<WorkUnit> ORDER = Comparator.comparingInt(WorkUnit::queryIndex)
		.thenComparingInt(WorkUnit::filterIndex);

	public WorkUnit {
		if (queryIndex < 0 || filterIndex < 0) {
			throw new IllegalArgumentException(
					"Work unit indexes must not be negative: (" + queryIndex + ", " + filterIndex + ")");
		}
	}

	@Override
	public int compareTo(WorkUnit other) {
		return ORDER.compare(this, other);
	}

	/**
	 * 1-based description for logs, e.g. {@code query 2, filter 3}.
	 * @return display string
	 */
	public String describe() {
		return "query " + (queryIndex + 1) + ", filter " + (filterIndex + 1);
	}

}
