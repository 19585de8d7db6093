package org.springaicommunity.harvester;

import java.util.List;

/**
 * Which filter facets a run enables.
 */
public enum FilterMode {

	ALL(true, true), DATE_ONLY(true, false), SIZE_ONLY(false, true), NONE(false, false);

	private final boolean dateFilters;

	private final boolean sizeFilters;

	FilterMode(boolean dateFilters, boolean sizeFilters) {
		this.dateFilters = dateFilters;
		this.sizeFilters = sizeFilters;
	}

	public List<FilterCombination> combinations() {
		return FilterCombination.generate(dateFilters, sizeFilters);
	}

}
