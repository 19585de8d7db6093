package org.springaicommunity.harvester;

import org.jspecify.annotations.Nullable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An optional date window paired with an optional size class. Either facet may be absent;
 * the combination with neither is a plain, unfiltered search.
 *
 * @param dateRestrict date window, or {@code null} for any date
 * @param imgSize size class, or {@code null} for any size
 */
public record FilterCombination(@Nullable DateRestrict dateRestrict, @Nullable ImageSize imgSize) {

	/**
	 * The unfiltered combination.
	 */
	public static final FilterCombination NONE = new FilterCombination(null, null);

	/**
	 * Generate the cross product of the enabled facets, date outer and size inner. With no
	 * facet enabled the result is the single {@link #NONE} combination.
	 * @param useDateFilters include every {@link DateRestrict} value
	 * @param useSizeFilters include every {@link ImageSize} value
	 * @return ordered, immutable list of combinations
	 */
	public static List<FilterCombination> generate(boolean useDateFilters, boolean useSizeFilters) {
		List<@Nullable DateRestrict> dates = new ArrayList<>();
		if (useDateFilters) {
			Collections.addAll(dates, DateRestrict.values());
		}
		else {
			dates.add(null);
		}

		List<@Nullable ImageSize> sizes = new ArrayList<>();
		if (useSizeFilters) {
			Collections.addAll(sizes, ImageSize.values());
		}
		else {
			sizes.add(null);
		}

		List<FilterCombination> combinations = new ArrayList<>();
		for (DateRestrict date : dates) {
			for (ImageSize size : sizes) {
				combinations.add(new FilterCombination(date, size));
			}
		}
		return List.copyOf(combinations);
	}

	public boolean isEmpty() {
		return dateRestrict == null && imgSize == null;
	}

	/**
	 * Human-readable form, e.g. {@code dateRestrict=d30, imgSize=large} or
	 * {@code no filters}.
	 * @return display string
	 */
	public String describe() {
		if (isEmpty()) {
			return "no filters";
		}
		List<String> parts = new ArrayList<>();
		if (dateRestrict != null) {
			parts.add("dateRestrict=" + dateRestrict.apiValue());
		}
		if (imgSize != null) {
			parts.add("imgSize=" + imgSize.apiValue());
		}
		return String.join(", ", parts);
	}

}
