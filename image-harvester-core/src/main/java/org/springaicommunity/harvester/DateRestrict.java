package org.springaicommunity.harvester;

/**
 * Publication date windows understood by the search API's {@code dateRestrict}
 * parameter.
 */
public enum DateRestrict {

	LAST_30_DAYS("d30"), LAST_6_MONTHS("m6"), LAST_YEAR("y1"), LAST_5_YEARS("y5");

	private final String apiValue;

	DateRestrict(String apiValue) {
		this.apiValue = apiValue;
	}

	public String apiValue() {
		return apiValue;
	}

	public static DateRestrict fromApiValue(String value) {
		for (DateRestrict restrict : values()) {
			if (restrict.apiValue.equalsIgnoreCase(value)) {
				return restrict;
			}
		}
		throw new IllegalArgumentException("Unknown dateRestrict value: " + value);
	}

}
