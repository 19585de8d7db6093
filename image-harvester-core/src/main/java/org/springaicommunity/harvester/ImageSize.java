package org.springaicommunity.harvester;

/**
 * Size classes understood by the search API's {@code imgSize} parameter.
 */
public enum ImageSize {

	LARGE("large"), XLARGE("xlarge"), XXLARGE("xxlarge"), HUGE("huge");

	private final String apiValue;

	ImageSize(String apiValue) {
		this.apiValue = apiValue;
	}

	public String apiValue() {
		return apiValue;
	}

	public static ImageSize fromApiValue(String value) {
		for (ImageSize size : values()) {
			if (size.apiValue.equalsIgnoreCase(value)) {
				return size;
			}
		}
		throw new IllegalArgumentException("Unknown imgSize value: " + value);
	}

}
