package org.springaicommunity.harvester;

/**
 * One API key together with the search engine scope it is valid for.
 *
 * @param key the API key
 * @param scope the search engine identifier ({@code cx}) the key queries
 */
public record Credential(String key, String scope) {

	public Credential {
		if (key.isBlank()) {
			throw new IllegalArgumentException("Credential key must not be blank");
		}
		if (scope.isBlank()) {
			throw new IllegalArgumentException("Credential scope must not be blank");
		}
	}

	/**
	 * Returns the key with everything but its last four characters masked, for logging.
	 * @return masked key
	 */
	public String maskedKey() {
		if (key.length() <= 4) {
			return "****";
		}
		return "****" + key.substring(key.length() - 4);
	}

	@Override
	public String toString() {
		return "Credential[key=" + maskedKey() + ", scope=" + scope + "]";
	}

}
