package org.springaicommunity.harvester;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jspecify.annotations.Nullable;

/**
 * Lifecycle of a harvest session as recorded in the checkpoint file.
 */
public enum SessionStatus {

	IN_PROGRESS("in_progress"), COMPLETED("completed");

	private final String value;

	SessionStatus(String value) {
		this.value = value;
	}

	@JsonValue
	public String value() {
		return value;
	}

	/**
	 * Parse a persisted status. Missing or unknown values count as in progress, so an odd
	 * file is resumed rather than silently discarded.
	 */
	@JsonCreator
	public static SessionStatus fromValue(@Nullable String value) {
		if (COMPLETED.value.equals(value)) {
			return COMPLETED;
		}
		return IN_PROGRESS;
	}

}
