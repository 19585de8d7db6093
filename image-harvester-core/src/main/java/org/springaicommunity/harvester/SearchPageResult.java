package org.springaicommunity.harvester;

import org.jspecify.annotations.Nullable;

import java.util.List;

/**
 * Outcome of a single search page request.
 *
 * <p>
 * The status separates quota exhaustion, which the caller answers by rotating
 * credentials, from every other failure.
 *
 * @param status what happened
 * @param items hits on the page (empty unless {@code status} is {@link Status#SUCCESS})
 * @param detail failure description, {@code null} on success
 * @param retryable whether repeating the same request may succeed (server errors,
 * network failures)
 */
public record SearchPageResult(Status status, List<ImageItem> items, @Nullable String detail, boolean retryable) {

	public enum Status {

		SUCCESS, QUOTA_EXCEEDED, ERROR

	}

	public SearchPageResult {
		items = List.copyOf(items);
	}

	public static SearchPageResult success(List<ImageItem> items) {
		return new SearchPageResult(Status.SUCCESS, items, null, false);
	}

	public static SearchPageResult quotaExceeded(String detail) {
		return new SearchPageResult(Status.QUOTA_EXCEEDED, List.of(), detail, false);
	}

	public static SearchPageResult error(String detail, boolean retryable) {
		return new SearchPageResult(Status.ERROR, List.of(), detail, retryable);
	}

	public boolean isSuccess() {
		return status == Status.SUCCESS;
	}

}
