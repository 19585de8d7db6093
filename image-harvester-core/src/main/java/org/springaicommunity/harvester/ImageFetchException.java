package org.springaicommunity.harvester;

import org.jspecify.annotations.Nullable;

/**
 * Exception thrown when an HTTP call to the search API or an image host fails.
 *
 * <p>
 * Carries the HTTP status when one was received; network failures and timeouts have a
 * status code of {@code -1}.
 */
public class ImageFetchException extends RuntimeException {

	private final int statusCode;

	@Nullable
	private final String responseBody;

	public ImageFetchException(String message, int statusCode, @Nullable String responseBody) {
		super(message);
		this.statusCode = statusCode;
		this.responseBody = responseBody;
	}

	public ImageFetchException(String message, Throwable cause) {
		super(message, cause);
		this.statusCode = -1;
		this.responseBody = null;
	}

	public int getStatusCode() {
		return statusCode;
	}

	@Nullable
	public String getResponseBody() {
		return responseBody;
	}

	/**
	 * Returns true if repeating the request may succeed: network failures, timeouts and
	 * 5xx responses.
	 */
	public boolean isRetryable() {
		return statusCode == -1 || statusCode >= 500;
	}

}
