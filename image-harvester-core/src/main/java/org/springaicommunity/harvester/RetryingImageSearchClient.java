package org.springaicommunity.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

/**
 * Decorator that retries retryable page failures of an {@link ImageSearchClient} with
 * exponential backoff.
 *
 * <p>
 * Only {@link SearchPageResult.Status#ERROR} results flagged as retryable (server errors,
 * network failures, timeouts) are repeated. Quota results are returned at once: switching
 * credentials is the {@link SearchDriver}'s job, and waiting does not refill a daily
 * quota.
 *
 * <pre>
 * {@code
 * ImageSearchClient client = RetryingImageSearchClient.builder()
 *     .wrapping(new CustomSearchHttpClient(objectMapper, Duration.ofSeconds(30)))
 *     .maxRetries(2)
 *     .initialDelay(Duration.ofSeconds(1))
 *     .build();
 * }
 * </pre>
 */
public final class RetryingImageSearchClient implements ImageSearchClient {

	private static final Logger logger = LoggerFactory.getLogger(RetryingImageSearchClient.class);

	private final ImageSearchClient delegate;

	private final int maxRetries;

	private final long initialDelayMs;

	private RetryingImageSearchClient(Builder builder) {
		this.delegate = builder.delegate;
		this.maxRetries = builder.maxRetries;
		this.initialDelayMs = builder.initialDelayMs;
	}

	public static Builder builder() {
		return new Builder();
	}

	@Override
	public SearchPageResult searchPage(String query, FilterCombination filters, int startIndex, int pageSize,
			Credential credential) {
		long delay = initialDelayMs;
		SearchPageResult result = delegate.searchPage(query, filters, startIndex, pageSize, credential);

		for (int attempt = 1; attempt <= maxRetries && isRetryable(result); attempt++) {
			logger.warn("Search page start={} for \"{}\" failed (attempt {}/{}): {}. Retrying in {}ms...", startIndex,
					query, attempt, maxRetries + 1, result.detail(), delay);
			if (!sleep(delay)) {
				return result;
			}
			delay *= 2;
			result = delegate.searchPage(query, filters, startIndex, pageSize, credential);
		}

		if (isRetryable(result)) {
			logger.error("Search page start={} for \"{}\" failed after {} attempts", startIndex, query,
					maxRetries + 1);
		}
		return result;
	}

	private static boolean isRetryable(SearchPageResult result) {
		return result.status() == SearchPageResult.Status.ERROR && result.retryable();
	}

	/**
	 * Returns false if the wait was interrupted; the interrupt flag is restored so the
	 * harvest loop can see the stop request.
	 */
	private boolean sleep(long ms) {
		try {
			Thread.sleep(ms);
			return true;
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			logger.debug("Retry wait interrupted");
			return false;
		}
	}

	/**
	 * Builder for {@link RetryingImageSearchClient}.
	 *
	 * <p>
	 * Defaults:
	 * <ul>
	 * <li>maxRetries: 2</li>
	 * <li>initialDelay: 1 second</li>
	 * </ul>
	 */
	public static class Builder {

		private ImageSearchClient delegate;

		private int maxRetries = 2;

		private long initialDelayMs = 1000;

		private Builder() {
		}

		/**
		 * Set the client to wrap with retry logic.
		 * @param client the ImageSearchClient to wrap (required)
		 * @return this builder
		 */
		public Builder wrapping(ImageSearchClient client) {
			this.delegate = client;
			return this;
		}

		/**
		 * Set the maximum number of retry attempts.
		 * @param maxRetries maximum retries (default: 2, 0 disables retrying)
		 * @return this builder
		 */
		public Builder maxRetries(int maxRetries) {
			this.maxRetries = maxRetries;
			return this;
		}

		/**
		 * Set the initial delay between retries.
		 * @param delay initial delay (doubles on each retry, default: 1 second)
		 * @return this builder
		 */
		public Builder initialDelay(Duration delay) {
			this.initialDelayMs = delay.toMillis();
			return this;
		}

		public Builder initialDelayMs(long delayMs) {
			this.initialDelayMs = delayMs;
			return this;
		}

		/**
		 * Build the RetryingImageSearchClient.
		 * @return configured client
		 * @throws IllegalStateException if required parameters are missing or invalid
		 */
		public RetryingImageSearchClient build() {
			if (delegate == null) {
				throw new IllegalStateException("An ImageSearchClient to wrap is required. Call wrapping() first.");
			}
			if (maxRetries < 0) {
				throw new IllegalStateException("maxRetries must be non-negative");
			}
			if (initialDelayMs <= 0) {
				throw new IllegalStateException("initialDelay must be positive");
			}
			return new RetryingImageSearchClient(this);
		}

	}

}
