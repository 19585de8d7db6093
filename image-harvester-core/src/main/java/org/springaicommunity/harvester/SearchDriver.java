package org.springaicommunity.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a (query, filters) pair into a bounded list of image hits by paging through an
 * {@link ImageSearchClient}.
 *
 * <p>
 * Paging stops when the target count is reached, when a page comes back empty, or when
 * the next start index would pass the API's {@value #MAX_RESULTS}-result ceiling. A quota
 * result rotates to the next credential and repeats the same page; when no credential is
 * left the outcome is {@link SearchOutcome.AllCredentialsExhausted}.
 */
public class SearchDriver {

	private static final Logger logger = LoggerFactory.getLogger(SearchDriver.class);

	/**
	 * Results per page request.
	 */
	public static final int PAGE_SIZE = 10;

	/**
	 * The API never serves results beyond this index for a query.
	 */
	public static final int MAX_RESULTS = 100;

	private final ImageSearchClient searchClient;

	private final CredentialRotator rotator;

	public SearchDriver(ImageSearchClient searchClient, CredentialRotator rotator) {
		this.searchClient = searchClient;
		this.rotator = rotator;
	}

	/**
	 * Fetch up to {@code targetCount} hits for one work unit.
	 * @param query search terms
	 * @param filters facets to apply
	 * @param targetCount wanted number of hits, clamped to [1, {@value #MAX_RESULTS}]
	 * @return success with the hits, a transient error with partial hits, or credential
	 * exhaustion
	 */
	public SearchOutcome fetchResults(String query, FilterCombination filters, int targetCount) {
		int count = clampTargetCount(targetCount);
		List<ImageItem> results = new ArrayList<>();
		int startIndex = 1;

		while (results.size() < count) {
			if (!rotator.hasAvailable()) {
				return new SearchOutcome.AllCredentialsExhausted(rotator.size());
			}

			int pageSize = Math.min(PAGE_SIZE, count - results.size());
			SearchPageResult page = searchClient.searchPage(query, filters, startIndex, pageSize, rotator.current());

			if (page.status() == SearchPageResult.Status.QUOTA_EXCEEDED) {
				logger.warn("Credential #{} quota exceeded: {}", rotator.currentOrdinal(), page.detail());
				if (rotator.rotateToNext()) {
					continue;
				}
				return new SearchOutcome.AllCredentialsExhausted(rotator.size());
			}

			if (page.status() == SearchPageResult.Status.ERROR) {
				logger.warn("Search for \"{}\" ({}) failed at start={}: {}", query, filters.describe(), startIndex,
						page.detail());
				return new SearchOutcome.TransientError(page.detail() != null ? page.detail() : "unknown error",
						results);
			}

			// An empty page ends paging even below the target count
			// TODO: confirm against the API whether an empty page can be transient
			if (page.items().isEmpty()) {
				break;
			}

			List<ImageItem> items = page.items();
			int remaining = count - results.size();
			results.addAll(items.size() > remaining ? items.subList(0, remaining) : items);

			startIndex += PAGE_SIZE;
			if (startIndex > MAX_RESULTS) {
				break;
			}
		}

		return new SearchOutcome.Success(results);
	}

	static int clampTargetCount(int targetCount) {
		return Math.min(Math.max(1, targetCount), MAX_RESULTS);
	}

}
