package org.springaicommunity.harvester;

/**
 * Interface for the paginated image search API.
 *
 * <p>
 * Implementations report failures through {@link SearchPageResult} instead of throwing,
 * which keeps quota handling in {@link SearchDriver} and allows decorators (retrying,
 * logging) to be stacked.
 */
public interface ImageSearchClient {

	/**
	 * Request one page of image results.
	 * @param query search terms
	 * @param filters facets to apply
	 * @param startIndex 1-based index of the first result
	 * @param pageSize number of results requested
	 * @param credential key and scope to authenticate with
	 * @return the page, or a quota/error status
	 */
	SearchPageResult searchPage(String query, FilterCombination filters, int startIndex, int pageSize,
			Credential credential);

}
