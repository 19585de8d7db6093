package org.springaicommunity.harvester;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * {@link ImageSearchClient} backed by the Google Custom Search JSON API using the Java
 * 11+ HttpClient.
 *
 * <p>
 * Quota exhaustion is reported for HTTP 429 and for HTTP 403 responses whose first error
 * reason is one of {@code dailyLimitExceeded}, {@code userRateLimitExceeded} or
 * {@code quotaExceeded}. Any other 403 is an ordinary error.
 */
public class CustomSearchHttpClient implements ImageSearchClient {

	private static final Logger logger = LoggerFactory.getLogger(CustomSearchHttpClient.class);

	public static final String DEFAULT_ENDPOINT = "https://www.googleapis.com/customsearch/v1";

	static final Set<String> QUOTA_REASONS = Set.of("dailyLimitExceeded", "userRateLimitExceeded", "quotaExceeded");

	private static final String USER_AGENT = "image-harvester";

	private final HttpClient httpClient;

	private final ObjectMapper objectMapper;

	private final String endpoint;

	private final Duration requestTimeout;

	public CustomSearchHttpClient(ObjectMapper objectMapper, Duration requestTimeout) {
		this(HttpClient.newBuilder()
			.connectTimeout(requestTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build(), objectMapper, DEFAULT_ENDPOINT, requestTimeout);
	}

	public CustomSearchHttpClient(HttpClient httpClient, ObjectMapper objectMapper, String endpoint,
			Duration requestTimeout) {
		this.httpClient = httpClient;
		this.objectMapper = objectMapper;
		this.endpoint = endpoint;
		this.requestTimeout = requestTimeout;
	}

	@Override
	public SearchPageResult searchPage(String query, FilterCombination filters, int startIndex, int pageSize,
			Credential credential) {
		URI uri = URI.create(endpoint + "?" + buildQueryString(query, filters, startIndex, pageSize, credential));
		HttpRequest request = HttpRequest.newBuilder()
			.uri(uri)
			.timeout(requestTimeout)
			.header("Accept", "application/json")
			.header("User-Agent", USER_AGENT)
			.GET()
			.build();

		// The URI carries the API key, so only the endpoint is logged
		logger.debug("GET {} q=\"{}\" start={} num={} ({})", endpoint, query, startIndex, pageSize,
				filters.describe());
		long start = System.currentTimeMillis();

		try {
			HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
			SearchPageResult result = toResult(response.statusCode(), response.body());
			logger.debug("Search page start={} completed in {}ms: {} ({} items)", startIndex,
					System.currentTimeMillis() - start, result.status(), result.items().size());
			return result;
		}
		catch (IOException e) {
			logger.debug("Search page start={} failed after {}ms: {}", startIndex, System.currentTimeMillis() - start,
					e.getMessage());
			return SearchPageResult.error("Search request failed: " + e.getMessage(), true);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return SearchPageResult.error("Search request interrupted", false);
		}
	}

	/**
	 * Map an HTTP status and body onto a page result.
	 */
	SearchPageResult toResult(int statusCode, String body) {
		if (statusCode >= 200 && statusCode < 300) {
			try {
				return SearchPageResult.success(parseItems(body));
			}
			catch (JsonProcessingException e) {
				return SearchPageResult.error("Failed to parse search response: " + e.getOriginalMessage(), false);
			}
		}
		if (statusCode == 429) {
			return SearchPageResult.quotaExceeded("Too Many Requests (429)");
		}
		if (statusCode == 403) {
			String reason = errorReason(body);
			if (QUOTA_REASONS.contains(reason)) {
				return SearchPageResult.quotaExceeded("Quota exceeded (" + reason + ")");
			}
			return SearchPageResult.error("Forbidden (403)" + (reason.isEmpty() ? "" : ": " + reason), false);
		}
		return SearchPageResult.error("Search API error: " + statusCode, statusCode >= 500);
	}

	List<ImageItem> parseItems(String body) throws JsonProcessingException {
		JsonNode root = objectMapper.readTree(body);
		List<ImageItem> items = new ArrayList<>();
		for (JsonNode item : root.path("items")) {
			items.add(new ImageItem(item.path("link").asText(""), item.path("image").path("contextLink").asText(""),
					item.path("title").asText("")));
		}
		return items;
	}

	/**
	 * Extract {@code error.errors[0].reason} from an error body, or an empty string.
	 */
	String errorReason(String body) {
		try {
			return objectMapper.readTree(body).path("error").path("errors").path(0).path("reason").asText("");
		}
		catch (JsonProcessingException e) {
			logger.debug("Error body is not JSON: {}", e.getOriginalMessage());
			return "";
		}
	}

	static String buildQueryString(String query, FilterCombination filters, int startIndex, int pageSize,
			Credential credential) {
		Map<String, String> params = new LinkedHashMap<>();
		params.put("key", credential.key());
		params.put("cx", credential.scope());
		params.put("q", query);
		params.put("searchType", "image");
		params.put("start", Integer.toString(startIndex));
		params.put("num", Integer.toString(pageSize));
		if (filters.dateRestrict() != null) {
			params.put("dateRestrict", filters.dateRestrict().apiValue());
		}
		if (filters.imgSize() != null) {
			params.put("imgSize", filters.imgSize().apiValue());
		}
		return params.entrySet()
			.stream()
			.map(e -> e.getKey() + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
			.collect(Collectors.joining("&"));
	}

}
