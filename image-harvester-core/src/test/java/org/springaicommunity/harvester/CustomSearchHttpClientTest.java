package org.springaicommunity.harvester;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CustomSearchHttpClient Tests")
class CustomSearchHttpClientTest {

	private final CustomSearchHttpClient client = new CustomSearchHttpClient(ObjectMapperFactory.create(),
			Duration.ofSeconds(5));

	private static String errorBody(String reason) {
		return "{\"error\":{\"code\":403,\"errors\":[{\"reason\":\"" + reason + "\"}]}}";
	}

	@Nested
	@DisplayName("Response classification")
	class ClassificationTest {

		@Test
		@DisplayName("2xx responses are parsed into items")
		void successParsesItems() {
			String body = """
					{"items":[
					  {"link":"https://img.example.com/a.png","title":"A","image":{"contextLink":"https://page.example.com/a"}},
					  {"link":"https://img.example.com/b.jpg","title":"B","image":{"contextLink":"https://page.example.com/b"}}
					]}""";

			SearchPageResult result = client.toResult(200, body);

			assertThat(result.isSuccess()).isTrue();
			assertThat(result.items()).containsExactly(
					new ImageItem("https://img.example.com/a.png", "https://page.example.com/a", "A"),
					new ImageItem("https://img.example.com/b.jpg", "https://page.example.com/b", "B"));
		}

		@Test
		@DisplayName("A body without items is an empty success")
		void missingItemsIsEmpty() {
			SearchPageResult result = client.toResult(200, "{\"searchInformation\":{\"totalResults\":\"0\"}}");

			assertThat(result.isSuccess()).isTrue();
			assertThat(result.items()).isEmpty();
		}

		@Test
		@DisplayName("429 is a quota signal")
		void tooManyRequestsIsQuota() {
			assertThat(client.toResult(429, "").status()).isEqualTo(SearchPageResult.Status.QUOTA_EXCEEDED);
		}

		@Test
		@DisplayName("403 with a quota reason is a quota signal")
		void forbiddenWithQuotaReason() {
			assertThat(client.toResult(403, errorBody("dailyLimitExceeded")).status())
				.isEqualTo(SearchPageResult.Status.QUOTA_EXCEEDED);
			assertThat(client.toResult(403, errorBody("userRateLimitExceeded")).status())
				.isEqualTo(SearchPageResult.Status.QUOTA_EXCEEDED);
			assertThat(client.toResult(403, errorBody("quotaExceeded")).status())
				.isEqualTo(SearchPageResult.Status.QUOTA_EXCEEDED);
		}

		@Test
		@DisplayName("403 with another reason is a non-retryable error")
		void forbiddenWithOtherReason() {
			SearchPageResult result = client.toResult(403, errorBody("accessNotConfigured"));

			assertThat(result.status()).isEqualTo(SearchPageResult.Status.ERROR);
			assertThat(result.retryable()).isFalse();
			assertThat(result.detail()).contains("accessNotConfigured");
		}

		@Test
		@DisplayName("5xx is a retryable error, 4xx is not")
		void serverErrorsAreRetryable() {
			assertThat(client.toResult(503, "").retryable()).isTrue();
			assertThat(client.toResult(400, "").retryable()).isFalse();
		}

		@Test
		@DisplayName("Malformed JSON on 2xx is an error")
		void malformedJson() {
			SearchPageResult result = client.toResult(200, "not json");

			assertThat(result.status()).isEqualTo(SearchPageResult.Status.ERROR);
		}

	}

	@Test
	@DisplayName("Query string carries credential, paging and filters, URL-encoded")
	void buildsQueryString() {
		String query = CustomSearchHttpClient.buildQueryString("pot holes & cracks",
				new FilterCombination(DateRestrict.LAST_30_DAYS, ImageSize.HUGE), 11, 10, new Credential("k", "c"));

		assertThat(query).isEqualTo(
				"key=k&cx=c&q=pot+holes+%26+cracks&searchType=image&start=11&num=10&dateRestrict=d30&imgSize=huge");
	}

	@Test
	@DisplayName("Unfiltered query string omits the filter parameters")
	void unfilteredQueryString() {
		String query = CustomSearchHttpClient.buildQueryString("cats", FilterCombination.NONE, 1, 5,
				new Credential("k", "c"));

		assertThat(query).doesNotContain("dateRestrict").doesNotContain("imgSize");
	}

}
