package org.springaicommunity.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * {@link ImageDownloader} using the Java 11+ HttpClient. Redirects are followed and every
 * request is bounded by the configured timeout.
 */
public class HttpImageDownloader implements ImageDownloader {

	private static final Logger logger = LoggerFactory.getLogger(HttpImageDownloader.class);

	private static final String USER_AGENT = "image-harvester";

	private final HttpClient httpClient;

	private final Duration requestTimeout;

	public HttpImageDownloader(Duration requestTimeout) {
		this(HttpClient.newBuilder()
			.connectTimeout(requestTimeout)
			.followRedirects(HttpClient.Redirect.NORMAL)
			.build(), requestTimeout);
	}

	public HttpImageDownloader(HttpClient httpClient, Duration requestTimeout) {
		this.httpClient = httpClient;
		this.requestTimeout = requestTimeout;
	}

	@Override
	public DownloadedImage download(String url) {
		HttpRequest request;
		try {
			request = HttpRequest.newBuilder()
				.uri(URI.create(url))
				.timeout(requestTimeout)
				.header("User-Agent", USER_AGENT)
				.GET()
				.build();
		}
		catch (IllegalArgumentException e) {
			throw new ImageFetchException("Invalid image URL: " + url, e);
		}

		logger.debug("GET {}", url);
		long start = System.currentTimeMillis();

		try {
			HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());
			int statusCode = response.statusCode();
			if (statusCode < 200 || statusCode >= 300) {
				throw new ImageFetchException("Image download failed with HTTP " + statusCode + ": " + url,
						statusCode, null);
			}
			String contentType = response.headers().firstValue("Content-Type").orElse(null);
			logger.debug("GET {} completed in {}ms ({} bytes, {})", url, System.currentTimeMillis() - start,
					response.body().length, contentType);
			return new DownloadedImage(response.body(), contentType);
		}
		catch (IOException e) {
			throw new ImageFetchException("Image download failed: " + e.getMessage(), e);
		}
		catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new ImageFetchException("Image download interrupted", e);
		}
	}

}
