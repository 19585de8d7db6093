package org.springaicommunity.harvester;

/**
 * Fetches image bytes from their host.
 */
public interface ImageDownloader {

	/**
	 * Download the content behind a URL.
	 * @param url image URL
	 * @return the content and its declared type
	 * @throws ImageFetchException if the download fails or times out
	 */
	DownloadedImage download(String url);

}
