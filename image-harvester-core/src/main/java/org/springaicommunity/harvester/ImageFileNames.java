package org.springaicommunity.harvester;

import org.jspecify.annotations.Nullable;

import java.net.URI;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Naming rules for saved images: {@code <prefix>_<seq>_scraped_from_<source><ext>}, with
 * the sequence number zero-padded to three digits.
 */
public final class ImageFileNames {

	/**
	 * Longest sanitized source component.
	 */
	public static final int MAX_SOURCE_LENGTH = 100;

	/**
	 * Extension used when neither the content type nor the URL names a known one.
	 */
	public static final String DEFAULT_EXTENSION = ".jpg";

	private static final Pattern SCHEME = Pattern.compile("^https?://");

	private static final Pattern SEPARATORS = Pattern.compile("[/:?&=%#\\\\\\s]+");

	private static final Pattern UNSAFE = Pattern.compile("[^a-zA-Z0-9\\-.]");

	private static final Pattern HYPHEN_RUNS = Pattern.compile("-+");

	private static final Map<String, String> CONTENT_TYPE_EXTENSIONS = Map.of("image/jpeg", ".jpg", "image/jpg",
			".jpg", "image/png", ".png", "image/gif", ".gif", "image/webp", ".webp", "image/bmp", ".bmp",
			"image/tiff", ".tiff", "image/svg+xml", ".svg");

	private static final List<String> URL_EXTENSIONS = List.of(".jpg", ".jpeg", ".png", ".gif", ".webp", ".bmp",
			".tiff", ".svg");

	private ImageFileNames() {
	}

	/**
	 * Build the file name for an accepted image.
	 * @param prefix file name prefix
	 * @param sequenceNumber ledger sequence number
	 * @param url the image URL
	 * @param extension extension including the dot
	 * @return the file name
	 */
	public static String fileName(String prefix, int sequenceNumber, String url, String extension) {
		return String.format("%s_%03d_scraped_from_%s%s", prefix, sequenceNumber, sanitize(url), extension);
	}

	public static String sanitize(String url) {
		return sanitize(url, MAX_SOURCE_LENGTH);
	}

	/**
	 * Reduce a URL to a file-system-safe fragment.
	 * @param url the source URL
	 * @param maxLength longest allowed result
	 * @return a string of letters, digits, dots and single hyphens
	 */
	public static String sanitize(String url, int maxLength) {
		String sanitized = SCHEME.matcher(url).replaceFirst("");
		sanitized = SEPARATORS.matcher(sanitized).replaceAll("-");
		sanitized = UNSAFE.matcher(sanitized).replaceAll("");
		sanitized = HYPHEN_RUNS.matcher(sanitized).replaceAll("-");
		sanitized = trimHyphens(sanitized);

		if (sanitized.length() > maxLength) {
			sanitized = sanitized.substring(0, maxLength);
			while (sanitized.endsWith("-")) {
				sanitized = sanitized.substring(0, sanitized.length() - 1);
			}
		}
		return sanitized;
	}

	/**
	 * Pick an extension from the content type, then from the URL path, else
	 * {@link #DEFAULT_EXTENSION}. {@code .jpeg} is normalized to {@code .jpg}.
	 * @param url the image URL
	 * @param contentType the {@code Content-Type} header, may be {@code null}
	 * @return extension including the dot
	 */
	public static String extensionFor(String url, @Nullable String contentType) {
		if (contentType != null) {
			String baseType = contentType.split(";")[0].trim().toLowerCase(Locale.ROOT);
			String extension = CONTENT_TYPE_EXTENSIONS.get(baseType);
			if (extension != null) {
				return extension;
			}
		}

		String path = urlPath(url).toLowerCase(Locale.ROOT);
		for (String extension : URL_EXTENSIONS) {
			if (path.endsWith(extension)) {
				return ".jpeg".equals(extension) ? ".jpg" : extension;
			}
		}
		return DEFAULT_EXTENSION;
	}

	private static String urlPath(String url) {
		try {
			String path = URI.create(url).getPath();
			return path != null ? path : "";
		}
		catch (IllegalArgumentException e) {
			int end = url.length();
			int query = url.indexOf('?');
			int fragment = url.indexOf('#');
			if (query >= 0) {
				end = Math.min(end, query);
			}
			if (fragment >= 0) {
				end = Math.min(end, fragment);
			}
			return url.substring(0, end);
		}
	}

	private static String trimHyphens(String value) {
		int start = 0;
		int end = value.length();
		while (start < end && value.charAt(start) == '-') {
			start++;
		}
		while (end > start && value.charAt(end - 1) == '-') {
			end--;
		}
		return value.substring(start, end);
	}

}
