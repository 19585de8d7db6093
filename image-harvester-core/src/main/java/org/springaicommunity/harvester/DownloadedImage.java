package org.springaicommunity.harvester;

import org.jspecify.annotations.Nullable;

/**
 * Downloaded image content.
 *
 * @param content the full response body
 * @param contentType the {@code Content-Type} header, or {@code null} if absent
 */
public record DownloadedImage(byte[] content, @Nullable String contentType) {
}
