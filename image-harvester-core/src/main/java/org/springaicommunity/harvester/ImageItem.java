package org.springaicommunity.harvester;

/**
 * One image search hit.
 *
 * @param url direct link to the image content
 * @param sourcePageUrl page the image was found on (empty if unknown)
 * @param title result title (empty if unknown)
 */
public record ImageItem(String url, String sourcePageUrl, String title) {
}
