package org.springaicommunity.harvester;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

/**
 * Content digests used as deduplication keys.
 */
public final class ContentHashes {

	private ContentHashes() {
	}

	/**
	 * Compute the SHA-256 digest of the full content.
	 * @param content bytes to hash
	 * @return lowercase hex digest (64 characters)
	 */
	public static String sha256Hex(byte[] content) {
		MessageDigest digest;
		try {
			digest = MessageDigest.getInstance("SHA-256");
		}
		catch (NoSuchAlgorithmException e) {
			throw new IllegalStateException("SHA-256 not available", e);
		}
		return HexFormat.of().formatHex(digest.digest(content));
	}

}
