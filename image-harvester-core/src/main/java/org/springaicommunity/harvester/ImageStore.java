package org.springaicommunity.harvester;

import java.io.IOException;

/**
 * Destination for accepted images.
 */
public interface ImageStore {

	/**
	 * Persist image content under the given file name.
	 * @param fileName generated name, including extension
	 * @param content image bytes
	 * @throws IOException if the content cannot be written
	 */
	void write(String fileName, byte[] content) throws IOException;

	/**
	 * Describe where images go, for log messages.
	 * @return location description
	 */
	String location();

}
