package org.springaicommunity.harvester;

import java.io.IOException;
import java.util.Optional;

/**
 * Durable storage for the checkpoint document.
 *
 * <p>
 * Abstracts the file system so that {@link CheckpointStore} can be tested against other
 * storage and so that the write discipline lives in one place.
 */
public interface CheckpointRepository {

	/**
	 * Read the stored checkpoint.
	 * @return the document, or empty if nothing is stored
	 * @throws IOException if the stored data cannot be read or parsed
	 */
	Optional<CheckpointDocument> read() throws IOException;

	/**
	 * Replace the stored checkpoint with the given document. A failed write must leave the
	 * previously stored document intact.
	 * @param document the complete state to store
	 * @throws IOException if the write fails
	 */
	void write(CheckpointDocument document) throws IOException;

	/**
	 * Remove the stored checkpoint, if any.
	 * @throws IOException if the deletion fails
	 */
	void delete() throws IOException;

	/**
	 * Describe where the checkpoint lives, for log messages.
	 * @return location description
	 */
	String location();

}
