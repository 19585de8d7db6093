package org.springaicommunity.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered pool of credentials with round-robin failover on quota exhaustion.
 *
 * <p>
 * A credential marked as exhausted stays exhausted until {@link #resetAll()}. Rotation
 * scans forward from the credential just after the current one, so every credential is
 * tried once before the pool is declared empty and index 0 is not favoured.
 *
 * <p>
 * Instances are not thread-safe; the harvester uses a single worker.
 */
public class CredentialRotator {

	private static final Logger logger = LoggerFactory.getLogger(CredentialRotator.class);

	private final List<Credential> credentials;

	private final Set<Integer> exhausted = new HashSet<>();

	private int currentIndex = 0;

	/**
	 * Create a rotator over a fixed, ordered pool.
	 * @param credentials the pool (must not be empty)
	 * @throws IllegalArgumentException if the pool is empty
	 */
	public CredentialRotator(List<Credential> credentials) {
		if (credentials.isEmpty()) {
			throw new IllegalArgumentException("At least one API key/scope pair is required");
		}
		this.credentials = List.copyOf(credentials);
	}

	/**
	 * Returns the credential currently in use.
	 * @return current credential
	 */
	public Credential current() {
		return credentials.get(currentIndex);
	}

	/**
	 * Returns the 1-based position of the current credential, for display.
	 * @return current ordinal
	 */
	public int currentOrdinal() {
		return currentIndex + 1;
	}

	public int size() {
		return credentials.size();
	}

	/**
	 * Mark the current credential as out of quota.
	 */
	public void markExhausted() {
		exhausted.add(currentIndex);
	}

	/**
	 * Mark the current credential exhausted and move to the next usable one.
	 * @return true if a usable credential was found, false if the whole pool is exhausted
	 * (in which case the current index is left unchanged)
	 */
	public boolean rotateToNext() {
		markExhausted();

		int size = credentials.size();
		for (int offset = 1; offset <= size; offset++) {
			int candidate = (currentIndex + offset) % size;
			if (!exhausted.contains(candidate)) {
				logger.info("Rotating from credential #{} to credential #{} of {}", currentIndex + 1, candidate + 1,
						size);
				currentIndex = candidate;
				return true;
			}
		}

		logger.warn("All {} credential(s) are exhausted", size);
		return false;
	}

	public boolean hasAvailable() {
		return exhausted.size() < credentials.size();
	}

	/**
	 * Clear every exhaustion flag and return to the first credential. Meant for a new
	 * quota period; the harvesting loop never calls it.
	 */
	public void resetAll() {
		exhausted.clear();
		currentIndex = 0;
		logger.info("Credential pool reset, {} credential(s) available", credentials.size());
	}

	public RotatorStatus status() {
		return new RotatorStatus(currentOrdinal(), credentials.size(), exhausted.size(),
				credentials.size() - exhausted.size());
	}

}
