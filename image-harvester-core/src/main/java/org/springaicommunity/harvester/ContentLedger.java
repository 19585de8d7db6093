package org.springaicommunity.harvester;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Content-addressed record of every image accepted so far, plus the counter that numbers
 * saved files.
 *
 * <p>
 * Two URLs serving byte-identical content are one image: membership is keyed on the
 * content hash only. Hashes are never evicted, so deduplication holds across runs for as
 * long as the checkpoint that carries the ledger survives.
 */
public class ContentLedger {

	private final Set<String> seenHashes = new LinkedHashSet<>();

	private int counter = 0;

	public boolean isDuplicate(String hash) {
		return seenHashes.contains(hash);
	}

	/**
	 * Mark a hash as seen. Accepting the same hash twice has no further effect.
	 * @param hash hex content digest
	 */
	public void accept(String hash) {
		seenHashes.add(hash);
	}

	/**
	 * Check and mark in one step.
	 * @param hash hex content digest
	 * @return true if the hash was new and is now accepted
	 */
	public boolean tryAccept(String hash) {
		return seenHashes.add(hash);
	}

	/**
	 * Issue the next file sequence number. Numbers start at 1 and are never reused.
	 * @return the next sequence number
	 */
	public int nextSequenceNumber() {
		counter++;
		return counter;
	}

	/**
	 * Returns the last issued sequence number (0 if none was issued yet).
	 * @return current counter value
	 */
	public int counter() {
		return counter;
	}

	public int size() {
		return seenHashes.size();
	}

	/**
	 * Returns a read-only view of the accepted hashes in acceptance order.
	 * @return accepted hashes
	 */
	public Set<String> seenHashes() {
		return Collections.unmodifiableSet(seenHashes);
	}

	/**
	 * Replace the ledger contents with persisted state.
	 * @param hashes previously accepted hashes
	 * @param counter last issued sequence number
	 */
	public void restore(Collection<String> hashes, int counter) {
		if (counter < 0) {
			throw new IllegalArgumentException("Image counter must not be negative: " + counter);
		}
		this.seenHashes.clear();
		this.seenHashes.addAll(hashes);
		this.counter = counter;
	}

	public void clear() {
		seenHashes.clear();
		counter = 0;
	}

}
