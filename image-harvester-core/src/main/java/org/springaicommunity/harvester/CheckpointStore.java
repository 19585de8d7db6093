package org.springaicommunity.harvester;

import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Owns the mutable state of a harvest session and its durable copy.
 *
 * <p>
 * The store tracks which work units are done, where the run currently is, the run
 * statistics and the {@link ContentLedger}. {@link #save()} writes all of it at once; the
 * harvest loop saves after every work unit, so a crash loses at most the unit in flight.
 *
 * <p>
 * Resume rules for {@link #load()}:
 * <ul>
 * <li>no checkpoint, or an unreadable one: new session</li>
 * <li>a checkpoint whose status is {@code completed}: new session (a finished session is
 * never resumed; its summary stays available through {@link #previousSession()})</li>
 * <li>otherwise: position, completed units, statistics, no-result entries and the ledger
 * are restored</li>
 * </ul>
 */
public class CheckpointStore {

	private static final Logger logger = LoggerFactory.getLogger(CheckpointStore.class);

	private final CheckpointRepository repository;

	private final Clock clock;

	private final ContentLedger ledger = new ContentLedger();

	private final Set<WorkUnit> completed = new TreeSet<>();

	private final List<NoResultEntry> noResults = new ArrayList<>();

	private SessionStatus status = SessionStatus.IN_PROGRESS;

	private LocalDateTime startedAt;

	@Nullable
	private LocalDateTime updatedAt;

	@Nullable
	private String queriesFile;

	private int totalQueries;

	private int totalCombinations;

	private WorkUnit position = new WorkUnit(0, 0);

	private int imagesSaved;

	private int duplicatesSkipped;

	private int errors;

	@Nullable
	private CheckpointDocument previousSession;

	public CheckpointStore(CheckpointRepository repository) {
		this(repository, Clock.systemDefaultZone());
	}

	public CheckpointStore(CheckpointRepository repository, Clock clock) {
		this.repository = repository;
		this.clock = clock;
		this.startedAt = LocalDateTime.now(clock);
	}

	/**
	 * Restore a previous, unfinished session if one is stored.
	 * @return true if a session was resumed, false if this is a new session
	 */
	public boolean load() {
		resetState();

		Optional<CheckpointDocument> stored;
		try {
			stored = repository.read();
		}
		catch (IOException e) {
			logger.warn("Checkpoint {} is unreadable, starting a new session: {}", repository.location(),
					e.getMessage());
			return false;
		}

		if (stored.isEmpty()) {
			logger.debug("No checkpoint at {}", repository.location());
			return false;
		}

		CheckpointDocument document = stored.get();
		if (document.status() == SessionStatus.COMPLETED) {
			previousSession = document;
			logger.info("Previous session completed at {}, starting a new session", document.updatedAt());
			return false;
		}

		try {
			restore(document);
		}
		catch (IllegalArgumentException e) {
			logger.warn("Checkpoint {} holds invalid state, starting a new session: {}", repository.location(),
					e.getMessage());
			resetState();
			return false;
		}
		return true;
	}

	/**
	 * Write the complete state to durable storage.
	 * @throws UncheckedIOException if the write fails
	 */
	public void save() {
		updatedAt = LocalDateTime.now(clock);
		try {
			repository.write(toDocument());
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to save checkpoint " + repository.location(), e);
		}
		logger.debug("Checkpoint saved: {} unit(s) done, {} image(s) saved", completed.size(), imagesSaved);
	}

	/**
	 * Delete the stored checkpoint and start over with empty state.
	 */
	public void discard() {
		try {
			repository.delete();
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to delete checkpoint " + repository.location(), e);
		}
		resetState();
	}

	public void setSessionInfo(@Nullable String queriesFile, int totalQueries, int totalCombinations) {
		this.queriesFile = queriesFile;
		this.totalQueries = totalQueries;
		this.totalCombinations = totalCombinations;
	}

	public boolean isUnitDone(WorkUnit unit) {
		return completed.contains(unit);
	}

	public void markUnitDone(WorkUnit unit) {
		completed.add(unit);
		position = unit;
	}

	public void updatePosition(WorkUnit unit) {
		position = unit;
	}

	/**
	 * Mark the session completed and save it. The next {@link #load()} starts afresh.
	 */
	public void markSessionFinished() {
		status = SessionStatus.COMPLETED;
		save();
	}

	public void recordNoResults(WorkUnit unit, String query, FilterCombination filters) {
		noResults.add(new NoResultEntry(unit.queryIndex(), unit.filterIndex(), query, filters.describe()));
	}

	public void incrementSaved() {
		imagesSaved++;
	}

	public void incrementDuplicates() {
		duplicatesSkipped++;
	}

	public void incrementErrors() {
		errors++;
	}

	public ContentLedger ledger() {
		return ledger;
	}

	public HarvestStats stats() {
		return new HarvestStats(imagesSaved, duplicatesSkipped, errors, noResults.size());
	}

	public List<NoResultEntry> noResults() {
		return Collections.unmodifiableList(noResults);
	}

	public Set<WorkUnit> completedUnits() {
		return Collections.unmodifiableSet(completed);
	}

	public int completedCount() {
		return completed.size();
	}

	public WorkUnit position() {
		return position;
	}

	public SessionStatus status() {
		return status;
	}

	public LocalDateTime startedAt() {
		return startedAt;
	}

	@Nullable
	public LocalDateTime updatedAt() {
		return updatedAt;
	}

	@Nullable
	public String queriesFile() {
		return queriesFile;
	}

	public int totalQueries() {
		return totalQueries;
	}

	public int totalCombinations() {
		return totalCombinations;
	}

	/**
	 * Returns the completed session found by the last {@link #load()}, if any.
	 * @return the discarded completed session
	 */
	public Optional<CheckpointDocument> previousSession() {
		return Optional.ofNullable(previousSession);
	}

	CheckpointDocument toDocument() {
		List<CheckpointDocument.Position> completedPositions = new ArrayList<>();
		for (WorkUnit unit : completed) {
			completedPositions.add(CheckpointDocument.Position.of(unit));
		}
		return new CheckpointDocument(status, startedAt, updatedAt, queriesFile, totalQueries, totalCombinations,
				CheckpointDocument.Position.of(position), completedPositions,
				CheckpointDocument.Stats.of(stats()), List.copyOf(noResults), List.copyOf(ledger.seenHashes()),
				ledger.counter());
	}

	private void restore(CheckpointDocument document) {
		status = SessionStatus.IN_PROGRESS;
		startedAt = document.startedAt() != null ? document.startedAt() : LocalDateTime.now(clock);
		updatedAt = document.updatedAt();
		queriesFile = document.queriesFile();
		totalQueries = document.totalQueries();
		totalCombinations = document.totalCombinations();

		if (document.currentPosition() != null) {
			position = document.currentPosition().toWorkUnit();
		}
		if (document.completed() != null) {
			for (CheckpointDocument.Position done : document.completed()) {
				if (done == null) {
					throw new IllegalArgumentException("Completed list holds a null entry");
				}
				completed.add(done.toWorkUnit());
			}
		}
		if (document.stats() != null) {
			imagesSaved = document.stats().imagesSaved();
			duplicatesSkipped = document.stats().duplicatesSkipped();
			errors = document.stats().errors();
		}
		if (document.noResults() != null) {
			if (document.noResults().stream().anyMatch(Objects::isNull)) {
				throw new IllegalArgumentException("No-results list holds a null entry");
			}
			noResults.addAll(document.noResults());
		}
		List<String> hashes = document.seenHashes() != null ? document.seenHashes() : List.of();
		if (hashes.stream().anyMatch(Objects::isNull)) {
			throw new IllegalArgumentException("Seen hashes hold a null entry");
		}
		ledger.restore(hashes, document.imageCounter());

		logger.info("Resuming session started {}: {} unit(s) done, {} image(s) saved, {} hash(es) loaded", startedAt,
				completed.size(), imagesSaved, ledger.size());
	}

	private void resetState() {
		status = SessionStatus.IN_PROGRESS;
		startedAt = LocalDateTime.now(clock);
		updatedAt = null;
		position = new WorkUnit(0, 0);
		completed.clear();
		noResults.clear();
		imagesSaved = 0;
		duplicatesSkipped = 0;
		errors = 0;
		ledger.clear();
		previousSession = null;
	}

}
