package org.springaicommunity.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives the (query x filter) grid to completion.
 *
 * <p>
 * Work units are visited in row-major order. Units already recorded as done are skipped,
 * so a resumed run never repeats a search or a download. The checkpoint is saved after
 * every unit, whatever its result:
 * <ul>
 * <li>all credentials exhausted: the run pauses and the unit stays open</li>
 * <li>transient search failure: one error is counted and the unit stays open, so the
 * session is only marked completed once every unit is done</li>
 * <li>no hits: the unit is recorded in the no-results list and marked done</li>
 * <li>hits: each is downloaded, hashed and saved unless its content is already in the
 * ledger; per-item failures count an error without aborting the unit</li>
 * </ul>
 *
 * <p>
 * {@link #requestStop()} may be called from another thread. The run checks for it before
 * each unit and each item, abandons the unit in flight and saves the checkpoint.
 */
public class HarvestOrchestrator {

	private static final Logger logger = LoggerFactory.getLogger(HarvestOrchestrator.class);

	private final HarvestConfiguration configuration;

	private final SearchDriver searchDriver;

	private final CredentialRotator rotator;

	private final ImageDownloader downloader;

	private final ImageStore imageStore;

	private final CheckpointStore checkpointStore;

	private final AtomicBoolean stopRequested = new AtomicBoolean(false);

	private final CountDownLatch finished = new CountDownLatch(1);

	public HarvestOrchestrator(HarvestConfiguration configuration, SearchDriver searchDriver,
			CredentialRotator rotator, ImageDownloader downloader, ImageStore imageStore,
			CheckpointStore checkpointStore) {
		this.configuration = configuration;
		this.searchDriver = searchDriver;
		this.rotator = rotator;
		this.downloader = downloader;
		this.imageStore = imageStore;
		this.checkpointStore = checkpointStore;
	}

	/**
	 * Load or discard the checkpoint, depending on {@link HarvestConfiguration#fresh()}.
	 * @return true if an unfinished session is resumed
	 */
	public boolean prepare() {
		if (configuration.fresh()) {
			checkpointStore.discard();
			logger.info("Starting fresh, any previous checkpoint was discarded");
			return false;
		}

		boolean resumed = checkpointStore.load();
		if (resumed) {
			WorkUnit position = checkpointStore.position();
			logger.info("Resuming from {}: {} unit(s) done, {} image(s) saved", position.describe(),
					checkpointStore.completedCount(), checkpointStore.stats().imagesSaved());
		}
		else {
			checkpointStore.previousSession()
				.ifPresent(previous -> logger.info("Last session finished {} with {} image(s), starting a new one",
						previous.updatedAt(), previous.stats() != null ? previous.stats().imagesSaved() : 0));
		}
		return resumed;
	}

	/**
	 * Run every open work unit of the grid.
	 * @param queries search queries, in file order
	 * @param filters filter combinations, in generation order
	 * @return the run summary
	 */
	public HarvestResult run(List<String> queries, List<FilterCombination> filters) {
		try {
			return harvest(queries, filters);
		}
		finally {
			finished.countDown();
		}
	}

	/**
	 * Ask a running harvest to stop after saving its checkpoint. Safe to call from any
	 * thread.
	 */
	public void requestStop() {
		stopRequested.set(true);
	}

	public boolean isStopRequested() {
		return stopRequested.get();
	}

	/**
	 * Wait for {@link #run(List, List)} to return.
	 * @param timeout longest wait
	 * @return true if the run finished within the timeout
	 * @throws InterruptedException if the waiting thread is interrupted
	 */
	public boolean awaitCompletion(Duration timeout) throws InterruptedException {
		return finished.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
	}

	private HarvestResult harvest(List<String> queries, List<FilterCombination> filters) {
		int totalUnits = queries.size() * filters.size();
		checkpointStore.setSessionInfo(configuration.queriesFile().toString(), queries.size(), filters.size());
		logger.info("Harvesting {} query(ies) x {} filter combination(s) = {} work unit(s)", queries.size(),
				filters.size(), totalUnits);

		HarvestOutcome outcome = HarvestOutcome.COMPLETED;
		try {
			grid: for (int queryIndex = 0; queryIndex < queries.size(); queryIndex++) {
				String query = queries.get(queryIndex);
				for (int filterIndex = 0; filterIndex < filters.size(); filterIndex++) {
					if (isStopping()) {
						outcome = HarvestOutcome.INTERRUPTED;
						break grid;
					}

					WorkUnit unit = new WorkUnit(queryIndex, filterIndex);
					if (checkpointStore.isUnitDone(unit)) {
						continue;
					}

					FilterCombination filter = filters.get(filterIndex);
					checkpointStore.updatePosition(unit);
					logger.info("[{}/{}] {}: \"{}\" ({})", checkpointStore.completedCount() + 1, totalUnits,
							unit.describe(), query, filter.describe());

					SearchOutcome searchOutcome = searchDriver.fetchResults(query, filter,
							configuration.targetCount());

					if (searchOutcome instanceof SearchOutcome.AllCredentialsExhausted) {
						SearchOutcome.AllCredentialsExhausted exhausted = (SearchOutcome.AllCredentialsExhausted) searchOutcome;
						logger.warn("All {} credential(s) exhausted, pausing at {}", exhausted.totalCredentials(),
								unit.describe());
						outcome = HarvestOutcome.PAUSED_EXHAUSTED;
						break grid;
					}

					if (searchOutcome instanceof SearchOutcome.TransientError) {
						SearchOutcome.TransientError error = (SearchOutcome.TransientError) searchOutcome;
						if (isStopping()) {
							outcome = HarvestOutcome.INTERRUPTED;
							break grid;
						}
						logger.warn("Search failed for {}, it will be retried on the next run: {}", unit.describe(),
								error.detail());
						checkpointStore.incrementErrors();
						saveCheckpoint();
						continue;
					}

					List<ImageItem> items = ((SearchOutcome.Success) searchOutcome).items();
					if (items.isEmpty()) {
						logger.info("No results for \"{}\" ({})", query, filter.describe());
						checkpointStore.recordNoResults(unit, query, filter);
						checkpointStore.markUnitDone(unit);
						saveCheckpoint();
						continue;
					}

					UnitReport report = processItems(items);
					if (report.interrupted()) {
						logger.info("Stop requested, abandoning {} ({} image(s) already saved)", unit.describe(),
								report.saved());
						outcome = HarvestOutcome.INTERRUPTED;
						break grid;
					}

					checkpointStore.markUnitDone(unit);
					saveCheckpoint();
					logger.info("Found {}, saved {}, duplicates {}, errors {}", report.found(), report.saved(),
							report.duplicates(), report.errors());
				}
			}
		}
		catch (RuntimeException e) {
			try {
				saveCheckpoint();
			}
			catch (RuntimeException saveFailure) {
				e.addSuppressed(saveFailure);
			}
			throw e;
		}

		if (outcome == HarvestOutcome.COMPLETED && checkpointStore.completedCount() < totalUnits) {
			logger.warn("{} unit(s) failed and remain open, run again to retry them",
					totalUnits - checkpointStore.completedCount());
			outcome = HarvestOutcome.INCOMPLETE;
		}

		if (outcome == HarvestOutcome.COMPLETED) {
			checkpointStore.markSessionFinished();
		}
		else {
			saveCheckpoint();
		}

		return new HarvestResult(outcome, totalUnits, checkpointStore.completedCount(), checkpointStore.stats(),
				checkpointStore.noResults(), rotator.status(), checkpointStore.position());
	}

	private UnitReport processItems(List<ImageItem> items) {
		ContentLedger ledger = checkpointStore.ledger();
		int saved = 0;
		int duplicates = 0;
		int errors = 0;

		for (ImageItem item : items) {
			if (isStopping()) {
				return new UnitReport(items.size(), saved, duplicates, errors, true);
			}

			DownloadedImage image;
			try {
				image = downloader.download(item.url());
			}
			catch (ImageFetchException e) {
				if (isStopping()) {
					return new UnitReport(items.size(), saved, duplicates, errors, true);
				}
				logger.warn("Download failed for {}: {}", item.url(), e.getMessage());
				checkpointStore.incrementErrors();
				errors++;
				continue;
			}

			String hash = ContentHashes.sha256Hex(image.content());
			if (ledger.isDuplicate(hash)) {
				logger.debug("Duplicate content {} from {}", hash, item.url());
				checkpointStore.incrementDuplicates();
				duplicates++;
				continue;
			}

			int sequenceNumber = ledger.nextSequenceNumber();
			String extension = ImageFileNames.extensionFor(item.url(), image.contentType());
			String fileName = ImageFileNames.fileName(configuration.filenamePrefix(), sequenceNumber, item.url(),
					extension);
			try {
				imageStore.write(fileName, image.content());
			}
			catch (IOException e) {
				if (isStopping()) {
					return new UnitReport(items.size(), saved, duplicates, errors, true);
				}
				logger.warn("Failed to write {}: {}", fileName, e.getMessage());
				checkpointStore.incrementErrors();
				errors++;
				continue;
			}

			ledger.accept(hash);
			checkpointStore.incrementSaved();
			saved++;
			logger.info("Saved {}", fileName);
		}

		return new UnitReport(items.size(), saved, duplicates, errors, false);
	}

	private boolean isStopping() {
		return stopRequested.get() || Thread.currentThread().isInterrupted();
	}

	// Interruptible file channels refuse to write while the interrupt flag is set
	private void saveCheckpoint() {
		boolean interrupted = Thread.interrupted();
		try {
			checkpointStore.save();
		}
		finally {
			if (interrupted) {
				Thread.currentThread().interrupt();
			}
		}
	}

}
