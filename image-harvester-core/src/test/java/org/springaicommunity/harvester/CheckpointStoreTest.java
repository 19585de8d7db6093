package org.springaicommunity.harvester;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("CheckpointStore Tests")
class CheckpointStoreTest {

	private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T10:00:00Z"), ZoneOffset.UTC);

	@TempDir
	Path tempDir;

	private Path checkpointFile;

	@BeforeEach
	void setUp() {
		checkpointFile = tempDir.resolve("progress.json");
	}

	private CheckpointStore newStore() {
		return new CheckpointStore(new FileSystemCheckpointRepository(ObjectMapperFactory.create(), checkpointFile),
				CLOCK);
	}

	@Nested
	@DisplayName("Save and resume")
	class ResumeTest {

		@Test
		@DisplayName("A new store with no file starts a new session")
		void noFileStartsFresh() {
			CheckpointStore store = newStore();

			assertThat(store.load()).isFalse();
			assertThat(store.completedCount()).isZero();
			assertThat(store.position()).isEqualTo(new WorkUnit(0, 0));
		}

		@Test
		@DisplayName("Saved state is restored by a second store")
		void roundTrip() {
			CheckpointStore store = newStore();
			store.load();
			store.setSessionInfo("queries.txt", 2, 4);
			store.markUnitDone(new WorkUnit(0, 0));
			store.markUnitDone(new WorkUnit(0, 1));
			store.updatePosition(new WorkUnit(0, 2));
			store.ledger().accept("hash-1");
			store.ledger().nextSequenceNumber();
			store.incrementSaved();
			store.incrementDuplicates();
			store.incrementErrors();
			store.recordNoResults(new WorkUnit(0, 1), "rare", new FilterCombination(null, ImageSize.HUGE));
			store.save();

			CheckpointStore resumed = newStore();

			assertThat(resumed.load()).isTrue();
			assertThat(resumed.isUnitDone(new WorkUnit(0, 0))).isTrue();
			assertThat(resumed.isUnitDone(new WorkUnit(0, 1))).isTrue();
			assertThat(resumed.isUnitDone(new WorkUnit(0, 2))).isFalse();
			assertThat(resumed.position()).isEqualTo(new WorkUnit(0, 2));
			assertThat(resumed.stats()).isEqualTo(new HarvestStats(1, 1, 1, 1));
			assertThat(resumed.noResults()).containsExactly(new NoResultEntry(0, 1, "rare", "imgSize=huge"));
			assertThat(resumed.ledger().isDuplicate("hash-1")).isTrue();
			assertThat(resumed.ledger().nextSequenceNumber()).isEqualTo(2);
			assertThat(resumed.totalQueries()).isEqualTo(2);
			assertThat(resumed.startedAt()).isEqualTo(LocalDateTime.of(2024, 5, 1, 10, 0));
		}

		@Test
		@DisplayName("Completed units are saved in row-major order")
		void completedSortedOnSave() {
			CheckpointStore store = newStore();
			store.markUnitDone(new WorkUnit(1, 0));
			store.markUnitDone(new WorkUnit(0, 3));

			assertThat(store.toDocument().completed()).containsExactly(new CheckpointDocument.Position(0, 3),
					new CheckpointDocument.Position(1, 0));
		}

		@Test
		@DisplayName("A completed session is not resumed but stays available for reporting")
		void completedSessionStartsFresh() {
			CheckpointStore store = newStore();
			store.markUnitDone(new WorkUnit(0, 0));
			store.incrementSaved();
			store.markSessionFinished();

			CheckpointStore next = newStore();

			assertThat(next.load()).isFalse();
			assertThat(next.completedCount()).isZero();
			assertThat(next.stats()).isEqualTo(HarvestStats.EMPTY);
			assertThat(next.previousSession()).hasValueSatisfying(
					previous -> assertThat(previous.status()).isEqualTo(SessionStatus.COMPLETED));
		}

		@Test
		@DisplayName("Discard deletes the file and clears state")
		void discardClears() {
			CheckpointStore store = newStore();
			store.markUnitDone(new WorkUnit(0, 0));
			store.save();

			store.discard();

			assertThat(checkpointFile).doesNotExist();
			assertThat(store.completedCount()).isZero();
		}

	}

	@Nested
	@DisplayName("Corrupt checkpoints")
	class CorruptTest {

		@Test
		@DisplayName("Unparseable file is treated as no prior session")
		void unparseable() throws IOException {
			Files.writeString(checkpointFile, "{{{ definitely not json");

			CheckpointStore store = newStore();

			assertThat(store.load()).isFalse();
			assertThat(store.completedCount()).isZero();
		}

		@Test
		@DisplayName("A file holding JSON null is treated as no prior session")
		void jsonNull() throws IOException {
			Files.writeString(checkpointFile, "null");

			CheckpointStore store = newStore();

			assertThat(store.load()).isFalse();
			assertThat(store.completedCount()).isZero();
		}

		@Test
		@DisplayName("A null completed entry is treated as no prior session")
		void nullCompletedEntry() throws IOException {
			Files.writeString(checkpointFile, "{\"status\":\"in_progress\",\"completed\":[{\"query_index\":0,"
					+ "\"filter_index\":0},null],\"image_counter\":2}");

			CheckpointStore store = newStore();

			assertThat(store.load()).isFalse();
			assertThat(store.completedCount()).isZero();
			assertThat(store.ledger().counter()).isZero();
		}

		@Test
		@DisplayName("Null hashes or no-result entries are treated as no prior session")
		void nullListEntries() {
			List<String> hashes = new ArrayList<>();
			hashes.add("abc");
			hashes.add(null);
			CheckpointStore withNullHash = new CheckpointStore(new InMemoryCheckpointRepository(
					new CheckpointDocument(SessionStatus.IN_PROGRESS, null, null, null, 1, 1, null, null, null, null,
							hashes, 1)),
					CLOCK);
			List<NoResultEntry> entries = new ArrayList<>();
			entries.add(null);
			CheckpointStore withNullEntry = new CheckpointStore(new InMemoryCheckpointRepository(
					new CheckpointDocument(SessionStatus.IN_PROGRESS, null, null, null, 1, 1, null, null, null,
							entries, List.of(), 0)),
					CLOCK);

			assertThat(withNullHash.load()).isFalse();
			assertThat(withNullHash.ledger().size()).isZero();
			assertThat(withNullEntry.load()).isFalse();
			assertThat(withNullEntry.noResults()).isEmpty();
		}

		@Test
		@DisplayName("Invalid values are treated as no prior session")
		void invalidValues() {
			InMemoryCheckpointRepository repository = new InMemoryCheckpointRepository(
					new CheckpointDocument(SessionStatus.IN_PROGRESS, null, null, null, 1, 1, null,
							List.of(new CheckpointDocument.Position(-1, 0)), null, null, List.of(), 0));
			CheckpointStore store = new CheckpointStore(repository, CLOCK);

			assertThat(store.load()).isFalse();
			assertThat(store.completedCount()).isZero();
		}

		@Test
		@DisplayName("Missing optional sections default to empty")
		void missingSections() {
			InMemoryCheckpointRepository repository = new InMemoryCheckpointRepository(
					new CheckpointDocument(null, null, null, null, 0, 0, null, null, null, null, null, 3));
			CheckpointStore store = new CheckpointStore(repository, CLOCK);

			assertThat(store.load()).isTrue();
			assertThat(store.ledger().counter()).isEqualTo(3);
			assertThat(store.stats()).isEqualTo(HarvestStats.EMPTY);
		}

	}

}
