package org.springaicommunity.harvester;

import org.jspecify.annotations.Nullable;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Serialized form of the checkpoint file. Field names become snake_case keys through
 * {@link ObjectMapperFactory}.
 *
 * <p>
 * Every field may be missing from a hand-edited or older file, hence the nullable
 * components; {@link CheckpointStore} supplies the defaults.
 */
public record CheckpointDocument(@Nullable SessionStatus status, @Nullable LocalDateTime startedAt,
		@Nullable LocalDateTime updatedAt, @Nullable String queriesFile, int totalQueries, int totalCombinations,
		@Nullable Position currentPosition, @Nullable List<Position> completed, @Nullable Stats stats,
		@Nullable List<NoResultEntry> noResults, @Nullable List<String> seenHashes, int imageCounter) {

	/**
	 * A work unit address.
	 */
	public record Position(int queryIndex, int filterIndex) {

		public static Position of(WorkUnit unit) {
			return new Position(unit.queryIndex(), unit.filterIndex());
		}

		public WorkUnit toWorkUnit() {
			return new WorkUnit(queryIndex, filterIndex);
		}

	}

	/**
	 * Persisted counters.
	 */
	public record Stats(int imagesSaved, int duplicatesSkipped, int errors, int noResults) {

		public static Stats of(HarvestStats stats) {
			return new Stats(stats.imagesSaved(), stats.duplicatesSkipped(), stats.errors(), stats.noResults());
		}

	}

}
