package org.springaicommunity.harvester;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads search queries, one per line. Lines are trimmed; blank lines and lines starting
 * with {@code #} are skipped.
 */
public final class QueryFileReader {

	private QueryFileReader() {
	}

	/**
	 * Read the queries of a file.
	 * @param queriesFile UTF-8 text file
	 * @return the queries in file order
	 * @throws IllegalArgumentException if the file is missing or holds no query
	 * @throws IOException if the file cannot be read
	 */
	public static List<String> read(Path queriesFile) throws IOException {
		if (!Files.isRegularFile(queriesFile)) {
			throw new IllegalArgumentException("Queries file not found: " + queriesFile);
		}

		List<String> queries = new ArrayList<>();
		for (String line : Files.readAllLines(queriesFile, StandardCharsets.UTF_8)) {
			String query = line.strip();
			if (!query.isEmpty() && !query.startsWith("#")) {
				queries.add(query);
			}
		}

		if (queries.isEmpty()) {
			throw new IllegalArgumentException("No queries found in " + queriesFile);
		}
		return queries;
	}

}
