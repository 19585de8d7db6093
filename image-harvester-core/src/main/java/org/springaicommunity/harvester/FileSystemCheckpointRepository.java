package org.springaicommunity.harvester;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Optional;

/**
 * File system implementation of {@link CheckpointRepository}.
 *
 * <p>
 * The document is written in full to a sibling {@code .tmp} file which then replaces the
 * checkpoint by an atomic move, so a crash mid-write leaves the previous checkpoint in
 * place. File systems without atomic moves fall back to a plain replace.
 */
public class FileSystemCheckpointRepository implements CheckpointRepository {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemCheckpointRepository.class);

	private final ObjectMapper objectMapper;

	private final Path checkpointFile;

	public FileSystemCheckpointRepository(ObjectMapper objectMapper, Path checkpointFile) {
		this.objectMapper = objectMapper;
		this.checkpointFile = checkpointFile;
	}

	@Override
	public Optional<CheckpointDocument> read() throws IOException {
		if (!Files.exists(checkpointFile)) {
			return Optional.empty();
		}
		CheckpointDocument document = objectMapper.readValue(checkpointFile.toFile(), CheckpointDocument.class);
		if (document == null) {
			throw new IOException("Checkpoint file holds no document: " + checkpointFile);
		}
		return Optional.of(document);
	}

	@Override
	public void write(CheckpointDocument document) throws IOException {
		Path parent = checkpointFile.toAbsolutePath().getParent();
		if (parent != null) {
			Files.createDirectories(parent);
		}

		Path tempFile = checkpointFile.resolveSibling(checkpointFile.getFileName() + ".tmp");
		objectMapper.writerWithDefaultPrettyPrinter().writeValue(tempFile.toFile(), document);

		try {
			Files.move(tempFile, checkpointFile, StandardCopyOption.REPLACE_EXISTING,
					StandardCopyOption.ATOMIC_MOVE);
		}
		catch (AtomicMoveNotSupportedException e) {
			logger.debug("Atomic move not supported for {}, replacing in place", checkpointFile);
			Files.move(tempFile, checkpointFile, StandardCopyOption.REPLACE_EXISTING);
		}
	}

	@Override
	public void delete() throws IOException {
		if (Files.deleteIfExists(checkpointFile)) {
			logger.info("Deleted checkpoint {}", checkpointFile);
		}
		Files.deleteIfExists(checkpointFile.resolveSibling(checkpointFile.getFileName() + ".tmp"));
	}

	@Override
	public String location() {
		return checkpointFile.toString();
	}

	public Path getCheckpointFile() {
		return checkpointFile;
	}

}
