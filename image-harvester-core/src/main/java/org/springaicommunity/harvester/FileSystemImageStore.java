package org.springaicommunity.harvester;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes images into a single output directory, created on construction.
 */
public class FileSystemImageStore implements ImageStore {

	private static final Logger logger = LoggerFactory.getLogger(FileSystemImageStore.class);

	private final Path outputDirectory;

	public FileSystemImageStore(Path outputDirectory) {
		this.outputDirectory = outputDirectory;
		try {
			Files.createDirectories(outputDirectory);
		}
		catch (IOException e) {
			throw new UncheckedIOException("Failed to create output directory: " + outputDirectory, e);
		}
	}

	@Override
	public void write(String fileName, byte[] content) throws IOException {
		Path target = outputDirectory.resolve(fileName);
		Files.write(target, content);
		logger.debug("Wrote {} ({} bytes)", target, content.length);
	}

	@Override
	public String location() {
		return outputDirectory.toString();
	}

	public Path getOutputDirectory() {
		return outputDirectory;
	}

}
