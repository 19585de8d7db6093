package org.springaicommunity.harvester;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.Nullable;

import java.time.Clock;
import java.util.List;

/**
 * Builder for wiring a {@link HarvestOrchestrator} without Spring dependencies.
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>
 * {@code
 * // Credentials from the environment, everything else from the properties
 * HarvestOrchestrator orchestrator = ImageHarvesterBuilder.create()
 *     .credentialsFromEnv()
 *     .properties(properties)
 *     .buildOrchestrator();
 *
 * // For testing with mock collaborators
 * HarvestOrchestrator testOrchestrator = ImageHarvesterBuilder.create()
 *     .credentials(List.of(new Credential("key", "cx")))
 *     .searchClient(mockSearchClient)
 *     .downloader(mockDownloader)
 *     .imageStore(mockImageStore)
 *     .checkpointRepository(inMemoryRepository)
 *     .buildOrchestrator();
 * }
 * </pre>
 */
public class ImageHarvesterBuilder {

	private HarvesterProperties properties;

	@Nullable
	private HarvestConfiguration configuration;

	@Nullable
	private List<Credential> credentials;

	@Nullable
	private ObjectMapper objectMapper;

	@Nullable
	private ImageSearchClient searchClient;

	@Nullable
	private ImageDownloader downloader;

	@Nullable
	private ImageStore imageStore;

	@Nullable
	private CheckpointRepository checkpointRepository;

	private Clock clock = Clock.systemDefaultZone();

	private ImageHarvesterBuilder() {
		this.properties = new HarvesterProperties();
	}

	/**
	 * Create a new builder instance.
	 * @return new ImageHarvesterBuilder
	 */
	public static ImageHarvesterBuilder create() {
		return new ImageHarvesterBuilder();
	}

	/**
	 * Set harvester properties.
	 * @param properties configuration properties (null to use defaults)
	 * @return this builder
	 */
	public ImageHarvesterBuilder properties(@Nullable HarvesterProperties properties) {
		if (properties != null) {
			this.properties = properties;
		}
		return this;
	}

	/**
	 * Set the resolved run configuration. Takes precedence over {@link #properties}.
	 * @param configuration run configuration
	 * @return this builder
	 */
	public ImageHarvesterBuilder configuration(@Nullable HarvestConfiguration configuration) {
		this.configuration = configuration;
		return this;
	}

	/**
	 * Set the credential pool directly.
	 * @param credentials credentials in rotation order
	 * @return this builder
	 */
	public ImageHarvesterBuilder credentials(List<Credential> credentials) {
		this.credentials = List.copyOf(credentials);
		return this;
	}

	/**
	 * Read the credential pool from the environment.
	 * @return this builder
	 * @throws IllegalStateException if no credential is configured
	 */
	public ImageHarvesterBuilder credentialsFromEnv() {
		this.credentials = new CredentialLoader(EnvironmentSupport::get).loadRequired();
		return this;
	}

	/**
	 * Set a custom ObjectMapper for the checkpoint file.
	 * @param objectMapper Jackson ObjectMapper (null to use default)
	 * @return this builder
	 */
	public ImageHarvesterBuilder objectMapper(@Nullable ObjectMapper objectMapper) {
		this.objectMapper = objectMapper;
		return this;
	}

	/**
	 * Set a custom search client. It is used as given, without the retry decorator.
	 * @param searchClient custom implementation (null to use default)
	 * @return this builder
	 */
	public ImageHarvesterBuilder searchClient(@Nullable ImageSearchClient searchClient) {
		this.searchClient = searchClient;
		return this;
	}

	public ImageHarvesterBuilder downloader(@Nullable ImageDownloader downloader) {
		this.downloader = downloader;
		return this;
	}

	public ImageHarvesterBuilder imageStore(@Nullable ImageStore imageStore) {
		this.imageStore = imageStore;
		return this;
	}

	/**
	 * Set a custom checkpoint repository. Useful for testing or alternative storage
	 * backends.
	 * @param checkpointRepository custom implementation (null to use the file system)
	 * @return this builder
	 */
	public ImageHarvesterBuilder checkpointRepository(@Nullable CheckpointRepository checkpointRepository) {
		this.checkpointRepository = checkpointRepository;
		return this;
	}

	public ImageHarvesterBuilder clock(Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Build a fully wired orchestrator.
	 * @return configured HarvestOrchestrator
	 * @throws IllegalStateException if no credentials were given
	 */
	public HarvestOrchestrator buildOrchestrator() {
		if (credentials == null || credentials.isEmpty()) {
			throw new IllegalStateException(
					"Credentials are required. Call credentials(...) or credentialsFromEnv() before building.");
		}

		HarvestConfiguration config = resolveConfiguration();
		ObjectMapper mapper = objectMapper != null ? objectMapper : ObjectMapperFactory.create();

		CredentialRotator rotator = new CredentialRotator(credentials);
		SearchDriver searchDriver = new SearchDriver(resolveSearchClient(config, mapper), rotator);

		CheckpointRepository repository = checkpointRepository != null ? checkpointRepository
				: new FileSystemCheckpointRepository(mapper, config.checkpointFile());
		CheckpointStore checkpointStore = new CheckpointStore(repository, clock);

		ImageDownloader resolvedDownloader = downloader != null ? downloader
				: new HttpImageDownloader(config.requestTimeout());
		ImageStore resolvedStore = imageStore != null ? imageStore : new FileSystemImageStore(config.outputDirectory());

		return new HarvestOrchestrator(config, searchDriver, rotator, resolvedDownloader, resolvedStore,
				checkpointStore);
	}

	private HarvestConfiguration resolveConfiguration() {
		return configuration != null ? configuration : HarvestConfiguration.fromProperties(properties);
	}

	private ImageSearchClient resolveSearchClient(HarvestConfiguration config, ObjectMapper mapper) {
		if (searchClient != null) {
			return searchClient;
		}
		return RetryingImageSearchClient.builder()
			.wrapping(new CustomSearchHttpClient(mapper, config.requestTimeout()))
			.maxRetries(config.maxSearchRetries())
			.initialDelay(config.retryDelay())
			.build();
	}

}
