package org.springaicommunity.harvester;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Spring configuration exposing the harvester collaborators as beans.
 */
@Configuration
public class HarvesterConfig {

	@Bean
	public HarvesterProperties harvesterProperties() {
		return new HarvesterProperties();
	}

	@Bean
	public HarvestConfiguration harvestConfiguration(HarvesterProperties harvesterProperties) {
		return HarvestConfiguration.fromProperties(harvesterProperties);
	}

	@Bean
	public ObjectMapper objectMapper() {
		return ObjectMapperFactory.create();
	}

	@Bean
	public CredentialLoader credentialLoader() {
		return new CredentialLoader(EnvironmentSupport::get);
	}

	@Bean
	public CredentialRotator credentialRotator(CredentialLoader credentialLoader) {
		List<Credential> credentials = credentialLoader.loadRequired();
		return new CredentialRotator(credentials);
	}

	@Bean
	public ImageSearchClient imageSearchClient(ObjectMapper objectMapper, HarvestConfiguration harvestConfiguration) {
		return RetryingImageSearchClient.builder()
			.wrapping(new CustomSearchHttpClient(objectMapper, harvestConfiguration.requestTimeout()))
			.maxRetries(harvestConfiguration.maxSearchRetries())
			.initialDelay(harvestConfiguration.retryDelay())
			.build();
	}

	@Bean
	public SearchDriver searchDriver(ImageSearchClient imageSearchClient, CredentialRotator credentialRotator) {
		return new SearchDriver(imageSearchClient, credentialRotator);
	}

	@Bean
	public CheckpointRepository checkpointRepository(ObjectMapper objectMapper,
			HarvestConfiguration harvestConfiguration) {
		return new FileSystemCheckpointRepository(objectMapper, harvestConfiguration.checkpointFile());
	}

	@Bean
	public CheckpointStore checkpointStore(CheckpointRepository checkpointRepository) {
		return new CheckpointStore(checkpointRepository);
	}

	@Bean
	public ImageDownloader imageDownloader(HarvestConfiguration harvestConfiguration) {
		return new HttpImageDownloader(harvestConfiguration.requestTimeout());
	}

	@Bean
	public ImageStore imageStore(HarvestConfiguration harvestConfiguration) {
		return new FileSystemImageStore(harvestConfiguration.outputDirectory());
	}

	@Bean
	public HarvestOrchestrator harvestOrchestrator(HarvestConfiguration harvestConfiguration,
			SearchDriver searchDriver, CredentialRotator credentialRotator, ImageDownloader imageDownloader,
			ImageStore imageStore, CheckpointStore checkpointStore) {
		return new HarvestOrchestrator(harvestConfiguration, searchDriver, credentialRotator, imageDownloader,
				imageStore, checkpointStore);
	}

}
