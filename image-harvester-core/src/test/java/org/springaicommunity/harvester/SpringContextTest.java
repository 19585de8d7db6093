package org.springaicommunity.harvester;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.ApplicationContext;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.test.context.junit.jupiter.SpringJUnitConfig;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Spring context tests for {@link HarvesterConfig}.
 *
 * Credentials come from a fixed map and every path points into a temporary directory, so
 * building the context never reads the real environment, searches or writes into the
 * working directory. The orchestrator is wired but never run.
 */
@SpringJUnitConfig({ HarvesterConfig.class, SpringContextTest.TestConfig.class })
@DisplayName("Image Harvester - Spring Context Tests")
class SpringContextTest {

	@Configuration
	static class TestConfig {

		@Bean
		@Primary
		Path harvestWorkDirectory() throws IOException {
			return Files.createTempDirectory("harvester-context");
		}

		@Bean
		@Primary
		HarvesterProperties testHarvesterProperties(Path harvestWorkDirectory) {
			HarvesterProperties properties = new HarvesterProperties();
			properties.setQueriesFile(harvestWorkDirectory.resolve("queries.txt").toString());
			properties.setOutputDirectory(harvestWorkDirectory.resolve("images").toString());
			properties.setCheckpointFile(harvestWorkDirectory.resolve("progress.json").toString());
			properties.setTargetCount(20);
			return properties;
		}

		@Bean
		@Primary
		CredentialLoader testCredentialLoader() {
			Map<String, String> environment = Map.of("API_KEY_1", "test-key-1", "CX_1", "cx-1", "API_KEY_2",
					"test-key-2", "CX_2", "cx-2");
			return new CredentialLoader(environment::get);
		}

	}

	@Autowired
	private ApplicationContext context;

	@Autowired
	private HarvestConfiguration harvestConfiguration;

	@Autowired
	private Path harvestWorkDirectory;

	@Nested
	@DisplayName("Spring Bean Wiring Validation")
	class SpringBeanWiringTest {

		@Test
		@DisplayName("Should wire the orchestrator and its collaborators")
		void shouldWireOrchestrator() {
			assertThat(context.getBean(HarvestOrchestrator.class)).isNotNull();
			assertThat(context.getBean(SearchDriver.class)).isNotNull();
			assertThat(context.getBean(CheckpointStore.class)).isNotNull();
		}

		@Test
		@DisplayName("Should wrap the HTTP search client in the retry decorator")
		void shouldDecorateSearchClient() {
			assertThat(context.getBean(ImageSearchClient.class)).isInstanceOf(RetryingImageSearchClient.class);
			assertThat(context.getBean(CheckpointRepository.class))
				.isInstanceOf(FileSystemCheckpointRepository.class);
			assertThat(context.getBean(ImageDownloader.class)).isInstanceOf(HttpImageDownloader.class);
		}

		@Test
		@DisplayName("Should build the credential pool from the injected loader")
		void shouldLoadCredentialPool() {
			RotatorStatus status = context.getBean(CredentialRotator.class).status();

			assertThat(status.total()).isEqualTo(2);
			assertThat(status.currentOrdinal()).isEqualTo(1);
		}

	}

	@Nested
	@DisplayName("Configuration Injection")
	class ConfigurationInjectionTest {

		@Test
		@DisplayName("Should resolve the run configuration from the primary properties")
		void shouldResolveConfiguration() {
			assertThat(harvestConfiguration.targetCount()).isEqualTo(20);
			assertThat(harvestConfiguration.checkpointFile()).isEqualTo(harvestWorkDirectory.resolve("progress.json"));
			assertThat(harvestConfiguration.filterMode()).isEqualTo(FilterMode.SIZE_ONLY);
			assertThat(harvestConfiguration.fresh()).isFalse();
		}

		@Test
		@DisplayName("Should create the output directory but no checkpoint")
		void shouldNotWriteCheckpointOnStartup() {
			FileSystemImageStore imageStore = (FileSystemImageStore) context.getBean(ImageStore.class);

			assertThat(imageStore.getOutputDirectory()).isDirectory();
			assertThat(harvestWorkDirectory.resolve("progress.json")).doesNotExist();
		}

	}

}
