package org.springaicommunity.harvester;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for ArgumentParser using plain JUnit only. No Spring context and no credentials.
 */
@DisplayName("ArgumentParser Tests - Plain JUnit Only")
class ArgumentParserTest {

	private HarvesterProperties defaultProperties;

	private ArgumentParser argumentParser;

	@BeforeEach
	void setUp() {
		defaultProperties = new HarvesterProperties();
		argumentParser = new ArgumentParser(defaultProperties);
	}

	@Nested
	@DisplayName("Basic Argument Parsing Tests")
	class BasicArgumentParsingTest {

		@Test
		@DisplayName("Should use default values for unparsed arguments")
		void shouldUseDefaultValues() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] {});

			assertThat(config.queriesFile).isEqualTo("queries.txt");
			assertThat(config.targetCount).isEqualTo(100);
			assertThat(config.outputDirectory).isEqualTo(defaultProperties.getOutputDirectory());
			assertThat(config.filenamePrefix).isEqualTo("image");
			assertThat(config.checkpointFile).isEqualTo("progress.json");
			assertThat(config.filterMode).isEqualTo(FilterMode.SIZE_ONLY);
			assertThat(config.fresh).isFalse();
			assertThat(config.verbose).isFalse();
		}

		@Test
		@DisplayName("Should parse long options")
		void shouldParseLongOptions() {
			String[] args = { "--queries", "potholes.txt", "--count", "25", "--output", "./out", "--prefix",
					"pothole", "--checkpoint", "state/progress.json" };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.queriesFile).isEqualTo("potholes.txt");
			assertThat(config.targetCount).isEqualTo(25);
			assertThat(config.outputDirectory).isEqualTo("./out");
			assertThat(config.filenamePrefix).isEqualTo("pothole");
			assertThat(config.checkpointFile).isEqualTo("state/progress.json");
		}

		@Test
		@DisplayName("Should parse short options")
		void shouldParseShortOptions() {
			String[] args = { "-q", "q.txt", "-c", "7", "-o", "dir", "-p", "crack", "-v" };

			ParsedConfiguration config = argumentParser.parseAndValidate(args);

			assertThat(config.queriesFile).isEqualTo("q.txt");
			assertThat(config.targetCount).isEqualTo(7);
			assertThat(config.outputDirectory).isEqualTo("dir");
			assertThat(config.filenamePrefix).isEqualTo("crack");
			assertThat(config.verbose).isTrue();
		}

		@Test
		@DisplayName("Should parse boolean flags correctly")
		void shouldParseBooleanFlags() {
			ParsedConfiguration config = argumentParser.parseAndValidate(new String[] { "--fresh", "--verbose" });

			assertThat(config.fresh).isTrue();
			assertThat(config.verbose).isTrue();
		}

	}

	@Nested
	@DisplayName("Filter Option Tests")
	class FilterOptionTest {

		@Test
		@DisplayName("Each filter flag selects its mode")
		void eachFlagSelectsMode() {
			assertThat(argumentParser.parseAndValidate(new String[] { "--no-filters" }).filterMode)
				.isEqualTo(FilterMode.NONE);
			assertThat(argumentParser.parseAndValidate(new String[] { "--date-only" }).filterMode)
				.isEqualTo(FilterMode.DATE_ONLY);
			assertThat(argumentParser.parseAndValidate(new String[] { "--size-only" }).filterMode)
				.isEqualTo(FilterMode.SIZE_ONLY);
			assertThat(argumentParser.parseAndValidate(new String[] { "--all-filters" }).filterMode)
				.isEqualTo(FilterMode.ALL);
		}

		@Test
		@DisplayName("Two filter flags are rejected")
		void rejectsConflictingFilterFlags() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--no-filters", "--date-only" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Only one of --no-filters");
		}

		@Test
		@DisplayName("Repeating the same filter flag is rejected too")
		void rejectsRepeatedFilterFlag() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--size-only", "--size-only" }))
				.isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Nested
	@DisplayName("Validation Tests")
	class ValidationTest {

		@ParameterizedTest
		@ValueSource(strings = { "0", "-5", "101" })
		@DisplayName("Should reject counts outside 1..100")
		void shouldRejectCountOutOfRange(String count) {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--count", count }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageStartingWith("Configuration validation failed:");
		}

		@Test
		@DisplayName("Should accept the largest count")
		void shouldAcceptMaxCount() {
			assertThat(argumentParser.parseAndValidate(new String[] { "--count", "100" }).targetCount).isEqualTo(100);
		}

		@Test
		@DisplayName("Should reject a non-numeric count")
		void shouldRejectNonNumericCount() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--count", "many" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Invalid count 'many'");
		}

		@ParameterizedTest
		@ValueSource(strings = { "bad prefix", "a/b", "x:y" })
		@DisplayName("Should reject prefixes unsafe for file names")
		void shouldRejectUnsafePrefix(String prefix) {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--prefix", prefix }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("Prefix may only contain");
		}

		@Test
		@DisplayName("Should collect every validation error in one message")
		void shouldCollectAllErrors() {
			String[] args = { "--count", "0", "--prefix", " ", "--output", "" };

			assertThatThrownBy(() -> argumentParser.parseAndValidate(args)).hasMessageContaining("Count must be positive")
				.hasMessageContaining("Prefix cannot be empty")
				.hasMessageContaining("Output directory cannot be empty");
		}

		@Test
		@DisplayName("Should reject a missing option value")
		void shouldRejectMissingValue() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--queries" }))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessage("Missing value for queries option");
		}

		@Test
		@DisplayName("Should reject unknown options and positional arguments")
		void shouldRejectUnknownArguments() {
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "--dry-run" }))
				.hasMessage("Unknown option: --dry-run");
			assertThatThrownBy(() -> argumentParser.parseAndValidate(new String[] { "potholes" }))
				.hasMessage("Unexpected argument: potholes");
		}

	}

	@Nested
	@DisplayName("Help Tests")
	class HelpTest {

		@Test
		@DisplayName("Should detect help flags anywhere in the arguments")
		void shouldDetectHelp() {
			assertThat(argumentParser.isHelpRequested(new String[] { "--count", "5", "-h" })).isTrue();
			assertThat(argumentParser.isHelpRequested(new String[] { "--help" })).isTrue();
			assertThat(argumentParser.isHelpRequested(new String[] { "--fresh" })).isFalse();
		}

		@Test
		@DisplayName("Help text lists options, defaults and exit codes")
		void helpTextContent() {
			defaultProperties.setTargetCount(40);

			String help = argumentParser.generateHelpText();

			assertThat(help).contains("Usage: image-harvester", "--queries", "--all-filters", "API_KEY_1",
					"(default: 40)", "default: size-only", "3 paused");
		}

	}

}
