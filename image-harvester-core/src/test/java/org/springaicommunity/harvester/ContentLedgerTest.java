package org.springaicommunity.harvester;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

@DisplayName("ContentLedger Tests")
class ContentLedgerTest {

	private ContentLedger ledger;

	@BeforeEach
	void setUp() {
		ledger = new ContentLedger();
	}

	@Nested
	@DisplayName("Duplicate detection")
	class DuplicateDetectionTest {

		@Test
		@DisplayName("Identical bytes are a duplicate regardless of origin")
		void identicalBytesAreDuplicate() {
			String first = ContentHashes.sha256Hex("same image".getBytes(StandardCharsets.UTF_8));
			String second = ContentHashes.sha256Hex("same image".getBytes(StandardCharsets.UTF_8));

			assertThat(ledger.isDuplicate(first)).isFalse();
			ledger.accept(first);

			assertThat(ledger.isDuplicate(second)).isTrue();
			assertThat(ledger.size()).isEqualTo(1);
		}

		@Test
		@DisplayName("Different bytes are not duplicates")
		void differentBytesAreNotDuplicates() {
			ledger.accept(ContentHashes.sha256Hex(new byte[] { 1, 2, 3 }));

			assertThat(ledger.isDuplicate(ContentHashes.sha256Hex(new byte[] { 1, 2, 4 }))).isFalse();
		}

		@Test
		@DisplayName("tryAccept reports whether the hash was new")
		void tryAcceptReportsNovelty() {
			assertThat(ledger.tryAccept("abc")).isTrue();
			assertThat(ledger.tryAccept("abc")).isFalse();
			assertThat(ledger.seenHashes()).containsExactly("abc");
		}

		@Test
		@DisplayName("SHA-256 digest is lowercase hex")
		void digestIsLowercaseHex() {
			assertThat(ContentHashes.sha256Hex(new byte[0]))
				.isEqualTo("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855");
		}

	}

	@Nested
	@DisplayName("Sequence numbers")
	class SequenceNumberTest {

		@Test
		@DisplayName("Numbers start at 1 and increase strictly")
		void numbersIncrease() {
			assertThat(ledger.counter()).isZero();
			assertThat(ledger.nextSequenceNumber()).isEqualTo(1);
			assertThat(ledger.nextSequenceNumber()).isEqualTo(2);
			assertThat(ledger.counter()).isEqualTo(2);
		}

		@Test
		@DisplayName("Restored counter continues numbering without reuse")
		void restoredCounterContinues() {
			ledger.restore(List.of("a", "b"), 7);

			assertThat(ledger.nextSequenceNumber()).isEqualTo(8);
			assertThat(ledger.isDuplicate("a")).isTrue();
		}

		@Test
		@DisplayName("Negative counter is rejected")
		void negativeCounterRejected() {
			assertThatThrownBy(() -> ledger.restore(List.of(), -1)).isInstanceOf(IllegalArgumentException.class);
		}

	}

	@Test
	@DisplayName("Seen hashes cannot be modified from outside")
	void seenHashesAreReadOnly() {
		ledger.accept("abc");

		assertThatThrownBy(() -> ledger.seenHashes().add("def")).isInstanceOf(UnsupportedOperationException.class);
	}

}
