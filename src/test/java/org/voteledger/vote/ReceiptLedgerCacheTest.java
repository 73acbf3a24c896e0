package org.voteledger.vote;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInfo;
import org.voteledger.VoteLedgerTestUtils;

import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@QuarkusTest
public class ReceiptLedgerCacheTest {

	@Inject
	ReceiptLedgerCache receiptCache;

	@Inject
	EnrollmentHasher hasher;

	@Inject
	VoteLedgerTestUtils testUtils;

	@BeforeEach
	public void beforeEachTest(TestInfo testInfo) {
		log.info("==========> Starting: " + testInfo.getDisplayName());
		testUtils.resetAll();
	}

	@AfterEach
	public void afterEachTest(TestInfo testInfo) {
		log.info("<========== Finished: " + testInfo.getDisplayName());
	}

	@Test
	public void recordedReceiptNeverChanges() {
		String hash = hasher.enrollmentHash("E100", 3);
		receiptCache.record(7, 3, hash, hasher.visibleTag(hash), "0xaaa", 10L);
		VoteReceiptEntity first = receiptCache.lookupById(7).orElseThrow();

		// a second record with the same receiptId must not overwrite anything
		VoteReceiptEntity again = receiptCache.record(7, 4, "0xother", "0xother", "0xbbb", 11L);
		assertEquals("0xaaa", again.getTxHash());

		for (int i = 0; i < 3; i++) {
			VoteReceiptEntity lookup = receiptCache.lookupById(7).orElseThrow();
			assertEquals(first.getReceiptId(), lookup.getReceiptId());
			assertEquals(first.getElectionId(), lookup.getElectionId());
			assertEquals(first.getEnrollmentHash(), lookup.getEnrollmentHash());
			assertEquals(first.getVisibleTag(), lookup.getVisibleTag());
			assertEquals(first.getTxHash(), lookup.getTxHash());
			assertEquals(first.getBlockNumber(), lookup.getBlockNumber());
			assertEquals(first.getIssuedAt(), lookup.getIssuedAt());
		}
	}

	@Test
	public void unknownReceiptIsAbsent() {
		assertTrue(receiptCache.lookupById(4711).isEmpty());
	}

	@Test
	public void lookupByHashAndElectionIsConfident() {
		String hash = hasher.enrollmentHash("E100", 3);
		receiptCache.record(1, 3, hash, hasher.visibleTag(hash), "0xaaa", 10L);

		ReceiptMatch match = receiptCache.lookupByEnrollmentHash(hash, 3).orElseThrow();
		assertEquals(1L, match.getReceipt().getReceiptId());
		assertFalse(match.isLowConfidence());
	}

	@Test
	public void hashOnlyFallbackIsLowConfidence() {
		// cache row was written with an election id that drifted from the ledger's
		String hash = hasher.enrollmentHash("E100", 3);
		receiptCache.record(1, 5, hash, hasher.visibleTag(hash), "0xaaa", 10L);

		Optional<ReceiptMatch> match = receiptCache.lookupByEnrollmentHash(hash, 3);
		assertTrue(match.isPresent());
		assertTrue(match.get().isLowConfidence());
		assertEquals(5L, match.get().getReceipt().getElectionId());

		assertTrue(receiptCache.lookupByEnrollmentHash(hasher.enrollmentHash("E200", 3), 3).isEmpty());
	}
}
