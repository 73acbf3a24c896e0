package org.voteledger.election;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInfo;
import org.voteledger.VoteLedgerTestUtils;
import org.voteledger.ledger.InMemoryLedgerClient;
import org.voteledger.util.VoteLedgerException;

import java.time.LocalDateTime;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@QuarkusTest
public class PhaseResolverTest {

	@Inject
	PhaseResolver phaseResolver;

	@Inject
	ElectionService electionService;

	@Inject
	InMemoryLedgerClient fakeLedger;

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
	public void onlyActiveCanExpire() {
		LocalDateTime now = LocalDateTime.of(2025, 5, 1, 12, 0);
		LocalDateTime past = now.minusMinutes(1);
		LocalDateTime future = now.plusMinutes(1);

		assertEquals(ElectionPhase.EXPIRED, PhaseResolver.applyExpiry(ElectionPhase.ACTIVE, past, now));
		assertEquals(ElectionPhase.ACTIVE, PhaseResolver.applyExpiry(ElectionPhase.ACTIVE, future, now));
		assertEquals(ElectionPhase.ACTIVE, PhaseResolver.applyExpiry(ElectionPhase.ACTIVE, null, now));
		assertEquals(ElectionPhase.CREATED, PhaseResolver.applyExpiry(ElectionPhase.CREATED, past, now));
		assertEquals(ElectionPhase.ENDED, PhaseResolver.applyExpiry(ElectionPhase.ENDED, past, now));
		assertEquals(ElectionPhase.RESULT_DECLARED, PhaseResolver.applyExpiry(ElectionPhase.RESULT_DECLARED, past, now));
	}

	@Test
	public void activeElectionWithPastDeadlineIsExpired() throws Exception {
		String pastDeadline = LocalDateTime.now(ZoneOffset.UTC).minusHours(1).withSecond(0).withNano(0).toString();
		long electionId = electionService.createElection("Expiring", "", true, pastDeadline).getElectionId();
		electionService.addCandidate(electionId, "Alice");
		electionService.startElection(electionId);

		assertEquals(1, fakeLedger.getElectionPhase(electionId), "Ledger still says ACTIVE");
		assertEquals(ElectionPhase.EXPIRED, phaseResolver.effectivePhase(electionId));

		VoteLedgerException ex = assertThrows(VoteLedgerException.class, () -> phaseResolver.requireActive(electionId));
		assertEquals(VoteLedgerException.Errors.PHASE_GATE, ex.getError());
	}

	@Test
	public void votingGateRefusesEveryOtherPhase() throws Exception {
		long electionId = electionService.createElection("Gate", "", true, null).getElectionId();
		electionService.addCandidate(electionId, "Alice");
		assertGateCloses(electionId, ElectionPhase.CREATED);

		electionService.startElection(electionId);
		assertEquals(ElectionPhase.ACTIVE, phaseResolver.effectivePhase(electionId));
		assertDoesNotThrow(() -> phaseResolver.requireActive(electionId));

		electionService.endElection(electionId);
		assertGateCloses(electionId, ElectionPhase.ENDED);

		electionService.declareResults(electionId);
		assertGateCloses(electionId, ElectionPhase.RESULT_DECLARED);
	}

	@Test
	public void votingGateFailsClosedWhenLedgerIsDown() throws VoteLedgerException {
		long electionId = electionService.createElection("Down", "", true, null).getElectionId();
		electionService.startElection(electionId);
		fakeLedger.setReachable(false);

		VoteLedgerException ex = assertThrows(VoteLedgerException.class, () -> phaseResolver.requireActive(electionId));
		assertEquals(VoteLedgerException.Errors.PHASE_GATE, ex.getError());

		VoteLedgerException readEx = assertThrows(VoteLedgerException.class, () -> phaseResolver.effectivePhase(electionId));
		assertEquals(VoteLedgerException.Errors.TRANSPORT_UNAVAILABLE, readEx.getError());
	}

	@Test
	public void unknownWireValueIsRejected() {
		VoteLedgerException ex = assertThrows(VoteLedgerException.class, () -> ElectionPhase.fromWire(7));
		assertEquals(VoteLedgerException.Errors.LEDGER_REJECTED, ex.getError());
		assertThrows(VoteLedgerException.class, () -> ElectionPhase.fromWire(-1), "EXPIRED never comes from the ledger");
	}

	private void assertGateCloses(long electionId, ElectionPhase expected) throws VoteLedgerException {
		assertEquals(expected, phaseResolver.effectivePhase(electionId));
		VoteLedgerException ex = assertThrows(VoteLedgerException.class, () -> phaseResolver.requireActive(electionId));
		assertEquals(VoteLedgerException.Errors.PHASE_GATE, ex.getError());
	}
}
