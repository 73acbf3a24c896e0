package org.voteledger.voter;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.binary.Base64;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInfo;
import org.voteledger.VoteLedgerTestUtils;
import org.voteledger.election.ElectionService;
import org.voteledger.ledger.InMemoryLedgerClient;
import org.voteledger.util.VoteLedgerException;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Slf4j
@QuarkusTest
public class VoterServiceTest {

	@Inject
	VoterService voterService;

	@Inject
	VoterRegistry voterRegistry;

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
	public void registerVoter() throws VoteLedgerException {
		long electionId = electionService.createElection("E", "", true, null).getElectionId();

		RegistrationResponse res = voterService.registerVoter(electionId, " E100 ", "Erin", VoteLedgerTestUtils.sample(0.1f));
		assertNotNull(res.getVoterId());
		assertEquals(electionId, res.getElectionId());
		assertNotNull(res.getTxHash());
		assertTrue(res.getVisibleTag().startsWith("0x"));

		VoterEntity voter = voterRegistry.findVoter("E100").orElseThrow();
		assertEquals("Erin", voter.getName());
		assertTrue(voterRegistry.isRegistered(voter, electionId));
	}

	@Test
	public void duplicateRegistrationIsRefusedLocally() throws VoteLedgerException {
		long electionId = electionService.createElection("E", "", true, null).getElectionId();
		voterService.registerVoter(electionId, "E100", "Erin", VoteLedgerTestUtils.sample(0.1f));
		int sentBefore = fakeLedger.getSentCalls().size();

		VoteLedgerException ex = assertThrows(VoteLedgerException.class,
				() -> voterService.registerVoter(electionId, "E100", "Erin", VoteLedgerTestUtils.sample(0.1f)));
		assertEquals(VoteLedgerException.Errors.ALREADY_ACTED, ex.getError());
		assertEquals(sentBefore, fakeLedger.getSentCalls().size(), "no second registration must reach the ledger");
	}

	@Test
	public void knownVoterKeepsTemplateInNextElection() throws VoteLedgerException {
		long first = electionService.createElection("A", "", true, null).getElectionId();
		long second = electionService.createElection("B", "", true, null).getElectionId();
		String original = VoteLedgerTestUtils.sample(0.1f);

		voterService.registerVoter(first, "E100", "Erin", original);
		voterService.registerVoter(second, "E100", "Someone else", VoteLedgerTestUtils.sample(0.7f));

		VoterEntity voter = voterRegistry.findVoter("E100").orElseThrow();
		assertArrayEquals(Base64.decodeBase64(original), voter.getBiometricTemplate());
		assertEquals("Erin", voter.getName());
		assertEquals(1, voterRegistry.countVoters());
		assertTrue(voterRegistry.isRegistered(voter, second));
	}

	@Test
	public void registrationClosesWhenElectionEnds() throws VoteLedgerException {
		long electionId = electionService.createElection("E", "", true, null).getElectionId();
		electionService.addCandidate(electionId, "Alice");
		electionService.startElection(electionId);
		voterService.registerVoter(electionId, "E100", "Erin", VoteLedgerTestUtils.sample(0.1f));
		electionService.endElection(electionId);

		VoteLedgerException ex = assertThrows(VoteLedgerException.class,
				() -> voterService.registerVoter(electionId, "E200", "Eve", VoteLedgerTestUtils.sample(0.2f)));
		assertEquals(VoteLedgerException.Errors.PHASE_GATE, ex.getError());
		assertTrue(voterRegistry.findVoter("E200").isEmpty());
	}

	@Test
	public void invalidRegistrations() throws VoteLedgerException {
		long electionId = electionService.createElection("E", "", true, null).getElectionId();

		VoteLedgerException noName = assertThrows(VoteLedgerException.class,
				() -> voterService.registerVoter(electionId, "E100", " ", VoteLedgerTestUtils.sample(0.1f)));
		assertEquals(VoteLedgerException.Errors.VALIDATION_ERROR, noName.getError());

		VoteLedgerException notBase64 = assertThrows(VoteLedgerException.class,
				() -> voterService.registerVoter(electionId, "E100", "Erin", "not base64 !!"));
		assertEquals(VoteLedgerException.Errors.VALIDATION_ERROR, notBase64.getError());

		VoteLedgerException unknownElection = assertThrows(VoteLedgerException.class,
				() -> voterService.registerVoter(electionId + 5, "E100", "Erin", VoteLedgerTestUtils.sample(0.1f)));
		assertEquals(VoteLedgerException.Errors.NOT_FOUND, unknownElection.getError());
	}

	@Test
	public void ledgerDownDuringRegistration() throws VoteLedgerException {
		long electionId = electionService.createElection("E", "", true, null).getElectionId();
		fakeLedger.setReachable(false);

		VoteLedgerException ex = assertThrows(VoteLedgerException.class,
				() -> voterService.registerVoter(electionId, "E100", "Erin", VoteLedgerTestUtils.sample(0.1f)));
		assertEquals(VoteLedgerException.Errors.TRANSPORT_UNAVAILABLE, ex.getError());
		assertTrue(voterRegistry.findVoter("E100").isEmpty(), "nothing is cached without ledger confirmation");
	}

	@Test
	public void listVotersByEnrollment() throws VoteLedgerException {
		long electionId = electionService.createElection("E", "", true, null).getElectionId();
		voterService.registerVoter(electionId, "E300", "Carl", VoteLedgerTestUtils.sample(0.3f));
		voterService.registerVoter(electionId, "E100", "Erin", VoteLedgerTestUtils.sample(0.1f));

		List<VoterEntity> voters = voterService.listVoters();
		assertEquals(2, voters.size());
		assertEquals("E100", voters.get(0).getEnrollment());
		assertEquals("E300", voters.get(1).getEnrollment());
	}
}
