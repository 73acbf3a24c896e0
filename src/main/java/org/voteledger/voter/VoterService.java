package org.voteledger.voter;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.voteledger.biometric.BiometricSamples;
import org.voteledger.biometric.BiometricVerifier;
import org.voteledger.election.ElectionPhase;
import org.voteledger.election.ElectionService;
import org.voteledger.election.PhaseResolver;
import org.voteledger.ledger.LedgerCall;
import org.voteledger.ledger.LedgerTxReceipt;
import org.voteledger.ledger.TransactionSubmitter;
import org.voteledger.util.VoteLedgerException;
import org.voteledger.vote.EnrollmentHasher;

import java.util.List;
import java.util.Optional;

/**
 * Registers voters for elections.
 *
 * One registration per voter and election. A second registration for the same enrollment and election
 * is refused here, before it reaches the ledger, so that nobody can commit a second face hash for an election.
 * A voter who is already known must present the same face. Their stored template is never replaced.
 */
@Slf4j
@ApplicationScoped
public class VoterService {

	@Inject
	VoterRegistry registry;

	@Inject
	ElectionService electionService;

	@Inject
	PhaseResolver phaseResolver;

	@Inject
	TransactionSubmitter submitter;

	@Inject
	BiometricVerifier biometricVerifier;

	@Inject
	EnrollmentHasher hasher;

	/**
	 * Register a voter for an election, on the ledger and then locally.
	 *
	 * @param electionId ledger id of the election. Must be CREATED or ACTIVE (and not expired).
	 * @param enrollment the voter's enrollment id
	 * @param name display name. Only used when the voter is new.
	 * @param base64Sample the voter's face embedding, base64 encoded
	 * @return the confirmed registration
	 * @throws VoteLedgerException ALREADY_ACTED when this voter is already registered for this election,
	 *    BIOMETRIC_MISMATCH when a known voter presents another face, or any of the ledger errors
	 */
	public RegistrationResponse registerVoter(Long electionId, String enrollment, String name, String base64Sample) throws VoteLedgerException {
		if (electionId == null || isBlank(enrollment) || isBlank(name))
			throw new VoteLedgerException(VoteLedgerException.Errors.VALIDATION_ERROR, "electionId, enrollment, name and sample are required");
		byte[] sample = BiometricSamples.decode(base64Sample);
		String enrollmentId = enrollment.trim();

		electionService.checkExists(electionId);
		phaseResolver.requirePhase(electionId, "register voter", ElectionPhase.CREATED, ElectionPhase.ACTIVE);

		byte[] template;
		Optional<VoterEntity> known = registry.findVoter(enrollmentId);
		if (known.isPresent()) {
			VoterEntity voter = known.get();
			if (registry.isRegistered(voter, electionId))
				throw new VoteLedgerException(VoteLedgerException.Errors.ALREADY_ACTED, "Voter already registered for this election");
			if (!biometricVerifier.matches(voter.getBiometricTemplate(), sample))
				throw new VoteLedgerException(VoteLedgerException.Errors.BIOMETRIC_MISMATCH, "Face does not match the registered voter");
			template = voter.getBiometricTemplate();
		} else {
			template = biometricVerifier.encode(sample);
		}

		String faceHash = biometricVerifier.digest(template);
		String enrollmentHash = hasher.enrollmentHash(enrollmentId, electionId);

		LedgerTxReceipt receipt = submitter.submit(LedgerCall.registerVoter(electionId, enrollmentId, faceHash));

		VoterElectionRegistrationEntity registration = registry.recordRegistration(enrollmentId, name.trim(), template, electionId, enrollmentHash, faceHash);
		return new RegistrationResponse(registration.getVoter().getId(), electionId, hasher.visibleTag(enrollmentHash), receipt.getTxHash(), receipt.getBlockNumber());
	}

	public List<VoterEntity> listVoters() {
		return registry.listVoters();
	}

	private static boolean isBlank(String s) {
		return s == null || s.isBlank();
	}
}
