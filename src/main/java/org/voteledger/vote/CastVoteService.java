package org.voteledger.vote;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.voteledger.biometric.BiometricSamples;
import org.voteledger.biometric.BiometricVerifier;
import org.voteledger.election.PhaseResolver;
import org.voteledger.ledger.LedgerCall;
import org.voteledger.ledger.LedgerTxReceipt;
import org.voteledger.ledger.TransactionSubmitter;
import org.voteledger.util.VoteLedgerException;
import org.voteledger.voter.VoterEntity;
import org.voteledger.voter.VoterRegistry;

/**
 * This service handles everything related to casting a vote.
 *
 * The voter's choice only goes to the ledger. Locally we only record the receipt,
 * which proves that a vote was cast but not for whom.
 */
@Slf4j
@ApplicationScoped
public class CastVoteService {

	public static final String ALREADY_VOTED_MESSAGE = "You already voted in this election";

	@Inject
	PhaseResolver phaseResolver;

	@Inject
	VoterRegistry voterRegistry;

	@Inject
	BiometricVerifier biometricVerifier;

	@Inject
	EnrollmentHasher hasher;

	@Inject
	TransactionSubmitter submitter;

	@Inject
	ReceiptLedgerCache receiptCache;

	/**
	 * A registered voter casts their vote.
	 *
	 * @param electionId ledger id of the election. Must be ACTIVE and not expired.
	 * @param enrollment the voter's enrollment id
	 * @param candidateId 1-based id of the candidate
	 * @param base64Sample fresh face embedding of the voter, base64 encoded
	 * @return the receipt of the confirmed vote. Once the ledger confirmed the vote, a receipt is returned,
	 *   even when it could not be cached (receiptCached=false). receiptId is null when it could not be read.
	 * @throws VoteLedgerException VALIDATION_ERROR, PHASE_GATE, NOT_FOUND, BIOMETRIC_MISMATCH or any ledger error.
	 *   A second vote is ALREADY_ACTED.
	 */
	public CastVoteResponse castVote(Long electionId, String enrollment, Long candidateId, String base64Sample) throws VoteLedgerException {
		if (electionId == null || enrollment == null || enrollment.isBlank() || candidateId == null)
			throw new VoteLedgerException(VoteLedgerException.Errors.VALIDATION_ERROR, "electionId, enrollment, candidateId and sample are required");
		if (candidateId < 1)
			throw new VoteLedgerException(VoteLedgerException.Errors.VALIDATION_ERROR, "candidateId must be 1 or higher");
		byte[] sample = BiometricSamples.decode(base64Sample);
		String enrollmentId = enrollment.trim();

		phaseResolver.requireActive(electionId);

		VoterEntity voter = voterRegistry.findVoter(enrollmentId)
				.orElseThrow(VoteLedgerException.supplyAndLog(VoteLedgerException.Errors.NOT_FOUND, "Voter is not registered"));
		if (!biometricVerifier.matches(voter.getBiometricTemplate(), sample))
			throw new VoteLedgerException(VoteLedgerException.Errors.BIOMETRIC_MISMATCH, "Face does not match the registered voter");

		String faceHash = biometricVerifier.digest(voter.getBiometricTemplate());
		LedgerTxReceipt txReceipt;
		try {
			txReceipt = submitter.submit(LedgerCall.castVote(electionId, enrollmentId, faceHash, candidateId));
		} catch (VoteLedgerException e) {
			if (e.getError() == VoteLedgerException.Errors.ALREADY_ACTED && e.getMessage().toLowerCase().contains("already voted"))
				throw new VoteLedgerException(VoteLedgerException.Errors.ALREADY_ACTED, ALREADY_VOTED_MESSAGE, e);
			throw e;
		}

		// The vote is counted from here on. Nothing below may tell the voter otherwise.
		Long receiptId = txReceipt.getAssignedId();
		String enrollmentHash = hasher.enrollmentHash(enrollmentId, electionId);
		String visibleTag = hasher.visibleTag(enrollmentHash);
		boolean receiptCached = false;
		if (receiptId == null) {
			log.error("ANOMALY: vote in election {} is confirmed in tx {}, but its receiptId is unknown. No receipt cached.", electionId, txReceipt.getTxHash());
		} else {
			try {
				receiptCache.record(receiptId, electionId, enrollmentHash, visibleTag, txReceipt.getTxHash(), txReceipt.getBlockNumber());
				receiptCached = true;
			} catch (RuntimeException e) {
				log.error("ANOMALY: vote receipt {} of tx {} is confirmed, but cannot be cached: {}", receiptId, txReceipt.getTxHash(), e.toString());
			}
		}
		try {
			voterRegistry.markVoted(enrollmentId, electionId);
		} catch (RuntimeException e) {
			log.error("Cannot mark registration of election {} as voted: {}", electionId, e.toString());
		}

		log.info("Vote cast in election {} receiptId={} tx={}", electionId, receiptId, txReceipt.getTxHash());
		return new CastVoteResponse(receiptId, electionId, visibleTag, txReceipt.getTxHash(), txReceipt.getBlockNumber(), receiptCached);
	}
}
