package org.voteledger.vote;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.voteledger.ledger.LedgerClient;
import org.voteledger.ledger.LedgerReader;
import org.voteledger.ledger.LedgerVoteReceipt;
import org.voteledger.util.VoteLedgerException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Verifies vote receipts against the ledger, with the local cache as fallback.
 *
 * The ledger is the authority. But receipts must stay verifiable while the ledger is down.
 * So when the ledger cannot be asked, or does not know a receipt that we have cached,
 * the cached receipt is trusted and the answer says so.
 */
@Slf4j
@ApplicationScoped
public class VerificationService {

	@Inject
	LedgerClient ledger;

	@Inject
	LedgerReader reader;

	@Inject
	ReceiptLedgerCache receiptCache;

	@Inject
	EnrollmentHasher hasher;

	/**
	 * Verify one receipt
	 * @param receiptId id of the receipt
	 * @return the verification result. verified=false when neither ledger nor cache know this receipt
	 * @throws VoteLedgerException TRANSPORT_UNAVAILABLE when the ledger is unreachable and nothing is cached
	 */
	public VerificationResult verify(long receiptId) throws VoteLedgerException {
		Optional<VoteReceiptEntity> cached = lookupCached(receiptId);

		LedgerVoteReceipt onChain;
		try {
			onChain = reader.read("receipt " + receiptId, () -> ledger.getVoteReceipt(receiptId));
		} catch (VoteLedgerException e) {
			if (cached.isPresent()) {
				log.warn("Receipt {} verified from cache only. Ledger unreachable: {}", receiptId, e.getMessage());
				return new VerificationResult(true, VerificationResult.SOURCE_CACHE,
						"Blockchain is unreachable. Receipt verified from local records.", null, cached.get());
			}
			throw new VoteLedgerException(VoteLedgerException.Errors.TRANSPORT_UNAVAILABLE,
					"Cannot verify receipt " + receiptId + ". Blockchain is unreachable and the receipt is not known locally.", e);
		}

		if (!onChain.isExists()) {
			if (cached.isPresent()) {
				log.warn("ANOMALY: receipt {} is cached for election {}, but the ledger does not know it", receiptId, cached.get().getElectionId());
				return new VerificationResult(true, VerificationResult.SOURCE_CACHE,
						"Receipt found in local records, but not on the blockchain. This mismatch was reported.", null, cached.get());
			}
			return new VerificationResult(false, null, "Receipt " + receiptId + " not found", null, null);
		}

		LedgerReceiptView ledgerView = new LedgerReceiptView(
				onChain.getReceiptId(),
				onChain.getElectionId(),
				onChain.decodeVisibleTag(),
				onChain.getTimestamp() > 0 ? LocalDateTime.ofInstant(Instant.ofEpochSecond(onChain.getTimestamp()), ZoneOffset.UTC) : null,
				true);
		if (cached.isPresent() && cached.get().getElectionId() != onChain.getElectionId())
			log.warn("Receipt {} is cached for election {}, but on the ledger it belongs to election {}",
					receiptId, cached.get().getElectionId(), onChain.getElectionId());
		return new VerificationResult(true, VerificationResult.SOURCE_LEDGER, "Vote receipt verified on the blockchain", ledgerView, cached.orElse(null));
	}

	/**
	 * Find the receipt of a voter in an election by recomputing their enrollment hash.
	 * @throws VoteLedgerException NOT_FOUND when there is no such receipt
	 */
	public ReceiptMatch searchReceipt(String enrollment, long electionId) throws VoteLedgerException {
		if (enrollment == null || enrollment.isBlank())
			throw new VoteLedgerException(VoteLedgerException.Errors.VALIDATION_ERROR, "enrollment is required");
		String enrollmentHash = hasher.enrollmentHash(enrollment.trim(), electionId);
		return receiptCache.lookupByEnrollmentHash(enrollmentHash, electionId)
				.orElseThrow(VoteLedgerException.supply(VoteLedgerException.Errors.NOT_FOUND, "No receipt found for this voter in election " + electionId));
	}

	public VoteReceiptEntity getReceipt(long receiptId) throws VoteLedgerException {
		return receiptCache.lookupById(receiptId)
				.orElseThrow(VoteLedgerException.notFound("Receipt " + receiptId + " not found"));
	}

	private Optional<VoteReceiptEntity> lookupCached(long receiptId) {
		try {
			return receiptCache.lookupById(receiptId);
		} catch (RuntimeException e) {
			log.warn("Cannot read receipt {} from local cache: {}", receiptId, e.getMessage());
			return Optional.empty();
		}
	}
}
