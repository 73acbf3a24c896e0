package org.voteledger.vote;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Local record of issued vote receipts.
 * Answers receipt lookups without asking the ledger, and is the fallback when the ledger is unreachable.
 *
 * The cache is a passive recorder. It does not enforce one receipt per voter and election.
 * The ledger's one-vote rule does that.
 */
@Slf4j
@ApplicationScoped
public class ReceiptLedgerCache {

	/**
	 * Record a receipt that the ledger has confirmed.
	 * An already recorded receiptId is never overwritten. The existing row is returned unchanged.
	 *
	 * @return the stored receipt
	 */
	@Transactional
	public VoteReceiptEntity record(long receiptId, long electionId, String enrollmentHash, String visibleTag, String txHash, Long blockNumber) {
		Optional<VoteReceiptEntity> existing = VoteReceiptEntity.findByIdOptional(receiptId);
		if (existing.isPresent()) {
			log.warn("Receipt {} is already recorded. Keeping the existing row.", receiptId);
			return existing.get();
		}
		VoteReceiptEntity receipt = new VoteReceiptEntity(receiptId, electionId, enrollmentHash, visibleTag, txHash, blockNumber,
				LocalDateTime.now(ZoneOffset.UTC));
		receipt.persist();
		log.info("Recorded {}", receipt);
		return receipt;
	}

	@Transactional
	public Optional<VoteReceiptEntity> lookupById(long receiptId) {
		return VoteReceiptEntity.findByIdOptional(receiptId);
	}

	/**
	 * Find the receipt of a voter in an election.
	 * First by enrollment hash and election id. If that misses, by enrollment hash only,
	 * because election ids of ledger and cache may have drifted apart. Such a match is flagged as low confidence.
	 */
	@Transactional
	public Optional<ReceiptMatch> lookupByEnrollmentHash(String enrollmentHash, long electionId) {
		Optional<VoteReceiptEntity> exact = VoteReceiptEntity.findByEnrollmentHashAndElection(enrollmentHash, electionId);
		if (exact.isPresent()) return Optional.of(new ReceiptMatch(exact.get(), false));

		Optional<VoteReceiptEntity> hashOnly = VoteReceiptEntity.findByEnrollmentHash(enrollmentHash);
		if (hashOnly.isPresent()) {
			log.warn("Receipt {} only found by enrollment hash. It is cached for election {}, but was searched in election {}",
					hashOnly.get().getReceiptId(), hashOnly.get().getElectionId(), electionId);
			return Optional.of(new ReceiptMatch(hashOnly.get(), true));
		}
		return Optional.empty();
	}
}
