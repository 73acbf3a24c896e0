package org.voteledger.vote;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import lombok.Getter;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Proof that a vote was cast, and when. A receipt never says for whom.
 * There is no candidate column in this table and there must never be one.
 *
 * Receipts are written once, right after the ledger confirmed the vote, and never updated or deleted.
 */
@Getter
@NoArgsConstructor(force = true)
@Immutable
@Entity(name = "vote_receipts")
@Table(indexes = @Index(columnList = "enrollmentHash, electionId"))
public class VoteReceiptEntity extends PanacheEntityBase {

	/** assigned by the ledger, increasing across all elections */
	@Id
	@Column(updatable = false)
	Long receiptId;

	@Column(nullable = false, updatable = false)
	Long electionId;

	@Column(nullable = false, updatable = false)
	String enrollmentHash;

	@Column(nullable = false, updatable = false)
	String visibleTag;

	@Column(updatable = false)
	String txHash;

	@Column(updatable = false)
	Long blockNumber;

	/** when this backend issued the receipt, UTC */
	@Column(nullable = false, updatable = false)
	LocalDateTime issuedAt;

	public VoteReceiptEntity(Long receiptId, Long electionId, String enrollmentHash, String visibleTag, String txHash, Long blockNumber, LocalDateTime issuedAt) {
		this.receiptId = receiptId;
		this.electionId = electionId;
		this.enrollmentHash = enrollmentHash;
		this.visibleTag = visibleTag;
		this.txHash = txHash;
		this.blockNumber = blockNumber;
		this.issuedAt = issuedAt;
	}

	public static Optional<VoteReceiptEntity> findByEnrollmentHashAndElection(String enrollmentHash, long electionId) {
		return VoteReceiptEntity.find("enrollmentHash = ?1 and electionId = ?2 order by receiptId", enrollmentHash, electionId).firstResultOptional();
	}

	public static Optional<VoteReceiptEntity> findByEnrollmentHash(String enrollmentHash) {
		return VoteReceiptEntity.find("enrollmentHash = ?1 order by receiptId", enrollmentHash).firstResultOptional();
	}

	@Override
	public String toString() {
		return "VoteReceipt[" +
				"receiptId=" + receiptId +
				", electionId=" + electionId +
				", visibleTag=" + visibleTag +
				", txHash=" + txHash +
				", blockNumber=" + blockNumber +
				"]";
	}
}
