package org.voteledger.ledger;

import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * The ledger's confirmation that a transaction was included in a block.
 */
@Data
@AllArgsConstructor
public class LedgerTxReceipt {
	String txHash;
	long blockNumber;

	/**
	 * The id that this transaction created on the ledger: the electionId of createElection,
	 * the candidateId of addCandidate or the receiptId of a vote.
	 * Null for all other calls, and when the id could not be determined after confirmation.
	 */
	Long assignedId;
}
