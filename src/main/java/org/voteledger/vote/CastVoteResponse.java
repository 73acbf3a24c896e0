package org.voteledger.vote;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * What a voter gets back after their vote was confirmed.
 * With the receiptId they can later verify that their vote was counted. It does not reveal their choice.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CastVoteResponse {
	/** null only if the vote is confirmed, but its receiptId could not be read from the ledger */
	Long receiptId;
	long electionId;
	String visibleTag;
	String txHash;
	long blockNumber;

	/** false when the vote is counted on the ledger, but the receipt is missing in the local records */
	boolean receiptCached;
}
