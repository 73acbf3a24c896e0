package org.voteledger.vote;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Answer to "was my vote counted?".
 * source tells where the answer comes from: "ledger" or "cache". It is null when nothing was found.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VerificationResult {
	public static final String SOURCE_LEDGER = "ledger";
	public static final String SOURCE_CACHE = "cache";

	boolean verified;
	String source;
	String message;

	/** the receipt as stored on the ledger. Null if the ledger could not be asked or does not know it. */
	LedgerReceiptView ledger;

	/** the locally cached receipt, if any */
	VoteReceiptEntity cache;
}
