package org.voteledger.ledger;

import lombok.Getter;

/**
 * The transaction was broadcast, but no receipt showed up within the confirmation timeout.
 * This does NOT mean that the transaction failed. It may still be included later.
 */
public class LedgerTimeoutException extends LedgerException {

	@Getter
	final String txHash;

	public LedgerTimeoutException(String txHash, String message, Throwable cause) {
		super(message, cause);
		this.txHash = txHash;
	}
}
