package org.voteledger.ledger;

import lombok.Value;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Vote receipt as returned by getVoteReceipt(receiptId).
 * The contract returns exists=false (and zero values) for unknown receipt ids.
 */
@Value
public class LedgerVoteReceipt {
	long receiptId;
	long electionId;
	/** bytes32 on chain: text, right padded with zero bytes */
	byte[] visibleTagBytes;
	long timestamp;
	boolean exists;

	/**
	 * Strip the trailing zero padding and decode the rest as UTF-8.
	 * Malformed bytes are replaced, never thrown.
	 */
	public String decodeVisibleTag() {
		if (visibleTagBytes == null) return "";
		int end = visibleTagBytes.length;
		while (end > 0 && visibleTagBytes[end - 1] == 0) end--;
		return new String(Arrays.copyOf(visibleTagBytes, end), StandardCharsets.UTF_8);
	}
}
