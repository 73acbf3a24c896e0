package org.voteledger.vote;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Result of looking up a receipt by enrollment hash.
 * lowConfidence is true when the receipt was only found by its enrollment hash, but for another election id.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ReceiptMatch {
	VoteReceiptEntity receipt;
	boolean lowConfidence;
}
