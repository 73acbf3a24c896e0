package org.voteledger.vote;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/** A vote receipt as the ledger stores it */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LedgerReceiptView {
	long receiptId;
	long electionId;
	String visibleTag;
	LocalDateTime timestamp;
	boolean exists;
}
