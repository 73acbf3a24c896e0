package org.voteledger.election;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Confirmation of an administrative election transaction.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ElectionTxResponse {
	long electionId;

	/** phase of the election after the transaction */
	ElectionPhase phase;

	String txHash;

	long blockNumber;

	/** only set for addCandidate */
	Long candidateId;
}
