package org.voteledger.election;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One candidate, always read live from the ledger.
 * When results are hidden, votes is 0. The response looks the same either way.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class CandidateView {
	long candidateId;
	String name;
	long votes;
}
