package org.voteledger.ledger;

import lombok.Value;

/** Candidate as returned by getCandidate(electionId, candidateId). Votes are always live from the ledger. */
@Value
public class LedgerCandidate {
	long id;
	String name;
	long votes;
}
