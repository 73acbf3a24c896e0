package org.voteledger.ledger;

import lombok.Value;

/**
 * Election as returned by the contract's getElection(id).
 * Timestamps are unix seconds as stored on chain. 0 means "not yet".
 */
@Value
public class LedgerElection {
	long id;
	String name;
	String description;
	/** raw wire value of the contract's phase enum */
	int phase;
	long candidateCount;
	long totalVotes;
	long createdAt;
	long startedAt;
	long endedAt;
}
