package org.voteledger.ledger;

import lombok.Getter;

/**
 * The mutating functions of the election contract that this backend submits.
 * Each operation has its own default gas budget.
 */
public enum LedgerOperation {
	CREATE_ELECTION("createElection", 500_000),
	ADD_CANDIDATE("addCandidate", 300_000),
	START_ELECTION("startElection", 300_000),
	END_ELECTION("endElection", 300_000),
	DECLARE_RESULTS("declareResults", 300_000),
	REGISTER_VOTER("registerVoter", 500_000),
	CAST_VOTE("vote", 500_000);

	/** name of the solidity function in the contract ABI */
	@Getter
	final String functionName;

	@Getter
	final long defaultGas;

	LedgerOperation(String functionName, long defaultGas) {
		this.functionName = functionName;
		this.defaultGas = defaultGas;
	}
}
