package org.voteledger.election;

import org.voteledger.util.VoteLedgerException;

/**
 * Lifecycle of an election. The first four values mirror the contract's phase enum and its wire values.
 * EXPIRED is derived locally from the cached deadline and is never sent to the ledger.
 *
 * Phases only move forward: CREATED → ACTIVE → ENDED → RESULT_DECLARED
 */
public enum ElectionPhase {
	CREATED(0, 0),
	ACTIVE(1, 1),
	ENDED(2, 2),
	RESULT_DECLARED(3, 3),
	EXPIRED(-1, 1);        // still ACTIVE on the ledger, but the local deadline has passed

	final int wireValue;

	/** position in the lifecycle. EXPIRED ranks like ACTIVE */
	final int rank;

	ElectionPhase(int wireValue, int rank) {
		this.wireValue = wireValue;
		this.rank = rank;
	}

	public int getWireValue() {
		return wireValue;
	}

	/**
	 * Map the ledger's enum value to a phase
	 * @param wireValue 0..3 as returned by getElectionPhase
	 * @return the phase
	 * @throws VoteLedgerException LEDGER_REJECTED when the ledger returned something we do not know
	 */
	public static ElectionPhase fromWire(int wireValue) throws VoteLedgerException {
		for (ElectionPhase p : values()) {
			if (p.wireValue == wireValue && p != EXPIRED) return p;
		}
		throw new VoteLedgerException(VoteLedgerException.Errors.LEDGER_REJECTED, "Unknown election phase " + wireValue + " on the ledger");
	}

	/** true if this phase comes strictly before the other one in the lifecycle */
	public boolean isBefore(ElectionPhase other) {
		return this.rank < other.rank;
	}
}
