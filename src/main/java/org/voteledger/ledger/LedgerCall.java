package org.voteledger.ledger;

import lombok.Getter;
import lombok.NonNull;

/**
 * Descriptor of one mutating contract call: the operation, its typed arguments and a gas budget.
 * Only the arguments that the operation needs are set. Build instances with the static factories.
 *
 * toString() does not print the enrollment or the face hash commitment.
 */
@Getter
public class LedgerCall {

	final LedgerOperation operation;
	final long gas;

	Long electionId;
	String name;
	String description;
	String enrollment;
	/** bytes32 commitment as hex string "0x" + 64 hex chars */
	String faceHashCommitment;
	Long candidateId;

	private LedgerCall(LedgerOperation operation, long gas) {
		this.operation = operation;
		this.gas = gas;
	}

	public static LedgerCall createElection(@NonNull String name, @NonNull String description) {
		LedgerCall call = new LedgerCall(LedgerOperation.CREATE_ELECTION, LedgerOperation.CREATE_ELECTION.getDefaultGas());
		call.name = name;
		call.description = description;
		return call;
	}

	public static LedgerCall addCandidate(long electionId, @NonNull String name) {
		LedgerCall call = new LedgerCall(LedgerOperation.ADD_CANDIDATE, LedgerOperation.ADD_CANDIDATE.getDefaultGas());
		call.electionId = electionId;
		call.name = name;
		return call;
	}

	public static LedgerCall startElection(long electionId) {
		return forElection(LedgerOperation.START_ELECTION, electionId);
	}

	public static LedgerCall endElection(long electionId) {
		return forElection(LedgerOperation.END_ELECTION, electionId);
	}

	public static LedgerCall declareResults(long electionId) {
		return forElection(LedgerOperation.DECLARE_RESULTS, electionId);
	}

	public static LedgerCall registerVoter(long electionId, @NonNull String enrollment, @NonNull String faceHashCommitment) {
		LedgerCall call = new LedgerCall(LedgerOperation.REGISTER_VOTER, LedgerOperation.REGISTER_VOTER.getDefaultGas());
		call.electionId = electionId;
		call.enrollment = enrollment;
		call.faceHashCommitment = checkBytes32(faceHashCommitment);
		return call;
	}

	public static LedgerCall castVote(long electionId, @NonNull String enrollment, @NonNull String faceHashCommitment, long candidateId) {
		LedgerCall call = new LedgerCall(LedgerOperation.CAST_VOTE, LedgerOperation.CAST_VOTE.getDefaultGas());
		call.electionId = electionId;
		call.enrollment = enrollment;
		call.faceHashCommitment = checkBytes32(faceHashCommitment);
		call.candidateId = candidateId;
		return call;
	}

	/** Copy of this call with another gas budget */
	public LedgerCall withGas(long gas) {
		if (gas <= 0) throw new IllegalArgumentException("gas must be positive");
		LedgerCall copy = new LedgerCall(this.operation, gas);
		copy.electionId = this.electionId;
		copy.name = this.name;
		copy.description = this.description;
		copy.enrollment = this.enrollment;
		copy.faceHashCommitment = this.faceHashCommitment;
		copy.candidateId = this.candidateId;
		return copy;
	}

	private static LedgerCall forElection(LedgerOperation op, long electionId) {
		LedgerCall call = new LedgerCall(op, op.getDefaultGas());
		call.electionId = electionId;
		return call;
	}

	private static String checkBytes32(String hex) {
		if (!hex.matches("0x[0-9a-fA-F]{64}"))
			throw new IllegalArgumentException("Face hash commitment must be a bytes32 hex string");
		return hex;
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("LedgerCall[")
				.append(operation.getFunctionName());
		if (electionId != null) sb.append(", electionId=").append(electionId);
		if (name != null) sb.append(", name='").append(name).append("'");
		sb.append(", gas=").append(gas);
		return sb.append("]").toString();
	}
}
