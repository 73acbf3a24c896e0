package org.voteledger.ledger;

import java.io.IOException;
import java.time.Duration;

/**
 * The surface of the election contract that this backend consumes.
 *
 * All reads are plain calls against the latest block and may be called concurrently.
 * {@link #send(LedgerCall, Duration)} is NOT safe for concurrent use from the same signing account.
 * Only the {@link TransactionSubmitter} may call it.
 *
 * Every method throws IOException when the node cannot be reached
 * and LedgerException when the node or the contract reported an error.
 */
public interface LedgerClient {

	/** Number of elections on the ledger. Election ids are 1..count */
	long getElectionCount() throws IOException, LedgerException;

	LedgerElection getElection(long electionId) throws IOException, LedgerException;

	LedgerCandidate getCandidate(long electionId, long candidateId) throws IOException, LedgerException;

	/** raw wire value of the phase enum: 0=CREATED, 1=ACTIVE, 2=ENDED, 3=RESULT_DECLARED */
	int getElectionPhase(long electionId) throws IOException, LedgerException;

	LedgerVoteReceipt getVoteReceipt(long receiptId) throws IOException, LedgerException;

	/** id of the last issued vote receipt, globally across all elections */
	long globalReceiptCounter() throws IOException, LedgerException;

	/**
	 * Build, sign and broadcast a mutating call. Then block until the ledger confirms inclusion.
	 *
	 * @param call the contract function and its arguments
	 * @param confirmationTimeout how long to wait for the confirmation
	 * @return confirmation with tx hash and block number
	 * @throws LedgerTimeoutException when no confirmation arrived in time. The tx may still land later!
	 * @throws LedgerException when the call was reverted, either during simulation or after inclusion
	 * @throws IOException when the node is unreachable
	 */
	LedgerTxReceipt send(LedgerCall call, Duration confirmationTimeout) throws IOException, LedgerException;

	// ===== Node and contract health, used by the system status

	long getBlockNumber() throws IOException, LedgerException;

	long getChainId() throws IOException, LedgerException;

	/** true if there is contract code deployed at the configured address */
	boolean isContractDeployed() throws IOException, LedgerException;

	String getSignerAddress();

	String getContractAddress();
}
