package org.voteledger.ledger;

import io.quarkus.test.Mock;
import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;

import java.io.IOException;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.*;

/**
 * In-memory replacement of the election contract for tests.
 * Reproduces the contract's phase rules, its revert reasons and the global receipt counter.
 * Reverts come back the way a Ganache node reports them: "VM Exception while processing transaction: revert &lt;reason&gt;"
 */
@Slf4j
@Mock
@ApplicationScoped
public class InMemoryLedgerClient implements LedgerClient {

	public static final String CONTRACT_ADDRESS = "0x5FbDB2315678afecb367f032d93F642f64180aa3";
	public static final String SIGNER_ADDRESS = "0xf39fd6e51aad88f6f4ce6ab8827279cfffb92266";

	static class Election {
		long id;
		String name;
		String description;
		int phase = 0;
		List<String> candidates = new ArrayList<>();
		List<Long> votes = new ArrayList<>();
		long totalVotes;
		long createdAt, startedAt, endedAt;
		Map<String, String> registeredFaceHashes = new HashMap<>();
		Set<String> voted = new HashSet<>();
	}

	final List<Election> elections = new ArrayList<>();
	final Map<Long, LedgerVoteReceipt> receipts = new HashMap<>();
	long receiptCounter = 0;
	long blockNumber = 1;
	boolean reachable = true;
	boolean emitVoteCastEvent = true;
	Exception nextSendFailure = null;
	boolean unreachableAfterNextSend = false;
	final List<LedgerCall> sentCalls = new ArrayList<>();

	/** forget all state */
	public synchronized void reset() {
		elections.clear();
		receipts.clear();
		receiptCounter = 0;
		blockNumber = 1;
		reachable = true;
		emitVoteCastEvent = true;
		nextSendFailure = null;
		unreachableAfterNextSend = false;
		sentCalls.clear();
	}

	/** when false, every call fails like a node that is down */
	public synchronized void setReachable(boolean reachable) {
		this.reachable = reachable;
	}

	/** when false, vote confirmations carry no decodable VoteCast event */
	public synchronized void setEmitVoteCastEvent(boolean emit) {
		this.emitVoteCastEvent = emit;
	}

	/** the next send fails with this exception, without touching the state */
	public synchronized void failNextSend(Exception failure) {
		this.nextSendFailure = failure;
	}

	/** the next send is confirmed, then the node goes down */
	public synchronized void loseConnectionAfterNextSend() {
		this.unreachableAfterNextSend = true;
	}

	public synchronized List<LedgerCall> getSentCalls() {
		return new ArrayList<>(sentCalls);
	}

	/** Let elections start with a higher id, as if other elections were created before */
	public synchronized void seedElections(int count) {
		for (int i = 0; i < count; i++) createElection("Seeded election " + (i + 1), "");
	}

	// ================= Reads

	@Override
	public synchronized long getElectionCount() throws IOException {
		checkReachable();
		return elections.size();
	}

	@Override
	public synchronized LedgerElection getElection(long electionId) throws IOException, LedgerException {
		checkReachable();
		Election e = election(electionId);
		return new LedgerElection(e.id, e.name, e.description, e.phase, e.candidates.size(), e.totalVotes, e.createdAt, e.startedAt, e.endedAt);
	}

	@Override
	public synchronized LedgerCandidate getCandidate(long electionId, long candidateId) throws IOException, LedgerException {
		checkReachable();
		Election e = election(electionId);
		if (candidateId < 1 || candidateId > e.candidates.size()) throw revert("Invalid candidate");
		int idx = (int) candidateId - 1;
		return new LedgerCandidate(candidateId, e.candidates.get(idx), e.votes.get(idx));
	}

	@Override
	public synchronized int getElectionPhase(long electionId) throws IOException, LedgerException {
		checkReachable();
		return election(electionId).phase;
	}

	@Override
	public synchronized LedgerVoteReceipt getVoteReceipt(long receiptId) throws IOException {
		checkReachable();
		LedgerVoteReceipt r = receipts.get(receiptId);
		return r != null ? r : new LedgerVoteReceipt(0, 0, new byte[32], 0, false);
	}

	@Override
	public synchronized long globalReceiptCounter() throws IOException {
		checkReachable();
		return receiptCounter;
	}

	// ================= Writes

	@Override
	public synchronized LedgerTxReceipt send(LedgerCall call, Duration confirmationTimeout) throws IOException, LedgerException {
		checkReachable();
		if (nextSendFailure != null) {
			Exception failure = nextSendFailure;
			nextSendFailure = null;
			if (failure instanceof IOException io) throw io;
			if (failure instanceof LedgerException le) throw le;
			throw new IllegalStateException(failure);
		}

		Long assignedId = null;
		switch (call.getOperation()) {
			case CREATE_ELECTION:
				createElection(call.getName(), call.getDescription());
				break;
			case ADD_CANDIDATE: {
				Election e = election(call.getElectionId());
				if (e.phase != 0) throw revert("Election not in CREATED phase");
				e.candidates.add(call.getName());
				e.votes.add(0L);
				break;
			}
			case START_ELECTION: {
				Election e = election(call.getElectionId());
				if (e.phase != 0) throw revert("Election must be in CREATED phase");
				e.phase = 1;
				e.startedAt = now();
				break;
			}
			case END_ELECTION: {
				Election e = election(call.getElectionId());
				if (e.phase != 1) throw revert("Election must be ACTIVE");
				e.phase = 2;
				e.endedAt = now();
				break;
			}
			case DECLARE_RESULTS: {
				Election e = election(call.getElectionId());
				if (e.phase != 2) throw revert("Election must be ENDED");
				e.phase = 3;
				break;
			}
			case REGISTER_VOTER: {
				Election e = election(call.getElectionId());
				if (e.phase > 1) throw revert("Registration closed");
				if (e.registeredFaceHashes.containsKey(call.getEnrollment())) throw revert("Voter already registered");
				e.registeredFaceHashes.put(call.getEnrollment(), call.getFaceHashCommitment());
				break;
			}
			case CAST_VOTE: {
				Election e = election(call.getElectionId());
				if (e.phase != 1) throw revert("Election is not active");
				String faceHash = e.registeredFaceHashes.get(call.getEnrollment());
				if (faceHash == null) throw revert("Voter not registered");
				if (!faceHash.equalsIgnoreCase(call.getFaceHashCommitment())) throw revert("Face verification failed");
				if (e.voted.contains(call.getEnrollment())) throw revert("Already voted");
				if (call.getCandidateId() < 1 || call.getCandidateId() > e.candidates.size()) throw revert("Invalid candidate");
				int idx = call.getCandidateId().intValue() - 1;
				e.votes.set(idx, e.votes.get(idx) + 1);
				e.totalVotes++;
				e.voted.add(call.getEnrollment());
				receiptCounter++;
				String tag = ("0x" + DigestUtils.sha256Hex(call.getEnrollment() + ":" + e.id)).substring(0, 10);
				receipts.put(receiptCounter, new LedgerVoteReceipt(receiptCounter, e.id, Arrays.copyOf(tag.getBytes(StandardCharsets.UTF_8), 32), now(), true));
				if (emitVoteCastEvent) assignedId = receiptCounter;
				break;
			}
			default:
				throw new IllegalArgumentException("Unknown operation " + call.getOperation());
		}
		sentCalls.add(call);
		blockNumber++;
		String txHash = "0x" + DigestUtils.sha256Hex(call + ":" + blockNumber);
		if (unreachableAfterNextSend) {
			unreachableAfterNextSend = false;
			reachable = false;
		}
		return new LedgerTxReceipt(txHash, blockNumber, assignedId);
	}

	// ================= Health

	@Override
	public synchronized long getBlockNumber() throws IOException {
		checkReachable();
		return blockNumber;
	}

	@Override
	public long getChainId() throws IOException {
		checkReachable();
		return 1337;
	}

	@Override
	public boolean isContractDeployed() throws IOException {
		checkReachable();
		return true;
	}

	@Override
	public String getSignerAddress() {
		return SIGNER_ADDRESS;
	}

	@Override
	public String getContractAddress() {
		return CONTRACT_ADDRESS;
	}

	// ================= internals

	private void createElection(String name, String description) {
		Election e = new Election();
		e.id = elections.size() + 1;
		e.name = name;
		e.description = description;
		e.createdAt = now();
		elections.add(e);
	}

	private Election election(long electionId) throws LedgerException {
		if (electionId < 1 || electionId > elections.size()) throw revert("Election does not exist");
		return elections.get((int) electionId - 1);
	}

	private synchronized void checkReachable() throws IOException {
		if (!reachable) throw new ConnectException("Failed to connect to /127.0.0.1:7545");
	}

	private static LedgerException revert(String reason) {
		String message = "VM Exception while processing transaction: revert " + reason;
		return new LedgerException(message, new LedgerException.RpcError(-32000, message, null));
	}

	private static long now() {
		return Instant.now().getEpochSecond();
	}
}
