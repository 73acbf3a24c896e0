package org.voteledger.ledger;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.voteledger.util.VoteLedgerConfig;
import org.voteledger.util.VoteLedgerException;

import java.io.IOException;
import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * The one and only way to mutate ledger state.
 *
 * All mutating calls share one signing account. Reading the account's nonce, signing and broadcasting
 * must therefore never interleave. Every call is queued to a single writer thread that owns the
 * {@link LedgerClient#send(LedgerCall, Duration)} handle. Admin operations and votes go through the same queue.
 * Callers block until their call is confirmed (or failed), so they can return a confirmed, receipt-bearing response.
 *
 * This class only talks to the ledger. It never touches the local cache.
 * Callers update the cache after this method returned successfully.
 *
 * Failed calls are never retried here. Resubmitting a state-mutating call could submit it twice.
 */
@Slf4j
@ApplicationScoped
public class TransactionSubmitter {

	@Inject
	LedgerClient ledgerClient;

	@Inject
	VoteLedgerConfig config;

	ThreadPoolExecutor writer;

	@PostConstruct
	void startWriter() {
		writer = new ThreadPoolExecutor(1, 1, 0L, TimeUnit.MILLISECONDS,
				new LinkedBlockingQueue<>(),
				new ThreadFactoryBuilder().setNameFormat("ledger-writer-%d").setDaemon(true).build());
	}

	@PreDestroy
	void stopWriter() {
		writer.shutdown();
	}

	/**
	 * Submit a mutating call to the ledger and wait for its confirmation.
	 *
	 * @param call what to call on the contract
	 * @return the ledger's confirmation
	 * @throws VoteLedgerException with exactly one of ALREADY_ACTED, LEDGER_REJECTED, CONFIRMATION_TIMEOUT or TRANSPORT_UNAVAILABLE.
	 *         The message is always the flat, human-readable reason.
	 */
	public LedgerTxReceipt submit(LedgerCall call) throws VoteLedgerException {
		Duration timeout = Duration.ofSeconds(config.ledger().confirmationTimeoutSecs());
		log.info("Submitting {} ({} calls queued before it)", call, writer.getQueue().size());

		Future<LedgerTxReceipt> future = writer.submit(() -> sendAndIdentify(call, timeout));
		try {
			LedgerTxReceipt receipt = future.get();
			log.info("Confirmed {} tx={} block={}", call.getOperation().getFunctionName(), receipt.getTxHash(), receipt.getBlockNumber());
			return receipt;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			// the writer thread keeps going. The call may still be confirmed.
			log.warn("Interrupted while waiting for {}. It may still be confirmed on the ledger.", call);
			throw new VoteLedgerException(VoteLedgerException.Errors.INTERNAL_ERROR, "Interrupted while waiting for the ledger", e);
		} catch (ExecutionException e) {
			throw normalize(call, e.getCause());
		}
	}

	/**
	 * Runs on the writer thread. Sends the call and, when the client could not tell from the confirmation,
	 * reads the id that the call created. No other write can be confirmed in between,
	 * so the latest count on the ledger is ours.
	 * The call is already confirmed when this read happens. A failing read leaves assignedId null and is not an error.
	 */
	LedgerTxReceipt sendAndIdentify(LedgerCall call, Duration timeout) throws IOException, LedgerException {
		LedgerTxReceipt receipt = ledgerClient.send(call, timeout);
		if (receipt.getAssignedId() != null) return receipt;
		try {
			switch (call.getOperation()) {
				case CREATE_ELECTION:
					receipt.setAssignedId(ledgerClient.getElectionCount());
					break;
				case ADD_CANDIDATE:
					receipt.setAssignedId(ledgerClient.getElection(call.getElectionId()).getCandidateCount());
					break;
				case CAST_VOTE:
					receipt.setAssignedId(ledgerClient.globalReceiptCounter());
					log.warn("No VoteCast event for tx {}. receiptId={} taken from globalReceiptCounter", receipt.getTxHash(), receipt.getAssignedId());
					break;
				default:
					break;
			}
		} catch (IOException | LedgerException e) {
			log.error("ANOMALY: {} tx={} is confirmed, but the id it created cannot be read: {}",
					call.getOperation().getFunctionName(), receipt.getTxHash(), e.getMessage());
		}
		return receipt;
	}

	/** Number of calls waiting for the writer. */
	public int pendingSubmissions() {
		return writer.getQueue().size();
	}

	/**
	 * Map any failure of the ledger client to exactly one error kind with one flat reason string.
	 */
	VoteLedgerException normalize(LedgerCall call, Throwable failure) {
		String fn = call.getOperation().getFunctionName();
		if (failure instanceof LedgerTimeoutException te) {
			log.error("{} tx={} was not confirmed within {}s", fn, te.getTxHash(), config.ledger().confirmationTimeoutSecs());
			return new VoteLedgerException(VoteLedgerException.Errors.CONFIRMATION_TIMEOUT,
					"Transaction " + te.getTxHash() + " was not confirmed in time. It may still be included later. Check before you resubmit.", failure);
		}
		if (failure instanceof IOException) {
			log.error("Ledger node unreachable during {}: {}", fn, failure.getMessage());
			return new VoteLedgerException(VoteLedgerException.Errors.TRANSPORT_UNAVAILABLE, "Blockchain node is unreachable", failure);
		}
		String reason = RevertReasonDecoder.extractReason(failure);
		if (RevertReasonDecoder.isAlreadyActed(reason)) {
			log.info("{} refused by ledger as duplicate: {}", fn, reason);
			return new VoteLedgerException(VoteLedgerException.Errors.ALREADY_ACTED, reason, failure);
		}
		log.info("{} rejected by ledger: {}", fn, reason);
		return new VoteLedgerException(VoteLedgerException.Errors.LEDGER_REJECTED, reason, failure);
	}
}
