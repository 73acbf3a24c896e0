package org.voteledger.ledger;

import jakarta.enterprise.context.ApplicationScoped;
import lombok.extern.slf4j.Slf4j;
import org.voteledger.util.VoteLedgerException;

import java.io.IOException;

/**
 * Read-only ledger queries for the services. Reads are not serialized, they run concurrently on the caller's thread.
 * Any failure becomes TRANSPORT_UNAVAILABLE with the extracted reason, so that callers can fail closed.
 */
@Slf4j
@ApplicationScoped
public class LedgerReader {

	/** One read against the ledger */
	@FunctionalInterface
	public interface LedgerQuery<T> {
		T call() throws IOException, LedgerException;
	}

	public <T> T read(String what, LedgerQuery<T> query) throws VoteLedgerException {
		try {
			return query.call();
		} catch (IOException e) {
			log.warn("Ledger unreachable while reading {}: {}", what, e.getMessage());
			throw new VoteLedgerException(VoteLedgerException.Errors.TRANSPORT_UNAVAILABLE, "Blockchain node is unreachable", e);
		} catch (LedgerException e) {
			String reason = RevertReasonDecoder.extractReason(e);
			log.warn("Ledger read {} failed: {}", what, reason);
			throw new VoteLedgerException(VoteLedgerException.Errors.TRANSPORT_UNAVAILABLE, "Cannot read " + what + " from blockchain: " + reason, e);
		}
	}
}
