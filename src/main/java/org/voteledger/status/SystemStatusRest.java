package org.voteledger.status;

import com.google.common.base.Ascii;
import io.smallrye.common.annotation.Blocking;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import lombok.extern.slf4j.Slf4j;
import org.voteledger.election.ElectionCache;
import org.voteledger.ledger.LedgerClient;
import org.voteledger.ledger.LedgerException;
import org.voteledger.ledger.RevertReasonDecoder;
import org.voteledger.ledger.TransactionSubmitter;
import org.voteledger.util.VoteLedgerConfig;
import org.voteledger.voter.VoterRegistry;

/**
 * Real-time system health for the status widget of the frontend.
 * Every check catches its own failure and reports it as detail. This endpoint never fails.
 */
@Slf4j
@Path("/api/status")
@Produces(MediaType.APPLICATION_JSON)
public class SystemStatusRest {

	static final int MAX_DETAIL_LENGTH = 60;

	@Inject
	LedgerClient ledger;

	@Inject
	VoterRegistry voterRegistry;

	@Inject
	ElectionCache electionCache;

	@Inject
	TransactionSubmitter submitter;

	@Inject
	VoteLedgerConfig config;

	@GET
	@Blocking
	public SystemStatus status() {
		SystemStatus status = new SystemStatus();
		status.getServices().put("ledger", checkLedger());
		status.getServices().put("contract", checkContract());
		status.getServices().put("database", checkDatabase());
		status.getServices().put("server", new ServiceHealth(true, "VoteLedger Server", "Running " + config.apiVersion() + " · " + submitter.pendingSubmissions() + " tx queued"));
		status.setOverall(status.getServices().values().stream().allMatch(ServiceHealth::isOk));
		status.setRpcUrl(config.ledger().rpcUrl());
		status.setContractAddress(ledger.getContractAddress());
		log.debug("System status overall={}", status.isOverall());
		return status;
	}

	ServiceHealth checkLedger() {
		try {
			long block = ledger.getBlockNumber();
			long chainId = ledger.getChainId();
			return new ServiceHealth(true, "Blockchain", "Block #" + block + " · Chain " + chainId);
		} catch (Exception e) {
			log.debug("Ledger node not healthy: {}", e.getMessage());
			return new ServiceHealth(false, "Blockchain", detail(e));
		}
	}

	ServiceHealth checkContract() {
		try {
			if (!ledger.isContractDeployed()) return new ServiceHealth(false, "Smart Contract", "No contract at address");
			long count = ledger.getElectionCount();
			String addr = ledger.getContractAddress();
			String shortAddr = addr.length() > 10 ? addr.substring(0, 6) + "..." + addr.substring(addr.length() - 4) : addr;
			return new ServiceHealth(true, "Smart Contract", shortAddr + " · " + count + " election(s)");
		} catch (Exception e) {
			log.debug("Contract not healthy: {}", e.getMessage());
			return new ServiceHealth(false, "Smart Contract", detail(e));
		}
	}

	ServiceHealth checkDatabase() {
		try {
			long voters = voterRegistry.countVoters();
			long elections = electionCache.count();
			return new ServiceHealth(true, "Database", voters + " voters · " + elections + " elections");
		} catch (Exception e) {
			log.error("Database not healthy: {}", e.getMessage());
			return new ServiceHealth(false, "Database", detail(e));
		}
	}

	/** flat, short reason. Never a stack trace. */
	static String detail(Exception e) {
		String reason = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
		if (e instanceof LedgerException) reason = RevertReasonDecoder.extractReason(e);
		return Ascii.truncate(reason, MAX_DETAIL_LENGTH, "");
	}
}
