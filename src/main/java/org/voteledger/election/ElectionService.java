package org.voteledger.election;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.voteledger.ledger.*;
import org.voteledger.util.VoteLedgerConfig;
import org.voteledger.util.VoteLedgerException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Everything about elections and their candidates.
 * Reads merge the ledger with the local cache. Writes go to the ledger first, and only after
 * confirmation the cache is updated.
 */
@Slf4j
@ApplicationScoped
public class ElectionService {

	@Inject
	LedgerClient ledger;

	@Inject
	LedgerReader reader;

	@Inject
	TransactionSubmitter submitter;

	@Inject
	ElectionCache cache;

	@Inject
	PhaseResolver phaseResolver;

	@Inject
	VoteLedgerConfig config;

	// ================= Reads

	/**
	 * All elections on the ledger, oldest first.
	 */
	public List<ElectionView> listElections() throws VoteLedgerException {
		long count = reader.read("election count", () -> ledger.getElectionCount());
		List<ElectionView> result = new ArrayList<>();
		for (long id = 1; id <= count; id++) {
			final long electionId = id;
			LedgerElection onChain = reader.read("election " + electionId, () -> ledger.getElection(electionId));
			result.add(toView(onChain, cache.find(electionId)));
		}
		log.debug("listElections: {} elections on the ledger", result.size());
		return result;
	}

	/**
	 * One election with its effective phase
	 * @throws VoteLedgerException NOT_FOUND when there is no election with this id on the ledger
	 */
	public ElectionView getElection(long electionId) throws VoteLedgerException {
		checkExists(electionId);
		LedgerElection onChain = reader.read("election " + electionId, () -> ledger.getElection(electionId));
		return toView(onChain, cache.find(electionId));
	}

	/**
	 * Candidates of an election with their live tally.
	 * When live results are switched off for this election, every tally is 0 until the results are declared.
	 */
	public List<CandidateView> candidates(long electionId) throws VoteLedgerException {
		ElectionView election = getElection(electionId);
		boolean hideVotes = !election.isLiveResults() && election.getPhase() != ElectionPhase.RESULT_DECLARED;
		List<CandidateView> result = new ArrayList<>();
		for (long id = 1; id <= election.getCandidateCount(); id++) {
			final long candidateId = id;
			LedgerCandidate c = reader.read("candidate " + candidateId, () -> ledger.getCandidate(electionId, candidateId));
			result.add(new CandidateView(c.getId(), c.getName(), hideVotes ? 0 : c.getVotes()));
		}
		return result;
	}

	ElectionView toView(LedgerElection onChain, Optional<ElectionEntity> cached) throws VoteLedgerException {
		boolean liveResults = cached.map(ElectionEntity::isLiveResults).orElse(config.liveResultsDefault());
		LocalDateTime expiresAt = cached.map(ElectionEntity::getExpiresAt).orElse(null);
		ElectionPhase phase = PhaseResolver.applyExpiry(ElectionPhase.fromWire(onChain.getPhase()), expiresAt, LocalDateTime.now(ZoneOffset.UTC));
		if (cached.isPresent() && cached.get().getPhase() != ElectionPhase.fromWire(onChain.getPhase()))
			log.warn("Cached phase {} of election {} differs from ledger phase {}", cached.get().getPhase(), onChain.getId(), onChain.getPhase());
		return new ElectionView(
				onChain.getId(),
				onChain.getName(),
				onChain.getDescription(),
				phase,
				onChain.getCandidateCount(),
				onChain.getTotalVotes(),
				fromUnixSeconds(onChain.getCreatedAt()),
				fromUnixSeconds(onChain.getStartedAt()),
				fromUnixSeconds(onChain.getEndedAt()),
				liveResults,
				expiresAt);
	}

	/** Election ids on the ledger are 1..electionCount */
	public void checkExists(long electionId) throws VoteLedgerException {
		if (electionId < 1) throw new VoteLedgerException(VoteLedgerException.Errors.VALIDATION_ERROR, "electionId must be positive");
		long count = reader.read("election count", () -> ledger.getElectionCount());
		if (electionId > count) throw new VoteLedgerException(VoteLedgerException.Errors.NOT_FOUND, "Election " + electionId + " not found");
	}

	private static LocalDateTime fromUnixSeconds(long seconds) {
		if (seconds <= 0) return null;
		return LocalDateTime.ofInstant(Instant.ofEpochSecond(seconds), ZoneOffset.UTC);
	}

	// ================= Administrative mutations

	/**
	 * Create a new election on the ledger and cache its local settings.
	 *
	 * @param name mandatory
	 * @param description may be empty
	 * @param liveResults show vote counts while the election is running. Default true
	 * @param expiresAt optional deadline as ISO local date time, e.g. "2025-05-01T18:00", interpreted as UTC
	 * @return the confirmation with the new election's id
	 */
	public ElectionTxResponse createElection(String name, String description, Boolean liveResults, String expiresAt) throws VoteLedgerException {
		if (name == null || name.isBlank())
			throw new VoteLedgerException(VoteLedgerException.Errors.VALIDATION_ERROR, "Election name is required");
		LocalDateTime deadline = parseExpiresAt(expiresAt);
		String desc = description == null ? "" : description.trim();

		LedgerTxReceipt receipt = submitter.submit(LedgerCall.createElection(name.trim(), desc));
		if (receipt.getAssignedId() == null)
			throw new VoteLedgerException(VoteLedgerException.Errors.CONFIRMED_NOT_RECORDED,
					"Election was created in tx " + receipt.getTxHash() + ", but its id could not be read. Its settings were not saved.");
		long electionId = receipt.getAssignedId();
		boolean live = liveResults == null ? config.liveResultsDefault() : liveResults;
		try {
			cache.upsert(electionId, name.trim(), desc, live, deadline);
		} catch (RuntimeException e) {
			log.error("ANOMALY: election {} is confirmed in tx {}, but cannot be cached: {}", electionId, receipt.getTxHash(), e.toString());
			throw new VoteLedgerException(VoteLedgerException.Errors.CONFIRMED_NOT_RECORDED,
					"Election " + electionId + " was created in tx " + receipt.getTxHash() + ", but its settings could not be saved.", e);
		}
		log.info("Created election {} '{}' tx={}", electionId, name, receipt.getTxHash());
		return new ElectionTxResponse(electionId, ElectionPhase.CREATED, receipt.getTxHash(), receipt.getBlockNumber(), null);
	}

	public ElectionTxResponse addCandidate(long electionId, String name) throws VoteLedgerException {
		if (name == null || name.isBlank())
			throw new VoteLedgerException(VoteLedgerException.Errors.VALIDATION_ERROR, "Candidate name is required");
		checkExists(electionId);
		phaseResolver.requirePhase(electionId, "add candidate", ElectionPhase.CREATED);

		LedgerTxReceipt receipt = submitter.submit(LedgerCall.addCandidate(electionId, name.trim()));

		log.info("Added candidate {} '{}' to election {}", receipt.getAssignedId(), name, electionId);
		return new ElectionTxResponse(electionId, ElectionPhase.CREATED, receipt.getTxHash(), receipt.getBlockNumber(), receipt.getAssignedId());
	}

	public ElectionTxResponse startElection(long electionId) throws VoteLedgerException {
		checkExists(electionId);
		phaseResolver.requirePhase(electionId, "start election", ElectionPhase.CREATED);
		return transition(LedgerCall.startElection(electionId), ElectionPhase.ACTIVE);
	}

	/** An ACTIVE election can be ended, also after its deadline passed. */
	public ElectionTxResponse endElection(long electionId) throws VoteLedgerException {
		checkExists(electionId);
		phaseResolver.requirePhase(electionId, "end election", ElectionPhase.ACTIVE, ElectionPhase.EXPIRED);
		return transition(LedgerCall.endElection(electionId), ElectionPhase.ENDED);
	}

	public ElectionTxResponse declareResults(long electionId) throws VoteLedgerException {
		checkExists(electionId);
		phaseResolver.requirePhase(electionId, "declare results", ElectionPhase.ENDED);
		return transition(LedgerCall.declareResults(electionId), ElectionPhase.RESULT_DECLARED);
	}

	private ElectionTxResponse transition(LedgerCall call, ElectionPhase newPhase) throws VoteLedgerException {
		LedgerTxReceipt receipt = submitter.submit(call);
		try {
			cache.mirrorPhase(call.getElectionId(), newPhase);
		} catch (RuntimeException e) {
			// the ledger stays authoritative. Reads take the phase from there.
			log.error("ANOMALY: election {} is {} on the ledger (tx {}), but the cache could not be updated: {}",
					call.getElectionId(), newPhase, receipt.getTxHash(), e.toString());
		}
		return new ElectionTxResponse(call.getElectionId(), newPhase, receipt.getTxHash(), receipt.getBlockNumber(), null);
	}

	static LocalDateTime parseExpiresAt(String expiresAt) throws VoteLedgerException {
		if (expiresAt == null || expiresAt.isBlank()) return null;
		try {
			return LocalDateTime.parse(expiresAt.trim());
		} catch (DateTimeParseException e) {
			throw new VoteLedgerException(VoteLedgerException.Errors.VALIDATION_ERROR,
					"expiresAt must be an ISO date time like 2025-05-01T18:00, but was '" + expiresAt + "'");
		}
	}
}
