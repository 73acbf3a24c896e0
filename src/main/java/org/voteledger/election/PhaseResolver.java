package org.voteledger.election;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.voteledger.ledger.LedgerClient;
import org.voteledger.ledger.LedgerReader;
import org.voteledger.util.VoteLedgerException;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.List;

/**
 * Computes the effective phase of an election: the ledger's phase, plus the local EXPIRED override.
 * The ledger is always asked first. Only the expiry deadline comes from the cache.
 */
@Slf4j
@ApplicationScoped
public class PhaseResolver {

	@Inject
	LedgerClient ledger;

	@Inject
	LedgerReader reader;

	@Inject
	ElectionCache cache;

	/**
	 * Get the effective phase of an election
	 * @param electionId ledger id of the election
	 * @return the ledger phase, or EXPIRED when the ledger says ACTIVE but the cached deadline has passed
	 * @throws VoteLedgerException TRANSPORT_UNAVAILABLE when the ledger cannot be asked
	 */
	public ElectionPhase effectivePhase(long electionId) throws VoteLedgerException {
		int wire = reader.read("phase of election " + electionId, () -> ledger.getElectionPhase(electionId));
		ElectionPhase ledgerPhase = ElectionPhase.fromWire(wire);
		LocalDateTime expiresAt = cache.find(electionId).map(ElectionEntity::getExpiresAt).orElse(null);
		return applyExpiry(ledgerPhase, expiresAt, LocalDateTime.now(ZoneOffset.UTC));
	}

	/**
	 * Merge the ledger phase with the local deadline. Only ACTIVE can become EXPIRED.
	 */
	public static ElectionPhase applyExpiry(ElectionPhase ledgerPhase, LocalDateTime expiresAt, LocalDateTime nowUtc) {
		if (ledgerPhase == ElectionPhase.ACTIVE && expiresAt != null && nowUtc.isAfter(expiresAt)) return ElectionPhase.EXPIRED;
		return ledgerPhase;
	}

	/**
	 * Voting gate. Votes are only accepted while the effective phase is ACTIVE.
	 * When the phase cannot be read from the ledger, voting is refused as well.
	 *
	 * @throws VoteLedgerException PHASE_GATE for every other phase and when the ledger is unreachable
	 */
	public void requireActive(long electionId) throws VoteLedgerException {
		ElectionPhase phase;
		try {
			phase = effectivePhase(electionId);
		} catch (VoteLedgerException e) {
			log.warn("Cannot resolve phase of election {}. Refusing to vote: {}", electionId, e.getMessage());
			throw new VoteLedgerException(VoteLedgerException.Errors.PHASE_GATE,
					"Cannot determine the phase of election " + electionId + ". Voting is not possible right now.", e);
		}
		if (phase != ElectionPhase.ACTIVE)
			throw new VoteLedgerException(VoteLedgerException.Errors.PHASE_GATE, "Election " + electionId + " is not active. It is " + phase + ".");
	}

	/**
	 * Gate for administrative operations and registrations.
	 * @param electionId ledger id of the election
	 * @param action what the caller wants to do, for the error message
	 * @param allowed effective phases in which the action is allowed
	 * @return the current effective phase
	 * @throws VoteLedgerException PHASE_GATE when the election is in any other phase
	 */
	public ElectionPhase requirePhase(long electionId, String action, ElectionPhase... allowed) throws VoteLedgerException {
		ElectionPhase phase = effectivePhase(electionId);
		List<ElectionPhase> allowedList = Arrays.asList(allowed);
		if (!allowedList.contains(phase))
			throw new VoteLedgerException(VoteLedgerException.Errors.PHASE_GATE,
					"Cannot " + action + ": election " + electionId + " is " + phase + ". Must be " + allowedList + ".");
		return phase;
	}
}
