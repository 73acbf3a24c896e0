package org.voteledger.election;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.transaction.Transactional;
import lombok.extern.slf4j.Slf4j;
import org.voteledger.util.VoteLedgerConfig;

import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Writes and reads the local election rows.
 *
 * Writers are only called after the ledger confirmed the corresponding transaction.
 * Each method runs in its own short transaction, never around a ledger call.
 */
@Slf4j
@ApplicationScoped
public class ElectionCache {

	@Inject
	VoteLedgerConfig config;

	@Transactional
	public Optional<ElectionEntity> find(long electionId) {
		return ElectionEntity.findByBlockchainId(electionId);
	}

	/** number of cached elections */
	@Transactional
	public long count() {
		return ElectionEntity.count();
	}

	/**
	 * Insert or update the cache row of a freshly created election.
	 * A new row starts in phase CREATED.
	 */
	@Transactional
	public ElectionEntity upsert(long electionId, String name, String description, boolean liveResults, LocalDateTime expiresAt) {
		ElectionEntity election = ElectionEntity.findByBlockchainId(electionId).orElseGet(() -> new ElectionEntity(electionId));
		if (election.id != null) log.warn("Election cache row for electionId={} already existed. Overwriting its metadata.", electionId);
		election.setName(name);
		election.setDescription(description);
		election.setLiveResults(liveResults);
		election.setExpiresAt(expiresAt);
		election.persist();
		log.info("Cached {}", election);
		return election;
	}

	/**
	 * Mirror a confirmed phase transition into the cache.
	 * The cached phase never goes backwards. If the row is already ahead, it is left alone and the divergence is logged.
	 * startedAt and endedAt are stamped with the current UTC time.
	 *
	 * @param electionId ledger id of the election
	 * @param newPhase the phase that the ledger just confirmed
	 * @return the (possibly unchanged) cache row
	 */
	@Transactional
	public ElectionEntity mirrorPhase(long electionId, ElectionPhase newPhase) {
		if (newPhase == ElectionPhase.EXPIRED) throw new IllegalArgumentException("EXPIRED is never cached");
		ElectionEntity election = ElectionEntity.findByBlockchainId(electionId).orElseGet(() -> {
			// election was created outside this backend
			log.warn("No cache row for electionId={}. Creating one.", electionId);
			ElectionEntity e = new ElectionEntity(electionId);
			e.setLiveResults(config.liveResultsDefault());
			return e;
		});

		if (newPhase.isBefore(election.getPhase())) {
			log.warn("Cached phase {} of electionId={} is ahead of the confirmed phase {}. Cache is left unchanged.",
					election.getPhase(), electionId, newPhase);
			return election;
		}

		LocalDateTime now = LocalDateTime.now(ZoneOffset.UTC);
		if (newPhase == ElectionPhase.ACTIVE && election.getStartedAt() == null) election.setStartedAt(now);
		if (newPhase == ElectionPhase.ENDED && election.getEndedAt() == null) election.setEndedAt(now);
		election.setPhase(newPhase);
		election.persist();
		log.info("Election {} is now {}", electionId, newPhase);
		return election;
	}
}
