package org.voteledger.voter;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Optional;

/**
 * Local store of voters and their registrations.
 * Each method is one short transaction. Writers are only called after the ledger confirmed.
 */
@Slf4j
@ApplicationScoped
public class VoterRegistry {

	@Transactional
	public Optional<VoterEntity> findVoter(String enrollment) {
		return VoterEntity.findByEnrollment(enrollment);
	}

	@Transactional
	public boolean isRegistered(VoterEntity voter, long electionId) {
		return VoterElectionRegistrationEntity.findByVoterAndElection(voter, electionId).isPresent();
	}

	@Transactional
	public long countVoters() {
		return VoterEntity.count();
	}

	@Transactional
	public List<VoterEntity> listVoters() {
		return VoterEntity.listAllByEnrollment();
	}

	/**
	 * Store a confirmed registration. Creates the voter, if this is their first election.
	 * The template of an existing voter is never replaced.
	 */
	@Transactional
	public VoterElectionRegistrationEntity recordRegistration(String enrollment, String name, byte[] template,
	                                                          long electionId, String enrollmentHash, String faceHash) {
		VoterEntity voter = VoterEntity.findByEnrollment(enrollment).orElseGet(() -> {
			VoterEntity newVoter = new VoterEntity(enrollment, name, template);
			newVoter.persist();
			log.info("New voter {}", newVoter);
			return newVoter;
		});
		VoterElectionRegistrationEntity registration = new VoterElectionRegistrationEntity(voter, electionId, enrollmentHash, faceHash);
		registration.persist();
		log.info("Registered {}", registration);
		return registration;
	}

	/**
	 * Remember that this voter has voted in that election.
	 * @return false if there is no local registration (ledger and cache drifted apart)
	 */
	@Transactional
	public boolean markVoted(String enrollment, long electionId) {
		Optional<VoterElectionRegistrationEntity> registration = VoterEntity.findByEnrollment(enrollment)
				.flatMap(voter -> VoterElectionRegistrationEntity.findByVoterAndElection(voter, electionId));
		if (registration.isEmpty()) {
			log.warn("Vote confirmed by the ledger, but there is no local registration for election {}", electionId);
			return false;
		}
		registration.get().setHasVoted(true);
		return true;
	}
}
