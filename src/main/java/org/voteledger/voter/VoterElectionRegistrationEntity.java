package org.voteledger.voter;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import org.voteledger.model.BaseEntity;

import java.util.Optional;

/**
 * A voter is registered for one election. At most one registration per voter and election.
 */
@Data
@NoArgsConstructor(force = true)
@EqualsAndHashCode(of = {}, callSuper = true)
@Entity(name = "voter_election_registrations")
@Table(uniqueConstraints = @UniqueConstraint(columnNames = {"voter_id", "election_id"}))
public class VoterElectionRegistrationEntity extends BaseEntity {

	@NotNull
	@ManyToOne(optional = false)
	@JoinColumn(name = "voter_id")
	VoterEntity voter;

	/** ledger id of the election */
	@NotNull
	@Column(name = "election_id", nullable = false)
	Long electionId;

	/** "0x" + sha256(enrollment:electionId) */
	@NotNull
	String enrollmentHash;

	/** face hash commitment that was sent to the ledger */
	@NotNull
	String faceHash;

	boolean hasVoted = false;

	public VoterElectionRegistrationEntity(VoterEntity voter, Long electionId, String enrollmentHash, String faceHash) {
		this.voter = voter;
		this.electionId = electionId;
		this.enrollmentHash = enrollmentHash;
		this.faceHash = faceHash;
	}

	public static Optional<VoterElectionRegistrationEntity> findByVoterAndElection(VoterEntity voter, long electionId) {
		return VoterElectionRegistrationEntity.find("voter = ?1 and electionId = ?2", voter, electionId).firstResultOptional();
	}

	@Override
	public String toString() {
		return "VoterElectionRegistration[" +
				"id=" + id +
				", voter.id=" + (voter != null ? voter.id : "null") +
				", electionId=" + electionId +
				", hasVoted=" + hasVoted +
				"]";
	}
}
