package org.voteledger.election;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import org.voteledger.model.BaseEntity;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Local cache row of an election.
 * The ledger owns the election. This row only holds what the ledger does not know (liveResults, expiresAt)
 * and a mirror of the phase for quick local checks. It can always be rebuilt from the ledger.
 */
@Data
@NoArgsConstructor(force = true)
@EqualsAndHashCode(of = {}, callSuper = true)
@Entity(name = "elections")
public class ElectionEntity extends BaseEntity {

	/** id that the ledger assigned to this election. At most one cache row per ledger election. */
	@NotNull
	@Column(unique = true, nullable = false)
	Long blockchainId;

	String name;

	@Column(length = 2000)
	String description;

	/** mirror of the ledger phase. Only ever moves forward. Never EXPIRED. */
	@Enumerated(EnumType.STRING)
	ElectionPhase phase = ElectionPhase.CREATED;

	/** When false, vote counts are hidden until the results are declared. */
	boolean liveResults = true;

	/** soft deadline in UTC. After this moment an ACTIVE election counts as EXPIRED. */
	LocalDateTime expiresAt = null;

	LocalDateTime startedAt = null;

	LocalDateTime endedAt = null;

	public ElectionEntity(Long blockchainId) {
		this.blockchainId = blockchainId;
	}

	public static Optional<ElectionEntity> findByBlockchainId(long blockchainId) {
		return ElectionEntity.find("blockchainId", blockchainId).firstResultOptional();
	}

	@Override
	public String toString() {
		return "ElectionEntity[" +
				"id=" + id +
				", blockchainId=" + blockchainId +
				", name='" + name + "'" +
				", phase=" + phase +
				", liveResults=" + liveResults +
				", expiresAt=" + expiresAt +
				"]";
	}
}
