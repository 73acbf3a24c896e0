package org.voteledger.election;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * An election as the ledger knows it, merged with its local cache row.
 * phase is the effective phase. Timestamps are UTC.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ElectionView {
	long electionId;
	String name;
	String description;
	ElectionPhase phase;
	long candidateCount;
	long totalVotes;
	LocalDateTime createdAt;
	LocalDateTime startedAt;
	LocalDateTime endedAt;
	boolean liveResults;
	LocalDateTime expiresAt;
}
