package org.voteledger.voter;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Confirmation of a voter registration
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RegistrationResponse {
	Long voterId;
	long electionId;
	String visibleTag;
	String txHash;
	long blockNumber;
}
