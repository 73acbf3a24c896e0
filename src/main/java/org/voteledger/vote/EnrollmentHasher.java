package org.voteledger.vote;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.apache.commons.codec.digest.DigestUtils;
import org.voteledger.util.VoteLedgerConfig;

/**
 * The enrollment hash binds a voter to one election without naming the voter.
 * It is the join key between vote receipts and voters. The enrollment itself is never stored with a receipt.
 *
 * enrollmentHash = "0x" + hex(sha256(enrollment + ":" + electionId))
 */
@ApplicationScoped
public class EnrollmentHasher {

	public static final String SEPARATOR = ":";
	public static final String PREFIX = "0x";

	@Inject
	VoteLedgerConfig config;

	/**
	 * @param enrollment the voter's enrollment id
	 * @param electionId ledger id of the election
	 * @return "0x" followed by 64 lowercase hex chars
	 */
	public String enrollmentHash(String enrollment, long electionId) {
		if (enrollment == null || enrollment.isEmpty()) throw new IllegalArgumentException("Need enrollment to calculate enrollmentHash");
		return PREFIX + DigestUtils.sha256Hex(enrollment + SEPARATOR + electionId);
	}

	/**
	 * Short prefix of the enrollment hash that can be shown to the voter. Including the "0x".
	 * This is a display aid for looking up a receipt, not a secret.
	 */
	public String visibleTag(String enrollmentHash) {
		int length = Math.min(config.receipt().visibleTagLength(), enrollmentHash.length());
		return enrollmentHash.substring(0, length);
	}
}
