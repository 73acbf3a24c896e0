package org.voteledger.biometric;

import lombok.extern.slf4j.Slf4j;
import org.voteledger.util.VoteLedgerException;

/**
 * Accepts every well-formed sample. For tests and demos without a capture pipeline.
 * Encoding and digest are the same as in production, so ledger commitments look alike.
 */
@Slf4j
public class AcceptAllBiometricVerifier extends EmbeddingBiometricVerifier {

	public AcceptAllBiometricVerifier() {
		super(Double.MAX_VALUE);
	}

	@Override
	public boolean matches(byte[] storedTemplate, byte[] freshSample) throws VoteLedgerException {
		toVector(freshSample);
		return true;
	}
}
