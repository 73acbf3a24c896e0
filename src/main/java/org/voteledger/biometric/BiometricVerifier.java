package org.voteledger.biometric;

import org.voteledger.util.VoteLedgerException;

/**
 * Face matching. The capture pipeline turns a camera image into a face embedding. This is the sample.
 * Its encoded form is stored per voter as the template.
 * The implementation is selected with voteledger.biometric.mode, see {@link BiometricVerifierProducer}.
 */
public interface BiometricVerifier {

	/**
	 * Turn a fresh sample into a template that can be stored.
	 * @throws VoteLedgerException VALIDATION_ERROR when the sample is not a face embedding
	 */
	byte[] encode(byte[] sample) throws VoteLedgerException;

	/**
	 * Does the fresh sample show the same person as the stored template?
	 * @throws VoteLedgerException VALIDATION_ERROR when the sample is not a face embedding
	 */
	boolean matches(byte[] storedTemplate, byte[] freshSample) throws VoteLedgerException;

	/**
	 * Stable hash of a template, "0x" + 64 hex chars. This is the face hash commitment on the ledger.
	 */
	String digest(byte[] template);
}
