package org.voteledger.biometric;

import org.apache.commons.codec.binary.Base64;
import org.voteledger.util.VoteLedgerException;

/**
 * Samples arrive as base64 strings, optionally as data URL ("data:application/octet-stream;base64,....").
 */
public final class BiometricSamples {

	private BiometricSamples() {}

	public static byte[] decode(String base64Sample) throws VoteLedgerException {
		if (base64Sample == null || base64Sample.isBlank())
			throw new VoteLedgerException(VoteLedgerException.Errors.VALIDATION_ERROR, "Biometric sample is required");
		String data = base64Sample.trim();
		int comma = data.indexOf(',');
		if (data.startsWith("data:") && comma > 0) data = data.substring(comma + 1);
		if (!Base64.isBase64(data))
			throw new VoteLedgerException(VoteLedgerException.Errors.VALIDATION_ERROR, "Biometric sample must be base64 encoded");
		byte[] raw = Base64.decodeBase64(data);
		if (raw.length == 0)
			throw new VoteLedgerException(VoteLedgerException.Errors.VALIDATION_ERROR, "Biometric sample is empty");
		return raw;
	}
}
