package org.voteledger.biometric;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.voteledger.util.VoteLedgerException;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Arrays;

/**
 * Compares face embeddings by their euclidean distance.
 * Samples and templates are vectors of little-endian float32 values, usually 128 of them.
 */
@Slf4j
public class EmbeddingBiometricVerifier implements BiometricVerifier {

	final double matchThreshold;

	public EmbeddingBiometricVerifier(double matchThreshold) {
		this.matchThreshold = matchThreshold;
	}

	@Override
	public byte[] encode(byte[] sample) throws VoteLedgerException {
		toVector(sample);
		return Arrays.copyOf(sample, sample.length);
	}

	@Override
	public boolean matches(byte[] storedTemplate, byte[] freshSample) throws VoteLedgerException {
		float[] known = toVector(storedTemplate);
		float[] fresh = toVector(freshSample);
		if (known.length != fresh.length) {
			log.info("Face embeddings have different dimensions {} and {}", known.length, fresh.length);
			return false;
		}
		double sum = 0;
		for (int i = 0; i < known.length; i++) {
			double d = known[i] - fresh[i];
			sum += d * d;
		}
		double distance = Math.sqrt(sum);
		log.debug("Face distance {} (threshold {})", distance, matchThreshold);
		return distance <= matchThreshold;
	}

	@Override
	public String digest(byte[] template) {
		return "0x" + DigestUtils.sha256Hex(template);
	}

	static float[] toVector(byte[] raw) throws VoteLedgerException {
		if (raw == null || raw.length == 0 || raw.length % Float.BYTES != 0)
			throw new VoteLedgerException(VoteLedgerException.Errors.VALIDATION_ERROR, "Biometric sample is not a face embedding");
		ByteBuffer buf = ByteBuffer.wrap(raw).order(ByteOrder.LITTLE_ENDIAN);
		float[] vector = new float[raw.length / Float.BYTES];
		for (int i = 0; i < vector.length; i++) {
			vector[i] = buf.getFloat();
			if (Float.isNaN(vector[i]) || Float.isInfinite(vector[i]))
				throw new VoteLedgerException(VoteLedgerException.Errors.VALIDATION_ERROR, "Biometric sample contains invalid values");
		}
		return vector;
	}
}
