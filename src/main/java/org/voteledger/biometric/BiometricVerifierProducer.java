package org.voteledger.biometric;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.voteledger.util.VoteLedgerConfig;

/**
 * Selects the BiometricVerifier from voteledger.biometric.mode
 */
@Slf4j
@ApplicationScoped
public class BiometricVerifierProducer {

	public static final String MODE_EMBEDDING = "embedding";
	public static final String MODE_ACCEPT_ALL = "accept-all";

	@Inject
	VoteLedgerConfig config;

	@Produces
	@ApplicationScoped
	BiometricVerifier biometricVerifier() {
		String mode = config.biometric().mode();
		switch (mode) {
			case MODE_EMBEDDING:
				log.info("Biometric verifier: face embeddings, threshold {}", config.biometric().matchThreshold());
				return new EmbeddingBiometricVerifier(config.biometric().matchThreshold());
			case MODE_ACCEPT_ALL:
				log.warn("Biometric verifier: ACCEPT ALL. Any face matches every voter. Never use this in production!");
				return new AcceptAllBiometricVerifier();
			default:
				throw new IllegalStateException("Unknown voteledger.biometric.mode '" + mode + "'. Must be " + MODE_EMBEDDING + " or " + MODE_ACCEPT_ALL);
		}
	}
}
