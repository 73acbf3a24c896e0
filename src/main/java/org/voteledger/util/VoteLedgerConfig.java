package org.voteledger.util;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

import java.util.Optional;

/**
 * VoteLedger configurations from application.properties
 */
@ConfigMapping(prefix = "voteledger")
public interface VoteLedgerConfig {
	String apiVersion();

	// Elections without a cached row (or created without the flag) show live results.
	@WithDefault("true")
	boolean liveResultsDefault();

	Ledger ledger();
	interface Ledger {
		@NotNull
		String rpcUrl();

		@NotNull
		String contractAddress();

		// the one account that signs ALL mutating transactions. Never log this!
		@NotNull
		String signerPrivateKey();

		// If not set, then the chain id is asked from the node once.
		Optional<Long> chainId();

		@WithDefault("1000000000")
		long gasPriceWei();

		// This is the only timeout in the system.
		@WithDefault("60")
		@Min(1)
		int confirmationTimeoutSecs();

		@WithDefault("1000")
		@Min(10)
		long receiptPollIntervalMillis();
	}

	Receipt receipt();
	interface Receipt {
		// number of characters of the enrollment hash (including "0x") that are shown to voters
		@WithDefault("10")
		@Min(4)
		int visibleTagLength();
	}

	Biometric biometric();
	interface Biometric {
		// "embedding" in production. "accept-all" is a deterministic double for tests and demos.
		@WithDefault("embedding")
		String mode();

		// Maximum euclidean distance between two face embeddings. Lower = stricter.
		@WithDefault("0.45")
		double matchThreshold();
	}

}
