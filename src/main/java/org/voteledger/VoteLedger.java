package org.voteledger;

import io.agroal.api.AgroalDataSource;
import io.quarkus.runtime.LaunchMode;
import io.quarkus.runtime.StartupEvent;
import io.quarkus.runtime.configuration.ConfigUtils;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.voteledger.election.ElectionCache;
import org.voteledger.ledger.LedgerClient;
import org.voteledger.util.VoteLedgerConfig;
import org.voteledger.voter.VoterRegistry;

import java.sql.Connection;
import java.sql.SQLException;

@Slf4j
@ApplicationScoped
public class VoteLedger {

	@Inject
	AgroalDataSource dataSource;

	@Inject
	VoteLedgerConfig config;

	@Inject
	LedgerClient ledger;

	@Inject
	ElectionCache electionCache;

	@Inject
	VoterRegistry voterRegistry;

	@ConfigProperty(name = "quarkus.hibernate-orm.database.generation", defaultValue = "none")
	String databaseGeneration;

	@ConfigProperty(name = "quarkus.datasource.jdbc.url")
	String jdbcUrl;

	@ConfigProperty(name = "quarkus.http.port", defaultValue = "8080")
	int port;

	/**
	 * This is called when app has started.
	 * Print the configuration and sanity check the connection to our DB.
	 * The ledger is not called here. The node may come up after us. See GET /api/status
	 */
	void onStart(@Observes StartupEvent ev) {
		LaunchMode launchMode = LaunchMode.current();
		System.out.println("============ STARTING VoteLedger " + config.apiVersion() + " in [" + launchMode + "] ==================");
		System.out.println("   Profiles        : " + ConfigUtils.getProfiles());
		System.out.println("   HTTP port       : " + port);
		System.out.println("============= LEDGER ================");
		System.out.println("   RPC URL         : " + config.ledger().rpcUrl());
		System.out.println("   Contract        : " + ledger.getContractAddress());
		System.out.println("   Signer          : " + ledger.getSignerAddress());
		System.out.println("   Confirm timeout : " + config.ledger().confirmationTimeoutSecs() + "s");
		System.out.println("   Biometric mode  : " + config.biometric().mode());
		System.out.println("============= DB INFO ===============");
		System.out.println("   DB JDBC URL     : " + jdbcUrl);
		System.out.println("   DB Generation   : " + databaseGeneration);

		try (Connection con = dataSource.getConnection()) {
			System.out.println("   DB Connection   : " + con.getMetaData().getURL());
		} catch (SQLException e) {
			log.error("=====================================");
			log.error("Cannot connect to DB! {}", e.getMessage());
			log.error("=====================================");
			throw new RuntimeException(e);
		}

		try {
			System.out.println("============= Table counts ==========");
			System.out.println("   #Elections      : " + electionCache.count());
			System.out.println("   #Voters         : " + voterRegistry.countVoters());
		} catch (Exception e) {
			log.error("==================================================");
			log.error(" Elections or voters table does not exist.");
			log.error(" Is your database initialized with the correct schema?");
			log.error("==================================================");
			throw e;
		}
		System.out.println("=====================================");
	}
}
