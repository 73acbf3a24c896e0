package org.voteledger.election;

import jakarta.annotation.security.RolesAllowed;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.graphql.*;
import org.voteledger.security.AdminIdentity;
import org.voteledger.util.VoteLedgerException;

import java.util.List;

/**
 * This adapter only handles the GraphQL API specifics.
 * All the business logic is in ElectionService.
 */
@Slf4j
@GraphQLApi
public class ElectionsGraphQL {

	@Inject
	ElectionService electionService;

	@Inject
	PhaseResolver phaseResolver;

	@Inject
	AdminIdentity adminIdentity;

	@Query
	@Description("All elections on the ledger with their effective phase")
	public List<ElectionView> elections() throws VoteLedgerException {
		return electionService.listElections();
	}

	@Query
	@Description("Get one election by its ledger id")
	public ElectionView election(@NonNull Long electionId) throws VoteLedgerException {
		return electionService.getElection(electionId);
	}

	@Query
	@Description("Effective phase of an election. EXPIRED when the deadline has passed while still ACTIVE.")
	public ElectionPhase electionPhase(@NonNull Long electionId) throws VoteLedgerException {
		return phaseResolver.effectivePhase(electionId);
	}

	@Query
	@Description("Candidates of an election. Votes are 0 while results are hidden.")
	public List<CandidateView> candidates(@NonNull Long electionId) throws VoteLedgerException {
		return electionService.candidates(electionId);
	}

	/**
	 * Admin creates a new election. Candidates can be added while it is CREATED.
	 * @param name name of the election
	 * @param description longer description
	 * @param liveResults show vote counts during the election (default true)
	 * @param expiresAt optional deadline "yyyy-MM-dd'T'HH:mm" in UTC
	 * @return the confirmed transaction and the id of the new election
	 */
	@Mutation
	@Description("Admin creates a new election")
	@RolesAllowed(AdminIdentity.ADMIN_ROLE)
	public ElectionTxResponse createElection(
			@NonNull String name,
			String description,
			Boolean liveResults,
			String expiresAt
	) throws VoteLedgerException {
		log.info("createElection '{}' by {}", name, adminIdentity.getCallerName());
		return electionService.createElection(name, description, liveResults, expiresAt);
	}

	@Mutation
	@Description("Admin adds a candidate to an election in phase CREATED")
	@RolesAllowed(AdminIdentity.ADMIN_ROLE)
	public ElectionTxResponse addCandidate(@NonNull Long electionId, @NonNull String name) throws VoteLedgerException {
		log.info("addCandidate '{}' to election {} by {}", name, electionId, adminIdentity.getCallerName());
		return electionService.addCandidate(electionId, name);
	}

	@Mutation
	@Description("Admin starts the voting phase of an election")
	@RolesAllowed(AdminIdentity.ADMIN_ROLE)
	public ElectionTxResponse startElection(@NonNull Long electionId) throws VoteLedgerException {
		log.info("startElection {} by {}", electionId, adminIdentity.getCallerName());
		return electionService.startElection(electionId);
	}

	@Mutation
	@Description("Admin ends the voting phase of an election")
	@RolesAllowed(AdminIdentity.ADMIN_ROLE)
	public ElectionTxResponse endElection(@NonNull Long electionId) throws VoteLedgerException {
		log.info("endElection {} by {}", electionId, adminIdentity.getCallerName());
		return electionService.endElection(electionId);
	}

	@Mutation
	@Description("Admin declares the results of an ended election")
	@RolesAllowed(AdminIdentity.ADMIN_ROLE)
	public ElectionTxResponse declareResults(@NonNull Long electionId) throws VoteLedgerException {
		log.info("declareResults {} by {}", electionId, adminIdentity.getCallerName());
		return electionService.declareResults(electionId);
	}
}
