package org.voteledger.voter;

import jakarta.annotation.security.RolesAllowed;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.graphql.*;
import org.voteledger.security.AdminIdentity;
import org.voteledger.util.VoteLedgerException;
import org.voteledger.vote.CastVoteResponse;
import org.voteledger.vote.CastVoteService;

import java.util.List;

/**
 * GraphQL API for voter registration and voting.
 * All the business logic is in VoterService and CastVoteService.
 */
@Slf4j
@GraphQLApi
public class VotersGraphQL {

	@Inject
	VoterService voterService;

	@Inject
	CastVoteService castVoteService;

	@Inject
	AdminIdentity adminIdentity;

	@Query
	@Description("All registered voters")
	@RolesAllowed(AdminIdentity.ADMIN_ROLE)
	public List<VoterEntity> voters() {
		return voterService.listVoters();
	}

	/**
	 * Admin registers a voter for an election.
	 * @param sample base64 encoded face embedding, optionally as data URL
	 */
	@Mutation
	@Description("Admin registers a voter for an election")
	@RolesAllowed(AdminIdentity.ADMIN_ROLE)
	public RegistrationResponse registerVoter(
			@NonNull Long electionId,
			@NonNull String enrollment,
			@NonNull String name,
			@NonNull String sample
	) throws VoteLedgerException {
		log.info("registerVoter for election {} by {}", electionId, adminIdentity.getCallerName());
		return voterService.registerVoter(electionId, enrollment, name, sample);
	}

	/**
	 * A voter casts their vote. They authenticate with their face.
	 * @return the vote receipt
	 */
	@Mutation
	@Description("Cast a vote. Returns a receipt that does not reveal the choice.")
	public CastVoteResponse castVote(
			@NonNull Long electionId,
			@NonNull String enrollment,
			@NonNull Long candidateId,
			@NonNull String sample
	) throws VoteLedgerException {
		return castVoteService.castVote(electionId, enrollment, candidateId, sample);
	}
}
