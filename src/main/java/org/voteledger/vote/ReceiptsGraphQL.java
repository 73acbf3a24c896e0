package org.voteledger.vote;

import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.microprofile.graphql.*;
import org.voteledger.util.VoteLedgerException;

/**
 * Voters look up and verify their vote receipts. No login needed. Receipts do not reveal any choice.
 */
@Slf4j
@GraphQLApi
public class ReceiptsGraphQL {

	@Inject
	VerificationService verificationService;

	@Query
	@Description("Get a locally recorded vote receipt")
	public VoteReceiptEntity receipt(@NonNull Long receiptId) throws VoteLedgerException {
		return verificationService.getReceipt(receiptId);
	}

	@Query
	@Description("Verify a vote receipt against the blockchain. Falls back to local records when the blockchain is unreachable.")
	public VerificationResult verifyReceipt(@NonNull Long receiptId) throws VoteLedgerException {
		log.debug("verifyReceipt {}", receiptId);
		return verificationService.verify(receiptId);
	}

	@Query
	@Description("Find the receipt of a voter in an election")
	public ReceiptMatch searchReceipt(@NonNull String enrollment, @NonNull Long electionId) throws VoteLedgerException {
		return verificationService.searchReceipt(enrollment, electionId);
	}
}
