package org.voteledger.util;

import io.quarkus.security.AuthenticationFailedException;
import io.quarkus.security.ForbiddenException;
import io.quarkus.security.UnauthorizedException;
import jakarta.json.Json;
import jakarta.json.JsonValue;
import lombok.extern.slf4j.Slf4j;

/**
 * Puts the VoteLedger error name, code and message into the "extensions" of every GraphQL error,
 * so that GraphQL clients get the same three fields as REST clients.
 * Registered as a ServiceLoader in META-INF/services/io.smallrye.graphql.api.ErrorExtensionProvider
 *
 * https://smallrye.io/smallrye-graphql/2.13.0/custom-error-extensions/
 */
@Slf4j
public class VoteLedgerErrorExtensionProvider implements io.smallrye.graphql.api.ErrorExtensionProvider {

	static final String SYSTEM_ERROR_MESSAGE = "Something went wrong on the server. The error was logged.";
	static final String ACCESS_DENIED_MESSAGE = "Admin token is missing or not valid";

	@Override
	public String getKey() {
		return "voteLedgerException";
	}

	@Override
	public JsonValue mapValueFrom(Throwable throwable) {
		VoteLedgerException ve = unwrap(throwable);
		if (ve == null) ve = classify(throwable);
		return Json.createObjectBuilder()
				.add("voteLedgerErrorName", ve.getErrorName())
				.add("voteLedgerErrorCode", ve.getErrorCodeAsInt())
				.add("voteLedgerErrorMessage", ve.getMessage())
				.build();
	}

	/** GraphQL may hand us a wrapper. Find our own exception anywhere in the cause chain. */
	static VoteLedgerException unwrap(Throwable throwable) {
		for (Throwable t = throwable; t != null; t = t.getCause()) {
			if (t instanceof VoteLedgerException) return (VoteLedgerException) t;
			if (t.getCause() == t) break;
		}
		return null;
	}

	/**
	 * Anything that is not a VoteLedgerException. Security refusals keep their meaning,
	 * everything else is reported as INTERNAL_ERROR without leaking server internals.
	 */
	static VoteLedgerException classify(Throwable throwable) {
		if (throwable instanceof UnauthorizedException
				|| throwable instanceof ForbiddenException
				|| throwable instanceof AuthenticationFailedException) {
			log.info("GraphQL request refused: {}", throwable.toString());
			return new VoteLedgerException(VoteLedgerException.Errors.UNAUTHORIZED, ACCESS_DENIED_MESSAGE, throwable);
		}
		log.error("Unexpected error in GraphQL request", throwable);
		return new VoteLedgerException(VoteLedgerException.Errors.INTERNAL_ERROR, SYSTEM_ERROR_MESSAGE, throwable);
	}
}
