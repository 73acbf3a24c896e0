package org.voteledger.util;


import jakarta.ws.rs.core.Response;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.function.Supplier;

/**
 * <h1>VoteLedgerException</h1>
 *
 * VoteLedgerException is the one central place for handling exceptions in the application.
 * There are two kinds of exceptions:
 * <ul>
 * <li>Problems with the ledger itself: the node is unreachable, a transaction was reverted or not confirmed in time.</li>
 * <li>Normal business exceptions. For example when someone wants to vote in an election that has already ended.</li>
 * </ul>
 * When a VoteLedgerException is thrown from a GraphQL operation, then {@link VoteLedgerErrorExtensionProvider}
 * adds the errorName and errorCode to the GraphQL extensions JSON field:
 *
 * <pre>
 * {
 *   "data": { "castVote": null },
 *   "errors": [
 *     {
 *       "message": "You already voted in this election",
 *       "path": [ "castVote" ],
 *       "extensions": {
 *         "voteLedgerException": {
 *           "voteLedgerErrorName": "ALREADY_ACTED",
 *           "voteLedgerErrorCode": 30,
 *           "voteLedgerErrorMessage": "You already voted in this election"
 *         }
 *       }
 *     }
 *   ]
 * }
 * </pre>
 *
 * The message of a VoteLedgerException is always meant for humans. It must never contain a raw
 * transport stack trace. For ledger errors it is the extracted revert reason.
 */
@Slf4j
public class VoteLedgerException extends Exception {

	/** VoteLedger error code */
	@Getter
	Errors error;

	/**
	 * The codes are grouped by where the error is detected: locally before the ledger is called,
	 * by the ledger itself or while talking to the ledger.
	 */
	public enum Errors {
		// Detected locally. These never reach the ledger.
		VALIDATION_ERROR(10, Response.Status.BAD_REQUEST),              // missing or malformed input
		PHASE_GATE(20, Response.Status.CONFLICT),                       // operation not allowed in the election's effective phase
		BIOMETRIC_MISMATCH(21, Response.Status.UNAUTHORIZED),           // fresh biometric sample does not match the stored template

		// Reported by the ledger
		ALREADY_ACTED(30, Response.Status.CONFLICT),                    // duplicate vote or registration. User can act upon this.
		LEDGER_REJECTED(31, Response.Status.BAD_GATEWAY),               // any other revert

		// Talking to the ledger
		CONFIRMATION_TIMEOUT(40, Response.Status.GATEWAY_TIMEOUT),      // tx was broadcast, but not confirmed in time. It may still land later!
		TRANSPORT_UNAVAILABLE(41, Response.Status.SERVICE_UNAVAILABLE), // ledger node unreachable
		CONFIRMED_NOT_RECORDED(42, Response.Status.INTERNAL_SERVER_ERROR), // tx IS confirmed on the ledger, but the local cache could not be updated. Do not resubmit!

		// general errors
		UNAUTHORIZED(401, Response.Status.UNAUTHORIZED),
		NOT_FOUND(404, Response.Status.NOT_FOUND),                      // entity absent in ledger and cache
		INTERNAL_ERROR(500, Response.Status.INTERNAL_SERVER_ERROR);

		@Getter
		final int voteLedgerErrorCode;

		final Response.Status httpResponseStatus;

		Errors(int code, Response.Status httpResponseStatus) {
			this.voteLedgerErrorCode = code;
			this.httpResponseStatus = httpResponseStatus;
		}

		public Response.Status getHttpResponseStatus() {
			return this.httpResponseStatus;
		}
	}

	/**
	 * A VoteLedgerException must always have an error code and a human-readable error message
	 */
	public VoteLedgerException(Errors errCode, String msg) {
		super(msg);
		this.error = errCode;
	}

	public VoteLedgerException(Errors errCode, String msg, Throwable childException) {
		super(msg, childException);
		this.error = errCode;
	}

	/**
	 * This utility method can be passed to java.util.Optional methods, e.g.
	 * <pre>Optional.orElseThrow(VoteLedgerException.notFound("not found"))</pre>
	 * @param msg The human-readable error message
	 * @return a Supplier for that VoteLedgerException
	 */
	public static Supplier<VoteLedgerException> notFound(String msg) {
		return () -> new VoteLedgerException(Errors.NOT_FOUND, msg);
	}

	/**
	 * Supply an exception. This can be used in Optional methods, e.g.
	 * <pre>Optional.orElseThrow(VoteLedgerException.supply(Errors.SOME_NAME, "Some message"))</pre>
	 */
	public static Supplier<VoteLedgerException> supply(Errors error, String msg) {
		return () -> new VoteLedgerException(error, msg);
	}

	/**
	 * Like {@link #supply(Errors, String)}, but the error is logged when it is thrown.
	 * Server side errors (5xx) are logged as errors. Client errors only as info.
	 */
	public static Supplier<VoteLedgerException> supplyAndLog(Errors error, String msg) {
		return () -> {
			if (error.getHttpResponseStatus().getFamily() == Response.Status.Family.SERVER_ERROR) {
				log.error("{}: {}", error.name(), msg);
			} else {
				log.info("{}: {}", error.name(), msg);
			}
			return new VoteLedgerException(error, msg);
		};
	}

	public int getErrorCodeAsInt() {
		return this.error.voteLedgerErrorCode;
	}

	public String getErrorName() {
		return this.error.name();
	}

	public Response.Status getHttpResponseStatus() {
		return this.error.httpResponseStatus;
	}

	public String toString() {
		StringBuilder b = new StringBuilder("VoteLedgerException[");
		b.append("errorCode=");
		b.append(this.getErrorCodeAsInt());
		b.append(", errorName=");
		b.append(this.getErrorName());
		b.append(", msg=");
		b.append(this.getMessage());
		if (this.getCause() != null) {
			b.append(", cause=");
			b.append(this.getCause().toString());
		}
		b.append("]");
		return b.toString();
	}
}
