package org.voteledger.ledger;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Raw failure reported by the ledger or its JSON-RPC endpoint.
 * Depending on the node the error comes either as a structured JSON-RPC error payload
 * or only as prose. {@link RevertReasonDecoder} turns both into one flat reason string.
 *
 * Network problems are NOT LedgerExceptions. They are thrown as java.io.IOException.
 */
public class LedgerException extends Exception {

	/** structured JSON-RPC error. May be null when the ledger only reported prose. */
	@Getter
	final RpcError rpcError;

	public LedgerException(String message) {
		super(message);
		this.rpcError = null;
	}

	public LedgerException(String message, Throwable cause) {
		super(message, cause);
		this.rpcError = null;
	}

	public LedgerException(String message, RpcError rpcError) {
		super(message);
		this.rpcError = rpcError;
	}

	/**
	 * JSON-RPC error object: code, message and the optional "data" member.
	 * data is kept as raw text. It may be a JSON object (Ganache puts "reason" and "message" in there),
	 * a hex string with ABI encoded revert data or plain text.
	 */
	@Getter
	@ToString
	@AllArgsConstructor
	public static class RpcError {
		int code;
		String message;
		String data;
	}
}
