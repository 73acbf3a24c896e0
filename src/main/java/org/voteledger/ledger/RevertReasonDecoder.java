package org.voteledger.ledger;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.Utils;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;

import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts a human-readable revert reason from whatever shape the ledger transport returned.
 *
 * The fallback order is fixed:
 * <ol>
 *   <li>structured error payload: "reason" field (anywhere inside error.data) or ABI encoded Error(string) revert data</li>
 *   <li>structured error payload: "message" field of error.data, then error.message itself</li>
 *   <li>free text of the exception (and its causes) containing a "revert &lt;reason&gt;" marker</li>
 *   <li>the generic {@link #GENERIC_REASON}</li>
 * </ol>
 * The output is always one flat, non-empty string. Transport internals (stack traces, URLs, JSON) never leak.
 */
@Slf4j
public final class RevertReasonDecoder {

	public static final String GENERIC_REASON = "Blockchain error";

	private static final Pattern REVERT_MARKER = Pattern.compile("revert (.+?)(?:['\"]|$)", Pattern.CASE_INSENSITIVE | Pattern.MULTILINE);

	/** selector of solidity's Error(string) */
	public static final String ERROR_STRING_SELECTOR = "0x08c379a0";

	private static final List<TypeReference<Type>> ERROR_STRING_OUTPUT =
			Utils.convert(Arrays.<TypeReference<?>>asList(new TypeReference<Utf8String>() {}));

	private static final ObjectMapper mapper = new ObjectMapper();

	private RevertReasonDecoder() {}

	public static String extractReason(Throwable failure) {
		if (failure == null) return GENERIC_REASON;

		if (failure instanceof LedgerException le && le.getRpcError() != null) {
			Optional<String> structured = fromRpcError(le.getRpcError());
			if (structured.isPresent()) return structured.get();
		}

		for (Throwable t = failure; t != null; t = t.getCause()) {
			Optional<String> fromText = fromText(t.getMessage());
			if (fromText.isPresent()) return fromText.get();
			if (t.getCause() == t) break;
		}
		log.debug("No revert reason found in {}", failure.getClass().getSimpleName());
		return GENERIC_REASON;
	}

	/**
	 * The ledger refuses duplicates with reasons like "Already voted" or "Voter already registered".
	 * These must be shown to the user as their own kind of error.
	 */
	public static boolean isAlreadyActed(String reason) {
		if (reason == null) return false;
		String lower = reason.toLowerCase();
		return lower.contains("already voted") || lower.contains("already registered");
	}

	static Optional<String> fromRpcError(LedgerException.RpcError err) {
		Optional<String> abiReason = decodeErrorString(err.getData());
		if (abiReason.isPresent()) return abiReason;

		JsonNode data = parseJson(err.getData());
		if (data != null && data.isObject()) {
			Optional<String> reason = text(data.findValue("reason"));
			if (reason.isPresent()) return reason;
			Optional<String> message = text(data.get("message")).filter(m -> !m.equalsIgnoreCase("revert"));
			if (message.isPresent()) return Optional.of(fromText(message.get()).orElse(message.get()));
		}
		String msg = err.getMessage();
		if (msg != null && !msg.isBlank()) {
			return Optional.of(fromText(msg).orElse(msg.trim()));
		}
		return Optional.empty();
	}

	static Optional<String> fromText(String text) {
		if (text == null) return Optional.empty();
		Matcher m = REVERT_MARKER.matcher(text);
		if (m.find()) {
			String reason = m.group(1).trim();
			if (!reason.isEmpty()) return Optional.of(reason);
		}
		return Optional.empty();
	}

	/**
	 * Decode revert data of the form Error(string): selector 0x08c379a0 followed by the ABI encoded string.
	 */
	static Optional<String> decodeErrorString(String hexData) {
		if (hexData == null || !hexData.startsWith(ERROR_STRING_SELECTOR)) return Optional.empty();
		try {
			List<Type> decoded = FunctionReturnDecoder.decode(
					hexData.substring(ERROR_STRING_SELECTOR.length()), ERROR_STRING_OUTPUT);
			if (decoded.isEmpty()) return Optional.empty();
			String reason = ((String) decoded.get(0).getValue()).trim();
			return reason.isEmpty() ? Optional.empty() : Optional.of(reason);
		} catch (RuntimeException e) {
			log.debug("Cannot decode revert data: {}", e.getMessage());
			return Optional.empty();
		}
	}

	private static Optional<String> text(JsonNode node) {
		if (node == null || !node.isTextual() || node.asText().isBlank()) return Optional.empty();
		return Optional.of(node.asText().trim());
	}

	private static JsonNode parseJson(String raw) {
		if (raw == null || raw.isBlank()) return null;
		String trimmed = raw.trim();
		if (!trimmed.startsWith("{")) return null;
		try {
			return mapper.readTree(trimmed);
		} catch (Exception e) {
			log.debug("error.data is not valid JSON: {}", e.getMessage());
			return null;
		}
	}
}
