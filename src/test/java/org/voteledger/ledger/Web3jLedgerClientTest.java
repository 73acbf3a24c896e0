package org.voteledger.ledger;

import io.quarkus.test.junit.QuarkusTest;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.TestInfo;
import org.voteledger.util.VoteLedgerConfig;
import org.voteledger.util.VoteLedgerException;
import org.web3j.protocol.http.HttpService;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.ConnectException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Web3jLedgerClient against a scripted JSON-RPC node.
 */
@Slf4j
@QuarkusTest
public class Web3jLedgerClientTest {

	static final String TX_HASH = "0x" + "ab".repeat(32);

	@Inject
	VoteLedgerConfig config;

	@Inject
	TransactionSubmitter submitter;

	@BeforeEach
	public void beforeEachTest(TestInfo testInfo) {
		log.info("==========> Starting: " + testInfo.getDisplayName());
	}

	@AfterEach
	public void afterEachTest(TestInfo testInfo) {
		log.info("<========== Finished: " + testInfo.getDisplayName());
	}

	/** Answers eth_* requests with canned results. Methods listed in failing lose the connection. */
	static class ScriptedNode extends HttpService {
		static final Pattern METHOD = Pattern.compile("\"method\"\\s*:\\s*\"([a-zA-Z_]+)\"");

		final Set<String> failing = new HashSet<>();
		final Set<String> called = new HashSet<>();

		ScriptedNode(String... failingMethods) {
			super("http://127.0.0.1:7545");
			failing.addAll(Set.of(failingMethods));
		}

		@Override
		protected InputStream performIO(String request) throws IOException {
			Matcher m = METHOD.matcher(request);
			String method = m.find() ? m.group(1) : "unknown";
			called.add(method);
			if (failing.contains(method)) throw new ConnectException("Connection refused");
			String result;
			switch (method) {
				case "eth_getTransactionCount":
					result = "\"0x0\"";
					break;
				case "eth_sendRawTransaction":
					result = "\"" + TX_HASH + "\"";
					break;
				case "eth_call":
					result = "\"0x\"";
					break;
				case "eth_blockNumber":
					result = "\"0x2a\"";
					break;
				default:
					result = "null";
			}
			String json = "{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":" + result + "}";
			return new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8));
		}
	}

	private Web3jLedgerClient clientFor(ScriptedNode node) {
		Web3jLedgerClient client = new Web3jLedgerClient();
		client.config = config;
		client.connect(node);
		client.chainId = 1337L;
		return client;
	}

	@Test
	public void connectionLostAfterBroadcastIsTimeoutWithTxHash() {
		ScriptedNode node = new ScriptedNode("eth_getTransactionReceipt");
		Web3jLedgerClient client = clientFor(node);

		LedgerTimeoutException ex = assertThrows(LedgerTimeoutException.class,
				() -> client.send(LedgerCall.startElection(1), Duration.ofSeconds(5)));
		assertEquals(TX_HASH, ex.getTxHash());
		assertTrue(node.called.contains("eth_sendRawTransaction"));

		VoteLedgerException normalized = submitter.normalize(LedgerCall.startElection(1), ex);
		assertEquals(VoteLedgerException.Errors.CONFIRMATION_TIMEOUT, normalized.getError());
		assertTrue(normalized.getMessage().contains(TX_HASH));
	}

	@Test
	public void connectionLostBeforeBroadcastIsTransportError() {
		ScriptedNode node = new ScriptedNode("eth_sendRawTransaction");
		Web3jLedgerClient client = clientFor(node);

		IOException ex = assertThrows(IOException.class,
				() -> client.send(LedgerCall.startElection(1), Duration.ofSeconds(5)));
		assertFalse(node.called.contains("eth_getTransactionReceipt"));

		VoteLedgerException normalized = submitter.normalize(LedgerCall.startElection(1), ex);
		assertEquals(VoteLedgerException.Errors.TRANSPORT_UNAVAILABLE, normalized.getError());
	}

	@Test
	public void blockNumberIsReadFromNode() throws Exception {
		ScriptedNode node = new ScriptedNode();
		assertEquals(42L, clientFor(node).getBlockNumber());
		assertTrue(node.called.contains("eth_blockNumber"));
	}
}
