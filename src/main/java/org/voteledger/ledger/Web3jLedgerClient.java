package org.voteledger.ledger;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;
import org.voteledger.util.VoteLedgerConfig;
import org.web3j.abi.EventEncoder;
import org.web3j.abi.FunctionEncoder;
import org.web3j.abi.FunctionReturnDecoder;
import org.web3j.abi.TypeReference;
import org.web3j.abi.datatypes.Bool;
import org.web3j.abi.datatypes.Event;
import org.web3j.abi.datatypes.Function;
import org.web3j.abi.datatypes.Type;
import org.web3j.abi.datatypes.Utf8String;
import org.web3j.abi.datatypes.generated.Bytes32;
import org.web3j.abi.datatypes.generated.Uint256;
import org.web3j.abi.datatypes.generated.Uint8;
import org.web3j.crypto.Credentials;
import org.web3j.crypto.RawTransaction;
import org.web3j.crypto.TransactionEncoder;
import org.web3j.protocol.Web3j;
import org.web3j.protocol.Web3jService;
import org.web3j.protocol.core.DefaultBlockParameterName;
import org.web3j.protocol.core.Response;
import org.web3j.protocol.core.methods.request.Transaction;
import org.web3j.protocol.core.methods.response.EthBlockNumber;
import org.web3j.protocol.core.methods.response.EthCall;
import org.web3j.protocol.core.methods.response.EthChainId;
import org.web3j.protocol.core.methods.response.EthGetCode;
import org.web3j.protocol.core.methods.response.EthGetTransactionCount;
import org.web3j.protocol.core.methods.response.EthSendTransaction;
import org.web3j.protocol.core.methods.response.Log;
import org.web3j.protocol.core.methods.response.TransactionReceipt;
import org.web3j.protocol.exceptions.TransactionException;
import org.web3j.protocol.http.HttpService;
import org.web3j.tx.response.PollingTransactionReceiptProcessor;
import org.web3j.utils.Numeric;

import java.io.IOException;
import java.math.BigInteger;
import java.time.Duration;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Election contract client on top of web3j and the node's JSON-RPC API.
 *
 * Reads are eth_call against the latest block.
 * Writes are simulated with eth_call first, so that reverts come back with their reason and nothing is broadcast.
 * Then the transaction is signed locally (EIP-155) with the configured signer key, sent as raw transaction
 * and the receipt is polled until the confirmation timeout.
 */
@Slf4j
@ApplicationScoped
public class Web3jLedgerClient implements LedgerClient {

	/**
	 * VoteCast(uint256 indexed receiptId, uint256 indexed electionId, uint256 timestamp)
	 * The voter's choice is not part of the event.
	 */
	static final Event VOTE_CAST_EVENT = new Event("VoteCast", Arrays.<TypeReference<?>>asList(
			new TypeReference<Uint256>(true) {},
			new TypeReference<Uint256>(true) {},
			new TypeReference<Uint256>() {}
	));

	@Inject
	VoteLedgerConfig config;

	Web3j web3j;
	Credentials signer;
	String contractAddress;
	volatile Long chainId = null;

	@PostConstruct
	void connect() {
		connect(new HttpService(config.ledger().rpcUrl()));
	}

	void connect(Web3jService service) {
		this.web3j = Web3j.build(service);
		this.signer = Credentials.create(config.ledger().signerPrivateKey());
		this.contractAddress = config.ledger().contractAddress();
		this.chainId = config.ledger().chainId().orElse(null);
		log.info("Ledger client for contract {} at {} (signer {})", contractAddress, config.ledger().rpcUrl(), signer.getAddress());
	}

	@PreDestroy
	void disconnect() {
		if (web3j != null) web3j.shutdown();
	}

	// ================= Reads

	@Override
	public long getElectionCount() throws IOException, LedgerException {
		Function fn = new Function("getElectionCount", Collections.emptyList(),
				Arrays.<TypeReference<?>>asList(new TypeReference<Uint256>() {}));
		return uint(call(fn).get(0));
	}

	@Override
	public LedgerElection getElection(long electionId) throws IOException, LedgerException {
		Function fn = new Function("getElection", Arrays.<Type>asList(new Uint256(electionId)),
				Arrays.<TypeReference<?>>asList(
						new TypeReference<Uint256>() {},     // id
						new TypeReference<Utf8String>() {},  // name
						new TypeReference<Utf8String>() {},  // description
						new TypeReference<Uint8>() {},       // phase
						new TypeReference<Uint256>() {},     // candidateCount
						new TypeReference<Uint256>() {},     // totalVotes
						new TypeReference<Uint256>() {},     // createdAt
						new TypeReference<Uint256>() {},     // startedAt
						new TypeReference<Uint256>() {}      // endedAt
				));
		List<Type> out = call(fn);
		return new LedgerElection(
				uint(out.get(0)),
				(String) out.get(1).getValue(),
				(String) out.get(2).getValue(),
				(int) uint(out.get(3)),
				uint(out.get(4)),
				uint(out.get(5)),
				uint(out.get(6)),
				uint(out.get(7)),
				uint(out.get(8)));
	}

	@Override
	public LedgerCandidate getCandidate(long electionId, long candidateId) throws IOException, LedgerException {
		Function fn = new Function("getCandidate", Arrays.<Type>asList(new Uint256(electionId), new Uint256(candidateId)),
				Arrays.<TypeReference<?>>asList(
						new TypeReference<Uint256>() {},
						new TypeReference<Utf8String>() {},
						new TypeReference<Uint256>() {}
				));
		List<Type> out = call(fn);
		return new LedgerCandidate(uint(out.get(0)), (String) out.get(1).getValue(), uint(out.get(2)));
	}

	@Override
	public int getElectionPhase(long electionId) throws IOException, LedgerException {
		Function fn = new Function("getElectionPhase", Arrays.<Type>asList(new Uint256(electionId)),
				Arrays.<TypeReference<?>>asList(new TypeReference<Uint8>() {}));
		return (int) uint(call(fn).get(0));
	}

	@Override
	public LedgerVoteReceipt getVoteReceipt(long receiptId) throws IOException, LedgerException {
		Function fn = new Function("getVoteReceipt", Arrays.<Type>asList(new Uint256(receiptId)),
				Arrays.<TypeReference<?>>asList(
						new TypeReference<Uint256>() {},   // receiptId
						new TypeReference<Uint256>() {},   // electionId
						new TypeReference<Bytes32>() {},   // visibleTag
						new TypeReference<Uint256>() {},   // timestamp
						new TypeReference<Bool>() {}       // exists
				));
		List<Type> out = call(fn);
		return new LedgerVoteReceipt(
				uint(out.get(0)),
				uint(out.get(1)),
				(byte[]) out.get(2).getValue(),
				uint(out.get(3)),
				(Boolean) out.get(4).getValue());
	}

	@Override
	public long globalReceiptCounter() throws IOException, LedgerException {
		Function fn = new Function("globalReceiptCounter", Collections.emptyList(),
				Arrays.<TypeReference<?>>asList(new TypeReference<Uint256>() {}));
		return uint(call(fn).get(0));
	}

	// ================= Writes

	@Override
	public LedgerTxReceipt send(LedgerCall call, Duration confirmationTimeout) throws IOException, LedgerException {
		Function fn = toFunction(call);
		String data = FunctionEncoder.encode(fn);

		// 1. simulate. A revert here has a reason and costs nothing.
		ethCall(fn.getName(), data);

		// 2. nonce of the signing account. Safe only because the TransactionSubmitter serializes all sends.
		EthGetTransactionCount txCount = web3j.ethGetTransactionCount(signer.getAddress(), DefaultBlockParameterName.PENDING).send();
		throwOnError("getTransactionCount", txCount);
		BigInteger nonce = txCount.getTransactionCount();

		// 3. sign and broadcast
		RawTransaction rawTx = RawTransaction.createTransaction(
				nonce,
				BigInteger.valueOf(config.ledger().gasPriceWei()),
				BigInteger.valueOf(call.getGas()),
				contractAddress,
				data);
		byte[] signed = TransactionEncoder.signMessage(rawTx, getChainId(), signer);
		EthSendTransaction sent = web3j.ethSendRawTransaction(Numeric.toHexString(signed)).send();
		throwOnError(fn.getName(), sent);
		String txHash = sent.getTransactionHash();
		log.debug("Broadcast {} nonce={} tx={}", fn.getName(), nonce, txHash);

		// 4. wait for inclusion
		TransactionReceipt receipt = waitForReceipt(txHash, confirmationTimeout);
		if (!receipt.isStatusOK()) {
			String reason = receipt.getRevertReason() != null ? receipt.getRevertReason() : RevertReasonDecoder.GENERIC_REASON;
			throw new LedgerException("Transaction " + txHash + " failed: revert " + reason);
		}

		Long assignedId = call.getOperation() == LedgerOperation.CAST_VOTE ? decodeVoteCastReceiptId(receipt) : null;
		return new LedgerTxReceipt(txHash, receipt.getBlockNumber().longValue(), assignedId);
	}

	// ================= Health

	@Override
	public long getBlockNumber() throws IOException, LedgerException {
		EthBlockNumber res = web3j.ethBlockNumber().send();
		throwOnError("blockNumber", res);
		return res.getBlockNumber().longValue();
	}

	@Override
	public long getChainId() throws IOException, LedgerException {
		if (chainId == null) {
			EthChainId res = web3j.ethChainId().send();
			throwOnError("chainId", res);
			chainId = res.getChainId().longValue();
		}
		return chainId;
	}

	@Override
	public boolean isContractDeployed() throws IOException, LedgerException {
		EthGetCode code = web3j.ethGetCode(contractAddress, DefaultBlockParameterName.LATEST).send();
		throwOnError("getCode", code);
		return code.getCode() != null && code.getCode().length() > 2;
	}

	@Override
	public String getSignerAddress() {
		return signer.getAddress();
	}

	@Override
	public String getContractAddress() {
		return contractAddress;
	}

	// ================= internals

	Function toFunction(LedgerCall call) {
		String name = call.getOperation().getFunctionName();
		List<Type> args;
		switch (call.getOperation()) {
			case CREATE_ELECTION:
				args = Arrays.<Type>asList(new Utf8String(call.getName()), new Utf8String(call.getDescription()));
				break;
			case ADD_CANDIDATE:
				args = Arrays.<Type>asList(new Uint256(call.getElectionId()), new Utf8String(call.getName()));
				break;
			case START_ELECTION:
			case END_ELECTION:
			case DECLARE_RESULTS:
				args = Arrays.<Type>asList(new Uint256(call.getElectionId()));
				break;
			case REGISTER_VOTER:
				args = Arrays.<Type>asList(
						new Uint256(call.getElectionId()),
						new Utf8String(call.getEnrollment()),
						new Bytes32(Numeric.hexStringToByteArray(call.getFaceHashCommitment())));
				break;
			case CAST_VOTE:
				args = Arrays.<Type>asList(
						new Uint256(call.getElectionId()),
						new Utf8String(call.getEnrollment()),
						new Bytes32(Numeric.hexStringToByteArray(call.getFaceHashCommitment())),
						new Uint256(call.getCandidateId()));
				break;
			default:
				throw new IllegalArgumentException("Unknown ledger operation " + call.getOperation());
		}
		return new Function(name, args, Collections.emptyList());
	}

	private List<Type> call(Function fn) throws IOException, LedgerException {
		String value = ethCall(fn.getName(), FunctionEncoder.encode(fn));
		if (value == null || value.equals("0x"))
			throw new LedgerException(fn.getName() + " returned no data. Is the contract deployed at " + contractAddress + "?");
		return FunctionReturnDecoder.decode(value, fn.getOutputParameters());
	}

	/** eth_call against the latest block. Reverts are thrown, whether they come as RPC error or as revert data in the result. */
	private String ethCall(String fnName, String data) throws IOException, LedgerException {
		EthCall res = web3j.ethCall(
				Transaction.createEthCallTransaction(signer.getAddress(), contractAddress, data),
				DefaultBlockParameterName.LATEST).send();
		throwOnError(fnName, res);
		String value = res.getValue();
		if (value != null && value.startsWith(RevertReasonDecoder.ERROR_STRING_SELECTOR)) {
			String reason = RevertReasonDecoder.decodeErrorString(value).orElse(RevertReasonDecoder.GENERIC_REASON);
			throw new LedgerException(fnName + " reverted: revert " + reason);
		}
		return value;
	}

	private void throwOnError(String what, Response<?> res) throws LedgerException {
		if (res.hasError()) {
			Response.Error err = res.getError();
			throw new LedgerException(what + " failed: " + err.getMessage(),
					new LedgerException.RpcError(err.getCode(), err.getMessage(), err.getData()));
		}
	}

	/**
	 * Poll for the receipt of a broadcast transaction.
	 * From here on the transaction may be included at any time. So every failure, also a lost connection,
	 * is a {@link LedgerTimeoutException} that carries the txHash, never a plain transport error.
	 */
	TransactionReceipt waitForReceipt(String txHash, Duration timeout) throws LedgerTimeoutException {
		long pollMillis = config.ledger().receiptPollIntervalMillis();
		int attempts = (int) Math.max(1, timeout.toMillis() / pollMillis);
		try {
			return new PollingTransactionReceiptProcessor(web3j, pollMillis, attempts).waitForTransactionReceipt(txHash);
		} catch (TransactionException e) {
			throw new LedgerTimeoutException(txHash, "No receipt for " + txHash + " after " + timeout.toSeconds() + "s", e);
		} catch (IOException e) {
			log.error("Lost connection to ledger node while waiting for broadcast tx {}: {}", txHash, e.getMessage());
			throw new LedgerTimeoutException(txHash, "Connection lost while waiting for the receipt of " + txHash, e);
		}
	}

	/**
	 * Find the VoteCast event of our contract in the receipt and return its receiptId.
	 * @return the receiptId or null when there is no decodable VoteCast log
	 */
	Long decodeVoteCastReceiptId(TransactionReceipt receipt) {
		String topic0 = EventEncoder.encode(VOTE_CAST_EVENT);
		for (Log l : receipt.getLogs()) {
			if (l.getTopics() == null || l.getTopics().size() < 2) continue;
			if (!contractAddress.equalsIgnoreCase(l.getAddress())) continue;
			if (!topic0.equalsIgnoreCase(l.getTopics().get(0))) continue;
			return Numeric.toBigInt(l.getTopics().get(1)).longValueExact();
		}
		log.warn("No VoteCast event in receipt of tx {}", receipt.getTransactionHash());
		return null;
	}

	private static long uint(Type value) {
		return ((BigInteger) value.getValue()).longValueExact();
	}
}
