package org.voteledger.status;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Health of ledger node, contract, database and server. overall is true when all of them are ok.
 */
@Data
@NoArgsConstructor
public class SystemStatus {
	boolean overall;
	Map<String, ServiceHealth> services = new LinkedHashMap<>();
	String rpcUrl;
	String contractAddress;
}
