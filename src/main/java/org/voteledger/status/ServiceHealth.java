package org.voteledger.status;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/** Health of one service in the system status */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ServiceHealth {
	boolean ok;
	String label;
	String detail;
}
