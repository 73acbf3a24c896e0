package org.voteledger.util;

import com.google.common.base.Strings;
import io.quarkus.vertx.web.RouteFilter;
import io.vertx.ext.web.RoutingContext;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Log all HTTP requests and responses.
 * Request bodies are not logged: castVote and registerVoter carry biometric samples.
 */
@Slf4j
public class VoteLedgerRequestLogger {

	public static boolean logHeaders = false;

	AtomicLong requestCounter = new AtomicLong(0);

	@RouteFilter(100)
	void logFilter(RoutingContext ctx) {
		long count = this.requestCounter.incrementAndGet();
		if (count > 99999) {
			this.requestCounter.set(0);
			count = 0;
		}
		String countPadded = Strings.padStart(String.valueOf(count), 6, ' ');

		ctx.request().exceptionHandler(err -> log.error("=> [" + countPadded + "] RequestException: " + err.getMessage()));
		ctx.response().exceptionHandler(err -> log.error("<= [" + countPadded + "] ResponseException: " + err.getMessage()));

		log.debug("=> [{}] {} {}", countPadded, ctx.request().method(), ctx.request().absoluteURI());
		if (logHeaders) ctx.request().headers().forEach((key, value) -> log.debug("  " + key + ": " + value));

		long start = System.currentTimeMillis();
		ctx.addEndHandler(res -> {
			// ledger mutations block until confirmation, so the duration is worth logging
			long millis = System.currentTimeMillis() - start;
			log.debug("<= [{}] {} {} ({} ms)", countPadded, ctx.response().getStatusCode(), ctx.response().getStatusMessage(), millis);
			if (logHeaders) ctx.response().headers().forEach((key, value) -> log.debug("  " + key + ": " + value));
		});

		ctx.next();  // important!
	}
}
