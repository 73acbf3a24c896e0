package org.voteledger.security;

import io.quarkus.security.identity.SecurityIdentity;
import jakarta.enterprise.context.RequestScoped;
import jakarta.inject.Inject;

/**
 * Who is calling? Admin JWTs are issued by the external admin login and only verified here.
 * The JWT "groups" claim must contain {@link #ADMIN_ROLE} for administrative operations.
 */
@RequestScoped
public class AdminIdentity {

	public static final String ADMIN_ROLE = "VOTELEDGER_ADMIN";

	@Inject
	SecurityIdentity identity;

	/** name of the caller for the audit log, "anonymous" when not logged in */
	public String getCallerName() {
		if (identity == null || identity.isAnonymous()) return "anonymous";
		return identity.getPrincipal().getName();
	}
}
