/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.server.auth;

import java.time.Instant;
import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

import io.logpare.mcp.spec.ErrorCodes;
import io.logpare.mcp.spec.McpError;
import reactor.util.annotation.Nullable;

/**
 * The outcome of authenticating one request.
 *
 * @param authenticated whether the caller is authenticated
 * @param scopes the scopes granted to the caller
 * @param subject the caller's identity, when authenticated
 * @param expiresAt when the caller's credentials expire, if known
 */
public record AuthContext(boolean authenticated, Set<Scope> scopes, @Nullable String subject,
		@Nullable Instant expiresAt) {

	/**
	 * Authenticated with every scope.
	 */
	public static final AuthContext FULL_ACCESS = new AuthContext(true, EnumSet.allOf(Scope.class), null, null);

	public static final AuthContext ANONYMOUS = new AuthContext(false, Set.of(), null, null);

	public AuthContext {
		scopes = scopes == null || scopes.isEmpty() ? Set.of() : Set.copyOf(scopes);
	}

	/**
	 * Checks that the caller is authenticated and holds every given scope.
	 * @param required the scopes the operation needs
	 * @throws McpError with {@link ErrorCodes#UNAUTHORIZED} if the caller is not
	 * authenticated, or {@link ErrorCodes#INSUFFICIENT_SCOPE} if a scope is missing
	 */
	public void requireScopes(Scope... required) {
		if (!this.authenticated) {
			throw McpError.builder(ErrorCodes.UNAUTHORIZED).message("Authentication required").build();
		}
		if (!this.scopes.containsAll(Arrays.asList(required))) {
			String names = Arrays.stream(required).map(Scope::value).collect(Collectors.joining(", "));
			throw McpError.builder(ErrorCodes.INSUFFICIENT_SCOPE)
				.message("Insufficient scope. Required: " + names)
				.build();
		}
	}

}
