/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.server.auth;

import reactor.core.publisher.Mono;
import reactor.util.annotation.Nullable;

/**
 * Authenticates a request before it is routed to a session.
 *
 * <p>
 * The default hook grants full access to everyone. A real implementation would validate
 * a bearer token and derive the scopes from its claims.
 */
@FunctionalInterface
public interface AuthHook {

	/**
	 * Grants {@link AuthContext#FULL_ACCESS} to every request.
	 */
	AuthHook NOOP = authorization -> Mono.just(AuthContext.FULL_ACCESS);

	/**
	 * Authenticates a request.
	 * @param authorization the value of the request's {@code Authorization} header, or
	 * {@code null}
	 * @return a Mono emitting the caller's auth context
	 */
	Mono<AuthContext> authenticate(@Nullable String authorization);

}
