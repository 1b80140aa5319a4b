/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.session;

import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

import io.logpare.mcp.spec.ErrorCodes;
import io.logpare.mcp.spec.McpError;
import io.logpare.mcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Binds inbound client messages to sessions.
 *
 * <ul>
 * <li>A message with a known session id is forwarded to that session's transport and
 * refreshes its activity.</li>
 * <li>An {@link MessageKind#INITIALIZE} message without a session id creates a session.
 * The session is registered only once its transport is connected and has accepted the
 * initialize message; a transport that fails either step is closed and never becomes
 * visible.</li>
 * <li>Anything else fails with an {@link McpError} of code
 * {@link ErrorCodes#INVALID_SESSION}.</li>
 * </ul>
 */
public class SessionRouter {

	private static final Logger logger = LoggerFactory.getLogger(SessionRouter.class);

	static final String INIT_FAILED_MESSAGE = "Internal error: failed to initialize session";

	private final SessionRegistry registry;

	private final SessionTransportFactory transportFactory;

	private final SessionConnector connector;

	private final Supplier<String> sessionIdGenerator;

	public SessionRouter(SessionRegistry registry, SessionTransportFactory transportFactory,
			SessionConnector connector) {
		this(registry, transportFactory, connector, () -> UUID.randomUUID().toString());
	}

	SessionRouter(SessionRegistry registry, SessionTransportFactory transportFactory, SessionConnector connector,
			Supplier<String> sessionIdGenerator) {
		Assert.notNull(registry, "registry must not be null");
		Assert.notNull(transportFactory, "transportFactory must not be null");
		Assert.notNull(connector, "connector must not be null");
		Assert.notNull(sessionIdGenerator, "sessionIdGenerator must not be null");
		this.registry = registry;
		this.transportFactory = transportFactory;
		this.connector = connector;
		this.sessionIdGenerator = sessionIdGenerator;
	}

	/**
	 * Routes a message to its session.
	 * @param message the inbound message
	 * @return a Mono emitting the session's reply, or failing with an {@link McpError}
	 */
	public Mono<RoutedReply> route(InboundMessage message) {
		Assert.notNull(message, "message must not be null");
		return Mono.defer(() -> switch (message.kind()) {
			case INITIALIZE, REQUEST -> routeRequest(message);
			case STREAM -> routeStream(message);
			case TERMINATE -> routeTerminate(message);
		});
	}

	private Mono<RoutedReply> routeRequest(InboundMessage message) {
		String sessionId = message.sessionId();
		if (sessionId != null) {
			Optional<SessionTransport> transport = this.registry.find(sessionId);
			if (transport.isPresent()) {
				this.registry.touch(sessionId);
				return forward(sessionId, transport.get(), message);
			}
			logger.debug("Rejecting message for unknown session {}", sessionId);
			return Mono.error(McpError.invalidSession());
		}
		if (message.kind() == MessageKind.INITIALIZE) {
			return initialize(message);
		}
		return Mono.error(McpError.invalidSession());
	}

	private Mono<RoutedReply> routeStream(InboundMessage message) {
		String sessionId = message.sessionId();
		if (sessionId == null) {
			return Mono.error(McpError.missingSessionId());
		}
		return this.registry.find(sessionId).map(transport -> {
			this.registry.touch(sessionId);
			return forward(sessionId, transport, message);
		}).orElseGet(() -> Mono.error(McpError.invalidSession()));
	}

	private Mono<RoutedReply> routeTerminate(InboundMessage message) {
		String sessionId = message.sessionId();
		if (sessionId == null) {
			return Mono.error(McpError.missingSessionId());
		}
		return this.registry.find(sessionId)
			.map(transport -> forward(sessionId, transport, message)
				.flatMap(reply -> this.registry.terminate(sessionId).thenReturn(reply)))
			.orElseGet(() -> Mono.error(McpError.invalidSession()));
	}

	private Mono<RoutedReply> initialize(InboundMessage message) {
		String sessionId = this.sessionIdGenerator.get();
		SessionTransport transport;
		try {
			transport = this.transportFactory.create(sessionId);
		}
		catch (RuntimeException e) {
			logger.error("Failed to create transport for session {}", sessionId, e);
			return Mono.error(initializationFailed(e));
		}
		return Mono.defer(() -> this.connector.connect(transport))
			.then(forward(sessionId, transport, message))
			.flatMap(reply -> {
				if (!this.registry.register(sessionId, transport)) {
					return Mono.<RoutedReply>error(
							new IllegalStateException("Session " + sessionId + " could not be registered"));
				}
				return Mono.just(reply);
			})
			.onErrorResume(e -> {
				logger.error("Failed to initialize session {}", sessionId, e);
				return transport.closeGracefully().onErrorResume(closeError -> {
					logger.warn("Failed to close transport of uninitialized session {}", sessionId, closeError);
					return Mono.empty();
				}).then(Mono.<RoutedReply>error(initializationFailed(e)));
			});
	}

	private Mono<RoutedReply> forward(String sessionId, SessionTransport transport, InboundMessage message) {
		return Mono.defer(() -> transport.handleMessage(message))
			.map(body -> new RoutedReply(sessionId, body))
			.defaultIfEmpty(new RoutedReply(sessionId, null));
	}

	private static McpError initializationFailed(Throwable cause) {
		McpError error = McpError.builder(ErrorCodes.INTERNAL_ERROR).message(INIT_FAILED_MESSAGE).build();
		error.initCause(cause);
		return error;
	}

}
