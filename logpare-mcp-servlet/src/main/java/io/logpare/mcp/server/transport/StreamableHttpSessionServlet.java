/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.server.transport;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.stream.Collectors;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.logpare.mcp.server.LogpareServer;
import io.logpare.mcp.server.auth.AuthContext;
import io.logpare.mcp.server.auth.AuthHook;
import io.logpare.mcp.server.auth.Scope;
import io.logpare.mcp.session.InboundMessage;
import io.logpare.mcp.session.MessageKind;
import io.logpare.mcp.session.RoutedReply;
import io.logpare.mcp.session.SessionDefaults;
import io.logpare.mcp.session.SessionRouter;
import io.logpare.mcp.spec.ErrorCodes;
import io.logpare.mcp.spec.McpError;
import io.logpare.mcp.util.Assert;
import jakarta.servlet.http.HttpServlet;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Serves the MCP endpoint over streamable HTTP.
 *
 * <ul>
 * <li>{@code POST} delivers a JSON-RPC message. A message without a session id whose
 * method is {@code initialize} opens a session; the new id is returned in the
 * {@value SessionDefaults#SESSION_ID_HEADER} header.</li>
 * <li>{@code GET} opens the server-to-client event stream of a session.</li>
 * <li>{@code DELETE} ends a session.</li>
 * </ul>
 *
 * <p>
 * Failures are answered with a JSON-RPC error object and {@code "id": null}: HTTP 400
 * for session errors, 401 or 403 when the {@link AuthHook} rejects the caller, and 500
 * when a session cannot be initialized.
 */
public class StreamableHttpSessionServlet extends HttpServlet {

	private static final Logger logger = LoggerFactory.getLogger(StreamableHttpSessionServlet.class);

	public static final String AUTH_CONTEXT_ATTRIBUTE = "io.logpare.mcp.authContext";

	private static final String APPLICATION_JSON = "application/json";

	private static final String TEXT_EVENT_STREAM = "text/event-stream";

	private static final String AUTHORIZATION = "Authorization";

	private final transient SessionRouter router;

	private final transient AuthHook authHook;

	private final transient ObjectMapper objectMapper;

	private final Scope[] requiredScopes;

	public StreamableHttpSessionServlet(LogpareServer server, Scope... requiredScopes) {
		this(server.sessionRouter(), server.authHook(), server.objectMapper(), requiredScopes);
	}

	public StreamableHttpSessionServlet(SessionRouter router, AuthHook authHook, ObjectMapper objectMapper,
			Scope... requiredScopes) {
		Assert.notNull(router, "router must not be null");
		Assert.notNull(authHook, "authHook must not be null");
		Assert.notNull(objectMapper, "objectMapper must not be null");
		this.router = router;
		this.authHook = authHook;
		this.objectMapper = objectMapper;
		this.requiredScopes = requiredScopes.clone();
	}

	@Override
	protected void doPost(HttpServletRequest req, HttpServletResponse resp) throws IOException {
		if (!authenticate(req, resp)) {
			return;
		}
		String body;
		try (BufferedReader reader = req.getReader()) {
			body = reader.lines().collect(Collectors.joining("\n"));
		}
		MessageKind kind;
		try {
			kind = isInitializeRequest(body) ? MessageKind.INITIALIZE : MessageKind.REQUEST;
		}
		catch (JsonProcessingException e) {
			logger.debug("Rejecting malformed request body", e);
			writeError(resp, HttpServletResponse.SC_BAD_REQUEST,
					McpError.builder(ErrorCodes.PARSE_ERROR).message("Parse error").build());
			return;
		}
		route(new InboundMessage(req.getHeader(SessionDefaults.SESSION_ID_HEADER), kind, body), resp,
				APPLICATION_JSON);
	}

	@Override
	protected void doGet(HttpServletRequest req, HttpServletResponse resp) throws IOException {
		if (!authenticate(req, resp)) {
			return;
		}
		route(InboundMessage.stream(req.getHeader(SessionDefaults.SESSION_ID_HEADER)), resp, TEXT_EVENT_STREAM);
	}

	@Override
	protected void doDelete(HttpServletRequest req, HttpServletResponse resp) throws IOException {
		if (!authenticate(req, resp)) {
			return;
		}
		route(InboundMessage.terminate(req.getHeader(SessionDefaults.SESSION_ID_HEADER)), resp, APPLICATION_JSON);
	}

	private boolean authenticate(HttpServletRequest req, HttpServletResponse resp) throws IOException {
		try {
			AuthContext context = this.authHook.authenticate(req.getHeader(AUTHORIZATION))
				.defaultIfEmpty(AuthContext.ANONYMOUS)
				.block();
			context.requireScopes(this.requiredScopes);
			req.setAttribute(AUTH_CONTEXT_ATTRIBUTE, context);
			return true;
		}
		catch (McpError e) {
			int status = e.code() == ErrorCodes.UNAUTHORIZED ? HttpServletResponse.SC_UNAUTHORIZED
					: HttpServletResponse.SC_FORBIDDEN;
			writeError(resp, status, e);
			return false;
		}
	}

	private void route(InboundMessage message, HttpServletResponse resp, String contentType) throws IOException {
		RoutedReply reply;
		try {
			reply = this.router.route(message).block();
		}
		catch (McpError e) {
			int status = e.code() == ErrorCodes.INTERNAL_ERROR ? HttpServletResponse.SC_INTERNAL_SERVER_ERROR
					: HttpServletResponse.SC_BAD_REQUEST;
			writeError(resp, status, e);
			return;
		}
		catch (RuntimeException e) {
			logger.error("Failed to handle {} message for session {}", message.kind(), message.sessionId(), e);
			writeError(resp, HttpServletResponse.SC_INTERNAL_SERVER_ERROR,
					McpError.builder(ErrorCodes.INTERNAL_ERROR).message("Internal error").build());
			return;
		}
		resp.setHeader(SessionDefaults.SESSION_ID_HEADER, reply.sessionId());
		if (reply.body() == null) {
			resp.setStatus(HttpServletResponse.SC_ACCEPTED);
			return;
		}
		resp.setStatus(HttpServletResponse.SC_OK);
		resp.setContentType(contentType);
		resp.setCharacterEncoding(StandardCharsets.UTF_8.name());
		PrintWriter writer = resp.getWriter();
		writer.write(reply.body());
		writer.flush();
	}

	/**
	 * Checks whether a request body is an {@code initialize} request, alone or inside a
	 * batch.
	 * @param body the raw JSON body
	 * @return true if the body carries an initialize request
	 * @throws JsonProcessingException if the body is not valid JSON
	 */
	boolean isInitializeRequest(String body) throws JsonProcessingException {
		JsonNode node = this.objectMapper.readTree(body);
		if (node == null) {
			return false;
		}
		if (node.isArray()) {
			for (JsonNode element : node) {
				if (isInitialize(element)) {
					return true;
				}
			}
			return false;
		}
		return isInitialize(node);
	}

	private static boolean isInitialize(JsonNode node) {
		return node.isObject() && "initialize".equals(node.path("method").asText(null));
	}

	private void writeError(HttpServletResponse resp, int status, McpError error) throws IOException {
		Map<String, Object> envelope = new LinkedHashMap<>();
		envelope.put("jsonrpc", "2.0");
		envelope.put("error", error.getJsonRpcError());
		envelope.put("id", null);
		resp.setStatus(status);
		resp.setContentType(APPLICATION_JSON);
		resp.setCharacterEncoding(StandardCharsets.UTF_8.name());
		PrintWriter writer = resp.getWriter();
		writer.write(this.objectMapper.writeValueAsString(envelope));
		writer.flush();
	}

}
