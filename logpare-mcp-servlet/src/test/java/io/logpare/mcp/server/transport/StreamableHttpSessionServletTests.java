/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.server.transport;

import static net.javacrumbs.jsonunit.assertj.JsonAssertions.assertThatJson;
import static net.javacrumbs.jsonunit.assertj.JsonAssertions.json;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.logpare.mcp.server.auth.AuthContext;
import io.logpare.mcp.server.auth.AuthHook;
import io.logpare.mcp.server.auth.Scope;
import io.logpare.mcp.session.InboundMessage;
import io.logpare.mcp.session.MessageKind;
import io.logpare.mcp.session.SessionRegistry;
import io.logpare.mcp.session.SessionRouter;
import io.logpare.mcp.session.SessionTransport;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import reactor.core.publisher.Mono;

/**
 * Tests for {@link StreamableHttpSessionServlet} against a real router and registry.
 */
class StreamableHttpSessionServletTests {

	private static final String INIT_BODY = """
			{"jsonrpc":"2.0","id":1,"method":"initialize","params":{}}""";

	private final ObjectMapper mapper = new ObjectMapper();

	private final List<InboundMessage> delivered = new ArrayList<>();

	private SessionRegistry registry;

	private SessionTransport transport;

	private StreamableHttpSessionServlet servlet;

	private StringWriter responseBody;

	private HttpServletResponse response;

	@BeforeEach
	void setUp() throws IOException {
		registry = new SessionRegistry();
		transport = mock(SessionTransport.class);
		when(transport.handleMessage(any())).thenAnswer(invocation -> {
			InboundMessage message = invocation.getArgument(0);
			delivered.add(message);
			return message.kind() == MessageKind.STREAM || message.kind() == MessageKind.TERMINATE ? Mono.empty()
					: Mono.just("{\"jsonrpc\":\"2.0\",\"id\":1,\"result\":{}}");
		});
		when(transport.closeGracefully()).thenReturn(Mono.empty());
		SessionRouter router = new SessionRouter(registry, sessionId -> transport, t -> Mono.empty());
		servlet = new StreamableHttpSessionServlet(router, AuthHook.NOOP, mapper);
		responseBody = new StringWriter();
		response = mock(HttpServletResponse.class);
		when(response.getWriter()).thenReturn(new PrintWriter(responseBody));
	}

	@AfterEach
	void tearDown() {
		registry.closeAll().block();
	}

	private static HttpServletRequest request(String sessionId, String body) throws IOException {
		HttpServletRequest request = mock(HttpServletRequest.class);
		when(request.getHeader("Mcp-Session-Id")).thenReturn(sessionId);
		when(request.getReader()).thenReturn(new BufferedReader(new StringReader(body != null ? body : "")));
		return request;
	}

	private static HttpServletResponse discardingResponse() throws IOException {
		HttpServletResponse response = mock(HttpServletResponse.class);
		when(response.getWriter()).thenReturn(new PrintWriter(new StringWriter()));
		return response;
	}

	private String initialize() throws IOException {
		HttpServletResponse initResponse = discardingResponse();
		servlet.doPost(request(null, INIT_BODY), initResponse);
		ArgumentCaptor<String> sessionId = ArgumentCaptor.forClass(String.class);
		verify(initResponse).setHeader(eq("Mcp-Session-Id"), sessionId.capture());
		return sessionId.getValue();
	}

	// ------------------------------------------
	// POST
	// ------------------------------------------

	@Test
	void testInitializeOpensSessionAndReturnsItsId() throws IOException {
		servlet.doPost(request(null, INIT_BODY), response);

		assertThat(registry.count()).isEqualTo(1);
		verify(response).setStatus(HttpServletResponse.SC_OK);
		verify(response).setContentType("application/json");
		verify(response).setHeader(eq("Mcp-Session-Id"), any());
		assertThatJson(responseBody.toString()).inPath("result").isObject();
		assertThat(delivered).singleElement().satisfies(message -> {
			assertThat(message.kind()).isEqualTo(MessageKind.INITIALIZE);
			assertThat(message.body()).isEqualTo(INIT_BODY);
		});
	}

	@Test
	void testBatchContainingInitializeOpensSession() throws IOException {
		servlet.doPost(request(null, "[{\"jsonrpc\":\"2.0\",\"method\":\"notifications/x\"}," + INIT_BODY + "]"),
				response);

		assertThat(registry.count()).isEqualTo(1);
	}

	@Test
	void testRequestWithoutSessionIsRejected() throws IOException {
		servlet.doPost(request(null, "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/list\"}"), response);

		verify(response).setStatus(HttpServletResponse.SC_BAD_REQUEST);
		assertThatJson(responseBody.toString()).isEqualTo(json("""
				{"jsonrpc":"2.0","error":{"code":-32000,"message":"Invalid session"},"id":null}"""));
		assertThat(registry.count()).isZero();
	}

	@Test
	void testUnknownSessionIdIsRejected() throws IOException {
		servlet.doPost(request("expired-id", INIT_BODY), response);

		verify(response).setStatus(HttpServletResponse.SC_BAD_REQUEST);
		assertThatJson(responseBody.toString()).inPath("error.code").isEqualTo(-32000);
		assertThat(registry.count()).isZero();
	}

	@Test
	void testMalformedBodyIsParseError() throws IOException {
		servlet.doPost(request(null, "{not json"), response);

		verify(response).setStatus(HttpServletResponse.SC_BAD_REQUEST);
		assertThatJson(responseBody.toString()).inPath("error.code").isEqualTo(-32700);
		assertThat(delivered).isEmpty();
	}

	@Test
	void testRequestOnEstablishedSession() throws IOException {
		String sessionId = initialize();

		servlet.doPost(request(sessionId, "{\"jsonrpc\":\"2.0\",\"id\":2,\"method\":\"tools/list\"}"), response);

		verify(response).setStatus(HttpServletResponse.SC_OK);
		verify(response).setHeader("Mcp-Session-Id", sessionId);
		assertThat(delivered).extracting(InboundMessage::kind)
			.containsExactly(MessageKind.INITIALIZE, MessageKind.REQUEST);
	}

	@Test
	void testInitializationFailureIsInternalError() throws IOException {
		SessionRouter failing = new SessionRouter(registry, sessionId -> transport,
				t -> Mono.error(new IllegalStateException("refused")));
		servlet = new StreamableHttpSessionServlet(failing, AuthHook.NOOP, mapper);

		servlet.doPost(request(null, INIT_BODY), response);

		verify(response).setStatus(HttpServletResponse.SC_INTERNAL_SERVER_ERROR);
		assertThatJson(responseBody.toString()).inPath("error.message")
			.isString()
			.isEqualTo("Internal error: failed to initialize session");
		verify(transport).closeGracefully();
	}

	// ------------------------------------------
	// GET and DELETE
	// ------------------------------------------

	@Test
	void testStreamWithoutSessionIdIsRejected() throws IOException {
		servlet.doGet(request(null, null), response);

		verify(response).setStatus(HttpServletResponse.SC_BAD_REQUEST);
		assertThatJson(responseBody.toString()).inPath("error.message").isString().isEqualTo("Missing session ID");
	}

	@Test
	void testStreamOnEstablishedSession() throws IOException {
		String sessionId = initialize();

		servlet.doGet(request(sessionId, null), response);

		verify(response).setStatus(HttpServletResponse.SC_ACCEPTED);
		assertThat(delivered).extracting(InboundMessage::kind).endsWith(MessageKind.STREAM);
	}

	@Test
	void testDeleteTerminatesSession() throws IOException {
		String sessionId = initialize();

		servlet.doDelete(request(sessionId, null), response);

		verify(response).setStatus(HttpServletResponse.SC_ACCEPTED);
		verify(transport).closeGracefully();
		assertThat(registry.count()).isZero();

		HttpServletResponse second = discardingResponse();
		servlet.doDelete(request(sessionId, null), second);
		verify(second).setStatus(HttpServletResponse.SC_BAD_REQUEST);
	}

	// ------------------------------------------
	// Authentication
	// ------------------------------------------

	@Test
	void testRejectedCredentialsAreUnauthorized() throws IOException {
		AuthHook hook = authorization -> Mono.just(AuthContext.ANONYMOUS);
		servlet = new StreamableHttpSessionServlet(new SessionRouter(registry, id -> transport, t -> Mono.empty()), hook,
				mapper);

		servlet.doPost(request(null, INIT_BODY), response);

		verify(response).setStatus(HttpServletResponse.SC_UNAUTHORIZED);
		assertThatJson(responseBody.toString()).inPath("error.code").isEqualTo(-32001);
		assertThat(registry.count()).isZero();
	}

	@Test
	void testMissingScopeIsForbidden() throws IOException {
		AuthHook hook = authorization -> Mono
			.just(new AuthContext(true, Set.of(Scope.DISCOVER), "client", null));
		servlet = new StreamableHttpSessionServlet(new SessionRouter(registry, id -> transport, t -> Mono.empty()), hook,
				mapper, Scope.COMPRESS);

		servlet.doPost(request(null, INIT_BODY), response);

		verify(response).setStatus(HttpServletResponse.SC_FORBIDDEN);
		assertThatJson(responseBody.toString()).inPath("error.message")
			.isString()
			.isEqualTo("Insufficient scope. Required: logs:compress");
		verify(transport, never()).handleMessage(any());
	}

	@Test
	void testAuthorizationHeaderIsPassedToHookAndContextIsExposed() throws IOException {
		List<String> seen = new ArrayList<>();
		AuthHook hook = authorization -> {
			seen.add(authorization);
			return Mono.just(AuthContext.FULL_ACCESS);
		};
		servlet = new StreamableHttpSessionServlet(new SessionRouter(registry, id -> transport, t -> Mono.empty()), hook,
				mapper, Scope.COMPRESS);
		HttpServletRequest request = request(null, INIT_BODY);
		when(request.getHeader("Authorization")).thenReturn("Bearer abc");

		servlet.doPost(request, response);

		assertThat(seen).containsExactly("Bearer abc");
		verify(request).setAttribute(StreamableHttpSessionServlet.AUTH_CONTEXT_ATTRIBUTE, AuthContext.FULL_ACCESS);
		verify(response).setStatus(HttpServletResponse.SC_OK);
	}

	@Test
	void testEmptyHookResultIsTreatedAsAnonymous() throws IOException {
		servlet = new StreamableHttpSessionServlet(new SessionRouter(registry, id -> transport, t -> Mono.empty()),
				authorization -> Mono.empty(), mapper);

		servlet.doGet(request("any", null), response);

		verify(response).setStatus(HttpServletResponse.SC_UNAUTHORIZED);
	}

	@Test
	void testIsInitializeRequest() throws IOException {
		assertThat(servlet.isInitializeRequest(INIT_BODY)).isTrue();
		assertThat(servlet.isInitializeRequest("{\"method\":\"ping\"}")).isFalse();
		assertThat(servlet.isInitializeRequest("[{\"method\":\"ping\"},{\"method\":\"initialize\"}]")).isTrue();
		assertThat(servlet.isInitializeRequest("\"initialize\"")).isFalse();
		assertThat(servlet.isInitializeRequest("")).isFalse();
	}

}
