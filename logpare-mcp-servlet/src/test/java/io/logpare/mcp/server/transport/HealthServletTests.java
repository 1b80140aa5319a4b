/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.server.transport;

import static net.javacrumbs.jsonunit.assertj.JsonAssertions.assertThatJson;
import static net.javacrumbs.jsonunit.assertj.JsonAssertions.json;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.logpare.mcp.session.SessionRegistry;
import io.logpare.mcp.session.SessionTransport;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;

class HealthServletTests {

	private SessionRegistry registry;

	@BeforeEach
	void setUp() {
		registry = new SessionRegistry();
	}

	@AfterEach
	void tearDown() {
		registry.closeAll().block();
	}

	private String get() throws IOException {
		StringWriter body = new StringWriter();
		HttpServletResponse response = mock(HttpServletResponse.class);
		when(response.getWriter()).thenReturn(new PrintWriter(body));

		new HealthServlet(registry, new ObjectMapper()).doGet(mock(HttpServletRequest.class), response);

		verify(response).setStatus(HttpServletResponse.SC_OK);
		verify(response).setContentType("application/json");
		return body.toString();
	}

	@Test
	void testReportsLiveSessionCount() throws IOException {
		assertThatJson(get()).isEqualTo(json("""
				{"status":"ok","sessions":0}"""));

		SessionTransport transport = mock(SessionTransport.class);
		when(transport.closeGracefully()).thenReturn(Mono.empty());
		registry.register("s1", transport);
		registry.register("s2", transport);

		assertThatJson(get()).inPath("sessions").isEqualTo(2);
	}

}
