/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.server;

import static io.logpare.mcp.tasks.TaskTestUtils.sampleTaskResult;
import static net.javacrumbs.jsonunit.assertj.JsonAssertions.assertThatJson;
import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.logpare.mcp.spec.ErrorCodes;
import io.logpare.mcp.spec.McpError;
import io.logpare.mcp.tasks.CreateTaskOptions;
import io.logpare.mcp.tasks.InMemoryTaskStore;
import io.logpare.mcp.tasks.Task;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import reactor.test.StepVerifier;

/**
 * Tests for {@link CompressionResultResources}.
 */
class CompressionResultResourcesTests {

	private InMemoryTaskStore taskStore;

	private CompressionResultResources resources;

	@BeforeEach
	void setUp() {
		taskStore = new InMemoryTaskStore();
		resources = new CompressionResultResources(taskStore, new ObjectMapper());
	}

	@AfterEach
	void tearDown() {
		taskStore.shutdown().block();
	}

	private Task completedTask() {
		Task task = taskStore.createTask(CreateTaskOptions.defaults()).block();
		taskStore.completeTask(task.taskId(), sampleTaskResult()).block();
		return taskStore.getTask(task.taskId()).block();
	}

	private static void assertMcpError(Throwable error, int code) {
		assertThat(error).isInstanceOf(McpError.class);
		assertThat(((McpError) error).code()).isEqualTo(code);
	}

	@Test
	void testReadResult() {
		Task task = completedTask();

		ResourceContents contents = resources.read("logpare://results/" + task.taskId()).block();

		assertThat(contents.uri()).isEqualTo("logpare://results/" + task.taskId());
		assertThat(contents.mimeType()).isEqualTo("application/json");
		assertThatJson(contents.text()).inPath("taskId").isString().isEqualTo(task.taskId());
		assertThatJson(contents.text()).inPath("status").isString().isEqualTo("completed");
		assertThatJson(contents.text()).inPath("completedAt").isString().isEqualTo(task.lastUpdatedAt());
		assertThatJson(contents.text()).inPath("uniqueTemplates").isEqualTo(4);
		assertThatJson(contents.text()).inPath("templates").isArray().hasSize(4);
		assertThatJson(contents.text()).inPath("processingTimeMs").isEqualTo(7);
		assertThat(contents.text()).contains("\n");
	}

	@Test
	void testReadTemplates() {
		Task task = completedTask();

		ResourceContents contents = resources.read("logpare://templates/" + task.taskId()).block();

		assertThatJson(contents.text()).isObject().containsOnlyKeys("taskId", "templateCount", "templates");
		assertThatJson(contents.text()).inPath("templateCount").isEqualTo(4);
		assertThatJson(contents.text()).inPath("templates[0].hydratedExample")
			.isString()
			.isEqualTo("INFO Request 1 handled in 12ms");
	}

	@Test
	void testReadStatsOmitsTemplates() {
		Task task = completedTask();

		ResourceContents contents = resources.read("logpare://stats/" + task.taskId()).block();

		assertThatJson(contents.text()).isObject()
			.containsKeys("taskId", "createdAt", "completedAt", "compressionRatio", "summary")
			.doesNotContainKey("templates");
		assertThatJson(contents.text()).inPath("summary.performanceViolations").isEqualTo(1);
	}

	@Test
	void testUnknownTaskAndUnknownUri() {
		StepVerifier.create(resources.read("logpare://results/missing"))
			.verifyErrorSatisfies(error -> assertMcpError(error, ErrorCodes.RESOURCE_NOT_FOUND));
		StepVerifier.create(resources.read("logpare://other/x"))
			.verifyErrorSatisfies(error -> assertMcpError(error, ErrorCodes.RESOURCE_NOT_FOUND));
		StepVerifier.create(resources.read(null))
			.verifyErrorSatisfies(error -> assertMcpError(error, ErrorCodes.RESOURCE_NOT_FOUND));
		StepVerifier.create(resources.read("logpare://results/"))
			.verifyErrorSatisfies(error -> assertMcpError(error, ErrorCodes.RESOURCE_NOT_FOUND));
		StepVerifier.create(resources.readStats(null))
			.verifyErrorSatisfies(error -> assertMcpError(error, ErrorCodes.RESOURCE_NOT_FOUND));
	}

	@Test
	void testWorkingTaskIsNotReadable() {
		Task task = taskStore.createTask(CreateTaskOptions.defaults()).block();

		StepVerifier.create(resources.read("logpare://stats/" + task.taskId())).verifyErrorSatisfies(error -> {
			assertMcpError(error, ErrorCodes.INVALID_PARAMS);
			assertThat(error).hasMessage("Task " + task.taskId() + " is not completed (status: working)");
		});
	}

	@Test
	void testResourceTemplates() {
		assertThat(CompressionResultResources.RESOURCE_TEMPLATES)
			.extracting(CompressionResultResources.ResourceTemplate::uriTemplate)
			.containsExactly("logpare://results/{taskId}", "logpare://templates/{taskId}", "logpare://stats/{taskId}");
		assertThat(CompressionResultResources.RESOURCE_TEMPLATES)
			.allSatisfy(template -> assertThat(template.mimeType()).isEqualTo("application/json"));
	}

}
