/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.server;

import java.time.Duration;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.logpare.mcp.compressor.LogCompressor;
import io.logpare.mcp.compressor.ResultFormatter;
import io.logpare.mcp.report.SmartResultFormatter;
import io.logpare.mcp.server.auth.AuthHook;
import io.logpare.mcp.session.SessionConnector;
import io.logpare.mcp.session.SessionRegistry;
import io.logpare.mcp.session.SessionRouter;
import io.logpare.mcp.session.SessionTransportFactory;
import io.logpare.mcp.tasks.CompressionTaskRunner;
import io.logpare.mcp.tasks.InMemoryTaskStore;
import io.logpare.mcp.tasks.TaskDefaults;
import io.logpare.mcp.tasks.TaskStore;
import io.logpare.mcp.util.Assert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

/**
 * The log compression server: one task store, one job runner, one session registry and
 * the tool and resource handlers built on them.
 *
 * <pre>{@code
 * LogpareServer server = LogpareServer.builder()
 *     .compressor(compressor)
 *     .sessionTransportFactory(sessionId -> newTransport(sessionId))
 *     .sessionConnector(protocolServer::connect)
 *     .build();
 * }</pre>
 *
 * <p>
 * The server owns the store and the registry it was built with, whether they were
 * supplied or created by the builder, and releases both in
 * {@link #closeGracefully()}.
 */
public class LogpareServer {

	private static final Logger logger = LoggerFactory.getLogger(LogpareServer.class);

	public static final String NAME = "logpare";

	public static final String VERSION = "0.1.0";

	private static final Duration SHUTDOWN_TIMEOUT = Duration.ofSeconds(5);

	private final TaskStore taskStore;

	private final SessionRegistry sessionRegistry;

	private final SessionRouter sessionRouter;

	private final AuthHook authHook;

	private final ObjectMapper objectMapper;

	private final CompressLogsToolHandler compressLogs;

	private final AnalyzeLogPatternsToolHandler analyzeLogPatterns;

	private final EstimateCompressionToolHandler estimateCompression;

	private final TaskQueryHandler taskQueries;

	private final CompressionResultResources resources;

	private final DiagnosticPrompts prompts;

	private LogpareServer(Builder builder) {
		this.taskStore = builder.taskStore != null ? builder.taskStore : new InMemoryTaskStore();
		this.sessionRegistry = builder.sessionRegistry != null ? builder.sessionRegistry : new SessionRegistry();
		this.sessionRouter = new SessionRouter(this.sessionRegistry, builder.sessionTransportFactory,
				builder.sessionConnector);
		this.authHook = builder.authHook;
		this.objectMapper = builder.objectMapper;
		CompressionTaskRunner runner = new CompressionTaskRunner(this.taskStore, builder.compressor,
				builder.resultFormatter, builder.scheduler);
		this.compressLogs = new CompressLogsToolHandler(builder.compressor, builder.resultFormatter, this.taskStore,
				runner, builder.asyncThresholdBytes);
		this.analyzeLogPatterns = new AnalyzeLogPatternsToolHandler(builder.compressor);
		this.estimateCompression = new EstimateCompressionToolHandler(builder.compressor);
		this.taskQueries = new TaskQueryHandler(this.taskStore);
		this.resources = new CompressionResultResources(this.taskStore, this.objectMapper);
		this.prompts = new DiagnosticPrompts();
		logger.info("{} {} started", NAME, VERSION);
	}

	public static Builder builder() {
		return new Builder();
	}

	public CompressLogsToolHandler compressLogs() {
		return this.compressLogs;
	}

	public AnalyzeLogPatternsToolHandler analyzeLogPatterns() {
		return this.analyzeLogPatterns;
	}

	public EstimateCompressionToolHandler estimateCompression() {
		return this.estimateCompression;
	}

	public TaskQueryHandler taskQueries() {
		return this.taskQueries;
	}

	public CompressionResultResources resources() {
		return this.resources;
	}

	public DiagnosticPrompts prompts() {
		return this.prompts;
	}

	public SessionRouter sessionRouter() {
		return this.sessionRouter;
	}

	public SessionRegistry sessionRegistry() {
		return this.sessionRegistry;
	}

	public TaskStore taskStore() {
		return this.taskStore;
	}

	public AuthHook authHook() {
		return this.authHook;
	}

	public ObjectMapper objectMapper() {
		return this.objectMapper;
	}

	/**
	 * Closes every session, then stops the task store. Gives up after five seconds.
	 * @return a Mono completing once shutdown has finished or timed out
	 */
	public Mono<Void> closeGracefully() {
		return Mono.defer(() -> {
			logger.info("Shutting down with {} sessions and {} tasks", this.sessionRegistry.count(),
					this.taskStore.size());
			return this.sessionRegistry.closeAll()
				.onErrorResume(e -> {
					logger.error("Failed to close sessions", e);
					return Mono.empty();
				})
				.then(this.taskStore.shutdown());
		}).timeout(SHUTDOWN_TIMEOUT).onErrorResume(e -> {
			logger.error("Shutdown did not complete cleanly", e);
			return Mono.empty();
		}).doOnSuccess(v -> logger.info("{} stopped", NAME));
	}

	public void close() {
		closeGracefully().block();
	}

	/**
	 * Builder for {@link LogpareServer}. A compressor and a session transport factory
	 * are required; everything else has a default.
	 */
	public static class Builder {

		private LogCompressor compressor;

		private ResultFormatter resultFormatter = new SmartResultFormatter();

		private TaskStore taskStore;

		private SessionRegistry sessionRegistry;

		private SessionTransportFactory sessionTransportFactory;

		private SessionConnector sessionConnector = transport -> Mono.empty();

		private AuthHook authHook = AuthHook.NOOP;

		private Scheduler scheduler = Schedulers.boundedElastic();

		private ObjectMapper objectMapper = new ObjectMapper();

		private int asyncThresholdBytes = TaskDefaults.ASYNC_THRESHOLD_BYTES;

		public Builder compressor(LogCompressor compressor) {
			Assert.notNull(compressor, "compressor must not be null");
			this.compressor = compressor;
			return this;
		}

		public Builder resultFormatter(ResultFormatter resultFormatter) {
			Assert.notNull(resultFormatter, "resultFormatter must not be null");
			this.resultFormatter = resultFormatter;
			return this;
		}

		public Builder taskStore(TaskStore taskStore) {
			Assert.notNull(taskStore, "taskStore must not be null");
			this.taskStore = taskStore;
			return this;
		}

		public Builder sessionRegistry(SessionRegistry sessionRegistry) {
			Assert.notNull(sessionRegistry, "sessionRegistry must not be null");
			this.sessionRegistry = sessionRegistry;
			return this;
		}

		public Builder sessionTransportFactory(SessionTransportFactory sessionTransportFactory) {
			Assert.notNull(sessionTransportFactory, "sessionTransportFactory must not be null");
			this.sessionTransportFactory = sessionTransportFactory;
			return this;
		}

		public Builder sessionConnector(SessionConnector sessionConnector) {
			Assert.notNull(sessionConnector, "sessionConnector must not be null");
			this.sessionConnector = sessionConnector;
			return this;
		}

		public Builder authHook(AuthHook authHook) {
			Assert.notNull(authHook, "authHook must not be null");
			this.authHook = authHook;
			return this;
		}

		/**
		 * Sets the scheduler background compression jobs run on. Defaults to
		 * {@link Schedulers#boundedElastic()}.
		 * @param scheduler the scheduler
		 * @return this builder
		 */
		public Builder scheduler(Scheduler scheduler) {
			Assert.notNull(scheduler, "scheduler must not be null");
			this.scheduler = scheduler;
			return this;
		}

		public Builder objectMapper(ObjectMapper objectMapper) {
			Assert.notNull(objectMapper, "objectMapper must not be null");
			this.objectMapper = objectMapper;
			return this;
		}

		/**
		 * Sets the input size, in UTF-8 bytes, from which {@code compress_logs} runs as a
		 * background task. Defaults to {@link TaskDefaults#ASYNC_THRESHOLD_BYTES}.
		 * @param asyncThresholdBytes the threshold
		 * @return this builder
		 */
		public Builder asyncThresholdBytes(int asyncThresholdBytes) {
			Assert.isTrue(asyncThresholdBytes > 0, "asyncThresholdBytes must be positive");
			this.asyncThresholdBytes = asyncThresholdBytes;
			return this;
		}

		public LogpareServer build() {
			Assert.notNull(this.compressor, "compressor must be set");
			Assert.notNull(this.sessionTransportFactory, "sessionTransportFactory must be set");
			return new LogpareServer(this);
		}

	}

}
