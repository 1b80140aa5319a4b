/*
 * Copyright 2024-2026 the original author or authors.
 */

package io.logpare.mcp.tasks;

import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.IntConsumer;

import io.logpare.mcp.compressor.CompressionFixtures;
import io.logpare.mcp.report.CompressionReport;

/**
 * Testing utilities for tasks.
 */
public final class TaskTestUtils {

	private TaskTestUtils() {
		// Utility class - no instantiation
	}

	public static TaskResult sampleTaskResult() {
		return new TaskResult("compressed", CompressionReport.of(CompressionFixtures.sampleResult(), 50, 7L));
	}

	public static TaskProgress progress(int percent) {
		return new TaskProgress(percent, "Processing", TaskPhase.PARSING, null, null);
	}

	/**
	 * Runs concurrent operations with all threads released at the same time.
	 *
	 * <pre>{@code
	 * TaskTestUtils.runConcurrent(100, 10, i -> {
	 *     taskStore.createTask(null).block();
	 * });
	 * }</pre>
	 * @param numOperations total number of operations to execute
	 * @param numThreads number of threads in the thread pool
	 * @param operation the operation to run, receiving the operation index
	 * @throws InterruptedException if the current thread is interrupted while waiting
	 * @throws RuntimeException if operations don't complete within 10 seconds
	 */
	public static void runConcurrent(int numOperations, int numThreads, IntConsumer operation)
			throws InterruptedException {
		CountDownLatch startLatch = new CountDownLatch(1);
		CountDownLatch doneLatch = new CountDownLatch(numOperations);
		ExecutorService executor = Executors.newFixedThreadPool(numThreads);
		try {
			for (int i = 0; i < numOperations; i++) {
				final int index = i;
				executor.submit(() -> {
					try {
						startLatch.await();
						operation.accept(index);
					}
					catch (InterruptedException e) {
						Thread.currentThread().interrupt();
					}
					finally {
						doneLatch.countDown();
					}
				});
			}
			startLatch.countDown();
			boolean completed = doneLatch.await(10, TimeUnit.SECONDS);
			if (!completed) {
				throw new RuntimeException("Operations did not complete within 10 seconds");
			}
		}
		finally {
			executor.shutdownNow();
		}
	}

}
