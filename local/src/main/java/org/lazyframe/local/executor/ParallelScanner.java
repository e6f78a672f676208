/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.lazyframe.local.executor;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.function.Consumer;
import java.util.function.Function;
import lombok.extern.log4j.Log4j2;
import org.lazyframe.exception.OperationException;
import org.lazyframe.executor.TableSource;

/**
 * Reads an input batch by batch on the calling thread and evaluates batches on a worker pool. At
 * most {@code window} batches are in flight, so memory stays bounded by the batch size. Results
 * reach the sink on the calling thread, either in batch order or as workers complete them.
 */
@Log4j2
class ParallelScanner {

  private final ExecutorService pool;
  private final int window;
  private final FailureCollector failures;

  ParallelScanner(ExecutorService pool, int window, FailureCollector failures) {
    this.pool = pool;
    this.window = Math.max(1, window);
    this.failures = failures;
  }

  /**
   * Evaluates every batch of {@code source} with {@code task} and hands the non-null results to
   * {@code sink}.
   *
   * @return number of batches read
   */
  <T> int scan(
      TableSource source,
      String stageId,
      Function<Batch, T> task,
      Consumer<T> sink,
      boolean ordered) {
    try (BatchReader reader = new BatchReader(source, stageId)) {
      if (ordered) {
        scanOrdered(reader, task, sink);
      } else {
        scanUnordered(reader, task, sink);
      }
      log.debug("Stage {} scanned {} batch(es) of {}", stageId, reader.getBatchCount(), source);
      return reader.getBatchCount();
    }
  }

  private <T> void scanOrdered(BatchReader reader, Function<Batch, T> task, Consumer<T> sink) {
    Deque<Future<T>> inFlight = new ArrayDeque<>();
    try {
      Batch batch;
      while ((batch = reader.next()) != null) {
        Batch submitted = batch;
        inFlight.add(pool.submit(() -> failures.guard(submitted, () -> task.apply(submitted))));
        while (inFlight.size() >= window) {
          deliver(await(inFlight.poll()), sink);
        }
      }
      while (!inFlight.isEmpty()) {
        deliver(await(inFlight.poll()), sink);
      }
    } finally {
      inFlight.forEach(f -> f.cancel(true));
    }
  }

  private <T> void scanUnordered(BatchReader reader, Function<Batch, T> task, Consumer<T> sink) {
    CompletionService<T> completion = new ExecutorCompletionService<>(pool);
    int pending = 0;
    Batch batch;
    while ((batch = reader.next()) != null) {
      Batch submitted = batch;
      completion.submit(() -> failures.guard(submitted, () -> task.apply(submitted)));
      pending++;
      while (pending >= window) {
        deliver(await(take(completion)), sink);
        pending--;
      }
    }
    while (pending > 0) {
      deliver(await(take(completion)), sink);
      pending--;
    }
  }

  private static <T> void deliver(T result, Consumer<T> sink) {
    if (result != null) {
      sink.accept(result);
    }
  }

  private static <T> Future<T> take(CompletionService<T> completion) {
    try {
      return completion.take();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new OperationException("Interrupted while waiting for a worker", e);
    }
  }

  /** Waits for a worker, rethrowing its failure unchanged when it is unchecked. */
  static <T> T await(Future<T> future) {
    try {
      return future.get();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new OperationException("Interrupted while waiting for a worker", e);
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      throw new OperationException("Worker failed: " + cause.getMessage(), cause);
    }
  }
}
