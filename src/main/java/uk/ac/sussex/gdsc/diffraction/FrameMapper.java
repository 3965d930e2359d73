/*-
 * #%L
 * Genome Damage and Stability Centre Diffraction Analysis
 *
 * Software for electron diffraction image analysis
 * %%
 * Copyright (C) 2011 - 2022 Alex Herbert
 * %%
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/gpl-3.0.html>.
 * #L%
 */

package uk.ac.sussex.gdsc.diffraction;

import ij.Prefs;
import ij.process.FloatProcessor;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.apache.commons.lang3.concurrent.ConcurrentRuntimeException;
import uk.ac.sussex.gdsc.core.annotation.Nullable;
import uk.ac.sussex.gdsc.core.data.ComputationException;
import uk.ac.sussex.gdsc.core.logging.NullTrackProgress;
import uk.ac.sussex.gdsc.core.logging.Ticker;
import uk.ac.sussex.gdsc.core.logging.TrackProgress;
import uk.ac.sussex.gdsc.core.utils.LocalList;
import uk.ac.sussex.gdsc.core.utils.ValidationUtils;

/**
 * Apply a function independently to every frame of a stack and collect the results.
 *
 * <p>Frames are processed in parallel. The result at index {@code i} is always the result for
 * frame {@code i}.
 */
public class FrameMapper {
  /** The number of threads. */
  private int threadCount;

  /** The executor service. If null a fixed thread pool is created for each map operation. */
  @Nullable
  private ExecutorService executorService;

  /** The progress tracker. */
  private TrackProgress progress = NullTrackProgress.getInstance();

  /**
   * Define a function of a single frame.
   *
   * @param <T> the result type
   */
  @FunctionalInterface
  public interface FrameFunction<T> {
    /**
     * Apply the function to the frame.
     *
     * <p>The frame must not be modified.
     *
     * @param index the navigation index
     * @param frame the frame
     * @return the result
     */
    T apply(int index, FloatProcessor frame);
  }

  /**
   * Create a new instance using the ImageJ default thread count.
   */
  public FrameMapper() {
    this(Prefs.getThreads());
  }

  /**
   * Create a new instance.
   *
   * @param threadCount the thread count
   */
  public FrameMapper(int threadCount) {
    setThreadCount(threadCount);
  }

  /**
   * Gets the thread count.
   *
   * @return the thread count
   */
  public int getThreadCount() {
    return threadCount;
  }

  /**
   * Sets the thread count. This is ignored if an executor service has been set.
   *
   * @param threadCount the new thread count
   */
  public void setThreadCount(int threadCount) {
    this.threadCount = ValidationUtils.checkStrictlyPositive(threadCount, "threadCount");
  }

  /**
   * Sets the executor service. The service is not shut down by this class. Set to null to use a
   * new fixed thread pool for each map operation.
   *
   * @param executorService the new executor service
   */
  public void setExecutorService(@Nullable ExecutorService executorService) {
    this.executorService = executorService;
  }

  /**
   * Sets the progress tracker.
   *
   * @param progress the new progress tracker
   */
  public void setTrackProgress(@Nullable TrackProgress progress) {
    this.progress = NullTrackProgress.createIfNull(progress);
  }

  /**
   * Apply the function to every frame in the stack.
   *
   * <p>If any function fails the remaining work is cancelled. An unchecked exception thrown by
   * the function is rethrown unchanged.
   *
   * @param <T> the result type
   * @param stack the stack
   * @param function the function
   * @return the results in navigation order
   * @throws ConcurrentRuntimeException if interrupted while waiting for the results
   */
  public <T> List<T> map(FrameStack stack, FrameFunction<T> function) {
    final int size = stack.size();
    final boolean sequential = executorService == null && (threadCount == 1 || size == 1);
    final Ticker ticker = Ticker.createStarted(progress, size, !sequential);
    final LocalList<T> results = new LocalList<>(size);

    if (sequential) {
      for (int i = 0; i < size; i++) {
        results.add(function.apply(i, stack.getFrame(i)));
        ticker.tick();
      }
      ticker.stop();
      return results;
    }

    final ExecutorService executor = executorService == null
        ? Executors.newFixedThreadPool(Math.min(threadCount, size))
        : executorService;
    final LocalList<Future<T>> futures = new LocalList<>(size);
    try {
      for (int i = 0; i < size; i++) {
        final int index = i;
        futures.add(executor.submit(() -> {
          final T result = function.apply(index, stack.getFrame(index));
          ticker.tick();
          return result;
        }));
      }
      for (final Future<T> future : futures) {
        results.add(getResult(future, futures));
      }
    } finally {
      if (executorService == null) {
        executor.shutdown();
      }
    }
    ticker.stop();
    return results;
  }

  /**
   * Apply the function to every frame in the stack and collect the output frames into a new stack
   * with the same navigation shape.
   *
   * @param stack the stack
   * @param function the function
   * @return the new stack
   * @see #map(FrameStack, FrameFunction)
   */
  public FrameStack mapFrames(FrameStack stack, FrameFunction<FloatProcessor> function) {
    return stack.derive(map(stack, function).toArray(new FloatProcessor[0]));
  }

  /**
   * Wait for the result of the future. On failure all outstanding futures are cancelled.
   *
   * @param <T> the result type
   * @param future the future
   * @param futures all the futures
   * @return the result
   */
  private static <T> T getResult(Future<T> future, List<Future<T>> futures) {
    try {
      return future.get();
    } catch (final InterruptedException ex) {
      futures.forEach(f -> f.cancel(true));
      Thread.currentThread().interrupt();
      throw new ConcurrentRuntimeException("Interrupted while processing frames", ex);
    } catch (final ExecutionException ex) {
      futures.forEach(f -> f.cancel(true));
      final Throwable cause = ex.getCause();
      if (cause instanceof RuntimeException) {
        throw (RuntimeException) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw new ComputationException("Failed to process frame", cause);
    }
  }
}
