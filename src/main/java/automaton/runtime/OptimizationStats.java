package automaton.runtime;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Counters accumulated over the life of a running machine.
 *
 * <p>Counters only grow; {@link #reset()} is the one explicit way to zero them.
 */
public final class OptimizationStats {

  /**
   * Immutable copy of the counters.
   *
   * @param transitionsProcessed transitions taken
   * @param compiledHits transitions served by direct dispatch
   * @param minimizationsPerformed passes which published a new machine
   * @param statesRemoved states removed over all passes
   * @param failedPasses passes which threw
   * @param abortedPasses passes discarded because the machine changed underneath them
   * @param deferredTriggers triggers dropped because a pass was in flight
   * @param totalOptimizationTime wall time spent in published passes
   * @param lastResult most recent published pass, or {@code null}
   */
  public record Summary(
    long transitionsProcessed,
    long compiledHits,
    long minimizationsPerformed,
    long statesRemoved,
    long failedPasses,
    long abortedPasses,
    long deferredTriggers,
    Duration totalOptimizationTime,
    OptimizationResult lastResult
  ) {

    public Optional<OptimizationResult> last() {
      return Optional.ofNullable(lastResult);
    }
  }

  private final AtomicLong transitionsProcessed = new AtomicLong(0);
  private final AtomicLong compiledHits = new AtomicLong(0);
  private final AtomicLong minimizationsPerformed = new AtomicLong(0);
  private final AtomicLong statesRemoved = new AtomicLong(0);
  private final AtomicLong failedPasses = new AtomicLong(0);
  private final AtomicLong abortedPasses = new AtomicLong(0);
  private final AtomicLong deferredTriggers = new AtomicLong(0);
  private final AtomicLong optimizationNanos = new AtomicLong(0);
  private final AtomicReference<OptimizationResult> lastResult = new AtomicReference<>();

  public void recordTransition(boolean compiled) {
    transitionsProcessed.incrementAndGet();
    if (compiled) {
      compiledHits.incrementAndGet();
    }
  }

  void recordPass(OptimizationResult result) {
    minimizationsPerformed.incrementAndGet();
    statesRemoved.addAndGet(result.statesRemoved());
    optimizationNanos.addAndGet(result.duration().toNanos());
    lastResult.set(result);
  }

  void recordFailedPass() {
    failedPasses.incrementAndGet();
  }

  void recordAbortedPass() {
    abortedPasses.incrementAndGet();
  }

  void recordDeferredTrigger() {
    deferredTriggers.incrementAndGet();
  }

  public long transitionsProcessed() {
    return transitionsProcessed.get();
  }

  public Optional<OptimizationResult> lastResult() {
    return Optional.ofNullable(lastResult.get());
  }

  public Summary summary() {
    return new Summary(
      transitionsProcessed.get(),
      compiledHits.get(),
      minimizationsPerformed.get(),
      statesRemoved.get(),
      failedPasses.get(),
      abortedPasses.get(),
      deferredTriggers.get(),
      Duration.ofNanos(optimizationNanos.get()),
      lastResult.get()
    );
  }

  public void reset() {
    transitionsProcessed.set(0);
    compiledHits.set(0);
    minimizationsPerformed.set(0);
    statesRemoved.set(0);
    failedPasses.set(0);
    abortedPasses.set(0);
    deferredTriggers.set(0);
    optimizationNanos.set(0);
    lastResult.set(null);
  }
}
