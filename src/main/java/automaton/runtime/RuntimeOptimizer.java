package automaton.runtime;

import automaton.cache.CacheTier;
import automaton.cache.TransitionCache;
import automaton.graph.Machine;
import automaton.graph.MachineMinimizer;
import automaton.graph.MinimizationResult;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Decides when a running machine is re-optimized, and runs the passes.
 *
 * <p>A pass works on the machine snapshot it started from and publishes its
 * result with one compare-and-set of the {@link MachineCursor}, so callers
 * always see a complete machine. If the machine was replaced while the pass
 * ran, the pass is discarded. Only once the new machine is published are the
 * cache entries renamed, expired and idle entries purged or demoted, and direct
 * dispatch rebuilt.
 *
 * <p>At most one pass is in flight: a trigger arriving in the meantime is
 * counted and dropped.
 *
 * @param <V> payload type of the states
 */
public final class RuntimeOptimizer<V> implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(RuntimeOptimizer.class);

  private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);

  /**
   * Where the optimizer is in its cycle.
   */
  public enum Phase {
    IDLE,
    TRIGGERED,
    RUNNING
  }

  private final OptimizerConfig config;
  private final AtomicReference<MachineCursor<V>> cursor;
  private final TransitionCache cache;
  private final CompiledDispatchTable compiled;
  private final PerformanceSampler sampler;
  private final OptimizationStats stats;
  private final Clock clock;

  private final ScheduledExecutorService scheduler;
  private final Executor passExecutor;

  private final AtomicReference<Phase> phase = new AtomicReference<>(Phase.IDLE);
  private final AtomicLong transitionsSinceLastPass = new AtomicLong(0);
  private volatile Instant lastPass;
  private volatile boolean closed = false;

  /**
   * @param config optimizer configuration
   * @param cursor published machine and position, shared with the session
   * @param cache transition cache of the session
   * @param compiled direct-dispatch table of the session
   * @param sampler performance sampler of the session
   * @param stats counters of the session
   * @param clock time source for rate limiting
   * @param passExecutor where passes run ({@code null} for the optimizer's own thread)
   */
  public RuntimeOptimizer(
    OptimizerConfig config,
    AtomicReference<MachineCursor<V>> cursor,
    TransitionCache cache,
    CompiledDispatchTable compiled,
    PerformanceSampler sampler,
    OptimizationStats stats,
    Clock clock,
    Executor passExecutor
  ) {
    this.config = Objects.requireNonNull(config, "config");
    this.cursor = Objects.requireNonNull(cursor, "cursor");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.compiled = Objects.requireNonNull(compiled, "compiled dispatch");
    this.sampler = Objects.requireNonNull(sampler, "sampler");
    this.stats = Objects.requireNonNull(stats, "stats");
    this.clock = Objects.requireNonNull(clock, "clock");

    final boolean needsTimer = config.runtimeOptimization() && hasInterval();
    if (needsTimer || passExecutor == null) {
      this.scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
        final var thread = new Thread(runnable, "automaton-optimizer");
        thread.setDaemon(true);
        return thread;
      });
    } else {
      this.scheduler = null;
    }
    this.passExecutor = passExecutor != null ? passExecutor : scheduler;
  }

  /**
   * Start the periodic timer, if the configuration asks for one.
   */
  public void start() {
    if (!config.runtimeOptimization() || !hasInterval()) {
      log.info("Runtime optimizer started without timer (level {})", config.level());
      return;
    }
    final long period = config.interval().toMillis();
    scheduler.scheduleAtFixedRate(() -> trigger(OptimizationTrigger.TIMER), period, period, TimeUnit.MILLISECONDS);
    log.info("Runtime optimizer started (level {}, interval {})", config.level(), config.interval());
  }

  public Phase phase() {
    return phase.get();
  }

  public OptimizerConfig config() {
    return config;
  }

  /**
   * Account for one transition, firing the count and memory triggers.
   */
  public void onTransition() {
    final long since = transitionsSinceLastPass.incrementAndGet();
    if (!config.runtimeOptimization() || closed) {
      return;
    }
    final Machine<V> machine = cursor.get().machine();
    if (config.hasMemoryBudget() && estimateMemory(machine) > config.memoryPressureThreshold()) {
      trigger(OptimizationTrigger.MEMORY_PRESSURE);
    } else if (since > 2L * machine.size()) {
      trigger(OptimizationTrigger.TRANSITION_COUNT);
    }
  }

  /**
   * Ask for a pass.
   *
   * <p>Memory pressure always runs at {@link OptimizationLevel#MAXIMUM}; other
   * triggers use the configured level. Automatic triggers are rate limited.
   *
   * @param trigger reason for the pass
   * @return whether a pass was handed to the executor
   */
  public boolean trigger(OptimizationTrigger trigger) {
    if (closed) {
      return false;
    }
    if (trigger != OptimizationTrigger.MANUAL && isRateLimited()) {
      return false;
    }
    if (!phase.compareAndSet(Phase.IDLE, Phase.TRIGGERED)) {
      stats.recordDeferredTrigger();
      log.trace("Deferred {} trigger, a pass is already in flight", trigger);
      return false;
    }

    final OptimizationLevel level = trigger == OptimizationTrigger.MEMORY_PRESSURE
      ? OptimizationLevel.MAXIMUM
      : config.level();
    try {
      passExecutor.execute(() -> runPass(level, trigger));
      return true;
    } catch (RejectedExecutionException err) {
      phase.set(Phase.IDLE);
      log.warn("Could not schedule {} optimization pass", level, err);
      return false;
    }
  }

  /**
   * Run a pass on the calling thread.
   *
   * @param level level to run at
   * @return the pass result, or empty if another pass was in flight or this one
   *   did not publish a machine
   */
  public Optional<OptimizationResult> optimizeNow(OptimizationLevel level) {
    Objects.requireNonNull(level, "level");
    if (!phase.compareAndSet(Phase.IDLE, Phase.TRIGGERED)) {
      stats.recordDeferredTrigger();
      return Optional.empty();
    }
    return runPass(level, OptimizationTrigger.MANUAL);
  }

  /**
   * Estimated footprint of a machine with the current cache, direct dispatch
   * and samples.
   *
   * @param machine machine to estimate
   * @return bytes
   */
  public long estimateMemory(Machine<V> machine) {
    return MemoryEstimator.estimate(machine, cache.size(), compiled.size(), sampler.size());
  }

  private boolean hasInterval() {
    return !config.interval().isZero();
  }

  private boolean isRateLimited() {
    final Instant last = lastPass;
    if (last == null || !hasInterval()) {
      return false;
    }
    return Duration.between(last, clock.instant()).compareTo(config.interval().dividedBy(2)) < 0;
  }

  private Optional<OptimizationResult> runPass(OptimizationLevel level, OptimizationTrigger trigger) {
    phase.set(Phase.RUNNING);
    final long start = System.nanoTime();
    try {
      final MachineCursor<V> before = cursor.get();
      final Machine<V> original = before.machine();
      final long memoryBefore = estimateMemory(original);

      final MinimizationResult<V> result = level.mergesStates()
        ? MachineMinimizer.minimize(original)
        : MachineMinimizer.removeUnreachable(original);
      if (!MachineMinimizer.isConsistent(original, result)) {
        throw new IllegalStateException("inconsistent class map for " + original);
      }

      // Mutations publish under the cache's monitor too, so the cache and
      // direct dispatch always end up describing the published machine
      final Machine<V> optimized = result.machine();
      synchronized (cache) {
        if (!publish(original, result)) {
          stats.recordAbortedPass();
          log.debug("Discarded {} pass, the machine changed while it ran", level);
          return Optional.empty();
        }

        cache.remap(result.stateMapping());
        final int expired = cache.purgeExpired();
        final int demoted = cache.rebalance();
        log.trace("Purged {} expired and demoted {} idle cache entries", expired, demoted);
        if (level.compilesTransitions()) {
          compiled.rebuild(optimized, cache.hottest(config.compileLimit()), config.compileLimit());
        } else {
          compiled.clear();
        }
        if (level.compactsMemory()) {
          compact(optimized);
        }
      }

      final var outcome = new OptimizationResult(
        level,
        trigger,
        result.originalStates(),
        result.minimizedStates(),
        result.reductionPercentage(),
        Duration.ofNanos(System.nanoTime() - start),
        memoryBefore,
        estimateMemory(optimized),
        compiled.size()
      );
      stats.recordPass(outcome);
      transitionsSinceLastPass.set(0);
      log.debug(
        "{} pass ({}): {} -> {} states, {} compiled, {} bytes released",
        level,
        trigger,
        outcome.originalStates(),
        outcome.optimizedStates(),
        outcome.compiledTransitions(),
        outcome.memoryDelta()
      );
      return Optional.of(outcome);
    } catch (RuntimeException err) {
      stats.recordFailedPass();
      log.warn("{} optimization pass failed, keeping the current machine", level, err);
      return Optional.empty();
    } finally {
      lastPass = clock.instant();
      phase.set(Phase.IDLE);
    }
  }

  /**
   * Swap the optimized machine in, keeping the caller's position.
   *
   * @return whether the machine was published
   */
  private boolean publish(Machine<V> original, MinimizationResult<V> result) {
    while (true) {
      final MachineCursor<V> current = cursor.get();
      if (current.machine() != original) {
        return false;
      }
      final MachineCursor<V> next;
      try {
        next = current.remap(result.machine(), result.stateMapping());
      } catch (IllegalStateException err) {
        log.debug("Current state is unreachable from the initial state: {}", err.getMessage());
        return false;
      }
      if (cursor.compareAndSet(current, next)) {
        return true;
      }
    }
  }

  /**
   * Drop the cold tier, then everything cached if still above budget.
   */
  private void compact(Machine<V> machine) {
    final int dropped = cache.dropTier(CacheTier.COLD);
    if (config.hasMemoryBudget() && estimateMemory(machine) > config.memoryPressureThreshold()) {
      compiled.clear();
      cache.clear();
      log.debug("Still above budget after dropping {} cold entries, cleared cache and direct dispatch", dropped);
    }
  }

  /**
   * Stop the timer. A pass in flight either publishes a complete machine or
   * nothing.
   */
  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    if (scheduler != null) {
      scheduler.shutdown();
      try {
        if (!scheduler.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
          scheduler.shutdownNow();
        }
      } catch (InterruptedException err) {
        scheduler.shutdownNow();
        Thread.currentThread().interrupt();
      }
    }
    log.info("Runtime optimizer stopped");
  }
}
