package automaton;

import automaton.cache.CacheKey;
import automaton.cache.CacheStats;
import automaton.cache.TransitionCache;
import automaton.graph.Machine;
import automaton.graph.State;
import automaton.runtime.CompiledDispatchStaleException;
import automaton.runtime.CompiledDispatchTable;
import automaton.runtime.MachineCursor;
import automaton.runtime.OptimizationLevel;
import automaton.runtime.OptimizationResult;
import automaton.runtime.OptimizationStats;
import automaton.runtime.OptimizerConfig;
import automaton.runtime.PerformanceSampler;
import automaton.runtime.RuntimeOptimizer;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Running session of a machine.
 *
 * <p>Holds the current machine snapshot and state, and everything used to make
 * transitions fast: a direct-dispatch table for the hottest transitions, an
 * adaptive cache for the rest, and a runtime optimizer which periodically
 * re-minimizes the machine. A transition tries direct dispatch first, then the
 * cache, then the machine itself (caching the answer).
 *
 * <p>Transitions and mutations may be called from several threads. Each one
 * publishes a new {@link MachineCursor} with a compare-and-set, so no call ever
 * sees a half-updated machine. Replacing the machine and invalidating what the
 * cache knows about it happen together under the cache's monitor.
 *
 * @param <V> payload type of the states
 */
public final class OptimizedStateMachine<V> implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(OptimizedStateMachine.class);

  private final OptimizerConfig config;
  private final AtomicReference<MachineCursor<V>> cursor;
  private final TransitionCache cache;
  private final CompiledDispatchTable compiled = new CompiledDispatchTable();
  private final PerformanceSampler sampler;
  private final OptimizationStats stats = new OptimizationStats();
  private final RuntimeOptimizer<V> optimizer;

  private OptimizedStateMachine(Machine<V> machine, OptimizerConfig config, Clock clock, Executor passExecutor) {
    this.config = config;
    this.cursor = new AtomicReference<>(MachineCursor.atInitial(machine));
    this.cache = new TransitionCache(config.cache(), clock);
    this.sampler = new PerformanceSampler(clock, config.samplingInterval());
    this.optimizer = new RuntimeOptimizer<>(config, cursor, cache, compiled, sampler, stats, clock, passExecutor);
    cache.setPrefetchSource((stateId, label) -> cursor.get().machine().next(stateId, label).map(State::id));
  }

  /**
   * Session with the default configuration, already started.
   *
   * @param machine machine to run
   * @return running session
   */
  public static <V> OptimizedStateMachine<V> of(Machine<V> machine) {
    return builder(machine).build();
  }

  public static <V> Builder<V> builder(Machine<V> machine) {
    return new Builder<>(machine);
  }

  /**
   * Take one transition from the current state.
   *
   * @param label transition label
   * @return new current state
   * @throws NoCurrentStateException if there is no current state
   * @throws UndefinedTransitionException if the current state has no such transition
   */
  public State<V> transition(String label) {
    Objects.requireNonNull(label, "label");
    final long start = System.nanoTime();
    while (true) {
      final MachineCursor<V> current = cursor.get();
      final Machine<V> machine = current.machine();
      final String stateId = current.currentId();
      if (stateId == null) {
        throw new NoCurrentStateException();
      }

      String target = compiledTarget(machine, stateId, label);
      final boolean viaCompiled = target != null;
      if (target == null) {
        target = cachedTarget(machine, stateId, label);
      }
      if (target == null) {
        target = machine
          .next(stateId, label)
          .orElseThrow(() -> new UndefinedTransitionException(stateId, label))
          .id();
        cacheIfCurrent(machine, stateId, label, target);
      }

      if (cursor.compareAndSet(current, current.moveTo(target))) {
        stats.recordTransition(viaCompiled);
        sampler.recordLatency(System.nanoTime() - start);
        sample(machine);
        optimizer.onTransition();
        return machine.state(target).get();
      }
    }
  }

  /**
   * Cache a transition looked up on {@code machine}, unless that machine has
   * been replaced in the meantime.
   *
   * <p>Machines are only ever replaced under the cache's monitor, together with
   * the matching invalidation, so a target read off a replaced machine never
   * reaches the cache.
   */
  private void cacheIfCurrent(Machine<V> machine, String stateId, String label, String target) {
    synchronized (cache) {
      if (cursor.get().machine() == machine) {
        cache.set(stateId, label, target);
      }
    }
  }

  private String compiledTarget(Machine<V> machine, String stateId, String label) {
    try {
      return compiled.lookup(machine, stateId, label).orElse(null);
    } catch (CompiledDispatchStaleException err) {
      compiled.decline(err.key());
      log.debug("Falling back from stale direct dispatch: {}", err.getMessage());
      return null;
    }
  }

  private String cachedTarget(Machine<V> machine, String stateId, String label) {
    final Optional<String> cached = cache.get(stateId, label);
    if (cached.isEmpty()) {
      return null;
    }
    if (!machine.contains(cached.get())) {
      // Left over from a machine which has since been replaced
      cache.invalidate(stateId, label);
      return null;
    }
    return cached.get();
  }

  private void sample(Machine<V> machine) {
    if (!sampler.isEnabled()) {
      return;
    }
    sampler.maybeSample(() -> new PerformanceSampler.Metrics(
      cache.stats().hitRatio(),
      optimizer.estimateMemory(machine),
      machine.size(),
      machine.transitionCount()
    ));
  }

  /**
   * Take a sequence of transitions.
   *
   * @param labels transition labels
   * @return final current state
   * @throws NoCurrentStateException if there is no current state
   * @throws UndefinedTransitionException at the first missing transition (the
   *   transitions before it stay taken)
   */
  public State<V> processSequence(List<String> labels) {
    State<V> state = currentState().orElseThrow(NoCurrentStateException::new);
    for (String label : labels) {
      state = transition(label);
    }
    return state;
  }

  /**
   * Check whether the current machine accepts an input, without moving the
   * current state.
   *
   * @param labels input, starting from the initial state
   * @return whether the run ends in an accepting state
   */
  public boolean accepts(List<String> labels) {
    return cursor.get().machine().accepts(labels);
  }

  public Optional<State<V>> currentState() {
    final MachineCursor<V> current = cursor.get();
    return current.current().flatMap(current.machine()::state);
  }

  /**
   * Current machine snapshot.
   *
   * @return machine (immutable)
   */
  public Machine<V> machine() {
    return cursor.get().machine();
  }

  /**
   * Go back to the initial state.
   */
  public void reset() {
    cursor.updateAndGet(current -> MachineCursor.atInitial(current.machine()));
  }

  /**
   * Jump to a state.
   *
   * @param stateId state to make current
   */
  public void resetTo(String stateId) {
    cursor.updateAndGet(current -> current.moveTo(stateId));
  }

  /**
   * Leave the machine without a current state until the next reset.
   */
  public void detach() {
    cursor.updateAndGet(current -> current.moveTo(null));
  }

  /**
   * Add or replace a state.
   *
   * <p>Replacing a state drops every cached transition, since any of them may
   * have gone through the old state.
   *
   * @param state state to add
   */
  public void addState(State<V> state) {
    synchronized (cache) {
      final boolean replaced = mutate(machine -> machine.withState(state)).contains(state.id());
      if (replaced) {
        cache.clear();
      }
    }
  }

  /**
   * Add or replace a transition.
   *
   * @param fromId source state
   * @param label transition label
   * @param toId target state
   */
  public void addTransition(String fromId, String label, String toId) {
    synchronized (cache) {
      mutate(machine -> machine.withTransition(fromId, label, toId));
      cache.invalidate(fromId, label);
    }
  }

  /**
   * Remove a transition.
   *
   * @param fromId source state
   * @param label transition label
   */
  public void removeTransition(String fromId, String label) {
    synchronized (cache) {
      mutate(machine -> machine.withoutTransition(fromId, label));
      cache.invalidate(fromId, label);
    }
  }

  /**
   * Publish a changed machine, keeping the current state, and drop direct
   * dispatch compiled for the old one. Callers hold the cache's monitor.
   *
   * @param change derives the new machine from the current one
   * @return machine before the change
   */
  private Machine<V> mutate(UnaryOperator<Machine<V>> change) {
    while (true) {
      final MachineCursor<V> current = cursor.get();
      final Machine<V> changed = change.apply(current.machine());
      if (cursor.compareAndSet(current, new MachineCursor<>(changed, current.currentId()))) {
        compiled.clear();
        return current.machine();
      }
    }
  }

  /**
   * Merge equivalent states now, on the calling thread.
   *
   * @return pass result, or empty if no machine was published
   */
  public Optional<OptimizationResult> minimize() {
    return optimizer.optimizeNow(OptimizationLevel.STANDARD);
  }

  /**
   * Run a pass now, on the calling thread.
   *
   * @param level level to run at
   * @return pass result, or empty if no machine was published
   */
  public Optional<OptimizationResult> optimizeNow(OptimizationLevel level) {
    return optimizer.optimizeNow(level);
  }

  /**
   * Fill the cache with the transitions of the current machine.
   *
   * @return number of entries added
   */
  public int precompute() {
    return cache.precompute(cursor.get().machine());
  }

  public CacheStats cacheStats() {
    return cache.stats();
  }

  public OptimizationStats.Summary optimizationStats() {
    return stats.summary();
  }

  public List<PerformanceSampler.Sample> performanceSamples() {
    return sampler.samples();
  }

  /**
   * Zero the optimizer and cache counters.
   */
  public void resetStatistics() {
    stats.reset();
    cache.resetStatistics();
  }

  public RuntimeOptimizer.Phase optimizerPhase() {
    return optimizer.phase();
  }

  public OptimizerConfig config() {
    return config;
  }

  /**
   * Direct-dispatch entries currently in use.
   *
   * @return unmodifiable pair to target map
   */
  public Map<CacheKey, String> compiledTransitions() {
    return compiled.entries();
  }

  CompiledDispatchTable compiledDispatch() {
    return compiled;
  }

  TransitionCache transitionCache() {
    return cache;
  }

  /**
   * Picture of the session for persistence or debugging.
   *
   * @return snapshot
   */
  public MachineSnapshot snapshot() {
    final MachineCursor<V> current = cursor.get();
    return new MachineSnapshot(
      MachineSnapshot.FORMAT_VERSION,
      current.machine().initialId(),
      current.currentId(),
      MachineSnapshot.describe(current.machine()),
      config.level(),
      compiled.size(),
      stats.summary(),
      sampler.summary(),
      cache.stats()
    );
  }

  @Override
  public void close() {
    optimizer.close();
  }

  @Override
  public String toString() {
    final MachineCursor<V> current = cursor.get();
    return "OptimizedStateMachine(" + current.machine() + ", current = " + current.currentId() + ")";
  }

  public static final class Builder<V> {

    private final Machine<V> machine;
    private OptimizerConfig config = OptimizerConfig.defaults();
    private Clock clock = Clock.systemUTC();
    private Executor passExecutor;

    private Builder(Machine<V> machine) {
      this.machine = Objects.requireNonNull(machine, "machine");
    }

    public Builder<V> config(OptimizerConfig config) {
      this.config = Objects.requireNonNull(config, "config");
      return this;
    }

    public Builder<V> clock(Clock clock) {
      this.clock = Objects.requireNonNull(clock, "clock");
      return this;
    }

    /**
     * Run optimization passes on a given executor instead of the optimizer's
     * own thread.
     *
     * @param passExecutor executor for passes
     * @return this builder
     */
    public Builder<V> passExecutor(Executor passExecutor) {
      this.passExecutor = passExecutor;
      return this;
    }

    /**
     * Create and start the session.
     *
     * @return running session
     */
    public OptimizedStateMachine<V> build() {
      final var session = new OptimizedStateMachine<>(machine, config, clock, passExecutor);
      session.optimizer.start();
      return session;
    }
  }
}
