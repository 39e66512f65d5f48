package automaton.runtime;

import automaton.graph.Machine;

/**
 * Rough memory footprint of a running machine, in bytes.
 *
 * <p>The per-item costs are fixed approximations; the estimate is only ever
 * compared against a configured budget.
 */
public final class MemoryEstimator {

  public static final long BASE_COST = 1000;
  public static final long STATE_COST = 200;
  public static final long TRANSITION_COST = 100;
  public static final long CACHE_ENTRY_COST = 150;
  public static final long COMPILED_ENTRY_COST = 300;
  public static final long SAMPLE_COST = 100;

  private MemoryEstimator() { }

  /**
   * Estimate the footprint of a machine and its runtime structures.
   *
   * @param machine current machine
   * @param cacheEntries live cache entries
   * @param compiledEntries direct-dispatch entries
   * @param samples retained performance samples
   * @return estimated bytes
   */
  public static long estimate(Machine<?> machine, int cacheEntries, int compiledEntries, int samples) {
    return BASE_COST
      + machine.size() * STATE_COST
      + machine.transitionCount() * TRANSITION_COST
      + cacheEntries * CACHE_ENTRY_COST
      + compiledEntries * COMPILED_ENTRY_COST
      + samples * SAMPLE_COST;
  }
}
