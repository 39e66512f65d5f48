package automaton.runtime;

/**
 * How much work an optimization pass does. Each level does everything the
 * previous one does.
 */
public enum OptimizationLevel {

  /** Prune unreachable states. */
  MINIMAL,

  /** Merge equivalent states. */
  STANDARD,

  /** Merge equivalent states and compile the most used transitions into direct dispatch. */
  AGGRESSIVE,

  /** Everything above, then compact the cache and drop direct dispatch if still over budget. */
  MAXIMUM;

  public boolean mergesStates() {
    return this != MINIMAL;
  }

  public boolean compilesTransitions() {
    return this == AGGRESSIVE || this == MAXIMUM;
  }

  public boolean compactsMemory() {
    return this == MAXIMUM;
  }
}
