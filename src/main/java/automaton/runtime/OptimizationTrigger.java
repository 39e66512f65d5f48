package automaton.runtime;

/**
 * What asked for an optimization pass.
 */
public enum OptimizationTrigger {
  TIMER,
  TRANSITION_COUNT,
  MEMORY_PRESSURE,
  MANUAL
}
