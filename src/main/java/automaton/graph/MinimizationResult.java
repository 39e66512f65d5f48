package automaton.graph;

import java.time.Duration;
import java.util.Map;

/**
 * Outcome of minimizing a machine.
 *
 * @param machine minimized machine
 * @param stateMapping id of every reachable original state mapped to the id of
 *   the state that replaces it
 * @param originalStates state count before minimization
 * @param minimizedStates state count after minimization
 * @param originalTransitions transition count before minimization
 * @param minimizedTransitions transition count after minimization
 * @param equivalenceClasses number of equivalence classes found
 * @param duration wall time spent minimizing
 * @param <V> payload type of the states
 */
public record MinimizationResult<V>(
  Machine<V> machine,
  Map<String, String> stateMapping,
  int originalStates,
  int minimizedStates,
  int originalTransitions,
  int minimizedTransitions,
  int equivalenceClasses,
  Duration duration
) {

  public MinimizationResult {
    stateMapping = Map.copyOf(stateMapping);
  }

  /**
   * Size of the minimized machine relative to the original.
   *
   * @return ratio in {@code (0, 1]}, where {@code 1} means nothing was removed
   */
  public double stateReductionRatio() {
    return originalStates == 0 ? 1.0 : (double) minimizedStates / originalStates;
  }

  /**
   * Share of the original states that were removed.
   *
   * @return percentage in {@code [0, 100)}
   */
  public double reductionPercentage() {
    return (1.0 - stateReductionRatio()) * 100.0;
  }

  public int statesRemoved() {
    return originalStates - minimizedStates;
  }
}
