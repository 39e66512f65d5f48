package automaton.runtime;

import java.time.Duration;

/**
 * Outcome of one optimization pass.
 *
 * @param level level the pass ran at
 * @param trigger what started the pass
 * @param originalStates state count before the pass
 * @param optimizedStates state count after the pass
 * @param reductionPercentage share of the states removed, in percent
 * @param duration wall time of the pass
 * @param memoryBefore memory estimate before the pass, in bytes
 * @param memoryAfter memory estimate after the pass, in bytes
 * @param compiledTransitions direct-dispatch entries after the pass
 */
public record OptimizationResult(
  OptimizationLevel level,
  OptimizationTrigger trigger,
  int originalStates,
  int optimizedStates,
  double reductionPercentage,
  Duration duration,
  long memoryBefore,
  long memoryAfter,
  int compiledTransitions
) {

  public int statesRemoved() {
    return originalStates - optimizedStates;
  }

  /**
   * Estimated memory released by the pass (negative if it grew).
   *
   * @return bytes
   */
  public long memoryDelta() {
    return memoryBefore - memoryAfter;
  }
}
