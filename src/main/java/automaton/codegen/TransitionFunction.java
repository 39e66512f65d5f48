package automaton.codegen;

/**
 * Transition function of a machine whose states and labels are numbered.
 */
public interface TransitionFunction {

  /**
   * Follow one transition.
   *
   * @param state index of the source state
   * @param symbol index of the label
   * @return index of the target state, or {@code -1} if there is no transition
   */
  int next(int state, int symbol);
}
