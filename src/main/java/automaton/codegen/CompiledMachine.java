package automaton.codegen;

import automaton.graph.Machine;
import automaton.graph.State;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * Machine together with its compiled transition function.
 *
 * @param <V> payload type of the states
 */
public final class CompiledMachine<V> {

  private final Machine<V> machine;
  private final TransitionFunction function;
  private final List<String> stateIds;
  private final Map<String, Integer> stateIndices;
  private final Map<String, Integer> symbolIndices;

  CompiledMachine(
    Machine<V> machine,
    TransitionFunction function,
    List<String> stateIds,
    Map<String, Integer> stateIndices,
    Map<String, Integer> symbolIndices
  ) {
    this.machine = machine;
    this.function = function;
    this.stateIds = Collections.unmodifiableList(stateIds);
    this.stateIndices = Collections.unmodifiableMap(stateIndices);
    this.symbolIndices = Collections.unmodifiableMap(symbolIndices);
  }

  public Machine<V> machine() {
    return machine;
  }

  public TransitionFunction function() {
    return function;
  }

  /**
   * Index of a state in the compiled function.
   *
   * @param stateId state id
   * @return index, or empty for an unknown state
   */
  public OptionalInt stateIndex(String stateId) {
    final Integer index = stateIndices.get(stateId);
    return index == null ? OptionalInt.empty() : OptionalInt.of(index);
  }

  /**
   * Index of a label in the compiled function.
   *
   * @param label transition label
   * @return index, or empty for a label no transition uses
   */
  public OptionalInt symbolIndex(String label) {
    final Integer index = symbolIndices.get(label);
    return index == null ? OptionalInt.empty() : OptionalInt.of(index);
  }

  public String stateId(int index) {
    return stateIds.get(index);
  }

  /**
   * Run the compiled function from the initial state.
   *
   * @param labels input labels
   * @return final state, or empty if some transition is missing
   */
  public Optional<State<V>> run(List<String> labels) {
    int state = stateIndices.get(machine.initialId());
    for (String label : labels) {
      final Integer symbol = symbolIndices.get(label);
      if (symbol == null) {
        return Optional.empty();
      }
      state = function.next(state, symbol);
      if (state < 0) {
        return Optional.empty();
      }
    }
    return machine.state(stateIds.get(state));
  }

  public boolean accepts(List<String> labels) {
    return run(labels).map(State::accepting).orElse(false);
  }
}
