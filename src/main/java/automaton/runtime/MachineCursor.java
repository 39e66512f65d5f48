package automaton.runtime;

import automaton.graph.Machine;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Machine snapshot together with the state the session is currently in.
 *
 * <p>Both are published together, so a reader never pairs a state id with a
 * machine it does not belong to.
 *
 * @param machine current machine
 * @param currentId current state id, or {@code null} when there is no current state
 * @param <V> payload type of the states
 */
public record MachineCursor<V>(Machine<V> machine, String currentId) {

  public MachineCursor {
    Objects.requireNonNull(machine, "machine");
    if (currentId != null && !machine.contains(currentId)) {
      throw new IllegalArgumentException("no state '" + currentId + "'");
    }
  }

  public static <V> MachineCursor<V> atInitial(Machine<V> machine) {
    return new MachineCursor<>(machine, machine.initialId());
  }

  public Optional<String> current() {
    return Optional.ofNullable(currentId);
  }

  public MachineCursor<V> moveTo(String stateId) {
    return new MachineCursor<>(machine, stateId);
  }

  /**
   * Same position, on a machine derived from this one.
   *
   * @param replacement new machine
   * @param mapping old state id to new state id
   * @return cursor on {@code replacement}
   * @throws IllegalStateException if the current state has no counterpart
   */
  public MachineCursor<V> remap(Machine<V> replacement, Map<String, String> mapping) {
    if (currentId == null) {
      return new MachineCursor<>(replacement, null);
    }
    final String mapped = mapping.get(currentId);
    if (mapped == null) {
      throw new IllegalStateException("current state '" + currentId + "' has no counterpart");
    }
    return new MachineCursor<>(replacement, mapped);
  }
}
