package automaton.graph;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * State inside a {@link Machine}.
 *
 * <p>States are immutable and refer to their targets by id, so the same state
 * object can be shared between successive snapshots of a machine.
 *
 * @param id unique identifier of the state inside its machine
 * @param value payload attached to the state (may be {@code null})
 * @param accepting is this an accepting state?
 * @param transitions mapping from labels to target state ids
 * @param <V> payload type
 */
public record State<V>(
  String id,
  V value,
  boolean accepting,
  Map<String, String> transitions
) {

  public State {
    Objects.requireNonNull(id, "state id");
    transitions = Collections.unmodifiableMap(new LinkedHashMap<>(transitions));
  }

  public State(String id, V value, boolean accepting) {
    this(id, value, accepting, Collections.emptyMap());
  }

  /**
   * Look up the target of a transition.
   *
   * @param label transition label
   * @return id of the target state
   */
  public Optional<String> target(String label) {
    return Optional.ofNullable(transitions.get(label));
  }

  /**
   * Whether another state has the same acceptance and an equal payload,
   * ignoring ids and transitions.
   *
   * @param other state to compare against
   * @return whether the two states are interchangeable apart from transitions
   */
  public boolean sameOutput(State<?> other) {
    return accepting == other.accepting && Objects.equals(value, other.value);
  }

  /**
   * Copy of this state with one transition added or replaced.
   *
   * @param label transition label
   * @param targetId id of the target state
   * @return updated state
   */
  public State<V> withTransition(String label, String targetId) {
    final var updated = new LinkedHashMap<>(transitions);
    updated.put(label, targetId);
    return new State<>(id, value, accepting, updated);
  }

  /**
   * Copy of this state with one transition removed.
   *
   * @param label transition label
   * @return updated state (or this state if there was no such transition)
   */
  public State<V> withoutTransition(String label) {
    if (!transitions.containsKey(label)) {
      return this;
    }
    final var updated = new LinkedHashMap<>(transitions);
    updated.remove(label);
    return new State<>(id, value, accepting, updated);
  }

  /**
   * Copy of this state with all targets renamed.
   *
   * @param id new id for this state
   * @param renamed mapping from old state ids to new state ids
   * @return renamed state
   */
  State<V> renamed(String id, Map<String, String> renamed) {
    final var updated = new LinkedHashMap<String, String>();
    for (final var entry : transitions.entrySet()) {
      updated.put(entry.getKey(), renamed.get(entry.getValue()));
    }
    return new State<>(id, value, accepting, updated);
  }
}
