package automaton.graph;

import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalInt;
import java.util.Set;
import java.util.SortedSet;
import java.util.Stack;
import java.util.TreeSet;
import java.util.function.Consumer;
import java.util.stream.Stream;

/**
 * Deterministic finite state machine.
 *
 * <p>A machine is an immutable snapshot: every "mutation" returns a fresh
 * machine sharing the untouched {@link State} objects. Every transition target
 * is guaranteed to be a state of the machine.
 *
 * @param <V> payload type of the states
 */
public final class Machine<V> implements DotGraph<String> {

  /**
   * Full set of states, in insertion order.
   */
  private final Map<String, State<V>> states;

  /**
   * Id of the initial state inside {@code states}.
   */
  private final String initialId;

  private final int transitionCount;

  // Computed on first use
  private Map<String, Node> nodes;
  private Map<V, Integer> payloadIndices;
  private EquivalenceClasses<Node> equivalenceClasses;

  private Machine(Map<String, State<V>> states, String initialId) {
    if (!states.containsKey(initialId)) {
      throw new IllegalArgumentException("initial state '" + initialId + "' is not a state of the machine");
    }

    int transitionCount = 0;
    for (State<V> state : states.values()) {
      for (var transition : state.transitions().entrySet()) {
        if (!states.containsKey(transition.getValue())) {
          throw new IllegalArgumentException(
            "dangling transition '" + transition.getKey() + "' from '" + state.id()
              + "' to unknown state '" + transition.getValue() + "'"
          );
        }
        transitionCount++;
      }
    }

    this.states = Collections.unmodifiableMap(states);
    this.initialId = initialId;
    this.transitionCount = transitionCount;
  }

  /**
   * Build a machine out of existing states.
   *
   * @param states states of the machine (ids must be unique)
   * @param initialId id of the initial state
   * @return machine
   */
  public static <V> Machine<V> of(Collection<State<V>> states, String initialId) {
    final var byId = new LinkedHashMap<String, State<V>>();
    for (State<V> state : states) {
      if (byId.put(state.id(), state) != null) {
        throw new IllegalArgumentException("duplicate state '" + state.id() + "'");
      }
    }
    return new Machine<>(byId, initialId);
  }

  public static <V> Builder<V> builder() {
    return new Builder<>();
  }

  public String initialId() {
    return initialId;
  }

  public State<V> initial() {
    return states.get(initialId);
  }

  /**
   * Look up a state by id.
   *
   * @param id state id
   * @return state, or empty if there is no such state
   */
  public Optional<State<V>> state(String id) {
    return Optional.ofNullable(states.get(id));
  }

  public boolean contains(String id) {
    return states.containsKey(id);
  }

  /**
   * All states, in insertion order.
   *
   * @return unmodifiable view of the states
   */
  public Collection<State<V>> states() {
    return states.values();
  }

  public Set<String> stateIds() {
    return states.keySet();
  }

  public int size() {
    return states.size();
  }

  public int transitionCount() {
    return transitionCount;
  }

  /**
   * Follow one transition.
   *
   * @param stateId state from which to move
   * @param label transition label
   * @return target state, or empty if the state or the transition is missing
   */
  public Optional<State<V>> next(String stateId, String label) {
    final State<V> state = states.get(stateId);
    if (state == null) {
      return Optional.empty();
    }
    return state.target(label).map(states::get);
  }

  /**
   * Every label used on some transition.
   *
   * @return sorted alphabet
   */
  public SortedSet<String> alphabet() {
    final var alphabet = new TreeSet<String>();
    for (State<V> state : states.values()) {
      alphabet.addAll(state.transitions().keySet());
    }
    return alphabet;
  }

  /**
   * Ids of the states reachable from the initial state.
   *
   * @return reachable state ids, in discovery order
   */
  public Set<String> reachableIds() {
    final Set<String> reachable = new LinkedHashSet<>();
    final Stack<String> toVisit = new Stack<>();
    toVisit.push(initialId);
    reachable.add(initialId);

    while (!toVisit.empty()) {
      for (String target : states.get(toVisit.pop()).transitions().values()) {
        if (reachable.add(target)) {
          toVisit.push(target);
        }
      }
    }

    return reachable;
  }

  /**
   * Copy of this machine with a state added or replaced.
   *
   * @param state new state
   * @return updated machine
   */
  public Machine<V> withState(State<V> state) {
    final var updated = new LinkedHashMap<>(states);
    updated.put(state.id(), state);
    return new Machine<>(updated, initialId);
  }

  /**
   * Copy of this machine with one transition added or replaced.
   *
   * @param fromId source state
   * @param label transition label
   * @param toId target state
   * @return updated machine
   */
  public Machine<V> withTransition(String fromId, String label, String toId) {
    final State<V> from = requireState(fromId);
    requireState(toId);
    return withState(from.withTransition(label, toId));
  }

  /**
   * Copy of this machine with one transition removed.
   *
   * @param fromId source state
   * @param label transition label
   * @return updated machine
   */
  public Machine<V> withoutTransition(String fromId, String label) {
    return withState(requireState(fromId).withoutTransition(label));
  }

  /**
   * Copy of this machine restricted to some of its states.
   *
   * @param keep ids of the states to keep (must include the initial state and
   *   be closed under transitions)
   * @return restricted machine
   */
  public Machine<V> restrictedTo(Set<String> keep) {
    final var updated = new LinkedHashMap<String, State<V>>();
    for (State<V> state : states.values()) {
      if (keep.contains(state.id())) {
        updated.put(state.id(), state);
      }
    }
    return new Machine<>(updated, initialId);
  }

  /**
   * Node view of a state, for use with {@link EquivalenceClassComputer}.
   *
   * @param id state id
   * @return node whose identity is stable for the lifetime of this machine
   */
  public Node node(String id) {
    final Node node = nodes().get(id);
    if (node == null) {
      throw new IllegalArgumentException("no state '" + id + "'");
    }
    return node;
  }

  /**
   * Equivalence classes of the states reachable from the initial state.
   *
   * <p>Computed once per machine: any change to the transitions produces a
   * new machine, which recomputes its own classes.
   *
   * @return equivalence classes
   */
  public synchronized EquivalenceClasses<Node> equivalenceClasses() {
    if (equivalenceClasses == null) {
      equivalenceClasses = EquivalenceClassComputer.compute(node(initialId));
    }
    return equivalenceClasses;
  }

  /**
   * Equivalence class of a state.
   *
   * @param id state id
   * @return class id, or empty for an unknown or unreachable state
   */
  public OptionalInt classOf(String id) {
    final Node node = nodes().get(id);
    return node == null ? OptionalInt.empty() : equivalenceClasses().classOf(node);
  }

  private synchronized Map<String, Node> nodes() {
    if (nodes == null) {
      final var views = new LinkedHashMap<String, Node>();
      for (State<V> state : states.values()) {
        views.put(state.id(), new Node(state));
      }
      nodes = views;
    }
    return nodes;
  }

  /**
   * Index of a payload, shared by every payload {@code equals} to it.
   */
  private synchronized int payloadIndex(V value) {
    if (payloadIndices == null) {
      payloadIndices = new HashMap<>();
    }
    final Integer known = payloadIndices.get(value);
    if (known != null) {
      return known;
    }
    final int index = payloadIndices.size();
    payloadIndices.put(value, index);
    return index;
  }

  private State<V> requireState(String id) {
    final State<V> state = states.get(id);
    if (state == null) {
      throw new IllegalArgumentException("no state '" + id + "'");
    }
    return state;
  }

  /**
   * Run the machine from its initial state either to completion or to a stuck
   * state.
   *
   * @param machine machine to run
   * @param labels input labels
   * @param onState callback to invoke whenever entering a state
   * @param onMissingTransition callback to invoke when there is no valid transition
   * @return final state, or empty if the machine got stuck
   */
  public static <V> Optional<State<V>> run(
    Machine<V> machine,
    Iterable<String> labels,
    Consumer<State<V>> onState,
    Consumer<String> onMissingTransition
  ) {
    State<V> current = machine.initial();
    onState.accept(current);

    for (String label : labels) {
      final String target = current.transitions().get(label);

      // No transition found
      if (target == null) {
        onMissingTransition.accept(label);
        return Optional.empty();
      }

      current = machine.states.get(target);
      onState.accept(current);
    }

    return Optional.of(current);
  }

  public static <V> Optional<State<V>> run(Machine<V> machine, Iterable<String> labels) {
    return run(machine, labels, s -> { }, l -> { });
  }

  /**
   * Whether the machine ends in an accepting state on some input.
   *
   * @param labels input labels
   * @return whether the input is accepted (stuck runs are rejected)
   */
  public boolean accepts(List<String> labels) {
    return run(this, labels).map(State::accepting).orElse(false);
  }

  @Override
  public Stream<Vertex<String>> vertices() {
    return states
      .values()
      .stream()
      .map(state -> {
        final OptionalInt klass = classOf(state.id());
        return new Vertex<>(state.id(), state.accepting(), klass.isPresent() ? klass.getAsInt() : null);
      });
  }

  @Override
  public Stream<Edge<String>> edges() {
    final var initialEdge = new Edge<String>(null, initialId, "");
    final var innerEdges = states
      .values()
      .stream()
      .flatMap(state ->
        state
          .transitions()
          .entrySet()
          .stream()
          .map(transition -> new Edge<>(state.id(), transition.getValue(), transition.getKey()))
      );
    return Stream.concat(Stream.of(initialEdge), innerEdges);
  }

  @Override
  public String renderVertexLabel(Vertex<String> vertex) {
    final V value = states.get(vertex.id()).value();
    final String id = DotGraph.escapeHtml(vertex.id());
    return value == null ? id : id + "<br/><i>" + DotGraph.escapeHtml(value.toString()) + "</i>";
  }

  @Override
  public String toString() {
    return "Machine(states = " + states.size() + ", transitions = " + transitionCount + ", initial = " + initialId + ")";
  }

  /**
   * View of a state as a {@link MinimizableNode}.
   */
  public final class Node implements MinimizableNode<Node> {

    private final State<V> state;
    private int equivalenceClass = EquivalenceClassComputer.UNKNOWN_CLASS;

    private Node(State<V> state) {
      this.state = state;
    }

    public State<V> state() {
      return state;
    }

    /**
     * Acceptance plus the index of the payload, so states only share a
     * signature if their payloads are {@code equals}.
     */
    @Override
    public String signature() {
      return (state.accepting() ? "accept:" : "reject:") + payloadIndex(state.value());
    }

    @Override
    public Collection<String> transitionLabels() {
      return state.transitions().keySet();
    }

    @Override
    public Optional<Node> transitionTarget(String label) {
      return state.target(label).map(nodes()::get);
    }

    @Override
    public OptionalInt equivalenceClass() {
      return equivalenceClass == EquivalenceClassComputer.UNKNOWN_CLASS
        ? OptionalInt.empty()
        : OptionalInt.of(equivalenceClass);
    }

    @Override
    public void setEquivalenceClass(int classId) {
      this.equivalenceClass = classId;
    }

    @Override
    public String toString() {
      return state.id();
    }
  }

  /**
   * Incremental construction of a {@link Machine}.
   *
   * <p>The first state added is the initial state unless another one is picked
   * with {@link #initial(String)}.
   */
  public static final class Builder<V> {

    private final Map<String, State<V>> states = new LinkedHashMap<>();
    private String initialId;

    private Builder() { }

    public Builder<V> state(String id) {
      return state(id, null, false);
    }

    public Builder<V> state(String id, V value) {
      return state(id, value, false);
    }

    public Builder<V> state(String id, V value, boolean accepting) {
      if (states.containsKey(id)) {
        throw new IllegalArgumentException("duplicate state '" + id + "'");
      }
      states.put(id, new State<>(id, value, accepting));
      if (initialId == null) {
        initialId = id;
      }
      return this;
    }

    public Builder<V> accepting(String id) {
      return state(id, null, true);
    }

    public Builder<V> transition(String fromId, String label, String toId) {
      final State<V> from = states.get(fromId);
      if (from == null) {
        throw new IllegalArgumentException("no state '" + fromId + "'");
      }
      states.put(fromId, from.withTransition(label, toId));
      return this;
    }

    public Builder<V> initial(String id) {
      this.initialId = id;
      return this;
    }

    public Machine<V> build() {
      if (initialId == null) {
        throw new IllegalStateException("machine has no states");
      }
      return new Machine<>(new LinkedHashMap<>(states), initialId);
    }
  }
}
