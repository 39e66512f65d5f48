package automaton;

import automaton.cache.CacheStats;
import automaton.graph.Machine;
import automaton.graph.State;
import automaton.runtime.OptimizationLevel;
import automaton.runtime.OptimizationStats;
import automaton.runtime.PerformanceSampler;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * Serializable picture of a running machine, for persistence and debugging.
 *
 * <p>The JSON form is a plain document; {@link #formatVersion()} is bumped
 * whenever a field changes meaning.
 *
 * @param formatVersion version of this layout
 * @param initialState id of the initial state
 * @param currentState id of the current state, or {@code null}
 * @param states every state with its transitions and equivalence class
 * @param level configured optimization level
 * @param compiledTransitions direct-dispatch entries at snapshot time
 * @param optimization optimizer counters
 * @param performance performance sampling summary
 * @param cache cache statistics
 */
public record MachineSnapshot(
  int formatVersion,
  String initialState,
  String currentState,
  List<StateEntry> states,
  OptimizationLevel level,
  int compiledTransitions,
  OptimizationStats.Summary optimization,
  PerformanceSampler.Summary performance,
  CacheStats cache
) {

  public static final int FORMAT_VERSION = 1;

  private static final ObjectMapper objectMapper = new ObjectMapper()
    .registerModule(new JavaTimeModule())
    .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
    .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS)
    .enable(SerializationFeature.INDENT_OUTPUT);

  /**
   * One state of the snapshot.
   *
   * @param id state id
   * @param accepting is this an accepting state?
   * @param value state payload
   * @param transitions label to target state id
   * @param equivalenceClass class of the state, or {@code null} if unreachable
   */
  public record StateEntry(
    String id,
    boolean accepting,
    Object value,
    Map<String, String> transitions,
    Integer equivalenceClass
  ) { }

  /**
   * Describe the states of a machine.
   *
   * @param machine machine to describe
   * @return state entries, in machine order
   */
  static List<StateEntry> describe(Machine<?> machine) {
    final var entries = new ArrayList<StateEntry>(machine.size());
    for (State<?> state : machine.states()) {
      final OptionalInt klass = machine.classOf(state.id());
      entries.add(new StateEntry(
        state.id(),
        state.accepting(),
        state.value(),
        new LinkedHashMap<>(state.transitions()),
        klass.isPresent() ? klass.getAsInt() : null
      ));
    }
    return entries;
  }

  /**
   * Rebuild the machine described by this snapshot.
   *
   * @param valueType type of the state payloads
   * @return machine with the same states and transitions
   * @throws IllegalArgumentException if the snapshot was built with another format version
   */
  public <V> Machine<V> toMachine(Class<V> valueType) {
    if (formatVersion != FORMAT_VERSION) {
      throw new IllegalArgumentException("unsupported snapshot format " + formatVersion);
    }
    final var rebuilt = new ArrayList<State<V>>(states.size());
    for (StateEntry entry : states) {
      final V value = entry.value() == null ? null : objectMapper.convertValue(entry.value(), valueType);
      rebuilt.add(new State<>(entry.id(), value, entry.accepting(), entry.transitions()));
    }
    return Machine.of(rebuilt, initialState);
  }

  public String toJson() throws IOException {
    return objectMapper.writeValueAsString(this);
  }

  public void writeJson(OutputStream out) throws IOException {
    objectMapper.writeValue(out, this);
  }

  /**
   * Read a snapshot written by {@link #toJson()}.
   *
   * @throws IOException if the document is malformed or of another format version
   */
  public static MachineSnapshot fromJson(String json) throws IOException {
    return supported(objectMapper.readValue(json, MachineSnapshot.class));
  }

  public static MachineSnapshot fromJson(InputStream json) throws IOException {
    return supported(objectMapper.readValue(json, MachineSnapshot.class));
  }

  private static MachineSnapshot supported(MachineSnapshot snapshot) throws IOException {
    if (snapshot.formatVersion() != FORMAT_VERSION) {
      throw new IOException(
        "Unsupported snapshot format " + snapshot.formatVersion() + ", expected " + FORMAT_VERSION
      );
    }
    return snapshot;
  }
}
