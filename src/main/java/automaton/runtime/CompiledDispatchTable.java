package automaton.runtime;

import automaton.cache.CacheKey;
import automaton.graph.Machine;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Direct {@code (state, label) -> target} dispatch for the hottest transitions.
 *
 * <p>The table belongs to one machine snapshot at a time. It is rebuilt as a
 * whole and published with a single write, so a reader sees either the old
 * generation or the new one. Entries of a generation built for another
 * snapshot are ignored rather than used.
 */
public final class CompiledDispatchTable {

  private static final Logger log = LoggerFactory.getLogger(CompiledDispatchTable.class);

  /**
   * Entries compiled against one machine.
   *
   * @param machine snapshot the entries were compiled for ({@code null} for none)
   * @param targets target state id of every compiled pair
   */
  private record Generation(Machine<?> machine, Map<CacheKey, String> targets) { }

  private static final Generation EMPTY = new Generation(null, Collections.emptyMap());

  private final AtomicReference<Generation> generation = new AtomicReference<>(EMPTY);

  /**
   * Pairs which failed once and are never compiled again.
   */
  private final Set<CacheKey> declined = ConcurrentHashMap.newKeySet();

  /**
   * Look up a compiled transition.
   *
   * @param machine snapshot the caller is running against
   * @param stateId current state
   * @param label transition label
   * @return target state id, or empty if the pair is not compiled for this snapshot
   * @throws CompiledDispatchStaleException if the compiled target is not a state of {@code machine}
   */
  public Optional<String> lookup(Machine<?> machine, String stateId, String label) {
    final Generation current = generation.get();
    if (current.machine() != machine || current.targets().isEmpty()) {
      return Optional.empty();
    }
    final var key = new CacheKey(stateId, label);
    final String target = current.targets().get(key);
    if (target == null) {
      return Optional.empty();
    }
    if (!machine.contains(target)) {
      throw new CompiledDispatchStaleException(key, target);
    }
    return Optional.of(target);
  }

  /**
   * Compile the given pairs against a machine, replacing every existing entry.
   *
   * <p>Pairs which are declined or have no transition in {@code machine} are
   * skipped.
   *
   * @param machine snapshot to compile against
   * @param keys candidate pairs, most important first
   * @param limit maximum number of entries
   * @return number of entries compiled
   */
  public int rebuild(Machine<?> machine, Collection<CacheKey> keys, int limit) {
    final var targets = new LinkedHashMap<CacheKey, String>();
    for (CacheKey key : keys) {
      if (targets.size() >= limit) {
        break;
      }
      if (declined.contains(key)) {
        continue;
      }
      machine.next(key.stateId(), key.label()).ifPresent(target -> targets.put(key, target.id()));
    }
    install(machine, targets);
    return targets.size();
  }

  /**
   * Publish entries as they are, without checking them against the machine.
   *
   * @param machine snapshot the entries belong to
   * @param targets target state id of every pair
   */
  public void install(Machine<?> machine, Map<CacheKey, String> targets) {
    final var accepted = new LinkedHashMap<CacheKey, String>();
    for (var entry : targets.entrySet()) {
      if (!declined.contains(entry.getKey())) {
        accepted.put(entry.getKey(), entry.getValue());
      }
    }
    generation.set(new Generation(machine, Collections.unmodifiableMap(accepted)));
  }

  /**
   * Stop using a pair for the rest of the session.
   *
   * @param key pair to decline
   */
  public void decline(CacheKey key) {
    if (declined.add(key)) {
      log.warn("Declined direct dispatch for {}", key);
    }
    generation.updateAndGet(current -> {
      if (!current.targets().containsKey(key)) {
        return current;
      }
      final var remaining = new LinkedHashMap<>(current.targets());
      remaining.remove(key);
      return new Generation(current.machine(), Collections.unmodifiableMap(remaining));
    });
  }

  public boolean isDeclined(CacheKey key) {
    return declined.contains(key);
  }

  public void clear() {
    generation.set(EMPTY);
  }

  public int size() {
    return generation.get().targets().size();
  }

  /**
   * Compiled entries of the current generation.
   *
   * @return unmodifiable pair to target id map
   */
  public Map<CacheKey, String> entries() {
    return generation.get().targets();
  }

  /**
   * Check that the table can be used against a machine.
   *
   * @param machine snapshot to check against
   * @return whether the table is empty, or was built for {@code machine} and
   *   every target is one of its states
   */
  public boolean isValidFor(Machine<?> machine) {
    final Generation current = generation.get();
    if (current.targets().isEmpty()) {
      return true;
    }
    return current.machine() == machine && current.targets().values().stream().allMatch(machine::contains);
  }
}
