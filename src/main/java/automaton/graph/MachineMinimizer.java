package automaton.graph;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Rebuilds a machine so that each equivalence class becomes a single state.
 *
 * <p>The surviving state of a class is its member with the lexicographically
 * smallest id, so minimizing twice yields the same ids. Its transitions are
 * rewritten to point at the surviving states of their target classes.
 */
public final class MachineMinimizer {

  private static final Logger log = LoggerFactory.getLogger(MachineMinimizer.class);

  private MachineMinimizer() { }

  /**
   * Minimize a machine.
   *
   * <p>Unreachable states are dropped first, then equivalent states merged.
   *
   * @param machine machine to minimize
   * @return minimized machine and metrics
   */
  public static <V> MinimizationResult<V> minimize(Machine<V> machine) {
    final long start = System.nanoTime();
    final Machine<V> reachable = prune(machine);
    final EquivalenceClasses<Machine<V>.Node> classes = reachable.equivalenceClasses();

    // Pick representatives
    final var representatives = new HashMap<Integer, String>();
    for (Machine<V>.Node node : classes.nodes()) {
      final int klass = classes.classOf(node).getAsInt();
      final String id = node.state().id();
      representatives.merge(klass, id, (a, b) -> a.compareTo(b) <= 0 ? a : b);
    }

    final var mapping = new LinkedHashMap<String, String>();
    for (Machine<V>.Node node : classes.nodes()) {
      mapping.put(node.state().id(), representatives.get(classes.classOf(node).getAsInt()));
    }

    // States which could not be classified (or were only reachable through
    // one) stay as they are
    for (String id : reachable.stateIds()) {
      mapping.putIfAbsent(id, id);
    }
    if (!classes.structuralErrors().isEmpty()) {
      log.warn("Kept {} unclassifiable states unmerged: {}", classes.structuralErrors().size(), classes.structuralErrors());
    }

    // Rebuild, keeping the original order of the surviving states
    final List<State<V>> states = new ArrayList<>();
    for (State<V> state : reachable.states()) {
      if (state.id().equals(mapping.get(state.id()))) {
        states.add(state.renamed(state.id(), mapping));
      }
    }
    final Machine<V> minimized = Machine.of(states, mapping.get(machine.initialId()));

    final var result = new MinimizationResult<>(
      minimized,
      mapping,
      machine.size(),
      minimized.size(),
      machine.transitionCount(),
      minimized.transitionCount(),
      classes.classCount(),
      Duration.ofNanos(System.nanoTime() - start)
    );
    log.debug(
      "Minimized {} states into {} ({} classes, {} passes) in {}",
      result.originalStates(),
      result.minimizedStates(),
      result.equivalenceClasses(),
      classes.refinementPasses(),
      result.duration()
    );
    return result;
  }

  /**
   * Drop the states which cannot be reached from the initial state, without
   * merging anything.
   *
   * @param machine machine to prune
   * @return pruned machine and metrics
   */
  public static <V> MinimizationResult<V> removeUnreachable(Machine<V> machine) {
    final long start = System.nanoTime();
    final Machine<V> pruned = prune(machine);

    final var mapping = new LinkedHashMap<String, String>();
    for (String id : pruned.stateIds()) {
      mapping.put(id, id);
    }

    final var result = new MinimizationResult<>(
      pruned,
      mapping,
      machine.size(),
      pruned.size(),
      machine.transitionCount(),
      pruned.transitionCount(),
      pruned.size(),
      Duration.ofNanos(System.nanoTime() - start)
    );
    log.debug("Pruned {} unreachable states", result.statesRemoved());
    return result;
  }

  private static <V> Machine<V> prune(Machine<V> machine) {
    final Set<String> reachable = machine.reachableIds();
    return reachable.size() == machine.size() ? machine : machine.restrictedTo(reachable);
  }

  /**
   * Check a minimization against the machine it was computed from.
   *
   * <p>Every reachable original state must map to a state with the same
   * acceptance, an equal payload and the same labels, and each of its transitions must lead to the state
   * which its own target maps to.
   *
   * @param original machine which was minimized
   * @param result outcome of minimizing {@code original}
   * @return whether the state mapping is consistent
   */
  public static <V> boolean isConsistent(Machine<V> original, MinimizationResult<V> result) {
    final Machine<V> minimized = result.machine();
    if (!minimized.initialId().equals(result.stateMapping().get(original.initialId()))) {
      return false;
    }
    for (var mapped : result.stateMapping().entrySet()) {
      final State<V> from = original.state(mapped.getKey()).orElse(null);
      final State<V> to = minimized.state(mapped.getValue()).orElse(null);
      if (from == null || to == null
        || !from.sameOutput(to)
        || !from.transitions().keySet().equals(to.transitions().keySet())) {
        return false;
      }
      for (var transition : from.transitions().entrySet()) {
        final String expected = result.stateMapping().get(transition.getValue());
        if (expected == null || !expected.equals(to.transitions().get(transition.getKey()))) {
          return false;
        }
      }
    }
    return true;
  }
}
