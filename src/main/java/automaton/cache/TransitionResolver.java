package automaton.cache;

import java.util.Optional;

/**
 * Source of transitions used to warm the cache ahead of a lookup.
 */
@FunctionalInterface
public interface TransitionResolver {

  /**
   * Resolve a transition without going through the cache.
   *
   * @param stateId source state
   * @param label transition label
   * @return target state id, or empty if there is no such transition
   */
  Optional<String> resolve(String stateId, String label);
}
