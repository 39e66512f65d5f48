package automaton.cache;

import java.util.Objects;

/**
 * Key of a cached transition.
 *
 * @param stateId id of the source state
 * @param label transition label
 */
public record CacheKey(String stateId, String label) {

  public CacheKey {
    Objects.requireNonNull(stateId, "state id");
    Objects.requireNonNull(label, "label");
  }

  @Override
  public String toString() {
    return stateId + ":" + label;
  }
}
