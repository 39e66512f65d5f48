package automaton.cache;

/**
 * Coarse access classification of a cache entry.
 *
 * <p>Declared from the first tier to evict to the last.
 */
public enum CacheTier {

  /** Rarely or not recently accessed, first in line for eviction. */
  COLD,

  /** Accessed often, though not necessarily recently. */
  FREQUENT,

  /** Accessed often and recently. */
  HOT;

  /**
   * Next tier up.
   *
   * @return tier one step closer to {@link #HOT} (or {@code HOT} itself)
   */
  public CacheTier promoted() {
    return this == COLD ? FREQUENT : HOT;
  }
}
