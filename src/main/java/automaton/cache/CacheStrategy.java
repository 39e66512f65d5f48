package automaton.cache;

/**
 * How the victim is picked inside a tier when the cache is full.
 */
public enum CacheStrategy {

  /** Least recently accessed entry. */
  LRU,

  /** Least accessed entry among the oldest few. */
  FREQUENCY,

  /** Lowest access count per second of age among the oldest few. */
  HYBRID
}
