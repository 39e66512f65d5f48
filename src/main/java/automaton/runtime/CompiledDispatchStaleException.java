package automaton.runtime;

import automaton.cache.CacheKey;

/**
 * A direct-dispatch entry points at a state which is not in the machine it was
 * compiled for.
 *
 * <p>Never surfaces past {@code transition}: the caller falls back to the cache
 * and the pair is declined for the rest of the session.
 */
public final class CompiledDispatchStaleException extends IllegalStateException {

  private static final long serialVersionUID = 1L;

  private final CacheKey key;
  private final String targetId;

  public CompiledDispatchStaleException(CacheKey key, String targetId) {
    super("compiled transition " + key + " points at missing state '" + targetId + "'");
    this.key = key;
    this.targetId = targetId;
  }

  public CacheKey key() {
    return key;
  }

  public String targetId() {
    return targetId;
  }
}
