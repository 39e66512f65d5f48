package automaton.cache;

import java.time.Instant;
import java.util.Optional;

/**
 * Cached transition together with its access metadata.
 *
 * <p>Entries are only mutated by their {@link TransitionCache}, under its lock.
 */
public final class CacheEntry {

  private final CacheKey key;
  private String target;
  private CacheTier tier = CacheTier.COLD;
  private long accessCount = 1;
  private Instant lastAccess;
  private long lastAccessSequence;
  private Instant expiresAt;

  /** Inserted by prefetching and not yet read. */
  private boolean prefetched;

  CacheEntry(CacheKey key, String target, Instant now, long sequence, Instant expiresAt) {
    this.key = key;
    this.target = target;
    this.lastAccess = now;
    this.lastAccessSequence = sequence;
    this.expiresAt = expiresAt;
  }

  public CacheKey key() {
    return key;
  }

  public String target() {
    return target;
  }

  public CacheTier tier() {
    return tier;
  }

  public long accessCount() {
    return accessCount;
  }

  public Instant lastAccess() {
    return lastAccess;
  }

  public Optional<Instant> expiresAt() {
    return Optional.ofNullable(expiresAt);
  }

  void setTarget(String target) {
    this.target = target;
  }

  void setTier(CacheTier tier) {
    this.tier = tier;
  }

  void setExpiresAt(Instant expiresAt) {
    this.expiresAt = expiresAt;
  }

  boolean isPrefetched() {
    return prefetched;
  }

  void setPrefetched(boolean prefetched) {
    this.prefetched = prefetched;
  }

  long lastAccessSequence() {
    return lastAccessSequence;
  }

  boolean isExpired(Instant now) {
    return expiresAt != null && !now.isBefore(expiresAt);
  }

  /**
   * Record a read.
   *
   * @param now time of the read
   * @param sequence logical time of the read
   */
  void recordAccess(Instant now, long sequence) {
    accessCount++;
    lastAccess = now;
    lastAccessSequence = sequence;
  }

  /**
   * Record a write to an existing entry (not counted as an access).
   *
   * @param now time of the write
   * @param sequence logical time of the write
   */
  void refresh(Instant now, long sequence) {
    lastAccess = now;
    lastAccessSequence = sequence;
  }

  /**
   * Copy of this entry under another key, keeping its metadata.
   *
   * @param key new key
   * @param target new target
   * @return copy
   */
  CacheEntry rekeyed(CacheKey key, String target) {
    final var copy = new CacheEntry(key, target, lastAccess, lastAccessSequence, expiresAt);
    copy.tier = tier;
    copy.accessCount = accessCount;
    copy.prefetched = prefetched;
    return copy;
  }

  @Override
  public String toString() {
    return "CacheEntry(" + key + " -> " + target + ", " + tier + ", accesses = " + accessCount + ")";
  }
}
