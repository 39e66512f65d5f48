package automaton.cache;

import automaton.graph.Machine;
import automaton.graph.State;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Multi-tier cache of {@code (state, label) -> target} transitions.
 *
 * <p>Every entry sits in exactly one tier. Each tier is kept in access order so
 * the least recently used entry of a tier is always its first. When the cache
 * is full, the victim is taken from {@link CacheTier#COLD} first, then
 * {@link CacheTier#FREQUENT}, then {@link CacheTier#HOT}; the strategy decides
 * which entry of that tier goes.
 *
 * <p>All operations take the cache's monitor, so a lookup never observes an
 * entry half-way through eviction.
 */
public final class TransitionCache {

  private static final Logger log = LoggerFactory.getLogger(TransitionCache.class);

  /**
   * Number of least recently used entries considered by the frequency-aware
   * strategies when picking a victim.
   */
  private static final int EVICTION_SAMPLE = 8;

  // Adaptive sizing: the capacity is reconsidered whenever the cache is full
  private static final long ADAPTIVE_MIN_REQUESTS = 100;
  private static final double ADAPTIVE_HIT_RATIO = 0.8;
  private static final double ADAPTIVE_LOW_HIT_RATIO = ADAPTIVE_HIT_RATIO * 0.7;
  private static final double ADAPTIVE_GROWTH = 1.2;
  private static final double ADAPTIVE_SHRINK = 0.8;
  private static final int ADAPTIVE_MIN_SIZE = 100;
  private static final int ADAPTIVE_MAX_SIZE = 10_000;

  /**
   * Cache configuration.
   *
   * @param maxSize maximum number of live entries
   * @param ttl time to live of an entry since its last access ({@link Duration#ZERO} for none)
   * @param strategy victim selection inside a tier
   * @param predictive warm the most likely next transition on every hit
   * @param multiTier move entries between tiers (otherwise everything stays cold)
   * @param frequencyThreshold access count above which an entry may be promoted
   * @param temporalThreshold maximum time between accesses for an entry to count as recent
   * @param adaptiveSize let the capacity follow the hit ratio, starting from {@code maxSize}
   */
  public record Options(
    int maxSize,
    Duration ttl,
    CacheStrategy strategy,
    boolean predictive,
    boolean multiTier,
    int frequencyThreshold,
    Duration temporalThreshold,
    boolean adaptiveSize
  ) {

    public static final int DEFAULT_MAX_SIZE = 1000;
    public static final Duration DEFAULT_TTL = Duration.ofHours(1);
    public static final int DEFAULT_FREQUENCY_THRESHOLD = 3;
    public static final Duration DEFAULT_TEMPORAL_THRESHOLD = Duration.ofSeconds(1);

    public Options {
      if (maxSize <= 0) {
        throw new IllegalArgumentException("cache size must be positive, got " + maxSize);
      }
      if (frequencyThreshold < 0) {
        throw new IllegalArgumentException("frequency threshold must not be negative, got " + frequencyThreshold);
      }
      Objects.requireNonNull(ttl, "ttl");
      Objects.requireNonNull(strategy, "strategy");
      Objects.requireNonNull(temporalThreshold, "temporal threshold");
      if (ttl.isNegative() || temporalThreshold.isNegative()) {
        throw new IllegalArgumentException("durations must not be negative");
      }
    }

    public static Options defaults() {
      return new Options(
        DEFAULT_MAX_SIZE,
        DEFAULT_TTL,
        CacheStrategy.HYBRID,
        false,
        true,
        DEFAULT_FREQUENCY_THRESHOLD,
        DEFAULT_TEMPORAL_THRESHOLD,
        false
      );
    }

    public Options withMaxSize(int maxSize) {
      return new Options(maxSize, ttl, strategy, predictive, multiTier, frequencyThreshold, temporalThreshold, adaptiveSize);
    }

    public Options withTtl(Duration ttl) {
      return new Options(maxSize, ttl, strategy, predictive, multiTier, frequencyThreshold, temporalThreshold, adaptiveSize);
    }

    public Options withStrategy(CacheStrategy strategy) {
      return new Options(maxSize, ttl, strategy, predictive, multiTier, frequencyThreshold, temporalThreshold, adaptiveSize);
    }

    public Options withPredictive(boolean predictive) {
      return new Options(maxSize, ttl, strategy, predictive, multiTier, frequencyThreshold, temporalThreshold, adaptiveSize);
    }

    public Options withMultiTier(boolean multiTier) {
      return new Options(maxSize, ttl, strategy, predictive, multiTier, frequencyThreshold, temporalThreshold, adaptiveSize);
    }

    public Options withFrequencyThreshold(int frequencyThreshold) {
      return new Options(maxSize, ttl, strategy, predictive, multiTier, frequencyThreshold, temporalThreshold, adaptiveSize);
    }

    public Options withTemporalThreshold(Duration temporalThreshold) {
      return new Options(maxSize, ttl, strategy, predictive, multiTier, frequencyThreshold, temporalThreshold, adaptiveSize);
    }

    public Options withAdaptiveSize(boolean adaptiveSize) {
      return new Options(maxSize, ttl, strategy, predictive, multiTier, frequencyThreshold, temporalThreshold, adaptiveSize);
    }
  }

  private final Options options;
  private final Clock clock;

  private final Map<CacheKey, CacheEntry> entries = new HashMap<>();
  private final EnumMap<CacheTier, LinkedHashMap<CacheKey, CacheEntry>> tiers = new EnumMap<>(CacheTier.class);

  /**
   * Per source state, how often each label was taken (predictive mode only).
   */
  private final Map<String, Map<String, Long>> labelFrequencies = new HashMap<>();

  private TransitionResolver prefetchSource;
  private long sequence = 0;
  private int capacity;

  // Statistics
  private final AtomicLong hits = new AtomicLong(0);
  private final AtomicLong misses = new AtomicLong(0);
  private final AtomicLong evictions = new AtomicLong(0);
  private final AtomicLong expirations = new AtomicLong(0);
  private final AtomicLong prefetches = new AtomicLong(0);
  private final AtomicLong predictiveHits = new AtomicLong(0);
  private final AtomicLong sizeAdjustments = new AtomicLong(0);

  public TransitionCache(Options options) {
    this(options, Clock.systemUTC());
  }

  public TransitionCache(Options options, Clock clock) {
    this.options = Objects.requireNonNull(options, "options");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.capacity = options.maxSize();
    for (CacheTier tier : CacheTier.values()) {
      tiers.put(tier, new LinkedHashMap<>(16, 0.75f, true));
    }
  }

  public Options options() {
    return options;
  }

  /**
   * Set where predictive mode looks up the transitions it warms.
   *
   * @param prefetchSource resolver, or {@code null} to disable warming
   */
  public synchronized void setPrefetchSource(TransitionResolver prefetchSource) {
    this.prefetchSource = prefetchSource;
  }

  /**
   * Look up a cached transition.
   *
   * @param stateId source state
   * @param label transition label
   * @return target state id, or empty on a miss
   */
  public synchronized Optional<String> get(String stateId, String label) {
    final var key = new CacheKey(stateId, label);
    final CacheEntry entry = entries.get(key);
    if (entry == null) {
      misses.incrementAndGet();
      return Optional.empty();
    }

    final Instant now = clock.instant();
    if (entry.isExpired(now)) {
      remove(entry);
      expirations.incrementAndGet();
      misses.incrementAndGet();
      return Optional.empty();
    }

    hits.incrementAndGet();
    if (entry.isPrefetched()) {
      entry.setPrefetched(false);
      predictiveHits.incrementAndGet();
    }

    final Instant previousAccess = entry.lastAccess();
    entry.recordAccess(now, ++sequence);
    entry.setExpiresAt(expiry(now));
    tiers.get(entry.tier()).get(key);
    if (options.multiTier()) {
      retier(entry, Duration.between(previousAccess, now));
    }

    if (options.predictive()) {
      recordLabel(stateId, label);
      prefetchFrom(entry.target());
    }
    return Optional.of(entry.target());
  }

  /**
   * Cache a transition.
   *
   * <p>If the key is already cached its target is replaced, otherwise a new cold
   * entry is inserted, evicting one entry first if the cache is full.
   *
   * @param stateId source state
   * @param label transition label
   * @param target target state id
   */
  public synchronized void set(String stateId, String label, String target) {
    Objects.requireNonNull(target, "target");
    final var key = new CacheKey(stateId, label);
    if (options.predictive()) {
      recordLabel(stateId, label);
    }
    insert(key, target, false);
  }

  private void insert(CacheKey key, String target, boolean prefetched) {
    final Instant now = clock.instant();
    final CacheEntry existing = entries.get(key);
    if (existing != null) {
      existing.setTarget(target);
      existing.refresh(now, ++sequence);
      existing.setExpiresAt(expiry(now));
      tiers.get(existing.tier()).get(key);
      return;
    }

    if (entries.size() >= capacity) {
      if (options.adaptiveSize()) {
        adjustCapacity();
      }
      while (entries.size() >= capacity) {
        evictOne();
      }
    }

    final var entry = new CacheEntry(key, target, now, ++sequence, expiry(now));
    entry.setPrefetched(prefetched);
    entries.put(key, entry);
    tiers.get(CacheTier.COLD).put(key, entry);
  }

  /**
   * Remove one cached transition.
   *
   * @param stateId source state
   * @param label transition label
   * @return whether an entry was removed
   */
  public synchronized boolean invalidate(String stateId, String label) {
    final CacheEntry entry = entries.get(new CacheKey(stateId, label));
    if (entry == null) {
      return false;
    }
    remove(entry);
    return true;
  }

  /**
   * Rename the states of every entry.
   *
   * <p>Entries whose source or target has no new id are dropped. When several
   * entries land on the same key, the most accessed one survives. Tiers and
   * access counts are kept, and nothing here counts as an eviction.
   *
   * @param mapping old state id to new state id
   * @return number of entries dropped
   */
  public synchronized int remap(Map<String, String> mapping) {
    final var remapped = new LinkedHashMap<CacheKey, CacheEntry>();
    int dropped = 0;
    for (CacheTier tier : CacheTier.values()) {
      for (CacheEntry entry : tiers.get(tier).values()) {
        final String stateId = mapping.get(entry.key().stateId());
        final String target = mapping.get(entry.target());
        if (stateId == null || target == null) {
          dropped++;
          continue;
        }
        final var key = new CacheKey(stateId, entry.key().label());
        final CacheEntry existing = remapped.get(key);
        if (existing != null) {
          dropped++;
          if (existing.accessCount() >= entry.accessCount()) {
            continue;
          }
        }
        remapped.put(key, entry.rekeyed(key, target));
      }
    }

    entries.clear();
    for (var tier : tiers.values()) {
      tier.clear();
    }
    for (CacheEntry entry : remapped.values()) {
      entries.put(entry.key(), entry);
      tiers.get(entry.tier()).put(entry.key(), entry);
    }

    final var frequencies = new HashMap<String, Map<String, Long>>();
    for (var state : labelFrequencies.entrySet()) {
      final String stateId = mapping.get(state.getKey());
      if (stateId != null) {
        final var merged = frequencies.computeIfAbsent(stateId, k -> new HashMap<>());
        state.getValue().forEach((label, count) -> merged.merge(label, count, Long::sum));
      }
    }
    labelFrequencies.clear();
    labelFrequencies.putAll(frequencies);

    log.debug("Remapped cache: {} entries kept, {} dropped", entries.size(), dropped);
    return dropped;
  }

  /**
   * Drop every entry. Statistics are kept.
   */
  public synchronized void clear() {
    entries.clear();
    labelFrequencies.clear();
    for (var tier : tiers.values()) {
      tier.clear();
    }
  }

  /**
   * Zero the hit, miss, eviction, expiration and prefetch counters. The count
   * of capacity adjustments is kept.
   */
  public synchronized void resetStatistics() {
    hits.set(0);
    misses.set(0);
    evictions.set(0);
    expirations.set(0);
    prefetches.set(0);
    predictiveHits.set(0);
  }

  /**
   * Cache every transition of a machine, until the cache is full.
   *
   * @param machine machine whose transitions to cache
   * @return number of entries added
   */
  public synchronized int precompute(Machine<?> machine) {
    int added = 0;
    for (State<?> state : machine.states()) {
      for (var transition : state.transitions().entrySet()) {
        if (entries.size() >= capacity) {
          log.debug("Precomputed {} transitions before filling the cache", added);
          return added;
        }
        final var key = new CacheKey(state.id(), transition.getKey());
        if (!entries.containsKey(key)) {
          insert(key, transition.getValue(), false);
          added++;
        }
      }
    }
    log.debug("Precomputed {} transitions", added);
    return added;
  }

  /**
   * Most accessed entries.
   *
   * @param limit maximum number of keys to return
   * @return keys, most accessed first (ties broken by tier, then recency)
   */
  public synchronized List<CacheKey> hottest(int limit) {
    final var ranked = new ArrayList<>(entries.values());
    ranked.sort(
      Comparator.comparingLong(CacheEntry::accessCount)
        .thenComparing(CacheEntry::tier)
        .thenComparingLong(CacheEntry::lastAccessSequence)
        .reversed()
    );
    final var keys = new ArrayList<CacheKey>(Math.min(limit, ranked.size()));
    for (CacheEntry entry : ranked) {
      if (keys.size() >= limit) {
        break;
      }
      keys.add(entry.key());
    }
    return keys;
  }

  /**
   * Drop every entry of a tier. Dropped entries count as evictions.
   *
   * @param tier tier to empty
   * @return number of entries dropped
   */
  public synchronized int dropTier(CacheTier tier) {
    final var dropped = new ArrayList<>(tiers.get(tier).values());
    for (CacheEntry entry : dropped) {
      remove(entry);
    }
    evictions.addAndGet(dropped.size());
    log.debug("Dropped {} {} entries", dropped.size(), tier);
    return dropped.size();
  }

  /**
   * Remove every expired entry.
   *
   * @return number of entries removed
   */
  public synchronized int purgeExpired() {
    final Instant now = clock.instant();
    final var expired = new ArrayList<CacheEntry>();
    for (CacheEntry entry : entries.values()) {
      if (entry.isExpired(now)) {
        expired.add(entry);
      }
    }
    for (CacheEntry entry : expired) {
      remove(entry);
    }
    expirations.addAndGet(expired.size());
    return expired.size();
  }

  /**
   * Demote idle entries.
   *
   * <p>An entry accessed at most once and idle for more than twice the temporal
   * threshold becomes cold; an idle hot entry falls back to frequent.
   *
   * @return number of entries which changed tier
   */
  public synchronized int rebalance() {
    if (!options.multiTier()) {
      return 0;
    }
    final Instant now = clock.instant();
    final Duration idleLimit = options.temporalThreshold().multipliedBy(2);
    int moved = 0;
    for (CacheEntry entry : new ArrayList<>(entries.values())) {
      if (Duration.between(entry.lastAccess(), now).compareTo(idleLimit) <= 0) {
        continue;
      }
      if (entry.accessCount() <= 1 && entry.tier() != CacheTier.COLD) {
        move(entry, CacheTier.COLD);
        moved++;
      } else if (entry.tier() == CacheTier.HOT) {
        move(entry, CacheTier.FREQUENT);
        moved++;
      }
    }
    return moved;
  }

  public synchronized int size() {
    return entries.size();
  }

  /**
   * Current capacity. Equal to {@link Options#maxSize()} unless adaptive
   * sizing has moved it.
   */
  public synchronized int capacity() {
    return capacity;
  }

  public synchronized int size(CacheTier tier) {
    return tiers.get(tier).size();
  }

  /**
   * Tier of a cached transition, without counting as an access.
   *
   * @param stateId source state
   * @param label transition label
   * @return tier, or empty if the transition is not cached
   */
  public synchronized Optional<CacheTier> tierOf(String stateId, String label) {
    return Optional.ofNullable(entries.get(new CacheKey(stateId, label))).map(CacheEntry::tier);
  }

  public synchronized CacheStats stats() {
    final long hitCount = hits.get();
    final long total = hitCount + misses.get();
    return new CacheStats(
      hitCount,
      misses.get(),
      evictions.get(),
      expirations.get(),
      prefetches.get(),
      predictiveHits.get(),
      sizeAdjustments.get(),
      total > 0 ? (double) hitCount / total : 0.0,
      entries.size(),
      capacity,
      tiers.get(CacheTier.HOT).size(),
      tiers.get(CacheTier.FREQUENT).size(),
      tiers.get(CacheTier.COLD).size()
    );
  }

  /**
   * Grow a full cache which mostly hits, shrink one which mostly misses.
   *
   * <p>Nothing moves before 100 lookups, and the capacity stays between 100 and
   * 10000 entries (or at its starting value, if that lies outside).
   */
  private void adjustCapacity() {
    final long hitCount = hits.get();
    final long total = hitCount + misses.get();
    if (total < ADAPTIVE_MIN_REQUESTS) {
      return;
    }
    final double hitRatio = (double) hitCount / total;
    int adjusted = capacity;
    if (hitRatio > ADAPTIVE_HIT_RATIO && capacity < ADAPTIVE_MAX_SIZE) {
      adjusted = Math.min(ADAPTIVE_MAX_SIZE, (int) (capacity * ADAPTIVE_GROWTH));
    } else if (hitRatio < ADAPTIVE_LOW_HIT_RATIO && capacity > ADAPTIVE_MIN_SIZE) {
      adjusted = Math.max(ADAPTIVE_MIN_SIZE, (int) (capacity * ADAPTIVE_SHRINK));
    }
    if (adjusted != capacity) {
      log.debug("Cache capacity {} -> {} at {} hit ratio", capacity, adjusted, hitRatio);
      capacity = adjusted;
      sizeAdjustments.incrementAndGet();
    }
  }

  private Instant expiry(Instant now) {
    return options.ttl().isZero() ? null : now.plus(options.ttl());
  }

  /**
   * Move an entry between tiers after a read.
   *
   * @param entry entry which was just read
   * @param sincePrevious time since the access before this one
   */
  private void retier(CacheEntry entry, Duration sincePrevious) {
    if (entry.accessCount() < options.frequencyThreshold()) {
      return;
    }
    final boolean recent = sincePrevious.compareTo(options.temporalThreshold()) < 0;
    if (entry.accessCount() > options.frequencyThreshold() && recent) {
      move(entry, entry.tier().promoted());
    } else if (!recent) {
      move(entry, CacheTier.FREQUENT);
    }
  }

  private void move(CacheEntry entry, CacheTier tier) {
    if (entry.tier() == tier) {
      return;
    }
    tiers.get(entry.tier()).remove(entry.key());
    entry.setTier(tier);
    tiers.get(tier).put(entry.key(), entry);
  }

  private void remove(CacheEntry entry) {
    entries.remove(entry.key());
    tiers.get(entry.tier()).remove(entry.key());
  }

  private void evictOne() {
    for (CacheTier tier : CacheTier.values()) {
      final var candidates = tiers.get(tier);
      if (candidates.isEmpty()) {
        continue;
      }
      final CacheEntry victim = pickVictim(candidates);
      remove(victim);
      evictions.incrementAndGet();
      log.trace("Evicted {}", victim);
      return;
    }
  }

  /**
   * Pick the least valuable entry of a non-empty tier.
   *
   * <p>Iteration order of a tier is least recently used first. Ties go to the
   * least recently used candidate.
   */
  private CacheEntry pickVictim(LinkedHashMap<CacheKey, CacheEntry> tier) {
    final Iterator<CacheEntry> candidates = tier.values().iterator();
    CacheEntry victim = candidates.next();
    if (options.strategy() == CacheStrategy.LRU) {
      return victim;
    }

    final Instant now = clock.instant();
    double victimValue = value(victim, now);
    for (int i = 1; i < EVICTION_SAMPLE && candidates.hasNext(); i++) {
      final CacheEntry candidate = candidates.next();
      final double candidateValue = value(candidate, now);
      if (candidateValue < victimValue) {
        victim = candidate;
        victimValue = candidateValue;
      }
    }
    return victim;
  }

  private double value(CacheEntry entry, Instant now) {
    if (options.strategy() == CacheStrategy.FREQUENCY) {
      return entry.accessCount();
    }
    final double ageSeconds = Math.max(0, Duration.between(entry.lastAccess(), now).toMillis()) / 1000.0;
    return entry.accessCount() / (ageSeconds + 1.0);
  }

  private void recordLabel(String stateId, String label) {
    labelFrequencies
      .computeIfAbsent(stateId, k -> new HashMap<>())
      .merge(label, 1L, Long::sum);
  }

  /**
   * Warm the most frequently taken transition out of a state.
   *
   * @param stateId state the machine just moved into
   */
  private void prefetchFrom(String stateId) {
    if (prefetchSource == null) {
      return;
    }
    final Map<String, Long> frequencies = labelFrequencies.get(stateId);
    if (frequencies == null || frequencies.isEmpty()) {
      return;
    }

    String likely = null;
    long best = -1;
    for (var frequency : frequencies.entrySet()) {
      final long count = frequency.getValue();
      if (count > best || (count == best && frequency.getKey().compareTo(likely) < 0)) {
        likely = frequency.getKey();
        best = count;
      }
    }

    final var key = new CacheKey(stateId, likely);
    if (entries.containsKey(key)) {
      return;
    }
    final Optional<String> target = prefetchSource.resolve(stateId, likely);
    if (target.isPresent()) {
      insert(key, target.get(), true);
      prefetches.incrementAndGet();
    }
  }
}
