package automaton.cache;

/**
 * Point-in-time statistics of a {@link TransitionCache}.
 *
 * @param hits lookups which found a live entry
 * @param misses lookups which found nothing (or an expired entry)
 * @param evictions entries removed to make room or by compaction
 * @param expirations entries removed because their TTL ran out
 * @param prefetches entries inserted by predictive prefetching
 * @param predictiveHits prefetched entries which were later read
 * @param adaptiveSizeAdjustments times adaptive sizing changed the capacity
 * @param hitRatio {@code hits / (hits + misses)}, or 0 before any lookup
 * @param size live entries
 * @param maxSize current capacity
 * @param hotEntries entries in the {@link CacheTier#HOT} tier
 * @param frequentEntries entries in the {@link CacheTier#FREQUENT} tier
 * @param coldEntries entries in the {@link CacheTier#COLD} tier
 */
public record CacheStats(
  long hits,
  long misses,
  long evictions,
  long expirations,
  long prefetches,
  long predictiveHits,
  long adaptiveSizeAdjustments,
  double hitRatio,
  int size,
  int maxSize,
  int hotEntries,
  int frequentEntries,
  int coldEntries
) {

  public String format() {
    return String.format(
      "Cache: %.2f%% hit ratio, %d/%d entries (%d hot, %d frequent, %d cold), %d hits, %d misses, %d evictions",
      hitRatio * 100, size, maxSize, hotEntries, frequentEntries, coldEntries, hits, misses, evictions
    );
  }
}
