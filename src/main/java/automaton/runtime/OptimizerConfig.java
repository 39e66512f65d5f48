package automaton.runtime;

import automaton.cache.CacheStrategy;
import automaton.cache.TransitionCache;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import java.io.IOException;
import java.io.InputStream;
import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of a running machine: its cache and its runtime optimizer.
 *
 * @param cache transition cache options
 * @param level level of the passes the optimizer starts on its own
 * @param runtimeOptimization whether the optimizer starts passes on its own
 * @param interval timer period, also twice the minimum time between passes
 *   ({@link Duration#ZERO} disables both the timer and the rate limit)
 * @param maxMemoryUsage memory budget in bytes (0 for no budget)
 * @param compactionThreshold share of the budget above which memory pressure is reported
 * @param samplingInterval minimum time between performance samples ({@link Duration#ZERO} disables sampling)
 * @param compileLimit maximum number of direct-dispatch entries
 */
public record OptimizerConfig(
  TransitionCache.Options cache,
  OptimizationLevel level,
  boolean runtimeOptimization,
  Duration interval,
  long maxMemoryUsage,
  double compactionThreshold,
  Duration samplingInterval,
  int compileLimit
) {

  public static final Duration DEFAULT_INTERVAL = Duration.ofSeconds(60);
  public static final double DEFAULT_COMPACTION_THRESHOLD = 0.8;
  public static final Duration DEFAULT_SAMPLING_INTERVAL = Duration.ofSeconds(10);
  public static final int DEFAULT_COMPILE_LIMIT = 20;

  private static final ObjectMapper objectMapper = JsonMapper.builder()
    .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
    .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
    .build();

  public OptimizerConfig {
    Objects.requireNonNull(cache, "cache options");
    Objects.requireNonNull(level, "optimization level");
    Objects.requireNonNull(interval, "optimization interval");
    Objects.requireNonNull(samplingInterval, "sampling interval");
    if (interval.isNegative() || samplingInterval.isNegative()) {
      throw new IllegalArgumentException("intervals must not be negative");
    }
    if (maxMemoryUsage < 0) {
      throw new IllegalArgumentException("memory budget must not be negative, got " + maxMemoryUsage);
    }
    if (!(compactionThreshold > 0 && compactionThreshold <= 1)) {
      throw new IllegalArgumentException("compaction threshold must be in (0, 1], got " + compactionThreshold);
    }
    if (compileLimit < 0) {
      throw new IllegalArgumentException("compile limit must not be negative, got " + compileLimit);
    }
  }

  public static OptimizerConfig defaults() {
    return builder().build();
  }

  public static Builder builder() {
    return new Builder();
  }

  public Builder toBuilder() {
    final var builder = new Builder();
    builder.cache = cache;
    builder.level = level;
    builder.runtimeOptimization = runtimeOptimization;
    builder.interval = interval;
    builder.maxMemoryUsage = maxMemoryUsage;
    builder.compactionThreshold = compactionThreshold;
    builder.samplingInterval = samplingInterval;
    builder.compileLimit = compileLimit;
    return builder;
  }

  public boolean hasMemoryBudget() {
    return maxMemoryUsage > 0;
  }

  /**
   * Estimate above which memory pressure is reported.
   *
   * @return bytes, or {@link Long#MAX_VALUE} without a budget
   */
  public long memoryPressureThreshold() {
    return hasMemoryBudget() ? (long) (maxMemoryUsage * compactionThreshold) : Long.MAX_VALUE;
  }

  /**
   * Read a configuration from JSON.
   *
   * <p>Every key is optional and defaults as in {@link #defaults()}. Durations
   * are given in milliseconds. Unknown keys are rejected.
   *
   * @param json JSON document
   * @return configuration
   * @throws IOException if the document cannot be read or has unknown keys
   */
  public static OptimizerConfig fromJson(InputStream json) throws IOException {
    return objectMapper.readValue(json, Document.class).toConfig();
  }

  /**
   * JSON form of the configuration.
   */
  record Document(
    CacheStrategy cacheStrategy,
    Integer maxCacheSize,
    Long ttlMillis,
    Boolean predictivePrefetch,
    Boolean multiTier,
    Integer frequencyThreshold,
    Long temporalThresholdMillis,
    Boolean adaptiveCacheSize,
    OptimizationLevel optimizationLevel,
    Boolean runtimeOptimization,
    Long optimizationIntervalMillis,
    Long maxMemoryUsage,
    Double compactionThreshold,
    Long samplingIntervalMillis,
    Integer compileLimit
  ) {

    OptimizerConfig toConfig() {
      TransitionCache.Options cache = TransitionCache.Options.defaults();
      if (cacheStrategy != null) {
        cache = cache.withStrategy(cacheStrategy);
      }
      if (maxCacheSize != null) {
        cache = cache.withMaxSize(maxCacheSize);
      }
      if (ttlMillis != null) {
        cache = cache.withTtl(Duration.ofMillis(ttlMillis));
      }
      if (predictivePrefetch != null) {
        cache = cache.withPredictive(predictivePrefetch);
      }
      if (multiTier != null) {
        cache = cache.withMultiTier(multiTier);
      }
      if (frequencyThreshold != null) {
        cache = cache.withFrequencyThreshold(frequencyThreshold);
      }
      if (temporalThresholdMillis != null) {
        cache = cache.withTemporalThreshold(Duration.ofMillis(temporalThresholdMillis));
      }
      if (adaptiveCacheSize != null) {
        cache = cache.withAdaptiveSize(adaptiveCacheSize);
      }

      final Builder builder = builder().cache(cache);
      if (optimizationLevel != null) {
        builder.level(optimizationLevel);
      }
      if (runtimeOptimization != null) {
        builder.runtimeOptimization(runtimeOptimization);
      }
      if (optimizationIntervalMillis != null) {
        builder.interval(Duration.ofMillis(optimizationIntervalMillis));
      }
      if (maxMemoryUsage != null) {
        builder.maxMemoryUsage(maxMemoryUsage);
      }
      if (compactionThreshold != null) {
        builder.compactionThreshold(compactionThreshold);
      }
      if (samplingIntervalMillis != null) {
        builder.samplingInterval(Duration.ofMillis(samplingIntervalMillis));
      }
      if (compileLimit != null) {
        builder.compileLimit(compileLimit);
      }
      return builder.build();
    }
  }

  public static final class Builder {

    private TransitionCache.Options cache = TransitionCache.Options.defaults();
    private OptimizationLevel level = OptimizationLevel.STANDARD;
    private boolean runtimeOptimization = true;
    private Duration interval = DEFAULT_INTERVAL;
    private long maxMemoryUsage = 0;
    private double compactionThreshold = DEFAULT_COMPACTION_THRESHOLD;
    private Duration samplingInterval = DEFAULT_SAMPLING_INTERVAL;
    private int compileLimit = DEFAULT_COMPILE_LIMIT;

    private Builder() { }

    public Builder cache(TransitionCache.Options cache) {
      this.cache = cache;
      return this;
    }

    public Builder level(OptimizationLevel level) {
      this.level = level;
      return this;
    }

    public Builder runtimeOptimization(boolean runtimeOptimization) {
      this.runtimeOptimization = runtimeOptimization;
      return this;
    }

    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    public Builder maxMemoryUsage(long maxMemoryUsage) {
      this.maxMemoryUsage = maxMemoryUsage;
      return this;
    }

    public Builder compactionThreshold(double compactionThreshold) {
      this.compactionThreshold = compactionThreshold;
      return this;
    }

    public Builder samplingInterval(Duration samplingInterval) {
      this.samplingInterval = samplingInterval;
      return this;
    }

    public Builder compileLimit(int compileLimit) {
      this.compileLimit = compileLimit;
      return this;
    }

    public OptimizerConfig build() {
      return new OptimizerConfig(
        cache,
        level,
        runtimeOptimization,
        interval,
        maxMemoryUsage,
        compactionThreshold,
        samplingInterval,
        compileLimit
      );
    }
  }
}
