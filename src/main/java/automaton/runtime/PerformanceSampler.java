package automaton.runtime;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Periodic record of how a running machine performs.
 *
 * <p>Transition latencies are accumulated on every call; a sample averaging
 * them is taken at most once per sampling interval. At most
 * {@link #MAX_SAMPLES} samples are retained: when the limit is exceeded only the
 * newest {@link #RETAINED_SAMPLES} are kept.
 */
public final class PerformanceSampler {

  public static final int MAX_SAMPLES = 1000;
  public static final int RETAINED_SAMPLES = 500;

  /**
   * One sample.
   *
   * @param time when the sample was taken
   * @param averageLatencyNanos mean transition latency since the previous sample
   * @param cacheHitRatio cache hit ratio at sampling time
   * @param memoryEstimate estimated footprint, in bytes
   * @param stateCount states in the machine
   * @param transitionCount transitions in the machine
   */
  public record Sample(
    Instant time,
    double averageLatencyNanos,
    double cacheHitRatio,
    long memoryEstimate,
    int stateCount,
    int transitionCount
  ) { }

  /**
   * What a sample needs besides the latency.
   */
  public record Metrics(double cacheHitRatio, long memoryEstimate, int stateCount, int transitionCount) { }

  /**
   * Condensed view of the retained samples.
   *
   * @param sampleCount retained samples
   * @param averageLatencyNanos mean latency over the retained samples
   * @param lastSampleTime time of the newest sample, or {@code null}
   */
  public record Summary(int sampleCount, double averageLatencyNanos, Instant lastSampleTime) { }

  private final Clock clock;
  private final Duration interval;
  private final ArrayDeque<Sample> samples = new ArrayDeque<>();

  private final AtomicLong latencyNanos = new AtomicLong(0);
  private final AtomicLong latencyCount = new AtomicLong(0);

  /**
   * @param clock time source
   * @param interval minimum time between samples ({@link Duration#ZERO} disables sampling)
   */
  public PerformanceSampler(Clock clock, Duration interval) {
    this.clock = clock;
    this.interval = interval;
  }

  public boolean isEnabled() {
    return !interval.isZero() && !interval.isNegative();
  }

  /**
   * Account for one transition.
   *
   * @param nanos time the transition took
   */
  public void recordLatency(long nanos) {
    latencyNanos.addAndGet(nanos);
    latencyCount.incrementAndGet();
  }

  /**
   * Take a sample if the sampling interval has elapsed since the last one.
   *
   * @param metrics computes the rest of the sample (only called if sampling)
   * @return the new sample, if one was taken
   */
  public synchronized Optional<Sample> maybeSample(Supplier<Metrics> metrics) {
    if (!isEnabled()) {
      return Optional.empty();
    }
    final Instant now = clock.instant();
    final Sample last = samples.peekLast();
    if (last != null && Duration.between(last.time(), now).compareTo(interval) < 0) {
      return Optional.empty();
    }

    final long count = latencyCount.getAndSet(0);
    final long total = latencyNanos.getAndSet(0);
    final Metrics current = metrics.get();
    final var sample = new Sample(
      now,
      count == 0 ? 0.0 : (double) total / count,
      current.cacheHitRatio(),
      current.memoryEstimate(),
      current.stateCount(),
      current.transitionCount()
    );
    samples.addLast(sample);
    if (samples.size() > MAX_SAMPLES) {
      while (samples.size() > RETAINED_SAMPLES) {
        samples.removeFirst();
      }
    }
    return Optional.of(sample);
  }

  public synchronized int size() {
    return samples.size();
  }

  public synchronized List<Sample> samples() {
    return new ArrayList<>(samples);
  }

  public synchronized Summary summary() {
    double latency = 0.0;
    for (Sample sample : samples) {
      latency += sample.averageLatencyNanos();
    }
    final Sample last = samples.peekLast();
    return new Summary(
      samples.size(),
      samples.isEmpty() ? 0.0 : latency / samples.size(),
      last == null ? null : last.time()
    );
  }

  public synchronized void clear() {
    samples.clear();
  }
}
