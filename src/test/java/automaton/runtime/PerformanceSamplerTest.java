package automaton.runtime;

import static org.junit.jupiter.api.Assertions.*;

import automaton.Machines;
import automaton.ManualClock;
import java.time.Duration;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

@DisplayName("PerformanceSampler")
class PerformanceSamplerTest {

  private static final PerformanceSampler.Metrics METRICS = new PerformanceSampler.Metrics(0.5, 4096, 4, 8);

  private final ManualClock clock = new ManualClock();

  @Test
  @DisplayName("Samples at most once per interval")
  void interval() {
    final var sampler = new PerformanceSampler(clock, Duration.ofSeconds(10));
    sampler.recordLatency(100);
    sampler.recordLatency(300);

    final var first = sampler.maybeSample(() -> METRICS);
    assertTrue(first.isPresent());
    assertEquals(200.0, first.get().averageLatencyNanos(), 1e-9);
    assertEquals(4096, first.get().memoryEstimate());

    clock.advance(Duration.ofSeconds(5));
    assertTrue(sampler.maybeSample(() -> METRICS).isEmpty());
    clock.advance(Duration.ofSeconds(5));
    final var second = sampler.maybeSample(() -> METRICS);
    assertTrue(second.isPresent());
    assertEquals(0.0, second.get().averageLatencyNanos(), 1e-9);

    final var summary = sampler.summary();
    assertEquals(2, summary.sampleCount());
    assertEquals(100.0, summary.averageLatencyNanos(), 1e-9);
    assertEquals(clock.instant(), summary.lastSampleTime());
  }

  @Test
  @DisplayName("Zero interval disables sampling")
  void disabled() {
    final var sampler = new PerformanceSampler(clock, Duration.ZERO);
    assertFalse(sampler.isEnabled());
    assertTrue(sampler.maybeSample(() -> fail("metrics computed while disabled")).isEmpty());
    assertNull(sampler.summary().lastSampleTime());
  }

  @Test
  @DisplayName("History is trimmed once it overflows")
  void retention() {
    final var sampler = new PerformanceSampler(clock, Duration.ofMillis(1));
    for (int i = 0; i <= PerformanceSampler.MAX_SAMPLES; i++) {
      sampler.maybeSample(() -> METRICS);
      clock.advance(Duration.ofMillis(1));
    }
    assertEquals(PerformanceSampler.RETAINED_SAMPLES, sampler.size());
    sampler.clear();
    assertEquals(0, sampler.size());
  }

  @Test
  @DisplayName("Memory estimate counts every structure")
  void memoryEstimate() {
    final long estimate = MemoryEstimator.estimate(Machines.fourStates(), 3, 2, 1);
    assertEquals(1000 + 4 * 200 + 8 * 100 + 3 * 150 + 2 * 300 + 100, estimate);
  }
}
