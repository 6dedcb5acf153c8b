package io.b2mash.tenantedge.credential;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Component;

/**
 * Rolling success rate and latency per credential record, reported by callers after each use.
 * Used to break cost ties under AUTO_RESOLVE.
 */
@Component
public class CredentialPerformanceTracker {

  // Weight of the newest sample in the moving averages
  private static final double ALPHA = 0.2;

  private final Map<String, PerformanceStats> stats = new ConcurrentHashMap<>();

  public void recordOutcome(String recordId, boolean success, long latencyMs) {
    stats.compute(
        recordId,
        (id, current) -> {
          double sample = success ? 1.0 : 0.0;
          if (current == null) {
            return new PerformanceStats(sample, latencyMs, 1);
          }
          return new PerformanceStats(
              current.successRate() + ALPHA * (sample - current.successRate()),
              current.averageLatencyMs() + ALPHA * (latencyMs - current.averageLatencyMs()),
              current.samples() + 1);
        });
  }

  /** Stats for a record; records without samples count as fully successful with no latency. */
  public PerformanceStats statsFor(String recordId) {
    return stats.getOrDefault(recordId, PerformanceStats.NONE);
  }

  public void forget(String recordId) {
    stats.remove(recordId);
  }

  public record PerformanceStats(double successRate, double averageLatencyMs, long samples) {

    static final PerformanceStats NONE = new PerformanceStats(1.0, 0.0, 0);
  }
}
