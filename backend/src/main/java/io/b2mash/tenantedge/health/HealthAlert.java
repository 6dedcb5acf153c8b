package io.b2mash.tenantedge.health;

import java.time.Instant;
import java.util.List;

public record HealthAlert(
    String tenantId,
    String platformId,
    String recordId,
    List<String> reasons,
    double healthScore,
    Instant raisedAt) {

  public HealthAlert {
    reasons = reasons == null ? List.of() : List.copyOf(reasons);
  }
}
