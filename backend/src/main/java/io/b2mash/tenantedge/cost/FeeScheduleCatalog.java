package io.b2mash.tenantedge.cost;

import io.b2mash.tenantedge.credential.CredentialStrategy;
import io.b2mash.tenantedge.exception.InvalidRequestException;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.springframework.stereotype.Component;

/** Fee schedule per credential strategy, as configured. */
@Component
public class FeeScheduleCatalog {

  private final Map<CredentialStrategy, FeeSchedule> schedules =
      new EnumMap<>(CredentialStrategy.class);

  public FeeScheduleCatalog(CostProperties properties) {
    schedules.putAll(properties.feeSchedules());
  }

  public FeeSchedule scheduleFor(CredentialStrategy strategy) {
    var schedule = schedules.get(strategy);
    if (schedule == null) {
      throw new InvalidRequestException(
          "strategy", "No fee schedule configured for strategy " + strategy);
    }
    return schedule;
  }

  public Map<CredentialStrategy, FeeSchedule> all() {
    return Collections.unmodifiableMap(schedules);
  }
}
