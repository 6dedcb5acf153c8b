package io.b2mash.tenantedge.health;

import io.b2mash.tenantedge.credential.CredentialFailoverEvent;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Turns HYBRID failovers into tenant alerts. */
@Component
public class CredentialFailoverListener {

  private static final Logger log = LoggerFactory.getLogger(CredentialFailoverListener.class);

  private final HealthAlertService alertService;

  public CredentialFailoverListener(HealthAlertService alertService) {
    this.alertService = alertService;
  }

  @EventListener
  public void onFailover(CredentialFailoverEvent event) {
    try {
      alertService.raise(
          "failover:" + event.fromRecordId(),
          event.tenantId(),
          event.platformId(),
          List.of(
              "Calls to "
                  + event.platformId()
                  + " are using the platform credential: "
                  + event.reason()),
          0.0,
          event.occurredAt());
    } catch (Exception e) {
      // Never propagates into the call that triggered the failover
      log.warn(
          "Failed to raise failover alert for tenant {} on {}: {}",
          event.tenantId(),
          event.platformId(),
          e.getMessage());
    }
  }
}
