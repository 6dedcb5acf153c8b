package io.b2mash.tenantedge.health;

import io.b2mash.tenantedge.credential.CredentialView;
import io.b2mash.tenantedge.multitenancy.RequestScopes;
import java.util.List;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/credentials")
public class HealthController {

  private final HealthStatusService statusService;
  private final CredentialHealthMonitor monitor;
  private final HealthAlertService alertService;

  public HealthController(
      HealthStatusService statusService,
      CredentialHealthMonitor monitor,
      HealthAlertService alertService) {
    this.statusService = statusService;
    this.monitor = monitor;
    this.alertService = alertService;
  }

  @GetMapping("/health")
  public ResponseEntity<TenantHealthSummary> health() {
    var tenantId = RequestScopes.requireTenant().tenantId();
    return ResponseEntity.ok(statusService.summary(tenantId));
  }

  @GetMapping("/health/{platformId}")
  public ResponseEntity<PlatformHealthStatus> platformHealth(@PathVariable String platformId) {
    var tenantId = RequestScopes.requireTenant().tenantId();
    return ResponseEntity.ok(statusService.platformStatus(tenantId, platformId));
  }

  @PostMapping("/health/check")
  public ResponseEntity<List<CredentialView>> checkNow(
      @RequestParam(required = false) String platformId) {
    var tenantId = RequestScopes.requireTenant().tenantId();
    var checked =
        monitor.checkTenant(tenantId, platformId).stream().map(CredentialView::from).toList();
    return ResponseEntity.ok(checked);
  }

  @GetMapping("/alerts")
  public ResponseEntity<List<HealthAlert>> alerts(
      @RequestParam(defaultValue = "10") int limit) {
    var tenantId = RequestScopes.requireTenant().tenantId();
    return ResponseEntity.ok(alertService.recentAlerts(tenantId, limit));
  }

  @DeleteMapping("/alerts")
  public ResponseEntity<Void> clearAlerts() {
    alertService.clear(RequestScopes.requireTenant().tenantId());
    return ResponseEntity.noContent().build();
  }
}
