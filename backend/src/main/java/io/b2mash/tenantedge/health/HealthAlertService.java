package io.b2mash.tenantedge.health;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.b2mash.tenantedge.credential.CredentialRecord;
import io.b2mash.tenantedge.credential.CredentialSource;
import io.b2mash.tenantedge.credential.HealthStatus;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedDeque;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/** Raises tenant alerts for degrading credentials and keeps the most recent ones per tenant. */
@Service
public class HealthAlertService {

  private static final Logger log = LoggerFactory.getLogger(HealthAlertService.class);

  private final HealthProperties properties;

  // tenantId -> alerts, newest first
  private final Map<String, Deque<HealthAlert>> alerts = new ConcurrentHashMap<>();

  // alert key -> time of the last alert; entries expire with the cooldown
  private final Cache<String, Instant> cooldowns;

  public HealthAlertService(HealthProperties properties) {
    this.properties = properties;
    this.cooldowns =
        Caffeine.newBuilder()
            .expireAfterWrite(properties.alertCooldown())
            .maximumSize(100_000)
            .build();
  }

  /** Checks a freshly updated record against the alert conditions. */
  public void evaluate(CredentialRecord record, Instant now) {
    var reasons = alertReasons(record, now);
    if (reasons.isEmpty()) {
      return;
    }
    if (record.source() == CredentialSource.PLATFORM) {
      // Platform credentials belong to no tenant; operators watch the log
      if (cooldowns.asMap().putIfAbsent(record.recordId(), now) == null) {
        log.warn(
            "Platform credential degraded: platform={}, reasons={}", record.platformId(), reasons);
      }
      return;
    }
    raise(
        record.recordId(),
        record.tenantId(),
        record.platformId(),
        reasons,
        record.healthScore(),
        now);
  }

  /**
   * Records an alert unless one with the same key was raised within the cooldown.
   *
   * @return true if the alert was recorded
   */
  public boolean raise(
      String alertKey,
      String tenantId,
      String platformId,
      List<String> reasons,
      double healthScore,
      Instant now) {
    if (cooldowns.asMap().putIfAbsent(alertKey, now) != null) {
      return false;
    }
    var alert = new HealthAlert(tenantId, platformId, alertKey, reasons, healthScore, now);
    alerts.compute(
        tenantId,
        (id, deque) -> {
          var target = deque != null ? deque : new ConcurrentLinkedDeque<HealthAlert>();
          target.addFirst(alert);
          while (target.size() > properties.maxAlertsPerTenant()) {
            target.pollLast();
          }
          return target;
        });
    log.warn("Credential alert: tenant={}, platform={}, reasons={}", tenantId, platformId, reasons);
    return true;
  }

  public List<HealthAlert> recentAlerts(String tenantId, int limit) {
    var deque = alerts.get(tenantId);
    if (deque == null || limit <= 0) {
      return List.of();
    }
    return deque.stream().limit(limit).toList();
  }

  public void clear(String tenantId) {
    alerts.remove(tenantId);
  }

  List<String> alertReasons(CredentialRecord record, Instant now) {
    var reasons = new ArrayList<String>();
    var platform = record.platformId();
    if (record.healthStatus() == HealthStatus.UNHEALTHY) {
      reasons.add(
          "Platform "
              + platform
              + " is unhealthy: "
              + (record.lastError() != null ? record.lastError() : "Unknown error"));
    } else if (record.healthStatus() == HealthStatus.HEALTHY
        && record.healthScore() < properties.healthScoreThreshold()) {
      reasons.add(
          String.format(
              Locale.ROOT,
              "Platform %s health score dropped to %.2f",
              platform,
              record.healthScore()));
    }
    if (record.quotaRemaining() != null && record.quotaRemaining() < properties.quotaThreshold()) {
      reasons.add(
          "Platform "
              + platform
              + " quota critically low: "
              + record.quotaRemaining()
              + " remaining");
    }
    if (record.expiresAt() != null) {
      long days = Duration.between(now, record.expiresAt()).toDays();
      if (days <= properties.expiryWarningDays()) {
        reasons.add(
            "Platform " + platform + " credentials expire in " + Math.max(0, days) + " days");
      }
    }
    return reasons;
  }
}
