package io.b2mash.tenantedge.credential;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * In-memory cache of credential records, shared by the resolution engine (reads) and the health
 * monitor (writes). Every write replaces one record atomically. A tenant holds at most one record
 * per platform; registering another one replaces it under the same lock.
 */
@Component
public class CredentialRegistry {

  private static final Logger log = LoggerFactory.getLogger(CredentialRegistry.class);

  // recordId -> record
  private final Map<String, CredentialRecord> records = new ConcurrentHashMap<>();

  // tenantId/platformId -> recordId of the tenant's own record
  private final ConcurrentHashMap<String, String> tenantRecordIds = new ConcurrentHashMap<>();

  public CredentialRegistry(CredentialProperties properties) {
    // Fail fast if two platform credentials are configured for the same platform
    for (var platform : properties.platform()) {
      var recordId = "platform-" + platform.platformId();
      var record =
          CredentialRecord.unchecked(
              recordId,
              null,
              platform.platformId(),
              CredentialSource.PLATFORM,
              CredentialStrategy.PLATFORM_MANAGED,
              platform.quota(),
              null,
              platform.capabilities(),
              platform.unitCost(),
              platform.secretRef(),
              null);
      if (records.putIfAbsent(recordId, record) != null) {
        throw new IllegalStateException(
            "Duplicate platform credential configured for " + platform.platformId());
      }
    }
    if (!records.isEmpty()) {
      log.info("Registered {} platform credentials", records.size());
    }
  }

  public static String newRecordId() {
    return UUID.randomUUID().toString();
  }

  public CredentialRecord register(CredentialRecord record) {
    if (record.source() == CredentialSource.TENANT) {
      replaceTenantRecord(record);
    } else {
      records.put(record.recordId(), record);
    }
    return record;
  }

  /**
   * Registers a tenant record and drops the tenant's previous record for the same platform in one
   * step. Concurrent registrations for the same tenant and platform are serialized.
   *
   * @return the record that was replaced, if any
   */
  public Optional<CredentialRecord> replaceTenantRecord(CredentialRecord record) {
    if (record.source() != CredentialSource.TENANT || record.tenantId() == null) {
      throw new IllegalArgumentException("Not a tenant credential: " + record.recordId());
    }
    var replaced = new AtomicReference<CredentialRecord>();
    tenantRecordIds.compute(
        tenantKey(record.tenantId(), record.platformId()),
        (key, previousId) -> {
          if (previousId != null && !previousId.equals(record.recordId())) {
            replaced.set(records.remove(previousId));
          }
          records.put(record.recordId(), record);
          return record.recordId();
        });
    return Optional.ofNullable(replaced.get());
  }

  public Optional<CredentialRecord> find(String recordId) {
    return Optional.ofNullable(records.get(recordId));
  }

  public Optional<CredentialRecord> remove(String recordId) {
    var removed = records.remove(recordId);
    if (removed != null && removed.source() == CredentialSource.TENANT) {
      tenantRecordIds.remove(tenantKey(removed.tenantId(), removed.platformId()), recordId);
    }
    return Optional.ofNullable(removed);
  }

  /** Atomically replaces a record. Empty if the record was removed meanwhile. */
  public Optional<CredentialRecord> update(
      String recordId, UnaryOperator<CredentialRecord> change) {
    return Optional.ofNullable(
        records.computeIfPresent(recordId, (id, current) -> change.apply(current)));
  }

  /** The tenant's own credential for a platform. A tenant holds at most one per platform. */
  public Optional<CredentialRecord> tenantRecord(String tenantId, String platformId) {
    return Optional.ofNullable(tenantRecordIds.get(tenantKey(tenantId, platformId)))
        .map(records::get);
  }

  public Optional<CredentialRecord> platformRecord(String platformId) {
    return records.values().stream()
        .filter(r -> r.source() == CredentialSource.PLATFORM)
        .filter(r -> platformId.equals(r.platformId()))
        .findFirst();
  }

  /** Records visible to a tenant: its own plus the platform's. */
  public List<CredentialRecord> visibleTo(String tenantId) {
    return records.values().stream()
        .filter(r -> r.source() == CredentialSource.PLATFORM || tenantId.equals(r.tenantId()))
        .sorted(
            Comparator.comparing(CredentialRecord::platformId)
                .thenComparing(CredentialRecord::source))
        .toList();
  }

  public List<CredentialRecord> ownedBy(String tenantId) {
    return records.values().stream()
        .filter(r -> tenantId.equals(r.tenantId()))
        .sorted(Comparator.comparing(CredentialRecord::platformId))
        .toList();
  }

  public Collection<CredentialRecord> all() {
    return List.copyOf(records.values());
  }

  private static String tenantKey(String tenantId, String platformId) {
    return tenantId + "/" + platformId;
  }
}
