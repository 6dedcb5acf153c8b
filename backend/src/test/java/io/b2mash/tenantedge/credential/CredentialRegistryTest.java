package io.b2mash.tenantedge.credential;

import static io.b2mash.tenantedge.testutil.TestFixtures.credentialProperties;
import static io.b2mash.tenantedge.testutil.TestFixtures.platformRecord;
import static io.b2mash.tenantedge.testutil.TestFixtures.tenantRecord;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class CredentialRegistryTest {

  private CredentialRegistry registry;

  @BeforeEach
  void setUp() {
    registry = new CredentialRegistry(credentialProperties(CredentialStrategy.HYBRID));
  }

  @Test
  void replacingTenantRecord_returnsPreviousAndDropsIt() {
    registry.register(tenantRecord("t1", "7", "hubspot", HealthStatus.HEALTHY, 500L));

    var replaced =
        registry.replaceTenantRecord(
            tenantRecord("t2", "7", "hubspot", HealthStatus.UNKNOWN, null));

    assertThat(replaced).map(CredentialRecord::recordId).contains("t1");
    assertThat(registry.find("t1")).isEmpty();
    assertThat(registry.tenantRecord("7", "hubspot"))
        .map(CredentialRecord::recordId)
        .contains("t2");
  }

  @Test
  void otherTenantsAndPlatforms_areNotReplaced() {
    registry.register(tenantRecord("t1", "7", "hubspot", HealthStatus.HEALTHY, 500L));
    registry.register(tenantRecord("t2", "7", "google", HealthStatus.HEALTHY, 500L));
    registry.register(tenantRecord("t3", "bizoholic", "hubspot", HealthStatus.HEALTHY, 500L));

    assertThat(registry.all())
        .extracting(CredentialRecord::recordId)
        .containsExactlyInAnyOrder("t1", "t2", "t3");
  }

  @Test
  void removedTenantRecord_isNoLongerFound() {
    registry.register(tenantRecord("t1", "7", "hubspot", HealthStatus.HEALTHY, 500L));

    registry.remove("t1");

    assertThat(registry.tenantRecord("7", "hubspot")).isEmpty();
    var replaced =
        registry.replaceTenantRecord(
            tenantRecord("t2", "7", "hubspot", HealthStatus.UNKNOWN, null));
    assertThat(replaced).isEmpty();
  }

  @Test
  void platformRecord_cannotTakeTenantSlot() {
    var platform = platformRecord("hubspot", HealthStatus.HEALTHY, 100L, null);

    assertThatThrownBy(() -> registry.replaceTenantRecord(platform))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
