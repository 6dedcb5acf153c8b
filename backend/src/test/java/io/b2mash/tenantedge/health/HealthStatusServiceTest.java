package io.b2mash.tenantedge.health;

import static io.b2mash.tenantedge.testutil.TestFixtures.credentialProperties;
import static io.b2mash.tenantedge.testutil.TestFixtures.platformRecord;
import static io.b2mash.tenantedge.testutil.TestFixtures.tenantRecord;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.b2mash.tenantedge.credential.CredentialRegistry;
import io.b2mash.tenantedge.credential.CredentialSource;
import io.b2mash.tenantedge.credential.CredentialStrategy;
import io.b2mash.tenantedge.credential.CredentialView;
import io.b2mash.tenantedge.credential.HealthStatus;
import io.b2mash.tenantedge.exception.ResourceNotFoundException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class HealthStatusServiceTest {

  private CredentialRegistry registry;
  private HealthStatusService service;

  @BeforeEach
  void setUp() {
    registry = new CredentialRegistry(credentialProperties(CredentialStrategy.HYBRID));
    service = new HealthStatusService(registry);
  }

  @Test
  void platformStatus_listsTenantAndPlatformCredentials() {
    registry.register(tenantRecord("t1", "7", "hubspot", HealthStatus.UNHEALTHY, 0L));
    registry.register(platformRecord("hubspot", HealthStatus.HEALTHY, 9000L, null));
    registry.register(tenantRecord("t2", "7", "google", HealthStatus.HEALTHY, 500L));

    var status = service.platformStatus("7", "hubspot");

    assertThat(status.platformId()).isEqualTo("hubspot");
    assertThat(status.totalCount()).isEqualTo(2);
    assertThat(status.healthyCount()).isEqualTo(1);
    assertThat(status.usable()).isTrue();
    assertThat(status.statuses())
        .extracting(CredentialView::source)
        .containsExactlyInAnyOrder(CredentialSource.TENANT, CredentialSource.PLATFORM);
  }

  @Test
  void platformStatus_withOnlyBrokenCredentials_isNotUsable() {
    registry.register(tenantRecord("t1", "7", "hubspot", HealthStatus.UNHEALTHY, 0L));

    var status = service.platformStatus("7", "hubspot");

    assertThat(status.usable()).isFalse();
    assertThat(status.healthyCount()).isZero();
  }

  @Test
  void platformStatus_ignoresOtherTenantsKeys() {
    registry.register(tenantRecord("t1", "bizoholic", "hubspot", HealthStatus.HEALTHY, 500L));

    assertThatThrownBy(() -> service.platformStatus("7", "hubspot"))
        .isInstanceOf(ResourceNotFoundException.class);
  }
}
