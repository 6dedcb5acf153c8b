package io.b2mash.tenantedge.health;

import static io.b2mash.tenantedge.testutil.TestFixtures.tenantRecord;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import io.b2mash.tenantedge.credential.HealthStatus;
import io.b2mash.tenantedge.upstream.Upstream;
import io.b2mash.tenantedge.upstream.UpstreamConnectionManager;
import java.time.Instant;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestClient;

class HttpCredentialValidatorTest {

  private MockRestServiceServer server;
  private HttpCredentialValidator validator;

  @BeforeEach
  void setUp() {
    var builder = RestClient.builder().baseUrl("http://auth.test");
    server = MockRestServiceServer.bindTo(builder).build();
    var connections = mock(UpstreamConnectionManager.class);
    when(connections.client(Upstream.AUTH_SERVICE)).thenReturn(builder.build());
    validator = new HttpCredentialValidator(connections);
  }

  @Test
  void validResponse_isMapped() {
    server
        .expect(requestTo("http://auth.test/credentials/secret-t1/validate"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(content().json("{\"tenantId\":\"7\",\"platformId\":\"hubspot\"}"))
        .andRespond(
            withSuccess(
                "{\"valid\":true,\"quotaRemaining\":4200,\"expiresAt\":\"2026-06-01T00:00:00Z\"}",
                MediaType.APPLICATION_JSON));

    var check = validator.validate(tenantRecord("t1", "7", "hubspot", HealthStatus.UNKNOWN, null));

    assertThat(check.valid()).isTrue();
    assertThat(check.quotaRemaining()).isEqualTo(4200L);
    assertThat(check.expiresAt()).isEqualTo(Instant.parse("2026-06-01T00:00:00Z"));
    assertThat(check.degraded()).isFalse();
    server.verify();
  }

  @Test
  void clientError_isFailedCheck() {
    server
        .expect(requestTo("http://auth.test/credentials/secret-t1/validate"))
        .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    var check = validator.validate(tenantRecord("t1", "7", "hubspot", HealthStatus.UNKNOWN, null));

    assertThat(check.valid()).isFalse();
    assertThat(check.errorMessage()).isEqualTo("Rejected by auth service: 401");
  }
}
