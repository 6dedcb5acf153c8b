package io.b2mash.tenantedge.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.content;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import io.b2mash.tenantedge.upstream.Upstream;
import io.b2mash.tenantedge.upstream.UpstreamConnectionManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.RestClient;

class HttpSessionCheckClientTest {

  private MockRestServiceServer server;
  private HttpSessionCheckClient client;

  @BeforeEach
  void setUp() {
    var builder = RestClient.builder().baseUrl("http://auth.test");
    server = MockRestServiceServer.bindTo(builder).build();
    var connections = mock(UpstreamConnectionManager.class);
    when(connections.client(Upstream.AUTH_SERVICE)).thenReturn(builder.build());
    client = new HttpSessionCheckClient(connections);
  }

  @Test
  void validSession_isMapped() {
    server
        .expect(requestTo("http://auth.test/sessions/current"))
        .andExpect(method(HttpMethod.GET))
        .andExpect(header("Authorization", "Bearer access-1"))
        .andRespond(
            withSuccess(
                """
                {"valid":true,"userId":"u1","tenantId":"bizoholic","role":"admin",
                 "onboarded":true,"accessToken":"access-1","refreshToken":"refresh-1",
                 "expiresAt":"2026-06-01T00:00:00Z"}
                """,
                MediaType.APPLICATION_JSON));

    var session = client.currentSession("access-1").orElseThrow();

    assertThat(session.userId()).isEqualTo("u1");
    assertThat(session.tenantId()).isEqualTo("bizoholic");
    assertThat(session.onboarded()).isTrue();
    server.verify();
  }

  @Test
  void invalidFlag_isNoSession() {
    server
        .expect(requestTo("http://auth.test/sessions/current"))
        .andRespond(withSuccess("{\"valid\":false}", MediaType.APPLICATION_JSON));

    assertThat(client.currentSession("access-1")).isEmpty();
  }

  @Test
  void unauthorized_isNoSession() {
    server
        .expect(requestTo("http://auth.test/sessions/current"))
        .andRespond(withStatus(HttpStatus.UNAUTHORIZED));

    assertThat(client.currentSession("stale")).isEmpty();
  }

  @Test
  void serverError_propagates() {
    server.expect(requestTo("http://auth.test/sessions/current")).andRespond(withServerError());

    assertThatThrownBy(() -> client.currentSession("access-1"))
        .isInstanceOf(HttpServerErrorException.class);
  }

  @Test
  void refresh_postsRefreshToken() {
    server
        .expect(requestTo("http://auth.test/sessions/refresh"))
        .andExpect(method(HttpMethod.POST))
        .andExpect(content().json("{\"refreshToken\":\"refresh-1\"}"))
        .andRespond(
            withSuccess(
                "{\"valid\":true,\"userId\":\"u1\",\"tenantId\":\"bizoholic\","
                    + "\"onboarded\":false,\"accessToken\":\"access-2\"}",
                MediaType.APPLICATION_JSON));

    var session = client.refresh("refresh-1").orElseThrow();

    assertThat(session.accessToken()).isEqualTo("access-2");
    assertThat(session.onboarded()).isFalse();
    server.verify();
  }
}
