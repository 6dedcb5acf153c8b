package io.b2mash.tenantedge.session;

import io.b2mash.tenantedge.upstream.Upstream;
import io.b2mash.tenantedge.upstream.UpstreamCalls;
import io.b2mash.tenantedge.upstream.UpstreamConnectionManager;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;

@Component
public class HttpSessionCheckClient implements SessionCheckClient {

  private final UpstreamConnectionManager connections;

  public HttpSessionCheckClient(UpstreamConnectionManager connections) {
    this.connections = connections;
  }

  @Override
  public Optional<Session> currentSession(String accessToken) {
    try {
      var response =
          UpstreamCalls.call(
              Upstream.AUTH_SERVICE,
              () ->
                  connections
                      .client(Upstream.AUTH_SERVICE)
                      .get()
                      .uri("/sessions/current")
                      .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                      .accept(MediaType.APPLICATION_JSON)
                      .retrieve()
                      .body(SessionResponse.class));
      return toSession(response);
    } catch (HttpClientErrorException e) {
      if (e.getStatusCode().isSameCodeAs(HttpStatus.UNAUTHORIZED)
          || e.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)) {
        return Optional.empty();
      }
      throw e;
    }
  }

  @Override
  public Optional<Session> refresh(String refreshToken) {
    try {
      var response =
          UpstreamCalls.call(
              Upstream.AUTH_SERVICE,
              () ->
                  connections
                      .client(Upstream.AUTH_SERVICE)
                      .post()
                      .uri("/sessions/refresh")
                      .contentType(MediaType.APPLICATION_JSON)
                      .body(Map.of("refreshToken", refreshToken))
                      .retrieve()
                      .body(SessionResponse.class));
      return toSession(response);
    } catch (HttpClientErrorException e) {
      if (e.getStatusCode().isSameCodeAs(HttpStatus.UNAUTHORIZED)
          || e.getStatusCode().isSameCodeAs(HttpStatus.BAD_REQUEST)) {
        return Optional.empty();
      }
      throw e;
    }
  }

  @Override
  public void revoke(String accessToken) {
    UpstreamCalls.run(
        Upstream.AUTH_SERVICE,
        () ->
            connections
                .client(Upstream.AUTH_SERVICE)
                .post()
                .uri("/sessions/revoke")
                .header(HttpHeaders.AUTHORIZATION, "Bearer " + accessToken)
                .retrieve()
                .toBodilessEntity());
  }

  private static Optional<Session> toSession(SessionResponse response) {
    if (response == null || !response.valid() || response.userId() == null) {
      return Optional.empty();
    }
    return Optional.of(
        new Session(
            response.userId(),
            response.tenantId(),
            response.role(),
            response.onboarded(),
            response.accessToken(),
            response.refreshToken(),
            response.expiresAt()));
  }

  record SessionResponse(
      boolean valid,
      String userId,
      String tenantId,
      String role,
      boolean onboarded,
      String accessToken,
      String refreshToken,
      Instant expiresAt) {}
}
