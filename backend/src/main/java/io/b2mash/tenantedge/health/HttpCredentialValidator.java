package io.b2mash.tenantedge.health;

import io.b2mash.tenantedge.credential.CredentialCheck;
import io.b2mash.tenantedge.credential.CredentialRecord;
import io.b2mash.tenantedge.upstream.Upstream;
import io.b2mash.tenantedge.upstream.UpstreamCalls;
import io.b2mash.tenantedge.upstream.UpstreamConnectionManager;
import java.time.Instant;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;

/** Validates through the auth/secret service, which holds the secret and calls the platform. */
@Component
public class HttpCredentialValidator implements CredentialValidator {

  private final UpstreamConnectionManager connections;

  public HttpCredentialValidator(UpstreamConnectionManager connections) {
    this.connections = connections;
  }

  @Override
  public CredentialCheck validate(CredentialRecord record) {
    ValidationResponse response;
    try {
      response =
          UpstreamCalls.call(
              Upstream.AUTH_SERVICE,
              () ->
                  connections
                      .client(Upstream.AUTH_SERVICE)
                      .post()
                      .uri("/credentials/{id}/validate", record.secretRef())
                      .contentType(MediaType.APPLICATION_JSON)
                      .body(new ValidationRequest(record.tenantId(), record.platformId()))
                      .retrieve()
                      .body(ValidationResponse.class));
    } catch (HttpClientErrorException e) {
      // 4xx: the service looked at the credential and refused it
      return CredentialCheck.failed("Rejected by auth service: " + e.getStatusCode().value());
    }
    if (response == null) {
      return CredentialCheck.failed("Empty validation response");
    }
    return new CredentialCheck(
        response.valid(),
        response.quotaRemaining(),
        response.expiresAt(),
        response.errorMessage(),
        false);
  }

  record ValidationRequest(String tenantId, String platformId) {}

  record ValidationResponse(
      boolean valid, Long quotaRemaining, Instant expiresAt, String errorMessage) {}
}
