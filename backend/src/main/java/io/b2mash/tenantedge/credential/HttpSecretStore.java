package io.b2mash.tenantedge.credential;

import io.b2mash.tenantedge.upstream.Upstream;
import io.b2mash.tenantedge.upstream.UpstreamCalls;
import io.b2mash.tenantedge.upstream.UpstreamConnectionManager;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;

@Component
public class HttpSecretStore implements SecretStore {

  private final UpstreamConnectionManager connections;

  public HttpSecretStore(UpstreamConnectionManager connections) {
    this.connections = connections;
  }

  @Override
  public String store(String tenantId, String platformId, String plaintext) {
    var response =
        UpstreamCalls.call(
            Upstream.AUTH_SERVICE,
            () ->
                connections
                    .client(Upstream.AUTH_SERVICE)
                    .post()
                    .uri("/secrets")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(new StoreSecretRequest(tenantId, platformId, plaintext))
                    .retrieve()
                    .body(StoreSecretResponse.class));
    if (response == null || response.secretRef() == null || response.secretRef().isBlank()) {
      throw new IllegalStateException("Secret store returned no reference");
    }
    return response.secretRef();
  }

  @Override
  public void delete(String secretRef) {
    try {
      UpstreamCalls.run(
          Upstream.AUTH_SERVICE,
          () ->
              connections
                  .client(Upstream.AUTH_SERVICE)
                  .delete()
                  .uri("/secrets/{ref}", secretRef)
                  .retrieve()
                  .toBodilessEntity());
    } catch (HttpClientErrorException e) {
      if (!e.getStatusCode().isSameCodeAs(HttpStatus.NOT_FOUND)) {
        throw e;
      }
    }
  }

  record StoreSecretRequest(String tenantId, String platformId, String secret) {

    @Override
    public String toString() {
      return "StoreSecretRequest[tenantId=" + tenantId + ", platformId=" + platformId + "]";
    }
  }

  record StoreSecretResponse(String secretRef) {}
}
