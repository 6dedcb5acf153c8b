package io.b2mash.tenantedge.oauth;

import io.b2mash.tenantedge.upstream.Upstream;
import io.b2mash.tenantedge.upstream.UpstreamCalls;
import io.b2mash.tenantedge.upstream.UpstreamConnectionManager;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

@Component
public class HttpTokenExchangeClient implements TokenExchangeClient {

  private final UpstreamConnectionManager connections;

  public HttpTokenExchangeClient(UpstreamConnectionManager connections) {
    this.connections = connections;
  }

  @Override
  public TokenExchangeResult exchange(TokenExchangeRequest request) {
    var result =
        UpstreamCalls.call(
            Upstream.AUTH_SERVICE,
            () ->
                connections
                    .client(Upstream.AUTH_SERVICE)
                    .post()
                    .uri("/oauth/token-exchange")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(TokenExchangeResult.class));
    if (result == null || result.credentialRef() == null || result.credentialRef().isBlank()) {
      throw new IllegalStateException("Token exchange returned no credential reference");
    }
    return result;
  }
}
