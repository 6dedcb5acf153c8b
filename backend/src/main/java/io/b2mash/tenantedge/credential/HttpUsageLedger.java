package io.b2mash.tenantedge.credential;

import io.b2mash.tenantedge.upstream.Upstream;
import io.b2mash.tenantedge.upstream.UpstreamCalls;
import io.b2mash.tenantedge.upstream.UpstreamConnectionManager;
import java.time.Instant;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;

@Component
public class HttpUsageLedger implements UsageLedger {

  private final UpstreamConnectionManager connections;

  public HttpUsageLedger(UpstreamConnectionManager connections) {
    this.connections = connections;
  }

  @Override
  public void recordUsage(String tenantId, String platformId, String recordId, long units) {
    UpstreamCalls.run(
        Upstream.BILLING_SERVICE,
        () ->
            connections
                .client(Upstream.BILLING_SERVICE)
                .post()
                .uri("/usage")
                .contentType(MediaType.APPLICATION_JSON)
                .body(new UsageEntry(tenantId, platformId, recordId, units, Instant.now()))
                .retrieve()
                .toBodilessEntity());
  }

  record UsageEntry(
      String tenantId, String platformId, String recordId, long units, Instant recordedAt) {}
}
