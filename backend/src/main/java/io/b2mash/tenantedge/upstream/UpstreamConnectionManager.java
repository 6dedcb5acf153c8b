package io.b2mash.tenantedge.upstream;

import java.net.http.HttpClient;
import java.util.EnumMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.SmartLifecycle;
import org.springframework.http.client.JdkClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

/**
 * Owns the outbound HTTP clients for every upstream service. Clients are built once on {@link
 * #start()} and released on {@link #stop()}; consumers receive the manager by injection and ask
 * for a client per call.
 */
@Component
public class UpstreamConnectionManager implements SmartLifecycle {

  private static final Logger log = LoggerFactory.getLogger(UpstreamConnectionManager.class);

  private final UpstreamProperties properties;
  private final RestClient.Builder builder;
  private final Map<Upstream, RestClient> clients = new EnumMap<>(Upstream.class);

  private HttpClient httpClient;
  private volatile boolean running;

  public UpstreamConnectionManager(UpstreamProperties properties, RestClient.Builder builder) {
    this.properties = properties;
    this.builder = builder;
  }

  @Override
  public synchronized void start() {
    if (running) {
      return;
    }
    httpClient = HttpClient.newBuilder().connectTimeout(properties.connectTimeout()).build();
    var requestFactory = new JdkClientHttpRequestFactory(httpClient);
    requestFactory.setReadTimeout(properties.readTimeout());

    clients.put(
        Upstream.AUTH_SERVICE,
        builder
            .clone()
            .baseUrl(properties.authServiceUrl())
            .requestFactory(requestFactory)
            .build());
    clients.put(
        Upstream.BILLING_SERVICE,
        builder
            .clone()
            .baseUrl(properties.billingServiceUrl())
            .requestFactory(requestFactory)
            .build());
    running = true;
    log.info(
        "Upstream clients started: auth={}, billing={}, connectTimeout={}, readTimeout={}",
        properties.authServiceUrl(),
        properties.billingServiceUrl(),
        properties.connectTimeout(),
        properties.readTimeout());
  }

  @Override
  public synchronized void stop() {
    if (!running) {
      return;
    }
    running = false;
    clients.clear();
    httpClient = null;
    log.info("Upstream clients stopped");
  }

  @Override
  public boolean isRunning() {
    return running;
  }

  /** Returns the client for the given upstream. Throws if the manager has not been started. */
  public RestClient client(Upstream upstream) {
    if (!running) {
      throw new IllegalStateException("Upstream connections not started");
    }
    return clients.get(upstream);
  }
}
