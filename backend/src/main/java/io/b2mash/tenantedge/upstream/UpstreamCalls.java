package io.b2mash.tenantedge.upstream;

import io.b2mash.tenantedge.exception.UpstreamTimeoutException;
import java.net.SocketTimeoutException;
import java.net.http.HttpTimeoutException;
import java.util.function.Supplier;
import org.springframework.web.client.ResourceAccessException;

/** Runs an outbound call, translating transport timeouts into {@link UpstreamTimeoutException}. */
public final class UpstreamCalls {

  private UpstreamCalls() {}

  public static <T> T call(Upstream upstream, Supplier<T> call) {
    try {
      return call.get();
    } catch (ResourceAccessException e) {
      if (isTimeout(e)) {
        throw new UpstreamTimeoutException(upstream.getDisplayName(), e);
      }
      throw e;
    }
  }

  public static void run(Upstream upstream, Runnable call) {
    call(
        upstream,
        () -> {
          call.run();
          return null;
        });
  }

  static boolean isTimeout(Throwable e) {
    for (Throwable t = e; t != null; t = t.getCause()) {
      if (t instanceof SocketTimeoutException || t instanceof HttpTimeoutException) {
        return true;
      }
    }
    return false;
  }
}
